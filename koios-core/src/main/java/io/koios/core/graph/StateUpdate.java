package io.koios.core.graph;

import io.koios.core.query.RouteDecision;

/**
 * Partial state produced by one stage. Null fields are left unchanged.
 */
record StateUpdate(String context, String searchQuery, String generation, RouteDecision route) {

    static StateUpdate routed(RouteDecision route) {
        return new StateUpdate(null, null, null, route);
    }

    static StateUpdate retrieved(String searchQuery, String context) {
        return new StateUpdate(context, searchQuery, null, null);
    }

    static StateUpdate transformed(String searchQuery) {
        return new StateUpdate(null, searchQuery, null, null);
    }

    static StateUpdate withContext(String context) {
        return new StateUpdate(context, null, null, null);
    }

    static StateUpdate generated(String generation) {
        return new StateUpdate(null, null, generation, null);
    }
}
