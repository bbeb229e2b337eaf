package io.koios.core.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.koios.core.prompt.Prompts;
import io.koios.core.provider.CompletionService;
import io.koios.core.provider.StructuredOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies a question into one of the three retrieval strategies. Unusable
 * model output falls back to document search; completion failures propagate.
 */
public final class QueryRouter {
    private static final Logger LOG = LoggerFactory.getLogger(QueryRouter.class);
    public static final RouteDecision DEFAULT = RouteDecision.DOC_SEARCH;

    private final CompletionService completions;
    private final String model;

    public QueryRouter(CompletionService completions, String model) {
        this.completions = completions;
        this.model = model;
    }

    public RouteDecision route(String question) {
        ObjectNode output = completions.completeJson(model, Prompts.router(question));
        if (StructuredOutput.isError(output)) {
            LOG.warn("Router output was not JSON ({}), defaulting to {}", output.path("error").asText(), DEFAULT.wireValue());
            return DEFAULT;
        }

        JsonNode choice = output.get("choice");
        if (choice == null || !choice.isTextual()) {
            LOG.warn("Router output has no usable 'choice' field, defaulting to {}", DEFAULT.wireValue());
            return DEFAULT;
        }

        return RouteDecision.fromWire(choice.asText()).orElseGet(() -> {
            LOG.warn("Router returned unknown choice '{}', defaulting to {}", choice.asText(), DEFAULT.wireValue());
            return DEFAULT;
        });
    }
}
