package io.koios.core.query;

import com.fasterxml.jackson.databind.JsonNode;
import io.koios.core.model.ConversationTurn;
import io.koios.core.prompt.Prompts;
import io.koios.core.provider.CompletionService;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites questions into retrieval queries. Both forms fall back to the
 * original question when the model returns nothing usable.
 */
public final class QueryReformulator {
    private static final Logger LOG = LoggerFactory.getLogger(QueryReformulator.class);

    private final CompletionService completions;
    private final String model;

    public QueryReformulator(CompletionService completions, String model) {
        this.completions = completions;
        this.model = model;
    }

    /**
     * Standalone form of {@code question} given the prior turns. Without history
     * the question is returned as is and no completion call is made.
     */
    public String standalone(String question, List<ConversationTurn> history) {
        if (history == null || history.isEmpty()) {
            return question;
        }
        String rewritten = completions.complete(model, Prompts.contextualize(question, history), 0.0).trim();
        if (rewritten.isEmpty()) {
            return question;
        }
        LOG.debug("Reformulated '{}' as '{}'", question, rewritten);
        return rewritten;
    }

    public String webQuery(String question) {
        JsonNode query = completions.completeJson(model, Prompts.webQuery(question)).get("query");
        if (query == null || !query.isTextual() || query.asText().isBlank()) {
            LOG.warn("Web query transform gave no usable query, searching for the question itself");
            return question;
        }
        return query.asText().trim();
    }
}
