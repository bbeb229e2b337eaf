package io.koios.core.provider;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.koios.core.model.ChatMessage;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Front door for the decision graph. Resolves the provider for a model and
 * turns the provider error convention into {@link CompletionException}.
 */
public final class CompletionService {
    private static final Logger LOG = LoggerFactory.getLogger(CompletionService.class);

    private final ProviderRouter providerRouter;
    private final String preferredProvider;

    public CompletionService(ProviderRouter providerRouter) {
        this(providerRouter, null);
    }

    public CompletionService(ProviderRouter providerRouter, String preferredProvider) {
        this.providerRouter = providerRouter;
        this.preferredProvider = preferredProvider;
    }

    public String complete(String model, List<ChatMessage> messages, double temperature) {
        return call(model, messages, CompletionOptions.text(temperature));
    }

    /**
     * Runs a JSON-constrained completion. The result is always an object;
     * unparseable output comes back as {@code {"error": ..., "raw": ...}}.
     */
    public ObjectNode completeJson(String model, List<ChatMessage> messages) {
        return StructuredOutput.parse(call(model, messages, CompletionOptions.json()));
    }

    private String call(String model, List<ChatMessage> messages, CompletionOptions options) {
        LlmProvider provider = resolve(model);
        LOG.debug("Calling provider {} model {} format {}", provider.name(), model, options.responseFormat());
        LlmResponse response = provider.chat(model, messages, options);
        if (response.failed()) {
            throw new CompletionException(provider.name(), response.content());
        }
        return response.content();
    }

    private LlmProvider resolve(String model) {
        try {
            return providerRouter.resolve(preferredProvider, model);
        } catch (IllegalArgumentException e) {
            throw new CompletionException(preferredProvider == null ? "unresolved" : preferredProvider, e.getMessage());
        }
    }
}
