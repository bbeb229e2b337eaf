package io.koios.core.provider;

import io.koios.core.model.ChatMessage;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class FallbackLlmProvider implements LlmProvider {
    private static final Logger LOG = LoggerFactory.getLogger(FallbackLlmProvider.class);
    private final String name;
    private final List<LlmProvider> chain;

    public FallbackLlmProvider(String name, List<LlmProvider> chain) {
        this.name = name;
        this.chain = List.copyOf(chain);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(String model, List<ChatMessage> messages, CompletionOptions options) {
        LlmResponse last = LlmResponse.error("no providers in fallback chain " + name);
        for (LlmProvider provider : chain) {
            last = provider.chat(model, messages, options);
            if (!last.failed()) {
                LOG.debug("Provider {} served {} request for chain {}", provider.name(), options.responseFormat(), name);
                return last;
            }
            LOG.warn("Provider {} failed in chain {}: {}", provider.name(), name, truncate(last.content(), 300));
        }
        return last;
    }

    private String truncate(String value, int max) {
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }
}
