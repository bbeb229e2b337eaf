package io.koios.core.graph;

import io.koios.core.model.ConversationTurn;
import io.koios.core.prompt.Prompts;
import io.koios.core.provider.CompletionService;
import java.util.List;

public final class AnswerGenerator {
    private final CompletionService completions;
    private final String model;
    private final double temperature;

    public AnswerGenerator(CompletionService completions, String model, double temperature) {
        this.completions = completions;
        this.model = model;
        this.temperature = temperature;
    }

    public String generate(String question, String context, List<ConversationTurn> history) {
        return completions.complete(model, Prompts.generate(question, context, history), temperature);
    }
}
