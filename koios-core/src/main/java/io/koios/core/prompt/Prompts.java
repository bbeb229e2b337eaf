package io.koios.core.prompt;

import io.koios.core.model.ChatMessage;
import io.koios.core.model.ConversationTurn;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixed prompt texts for each stage of the decision graph.
 */
public final class Prompts {
    public static final String NO_CONTEXT_MARKER =
        "No additional context provided. Answer based on your internal knowledge.";

    static final String ROUTER = """
        You are an expert at routing a user question to the right knowledge source.
        Choose "doc_search" when the question is about the user's own uploaded documents,
        reports, specifications or any private material.
        Choose "web_search" when the question needs current events, recent releases or
        facts that change over time.
        Choose "generate" when the question is general knowledge you can answer directly.
        Return a JSON object with a single key "choice" whose value is one of
        "doc_search", "web_search" or "generate". Do not add any other keys or any prose.
        """;

    static final String WEB_QUERY = """
        You are an expert at crafting web search queries.
        Rewrite the user question into a short query that a search engine will answer well.
        Keep the important entities and drop filler words.
        Return a JSON object with a single key "query" whose value is the search query.
        Do not add any other keys or any prose.
        """;

    static final String CONTEXTUALIZE = """
        Given a chat history and the latest user question which might reference context \
        in the chat history, formulate a standalone question which can be understood \
        without the chat history. Do NOT answer the question, just reformulate it if \
        needed and otherwise return it as is.""";

    static final String GENERATE = """
        You are Koios, a research assistant. Answer the question using the context and the
        conversation so far. Prefer facts from the context when it is relevant and cite the
        source names it mentions. If the context does not help and you do not know the answer,
        say that you don't know. Keep the answer focused and well structured.

        Conversation so far:
        %s

        Context:
        %s

        Question:
        %s
        """;

    private Prompts() {
    }

    public static List<ChatMessage> router(String question) {
        return List.of(ChatMessage.system(ROUTER), ChatMessage.user(question));
    }

    public static List<ChatMessage> webQuery(String question) {
        return List.of(ChatMessage.system(WEB_QUERY), ChatMessage.user(question));
    }

    /**
     * System instruction, the prior turns as real chat messages, then the question.
     */
    public static List<ChatMessage> contextualize(String question, List<ConversationTurn> history) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(CONTEXTUALIZE));
        for (ConversationTurn turn : history) {
            messages.add(turn.toChatMessage());
        }
        messages.add(ChatMessage.user(question));
        return messages;
    }

    public static List<ChatMessage> generate(String question, String context, List<ConversationTurn> history) {
        String effectiveContext = context == null || context.isBlank() ? NO_CONTEXT_MARKER : context;
        String transcript = transcript(history);
        return List.of(ChatMessage.user(GENERATE.formatted(
            transcript.isEmpty() ? "(no previous messages)" : transcript,
            effectiveContext,
            question
        )));
    }

    public static String transcript(List<ConversationTurn> history) {
        if (history == null || history.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        for (ConversationTurn turn : history) {
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append(turn.role().wireValue()).append(": ").append(turn.content());
        }
        return out.toString();
    }
}
