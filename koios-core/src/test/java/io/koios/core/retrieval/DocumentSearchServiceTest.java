package io.koios.core.retrieval;

import static org.assertj.core.api.Assertions.assertThat;

import io.koios.core.model.ConversationTurn;
import io.koios.core.provider.ScriptedLlmProvider;
import io.koios.core.query.QueryReformulator;
import io.koios.core.toon.ToonEncoder;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class DocumentSearchServiceTest {

    @Test
    void shouldEncodePassagesAsDocumentsTable() throws Exception {
        RecordingRetriever retriever = new RecordingRetriever(List.of(
            new RetrievedPassage("handbook.pdf", "Annual leave is 25 days"),
            new RetrievedPassage("faq.txt", "Leave requests go to HR")
        ));
        DocumentSearchService service = new DocumentSearchService(
            new QueryReformulator(new ScriptedLlmProvider().completions(), "llama3.2"),
            retriever,
            new ToonEncoder(),
            3
        );

        DocumentSearchService.Outcome outcome = service.search("How much leave do I get?", List.of());

        assertThat(outcome.query()).isEqualTo("How much leave do I get?");
        assertThat(outcome.passages()).isEqualTo(2);
        assertThat(outcome.context()).isEqualTo("""
            documents[2]{source,content}:
              handbook.pdf,Annual leave is 25 days
              faq.txt,Leave requests go to HR""");
        assertThat(retriever.requests).containsExactly("How much leave do I get?#3");
    }

    @Test
    void shouldSearchWithStandaloneQuestionAndReturnEmptyContextWhenNothingMatches() throws Exception {
        ScriptedLlmProvider llm = new ScriptedLlmProvider().reply("What does the handbook say about parental leave?");
        RecordingRetriever retriever = new RecordingRetriever(List.of());
        DocumentSearchService service = new DocumentSearchService(
            new QueryReformulator(llm.completions(), "llama3.2"),
            retriever,
            new ToonEncoder(),
            2
        );

        DocumentSearchService.Outcome outcome = service.search("and parental?", List.of(
            ConversationTurn.user("What does the handbook say about annual leave?"),
            ConversationTurn.assistant("25 days.")
        ));

        assertThat(outcome.context()).isEmpty();
        assertThat(outcome.passages()).isZero();
        assertThat(retriever.requests).containsExactly("What does the handbook say about parental leave?#2");
    }

    private static final class RecordingRetriever implements DocumentRetriever {
        private final List<RetrievedPassage> passages;
        private final List<String> requests = new ArrayList<>();

        RecordingRetriever(List<RetrievedPassage> passages) {
            this.passages = passages;
        }

        @Override
        public List<RetrievedPassage> retrieve(String query, int k) {
            requests.add(query + "#" + k);
            return passages;
        }
    }
}
