package io.koios.core.retrieval;

import java.io.IOException;
import java.util.List;

public interface DocumentRetriever {
    /**
     * Top {@code k} passages for the query, most relevant first. An empty list is a valid answer.
     */
    List<RetrievedPassage> retrieve(String query, int k) throws IOException;
}
