package io.koios.core.retrieval;

import java.io.IOException;
import java.util.List;

public interface EmbeddingClient {
    List<double[]> embed(List<String> texts) throws IOException;
}
