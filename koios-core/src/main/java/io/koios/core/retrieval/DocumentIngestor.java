package io.koios.core.retrieval;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a PDF or text file, splits it into chunks and stores them in the index
 * under the file name.
 */
public final class DocumentIngestor {
    private static final Logger LOG = LoggerFactory.getLogger(DocumentIngestor.class);

    private final SqliteDocumentIndex index;
    private final TextSplitter splitter;

    public DocumentIngestor(SqliteDocumentIndex index, TextSplitter splitter) {
        this.index = index;
        this.splitter = splitter;
    }

    public IngestResult ingest(Path file) throws IOException {
        if (file == null || !Files.isRegularFile(file)) {
            throw new IOException("Not a readable file: " + file);
        }
        String source = file.getFileName().toString();
        String text = readText(file);
        List<String> chunks = splitter.split(text);
        if (chunks.isEmpty()) {
            LOG.warn("No text extracted from {}", source);
            return new IngestResult(source, 0);
        }
        int stored = index.addChunks(source, chunks);
        return new IngestResult(source, stored);
    }

    String readText(Path file) throws IOException {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".pdf")) {
            try (PDDocument pdf = Loader.loadPDF(Files.readAllBytes(file))) {
                return new PDFTextStripper().getText(pdf);
            }
        }
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    public record IngestResult(String source, int chunks) {
    }
}
