package io.koios.cli;

import io.koios.core.retrieval.DocumentIngestor;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "ingest", description = "Add PDF or text files to the document index")
public final class IngestCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(arity = "1..*", description = "Files to ingest")
    List<Path> files;

    public IngestCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            int total = 0;
            for (Path file : files) {
                DocumentIngestor.IngestResult result = context.ingestor().ingest(file);
                System.out.println("Indexed " + result.source() + ": " + result.chunks() + " chunks");
                total += result.chunks();
            }
            System.out.println("Total chunks indexed: " + total);
            return 0;
        } catch (Exception e) {
            System.err.println("Ingest command failed: " + e.getMessage());
            return 1;
        }
    }
}
