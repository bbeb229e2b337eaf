package io.koios.cli;

import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "documents", description = "List or clear indexed documents")
public final class DocumentsCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--clear", description = "Remove every indexed document")
    boolean clear;

    public DocumentsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (clear) {
                int deleted = context.documents().clear();
                System.out.println("Removed " + deleted + " chunks");
                return 0;
            }
            List<String> sources = context.documents().listSources();
            if (sources.isEmpty()) {
                System.out.println("No documents indexed");
                return 0;
            }
            sources.forEach(System.out::println);
            return 0;
        } catch (Exception e) {
            System.err.println("Documents command failed: " + e.getMessage());
            return 1;
        }
    }
}
