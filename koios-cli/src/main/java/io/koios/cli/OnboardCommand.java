package io.koios.cli;

import io.koios.core.config.OnboardResult;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "onboard", description = "Write the Koios config file and prepare the data directory")
public final class OnboardCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Replace an existing config with the defaults")
    boolean overwrite;

    public OnboardCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            OnboardResult result = context.configService().onboard(context.configPath(), overwrite);
            String action = result.createdConfig()
                ? "Created"
                : result.overwrittenConfig() ? "Reset to defaults" : "Merged new defaults into";
            System.out.println(action + " config: " + result.configPath());
            System.out.println("Data directory: " + result.dataPath());
            System.out.println("Chat history database: " + result.historyDbPath());
            System.out.println("Document index: " + result.documentsDbPath());
            System.out.println("Next: koios ingest <file> to index documents, then koios ask \"<question>\"");
            return 0;
        } catch (Exception e) {
            System.err.println("Onboard command failed: " + e.getMessage());
            return 1;
        }
    }
}
