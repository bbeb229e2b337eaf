package io.koios.cli;

import io.koios.core.config.model.KoiosConfig;
import java.nio.file.Files;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show runtime and configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            KoiosConfig config = context.configService().load(context.configPath(), Map.copyOf(System.getenv()));
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Default model: " + config.agent().model());
            System.out.println("Default temperature: " + config.agent().temperature());
            System.out.println("Local endpoint: " + config.providers().local().apiBase());
            System.out.println("OpenAI configured: " + config.providers().openai().configured());
            System.out.println("Anthropic configured: " + config.providers().anthropic().configured());
            System.out.println("Internet search enabled: " + config.webSearch().enableInternetSearch());
            System.out.println("Web search provider: " + config.webSearch().provider());
            System.out.println("History backend: " + config.history().backend()
                + " (max " + config.history().maxMessagesPerUser() + " messages per user)");
            System.out.println("Indexed sources: " + context.documents().listSources().size());
            System.out.println("Indexed chunks: " + context.documents().chunkCount());
            System.out.println("Users with history: " + context.history().listUsers().size());
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
