package io.koios.cli;

import io.koios.core.config.model.KoiosConfig;
import io.koios.core.graph.GraphInput;
import io.koios.core.graph.GraphResult;
import io.koios.core.graph.GraphSettings;
import io.koios.core.model.ConversationTurn;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(
    name = "ask",
    description = "Ask a question through the routing and retrieval graph",
    exitCodeListHeading = "Exit codes:%n",
    exitCodeList = {"0:answered", "1:no answer produced", "2:answered but not saved to history"}
)
public final class AskCommand implements Callable<Integer> {
    static final int HISTORY_NOT_SAVED = 2;

    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Question to ask")
    String question;

    @Option(names = {"-m", "--model"}, description = "Model override")
    String model;

    @Option(names = {"-t", "--temperature"}, description = "Temperature override")
    Double temperature;

    @Option(names = {"--internet"}, negatable = true, description = "Allow or forbid web search for this question")
    Boolean internet;

    @Option(names = {"-u", "--user"}, description = "Load and save chat history for this user id")
    String user;

    @Option(names = {"-v", "--verbose"}, description = "Print route, search query and stage path")
    boolean verbose;

    public AskCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            KoiosConfig config = context.configService().load(context.configPath(), Map.copyOf(System.getenv()));
            GraphSettings settings = new GraphSettings(
                model != null ? model : config.agent().model(),
                temperature != null ? temperature : config.agent().temperature(),
                internet != null ? internet : config.webSearch().enableInternetSearch()
            );

            List<ConversationTurn> history = user == null ? List.of() : context.history().getHistory(user);
            GraphResult result = context.graphs().create(settings).invoke(GraphInput.of(question, history));

            if (verbose) {
                System.out.println("Route: " + (result.route() == null ? "-" : result.route().wireValue()));
                System.out.println("Search query: " + result.searchQuery());
                System.out.println("Path: " + result.path());
                System.out.println();
            }
            System.out.println(result.generation());

            if (user != null) {
                try {
                    context.history().addMessages(user, List.of(
                        ConversationTurn.user(question),
                        ConversationTurn.assistant(result.generation())
                    ));
                } catch (IOException e) {
                    System.err.println("Answer not saved to history: " + e.getMessage());
                    return HISTORY_NOT_SAVED;
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Ask command failed: " + e.getMessage());
            return 1;
        }
    }
}
