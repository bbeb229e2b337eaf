package io.koios.cli;

import io.koios.core.model.ConversationTurn;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "history", description = "Show, clear or list persisted chat history")
public final class HistoryCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "0..1", description = "User id")
    String user;

    @Option(names = "--clear", description = "Delete the user's history")
    boolean clear;

    @Option(names = "--users", description = "List users that have history")
    boolean users;

    public HistoryCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (users) {
                for (String id : context.history().listUsers()) {
                    System.out.println(id + " (" + context.history().messageCount(id) + " messages)");
                }
                return 0;
            }
            if (user == null || user.isBlank()) {
                System.err.println("History command failed: user id is required");
                return 1;
            }
            if (clear) {
                int deleted = context.history().clearHistory(user);
                System.out.println("Deleted " + deleted + " messages for " + user);
                return 0;
            }

            List<ConversationTurn> turns = context.history().getHistory(user);
            if (turns.isEmpty()) {
                System.out.println("No history for " + user);
                return 0;
            }
            for (ConversationTurn turn : turns) {
                System.out.println(turn.role().wireValue() + ": " + turn.content());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("History command failed: " + e.getMessage());
            return 1;
        }
    }
}
