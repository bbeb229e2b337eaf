package io.koios.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(
    name = "koios",
    mixinStandardHelpOptions = true,
    version = "koios 0.1.0",
    description = "Ask questions over your documents and the web, from the terminal or over HTTP"
)
public final class KoiosCliCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }
}
