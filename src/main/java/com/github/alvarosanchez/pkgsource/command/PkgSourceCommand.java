package com.github.alvarosanchez.pkgsource.command;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root Picocli command for the pkgsource CLI.
 */
@Command(
    name = "pkgsource",
    description = "Resolves and queries package sources.",
    mixinStandardHelpOptions = true,
    versionProvider = PkgSourceVersionProvider.class,
    subcommands = {
        CommandLine.HelpCommand.class,
        SearchCommand.class,
        UpdatesCommand.class,
        InfoCommand.class,
        ConfigCommand.class,
        SourcesCommand.class
    }
)
public class PkgSourceCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    /**
     * Prints root command usage when no subcommand is provided.
     */
    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }
}
