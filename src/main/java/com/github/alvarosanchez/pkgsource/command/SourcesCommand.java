package com.github.alvarosanchez.pkgsource.command;

import com.github.alvarosanchez.pkgsource.model.Configuration;
import com.github.alvarosanchez.pkgsource.model.PackageSourceCredentials;
import com.github.alvarosanchez.pkgsource.model.PackageSourceDescriptor;
import com.github.alvarosanchez.pkgsource.service.SourceResolver;
import jakarta.inject.Inject;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Command group for the package sources stored in the configuration file.
 */
@Command(
    name = "sources",
    description = "Manage configured package sources.",
    mixinStandardHelpOptions = true,
    subcommands = {
        SourcesCommand.ListCommand.class,
        SourcesCommand.AddCommand.class,
        SourcesCommand.RemoveCommand.class,
        SourcesCommand.UseCommand.class
    }
)
public class SourcesCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    /**
     * Prints sources command usage when no subcommand is provided.
     */
    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    @Command(name = "list", description = "List configured package sources.")
    static class ListCommand implements Callable<Integer> {

        private final SourceResolver sourceResolver;

        @Inject
        ListCommand(SourceResolver sourceResolver) {
            this.sourceResolver = sourceResolver;
        }

        /**
         * Prints one source per line; {@code *} marks the designated active source.
         *
         * @return command exit code
         */
        @Override
        public Integer call() {
            try {
                Configuration configuration = sourceResolver.configuration();
                if (configuration.getSources().isEmpty()) {
                    Cli.warning("No package sources configured. Add one with `pkgsource sources add`.");
                    return 0;
                }
                String active = configuration.getActiveSourceName().orElse(null);
                for (PackageSourceDescriptor source : configuration.getSources()) {
                    String marker = source.name().equals(active) ? "* " : "  ";
                    String state = source.enabled() ? "" : " (disabled)";
                    Cli.print(marker + source.name() + " -> " + source.location() + state);
                }
                return 0;
            } catch (RuntimeException e) {
                Cli.error(e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "add", description = "Add a package source.")
    static class AddCommand implements Callable<Integer> {

        private final SourceResolver sourceResolver;

        @Inject
        AddCommand(SourceResolver sourceResolver) {
            this.sourceResolver = sourceResolver;
        }

        @Parameters(index = "0", description = "Source name.")
        private String name;

        @Parameters(index = "1", description = "Source URL or directory.")
        private String location;

        @Option(names = "--username", description = "User name for authenticated sources.")
        private String username;

        @Option(names = "--password", description = "Password or API key for authenticated sources.")
        private String password;

        @Option(names = "--disabled", description = "Add the source without enabling it.")
        private boolean disabled;

        /**
         * Adds the source and saves the configuration.
         *
         * @return command exit code
         */
        @Override
        public Integer call() {
            try {
                PackageSourceCredentials credentials = username == null && password == null
                    ? null
                    : new PackageSourceCredentials(username, password);
                sourceResolver.configuration().addSource(new PackageSourceDescriptor(name, location, credentials, !disabled));
                sourceResolver.saveConfiguration();
                Cli.success("Added package source `" + name + "`.");
                return 0;
            } catch (RuntimeException e) {
                Cli.error(e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "remove", description = "Remove a package source.")
    static class RemoveCommand implements Callable<Integer> {

        private final SourceResolver sourceResolver;

        @Inject
        RemoveCommand(SourceResolver sourceResolver) {
            this.sourceResolver = sourceResolver;
        }

        @Parameters(index = "0", description = "Source name.")
        private String name;

        /**
         * Removes the source and saves the configuration.
         *
         * @return command exit code
         */
        @Override
        public Integer call() {
            try {
                if (!sourceResolver.configuration().removeSource(name)) {
                    throw new IllegalStateException("Package source `" + name + "` is not configured.");
                }
                sourceResolver.saveConfiguration();
                Cli.success("Removed package source `" + name + "`.");
                return 0;
            } catch (RuntimeException e) {
                Cli.error(e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "use", description = "Designate the active package source.")
    static class UseCommand implements Callable<Integer> {

        private final SourceResolver sourceResolver;

        @Inject
        UseCommand(SourceResolver sourceResolver) {
            this.sourceResolver = sourceResolver;
        }

        @Parameters(index = "0", arity = "0..1", description = "Source name. Omit to query all enabled sources.")
        private String name;

        /**
         * Designates the source and saves the configuration.
         *
         * @return command exit code
         */
        @Override
        public Integer call() {
            try {
                sourceResolver.configuration().setActiveSourceName(name);
                sourceResolver.saveConfiguration();
                if (name == null) {
                    Cli.success("Querying all enabled package sources.");
                } else {
                    Cli.success("Active package source is now `" + name + "`.");
                }
                return 0;
            } catch (RuntimeException e) {
                Cli.error(e.getMessage());
                return 1;
            }
        }
    }
}
