package com.github.alvarosanchez.pkgsource.command;

import com.github.alvarosanchez.pkgsource.config.ConfigLocation;
import com.github.alvarosanchez.pkgsource.model.Configuration;
import com.github.alvarosanchez.pkgsource.model.PackageSourceDescriptor;
import com.github.alvarosanchez.pkgsource.model.ResolvedSource;
import com.github.alvarosanchez.pkgsource.service.ConfigRelocator;
import com.github.alvarosanchez.pkgsource.service.SourceResolver;
import jakarta.inject.Inject;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Command group for the configuration file.
 */
@Command(
    name = "config",
    description = "Inspect and relocate the configuration file.",
    mixinStandardHelpOptions = true,
    subcommands = {
        ConfigCommand.ShowCommand.class,
        ConfigCommand.MoveCommand.class
    }
)
public class ConfigCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    /**
     * Prints config command usage when no subcommand is provided.
     */
    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    @Command(name = "show", description = "Show the loaded configuration and the active package source.")
    static class ShowCommand implements Callable<Integer> {

        private final SourceResolver sourceResolver;

        @Inject
        ShowCommand(SourceResolver sourceResolver) {
            this.sourceResolver = sourceResolver;
        }

        @Mixin
        private SourceOverrideOption sourceOverride;

        /**
         * Prints configuration settings and the resolved source.
         *
         * @return command exit code
         */
        @Override
        public Integer call() {
            try {
                Configuration configuration = sourceResolver.configuration();
                ResolvedSource resolvedSource = sourceResolver.resolvedSource();

                Cli.print(Cli.heading("Configuration file: ") + configuration.getStoragePath());
                Cli.print("verbose: " + configuration.isVerbose());
                Cli.print("installFromCache: " + configuration.isInstallFromCache());
                Cli.print("repositoryPath: " + configuration.getRepositoryPath());
                Cli.print("requestTimeoutSeconds: " + configuration.getRequestTimeoutSeconds());
                Cli.print("readOnlyPackageFiles: " + configuration.isReadOnlyPackageFiles());
                Cli.print(Cli.heading("Active source (" + resolvedSource.kind() + "):"));
                for (PackageSourceDescriptor descriptor : resolvedSource.descriptors()) {
                    Cli.print("  " + descriptor.name() + " -> " + descriptor.location());
                }
                return 0;
            } catch (RuntimeException e) {
                Cli.error(e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "move", description = "Move the configuration file to another directory.")
    static class MoveCommand implements Callable<Integer> {

        private final ConfigRelocator configRelocator;
        private final ConfigLocation configLocation;

        @Inject
        MoveCommand(ConfigRelocator configRelocator, ConfigLocation configLocation) {
            this.configRelocator = configRelocator;
            this.configLocation = configLocation;
        }

        @Parameters(index = "0", description = "Target directory relative to the project root.")
        private String directory;

        /**
         * Moves the configuration file.
         *
         * @return command exit code
         */
        @Override
        public Integer call() {
            try {
                if (!configRelocator.move(directory)) {
                    Cli.error("Could not move the configuration file to `" + directory + "`. It stays at " + configLocation.fullPath());
                    return 1;
                }
                Cli.success("Configuration file is now at " + configLocation.fullPath());
                return 0;
            } catch (RuntimeException e) {
                Cli.error(e.getMessage());
                return 1;
            }
        }
    }
}
