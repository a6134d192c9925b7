package com.github.alvarosanchez.pkgsource.command;

import com.github.alvarosanchez.pkgsource.model.PackageInfo;
import com.github.alvarosanchez.pkgsource.service.PackageQueryFacade;
import com.github.alvarosanchez.pkgsource.source.CancellationToken;
import jakarta.inject.Inject;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Searches packages in the active sources.
 */
@Command(name = "search", description = "Search packages in the active package sources.", mixinStandardHelpOptions = true)
public class SearchCommand implements Callable<Integer> {

    private final PackageQueryFacade queryFacade;

    @Inject
    SearchCommand(PackageQueryFacade queryFacade) {
        this.queryFacade = queryFacade;
    }

    @Parameters(index = "0", arity = "0..1", defaultValue = "", description = "Search term. Lists every package when omitted.")
    private String searchTerm;

    @Option(names = "--prerelease", description = "Include pre-release versions.")
    private boolean includePrerelease;

    @Option(names = "--take", defaultValue = "15", description = "Maximum number of packages to show (default: ${DEFAULT-VALUE}).")
    private int take;

    @Option(names = "--skip", defaultValue = "0", description = "Number of packages to skip (default: ${DEFAULT-VALUE}).")
    private int skip;

    @Mixin
    private SourceOverrideOption sourceOverride;

    /**
     * Runs the search and prints one package per line.
     *
     * @return command exit code
     */
    @Override
    public Integer call() {
        try {
            if (take <= 0) {
                throw new IllegalArgumentException("--take must be positive.");
            }
            if (skip < 0) {
                throw new IllegalArgumentException("--skip must not be negative.");
            }
            List<PackageInfo> packages = queryFacade
                .searchAsync(searchTerm, includePrerelease, take, skip, CancellationToken.NONE)
                .join();
            if (packages.isEmpty()) {
                Cli.warning("No packages found.");
                return 0;
            }
            for (PackageInfo info : packages) {
                Cli.print(PackageLines.describe(info));
            }
            return 0;
        } catch (CompletionException e) {
            Cli.error(e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return 1;
        } catch (RuntimeException e) {
            Cli.error(e.getMessage());
            return 1;
        }
    }
}
