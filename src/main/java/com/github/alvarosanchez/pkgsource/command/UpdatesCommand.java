package com.github.alvarosanchez.pkgsource.command;

import com.github.alvarosanchez.pkgsource.model.PackageIdentifier;
import com.github.alvarosanchez.pkgsource.model.PackageInfo;
import com.github.alvarosanchez.pkgsource.service.PackageQueryFacade;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Lists updates available for installed packages.
 */
@Command(name = "updates", description = "List updates for installed packages.", mixinStandardHelpOptions = true)
public class UpdatesCommand implements Callable<Integer> {

    private final PackageQueryFacade queryFacade;

    @Inject
    UpdatesCommand(PackageQueryFacade queryFacade) {
        this.queryFacade = queryFacade;
    }

    @Parameters(index = "0..*", arity = "1..*", paramLabel = "<id@version>", description = "Installed packages.")
    private List<String> installed;

    @Option(names = "--prerelease", description = "Consider pre-release versions.")
    private boolean includePrerelease;

    @Option(names = "--frameworks", defaultValue = "", description = "Comma separated target frameworks.")
    private String targetFrameworks;

    @Option(names = "--constraints", defaultValue = "", description = "Version constraints.")
    private String versionConstraints;

    @Mixin
    private SourceOverrideOption sourceOverride;

    /**
     * Prints one available update per line.
     *
     * @return command exit code
     */
    @Override
    public Integer call() {
        try {
            List<PackageIdentifier> installedPackages = new ArrayList<>();
            for (String value : installed) {
                installedPackages.add(PackageIdentifier.parse(value));
            }
            List<PackageInfo> updates = queryFacade.getUpdates(
                installedPackages,
                includePrerelease,
                targetFrameworks,
                versionConstraints
            );
            if (updates.isEmpty()) {
                Cli.success("All packages are up to date.");
                return 0;
            }
            for (PackageInfo update : updates) {
                Cli.print(PackageLines.describe(update));
            }
            return 0;
        } catch (RuntimeException e) {
            Cli.error(e.getMessage());
            return 1;
        }
    }
}
