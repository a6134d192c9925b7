package com.github.alvarosanchez.pkgsource.command;

import com.github.alvarosanchez.pkgsource.model.PackageIdentifier;
import com.github.alvarosanchez.pkgsource.model.PackageInfo;
import com.github.alvarosanchez.pkgsource.service.PackageQueryFacade;
import jakarta.inject.Inject;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

/**
 * Shows one package from the active sources.
 */
@Command(name = "info", description = "Show a specific package.", mixinStandardHelpOptions = true)
public class InfoCommand implements Callable<Integer> {

    private final PackageQueryFacade queryFacade;

    @Inject
    InfoCommand(PackageQueryFacade queryFacade) {
        this.queryFacade = queryFacade;
    }

    @Parameters(index = "0", paramLabel = "<id[@version]>", description = "Package id, optionally with an exact version.")
    private String identifier;

    @Mixin
    private SourceOverrideOption sourceOverride;

    /**
     * Prints the package, or a warning when no active source has it.
     *
     * @return command exit code
     */
    @Override
    public Integer call() {
        try {
            PackageIdentifier packageIdentifier = PackageIdentifier.parse(identifier);
            Optional<PackageInfo> found = queryFacade.getSpecificPackage(packageIdentifier);
            if (found.isEmpty()) {
                Cli.warning("Package `" + packageIdentifier + "` was not found.");
                return 0;
            }
            Cli.print(PackageLines.describe(found.get()));
            return 0;
        } catch (RuntimeException e) {
            Cli.error(e.getMessage());
            return 1;
        }
    }
}
