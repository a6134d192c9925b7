package com.github.alvarosanchez.pkgsource.command;

import java.util.List;
import picocli.CommandLine.Option;

/**
 * Declares {@code -Source} on the query and {@code config show} subcommands so picocli accepts it. The locations
 * themselves are read from the raw invocation arguments when the active source is resolved.
 * <p>
 * The option belongs to the subcommand: {@code pkgsource search json -Source ./packages} parses, while
 * {@code pkgsource -Source ./packages search json} is rejected as an unknown root option.
 */
public class SourceOverrideOption {

    @Option(
        names = "-Source",
        arity = "0..*",
        paramLabel = "<location>",
        description = "Package source to query instead of the configured ones. May be repeated. Goes after the subcommand name."
    )
    List<String> locations;
}
