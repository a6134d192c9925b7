package com.github.alvarosanchez.pkgsource;

import com.github.alvarosanchez.pkgsource.command.PkgSourceCommand;
import com.github.alvarosanchez.pkgsource.model.InvocationArguments;
import io.micronaut.configuration.picocli.MicronautFactory;
import io.micronaut.context.ApplicationContext;
import picocli.CommandLine;

public final class Application {

    private Application() {
    }

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    /**
     * Runs the CLI in a fresh application context that knows the invocation arguments.
     *
     * @param args command-line arguments
     * @return command exit code
     */
    public static int execute(String... args) {
        try (ApplicationContext context = ApplicationContext.builder()
            .singletons(InvocationArguments.of(args))
            .start()) {
            return new CommandLine(PkgSourceCommand.class, new MicronautFactory(context))
                .setOptionsCaseInsensitive(true)
                .setUsageHelpAutoWidth(true)
                .execute(args);
        }
    }
}
