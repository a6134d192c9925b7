package com.github.alvarosanchez.pkgsource.model;

import java.util.Arrays;
import java.util.List;

/**
 * Arguments the process was started with.
 *
 * @param values raw argument tokens in order
 */
public record InvocationArguments(List<String> values) {

    /**
     * Creates invocation arguments.
     *
     * @param values raw argument tokens
     */
    public InvocationArguments {
        values = values == null ? List.of() : List.copyOf(values);
    }

    /**
     * Wraps the arguments passed to {@code main}.
     *
     * @param args raw argument tokens
     * @return invocation arguments
     */
    public static InvocationArguments of(String... args) {
        return new InvocationArguments(args == null ? List.of() : Arrays.asList(args));
    }

    /**
     * Returns arguments for a process started without any.
     *
     * @return empty invocation arguments
     */
    public static InvocationArguments none() {
        return new InvocationArguments(List.of());
    }
}
