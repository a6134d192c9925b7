package com.github.alvarosanchez.pkgsource.command;

import picocli.CommandLine.Help.Ansi;

/**
 * Shared CLI output helpers.
 */
public final class Cli {

    private Cli() {
    }

    /**
     * Prints raw text to standard output.
     *
     * @param message message to print
     */
    public static void print(String message) {
        System.out.println(message);
    }

    /**
     * Prints an informational message.
     *
     * @param message message to print
     */
    public static void info(String message) {
        System.out.println(style("blue", message));
    }

    /**
     * Prints a success message.
     *
     * @param message message to print
     */
    public static void success(String message) {
        System.out.println(style("green", message));
    }

    /**
     * Prints a warning message.
     *
     * @param message message to print
     */
    public static void warning(String message) {
        System.out.println(style("yellow", message));
    }

    /**
     * Prints an error message to standard error.
     *
     * @param message message to print
     */
    public static void error(String message) {
        System.err.println(style("red", "Error:") + " " + message);
    }

    /**
     * Styles text as a heading.
     *
     * @param content heading text
     * @return styled heading
     */
    public static String heading(String content) {
        return style("bold,blue", content);
    }

    private static String style(String styles, String message) {
        return Ansi.AUTO.string("@|" + styles + " " + escape(message) + "|@");
    }

    // picocli markup would otherwise treat "|@" inside user text as the end of a style block
    private static String escape(String message) {
        return message == null ? "" : message.replace("|@", "| @");
    }
}
