package com.github.alvarosanchez.pkgsource.model;

import java.util.Comparator;

/**
 * Ordering of dotted package versions such as {@code 1.2.10} or {@code 2.0.0-beta1}.
 */
public final class PackageVersions {

    /**
     * Orders versions numerically per segment; a pre-release sorts below its release.
     */
    public static final Comparator<String> ORDER = PackageVersions::compare;

    private PackageVersions() {
    }

    /**
     * Returns whether a version has a pre-release suffix.
     *
     * @param version version text
     * @return {@code true} when the version contains {@code -}
     */
    public static boolean isPrerelease(String version) {
        return version != null && version.indexOf('-') > 0;
    }

    /**
     * Compares two versions.
     *
     * @param left first version
     * @param right second version
     * @return negative, zero or positive as {@code left} is lower, equal or higher
     */
    public static int compare(String left, String right) {
        String[] leftParts = split(left);
        String[] rightParts = split(right);

        int result = compareRelease(leftParts[0], rightParts[0]);
        if (result != 0) {
            return result;
        }
        if (leftParts[1] == null) {
            return rightParts[1] == null ? 0 : 1;
        }
        if (rightParts[1] == null) {
            return -1;
        }
        return leftParts[1].compareToIgnoreCase(rightParts[1]);
    }

    private static int compareRelease(String left, String right) {
        String[] leftSegments = left.split("\\.");
        String[] rightSegments = right.split("\\.");
        int length = Math.max(leftSegments.length, rightSegments.length);
        for (int i = 0; i < length; i++) {
            String leftSegment = i < leftSegments.length ? leftSegments[i] : "0";
            String rightSegment = i < rightSegments.length ? rightSegments[i] : "0";
            int result = compareSegment(leftSegment, rightSegment);
            if (result != 0) {
                return result;
            }
        }
        return 0;
    }

    private static int compareSegment(String left, String right) {
        try {
            return Long.compare(Long.parseLong(left), Long.parseLong(right));
        } catch (NumberFormatException e) {
            return left.compareToIgnoreCase(right);
        }
    }

    private static String[] split(String version) {
        String value = version == null ? "0" : version.trim();
        int separator = value.indexOf('-');
        if (separator < 0) {
            return new String[] {value, null};
        }
        return new String[] {value.substring(0, separator), value.substring(separator + 1)};
    }
}
