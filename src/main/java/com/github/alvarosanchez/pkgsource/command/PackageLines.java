package com.github.alvarosanchez.pkgsource.command;

import com.github.alvarosanchez.pkgsource.model.PackageInfo;

final class PackageLines {

    private PackageLines() {
    }

    static String describe(PackageInfo info) {
        StringBuilder line = new StringBuilder(info.id()).append(' ').append(info.version());
        if (info.sourceName() != null) {
            line.append("  [").append(info.sourceName()).append(']');
        }
        if (info.description() != null && !info.description().isBlank()) {
            line.append("  ").append(info.description());
        }
        return line.toString();
    }
}
