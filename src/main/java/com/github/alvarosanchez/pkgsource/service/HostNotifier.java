package com.github.alvarosanchez.pkgsource.service;

import com.github.alvarosanchez.pkgsource.model.ResolvedSource;
import java.nio.file.Path;

/**
 * Hooks into host subsystems that react to source and file changes. Calls are fire-and-forget.
 */
public interface HostNotifier {

    /**
     * Called after resolution picked a different source, so source-aware plugins can reinitialize.
     *
     * @param resolvedSource newly active source
     */
    void sourcesChanged(ResolvedSource resolvedSource);

    /**
     * Called after a relocation changed files on disk, so the host can rescan its assets.
     *
     * @param configurationFile configuration file path after the change
     */
    void assetsChanged(Path configurationFile);
}
