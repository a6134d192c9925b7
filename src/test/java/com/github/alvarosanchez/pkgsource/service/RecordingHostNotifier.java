package com.github.alvarosanchez.pkgsource.service;

import com.github.alvarosanchez.pkgsource.model.ResolvedSource;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

final class RecordingHostNotifier implements HostNotifier {

    final List<ResolvedSource> sourceChanges = new ArrayList<>();
    final List<Path> assetChanges = new ArrayList<>();

    @Override
    public void sourcesChanged(ResolvedSource resolvedSource) {
        sourceChanges.add(resolvedSource);
    }

    @Override
    public void assetsChanged(Path configurationFile) {
        assetChanges.add(configurationFile);
    }
}
