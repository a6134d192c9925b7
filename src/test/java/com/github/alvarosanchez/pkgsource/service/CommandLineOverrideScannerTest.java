package com.github.alvarosanchez.pkgsource.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.alvarosanchez.pkgsource.model.PackageSourceDescriptor;
import java.util.List;
import org.junit.jupiter.api.Test;

class CommandLineOverrideScannerTest {

    private final CommandLineOverrideScanner scanner = new CommandLineOverrideScanner();

    @Test
    void scanStopsCollectingAtTheNextFlag() {
        List<PackageSourceDescriptor> sources = scanner.scan(List.of("-Source", "A", "-Other"));

        assertEquals(1, sources.size());
        assertEquals("CMD_LINE_SRC_0", sources.get(0).name());
        assertEquals("A", sources.get(0).location());
        assertNull(sources.get(0).credentials());
    }

    @Test
    void scanAccumulatesRepeatedMarkersInOrder() {
        List<PackageSourceDescriptor> sources = scanner.scan(List.of("-Source", "A", "B", "-Source", "C"));

        assertEquals(List.of("A", "B", "C"), sources.stream().map(PackageSourceDescriptor::location).toList());
        assertEquals(
            List.of("CMD_LINE_SRC_0", "CMD_LINE_SRC_1", "CMD_LINE_SRC_2"),
            sources.stream().map(PackageSourceDescriptor::name).toList()
        );
    }

    @Test
    void scanReturnsEmptyListWithoutArguments() {
        assertTrue(scanner.scan(List.of()).isEmpty());
    }

    @Test
    void scanMatchesMarkerIgnoringCase() {
        List<PackageSourceDescriptor> sources = scanner.scan(List.of("search", "-source", "./local", "-SOURCE", "./other"));

        assertEquals(List.of("./local", "./other"), sources.stream().map(PackageSourceDescriptor::location).toList());
    }

    @Test
    void markerFollowedByAnotherFlagYieldsNothing() {
        List<PackageSourceDescriptor> sources = scanner.scan(List.of("-Source", "--verbose", "ignored", "-Source"));

        assertTrue(sources.isEmpty());
    }

    @Test
    void tokensBeforeAnyMarkerAreIgnored() {
        List<PackageSourceDescriptor> sources = scanner.scan(List.of("search", "json", "-Source", "https://example.org/v3/index.json"));

        assertEquals(1, sources.size());
        assertEquals("https://example.org/v3/index.json", sources.get(0).location());
    }
}
