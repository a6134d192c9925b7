package com.github.alvarosanchez.pkgsource.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.alvarosanchez.pkgsource.model.PackageIdentifier;
import com.github.alvarosanchez.pkgsource.model.PackageInfo;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalFolderPackageSourceTest {

    @TempDir
    Path tempDir;

    private LocalFolderPackageSource source;

    @BeforeEach
    void setUp() throws IOException {
        for (String fileName : List.of(
            "Newtonsoft.Json.12.0.3.nupkg",
            "Newtonsoft.Json.13.0.3.nupkg",
            "Newtonsoft.Json.14.0.0-beta1.nupkg",
            "Serilog.3.1.0.nupkg",
            "Serilog.Sinks.Console.5.0.1.nupkg",
            "README.md",
            "NoVersion.nupkg"
        )) {
            Files.writeString(tempDir.resolve(fileName), "");
        }
        source = new LocalFolderPackageSource("local", tempDir, Runnable::run);
    }

    @Test
    void searchFiltersByTermAndSkipsPrereleaseByDefault() {
        List<PackageInfo> packages = source.searchAsync("json", false, 15, 0, CancellationToken.NONE).join();

        assertEquals(List.of("13.0.3", "12.0.3"), packages.stream().map(PackageInfo::version).toList());
        assertTrue(packages.stream().allMatch(info -> "local".equals(info.sourceName())));
    }

    @Test
    void searchIncludesPrereleaseWhenAsked() {
        List<PackageInfo> packages = source.searchAsync("JSON", true, 15, 0, CancellationToken.NONE).join();

        assertEquals("14.0.0-beta1", packages.get(0).version());
    }

    @Test
    void searchAppliesSkipAndTakeAfterSorting() {
        List<PackageInfo> packages = source.searchAsync("", false, 2, 1, CancellationToken.NONE).join();

        assertEquals(2, packages.size());
        assertEquals("Newtonsoft.Json", packages.get(0).id());
        assertEquals("12.0.3", packages.get(0).version());
        assertEquals("Serilog", packages.get(1).id());
    }

    @Test
    void cancelledSearchFails() {
        CancellationTokenSource tokenSource = new CancellationTokenSource();
        tokenSource.cancel();

        CompletionException thrown = assertThrows(
            CompletionException.class,
            () -> source.searchAsync("", false, 15, 0, tokenSource.token()).join()
        );

        assertInstanceOf(CancellationException.class, thrown.getCause());
    }

    @Test
    void updatesReturnTheHighestNewerVersion() {
        List<PackageInfo> updates = source.getUpdates(
            List.of(new PackageIdentifier("newtonsoft.json", "12.0.3"), new PackageIdentifier("Serilog", "3.1.0")),
            false,
            "",
            ""
        );

        assertEquals(1, updates.size());
        assertEquals("13.0.3", updates.get(0).version());
    }

    @Test
    void updatesConsiderPrereleaseWhenAsked() {
        List<PackageInfo> updates = source.getUpdates(List.of(new PackageIdentifier("Newtonsoft.Json", "13.0.3")), true, "", "");

        assertEquals("14.0.0-beta1", updates.get(0).version());
    }

    @Test
    void specificPackageMatchesExactVersionOrHighestVersion() {
        assertEquals(
            "12.0.3",
            source.getSpecificPackage(new PackageIdentifier("Newtonsoft.Json", "12.0.3")).orElseThrow().version()
        );
        assertEquals(
            "14.0.0-beta1",
            source.getSpecificPackage(new PackageIdentifier("Newtonsoft.Json", null)).orElseThrow().version()
        );
        assertTrue(source.getSpecificPackage(new PackageIdentifier("Serilog", "9.9.9")).isEmpty());
    }

    @Test
    void parseFileNameSplitsIdFromVersionAtTheFirstNumericSegment() {
        PackageInfo info = source.parseFileName("Serilog.Sinks.Console.5.0.1.nupkg").orElseThrow();

        assertEquals("Serilog.Sinks.Console", info.id());
        assertEquals("5.0.1", info.version());
        assertTrue(source.parseFileName("NoVersion.nupkg").isEmpty());
        assertTrue(source.parseFileName("Serilog.3.1.0.zip").isEmpty());
    }

    @Test
    void missingDirectoryBehavesAsAnEmptySource() {
        LocalFolderPackageSource missing = new LocalFolderPackageSource("missing", tempDir.resolve("absent"), Runnable::run);

        assertTrue(missing.searchAsync("", true, 15, 0, CancellationToken.NONE).join().isEmpty());
        assertTrue(missing.getSpecificPackage(new PackageIdentifier("Serilog", null)).isEmpty());
    }
}
