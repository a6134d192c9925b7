package com.github.alvarosanchez.pkgsource.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.alvarosanchez.pkgsource.config.ConfigLocation;
import com.github.alvarosanchez.pkgsource.config.ConfigStore;
import com.github.alvarosanchez.pkgsource.model.Configuration;
import com.github.alvarosanchez.pkgsource.model.InvocationArguments;
import com.github.alvarosanchez.pkgsource.model.PackageSourceDescriptor;
import com.github.alvarosanchez.pkgsource.model.ResolvedSource;
import com.github.alvarosanchez.pkgsource.model.ResolvedSource.Kind;
import com.github.alvarosanchez.pkgsource.source.CompositePackageSource;
import com.github.alvarosanchez.pkgsource.source.PackageSource;
import io.micronaut.context.ApplicationContext;
import io.micronaut.serde.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceResolverTest {

    @TempDir
    Path tempDir;

    private ApplicationContext applicationContext;
    private CountingConfigStore configStore;
    private RecordingHostNotifier hostNotifier;
    private ConfigLocation configLocation;
    private String previousProjectDir;

    @BeforeEach
    void setUp() {
        applicationContext = ApplicationContext.run();
        configStore = new CountingConfigStore(applicationContext.getBean(ObjectMapper.class));
        hostNotifier = new RecordingHostNotifier();
        previousProjectDir = System.getProperty("pkgsource.project.dir");
        System.setProperty("pkgsource.project.dir", tempDir.toString());
        configLocation = new ConfigLocation("");
    }

    @AfterEach
    void tearDown() {
        applicationContext.close();
        if (previousProjectDir == null) {
            System.clearProperty("pkgsource.project.dir");
        } else {
            System.setProperty("pkgsource.project.dir", previousProjectDir);
        }
    }

    @Test
    void firstReadCreatesDefaultConfigurationAndResolvesItsActiveSource() {
        SourceResolver resolver = resolver();

        ResolvedSource resolvedSource = resolver.resolvedSource();

        assertTrue(Files.exists(tempDir.resolve(ConfigLocation.FILE_NAME)));
        assertEquals(Kind.CONFIGURED, resolvedSource.kind());
        assertEquals(List.of(ConfigStore.DEFAULT_SOURCE_NAME), names(resolvedSource.descriptors()));
    }

    @Test
    void repeatedReadsUseTheCachedResolution() {
        SourceResolver resolver = resolver();

        PackageSource first = resolver.active();
        PackageSource second = resolver.active();
        resolver.configuration();
        resolver.resolvedSource();

        assertEquals(1, configStore.loads());
        assertTrue(first == second);
    }

    @Test
    void invalidateForcesTheNextReadToLoadAgain() {
        SourceResolver resolver = resolver();
        resolver.active();

        resolver.invalidate();

        assertFalse(resolver.isResolved());
        assertTrue(resolver.currentConfiguration().isEmpty());
        resolver.active();
        assertEquals(2, configStore.loads());
    }

    @Test
    void resolveWithoutOverridesKeepsInstallFromCache() {
        SourceResolver resolver = resolver();
        Configuration configuration = configurationWith("local", "remote");
        configuration.setActiveSourceName("remote");

        ResolvedSource resolvedSource = resolver.resolve(configuration, List.of());

        assertEquals(Kind.CONFIGURED, resolvedSource.kind());
        assertEquals(List.of("remote"), names(resolvedSource.descriptors()));
        assertTrue(configuration.isInstallFromCache());
    }

    @Test
    void resolveWithoutDesignatedSourceUsesEveryEnabledSource() {
        SourceResolver resolver = resolver();
        Configuration configuration = configurationWith("one", "two");
        configuration.addSource(new PackageSourceDescriptor("off", "./off", null, false));

        ResolvedSource resolvedSource = resolver.resolve(configuration, List.of());

        assertEquals(Kind.CONFIGURED, resolvedSource.kind());
        assertEquals(List.of("one", "two"), names(resolvedSource.descriptors()));
    }

    @Test
    void resolveWithOneOverridePicksItAndDisablesInstallFromCache() {
        SourceResolver resolver = resolver();
        Configuration configuration = configurationWith("local");
        PackageSourceDescriptor override = PackageSourceDescriptor.fromCommandLine(0, "./forced");

        ResolvedSource resolvedSource = resolver.resolve(configuration, List.of(override));

        assertEquals(Kind.SINGLE_OVERRIDE, resolvedSource.kind());
        assertEquals(List.of(override), resolvedSource.descriptors());
        assertFalse(configuration.isInstallFromCache());
    }

    @Test
    void resolveWithSeveralOverridesKeepsScanOrderAndDisablesInstallFromCache() {
        SourceResolver resolver = resolver();
        Configuration configuration = configurationWith("local");
        configuration.setInstallFromCache(true);
        List<PackageSourceDescriptor> overrides = new CommandLineOverrideScanner().scan(List.of("-Source", "./b", "./a"));

        ResolvedSource resolvedSource = resolver.resolve(configuration, overrides);

        assertEquals(Kind.COMPOSITE_OVERRIDE, resolvedSource.kind());
        assertEquals(List.of("./b", "./a"), resolvedSource.descriptors().stream().map(PackageSourceDescriptor::location).toList());
        assertFalse(configuration.isInstallFromCache());
    }

    @Test
    void invocationOverridesBuildACompositeSourceInScanOrder() {
        SourceResolver resolver = resolver("search", "-Source", "./first", "./second");

        PackageSource active = resolver.active();

        CompositePackageSource composite = assertInstanceOf(CompositePackageSource.class, active);
        assertEquals(List.of("CMD_LINE_SRC_0", "CMD_LINE_SRC_1"), composite.sources().stream().map(PackageSource::name).toList());
        assertFalse(resolver.configuration().isInstallFromCache());
    }

    @Test
    void notifiesOnlyWhenTheResolvedSourceChanges() {
        SourceResolver resolver = resolver();

        resolver.reload();
        resolver.reload();
        assertEquals(1, hostNotifier.sourceChanges.size());

        Configuration configuration = resolver.configuration();
        configuration.addSource(new PackageSourceDescriptor("mirror", "./mirror"));
        configuration.setActiveSourceName("mirror");
        resolver.saveConfiguration();

        assertEquals(2, hostNotifier.sourceChanges.size());
        assertEquals(List.of("mirror"), names(hostNotifier.sourceChanges.get(1).descriptors()));
    }

    @Test
    void notifierFailuresDoNotBreakResolution() {
        SourceResolver resolver = new SourceResolver(
            configStore,
            configLocation,
            new CommandLineOverrideScanner(),
            InvocationArguments.none(),
            descriptor -> new StubPackageSource(descriptor.name(), List.of()),
            new HostNotifier() {
                @Override
                public void sourcesChanged(ResolvedSource resolvedSource) {
                    throw new IllegalStateException("plugin crashed");
                }

                @Override
                public void assetsChanged(Path configurationFile) {
                }
            }
        );

        assertEquals(Kind.CONFIGURED, resolver.reload().kind());
    }

    @Test
    void malformedConfigurationFileIsFatal() throws IOException {
        Files.writeString(tempDir.resolve(ConfigLocation.FILE_NAME), "not-json");
        SourceResolver resolver = resolver();

        UncheckedIOException thrown = assertThrows(UncheckedIOException.class, resolver::active);

        assertTrue(thrown.getMessage().contains("Failed to read configuration file"));
        assertFalse(resolver.isResolved());
    }

    private SourceResolver resolver(String... args) {
        return new SourceResolver(
            configStore,
            configLocation,
            new CommandLineOverrideScanner(),
            InvocationArguments.of(args),
            descriptor -> new StubPackageSource(descriptor.name(), List.of()),
            hostNotifier
        );
    }

    private Configuration configurationWith(String... sourceNames) {
        Configuration configuration = new Configuration(tempDir.resolve(ConfigLocation.FILE_NAME));
        for (String sourceName : sourceNames) {
            configuration.addSource(new PackageSourceDescriptor(sourceName, "./" + sourceName));
        }
        return configuration;
    }

    private static List<String> names(List<PackageSourceDescriptor> descriptors) {
        return descriptors.stream().map(PackageSourceDescriptor::name).toList();
    }
}
