package com.winevt.resources.api;

import com.winevt.resources.backend.FallbackSourceOpener;
import com.winevt.resources.backend.MessageStringSource;
import com.winevt.resources.backend.StorageReaderMessageSource;
import com.winevt.resources.backend.UnavailableMessageSource;
import com.winevt.resources.cache.CacheConfig;
import com.winevt.resources.cache.CacheStats;
import com.winevt.resources.core.model.EnvironmentVariable;
import com.winevt.resources.core.model.EventLogProvider;
import com.winevt.resources.core.model.MessageFile;
import com.winevt.resources.core.model.MessageString;
import com.winevt.resources.core.model.WinevtContainerTypes;
import com.winevt.resources.metrics.MicrometerMetricsService;
import com.winevt.resources.sqlite.DatabaseIntegrityException;
import com.winevt.resources.sqlite.LegacyDatabaseFixture;
import com.winevt.resources.store.ContainerIdentifier;
import com.winevt.resources.store.InMemoryAttributeContainerStore;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("WinevtResourcesResolver Tests")
class WinevtResourcesResolverTest {

    private static final String WER_IDENTIFIER = "{a0e9b465-b939-57d7-b27d-95d8e925ff57}";
    private static final String WER_LOG_SOURCE = "Application Error";

    @Mock
    private FallbackSourceOpener fallbackSourceOpener;

    @Mock
    private MessageStringSource source;

    @BeforeEach
    void setUp() {
        lenient().when(source.getName()).thenReturn("mock");
        lenient().when(fallbackSourceOpener.open()).thenReturn(source);
    }

    private WinevtResourcesResolver newResolver() {
        return WinevtResourcesResolver.builder()
                .fallbackSourceOpener(fallbackSourceOpener)
                .build();
    }

    private static InMemoryAttributeContainerStore newStorage() {
        InMemoryAttributeContainerStore storage = new InMemoryAttributeContainerStore();
        storage.addAttributeContainer(WinevtContainerTypes.ENVIRONMENT_VARIABLE,
                new EnvironmentVariable("SystemRoot", "C:\\Windows"));
        storage.addAttributeContainer(WinevtContainerTypes.EVENTLOG_PROVIDER, EventLogProvider.builder()
                .identifier(WER_IDENTIFIER)
                .logSource(WER_LOG_SOURCE)
                .eventMessageFiles(List.of("%SystemRoot%\\System32\\wer.dll"))
                .build());
        ContainerIdentifier wer = storage.addAttributeContainer(WinevtContainerTypes.EVENTLOG_MESSAGE_FILE,
                new MessageFile("\\Windows\\System32\\wer.dll"));
        storage.addAttributeContainer(WinevtContainerTypes.EVENTLOG_MESSAGE_STRING, MessageString.builder()
                .messageFileIdentifier(wer)
                .languageIdentifier(0x0409)
                .messageIdentifier(1000)
                .text("Faulting application name: {0}")
                .build());
        return storage;
    }

    @Nested
    @DisplayName("Source selection")
    class SourceSelectionTests {

        @Test
        @DisplayName("Should resolve from a storage reader holding EventLog providers")
        void usesStorageReader() {
            try (WinevtResourcesResolver resolver = WinevtResourcesResolver.builder()
                    .storageReader(newStorage())
                    .fallbackSourceOpener(fallbackSourceOpener)
                    .build()) {

                assertEquals(Optional.of("Faulting application name: {0}"),
                        resolver.getMessageString(WER_IDENTIFIER, WER_LOG_SOURCE, 1000, null));
                assertEquals(StorageReaderMessageSource.NAME, resolver.getSourceName());
            }
            verify(fallbackSourceOpener, never()).open();
        }

        @Test
        @DisplayName("Should fall back when the storage reader holds no EventLog providers")
        void fallsBackWithoutProviders() {
            when(source.getMessageString(null, WER_LOG_SOURCE, 1000, null))
                    .thenReturn(Optional.of("Faulting application name: {0}"));

            try (WinevtResourcesResolver resolver = WinevtResourcesResolver.builder()
                    .storageReader(new InMemoryAttributeContainerStore())
                    .fallbackSourceOpener(fallbackSourceOpener)
                    .build()) {

                assertEquals(Optional.of("Faulting application name: {0}"),
                        resolver.getMessageString(null, WER_LOG_SOURCE, 1000, null));
                assertEquals("mock", resolver.getSourceName());
            }
        }

        @Test
        @DisplayName("Should select the source only once")
        void memoizesSource() {
            when(source.getMessageString(any(), any(), anyLong(), any())).thenReturn(Optional.empty());

            try (WinevtResourcesResolver resolver = newResolver()) {
                resolver.getMessageString(null, "Source A", 1, null);
                resolver.getMessageString(null, "Source B", 2, null);
                resolver.getParameterString(null, "Source C", 3);
            }

            verify(fallbackSourceOpener, times(1)).open();
        }

        @Test
        @DisplayName("Should open a corrupt resources database only once")
        void memoizesCorruptDatabase() {
            when(fallbackSourceOpener.open())
                    .thenThrow(new DatabaseIntegrityException("Multiple values for metadata: version"));

            try (WinevtResourcesResolver resolver = newResolver()) {
                assertTrue(resolver.getMessageString(null, WER_LOG_SOURCE, 1000, null).isEmpty());
                assertTrue(resolver.getMessageString(null, WER_LOG_SOURCE, 1001, null).isEmpty());
                assertTrue(resolver.getParameterString(null, "Security", 1833).isEmpty());
                assertEquals(UnavailableMessageSource.NAME, resolver.getSourceName());
            }

            verify(fallbackSourceOpener, times(1)).open();
        }

        @Test
        @DisplayName("Should not open a source when closed before first use")
        void closeBeforeUse() {
            newResolver().close();

            verify(fallbackSourceOpener, never()).open();
            verify(source, never()).close();
        }

        @Test
        @DisplayName("Should resolve from a legacy database in the data location")
        void legacyDatabaseEndToEnd(@TempDir Path dataLocation) throws Exception {
            try (LegacyDatabaseFixture fixture = LegacyDatabaseFixture.create(
                    dataLocation.resolve(ResolverOptions.DEFAULT_DATABASE_NAME))) {
                fixture.provider(1, "Service Control Manager")
                        .messageFile(1, 7)
                        .message(7, 0x0409, 7023, "Service %1 failed");
            }

            try (WinevtResourcesResolver resolver = WinevtResourcesResolver.builder()
                    .options(ResolverOptions.builder().dataLocation(dataLocation).build())
                    .build()) {

                assertEquals(Optional.of("Service {0} failed"),
                        resolver.getMessageString(null, "Service Control Manager", 7023, null));
                assertEquals("legacy-database", resolver.getSourceName());
                assertTrue(resolver.getParameterString(null, "Service Control Manager", 7023).isEmpty());
            }
        }

        @Test
        @DisplayName("Should resolve nothing without storage reader and data location")
        void unavailable() {
            try (WinevtResourcesResolver resolver = WinevtResourcesResolver.builder().build()) {
                assertTrue(resolver.getMessageString(null, WER_LOG_SOURCE, 1000, null).isEmpty());
                assertEquals("unavailable", resolver.getSourceName());
            }
        }
    }

    @Nested
    @DisplayName("Caching")
    class CachingTests {

        @Test
        @DisplayName("Should serve repeated lookups from the cache")
        void cachesResolvedStrings() {
            when(source.getMessageString(WER_IDENTIFIER, WER_LOG_SOURCE, 1000, null))
                    .thenReturn(Optional.of("Faulting application name: {0}"));

            try (WinevtResourcesResolver resolver = newResolver()) {
                Optional<String> first = resolver.getMessageString(WER_IDENTIFIER, WER_LOG_SOURCE, 1000, null);
                Optional<String> second = resolver.getMessageString(WER_IDENTIFIER, WER_LOG_SOURCE, 1000, null);

                assertEquals(first, second);
                CacheStats stats = resolver.getCacheStats();
                assertEquals(1, stats.hitCount());
                assertEquals(1, stats.missCount());
            }
            verify(source, times(1)).getMessageString(WER_IDENTIFIER, WER_LOG_SOURCE, 1000, null);
        }

        @Test
        @DisplayName("Should serve a cached string by provider identifier or by log source")
        void cachesUnderBothKeys() {
            when(source.getMessageString(WER_IDENTIFIER, WER_LOG_SOURCE, 1000, null))
                    .thenReturn(Optional.of("Faulting application name: {0}"));

            try (WinevtResourcesResolver resolver = newResolver()) {
                resolver.getMessageString(WER_IDENTIFIER, WER_LOG_SOURCE, 1000, null);

                assertEquals(Optional.of("Faulting application name: {0}"),
                        resolver.getMessageString(WER_IDENTIFIER, null, 1000, null));
                assertEquals(Optional.of("Faulting application name: {0}"),
                        resolver.getMessageString(null, WER_LOG_SOURCE, 1000, null));
            }
        }

        @Test
        @DisplayName("Should not cache unresolved or empty strings")
        void doesNotCacheMisses() {
            when(source.getMessageString(null, WER_LOG_SOURCE, 1000, null)).thenReturn(Optional.of(""));

            try (WinevtResourcesResolver resolver = newResolver()) {
                assertTrue(resolver.getMessageString(null, WER_LOG_SOURCE, 1000, null).isEmpty());
                assertTrue(resolver.getMessageString(null, WER_LOG_SOURCE, 1000, null).isEmpty());
                assertEquals(0, resolver.getCacheStats().size());
            }
            verify(source, times(2)).getMessageString(null, WER_LOG_SOURCE, 1000, null);
        }

        @Test
        @DisplayName("Should cache message and parameter strings separately")
        void messageAndParameterCachedSeparately() {
            when(source.getMessageString(null, "Service Control Manager", 7023, null))
                    .thenReturn(Optional.of("The {0} service terminated with the following error: {1}"));
            when(source.getParameterString(null, "Service Control Manager", 7023))
                    .thenReturn(Optional.empty());

            try (WinevtResourcesResolver resolver = newResolver()) {
                resolver.getMessageString(null, "Service Control Manager", 7023, null);

                assertTrue(resolver.getParameterString(null, "Service Control Manager", 7023).isEmpty());
                assertEquals(Optional.of("The {0} service terminated with the following error: {1}"),
                        resolver.getMessageString(null, "Service Control Manager", 7023, null));
            }
            verify(source, times(1)).getParameterString(null, "Service Control Manager", 7023);
            verify(source, times(1)).getMessageString(null, "Service Control Manager", 7023, null);
        }

        @Test
        @DisplayName("Should qualify cached strings by event version")
        void versionQualified() {
            when(source.getMessageString(WER_IDENTIFIER, null, 1000, 1)).thenReturn(Optional.of("Version 1"));
            when(source.getMessageString(WER_IDENTIFIER, null, 1000, 2)).thenReturn(Optional.of("Version 2"));

            try (WinevtResourcesResolver resolver = newResolver()) {
                assertEquals(Optional.of("Version 1"), resolver.getMessageString(WER_IDENTIFIER, null, 1000, 1));
                assertEquals(Optional.of("Version 2"), resolver.getMessageString(WER_IDENTIFIER, null, 1000, 2));
            }
        }

        @Test
        @DisplayName("Should resolve every lookup when the cache is disabled")
        void cacheDisabled() {
            when(source.getParameterString(null, "Security", 1833)).thenReturn(Optional.of("Success"));

            try (WinevtResourcesResolver resolver = WinevtResourcesResolver.builder()
                    .options(ResolverOptions.builder().cacheEnabled(false).build())
                    .fallbackSourceOpener(fallbackSourceOpener)
                    .build()) {
                resolver.getParameterString(null, "Security", 1833);
                resolver.getParameterString(null, "Security", 1833);
            }
            verify(source, times(2)).getParameterString(null, "Security", 1833);
        }

        @Test
        @DisplayName("Should resolve again after invalidating the cache")
        void invalidateCache() {
            when(source.getMessageString(null, WER_LOG_SOURCE, 1000, null)).thenReturn(Optional.of("Message"));

            try (WinevtResourcesResolver resolver = WinevtResourcesResolver.builder()
                    .options(ResolverOptions.builder().cacheConfig(new CacheConfig(16, true)).build())
                    .fallbackSourceOpener(fallbackSourceOpener)
                    .build()) {
                resolver.getMessageString(null, WER_LOG_SOURCE, 1000, null);
                resolver.invalidateCache();
                resolver.getMessageString(null, WER_LOG_SOURCE, 1000, null);
            }
            verify(source, times(2)).getMessageString(null, WER_LOG_SOURCE, 1000, null);
        }
    }

    @Nested
    @DisplayName("Lifecycle and metrics")
    class LifecycleTests {

        @Test
        @DisplayName("Should close the source once and reject lookups afterwards")
        void closeLifecycle() {
            when(source.getMessageString(null, WER_LOG_SOURCE, 1000, null)).thenReturn(Optional.of("Message"));
            WinevtResourcesResolver resolver = newResolver();
            resolver.getMessageString(null, WER_LOG_SOURCE, 1000, null);

            resolver.close();
            resolver.close();

            verify(source, times(1)).close();
            IllegalStateException e = assertThrows(IllegalStateException.class,
                    () -> resolver.getMessageString(null, WER_LOG_SOURCE, 1000, null));
            assertEquals("Resolver already closed.", e.getMessage());
            assertThrows(IllegalStateException.class, () -> resolver.getParameterString(null, "Security", 1833));
        }

        @Test
        @DisplayName("Should dispatch parameter lookups to the source")
        void parameterLookup() {
            when(source.getParameterString(WER_IDENTIFIER, "Security", 1833)).thenReturn(Optional.of("Success"));

            try (WinevtResourcesResolver resolver = newResolver()) {
                assertEquals(Optional.of("Success"), resolver.getParameterString(WER_IDENTIFIER, "Security", 1833));
            }
            verify(source, never()).getMessageString(any(), any(), anyLong(), any());
        }

        @Test
        @DisplayName("Should record cache and resolution metrics")
        void recordsMetrics() {
            when(source.getMessageString(null, WER_LOG_SOURCE, 1000, null)).thenReturn(Optional.of("Message"));
            when(source.getMessageString(null, WER_LOG_SOURCE, 1001, null)).thenReturn(Optional.empty());
            SimpleMeterRegistry registry = new SimpleMeterRegistry();

            try (WinevtResourcesResolver resolver = WinevtResourcesResolver.builder()
                    .fallbackSourceOpener(fallbackSourceOpener)
                    .metricsService(new MicrometerMetricsService(registry))
                    .build()) {
                resolver.getMessageString(null, WER_LOG_SOURCE, 1000, null);
                resolver.getMessageString(null, WER_LOG_SOURCE, 1000, null);
                resolver.getMessageString(null, WER_LOG_SOURCE, 1001, null);
            }

            assertEquals(1.0, registry.find("winevt.cache.hit").counter().count());
            assertEquals(2.0, registry.find("winevt.cache.miss").counter().count());
            Timer timer = registry.find("winevt.resolution.duration")
                    .tag("kind", "message")
                    .tag("source", "mock")
                    .timer();
            assertNotNull(timer);
            assertEquals(2, timer.count());
            assertEquals(1.0, registry.find("winevt.resolution.unresolved")
                    .tag("kind", "message").counter().count());
        }
    }
}
