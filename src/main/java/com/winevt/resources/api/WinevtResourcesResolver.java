package com.winevt.resources.api;

import com.winevt.resources.backend.FallbackSourceOpener;
import com.winevt.resources.backend.MessageStringSource;
import com.winevt.resources.backend.StorageReaderMessageSource;
import com.winevt.resources.backend.UnavailableMessageSource;
import com.winevt.resources.cache.CacheStats;
import com.winevt.resources.cache.LruMessageStringCache;
import com.winevt.resources.cache.MessageStringCache;
import com.winevt.resources.cache.NoOpMessageStringCache;
import com.winevt.resources.core.model.ResolutionKind;
import com.winevt.resources.logging.LogContext;
import com.winevt.resources.metrics.MetricsService;
import com.winevt.resources.metrics.NoOpMetricsService;
import com.winevt.resources.sqlite.DatabaseIntegrityException;
import com.winevt.resources.store.AttributeContainerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Main entry point for resolving Windows EventLog message and parameter strings.
 *
 * <p>Strings are read from the EventLog resources in a case storage when it holds EventLog
 * providers, otherwise from the resources database in the configured data location. The
 * source is chosen on first use and kept for the lifetime of the resolver; a corrupt resources
 * database is reported once and leaves the resolver without a source. Resolved strings
 * are cached under the provider identifier and under the log source.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (WinevtResourcesResolver resolver = WinevtResourcesResolver.builder()
 *         .storageReader(storage)
 *         .options(ResolverOptions.builder().dataLocation(dataDirectory).build())
 *         .build()) {
 *     Optional&lt;String&gt; message = resolver.getMessageString(
 *             "{c2a5a5c5-...}", "Application Error", 1000L, null);
 * }
 * </pre>
 *
 * <p>Not thread-safe: each worker owns its own resolver, with its own cache and its own
 * fallback database connection.</p>
 */
public class WinevtResourcesResolver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WinevtResourcesResolver.class);

    private final AttributeContainerStore storageReader;
    private final ResolverOptions options;
    private final MessageStringCache cache;
    private final MetricsService metricsService;
    private final FallbackSourceOpener fallbackSourceOpener;

    private MessageStringSource source;
    private boolean sourceInitialized;
    private boolean closed;

    private WinevtResourcesResolver(Builder builder) {
        this.storageReader = builder.storageReader;
        this.options = builder.options;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();

        if (builder.cache != null) {
            this.cache = builder.cache;
        } else if (options.getCacheConfig().enabled()) {
            this.cache = new LruMessageStringCache(options.getCacheConfig());
        } else {
            this.cache = new NoOpMessageStringCache();
        }

        this.fallbackSourceOpener = builder.fallbackSourceOpener != null
                ? builder.fallbackSourceOpener
                : new FallbackSourceOpener(options.getDataLocation(), options.getDatabaseName(),
                        options.getLcid(), options.getLanguageTag());

        log.info("WinevtResourcesResolver initialized: lcid=0x{} languageTag={} storageReader={}",
                String.format("%04x", options.getLcid()), options.getLanguageTag(), storageReader != null);
    }

    // ========== Resolution API ==========

    /**
     * Retrieves a specific Windows EventLog message string.
     *
     * @param providerIdentifier EventLog provider identifier (GUID), may be null
     * @param logSource          EventLog source, such as "Application Error", may be null
     * @param messageIdentifier  message identifier
     * @param eventVersion       event version, or null if not set
     * @return the message string, or empty if not available
     */
    public Optional<String> getMessageString(String providerIdentifier, String logSource, long messageIdentifier,
                                             Integer eventVersion) {
        return resolve(ResolutionKind.MESSAGE, providerIdentifier, logSource, messageIdentifier, eventVersion);
    }

    /**
     * Retrieves a specific Windows EventLog parameter string.
     *
     * @param providerIdentifier EventLog provider identifier (GUID), may be null
     * @param logSource          EventLog source, may be null
     * @param messageIdentifier  parameter identifier
     * @return the parameter string, or empty if not available
     */
    public Optional<String> getParameterString(String providerIdentifier, String logSource, long messageIdentifier) {
        return resolve(ResolutionKind.PARAMETER, providerIdentifier, logSource, messageIdentifier, null);
    }

    private Optional<String> resolve(ResolutionKind kind, String providerIdentifier, String logSource,
                                     long messageIdentifier, Integer eventVersion) {
        ensureNotClosed();

        Optional<String> cached = cache.get(kind, providerIdentifier, logSource, messageIdentifier, eventVersion);
        if (cached.isPresent()) {
            metricsService.recordCacheHit();
            return cached;
        }
        metricsService.recordCacheMiss();

        MessageStringSource activeSource = getSource();
        long startNanos = System.nanoTime();
        Optional<String> resolved;
        try (LogContext ignored = LogContext.forLookup(kind.tagValue(), providerIdentifier, logSource,
                messageIdentifier).with("source", activeSource.getName())) {
            if (kind == ResolutionKind.MESSAGE) {
                resolved = activeSource.getMessageString(providerIdentifier, logSource, messageIdentifier,
                        eventVersion);
            } else {
                resolved = activeSource.getParameterString(providerIdentifier, logSource, messageIdentifier);
            }
        }
        metricsService.recordResolutionDuration(kind, activeSource.getName(),
                Duration.ofNanos(System.nanoTime() - startNanos));

        resolved = resolved.filter(value -> !value.isEmpty());
        if (resolved.isPresent()) {
            cache.put(kind, providerIdentifier, logSource, messageIdentifier, eventVersion, resolved.get());
        } else {
            metricsService.incrementUnresolved(kind);
        }
        return resolved;
    }

    /**
     * Returns the source strings are resolved from, selecting it on first use.
     */
    MessageStringSource getSource() {
        if (!sourceInitialized) {
            if (StorageReaderMessageSource.isSupported(storageReader)) {
                source = new StorageReaderMessageSource(storageReader, options.getLcid(), options.getLanguageTag());
            } else {
                try {
                    source = fallbackSourceOpener.open();
                } catch (DatabaseIntegrityException e) {
                    log.error("Resources database in {} is corrupt, message strings will not be resolved",
                            options.getDataLocation(), e);
                    source = UnavailableMessageSource.INSTANCE;
                }
            }
            sourceInitialized = true;
            log.info("Resolving EventLog message strings from source: {}", source.getName());
        }
        return source;
    }

    /**
     * Name of the active source, such as {@code storage} or {@code legacy-database}.
     */
    public String getSourceName() {
        ensureNotClosed();
        return getSource().getName();
    }

    public ResolverOptions getOptions() {
        return options;
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    /**
     * Invalidates all cached message strings.
     */
    public void invalidateCache() {
        cache.invalidateAll();
    }

    private void ensureNotClosed() {
        if (closed) {
            throw new IllegalStateException("Resolver already closed.");
        }
    }

    /**
     * Closes the fallback database, if one was opened. The storage reader is owned by the
     * caller and stays open.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (sourceInitialized) {
            source.close();
            source = null;
        }
        log.info("WinevtResourcesResolver closed: {}", cache.getStats());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link WinevtResourcesResolver}.
     */
    public static class Builder {
        private AttributeContainerStore storageReader;
        private ResolverOptions options = ResolverOptions.defaults();
        private MessageStringCache cache;
        private MetricsService metricsService;
        private FallbackSourceOpener fallbackSourceOpener;

        /**
         * Sets the case storage holding EventLog resources extracted by the parsers.
         */
        public Builder storageReader(AttributeContainerStore storageReader) {
            this.storageReader = storageReader;
            return this;
        }

        public Builder options(ResolverOptions options) {
            if (options == null) {
                throw new IllegalArgumentException("options must not be null");
            }
            this.options = options;
            return this;
        }

        /**
         * Sets a custom cache. By default an LRU cache sized by the options is used.
         */
        public Builder cache(MessageStringCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Sets how the fallback database is opened. By default it is opened from the data
         * location of the options.
         */
        public Builder fallbackSourceOpener(FallbackSourceOpener fallbackSourceOpener) {
            this.fallbackSourceOpener = fallbackSourceOpener;
            return this;
        }

        public WinevtResourcesResolver build() {
            return new WinevtResourcesResolver(this);
        }
    }
}
