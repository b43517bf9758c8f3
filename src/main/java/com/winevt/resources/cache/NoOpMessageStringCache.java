package com.winevt.resources.cache;

import com.winevt.resources.core.model.ResolutionKind;

import java.util.Optional;

/**
 * No-op cache implementation. All operations are no-ops.
 * Used when caching is disabled.
 */
public class NoOpMessageStringCache implements MessageStringCache {

    @Override
    public Optional<String> get(ResolutionKind resolutionKind, String providerIdentifier, String logSource,
                                long messageIdentifier, Integer eventVersion) {
        return Optional.empty();
    }

    @Override
    public void put(ResolutionKind resolutionKind, String providerIdentifier, String logSource,
                    long messageIdentifier, Integer eventVersion, String messageString) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
