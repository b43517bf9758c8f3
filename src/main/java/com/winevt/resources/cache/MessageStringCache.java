package com.winevt.resources.cache;

import com.winevt.resources.core.model.ResolutionKind;

import java.util.Optional;

/**
 * Cache of resolved message and parameter strings, keyed both by EventLog provider
 * identifier and by log source, each optionally qualified by event version.
 */
public interface MessageStringCache {

    /**
     * Gets a cached message string. The provider keyed entry is tried first, then the
     * log source keyed entry.
     *
     * @param resolutionKind     whether a message or a parameter string is looked up
     * @param providerIdentifier EventLog provider identifier, may be null
     * @param logSource          EventLog source, may be null
     * @param messageIdentifier  message identifier
     * @param eventVersion       event version, or null when not set
     * @return the cached message string, or empty if not cached
     */
    Optional<String> get(ResolutionKind resolutionKind, String providerIdentifier, String logSource,
                         long messageIdentifier, Integer eventVersion);

    /**
     * Caches a message string under the provider keyed and the log source keyed form,
     * for whichever of the two identifiers is present.
     *
     * @param resolutionKind     whether the string is a message or a parameter string
     * @param providerIdentifier EventLog provider identifier, may be null
     * @param logSource          EventLog source, may be null
     * @param messageIdentifier  message identifier
     * @param eventVersion       event version, or null when not set
     * @param messageString      the message string
     */
    void put(ResolutionKind resolutionKind, String providerIdentifier, String logSource, long messageIdentifier,
             Integer eventVersion, String messageString);

    /**
     * Invalidates all cache entries.
     */
    void invalidateAll();

    /**
     * Returns cache statistics.
     */
    CacheStats getStats();
}
