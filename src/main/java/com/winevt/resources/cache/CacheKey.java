package com.winevt.resources.cache;

import com.winevt.resources.core.model.ResolutionKind;

import java.util.Objects;

/**
 * Key of a cached string: whether it is an event message or a parameter string, an
 * EventLog provider identifier or a log source, the message identifier and, when supplied,
 * the event version.
 *
 * <p>The string form of a message key is
 * {@code <identifier>:0x<message id as 8 hex digits>[:<version>]}; parameter keys are
 * prefixed with {@code parameter:}.</p>
 *
 * @param resolutionKind    whether the cached string is a message or a parameter string
 * @param kind              whether the identifier is a provider identifier or a log source
 * @param identifier        the provider identifier or log source
 * @param messageIdentifier the message identifier
 * @param eventVersion      the event version, or null when not supplied
 */
public record CacheKey(ResolutionKind resolutionKind, Kind kind, String identifier, long messageIdentifier,
                       Integer eventVersion) {

    public enum Kind {
        PROVIDER,
        LOG_SOURCE
    }

    public CacheKey {
        Objects.requireNonNull(resolutionKind, "resolutionKind must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(identifier, "identifier must not be null");
    }

    public static CacheKey forProvider(ResolutionKind resolutionKind, String providerIdentifier,
                                       long messageIdentifier, Integer eventVersion) {
        return new CacheKey(resolutionKind, Kind.PROVIDER, providerIdentifier, messageIdentifier, eventVersion);
    }

    public static CacheKey forLogSource(ResolutionKind resolutionKind, String logSource,
                                        long messageIdentifier, Integer eventVersion) {
        return new CacheKey(resolutionKind, Kind.LOG_SOURCE, logSource, messageIdentifier, eventVersion);
    }

    @Override
    public String toString() {
        String key = String.format("%s:0x%08x", identifier, messageIdentifier);
        if (eventVersion != null) {
            key = key + ":" + eventVersion;
        }
        return resolutionKind == ResolutionKind.PARAMETER ? "parameter:" + key : key;
    }
}
