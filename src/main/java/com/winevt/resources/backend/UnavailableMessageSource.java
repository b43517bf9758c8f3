package com.winevt.resources.backend;

import java.util.Optional;

/**
 * Source used when neither a case storage nor a fallback database is available.
 * Every lookup is a miss.
 */
public final class UnavailableMessageSource implements MessageStringSource {

    public static final String NAME = "unavailable";

    public static final UnavailableMessageSource INSTANCE = new UnavailableMessageSource();

    private UnavailableMessageSource() {
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Optional<String> getMessageString(String providerIdentifier, String logSource, long messageIdentifier,
                                             Integer eventVersion) {
        return Optional.empty();
    }

    @Override
    public Optional<String> getParameterString(String providerIdentifier, String logSource, long messageIdentifier) {
        return Optional.empty();
    }

    @Override
    public void close() {
        // nothing to release
    }

    @Override
    public String toString() {
        return NAME;
    }
}
