package com.winevt.resources.backend;

import com.winevt.resources.sqlite.WinevtResourcesDatabaseReader;

import java.util.Optional;

/**
 * Resolves message strings from the legacy flat resources database by log source.
 *
 * <p>The legacy database holds no provider identifiers, no WEVT_TEMPLATE mappings and no
 * parameter message files, so parameter strings are never resolved from it.</p>
 */
public class LegacyDatabaseMessageSource implements MessageStringSource {

    public static final String NAME = "legacy-database";

    private final WinevtResourcesDatabaseReader databaseReader;
    private final int lcid;

    public LegacyDatabaseMessageSource(WinevtResourcesDatabaseReader databaseReader, int lcid) {
        this.databaseReader = databaseReader;
        this.lcid = lcid;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Optional<String> getMessageString(String providerIdentifier, String logSource, long messageIdentifier,
                                             Integer eventVersion) {
        return databaseReader.getMessage(logSource, lcid, messageIdentifier);
    }

    @Override
    public Optional<String> getParameterString(String providerIdentifier, String logSource, long messageIdentifier) {
        return Optional.empty();
    }

    @Override
    public void close() {
        databaseReader.close();
    }

    @Override
    public String toString() {
        return NAME;
    }
}
