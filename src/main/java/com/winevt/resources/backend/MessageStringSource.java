package com.winevt.resources.backend;

import java.util.Optional;

/**
 * A backend that resolves EventLog message and parameter identifiers to strings.
 * Misses are reported as empty results, never as exceptions.
 */
public interface MessageStringSource extends AutoCloseable {

    /**
     * Short name of the source, used in metrics and diagnostics.
     */
    String getName();

    /**
     * Resolves an event message string.
     *
     * @param providerIdentifier EventLog provider identifier (GUID), may be null
     * @param logSource          EventLog source, such as "Application Error", may be null
     * @param messageIdentifier  message identifier
     * @param eventVersion       event version, or null when not set
     * @return the message string, or empty if not available
     */
    Optional<String> getMessageString(String providerIdentifier, String logSource, long messageIdentifier,
                                      Integer eventVersion);

    /**
     * Resolves a parameter string.
     *
     * @param providerIdentifier EventLog provider identifier (GUID), may be null
     * @param logSource          EventLog source, may be null
     * @param messageIdentifier  parameter identifier
     * @return the parameter string, or empty if not available
     */
    Optional<String> getParameterString(String providerIdentifier, String logSource, long messageIdentifier);

    /**
     * Releases resources owned by the source.
     */
    @Override
    void close();
}
