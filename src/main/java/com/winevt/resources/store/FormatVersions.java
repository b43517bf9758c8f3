package com.winevt.resources.store;

/**
 * Format version floors of an attribute container store.
 *
 * @param formatVersion           version written by this implementation
 * @param appendCompatibleVersion oldest version that can be appended to as is
 * @param upgradeCompatibleVersion oldest version that can be upgraded for writing
 * @param readCompatibleVersion   oldest version that can be read
 */
public record FormatVersions(
        int formatVersion,
        int appendCompatibleVersion,
        int upgradeCompatibleVersion,
        int readCompatibleVersion) {

    public FormatVersions {
        if (readCompatibleVersion > formatVersion
                || appendCompatibleVersion > formatVersion
                || upgradeCompatibleVersion > formatVersion) {
            throw new IllegalArgumentException("Compatible versions cannot exceed the format version");
        }
    }

    /**
     * Versions where every floor equals the format version.
     */
    public static FormatVersions of(int formatVersion) {
        return new FormatVersions(formatVersion, formatVersion, formatVersion, formatVersion);
    }
}
