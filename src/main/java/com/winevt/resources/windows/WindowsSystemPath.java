package com.winevt.resources.windows;

import java.util.Locale;

/**
 * A normalized Windows system path split into directory and filename.
 *
 * @param path     directory path without drive letter, such as {@code \Windows\System32}
 * @param filename the filename
 */
public record WindowsSystemPath(String path, String filename) {

    /**
     * Lower-cased {@code path\filename} used to index message files.
     */
    public String lookupPath() {
        return (path + "\\" + filename).toLowerCase(Locale.ROOT);
    }

    /**
     * Lower-cased {@code path\<language-tag>\filename.mui} of the localized resource overlay.
     *
     * @param languageTag language tag such as {@code en-US}
     */
    public String muiLookupPath(String languageTag) {
        return (path + "\\" + languageTag + "\\" + filename + ".mui").toLowerCase(Locale.ROOT);
    }
}
