package com.winevt.resources.store;

import com.winevt.resources.core.model.StringFormat;
import com.winevt.resources.core.model.WinevtContainerTypes;

import java.util.Map;

/**
 * Versioned Windows EventLog resources store.
 *
 * <p>Holds providers, message files, message tables, message strings and string mappings
 * as attribute containers. Opening checks the format version floors and the
 * {@code string_format} metadata value.</p>
 */
public class WinevtResourcesContainerStore extends SqliteAttributeContainerStore {

    static final int FORMAT_VERSION = 20240929;

    private StringFormat stringFormat;

    /**
     * Creates a store whose new files are written in the Windows resource string format.
     */
    public WinevtResourcesContainerStore() {
        this(StringFormat.WRC);
    }

    /**
     * @param stringFormat string format recorded when a new store is created
     */
    public WinevtResourcesContainerStore(StringFormat stringFormat) {
        super(FormatVersions.of(FORMAT_VERSION));
        this.stringFormat = stringFormat;
        registerContainerTypes(WinevtContainerTypes.WINEVTRC_TYPES);
    }

    public StringFormat getStringFormat() {
        return stringFormat;
    }

    @Override
    protected void readAndCheckStorageMetadata(Map<String, String> metadata, boolean checkReadableOnly)
            throws StorageFormatException {
        super.readAndCheckStorageMetadata(metadata, checkReadableOnly);

        String value = metadata.get("string_format");
        StringFormat format = StringFormat.fromValue(value);
        if (format == null) {
            throw new StorageFormatException("Unsupported string format: " + value);
        }
        this.stringFormat = format;
    }

    @Override
    protected Map<String, String> getAdditionalMetadata() {
        return Map.of("string_format", stringFormat.getValue());
    }
}
