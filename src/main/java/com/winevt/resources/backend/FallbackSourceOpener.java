package com.winevt.resources.backend;

import com.winevt.resources.sqlite.DatabaseIntegrityException;
import com.winevt.resources.sqlite.ResourceDatabaseException;
import com.winevt.resources.sqlite.UnsupportedDatabaseFormatException;
import com.winevt.resources.sqlite.WinevtResourcesDatabaseReader;
import com.winevt.resources.store.WinevtResourcesContainerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens the EventLog resources database in the data location as fallback source.
 *
 * <p>The file is first opened as legacy flat database. When that fails, or the file is not
 * in the legacy format, it is opened read-only as versioned resource store. When neither
 * works the {@link UnavailableMessageSource} is returned. A legacy database with duplicate
 * metadata is corrupt and its {@link DatabaseIntegrityException} is propagated.</p>
 */
public class FallbackSourceOpener {
    private static final Logger log = LoggerFactory.getLogger(FallbackSourceOpener.class);

    private final Path dataLocation;
    private final String databaseName;
    private final int lcid;
    private final String languageTag;

    public FallbackSourceOpener(Path dataLocation, String databaseName, int lcid, String languageTag) {
        this.dataLocation = dataLocation;
        this.databaseName = databaseName;
        this.lcid = lcid;
        this.languageTag = languageTag;
    }

    public Path getDatabasePath() {
        return dataLocation != null ? dataLocation.resolve(databaseName) : null;
    }

    /**
     * Opens the fallback source.
     *
     * @return the opened source, or {@link UnavailableMessageSource#INSTANCE}
     */
    public MessageStringSource open() {
        if (dataLocation == null) {
            log.warn("No data location configured, EventLog message strings cannot be resolved");
            return UnavailableMessageSource.INSTANCE;
        }

        log.warn("Falling back to {}. Please make sure the Windows EventLog message strings in the "
                + "database correspond to those in the EventLog files.", databaseName);

        Path databasePath = getDatabasePath();
        if (!Files.isRegularFile(databasePath)) {
            log.warn("Missing EventLog resources database: {}", databasePath);
            return UnavailableMessageSource.INSTANCE;
        }

        WinevtResourcesDatabaseReader databaseReader = newDatabaseReader();
        try {
            if (databaseReader.open(databasePath)) {
                log.info("Opened EventLog resources database: {}", databasePath);
                return new LegacyDatabaseMessageSource(databaseReader, lcid);
            }
        } catch (UnsupportedDatabaseFormatException e) {
            log.debug("Not a legacy EventLog resources database: {} ({})", databasePath, e.getMessage());
        } catch (DatabaseIntegrityException e) {
            throw e;
        } catch (ResourceDatabaseException e) {
            log.debug("Unable to read legacy EventLog resources database: {}", databasePath, e);
        }

        WinevtResourcesContainerStore containerStore = newContainerStore();
        try {
            containerStore.open(databasePath, true);
        } catch (IOException | ResourceDatabaseException e) {
            log.warn("Unable to open EventLog resources database: {}", databasePath, e);
            return UnavailableMessageSource.INSTANCE;
        }
        log.info("Opened EventLog resources store: {} (format version: {}, string format: {})",
                databasePath, containerStore.getFormatVersion(), containerStore.getStringFormat().getValue());
        return new ContainerStoreMessageSource(containerStore, lcid, languageTag);
    }

    protected WinevtResourcesDatabaseReader newDatabaseReader() {
        return new WinevtResourcesDatabaseReader();
    }

    protected WinevtResourcesContainerStore newContainerStore() {
        return new WinevtResourcesContainerStore();
    }
}
