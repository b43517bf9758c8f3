package com.winevt.resources.store;

import com.winevt.resources.core.model.EventLogProvider;
import com.winevt.resources.core.model.MessageFile;
import com.winevt.resources.core.model.MessageString;
import com.winevt.resources.core.model.MessageTable;
import com.winevt.resources.core.model.StringFormat;
import com.winevt.resources.core.model.WinevtContainerTypes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WinevtResourcesContainerStore Tests")
class WinevtResourcesContainerStoreTest {

    @TempDir
    Path tempDir;

    private Path storePath() {
        return tempDir.resolve("winevt-rc.db");
    }

    private void setMetadata(String name, String value) throws Exception {
        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + storePath());
             PreparedStatement statement = connection.prepareStatement(
                     "UPDATE metadata SET value = ? WHERE name = ?")) {
            statement.setString(1, value);
            statement.setString(2, name);
            assertEquals(1, statement.executeUpdate());
        }
    }

    private void createEmptyStore() throws Exception {
        WinevtResourcesContainerStore store = new WinevtResourcesContainerStore();
        store.open(storePath(), false);
        store.close();
    }

    @Nested
    @DisplayName("Metadata")
    class MetadataTests {

        @Test
        @DisplayName("Should write format metadata when creating a store")
        void writesMetadata() throws Exception {
            createEmptyStore();

            try (WinevtResourcesContainerStore store = new WinevtResourcesContainerStore()) {
                store.open(storePath(), true);

                assertEquals(20240929, store.getFormatVersion());
                assertEquals("json", store.getSerializationFormat());
                assertEquals(StringFormat.WRC, store.getStringFormat());
            }
        }

        @Test
        @DisplayName("Should record the string format chosen for a new store")
        void recordsStringFormat() throws Exception {
            WinevtResourcesContainerStore created = new WinevtResourcesContainerStore(StringFormat.PEP3101);
            created.open(storePath(), false);
            created.close();

            try (WinevtResourcesContainerStore store = new WinevtResourcesContainerStore()) {
                store.open(storePath(), true);
                assertEquals(StringFormat.PEP3101, store.getStringFormat());
            }
        }

        @Test
        @DisplayName("Should reject an unsupported string format")
        void rejectsUnsupportedStringFormat() throws Exception {
            createEmptyStore();
            setMetadata("string_format", "printf");

            WinevtResourcesContainerStore store = new WinevtResourcesContainerStore();
            StorageFormatException e = assertThrows(StorageFormatException.class,
                    () -> store.open(storePath(), true));
            assertEquals("Unsupported string format: printf", e.getMessage());
            assertFalse(store.isOpen());
        }

        @Test
        @DisplayName("Should reject a format version that is too old to read")
        void rejectsTooOldVersion() throws Exception {
            createEmptyStore();
            setMetadata("format_version", "20230226");

            WinevtResourcesContainerStore store = new WinevtResourcesContainerStore();
            StorageFormatException e = assertThrows(StorageFormatException.class,
                    () -> store.open(storePath(), true));
            assertTrue(e.getMessage().contains("too old"));
        }

        @Test
        @DisplayName("Should reject a format version that is too new")
        void rejectsTooNewVersion() throws Exception {
            createEmptyStore();
            setMetadata("format_version", "20991231");

            WinevtResourcesContainerStore store = new WinevtResourcesContainerStore();
            StorageFormatException e = assertThrows(StorageFormatException.class,
                    () -> store.open(storePath(), true));
            assertTrue(e.getMessage().contains("too new"));
        }

        @Test
        @DisplayName("Should reject an unsupported serialization format")
        void rejectsSerializationFormat() throws Exception {
            createEmptyStore();
            setMetadata("serialization_format", "protobuf");

            WinevtResourcesContainerStore store = new WinevtResourcesContainerStore();
            assertThrows(StorageFormatException.class, () -> store.open(storePath(), true));
        }

        @Test
        @DisplayName("Should fail to open a missing store read-only")
        void rejectsMissingStore() {
            WinevtResourcesContainerStore store = new WinevtResourcesContainerStore();
            assertThrows(IOException.class, () -> store.open(storePath(), true));
        }

        @Test
        @DisplayName("Should fail to close a store not opened")
        void closeWithoutOpenFails() {
            WinevtResourcesContainerStore store = new WinevtResourcesContainerStore();
            assertThrows(IllegalStateException.class, store::close);
        }
    }

    @Nested
    @DisplayName("Containers")
    class ContainerTests {

        @Test
        @DisplayName("Should store and query containers with list attributes")
        void storesProviders() throws Exception {
            try (WinevtResourcesContainerStore store = new WinevtResourcesContainerStore()) {
                store.open(storePath(), false);
                store.addAttributeContainer(WinevtContainerTypes.WINEVTRC_EVENTLOG_PROVIDER,
                        EventLogProvider.builder()
                                .identifier("{f0db7ef8-b6f3-4005-9937-feb77b9e1b43}")
                                .logSources(List.of("Application Error", "Windows Error Reporting"))
                                .eventMessageFiles(List.of("%SystemRoot%\\System32\\wer.dll"))
                                .build());
            }

            try (WinevtResourcesContainerStore store = new WinevtResourcesContainerStore()) {
                store.open(storePath(), true);

                assertTrue(store.hasAttributeContainers(WinevtContainerTypes.WINEVTRC_EVENTLOG_PROVIDER));
                assertFalse(store.hasAttributeContainers(WinevtContainerTypes.WINEVTRC_MESSAGE_STRING));

                List<EventLogProvider> providers = store.getAttributeContainers(
                        WinevtContainerTypes.WINEVTRC_EVENTLOG_PROVIDER);
                assertEquals(1, providers.size());
                EventLogProvider provider = providers.get(0);
                assertEquals("winevtrc_eventlog_provider.1", provider.getIdentifier().toString());
                assertEquals(List.of("Application Error", "Windows Error Reporting"), provider.getLogSources());
                assertTrue(provider.getEventMessageFiles().contains("%SystemRoot%\\System32\\wer.dll"));
                assertTrue(provider.getParameterMessageFiles().isEmpty());
            }
        }

        @Test
        @DisplayName("Should filter containers on identifier and integer attributes")
        void filtersOnIdentifiers() throws Exception {
            try (WinevtResourcesContainerStore store = new WinevtResourcesContainerStore()) {
                store.open(storePath(), false);
                ContainerIdentifier fileIdentifier = store.addAttributeContainer(
                        WinevtContainerTypes.WINEVTRC_MESSAGE_FILE,
                        new MessageFile("%SystemRoot%\\System32\\services.exe"));
                ContainerIdentifier english = store.addAttributeContainer(
                        WinevtContainerTypes.WINEVTRC_MESSAGE_TABLE, new MessageTable(fileIdentifier, 0x0409));
                ContainerIdentifier german = store.addAttributeContainer(
                        WinevtContainerTypes.WINEVTRC_MESSAGE_TABLE, new MessageTable(fileIdentifier, 0x0407));
                store.addAttributeContainer(WinevtContainerTypes.WINEVTRC_MESSAGE_STRING, MessageString.builder()
                        .messageTableIdentifier(english).languageIdentifier(0x0409)
                        .messageIdentifier(7036).text("The %1 service entered the %2 state.").build());
                store.addAttributeContainer(WinevtContainerTypes.WINEVTRC_MESSAGE_STRING, MessageString.builder()
                        .messageTableIdentifier(german).languageIdentifier(0x0407)
                        .messageIdentifier(7036).text("Der Dienst %1 befindet sich jetzt im Status %2.").build());

                List<MessageTable> tables = store.getAttributeContainers(WinevtContainerTypes.WINEVTRC_MESSAGE_TABLE,
                        ContainerFilter.where("_message_file_identifier", fileIdentifier)
                                .and("language_identifier", 0x0407));
                assertEquals(1, tables.size());
                assertEquals(german, tables.get(0).getIdentifier());
                assertEquals(fileIdentifier, tables.get(0).getMessageFileIdentifier());

                List<MessageString> strings = store.getAttributeContainers(
                        WinevtContainerTypes.WINEVTRC_MESSAGE_STRING,
                        ContainerFilter.where("_message_table_identifier", english)
                                .and("message_identifier", 7036L));
                assertEquals(1, strings.size());
                assertEquals("The %1 service entered the %2 state.", strings.get(0).getText());

                assertEquals(german, store.getAttributeContainerByIdentifier(
                        WinevtContainerTypes.WINEVTRC_MESSAGE_TABLE, german).orElseThrow().getIdentifier());
            }
        }

        @Test
        @DisplayName("Should reject filters on unknown attributes")
        void rejectsUnknownAttribute() throws Exception {
            try (WinevtResourcesContainerStore store = new WinevtResourcesContainerStore()) {
                store.open(storePath(), false);
                store.addAttributeContainer(WinevtContainerTypes.WINEVTRC_MESSAGE_FILE,
                        new MessageFile("%SystemRoot%\\System32\\services.exe"));

                assertThrows(IllegalArgumentException.class, () -> store.getAttributeContainers(
                        WinevtContainerTypes.WINEVTRC_MESSAGE_FILE, ContainerFilter.where("path; DROP", "x")));
            }
        }

        @Test
        @DisplayName("Should reject unregistered container types")
        void rejectsUnregisteredType() throws Exception {
            try (WinevtResourcesContainerStore store = new WinevtResourcesContainerStore()) {
                store.open(storePath(), false);
                assertThrows(IllegalArgumentException.class,
                        () -> store.getAttributeContainers(WinevtContainerTypes.EVENTLOG_PROVIDER));
            }
        }

        @Test
        @DisplayName("Should refuse writes to a store opened read-only")
        void refusesReadOnlyWrites() throws Exception {
            createEmptyStore();
            try (WinevtResourcesContainerStore store = new WinevtResourcesContainerStore()) {
                store.open(storePath(), true);
                assertThrows(IllegalStateException.class, () -> store.addAttributeContainer(
                        WinevtContainerTypes.WINEVTRC_MESSAGE_FILE, new MessageFile("wevtapi.dll")));
            }
        }
    }
}
