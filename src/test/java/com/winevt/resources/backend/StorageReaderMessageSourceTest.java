package com.winevt.resources.backend;

import com.winevt.resources.core.model.EnvironmentVariable;
import com.winevt.resources.core.model.EventLogProvider;
import com.winevt.resources.core.model.MessageFile;
import com.winevt.resources.core.model.MessageString;
import com.winevt.resources.core.model.MessageStringMapping;
import com.winevt.resources.core.model.WinevtContainerTypes;
import com.winevt.resources.store.ContainerIdentifier;
import com.winevt.resources.store.InMemoryAttributeContainerStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StorageReaderMessageSource Tests")
class StorageReaderMessageSourceTest {

    private static final String SCM_IDENTIFIER = "{555908d1-a6d7-4695-8e1e-26931d2012f4}";
    private static final String SCM_LOG_SOURCE = "Service Control Manager";

    private InMemoryAttributeContainerStore storage;
    private ContainerIdentifier servicesMui;

    @BeforeEach
    void setUp() {
        storage = new InMemoryAttributeContainerStore();
        storage.addAttributeContainer(WinevtContainerTypes.ENVIRONMENT_VARIABLE,
                new EnvironmentVariable("SystemRoot", "C:\\Windows"));
        storage.addAttributeContainer(WinevtContainerTypes.EVENTLOG_PROVIDER, EventLogProvider.builder()
                .identifier(SCM_IDENTIFIER)
                .logSource(SCM_LOG_SOURCE)
                .eventMessageFiles(List.of("%SystemRoot%\\system32\\services.exe"))
                .build());
        servicesMui = storage.addAttributeContainer(WinevtContainerTypes.EVENTLOG_MESSAGE_FILE,
                new MessageFile("\\Windows\\System32\\en-US\\services.exe.mui"));
    }

    private void addString(ContainerIdentifier messageFile, int lcid, long messageIdentifier, String text) {
        storage.addAttributeContainer(WinevtContainerTypes.EVENTLOG_MESSAGE_STRING, MessageString.builder()
                .messageFileIdentifier(messageFile)
                .languageIdentifier(lcid)
                .messageIdentifier(messageIdentifier)
                .text(text)
                .build());
    }

    private StorageReaderMessageSource newSource() {
        return new StorageReaderMessageSource(storage, 0x0409, "en-US");
    }

    @Test
    @DisplayName("Should only support storage readers holding EventLog providers")
    void isSupported() {
        assertTrue(StorageReaderMessageSource.isSupported(storage));
        assertFalse(StorageReaderMessageSource.isSupported(new InMemoryAttributeContainerStore()));
        assertFalse(StorageReaderMessageSource.isSupported(null));
    }

    @Nested
    @DisplayName("getMessageString")
    class MessageStringTests {

        @Test
        @DisplayName("Should resolve a message string by log source")
        void byLogSource() {
            addString(servicesMui, 0x0409, 7036, "The {0} service entered the {1} state.");

            assertEquals(Optional.of("The {0} service entered the {1} state."),
                    newSource().getMessageString(null, "service control manager", 7036, null));
        }

        @Test
        @DisplayName("Should resolve a message string by provider identifier")
        void byProviderIdentifier() {
            addString(servicesMui, 0x0409, 7036, "The {0} service entered the {1} state.");

            assertEquals(Optional.of("The {0} service entered the {1} state."),
                    newSource().getMessageString(SCM_IDENTIFIER.toUpperCase(), null, 7036, null));
        }

        @Test
        @DisplayName("Should apply the first matching WEVT_TEMPLATE mapping")
        void appliesMapping() {
            addString(servicesMui, 0x0409, 7036, "Unmapped");
            addString(servicesMui, 0x0409, 0x40001b7cL, "Mapped");
            addString(servicesMui, 0x0409, 0x40001b7dL, "Second mapping");
            storage.addAttributeContainer(WinevtContainerTypes.WEVT_TEMPLATE_EVENT,
                    new MessageStringMapping(servicesMui, SCM_IDENTIFIER, 7036, null, 0x40001b7cL));
            storage.addAttributeContainer(WinevtContainerTypes.WEVT_TEMPLATE_EVENT,
                    new MessageStringMapping(servicesMui, SCM_IDENTIFIER, 7036, null, 0x40001b7dL));

            assertEquals(Optional.of("Mapped"), newSource().getMessageString(SCM_IDENTIFIER, null, 7036, null));
        }

        @Test
        @DisplayName("Should select the mapping of the event version")
        void mappingByVersion() {
            addString(servicesMui, 0x0409, 0x40001b7cL, "Version 0");
            addString(servicesMui, 0x0409, 0x40001b7dL, "Version 1");
            storage.addAttributeContainer(WinevtContainerTypes.WEVT_TEMPLATE_EVENT,
                    new MessageStringMapping(servicesMui, SCM_IDENTIFIER, 7036, 0, 0x40001b7cL));
            storage.addAttributeContainer(WinevtContainerTypes.WEVT_TEMPLATE_EVENT,
                    new MessageStringMapping(servicesMui, SCM_IDENTIFIER, 7036, 1, 0x40001b7dL));

            assertEquals(Optional.of("Version 1"), newSource().getMessageString(SCM_IDENTIFIER, null, 7036, 1));
        }

        @Test
        @DisplayName("Should not apply mappings without a provider identifier")
        void noMappingByLogSource() {
            addString(servicesMui, 0x0409, 7036, "Unmapped");
            addString(servicesMui, 0x0409, 0x40001b7cL, "Mapped");
            storage.addAttributeContainer(WinevtContainerTypes.WEVT_TEMPLATE_EVENT,
                    new MessageStringMapping(servicesMui, SCM_IDENTIFIER, 7036, null, 0x40001b7cL));

            assertEquals(Optional.of("Unmapped"), newSource().getMessageString(null, SCM_LOG_SOURCE, 7036, null));
        }

        @Test
        @DisplayName("Should return empty for an unknown provider")
        void unknownProvider() {
            addString(servicesMui, 0x0409, 7036, "Message");

            assertTrue(newSource().getMessageString("{unknown}", "Unknown", 7036, null).isEmpty());
        }

        @Test
        @DisplayName("Should return empty when the storage holds no message strings")
        void noMessageStrings() {
            assertTrue(newSource().getMessageString(SCM_IDENTIFIER, null, 7036, null).isEmpty());
        }

        @Test
        @DisplayName("Should return empty when no message file of the provider is stored")
        void noMessageFiles() {
            ContainerIdentifier other = new ContainerIdentifier("windows_eventlog_message_file", 1);
            InMemoryAttributeContainerStore withoutFiles = new InMemoryAttributeContainerStore();
            withoutFiles.addAttributeContainer(WinevtContainerTypes.EVENTLOG_PROVIDER, EventLogProvider.builder()
                    .logSource("Application Error")
                    .eventMessageFiles(List.of("%SystemRoot%\\System32\\wer.dll"))
                    .build());
            withoutFiles.addAttributeContainer(WinevtContainerTypes.EVENTLOG_MESSAGE_STRING, MessageString.builder()
                    .messageFileIdentifier(other).languageIdentifier(0x0409).messageIdentifier(1000)
                    .text("Faulting application {0}").build());

            assertTrue(new StorageReaderMessageSource(withoutFiles, 0x0409, "en-US")
                    .getMessageString(null, "Application Error", 1000, null).isEmpty());
        }

        @Test
        @DisplayName("Should ignore strings of other message files and languages")
        void otherFilesAndLanguages() {
            ContainerIdentifier other = storage.addAttributeContainer(WinevtContainerTypes.EVENTLOG_MESSAGE_FILE,
                    new MessageFile("\\Windows\\System32\\wevtapi.dll"));
            addString(other, 0x0409, 7036, "Wrong file");
            addString(servicesMui, 0x0407, 7036, "Falsche Sprache");
            ContainerIdentifier germanMui = storage.addAttributeContainer(WinevtContainerTypes.EVENTLOG_MESSAGE_FILE,
                    new MessageFile("\\Windows\\System32\\de-DE\\services.exe.mui"));
            addString(germanMui, 0x0407, 7036, "Der Dienst {0} befindet sich jetzt im Status {1}.");

            assertTrue(newSource().getMessageString(SCM_IDENTIFIER, null, 7036, null).isEmpty());
            assertEquals(Optional.of("Der Dienst {0} befindet sich jetzt im Status {1}."),
                    new StorageReaderMessageSource(storage, 0x0407, "de-DE")
                            .getMessageString(SCM_IDENTIFIER, null, 7036, null));
        }
    }

    @Nested
    @DisplayName("getParameterString")
    class ParameterStringTests {

        @Test
        @DisplayName("Should use the default parameter message files when the provider defines none")
        void defaultParameterFiles() {
            ContainerIdentifier kernel32 = storage.addAttributeContainer(
                    WinevtContainerTypes.EVENTLOG_MESSAGE_FILE, new MessageFile("\\Windows\\System32\\kernel32.dll"));
            addString(kernel32, 0x0409, 1833, "Success");

            assertEquals(Optional.of("Success"), newSource().getParameterString(SCM_IDENTIFIER, null, 1833));
        }

        @Test
        @DisplayName("Should not apply WEVT_TEMPLATE mappings to parameters")
        void noMapping() {
            addString(servicesMui, 0x0409, 7036, "Parameter");
            addString(servicesMui, 0x0409, 0x40001b7cL, "Mapped");
            storage.addAttributeContainer(WinevtContainerTypes.WEVT_TEMPLATE_EVENT,
                    new MessageStringMapping(servicesMui, SCM_IDENTIFIER, 7036, null, 0x40001b7cL));

            assertEquals(Optional.of("Parameter"), newSource().getParameterString(SCM_IDENTIFIER, null, 7036));
        }

        @Test
        @DisplayName("Should use the parameter message files of the provider")
        void providerParameterFiles() {
            EventLogProvider provider = EventLogProvider.builder()
                    .eventMessageFiles(List.of("%SystemRoot%\\System32\\services.exe"))
                    .parameterMessageFiles(List.of("%SystemRoot%\\System32\\MsObjs.dll"))
                    .build();

            assertEquals(List.of("%SystemRoot%\\System32\\MsObjs.dll"),
                    List.copyOf(AbstractContainerMessageSource.getParameterMessageFiles(provider)));
        }

        @Test
        @DisplayName("Should append the default files after the event message files")
        void defaultParameterFileOrder() {
            EventLogProvider provider = EventLogProvider.builder()
                    .eventMessageFiles(List.of("%SystemRoot%\\System32\\services.exe"))
                    .build();

            assertEquals(List.of(
                            "%SystemRoot%\\System32\\services.exe",
                            "%SystemRoot%\\System32\\MsObjs.dll",
                            "%SystemRoot%\\System32\\kernel32.dll"),
                    List.copyOf(AbstractContainerMessageSource.getParameterMessageFiles(provider)));
        }
    }

    @Test
    @DisplayName("Closing should leave the storage reader usable")
    void closeKeepsStorage() {
        addString(servicesMui, 0x0409, 7036, "Message");
        StorageReaderMessageSource source = newSource();

        source.close();

        assertTrue(storage.hasAttributeContainers(WinevtContainerTypes.EVENTLOG_MESSAGE_STRING));
        assertEquals("storage", source.getName());
    }
}
