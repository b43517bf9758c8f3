package com.winevt.resources.backend;

import com.winevt.resources.core.model.EnvironmentVariable;
import com.winevt.resources.core.model.EventLogProvider;
import com.winevt.resources.core.model.MessageFile;
import com.winevt.resources.store.AttributeContainerStore;
import com.winevt.resources.store.ContainerIdentifier;
import com.winevt.resources.windows.WindowsPathHelper;
import com.winevt.resources.windows.WindowsSystemPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Lookup state read once from a container store: environment variables, the provider
 * index (by identifier and by log source, both lower-cased) and the message file index
 * (by lower-cased {@code path\filename}).
 *
 * <p>Each piece is read on first use and kept for the lifetime of the index.</p>
 */
public class ResourceIndex {
    private static final Logger log = LoggerFactory.getLogger(ResourceIndex.class);

    private final AttributeContainerStore store;
    private final ContainerTypeSet types;
    private final String languageTag;

    private List<EnvironmentVariable> environmentVariables;
    private boolean environmentVariablesInitialized;

    private final Map<String, EventLogProvider> providersByIdentifier = new HashMap<>();
    private final Map<String, EventLogProvider> providersByLogSource = new HashMap<>();
    private boolean providersInitialized;

    private final Map<String, ContainerIdentifier> messageFiles = new HashMap<>();
    private boolean messageFilesInitialized;

    public ResourceIndex(AttributeContainerStore store, ContainerTypeSet types, String languageTag) {
        this.store = store;
        this.types = types;
        this.languageTag = languageTag;
    }

    /**
     * Finds a provider by identifier, falling back to log source. Both are matched
     * case-insensitively.
     *
     * @param providerIdentifier provider identifier, may be null
     * @param logSource          log source, may be null
     * @return the provider, or a lookup with a null provider, and the lookup key used last
     */
    public ProviderLookup findProvider(String providerIdentifier, String logSource) {
        ensureProviders();

        EventLogProvider provider = null;
        String lookupKey = null;

        if (providerIdentifier != null && !providerIdentifier.isEmpty()) {
            lookupKey = providerIdentifier.toLowerCase(Locale.ROOT);
            provider = providersByIdentifier.get(lookupKey);
        }
        if (provider == null && logSource != null) {
            lookupKey = logSource.toLowerCase(Locale.ROOT);
            provider = providersByLogSource.get(lookupKey);
        }
        return new ProviderLookup(provider, lookupKey);
    }

    /**
     * Resolves Windows message file paths to message file identifiers.
     *
     * <p>Every path is looked up as is and as the {@code <language-tag>\<filename>.mui}
     * overlay; each match contributes its identifier.</p>
     *
     * @param windowsPaths message file paths as defined by a provider
     * @return the identifiers of matching message files, in path order
     */
    public Set<ContainerIdentifier> getMessageFileIdentifiers(Collection<String> windowsPaths) {
        ensureMessageFiles();

        Set<ContainerIdentifier> identifiers = new LinkedHashSet<>();
        for (String windowsPath : windowsPaths) {
            WindowsSystemPath systemPath = WindowsPathHelper.getWindowsSystemPath(
                    windowsPath, getEnvironmentVariables());
            if (systemPath == null) {
                continue;
            }
            ContainerIdentifier identifier = messageFiles.get(systemPath.lookupPath());
            if (identifier != null) {
                identifiers.add(identifier);
            }
            identifier = messageFiles.get(systemPath.muiLookupPath(languageTag));
            if (identifier != null) {
                identifiers.add(identifier);
            }
        }
        return identifiers;
    }

    public List<EnvironmentVariable> getEnvironmentVariables() {
        if (!environmentVariablesInitialized) {
            if (types.environmentVariableType() != null) {
                environmentVariables = store.getAttributeContainers(types.environmentVariableType());
            } else {
                environmentVariables = List.of();
            }
            environmentVariablesInitialized = true;
        }
        return environmentVariables;
    }

    private void ensureProviders() {
        if (providersInitialized) {
            return;
        }
        if (store.hasAttributeContainers(types.providerType())) {
            for (EventLogProvider provider : store.getAttributeContainers(types.providerType())) {
                if (provider.getProviderIdentifier() != null && !provider.getProviderIdentifier().isEmpty()) {
                    providersByIdentifier.put(provider.getProviderIdentifier().toLowerCase(Locale.ROOT), provider);
                }
                for (String logSource : provider.getLogSources()) {
                    providersByLogSource.put(logSource.toLowerCase(Locale.ROOT), provider);
                }
            }
        }
        providersInitialized = true;
        log.debug("Indexed {} provider identifiers and {} log sources from {}",
                providersByIdentifier.size(), providersByLogSource.size(), types.providerType().getName());
    }

    private void ensureMessageFiles() {
        if (messageFilesInitialized) {
            return;
        }
        if (store.hasAttributeContainers(types.messageFileType())) {
            for (MessageFile messageFile : store.getAttributeContainers(types.messageFileType())) {
                WindowsSystemPath systemPath = WindowsPathHelper.getWindowsSystemPath(
                        messageFile.getWindowsPath(), getEnvironmentVariables());
                if (systemPath != null) {
                    messageFiles.put(systemPath.lookupPath(), messageFile.getIdentifier());
                }
            }
        }
        messageFilesInitialized = true;
        log.debug("Indexed {} message files from {}", messageFiles.size(), types.messageFileType().getName());
    }

    /**
     * Result of a provider lookup.
     *
     * @param provider  the provider, or null if none matched
     * @param lookupKey the lower-cased key used for the last lookup attempt
     */
    public record ProviderLookup(EventLogProvider provider, String lookupKey) {

        public boolean isFound() {
            return provider != null;
        }
    }
}
