package com.winevt.resources.core.model;

import com.winevt.resources.store.AbstractAttributeContainer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Windows EventLog provider (publisher).
 * Identified by a GUID and/or one or more legacy log source names; references its
 * message files by unresolved Windows paths.
 *
 * <p>Message file path sets keep the order in which paths were defined.</p>
 */
public class EventLogProvider extends AbstractAttributeContainer {
    private final String identifier;
    private final String additionalIdentifier;
    private final String name;
    private final List<String> logSources;
    private final List<String> logTypes;
    private final Set<String> categoryMessageFiles;
    private final Set<String> eventMessageFiles;
    private final Set<String> parameterMessageFiles;
    private final String windowsVersion;

    private EventLogProvider(Builder builder) {
        this.identifier = builder.identifier;
        this.additionalIdentifier = builder.additionalIdentifier;
        this.name = builder.name;
        this.logSources = List.copyOf(builder.logSources);
        this.logTypes = List.copyOf(builder.logTypes);
        this.categoryMessageFiles = Collections.unmodifiableSet(builder.categoryMessageFiles);
        this.eventMessageFiles = Collections.unmodifiableSet(builder.eventMessageFiles);
        this.parameterMessageFiles = Collections.unmodifiableSet(builder.parameterMessageFiles);
        this.windowsVersion = builder.windowsVersion;
    }

    /**
     * Provider GUID, or null for providers only known by log source.
     */
    public String getProviderIdentifier() {
        return identifier;
    }

    public String getAdditionalIdentifier() {
        return additionalIdentifier;
    }

    public String getName() {
        return name;
    }

    public List<String> getLogSources() {
        return logSources;
    }

    public List<String> getLogTypes() {
        return logTypes;
    }

    public Set<String> getCategoryMessageFiles() {
        return categoryMessageFiles;
    }

    public Set<String> getEventMessageFiles() {
        return eventMessageFiles;
    }

    public Set<String> getParameterMessageFiles() {
        return parameterMessageFiles;
    }

    public String getWindowsVersion() {
        return windowsVersion;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EventLogProvider that = (EventLogProvider) o;
        return Objects.equals(identifier, that.identifier)
                && Objects.equals(name, that.name)
                && logSources.equals(that.logSources);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identifier, name, logSources);
    }

    @Override
    public String toString() {
        return "EventLogProvider{" +
                "identifier='" + identifier + '\'' +
                ", name='" + name + '\'' +
                ", logSources=" + logSources +
                ", eventMessageFiles=" + eventMessageFiles +
                '}';
    }

    public static class Builder {
        private String identifier;
        private String additionalIdentifier;
        private String name;
        private List<String> logSources = List.of();
        private List<String> logTypes = List.of();
        private final Set<String> categoryMessageFiles = new LinkedHashSet<>();
        private final Set<String> eventMessageFiles = new LinkedHashSet<>();
        private final Set<String> parameterMessageFiles = new LinkedHashSet<>();
        private String windowsVersion;

        public Builder identifier(String identifier) {
            this.identifier = identifier;
            return this;
        }

        public Builder additionalIdentifier(String additionalIdentifier) {
            this.additionalIdentifier = additionalIdentifier;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder logSources(List<String> logSources) {
            this.logSources = logSources != null ? logSources : List.of();
            return this;
        }

        public Builder logSource(String logSource) {
            List<String> extended = new ArrayList<>(logSources);
            extended.add(logSource);
            this.logSources = extended;
            return this;
        }

        public Builder logTypes(List<String> logTypes) {
            this.logTypes = logTypes != null ? logTypes : List.of();
            return this;
        }

        public Builder categoryMessageFiles(Collection<String> paths) {
            addAll(categoryMessageFiles, paths);
            return this;
        }

        public Builder eventMessageFiles(Collection<String> paths) {
            addAll(eventMessageFiles, paths);
            return this;
        }

        public Builder parameterMessageFiles(Collection<String> paths) {
            addAll(parameterMessageFiles, paths);
            return this;
        }

        public Builder windowsVersion(String windowsVersion) {
            this.windowsVersion = windowsVersion;
            return this;
        }

        private static void addAll(Set<String> target, Collection<String> paths) {
            if (paths != null) {
                target.addAll(paths);
            }
        }

        public EventLogProvider build() {
            return new EventLogProvider(this);
        }
    }
}
