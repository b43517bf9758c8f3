package com.winevt.resources.api;

import com.winevt.resources.cache.CacheConfig;
import com.winevt.resources.windows.WindowsLanguageHelper;

import java.nio.file.Path;

/**
 * Options for Windows EventLog message string resolution.
 * Configures the data location of the fallback database, the language and caching.
 */
public class ResolverOptions {

    public static final int DEFAULT_LCID = 0x0409;
    public static final String DEFAULT_DATABASE_NAME = "winevt-rc.db";

    private final Path dataLocation;
    private final int lcid;
    private final String languageTag;
    private final CacheConfig cacheConfig;
    private final String databaseName;

    private ResolverOptions(Builder builder, String languageTag) {
        this.dataLocation = builder.dataLocation;
        this.lcid = builder.lcid;
        this.languageTag = languageTag;
        this.cacheConfig = builder.cacheConfig;
        this.databaseName = builder.databaseName;
    }

    /**
     * Directory that holds the fallback resources database, or null if none.
     */
    public Path getDataLocation() {
        return dataLocation;
    }

    public int getLcid() {
        return lcid;
    }

    /**
     * Language tag of the LCID, such as {@code en-US}, used to locate MUI files.
     */
    public String getLanguageTag() {
        return languageTag;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    public String getDatabaseName() {
        return databaseName;
    }

    /**
     * Creates default options: en-US, default cache, no data location.
     */
    public static ResolverOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Path dataLocation;
        private int lcid = DEFAULT_LCID;
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private String databaseName = DEFAULT_DATABASE_NAME;

        public Builder dataLocation(Path dataLocation) {
            this.dataLocation = dataLocation;
            return this;
        }

        /**
         * Sets the language code identifier. 0 selects the default, 0x0409 (en-US).
         */
        public Builder lcid(int lcid) {
            if (lcid < 0) {
                throw new IllegalArgumentException("lcid must not be negative");
            }
            this.lcid = lcid != 0 ? lcid : DEFAULT_LCID;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            if (cacheConfig == null) {
                throw new IllegalArgumentException("cacheConfig must not be null");
            }
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder cacheEnabled(boolean enabled) {
            this.cacheConfig = new CacheConfig(cacheConfig.maxSize(), enabled);
            return this;
        }

        public Builder databaseName(String databaseName) {
            if (databaseName == null || databaseName.isBlank()) {
                throw new IllegalArgumentException("databaseName must not be blank");
            }
            this.databaseName = databaseName;
            return this;
        }

        public ResolverOptions build() {
            String languageTag = WindowsLanguageHelper.getLanguageTagForLcid(lcid)
                    .orElseThrow(() -> new IllegalArgumentException(
                            String.format("Unsupported lcid: 0x%04x", lcid)));
            return new ResolverOptions(this, languageTag);
        }
    }

    @Override
    public String toString() {
        return "ResolverOptions{" +
                "dataLocation=" + dataLocation +
                ", lcid=" + String.format("0x%04x", lcid) +
                ", languageTag='" + languageTag + '\'' +
                ", cacheConfig=" + cacheConfig +
                ", databaseName='" + databaseName + '\'' +
                '}';
    }
}
