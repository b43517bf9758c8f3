package com.winevt.resources.cdi;

import com.winevt.resources.api.ResolverOptions;
import com.winevt.resources.api.WinevtResourcesResolver;
import com.winevt.resources.cache.CacheConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.Dependent;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Optional;

/**
 * CDI producer that wires the EventLog message string resolver from MicroProfile Config
 * properties.
 *
 * <h2>Configuration</h2>
 * <pre>
 * winevt-resources:
 *   data-location: /opt/plaso/data
 *   lcid: 0x0409
 *   database-name: winevt-rc.db
 *   cache:
 *     enabled: true
 *     max-size: 65536
 * </pre>
 *
 * <p>Resolvers are not thread-safe, so one is produced per injection point and closed
 * when the owning bean is destroyed.</p>
 */
@ApplicationScoped
public class WinevtResourcesProducer {

    private static final Logger log = LoggerFactory.getLogger(WinevtResourcesProducer.class);

    @Inject
    @ConfigProperty(name = "winevt-resources.data-location")
    Optional<String> dataLocation;

    @Inject
    @ConfigProperty(name = "winevt-resources.lcid", defaultValue = "0x0409")
    String lcid;

    @Inject
    @ConfigProperty(name = "winevt-resources.database-name", defaultValue = ResolverOptions.DEFAULT_DATABASE_NAME)
    String databaseName;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "winevt-resources.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "winevt-resources.cache.max-size", defaultValue = "65536")
    int cacheMaxSize;

    @Produces
    @Dependent
    public WinevtResourcesResolver winevtResourcesResolver() {
        return WinevtResourcesResolver.builder()
                .options(resolverOptions())
                .build();
    }

    public void closeResolver(@Disposes WinevtResourcesResolver resolver) {
        log.debug("Closing WinevtResourcesResolver");
        resolver.close();
    }

    ResolverOptions resolverOptions() {
        ResolverOptions options = ResolverOptions.builder()
                .dataLocation(dataLocation.filter(value -> !value.isBlank()).map(Path::of).orElse(null))
                .lcid(parseLcid(lcid))
                .databaseName(databaseName)
                .cacheConfig(new CacheConfig(cacheMaxSize, cacheEnabled))
                .build();
        log.info("Producing WinevtResourcesResolver: {}", options);
        return options;
    }

    /**
     * Parses an LCID given in decimal or as hexadecimal with a {@code 0x} prefix.
     */
    static int parseLcid(String value) {
        String trimmed = value.trim();
        if (trimmed.startsWith("0x") || trimmed.startsWith("0X")) {
            return Integer.parseInt(trimmed.substring(2), 16);
        }
        return Integer.parseInt(trimmed);
    }
}
