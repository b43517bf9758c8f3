package com.winevt.resources.metrics;

import com.winevt.resources.core.model.ResolutionKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code winevt.resolution.duration} - Timer (tags: kind, source)</li>
 *   <li>{@code winevt.resolution.unresolved} - Counter (tag: kind)</li>
 *   <li>{@code winevt.cache.hit} - Counter</li>
 *   <li>{@code winevt.cache.miss} - Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<ResolutionKind, Counter> unresolvedCounters = new ConcurrentHashMap<>();
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.cacheHitCounter = Counter.builder("winevt.cache.hit")
                .description("Number of message string cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("winevt.cache.miss")
                .description("Number of message string cache misses")
                .register(registry);
    }

    @Override
    public void recordResolutionDuration(ResolutionKind kind, String source, Duration duration) {
        String key = kind.name() + ":" + source;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("winevt.resolution.duration")
                        .description("Duration of message string resolutions that missed the cache")
                        .tag("kind", kind.tagValue())
                        .tag("source", source)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementUnresolved(ResolutionKind kind) {
        Counter counter = unresolvedCounters.computeIfAbsent(kind, k ->
                Counter.builder("winevt.resolution.unresolved")
                        .description("Number of resolutions that produced no string")
                        .tag("kind", kind.tagValue())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
