package com.winevt.resources.metrics;

import com.winevt.resources.core.model.ResolutionKind;

import java.time.Duration;

/**
 * Interface for recording message resolution metrics.
 * The default {@link NoOpMetricsService} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordResolutionDuration(ResolutionKind kind, String source, Duration duration);

    void incrementUnresolved(ResolutionKind kind);

    void recordCacheHit();

    void recordCacheMiss();
}
