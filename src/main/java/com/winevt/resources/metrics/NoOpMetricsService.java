package com.winevt.resources.metrics;

import com.winevt.resources.core.model.ResolutionKind;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 * All methods are empty, ensuring the library works without any metrics dependencies.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordResolutionDuration(ResolutionKind kind, String source, Duration duration) {
    }

    @Override
    public void incrementUnresolved(ResolutionKind kind) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
