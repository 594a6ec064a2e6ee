package com.ryuqq.resilience.adapter.inmemory.metrics;

import com.ryuqq.resilience.core.model.CallMetric;
import com.ryuqq.resilience.core.spi.MetricsRecorder;

import java.util.List;

/**
 * In-memory implementation of {@link MetricsRecorder} SPI backed by a {@link BoundedLog}.
 *
 * <p>Default capacity is {@value #DEFAULT_CAPACITY} entries.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class RingBufferMetricsRecorder implements MetricsRecorder {

    public static final int DEFAULT_CAPACITY = 1000;

    private final BoundedLog<CallMetric> log;

    public RingBufferMetricsRecorder() {
        this(DEFAULT_CAPACITY);
    }

    public RingBufferMetricsRecorder(int capacity) {
        this.log = new BoundedLog<>(capacity);
    }

    @Override
    public void record(CallMetric metric) {
        if (metric == null) {
            throw new IllegalArgumentException("metric cannot be null");
        }
        log.append(metric);
    }

    @Override
    public List<CallMetric> recent(int limit) {
        return log.recent(limit);
    }

    @Override
    public double successRate(int lastK) {
        List<CallMetric> window = log.recent(lastK);
        if (window.isEmpty()) {
            return 0.0;
        }
        long successes = window.stream().filter(CallMetric::success).count();
        return (double) successes / window.size() * 100.0;
    }

    @Override
    public double averageLatencyMs(int lastK) {
        return log.recent(lastK).stream()
            .mapToLong(CallMetric::durationMs)
            .average()
            .orElse(0.0);
    }

    @Override
    public int size() {
        return log.size();
    }

    @Override
    public int capacity() {
        return log.capacity();
    }

    @Override
    public void clear() {
        log.clear();
    }
}
