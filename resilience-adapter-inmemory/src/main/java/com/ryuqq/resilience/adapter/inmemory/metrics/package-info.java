/**
 * In-memory call metrics.
 *
 * <p>{@link com.ryuqq.resilience.adapter.inmemory.metrics.BoundedLog} is the shared bounded,
 * drop-oldest log used for both call metrics and recovery metrics.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.inmemory.metrics;
