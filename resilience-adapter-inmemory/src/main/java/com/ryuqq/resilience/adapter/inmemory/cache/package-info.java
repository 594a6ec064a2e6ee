/**
 * In-memory offline cache adapter.
 *
 * <p>Serves repeated reads and acts as the last-known-good store for fallback recovery
 * when the upstream API is unavailable.</p>
 *
 * @see com.ryuqq.resilience.core.spi.OfflineCache
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.inmemory.cache;
