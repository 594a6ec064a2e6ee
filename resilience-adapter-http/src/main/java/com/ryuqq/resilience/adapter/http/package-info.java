/**
 * JDK HttpClient 기반 Transport 어댑터.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.http;
