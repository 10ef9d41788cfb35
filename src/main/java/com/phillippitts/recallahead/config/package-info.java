/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.recallahead.config.ThreadPoolConfig} - the single-threaded
 *       recall event loop</li>
 *   <li>{@link com.phillippitts.recallahead.config.client.RecallClientConfig} - HTTP client for
 *       the memory search API</li>
 *   <li>{@link com.phillippitts.recallahead.config.orchestration.OrchestrationConfig} - per-surface
 *       orchestrator factory</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code @ConfigurationProperties}</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.recallahead.config;
