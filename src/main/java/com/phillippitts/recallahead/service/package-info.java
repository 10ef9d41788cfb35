/**
 * Service layer containing the recall orchestration logic and its collaborators.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.orchestration} - debounced, cancellable query orchestrator</li>
 *   <li>{@code service.eventloop} - single-threaded executor the orchestrators run on</li>
 *   <li>{@code service.trigger} - keystroke heuristics in front of the orchestrator</li>
 *   <li>{@code service.surface} - one orchestrator per registered input surface</li>
 *   <li>{@code service.client} - HTTP client for the memory search API</li>
 *   <li>{@code service.metrics}, {@code service.events} - Micrometer meters and event logging</li>
 * </ul>
 *
 * <p>Services depend on domain models, not the presentation layer, and throw domain
 * exceptions rather than HTTP exceptions.
 *
 * @since 1.0
 */
package com.phillippitts.recallahead.service;
