/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - Unique identifier for each HTTP request (UUID format)</li>
 *   <li>{@code surfaceId} - Input surface addressed by the request</li>
 * </ul>
 *
 * <p>Both keys are copied onto the recall event loop by the task decorator in
 * {@link com.phillippitts.recallahead.config.ThreadPoolConfig}, so orchestrator logs carry them.
 *
 * <p>Log Format:
 * <pre>
 * 2026-10-17 15:42:32.529 [recall-loop-1] [requestId] [surfaceId] LEVEL logger.name - message
 * </pre>
 *
 * @see com.phillippitts.recallahead.config.logging.MdcFilter
 * @since 1.0
 */
package com.phillippitts.recallahead.config.logging;
