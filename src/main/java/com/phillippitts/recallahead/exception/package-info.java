/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.recallahead.exception.RecallAheadException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.recallahead.exception.QueryCancelledException} - Raised by a
 *       fetcher whose cancellation token was signalled; swallowed by the orchestrator</li>
 *   <li>{@link com.phillippitts.recallahead.exception.RecallTransportException} - Remote recall
 *       service unreachable or answering with a non-2xx status</li>
 *   <li>{@link com.phillippitts.recallahead.exception.SurfaceNotFoundException} - REST call
 *       addressed to an unknown input surface</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and map to HTTP status codes via {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.recallahead.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.recallahead.exception;
