/**
 * Query orchestration: turns a stream of text changes into a small number of lookups.
 *
 * <p>Pipeline for {@code setText}: normalize, length gate, exact and near-duplicate filter,
 * debounce, then run. A run consults the cache, deduplicates against the lookup in flight,
 * cancels a superseded lookup and dispatches the fetch. Completions are marshalled back onto
 * the event loop where the {@link com.phillippitts.recallahead.service.orchestration.SequenceGuard}
 * drops every response except the most recent one.
 *
 * <p>All types in this package are confined to the event loop unless documented otherwise.
 *
 * @see com.phillippitts.recallahead.service.orchestration.QueryOrchestrator
 * @see com.phillippitts.recallahead.service.eventloop.EventLoop
 * @since 1.0
 */
package com.phillippitts.recallahead.service.orchestration;
