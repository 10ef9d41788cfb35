package com.phillippitts.recallahead.service.orchestration;

/**
 * Turns a stream of input-change events from one text field into a small, correct set of
 * recall lookups.
 *
 * <p>This orchestrator owns the debounce timer, the result cache, the in-flight slot and the
 * sequence counter of exactly one input surface. It guarantees that:
 * <ul>
 *   <li>no lookup fires while the user is still typing (debounce, near-duplicate filter)</li>
 *   <li>at most one lookup is in flight; a superseded one is cancelled first</li>
 *   <li>cached results are served for at most the configured TTL</li>
 *   <li>a response overtaken by a newer dispatch never reaches the caller</li>
 * </ul>
 *
 * <p><b>Threading:</b> Every method must be called on the orchestrator's
 * {@link com.phillippitts.recallahead.service.eventloop.EventLoop}. Callers on other threads go
 * through {@link com.phillippitts.recallahead.service.surface.SurfaceRegistry}.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * QueryOrchestrator<MemoryItem> orchestrator = QueryOrchestratorBuilder.<MemoryItem>builder()
 *     .fetcher(client.forProvider("chatgpt"))
 *     .eventLoop(eventLoop)
 *     .callbacks(callbacks)
 *     .build();
 *
 * // On every input event
 * orchestrator.setText(field.getText());
 *
 * // On Enter
 * orchestrator.runImmediate();
 * }</pre>
 *
 * @param <T> result item type
 * @since 1.0
 */
public interface QueryOrchestrator<T> {

    /**
     * Records the latest raw text and re-arms the debounce timer if the text passes the length
     * gate and is not a (near-)duplicate of the last searched or in-flight query.
     *
     * @param text raw text, null is treated as empty
     */
    void setText(String text);

    /**
     * Cancels the debounce timer and dispatches immediately, still subject to the length gate,
     * the cache and in-flight deduplication.
     *
     * @param text raw text to search, or null to search the latest text
     */
    void runImmediate(String text);

    /**
     * Dispatches the latest text immediately.
     */
    default void runImmediate() {
        runImmediate(null);
    }

    /**
     * Clears the pending timer and cancels the in-flight lookup, if any.
     */
    void cancel();

    /**
     * @return snapshot of the current state
     */
    OrchestratorState<T> getState();

    /**
     * Merges a partial update into the live options. Takes effect for the next scheduling or
     * dispatch decision.
     *
     * @param update partial options, null is ignored
     */
    void setOptions(OptionsUpdate update);

    /**
     * @return options currently in effect
     */
    OrchestratorOptions getOptions();

    /**
     * Drops every cached result.
     */
    void clearCache();
}
