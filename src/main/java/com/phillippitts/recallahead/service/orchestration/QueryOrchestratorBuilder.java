package com.phillippitts.recallahead.service.orchestration;

import com.phillippitts.recallahead.service.eventloop.EventLoop;

import java.util.Objects;

/**
 * Builder for {@link DefaultQueryOrchestrator}.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * QueryOrchestrator<MemoryItem> orchestrator = QueryOrchestratorBuilder.<MemoryItem>builder()
 *     .name("chat-input")
 *     .fetcher(fetcher)
 *     .eventLoop(eventLoop)
 *     .callbacks(callbacks)
 *     .options(OrchestratorOptions.defaults())
 *     .metricsPublisher(metricsPublisher)
 *     .build();
 * }</pre>
 *
 * @param <T> result item type
 * @since 1.0
 */
public final class QueryOrchestratorBuilder<T> {

    // Required dependencies
    private RecallFetcher<T> fetcher;
    private EventLoop eventLoop;

    // Optional dependencies
    private String name = "default";
    private QueryCallbacks<T> callbacks;
    private OrchestratorOptions options;
    private OrchestratorMetricsPublisher metricsPublisher;

    private QueryOrchestratorBuilder() {
        // Private constructor - use builder() factory method
    }

    public static <T> QueryOrchestratorBuilder<T> builder() {
        return new QueryOrchestratorBuilder<>();
    }

    /**
     * Label used in log lines, typically the surface id.
     */
    public QueryOrchestratorBuilder<T> name(String name) {
        this.name = name;
        return this;
    }

    public QueryOrchestratorBuilder<T> fetcher(RecallFetcher<T> fetcher) {
        this.fetcher = fetcher;
        return this;
    }

    public QueryOrchestratorBuilder<T> eventLoop(EventLoop eventLoop) {
        this.eventLoop = eventLoop;
        return this;
    }

    public QueryOrchestratorBuilder<T> callbacks(QueryCallbacks<T> callbacks) {
        this.callbacks = callbacks;
        return this;
    }

    public QueryOrchestratorBuilder<T> options(OrchestratorOptions options) {
        this.options = options;
        return this;
    }

    public QueryOrchestratorBuilder<T> metricsPublisher(OrchestratorMetricsPublisher metricsPublisher) {
        this.metricsPublisher = metricsPublisher;
        return this;
    }

    /**
     * @return a new orchestrator
     * @throws NullPointerException if the fetcher or the event loop is missing
     */
    public DefaultQueryOrchestrator<T> build() {
        Objects.requireNonNull(fetcher, "fetcher is required");
        Objects.requireNonNull(eventLoop, "eventLoop is required");
        return new DefaultQueryOrchestrator<>(
                name == null ? "default" : name,
                fetcher,
                callbacks != null ? callbacks : QueryCallbacks.noop(),
                options != null ? options : OrchestratorOptions.defaults(),
                eventLoop,
                metricsPublisher != null ? metricsPublisher : OrchestratorMetricsPublisher.NOOP);
    }
}
