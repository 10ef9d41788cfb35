package com.phillippitts.recallahead.service.orchestration;

import com.phillippitts.recallahead.exception.QueryCancelledException;
import com.phillippitts.recallahead.service.eventloop.EventLoop;
import com.phillippitts.recallahead.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Default implementation of {@link QueryOrchestrator}.
 *
 * <p><b>Pipeline:</b>
 * <ol>
 *   <li>{@link #setText(String)}: normalize, length gate, duplicate filter, arm debounce</li>
 *   <li>{@code run}: length gate, cache lookup, in-flight dedup or cancellation of the
 *       superseded lookup, sequence capture, {@code onStart}, fetch</li>
 *   <li>completion (re-dispatched onto the event loop): sequence guard, slot release,
 *       cache store, {@code onSuccess}/{@code onError}, then {@code onFinally} unless one of
 *       those callbacks started a newer lookup</li>
 * </ol>
 *
 * <p><b>Error Handling:</b> Every failure of the fetcher, thrown synchronously or delivered
 * through its stage, is caught here. Cancellation failures are dropped; other failures reach
 * {@code onError}. Stale responses are dropped regardless of outcome.
 *
 * <p><b>Configuration:</b> Construct through {@link QueryOrchestratorBuilder}.
 *
 * @since 1.0
 */
public class DefaultQueryOrchestrator<T> implements QueryOrchestrator<T> {

    private static final Logger LOG = LogManager.getLogger(DefaultQueryOrchestrator.class);

    private final String name;
    private final RecallFetcher<T> fetcher;
    private final CallbackDispatcher<T> dispatcher;
    private final EventLoop eventLoop;
    private final OrchestratorMetricsPublisher metricsPublisher;

    private final ResultCache<T> cache;
    private final InFlightTracker inFlight = new InFlightTracker();
    private final SequenceGuard sequence = new SequenceGuard();
    private final DebounceScheduler debounce;

    private OrchestratorOptions options;
    private String latestText = "";
    private String lastCompletedQuery = "";
    private String lastSearchedQuery = "";
    private List<T> lastResult;

    DefaultQueryOrchestrator(String name,
                             RecallFetcher<T> fetcher,
                             QueryCallbacks<T> callbacks,
                             OrchestratorOptions options,
                             EventLoop eventLoop,
                             OrchestratorMetricsPublisher metricsPublisher) {
        this.name = name;
        this.fetcher = fetcher;
        this.dispatcher = new CallbackDispatcher<>(callbacks);
        this.options = options;
        this.eventLoop = eventLoop;
        this.metricsPublisher = metricsPublisher;
        this.cache = new ResultCache<>(eventLoop.clock());
        this.debounce = new DebounceScheduler(eventLoop);
    }

    @Override
    public void setText(String text) {
        latestText = text == null ? "" : text;
        schedule();
    }

    @Override
    public void runImmediate(String text) {
        if (text != null) {
            latestText = text;
        }
        debounce.disarm();
        run(latestText);
    }

    @Override
    public void cancel() {
        boolean timerCleared = debounce.disarm();
        String cancelled = inFlight.cancelActive();
        if (cancelled != null) {
            metricsPublisher.recordCancelled();
            LOG.debug("[{}] Cancelled in-flight lookup {}", name, LogSanitizer.preview(cancelled));
        } else if (timerCleared) {
            LOG.debug("[{}] Cancelled pending debounce", name);
        }
    }

    @Override
    public OrchestratorState<T> getState() {
        return new OrchestratorState<>(latestText, lastCompletedQuery, lastResult,
                inFlight.query(), inFlight.isActive(), cache.size());
    }

    @Override
    public void setOptions(OptionsUpdate update) {
        OrchestratorOptions merged = options.merge(update);
        if (merged != options) {
            LOG.debug("[{}] Options updated: {}", name, merged);
            options = merged;
        }
    }

    @Override
    public OrchestratorOptions getOptions() {
        return options;
    }

    @Override
    public void clearCache() {
        cache.clear();
    }

    private void schedule() {
        debounce.disarm();
        String query = QueryNormalizer.normalize(latestText);
        if (!passesLengthGate(query)) {
            return;
        }
        NearDuplicateFilter.Verdict verdict = NearDuplicateFilter.evaluate(query, lastSearchedQuery,
                inFlight.query(), options.nearDuplicateMaxDelta());
        if (verdict != NearDuplicateFilter.Verdict.PASS) {
            LOG.trace("[{}] Skipping {}: {}", name, LogSanitizer.preview(query), verdict);
            return;
        }
        debounce.arm(() -> run(latestText), options.debounce());
    }

    private void run(String rawText) {
        String query = QueryNormalizer.normalize(rawText);
        if (!passesLengthGate(query)) {
            return;
        }

        if (serveFromCache(query) && !options.refreshOnCache()) {
            return;
        }

        if (inFlight.isTracking(query)) {
            LOG.trace("[{}] {} already in flight", name, LogSanitizer.preview(query));
            return;
        }
        String superseded = inFlight.cancelActive();
        if (superseded != null) {
            metricsPublisher.recordCancelled();
            LOG.debug("[{}] {} superseded by {}", name,
                    LogSanitizer.preview(superseded), LogSanitizer.preview(query));
        }

        CancellationToken token = inFlight.start(query);
        long seq = sequence.next();
        metricsPublisher.recordDispatch();
        LOG.debug("[{}] Dispatching {} (seq={})", name, LogSanitizer.preview(query), seq);
        dispatcher.onStart(query);

        long startNanos = System.nanoTime();
        invokeFetcher(query, token).whenCompleteAsync(
                (result, error) -> complete(query, seq, token, startNanos, result, error), eventLoop);
    }

    private boolean passesLengthGate(String query) {
        return !query.isEmpty() && query.length() >= options.minLength();
    }

    private boolean serveFromCache(String query) {
        if (!options.useCache()) {
            return false;
        }
        List<T> cached = cache.get(query, options.cacheTtl());
        if (cached == null) {
            return false;
        }
        metricsPublisher.recordCacheHit();
        LOG.debug("[{}] Cache hit for {}", name, LogSanitizer.preview(query));
        dispatcher.onSuccess(query, cached, true);
        return true;
    }

    private CompletionStage<List<T>> invokeFetcher(String query, CancellationToken token) {
        try {
            CompletionStage<List<T>> stage = fetcher.fetch(query, token);
            if (stage == null) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("Recall fetcher returned no completion stage"));
            }
            return stage;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void complete(String query, long seq, CancellationToken token, long startNanos,
                          List<T> result, Throwable error) {
        if (!sequence.isCurrent(seq)) {
            metricsPublisher.recordStale();
            LOG.debug("[{}] Discarding stale response for {} (seq={}, current={})",
                    name, LogSanitizer.preview(query), seq, sequence.current());
            return;
        }
        inFlight.finish();
        try {
            if (error == null) {
                applyResult(query, token, startNanos, result);
            } else {
                handleFailure(query, token, unwrap(error));
            }
        } finally {
            // a callback may have dispatched a newer lookup, which now owns the lifecycle
            if (sequence.isCurrent(seq)) {
                dispatcher.onFinally(query);
            } else {
                LOG.debug("[{}] {} superseded from its own callback", name, LogSanitizer.preview(query));
            }
        }
    }

    private void applyResult(String query, CancellationToken token, long startNanos, List<T> result) {
        if (token.isCancellationRequested()) {
            LOG.debug("[{}] Ignoring late result for cancelled {}", name, LogSanitizer.preview(query));
            return;
        }
        List<T> items = result == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(result));
        cache.put(query, items);
        lastCompletedQuery = query;
        lastSearchedQuery = query;
        lastResult = items;
        metricsPublisher.recordSuccess(System.nanoTime() - startNanos);
        LOG.debug("[{}] {} returned {} item(s)", name, LogSanitizer.preview(query), items.size());
        dispatcher.onSuccess(query, items, false);
    }

    private void handleFailure(String query, CancellationToken token, Throwable cause) {
        if (isCancellation(token, cause)) {
            LOG.debug("[{}] Lookup for {} ended by cancellation", name, LogSanitizer.preview(query));
            return;
        }
        metricsPublisher.recordFailure(cause.getClass().getSimpleName());
        LOG.warn("[{}] Recall lookup failed for {}: {}", name, LogSanitizer.preview(query), cause.toString());
        dispatcher.onError(query, cause);
    }

    private static boolean isCancellation(CancellationToken token, Throwable cause) {
        return token.isCancellationRequested()
                || cause instanceof CancellationException
                || cause instanceof QueryCancelledException;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
