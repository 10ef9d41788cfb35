package com.phillippitts.recallahead.service.orchestration;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * The single point where a concrete lookup against the recall service happens.
 *
 * <p>Implementations should return quickly and complete the stage asynchronously. They must
 * honour the {@link CancellationToken}: once it is cancelled the stage should complete
 * exceptionally (preferably with {@link com.phillippitts.recallahead.exception.QueryCancelledException}
 * or a {@link java.util.concurrent.CancellationException}) as soon as practical.
 *
 * @param <T> result item type
 * @see com.phillippitts.recallahead.service.client.MemorySearchClient
 */
@FunctionalInterface
public interface RecallFetcher<T> {

    /**
     * @param query             normalized query
     * @param cancellationToken token signalled when the lookup is superseded or cancelled
     * @return stage completing with the result list (null is treated as empty)
     */
    CompletionStage<List<T>> fetch(String query, CancellationToken cancellationToken);
}
