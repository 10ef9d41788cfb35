package com.phillippitts.recallahead.exception;

/**
 * Thrown by a recall fetcher when the cancellation token of its query has been signalled.
 *
 * <p>The orchestrator never reports this exception through {@code onError}; a cancelled
 * lookup has been superseded and its outcome is irrelevant to the caller.
 */
public class QueryCancelledException extends RecallAheadException {

    private final String query;

    public QueryCancelledException(String query) {
        super("Recall query cancelled: " + query);
        this.query = query;
    }

    public String getQuery() {
        return query;
    }
}
