package com.phillippitts.recallahead.service.client;

import com.phillippitts.recallahead.config.properties.RecallClientProperties;
import com.phillippitts.recallahead.domain.MemoryItem;
import com.phillippitts.recallahead.exception.QueryCancelledException;
import com.phillippitts.recallahead.exception.RecallTransportException;
import com.phillippitts.recallahead.service.orchestration.CancellationToken;
import com.phillippitts.recallahead.service.orchestration.RecallFetcher;
import com.phillippitts.recallahead.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * HTTP client for the remote memory search endpoint.
 *
 * <p>Each call is a JSON POST authorised with {@code Authorization: Token <api-key>}. The
 * request future is cancelled when the orchestrator signals the lookup's
 * {@link CancellationToken}, which aborts the exchange in {@link HttpClient}.
 *
 * <p><b>Missing configuration:</b> without a user id there is nothing to search and the call
 * completes with an empty list; without an API key an error is logged and the call also
 * completes empty, so an unconfigured install stays quiet instead of failing on every keystroke.
 *
 * @since 1.0
 */
public class MemorySearchClient {

    private static final Logger LOG = LogManager.getLogger(MemorySearchClient.class);
    private static final int MAX_ERROR_BODY_CHARS = 200;

    private final HttpClient httpClient;
    private final RecallClientProperties props;

    public MemorySearchClient(HttpClient httpClient, RecallClientProperties props) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    /**
     * @param provider provider whose own memories are excluded from results, may be null
     * @return fetcher bound to {@code provider}
     */
    public RecallFetcher<MemoryItem> forProvider(String provider) {
        return (query, token) -> search(query, provider, token);
    }

    /**
     * Searches memories matching {@code query}.
     *
     * @return future completing with the matches, or exceptionally with
     *         {@link RecallTransportException} / a cancellation exception
     */
    public CompletableFuture<List<MemoryItem>> search(String query, String provider, CancellationToken token) {
        if (isBlank(props.getUserId())) {
            LOG.debug("No recall.client.user-id configured; skipping search");
            return CompletableFuture.completedFuture(List.of());
        }
        if (isBlank(props.getApiKey())) {
            LOG.error("recall.client.api-key not configured; memory search disabled");
            return CompletableFuture.completedFuture(List.of());
        }
        if (token.isCancellationRequested()) {
            return CompletableFuture.failedFuture(new QueryCancelledException(query));
        }

        JSONObject payload = buildPayload(query, provider);
        HttpRequest request = HttpRequest.newBuilder(searchUri())
                .timeout(Duration.ofMillis(props.getRequestTimeoutMs()))
                .header("Content-Type", "application/json")
                .header("Authorization", "Token " + props.getApiKey())
                .POST(HttpRequest.BodyPublishers.ofString(payload.toString()))
                .build();

        LOG.debug("Search request: query={}, provider={}, threshold={}, topK={}",
                LogSanitizer.preview(query), provider, props.getThreshold(), props.getTopK());

        CompletableFuture<HttpResponse<String>> exchange =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        token.onCancel(() -> exchange.cancel(true));

        return exchange.handle((response, error) -> {
            if (error != null) {
                throw translate(query, error);
            }
            return toItems(response);
        });
    }

    JSONObject buildPayload(String query, String provider) {
        JSONObject payload = new JSONObject()
                .put("query", query)
                .put("filters", MemorySearchJsonParser.buildFilters(props.getUserId(), provider))
                .put("rerank", props.isRerank())
                .put("threshold", props.getThreshold())
                .put("top_k", props.getTopK())
                .put("filter_memories", false);
        if (!isBlank(props.getOrgId())) {
            payload.put("org_id", props.getOrgId());
        }
        if (!isBlank(props.getProjectId())) {
            payload.put("project_id", props.getProjectId());
        }
        return payload;
    }

    private URI searchUri() {
        String base = props.getBaseUrl().endsWith("/")
                ? props.getBaseUrl().substring(0, props.getBaseUrl().length() - 1)
                : props.getBaseUrl();
        String path = props.getSearchPath().startsWith("/") ? props.getSearchPath() : "/" + props.getSearchPath();
        return URI.create(base + path);
    }

    private List<MemoryItem> toItems(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            LOG.error("Search API error: status={}, body={}", status,
                    LogSanitizer.truncate(response.body(), MAX_ERROR_BODY_CHARS));
            throw new RecallTransportException("Memory search failed", status);
        }
        try {
            return MemorySearchJsonParser.parseItems(response.body());
        } catch (JSONException e) {
            throw new RecallTransportException("Malformed memory search response", e);
        }
    }

    private static RuntimeException translate(String query, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        if (cause instanceof CancellationException) {
            return new QueryCancelledException(query);
        }
        return new RecallTransportException("Memory search service unreachable", cause);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
