package com.phillippitts.recallahead.integration;

import com.phillippitts.recallahead.service.orchestration.event.RecallResultsEvent;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.event.EventListener;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * End-to-end flow through the REST surface, the event loop and the search client.
 *
 * <p>No user id is configured, so the client answers every search with an empty list without
 * touching the network.
 */
@Tag("integration")
@Import(SurfaceApiIntegrationTest.ResultsCollectorConfig.class)
@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {
                "recall.client.api-key=",
                "recall.client.user-id=",
                "recall.orchestrator.debounce-ms=50"
        }
)
class SurfaceApiIntegrationTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private ResultsCollector collector;

    @Test
    void inputFlowsThroughToResultsEvent() {
        ResponseEntity<Map> opened = restTemplate.exchange("/api/surfaces/it-chat?provider=chatgpt",
                HttpMethod.PUT, HttpEntity.EMPTY, Map.class);
        assertThat(opened.getStatusCode()).isEqualTo(HttpStatus.OK);

        ResponseEntity<Void> accepted = restTemplate.postForEntity("/api/surfaces/it-chat/input",
                Map.of("text", "explain react hooks please"), Void.class);
        assertThat(accepted.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);

        await().atMost(Duration.ofSeconds(5)).until(() -> collector.events.stream()
                .anyMatch(e -> e.surfaceId().equals("it-chat")));

        ResponseEntity<Map> state = restTemplate.getForEntity("/api/surfaces/it-chat", Map.class);
        assertThat(state.getBody()).containsEntry("lastCompletedQuery", "explain react hooks please");
        assertThat(state.getBody()).containsEntry("lastResult", List.of());
    }

    @Test
    void searchOfShortTextDoesNothingAndUnknownSurfaceIs404() {
        restTemplate.exchange("/api/surfaces/it-short", HttpMethod.PUT, HttpEntity.EMPTY, Map.class);
        restTemplate.postForEntity("/api/surfaces/it-short/search", Map.of("text", "hey"), Void.class);

        ResponseEntity<Map> state = restTemplate.getForEntity("/api/surfaces/it-short", Map.class);
        assertThat(state.getBody()).containsEntry("inFlight", false);
        assertThat(state.getBody()).containsEntry("lastCompletedQuery", "");

        ResponseEntity<Map> missing = restTemplate.getForEntity("/api/surfaces/nope", Map.class);
        assertThat(missing.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @TestConfiguration
    static class ResultsCollectorConfig {
        @Bean
        ResultsCollector resultsCollector() {
            return new ResultsCollector();
        }
    }

    static class ResultsCollector {
        final List<RecallResultsEvent> events = new CopyOnWriteArrayList<>();

        @EventListener
        void onResults(RecallResultsEvent event) {
            events.add(event);
        }
    }
}
