package com.phillippitts.recallahead.service.client;

import com.phillippitts.recallahead.domain.MemoryItem;
import org.json.JSONException;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MemorySearchJsonParserTest {

    @Test
    void filtersAreEmptyWithoutUser() {
        assertThat(MemorySearchJsonParser.buildFilters(null, "chatgpt").isEmpty()).isTrue();
    }

    @Test
    void filtersUseUserAloneWithoutProvider() {
        JSONObject filters = MemorySearchJsonParser.buildFilters("alice", " ");

        assertThat(filters.similar(new JSONObject().put("user_id", "alice"))).isTrue();
    }

    @Test
    void filtersExcludeOwnProvider() {
        JSONObject filters = MemorySearchJsonParser.buildFilters("alice", "chatgpt");

        JSONObject expected = new JSONObject("""
                {"AND": [
                  {"user_id": "alice"},
                  {"metadata": {"provider": {"ne": "chatgpt"}}}
                ]}
                """);
        assertThat(filters.similar(expected)).isTrue();
    }

    @Test
    void parsesResultsObject() {
        List<MemoryItem> items = MemorySearchJsonParser.parseItems("""
                {"results": [
                  {"id": "m1", "memory": "Drinks green tea", "categories": ["food", ""], "score": 0.82},
                  {"id": 7, "memory": "Lives in Lisbon"}
                ]}
                """);

        assertThat(items).containsExactly(
                new MemoryItem("m1", "Drinks green tea", List.of("food"), 0.82),
                new MemoryItem("7", "Lives in Lisbon", List.of(), 0.0));
    }

    @Test
    void parsesBareArrayAndSkipsEntriesWithoutId() {
        List<MemoryItem> items = MemorySearchJsonParser.parseItems("""
                [{"memory": "orphan"}, {"id": null, "memory": "null id"}, {"id": "m2"}]
                """);

        assertThat(items).containsExactly(new MemoryItem("m2", "", List.of(), 0.0));
    }

    @Test
    void emptyOrResultlessBodiesYieldNoItems() {
        assertThat(MemorySearchJsonParser.parseItems("")).isEmpty();
        assertThat(MemorySearchJsonParser.parseItems(null)).isEmpty();
        assertThat(MemorySearchJsonParser.parseItems("{\"message\": \"ok\"}")).isEmpty();
    }

    @Test
    void malformedBodyIsRejected() {
        assertThatThrownBy(() -> MemorySearchJsonParser.parseItems("<html>"))
                .isInstanceOf(JSONException.class);
    }
}
