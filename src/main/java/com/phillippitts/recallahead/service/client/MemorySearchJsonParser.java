package com.phillippitts.recallahead.service.client;

import com.phillippitts.recallahead.domain.MemoryItem;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON encoding of memory search requests and decoding of their responses.
 *
 * <p>Responses are either a bare array of memories or an object with a {@code results} array.
 * Entries without an id are skipped; a missing text becomes empty.
 */
final class MemorySearchJsonParser {

    private MemorySearchJsonParser() {}

    /**
     * Builds the search filter: none without a user, the user alone without a provider to
     * exclude, otherwise the user AND memories not created on {@code excludeProvider}.
     */
    static JSONObject buildFilters(String userId, String excludeProvider) {
        if (isBlank(userId)) {
            return new JSONObject();
        }
        JSONObject byUser = new JSONObject().put("user_id", userId);
        if (isBlank(excludeProvider)) {
            return byUser;
        }
        JSONObject notProvider = new JSONObject().put("metadata",
                new JSONObject().put("provider", new JSONObject().put("ne", excludeProvider)));
        return new JSONObject().put("AND", new JSONArray().put(byUser).put(notProvider));
    }

    /**
     * @throws JSONException if the body is neither a JSON array nor an object
     */
    static List<MemoryItem> parseItems(String body) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        String trimmed = body.trim();
        JSONArray array;
        if (trimmed.startsWith("[")) {
            array = new JSONArray(trimmed);
        } else {
            array = new JSONObject(trimmed).optJSONArray("results");
        }
        if (array == null) {
            return List.of();
        }

        List<MemoryItem> items = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            JSONObject entry = array.optJSONObject(i);
            if (entry == null || !entry.has("id") || entry.isNull("id")) {
                continue;
            }
            items.add(new MemoryItem(
                    String.valueOf(entry.get("id")),
                    entry.optString("memory", ""),
                    categories(entry.optJSONArray("categories")),
                    entry.optDouble("score", 0.0)));
        }
        return items;
    }

    private static List<String> categories(JSONArray array) {
        if (array == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            String category = array.optString(i, "");
            if (!category.isBlank()) {
                out.add(category);
            }
        }
        return out;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
