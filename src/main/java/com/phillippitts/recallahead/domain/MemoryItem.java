package com.phillippitts.recallahead.domain;

import java.util.List;
import java.util.Objects;

/**
 * Immutable domain model for a single memory returned by the recall service.
 *
 * @param id         Identifier assigned by the recall service (never null)
 * @param memory     The remembered text (never null, may be empty)
 * @param categories Categories attached to the memory (never null)
 * @param score      Relevance score reported by the service, 0.0 when absent
 */
public record MemoryItem(
        String id,
        String memory,
        List<String> categories,
        double score
) {

    /**
     * Compact constructor with validation.
     *
     * @throws NullPointerException if id or memory is null
     */
    public MemoryItem {
        Objects.requireNonNull(id, "Memory id must not be null");
        Objects.requireNonNull(memory, "Memory text must not be null");
        categories = categories == null ? List.of() : List.copyOf(categories);
    }
}
