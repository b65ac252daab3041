package com.hting007.logiq.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Counts for one window.
 *
 * @param windowStart    floored start of the window
 * @param total          every event in the window, blank lines included
 * @param templateCounts occurrences per template id, in first-seen order
 * @param templates      template text per template id
 */
public record WindowSnapshot(
        Instant windowStart,
        long total,
        Map<String, Long> templateCounts,
        Map<String, String> templates
) {
    public WindowSnapshot {
        templateCounts = Collections.unmodifiableMap(new LinkedHashMap<>(templateCounts));
        templates = Collections.unmodifiableMap(new LinkedHashMap<>(templates));
    }

    public static WindowSnapshot empty(Instant windowStart) {
        return new WindowSnapshot(windowStart, 0, Map.of(), Map.of());
    }

    public boolean isEmpty() {
        return total == 0;
    }

    public Set<String> distinctTemplateIds() {
        return templateCounts.keySet();
    }

    public long countOf(String templateId) {
        return templateCounts.getOrDefault(templateId, 0L);
    }

    public String templateOf(String templateId) {
        return templates.getOrDefault(templateId, "");
    }
}
