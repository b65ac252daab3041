package com.hting007.logiq.model;

import java.util.List;

/**
 * Result of mining a single raw line.
 */
public record ParsedLine(
        String templateId,
        String template,
        List<String> parameters
) {
    /** Returned for blank input: no tokens, no template. */
    public static final ParsedLine EMPTY = new ParsedLine("", "", List.of());

    public ParsedLine {
        parameters = List.copyOf(parameters);
    }

    public boolean isEmpty() {
        return templateId.isEmpty();
    }
}
