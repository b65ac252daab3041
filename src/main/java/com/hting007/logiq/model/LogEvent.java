package com.hting007.logiq.model;

import java.time.Instant;

/**
 * One mined log line placed on the time axis.
 *
 * @param timestamp  when the line was logged (replay) or received (follow)
 * @param templateId fingerprint of the template, empty for blank lines
 * @param template   template text, empty for blank lines
 */
public record LogEvent(
        Instant timestamp,
        String templateId,
        String template
) {
    public static LogEvent of(Instant timestamp, ParsedLine parsed) {
        return new LogEvent(timestamp, parsed.templateId(), parsed.template());
    }

    public boolean hasTemplate() {
        return templateId != null && !templateId.isEmpty();
    }
}
