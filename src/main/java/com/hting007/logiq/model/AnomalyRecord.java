package com.hting007.logiq.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * One detected deviation, handed to a sink and never changed afterwards.
 *
 * @param kind        FREQUENCY or PATTERN
 * @param stream      name of the monitored stream
 * @param detectedAt  wall-clock time of detection
 * @param windowStart start of the evaluated window
 * @param templateId  affected template, null for a global-rate spike
 * @param template    affected template text, null for a global-rate spike
 * @param observed    observed count (0 for PATTERN)
 * @param expected    threshold the count was compared with (0 for PATTERN)
 * @param severity    (observed - mean) / effectiveStd, 0 for PATTERN
 * @param description human readable summary
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnomalyRecord(
        AnomalyKind kind,
        String stream,
        Instant detectedAt,
        Instant windowStart,
        String templateId,
        String template,
        long observed,
        double expected,
        double severity,
        String description
) {}
