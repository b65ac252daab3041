package com.hting007.logiq.detect;

import com.hting007.logiq.config.DetectionMode;
import com.hting007.logiq.config.DetectorConfig;
import com.hting007.logiq.model.AnomalyKind;
import com.hting007.logiq.model.AnomalyRecord;
import com.hting007.logiq.model.WindowSnapshot;
import lombok.extern.log4j.Log4j2;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Evaluates windows of one stream in order.
 *
 * <p>While the baseline is learning, non-empty windows feed the baseline and every template
 * they contain becomes normal. Afterwards each window gets two independent checks:
 * <ul>
 *   <li>FREQUENCY, delegated to the configured {@link FrequencyCheck};</li>
 *   <li>PATTERN, one record for each template id never seen before in this run.</li>
 * </ul>
 * A window may produce any number of records.
 */
@Log4j2
public class AnomalyEngine {

    static final int MAX_TEMPLATE_CHARS = 180;

    private final String stream;
    private final BaselineModel baseline;
    private final SeenTemplateSet seen;
    private final FrequencyCheck frequencyCheck;
    private final Clock clock;

    public AnomalyEngine(String stream, BaselineModel baseline, SeenTemplateSet seen,
                         FrequencyCheck frequencyCheck, Clock clock) {
        this.stream = stream;
        this.baseline = baseline;
        this.seen = seen;
        this.frequencyCheck = frequencyCheck;
        this.clock = clock;
    }

    /**
     * Cold-start engine with its own baseline and seen set.
     */
    public static AnomalyEngine create(String stream, DetectorConfig config, Clock clock) {
        return new AnomalyEngine(stream, new BaselineModel(config), new SeenTemplateSet(),
                frequencyCheckFor(config), clock);
    }

    public static FrequencyCheck frequencyCheckFor(DetectorConfig config) {
        return config.getTemplateSimilarityMode() == DetectionMode.PER_TEMPLATE
                ? new PerTemplateRateCheck(config.getNoiseThresholdMean())
                : new GlobalRateCheck();
    }

    public List<AnomalyRecord> evaluate(WindowSnapshot window) {
        if (baseline.isLearning()) {
            if (baseline.learn(window)) {
                seen.commitAll(window.distinctTemplateIds());
            }
            return List.of();
        }

        List<AnomalyRecord> out = new ArrayList<>();

        for (FrequencyCheck.Spike spike : frequencyCheck.evaluate(window, baseline)) {
            out.add(frequencyRecord(window, spike));
        }

        for (String id : window.distinctTemplateIds()) {
            if (seen.addIfAbsent(id)) {
                out.add(patternRecord(window, id));
            }
        }

        return out;
    }

    public BaselineModel baseline() {
        return baseline;
    }

    public SeenTemplateSet seenTemplates() {
        return seen;
    }

    private AnomalyRecord frequencyRecord(WindowSnapshot window, FrequencyCheck.Spike spike) {
        Threshold t = spike.threshold();
        String description;
        if (spike.templateId() == null) {
            description = String.format(Locale.ROOT,
                    "[FREQUENCY] Spike: %d events in window (threshold %.2f, mean %.2f, std %.2f)",
                    spike.observed(), t.value(), t.mean(), t.std());
        } else {
            description = String.format(Locale.ROOT,
                    "[FREQUENCY] Template %s: %d events in window (threshold %.2f, mean %.2f, std %.2f)",
                    spike.templateId(), spike.observed(), t.value(), t.mean(), t.std());
        }
        log.warn("{} stream={} window={}", description, stream, window.windowStart());

        return new AnomalyRecord(AnomalyKind.FREQUENCY, stream, clock.instant(), window.windowStart(),
                spike.templateId(), spike.template(), spike.observed(), t.value(), spike.severity(), description);
    }

    private AnomalyRecord patternRecord(WindowSnapshot window, String templateId) {
        String template = window.templateOf(templateId);
        String description = "[PATTERN] New template: " + shorten(template);
        log.warn("{} stream={} id={}", description, stream, templateId);

        return new AnomalyRecord(AnomalyKind.PATTERN, stream, clock.instant(), window.windowStart(),
                templateId, template, 0, 0.0, 0.0, description);
    }

    static String shorten(String template) {
        if (template.length() <= MAX_TEMPLATE_CHARS) return template;
        return template.substring(0, MAX_TEMPLATE_CHARS - 3) + "...";
    }
}
