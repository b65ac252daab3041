package com.hting007.logiq.detect;

import com.hting007.logiq.config.DetectorConfig;
import com.hting007.logiq.model.WindowSnapshot;
import lombok.extern.log4j.Log4j2;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rolling traffic baseline of one stream.
 *
 * <p>Starts in {@link Phase#LEARNING}, where non-empty windows are appended unconditionally.
 * After {@code learningWindowCount} of them it moves to {@link Phase#ACTIVE} for the rest
 * of the run. Thresholds are only available once ACTIVE; from then on the detector decides
 * which counts are appended, so spikes never reach the history.
 *
 * <p>Keeps a global history of window totals and one history per template.
 */
@Log4j2
public class BaselineModel {

    public enum Phase { LEARNING, ACTIVE }

    private final DetectorConfig config;
    private final BaselineHistory global;
    private final Map<String, BaselineHistory> perTemplate = new HashMap<>();

    private Phase phase = Phase.LEARNING;
    private int learnedWindows;

    public BaselineModel(DetectorConfig config) {
        this.config = config;
        this.global = new BaselineHistory(config.getHistoryCapacity());
    }

    public Phase phase() {
        return phase;
    }

    public boolean isLearning() {
        return phase == Phase.LEARNING;
    }

    public int learnedWindows() {
        return learnedWindows;
    }

    /**
     * Feeds one window during the learning phase.
     *
     * @return false when the window was empty and therefore ignored
     * @throws IllegalStateException once the baseline is ACTIVE
     */
    public boolean learn(WindowSnapshot window) {
        if (phase == Phase.ACTIVE) {
            throw new IllegalStateException("Baseline already established, learning is over");
        }
        if (window.isEmpty()) {
            log.debug("Quiet window {} skipped while learning", window.windowStart());
            return false;
        }

        global.add(window.total());
        window.templateCounts().forEach(this::appendTemplate);
        learnedWindows++;
        log.debug("Learning {}/{}: {} events", learnedWindows, config.getLearningWindowCount(), window.total());

        if (learnedWindows >= config.getLearningWindowCount()) {
            phase = Phase.ACTIVE;
            log.info("Baseline established after {} windows: mean={} std={} templates={}",
                    learnedWindows, String.format("%.2f", global.mean()), String.format("%.2f", global.std()),
                    perTemplate.size());
        }
        return true;
    }

    public Threshold threshold() {
        requireActive();
        return Threshold.of(global, config);
    }

    /**
     * Threshold for one template, empty when the template has no history yet. Unlike
     * {@link #threshold()} it uses the sample standard deviation.
     */
    public Optional<Threshold> templateThreshold(String templateId) {
        requireActive();
        BaselineHistory h = perTemplate.get(templateId);
        if (h == null || h.isEmpty()) return Optional.empty();
        return Optional.of(Threshold.ofSample(h, config));
    }

    /** Appends a window total judged normal. */
    public void record(long count) {
        requireActive();
        global.add(count);
    }

    /** Appends a per-template count judged normal. */
    public void recordTemplate(String templateId, long count) {
        requireActive();
        appendTemplate(templateId, count);
    }

    public List<Long> history() {
        return global.values();
    }

    public List<Long> templateHistory(String templateId) {
        BaselineHistory h = perTemplate.get(templateId);
        return h == null ? List.of() : h.values();
    }

    private void appendTemplate(String templateId, long count) {
        perTemplate.computeIfAbsent(templateId, k -> new BaselineHistory(config.templateHistoryCapacity()))
                .add(count);
    }

    private void requireActive() {
        if (phase != Phase.ACTIVE) {
            throw new BaselineNotReadyException(learnedWindows, config.getLearningWindowCount());
        }
    }
}
