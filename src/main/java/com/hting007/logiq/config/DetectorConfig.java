package com.hting007.logiq.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Properties;

/**
 * Tunables for mining, windowing, the baseline and the I/O boundary.
 * Property names match the field names.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DetectorConfig {

    /**
     * Width of one evaluation window
     */
    @Builder.Default
    private int windowSizeSeconds = 2;

    /**
     * Delay between two ticks of the live loop
     */
    @Builder.Default
    private int pollIntervalSeconds = 2;

    /**
     * Non-empty windows observed before the baseline is trusted
     */
    @Builder.Default
    private int learningWindowCount = 5;

    /**
     * Capacity of the global rate history
     */
    @Builder.Default
    private int historyCapacity = 10;

    /**
     * Span of the per-template histories
     */
    @Builder.Default
    private int lookbackSeconds = 120;

    @Builder.Default
    private double sigmaMultiplier = 4.0;

    @Builder.Default
    private double minStdFloorAbs = 1.0;

    @Builder.Default
    private double minStdFloorRatio = 0.05;

    /**
     * Templates whose mean per-window count is below this are never frequency-checked
     */
    @Builder.Default
    private double noiseThresholdMean = 10.0;

    @Builder.Default
    private int maxTreeDepth = 5;

    @Builder.Default
    private DetectionMode templateSimilarityMode = DetectionMode.GLOBAL_RATE;

    @Builder.Default
    private int retryMaxAttempts = 3;

    @Builder.Default
    private long retryBackoffMillis = 500;

    public static DetectorConfig defaults() {
        return DetectorConfig.builder().build();
    }

    /**
     * Number of windows kept per template: the lookback divided by the window width,
     * never fewer than the learning budget.
     */
    public int templateHistoryCapacity() {
        return Math.max(learningWindowCount, lookbackSeconds / windowSizeSeconds);
    }

    public DetectorConfig validate() {
        requirePositive("windowSizeSeconds", windowSizeSeconds);
        requirePositive("pollIntervalSeconds", pollIntervalSeconds);
        requirePositive("learningWindowCount", learningWindowCount);
        requirePositive("historyCapacity", historyCapacity);
        requirePositive("lookbackSeconds", lookbackSeconds);
        requirePositive("maxTreeDepth", maxTreeDepth);
        requirePositive("retryMaxAttempts", retryMaxAttempts);
        if (historyCapacity < learningWindowCount) {
            throw new IllegalArgumentException("historyCapacity (" + historyCapacity
                    + ") must be >= learningWindowCount (" + learningWindowCount + ")");
        }
        if (!(sigmaMultiplier > 0)) {
            throw new IllegalArgumentException("sigmaMultiplier must be > 0");
        }
        // written so that NaN fails too
        if (!(minStdFloorAbs >= 0) || !(minStdFloorRatio >= 0)) {
            throw new IllegalArgumentException("std floors must be >= 0");
        }
        if (!(noiseThresholdMean >= 0)) {
            throw new IllegalArgumentException("noiseThresholdMean must be >= 0");
        }
        if (retryBackoffMillis < 0) {
            throw new IllegalArgumentException("retryBackoffMillis must be >= 0");
        }
        if (templateSimilarityMode == null) {
            throw new IllegalArgumentException("templateSimilarityMode must be set");
        }
        return this;
    }

    /**
     * Reads the recognised options from {@code props}; absent keys keep their defaults
     * and unknown keys are ignored.
     */
    public static DetectorConfig fromProperties(Properties props) {
        DetectorConfig d = defaults();
        return DetectorConfig.builder()
                .windowSizeSeconds(intProp(props, "windowSizeSeconds", d.windowSizeSeconds))
                .pollIntervalSeconds(intProp(props, "pollIntervalSeconds", d.pollIntervalSeconds))
                .learningWindowCount(intProp(props, "learningWindowCount", d.learningWindowCount))
                .historyCapacity(intProp(props, "historyCapacity", d.historyCapacity))
                .lookbackSeconds(intProp(props, "lookbackSeconds", d.lookbackSeconds))
                .sigmaMultiplier(doubleProp(props, "sigmaMultiplier", d.sigmaMultiplier))
                .minStdFloorAbs(doubleProp(props, "minStdFloorAbs", d.minStdFloorAbs))
                .minStdFloorRatio(doubleProp(props, "minStdFloorRatio", d.minStdFloorRatio))
                .noiseThresholdMean(doubleProp(props, "noiseThresholdMean", d.noiseThresholdMean))
                .maxTreeDepth(intProp(props, "maxTreeDepth", d.maxTreeDepth))
                .templateSimilarityMode(props.getProperty("templateSimilarityMode") == null
                        ? d.templateSimilarityMode
                        : DetectionMode.parse(props.getProperty("templateSimilarityMode")))
                .retryMaxAttempts(intProp(props, "retryMaxAttempts", d.retryMaxAttempts))
                .retryBackoffMillis(longProp(props, "retryBackoffMillis", d.retryBackoffMillis))
                .build()
                .validate();
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) throw new IllegalArgumentException(name + " must be > 0");
    }

    private static int intProp(Properties props, String key, int fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got: " + raw, e);
        }
    }

    private static long longProp(Properties props, String key, long fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got: " + raw, e);
        }
    }

    private static double doubleProp(Properties props, String key, double fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number, got: " + raw, e);
        }
    }
}
