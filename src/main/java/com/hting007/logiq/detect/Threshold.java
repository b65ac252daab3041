package com.hting007.logiq.detect;

import com.hting007.logiq.config.DetectorConfig;

/**
 * Upper bound derived from a history:
 * {@code effectiveStd = max(std, floorAbs, mean * floorRatio)},
 * {@code value = mean + k * effectiveStd}.
 * The floor keeps {@code effectiveStd} strictly positive whenever {@code floorAbs > 0}.
 */
public record Threshold(double mean, double std, double effectiveStd, double value) {

    public static Threshold of(double mean, double std, DetectorConfig config) {
        double effectiveStd = Math.max(std, Math.max(config.getMinStdFloorAbs(), mean * config.getMinStdFloorRatio()));
        return new Threshold(mean, std, effectiveStd, mean + config.getSigmaMultiplier() * effectiveStd);
    }

    /** Global window totals: population deviation over the history. */
    public static Threshold of(BaselineHistory history, DetectorConfig config) {
        return of(history.mean(), history.std(), config);
    }

    /** Per-template counts: sample deviation over the history. */
    public static Threshold ofSample(BaselineHistory history, DetectorConfig config) {
        return of(history.mean(), history.sampleStd(), config);
    }

    public boolean isExceededBy(long observed) {
        return observed > value;
    }

    /** Distance of {@code observed} from the mean in effective standard deviations. */
    public double severityOf(long observed) {
        if (effectiveStd == 0.0) {
            // only reachable with both floors configured to 0
            return observed > mean ? Double.MAX_VALUE : 0.0;
        }
        return (observed - mean) / effectiveStd;
    }
}
