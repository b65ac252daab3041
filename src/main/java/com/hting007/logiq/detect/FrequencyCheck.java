package com.hting007.logiq.detect;

import com.hting007.logiq.model.WindowSnapshot;

import java.util.List;

/**
 * Volume check run on every window once the baseline is ACTIVE. Implementations append
 * the counts they judge normal to the baseline and leave spikes out.
 */
public interface FrequencyCheck {

    /**
     * One over-threshold count.
     *
     * @param templateId null for the global rate
     */
    record Spike(String templateId, String template, long observed, Threshold threshold) {

        public double severity() {
            return threshold.severityOf(observed);
        }
    }

    List<Spike> evaluate(WindowSnapshot window, BaselineModel baseline);
}
