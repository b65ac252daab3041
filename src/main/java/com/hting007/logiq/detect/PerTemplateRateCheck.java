package com.hting007.logiq.detect;

import com.hting007.logiq.model.WindowSnapshot;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Compares each template's window count against that template's own baseline.
 * Templates whose historical mean is below the noise floor are never flagged; their
 * counts are still recorded so they can grow out of it.
 */
@Log4j2
public class PerTemplateRateCheck implements FrequencyCheck {

    private final double noiseThresholdMean;

    public PerTemplateRateCheck(double noiseThresholdMean) {
        this.noiseThresholdMean = noiseThresholdMean;
    }

    @Override
    public List<Spike> evaluate(WindowSnapshot window, BaselineModel baseline) {
        List<Spike> spikes = new ArrayList<>();

        for (Map.Entry<String, Long> e : window.templateCounts().entrySet()) {
            String id = e.getKey();
            long observed = e.getValue();

            Optional<Threshold> t = baseline.templateThreshold(id);
            if (t.isEmpty()) {
                // first window of a template: nothing to compare with yet
                baseline.recordTemplate(id, observed);
                continue;
            }
            if (t.get().mean() < noiseThresholdMean) {
                log.debug("Template {} below noise floor (mean {}), not checked", id,
                        String.format("%.2f", t.get().mean()));
                baseline.recordTemplate(id, observed);
                continue;
            }
            if (t.get().isExceededBy(observed)) {
                spikes.add(new Spike(id, window.templateOf(id), observed, t.get()));
            } else {
                baseline.recordTemplate(id, observed);
            }
        }
        return spikes;
    }
}
