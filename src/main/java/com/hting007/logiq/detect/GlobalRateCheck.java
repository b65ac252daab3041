package com.hting007.logiq.detect;

import com.hting007.logiq.model.WindowSnapshot;
import lombok.extern.log4j.Log4j2;

import java.util.List;

/**
 * Compares the window total against the global baseline; at most one spike per window.
 */
@Log4j2
public class GlobalRateCheck implements FrequencyCheck {

    @Override
    public List<Spike> evaluate(WindowSnapshot window, BaselineModel baseline) {
        Threshold t = baseline.threshold();
        long observed = window.total();

        if (t.isExceededBy(observed)) {
            return List.of(new Spike(null, null, observed, t));
        }

        baseline.record(observed);
        log.debug("Window {}: {} events, threshold {}", window.windowStart(), observed,
                String.format("%.2f", t.value()));
        return List.of();
    }
}
