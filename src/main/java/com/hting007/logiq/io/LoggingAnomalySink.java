package com.hting007.logiq.io;

import com.hting007.logiq.model.AnomalyRecord;
import lombok.extern.log4j.Log4j2;

/**
 * Writes each anomaly to the log; used when no other destination is configured.
 */
@Log4j2
public class LoggingAnomalySink implements AnomalySink {

    @Override
    public void publish(AnomalyRecord record) {
        log.warn("ANOMALY kind={} stream={} window={} severity={} {}",
                record.kind(), record.stream(), record.windowStart(),
                String.format("%.2f", record.severity()), record.description());
    }
}
