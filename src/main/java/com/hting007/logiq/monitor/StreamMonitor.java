package com.hting007.logiq.monitor;

import com.hting007.logiq.config.DetectorConfig;
import com.hting007.logiq.detect.AnomalyEngine;
import com.hting007.logiq.io.AnomalySink;
import com.hting007.logiq.io.RetryPolicy;
import com.hting007.logiq.io.TransientIoException;
import com.hting007.logiq.model.AnomalyRecord;
import com.hting007.logiq.model.WindowSnapshot;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;

import java.time.Clock;
import java.util.List;

/**
 * Everything one monitored stream owns: its baseline, its seen-template set (both inside
 * the engine) and the sink its anomalies go to. Streams never share these; they only share
 * the process-wide template miner upstream.
 *
 * <p>Not thread safe: a stream is driven by a single loop.
 */
@Log4j2
public class StreamMonitor {

    @Getter
    private final String name;
    private final AnomalyEngine engine;
    private final AnomalySink sink;
    private final RetryPolicy retry;

    @Getter
    private long windowsEvaluated;
    @Getter
    private long anomaliesPublished;
    @Getter
    private long deliveryFailures;

    public StreamMonitor(String name, AnomalyEngine engine, AnomalySink sink, RetryPolicy retry) {
        this.name = name;
        this.engine = engine;
        this.sink = sink;
        this.retry = retry;
    }

    public static StreamMonitor create(String name, DetectorConfig config, AnomalySink sink, Clock clock) {
        return new StreamMonitor(name, AnomalyEngine.create(name, config, clock), sink, RetryPolicy.from(config));
    }

    /**
     * Evaluates one window and hands every resulting record to the sink. Records the sink
     * refuses after all retries are logged at error level and still returned.
     */
    public List<AnomalyRecord> process(WindowSnapshot window) {
        List<AnomalyRecord> found = engine.evaluate(window);
        windowsEvaluated++;

        for (AnomalyRecord r : found) {
            publish(r);
        }
        return found;
    }

    public AnomalyEngine engine() {
        return engine;
    }

    private void publish(AnomalyRecord r) {
        try {
            retry.execute("publish anomaly", () -> {
                sink.publish(r);
                return null;
            });
            anomaliesPublished++;
        } catch (TransientIoException e) {
            deliveryFailures++;
            log.error("Anomaly not delivered on stream {}: kind={} window={} {}",
                    name, r.kind(), r.windowStart(), r.description(), e);
        }
    }
}
