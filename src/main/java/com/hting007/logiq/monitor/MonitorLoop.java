package com.hting007.logiq.monitor;

import com.hting007.logiq.config.DetectorConfig;
import com.hting007.logiq.detect.WindowAggregator;
import com.hting007.logiq.io.EventSource;
import com.hting007.logiq.io.RetryPolicy;
import com.hting007.logiq.io.TransientIoException;
import com.hting007.logiq.model.AnomalyRecord;
import com.hting007.logiq.model.LogEvent;
import com.hting007.logiq.model.WindowSnapshot;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic pipeline of one stream: every poll interval, fetch the events of the last
 * window from the source, aggregate them and let the stream monitor evaluate the window.
 *
 * <p>A fetch that still fails after the retry policy gives up skips the tick without
 * touching the baseline; the next tick tries again.
 */
@Log4j2
public class MonitorLoop implements AutoCloseable {

    private final StreamMonitor monitor;
    private final EventSource source;
    private final WindowAggregator aggregator;
    private final RetryPolicy retry;
    private final int pollIntervalSeconds;
    private final Clock clock;

    private ScheduledExecutorService scheduler;

    @Getter
    private volatile long skippedTicks;

    public MonitorLoop(StreamMonitor monitor, EventSource source, WindowAggregator aggregator,
                       RetryPolicy retry, int pollIntervalSeconds, Clock clock) {
        this.monitor = monitor;
        this.source = source;
        this.aggregator = aggregator;
        this.retry = retry;
        this.pollIntervalSeconds = pollIntervalSeconds;
        this.clock = clock;
    }

    public static MonitorLoop create(StreamMonitor monitor, EventSource source, DetectorConfig config, Clock clock) {
        return new MonitorLoop(monitor, source, new WindowAggregator(config.getWindowSizeSeconds()),
                RetryPolicy.from(config), config.getPollIntervalSeconds(), clock);
    }

    public synchronized void start() {
        if (scheduler != null) throw new IllegalStateException("Monitor loop already started");

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "monitor-" + monitor.getName());
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::runTick, pollIntervalSeconds, pollIntervalSeconds, TimeUnit.SECONDS);
        log.info("Monitoring stream {} every {}s over {}s windows",
                monitor.getName(), pollIntervalSeconds, aggregator.getWindowSeconds());
    }

    /**
     * One iteration of the loop.
     *
     * @return the anomalies of the evaluated window, or empty when the tick was skipped
     */
    public Optional<List<AnomalyRecord>> tick() {
        Instant to = clock.instant();
        Instant from = to.minusSeconds(aggregator.getWindowSeconds());

        List<LogEvent> events;
        try {
            events = retry.execute("fetch events", () -> source.fetch(from, to));
        } catch (TransientIoException e) {
            skippedTicks++;
            log.error("Event source unavailable, window at {} skipped on stream {}: {}",
                    from, monitor.getName(), e.getMessage());
            return Optional.empty();
        }

        WindowSnapshot window = aggregator.snapshot(aggregator.windowStart(from), events);
        return Optional.of(monitor.process(window));
    }

    // a scheduled task that throws is never run again
    private void runTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("Unexpected failure on stream {}, continuing with next tick", monitor.getName(), e);
        }
    }

    @Override
    public synchronized void close() {
        if (scheduler == null) return;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(pollIntervalSeconds * 2L, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Stopped monitoring stream {}", monitor.getName());
    }
}
