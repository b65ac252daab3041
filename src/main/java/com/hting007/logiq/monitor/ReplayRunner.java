package com.hting007.logiq.monitor;

import com.hting007.logiq.detect.WindowAggregator;
import com.hting007.logiq.model.AnomalyRecord;
import com.hting007.logiq.model.LogEvent;
import com.hting007.logiq.model.ParsedLine;
import com.hting007.logiq.model.WindowSnapshot;
import com.hting007.logiq.parse.LogLineTimestamps;
import com.hting007.logiq.parse.TemplateMiner;
import lombok.extern.log4j.Log4j2;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs a recorded log through the same pipeline as the live loop, using the timestamps
 * written in the lines instead of arrival time. Windows are evaluated oldest first,
 * quiet windows included up to {@code maxQuietWindows} per gap. Past the history
 * capacity more quiet windows change nothing: the history is all zeros by then.
 */
@Log4j2
public class ReplayRunner {

    public record Result(
            long totalLines,
            long parsedLines,
            long skippedLines,
            int windows,
            List<LogEvent> events,
            List<AnomalyRecord> anomalies
    ) {}

    private final TemplateMiner miner;
    private final LogLineTimestamps timestamps;
    private final WindowAggregator aggregator;
    private final int maxQuietWindows;

    public ReplayRunner(TemplateMiner miner, LogLineTimestamps timestamps, WindowAggregator aggregator,
                        int maxQuietWindows) {
        this.miner = miner;
        this.timestamps = timestamps;
        this.aggregator = aggregator;
        this.maxQuietWindows = maxQuietWindows;
    }

    public Result run(BufferedReader reader, StreamMonitor monitor) throws IOException {
        long total = 0;
        long parsed = 0;
        long skipped = 0;
        List<LogEvent> events = new ArrayList<>();

        String line;
        while ((line = reader.readLine()) != null) {
            total++;

            var ts = timestamps.read(line);
            if (ts.isEmpty()) {
                skipped++; // no timestamp -> can't bucket
                continue;
            }
            parsed++;

            ParsedLine p = miner.parse(line);
            events.add(LogEvent.of(ts.get(), p));
        }

        List<AnomalyRecord> anomalies = new ArrayList<>();
        var windows = aggregator.windows(events, maxQuietWindows);
        for (WindowSnapshot w : windows.values()) {
            anomalies.addAll(monitor.process(w));
        }

        log.info("Replayed {} lines ({} skipped) over {} windows: {} anomalies",
                total, skipped, windows.size(), anomalies.size());
        return new Result(total, parsed, skipped, windows.size(), events, anomalies);
    }
}
