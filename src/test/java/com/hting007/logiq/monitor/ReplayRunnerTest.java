package com.hting007.logiq.monitor;

import com.hting007.logiq.config.DetectorConfig;
import com.hting007.logiq.detect.AnomalyEngine;
import com.hting007.logiq.detect.WindowAggregator;
import com.hting007.logiq.io.RetryPolicy;
import com.hting007.logiq.model.AnomalyKind;
import com.hting007.logiq.model.AnomalyRecord;
import com.hting007.logiq.parse.LogLineTimestamps;
import com.hting007.logiq.parse.TemplateMiner;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

public class ReplayRunnerTest {

    private final TemplateMiner miner = new TemplateMiner();
    private final ReplayRunner runner = new ReplayRunner(miner, new LogLineTimestamps(ZoneOffset.UTC), new WindowAggregator(2), 10);
    private final RecordingSink sink = new RecordingSink(0);
    private final StreamMonitor monitor = new StreamMonitor("sample",
            AnomalyEngine.create("sample", DetectorConfig.defaults(), Clock.systemUTC()), sink,
            new RetryPolicy(1, 0));

    @Test
    void replaysSampleLogThroughThePipeline() throws Exception {
        ReplayRunner.Result result;
        try (var br = new BufferedReader(new InputStreamReader(
                getClass().getResourceAsStream("/sample.log"), StandardCharsets.UTF_8))) {
            result = runner.run(br, monitor);
        }

        assertEquals(131, result.totalLines());
        assertEquals(130, result.parsedLines());
        assertEquals(1, result.skippedLines());
        assertEquals(8, result.windows());
        assertEquals(3, miner.getStats().size());

        assertEquals(2, result.anomalies().size());
        AnomalyRecord spike = result.anomalies().get(0);
        assertEquals(AnomalyKind.FREQUENCY, spike.kind());
        assertEquals(Instant.parse("2026-01-28T10:00:10Z"), spike.windowStart());
        assertEquals(60, spike.observed());
        assertEquals(50.0, spike.severity(), 1e-9);

        AnomalyRecord novel = result.anomalies().get(1);
        assertEquals(AnomalyKind.PATTERN, novel.kind());
        assertEquals("security: SQL injection attempt detected", novel.template());
        assertEquals(Instant.parse("2026-01-28T10:00:12Z"), novel.windowStart());

        assertEquals(result.anomalies(), sink.records);
    }

    @Test
    void quietGapsBetweenLinesAreEvaluated() throws Exception {
        String log = "[2026-01-28 10:00:00] [INFO] a: job 1 done\n"
                + "[2026-01-28 10:00:09] [INFO] a: job 2 done\n";

        var result = runner.run(new BufferedReader(new StringReader(log)), monitor);

        assertEquals(5, result.windows());
        assertEquals(5, monitor.getWindowsEvaluated());
        assertEquals(2, monitor.engine().baseline().learnedWindows());
        assertTrue(result.anomalies().isEmpty());
    }

    @Test
    void lineWithAFarOffYearDoesNotFloodTheReplay() throws Exception {
        String log = "[2016-01-28 10:00:00] [INFO] a: job 1 done\n"
                + "[2026-01-28 10:00:00] [INFO] a: job 2 done\n";

        var result = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> runner.run(new BufferedReader(new StringReader(log)), monitor));

        assertEquals(2, result.parsedLines());
        assertEquals(12, result.windows());
        assertEquals(12, monitor.getWindowsEvaluated());
    }
}
