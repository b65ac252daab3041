package com.hting007.logiq.detect;

import com.hting007.logiq.config.DetectionMode;
import com.hting007.logiq.config.DetectorConfig;
import com.hting007.logiq.model.AnomalyKind;
import com.hting007.logiq.model.AnomalyRecord;
import com.hting007.logiq.model.WindowSnapshot;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class AnomalyEngineTest {

    private static final Instant T0 = Instant.parse("2026-01-28T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-28T11:00:00Z"), ZoneOffset.UTC);

    /**
     * Window {@code index} holding the given template counts; the total is their sum.
     */
    private static WindowSnapshot window(int index, Object... idAndCount) {
        Map<String, Long> counts = new LinkedHashMap<>();
        Map<String, String> templates = new LinkedHashMap<>();
        long total = 0;
        for (int i = 0; i < idAndCount.length; i += 2) {
            String id = (String) idAndCount[i];
            long count = ((Number) idAndCount[i + 1]).longValue();
            counts.put(id, count);
            templates.put(id, "template " + id);
            total += count;
        }
        return new WindowSnapshot(T0.plusSeconds(2L * index), total, counts, templates);
    }

    private static AnomalyEngine globalEngine() {
        return AnomalyEngine.create("svc", DetectorConfig.defaults(), CLOCK);
    }

    private static void learn(AnomalyEngine engine, Object... idAndCount) {
        for (int i = 0; i < 5; i++) {
            assertTrue(engine.evaluate(window(i, idAndCount)).isEmpty());
        }
        assertFalse(engine.baseline().isLearning());
    }

    @Test
    void spikeAfterFlatLearningIsAFrequencyAnomaly() {
        var engine = globalEngine();
        learn(engine, "a", 10);

        List<AnomalyRecord> out = engine.evaluate(window(5, "a", 45));

        assertEquals(1, out.size());
        AnomalyRecord r = out.get(0);
        assertEquals(AnomalyKind.FREQUENCY, r.kind());
        assertEquals(45, r.observed());
        assertEquals(14.0, r.expected(), 1e-9);
        assertEquals(35.0, r.severity(), 1e-9);
        assertEquals("svc", r.stream());
        assertEquals(T0.plusSeconds(10), r.windowStart());
        assertEquals(CLOCK.instant(), r.detectedAt());
        assertNull(r.templateId());
        assertTrue(r.description().startsWith("[FREQUENCY]"));
    }

    @Test
    void spikesNeverEnterTheHistory() {
        var engine = globalEngine();
        learn(engine, "a", 10);

        assertEquals(1, engine.evaluate(window(5, "a", 200)).size());
        assertTrue(engine.evaluate(window(6, "a", 11)).isEmpty());

        assertEquals(List.of(10L, 10L, 10L, 10L, 10L, 11L), engine.baseline().history());
    }

    @Test
    void countAtThresholdIsNormal() {
        var engine = globalEngine();
        learn(engine, "a", 10);

        assertTrue(engine.evaluate(window(5, "a", 14)).isEmpty());
        assertEquals(14L, engine.baseline().history().get(5));
    }

    @Test
    void newTemplateIsReportedOnlyOnFirstSighting() {
        var engine = globalEngine();
        learn(engine, "a", 10);

        List<List<AnomalyRecord>> perWindow = new ArrayList<>();
        for (int i = 5; i <= 7; i++) {
            perWindow.add(engine.evaluate(window(i, "a", 9, "new", 1)));
        }

        assertEquals(1, perWindow.get(0).size());
        AnomalyRecord r = perWindow.get(0).get(0);
        assertEquals(AnomalyKind.PATTERN, r.kind());
        assertEquals("new", r.templateId());
        assertEquals("template new", r.template());
        assertEquals(0.0, r.severity());
        assertEquals("[PATTERN] New template: template new", r.description());
        assertTrue(perWindow.get(1).isEmpty());
        assertTrue(perWindow.get(2).isEmpty());
    }

    @Test
    void templatesSeenWhileLearningAreNormal() {
        var engine = globalEngine();
        engine.evaluate(window(0, "a", 10));
        engine.evaluate(window(1, "a", 8, "b", 2));
        engine.evaluate(window(2, "a", 10));
        engine.evaluate(window(3, "a", 10));
        engine.evaluate(window(4, "a", 10));

        assertTrue(engine.evaluate(window(5, "a", 5, "b", 5)).isEmpty());
        assertEquals(2, engine.seenTemplates().size());
    }

    @Test
    void oneWindowCanCarryBothKinds() {
        var engine = globalEngine();
        learn(engine, "a", 10);

        List<AnomalyRecord> out = engine.evaluate(window(5, "a", 40, "x", 3, "y", 2));

        assertEquals(3, out.size());
        assertEquals(AnomalyKind.FREQUENCY, out.get(0).kind());
        assertEquals(45, out.get(0).observed());
        assertEquals("x", out.get(1).templateId());
        assertEquals("y", out.get(2).templateId());
    }

    @Test
    void nothingIsReportedWhileLearning() {
        var engine = globalEngine();

        assertTrue(engine.evaluate(window(0, "a", 10)).isEmpty());
        assertTrue(engine.evaluate(window(1, "a", 500, "b", 3)).isEmpty());
        assertTrue(engine.evaluate(WindowSnapshot.empty(T0.plusSeconds(4))).isEmpty());
        assertTrue(engine.baseline().isLearning());
        assertEquals(2, engine.baseline().learnedWindows());
    }

    @Test
    void quietActiveWindowIsRecorded() {
        var engine = globalEngine();
        learn(engine, "a", 10);

        assertTrue(engine.evaluate(WindowSnapshot.empty(T0.plusSeconds(10))).isEmpty());
        assertEquals(0L, engine.baseline().history().get(5));
    }

    @Test
    void perTemplateModeIgnoresNoisyTemplates() {
        var config = DetectorConfig.builder()
                .templateSimilarityMode(DetectionMode.PER_TEMPLATE)
                .noiseThresholdMean(10)
                .build();
        var engine = AnomalyEngine.create("svc", config, CLOCK);
        learn(engine, "noisy", 3, "busy", 20);

        assertTrue(engine.evaluate(window(5, "noisy", 50, "busy", 20)).isEmpty());

        List<AnomalyRecord> out = engine.evaluate(window(6, "noisy", 3, "busy", 200));
        assertEquals(1, out.size());
        AnomalyRecord r = out.get(0);
        assertEquals(AnomalyKind.FREQUENCY, r.kind());
        assertEquals("busy", r.templateId());
        assertEquals("template busy", r.template());
        assertEquals(24.0, r.expected(), 1e-9);
        assertEquals(180.0, r.severity(), 1e-9);

        assertEquals(List.of(20L, 20L, 20L, 20L, 20L, 20L), engine.baseline().templateHistory("busy"));
        assertEquals(List.of(3L, 3L, 3L, 3L, 3L, 50L, 3L), engine.baseline().templateHistory("noisy"));
    }

    @Test
    void perTemplateThresholdFollowsSampleDeviation() {
        var config = DetectorConfig.builder().templateSimilarityMode(DetectionMode.PER_TEMPLATE).build();
        var engine = AnomalyEngine.create("svc", config, CLOCK);
        long[] counts = {10, 20, 10, 20, 10};
        for (int i = 0; i < counts.length; i++) {
            assertTrue(engine.evaluate(window(i, "jobs", counts[i])).isEmpty());
        }

        // 14 + 4 * sqrt(30) = 35.91; with a population deviation it would be 33.60
        assertTrue(engine.evaluate(window(5, "jobs", 35)).isEmpty());

        // 35 joined the history: 17.5 + 4 * sqrt(97.5) = 57.0
        List<AnomalyRecord> out = engine.evaluate(window(6, "jobs", 60));
        assertEquals(1, out.size());
        assertEquals("jobs", out.get(0).templateId());
        assertEquals(17.5 + 4 * Math.sqrt(97.5), out.get(0).expected(), 1e-9);
    }

    @Test
    void perTemplateModeStillReportsNewTemplates() {
        var config = DetectorConfig.builder().templateSimilarityMode(DetectionMode.PER_TEMPLATE).build();
        var engine = AnomalyEngine.create("svc", config, CLOCK);
        learn(engine, "busy", 20);

        List<AnomalyRecord> out = engine.evaluate(window(5, "busy", 20, "fresh", 500));

        assertEquals(1, out.size());
        assertEquals(AnomalyKind.PATTERN, out.get(0).kind());
        assertEquals(List.of(500L), engine.baseline().templateHistory("fresh"));
    }

    @Test
    void longTemplatesAreShortenedInDescriptions() {
        String longTemplate = "x".repeat(300);

        String shortened = AnomalyEngine.shorten(longTemplate);

        assertEquals(AnomalyEngine.MAX_TEMPLATE_CHARS, shortened.length());
        assertTrue(shortened.endsWith("..."));
        assertEquals("short", AnomalyEngine.shorten("short"));
    }
}
