package com.hting007.logiq.detect;

import com.hting007.logiq.config.DetectorConfig;
import com.hting007.logiq.model.WindowSnapshot;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class BaselineModelTest {

    private static final Instant T0 = Instant.parse("2026-01-28T10:00:00Z");

    private static WindowSnapshot window(int index, long total) {
        Instant start = T0.plusSeconds(2L * index);
        if (total == 0) return WindowSnapshot.empty(start);
        return new WindowSnapshot(start, total, Map.of("t1", total), Map.of("t1", "User <*> logged in"));
    }

    @Test
    void quietWindowsDoNotCountTowardsLearning() {
        var model = new BaselineModel(DetectorConfig.defaults());

        assertFalse(model.learn(window(0, 0)));
        for (int i = 1; i <= 4; i++) {
            assertTrue(model.learn(window(i, 10)));
            assertFalse(model.learn(window(i, 0)));
        }
        assertTrue(model.isLearning());
        assertEquals(4, model.learnedWindows());

        model.learn(window(5, 10));

        assertEquals(BaselineModel.Phase.ACTIVE, model.phase());
        assertEquals(List.of(10L, 10L, 10L, 10L, 10L), model.history());
        assertEquals(List.of(10L, 10L, 10L, 10L, 10L), model.templateHistory("t1"));
    }

    @Test
    void thresholdBeforeActiveIsAContractViolation() {
        var model = new BaselineModel(DetectorConfig.defaults());
        model.learn(window(0, 10));

        var e = assertThrows(BaselineNotReadyException.class, model::threshold);
        assertTrue(e.getMessage().contains("1/5"));
        assertThrows(IllegalStateException.class, () -> model.templateThreshold("t1"));
        assertThrows(IllegalStateException.class, () -> model.record(3));
    }

    @Test
    void learningEndsOnceForTheRun() {
        var model = new BaselineModel(DetectorConfig.defaults());
        for (int i = 0; i < 5; i++) model.learn(window(i, 10));

        assertThrows(IllegalStateException.class, () -> model.learn(window(6, 10)));
        assertFalse(model.isLearning());
    }

    @Test
    void flatHistoryUsesAbsoluteFloor() {
        var model = new BaselineModel(DetectorConfig.defaults());
        for (int i = 0; i < 5; i++) model.learn(window(i, 10));

        Threshold t = model.threshold();

        assertEquals(10.0, t.mean(), 1e-9);
        assertEquals(0.0, t.std(), 1e-9);
        assertEquals(1.0, t.effectiveStd(), 1e-9);
        assertEquals(14.0, t.value(), 1e-9);
        assertEquals(35.0, t.severityOf(45), 1e-9);
    }

    @Test
    void busyFlatHistoryUsesRatioFloor() {
        var model = new BaselineModel(DetectorConfig.defaults());
        for (int i = 0; i < 5; i++) model.learn(window(i, 100));

        Threshold t = model.threshold();

        assertEquals(5.0, t.effectiveStd(), 1e-9);
        assertEquals(120.0, t.value(), 1e-9);
        assertFalse(t.isExceededBy(120));
        assertTrue(t.isExceededBy(121));
    }

    @Test
    void noisyHistoryUsesItsOwnDeviation() {
        var model = new BaselineModel(DetectorConfig.defaults());
        long[] counts = {10, 20, 10, 20, 10};
        for (int i = 0; i < counts.length; i++) model.learn(window(i, counts[i]));

        Threshold t = model.threshold();

        assertEquals(14.0, t.mean(), 1e-9);
        assertEquals(Math.sqrt(24.0), t.std(), 1e-9);
        assertEquals(t.std(), t.effectiveStd(), 1e-9);
        assertEquals(14.0 + 4 * Math.sqrt(24.0), t.value(), 1e-9);
    }

    @Test
    void templateThresholdUsesSampleDeviation() {
        var model = new BaselineModel(DetectorConfig.defaults());
        long[] counts = {10, 20, 10, 20, 10};
        for (int i = 0; i < counts.length; i++) model.learn(window(i, counts[i]));

        Threshold t = model.templateThreshold("t1").orElseThrow();

        assertEquals(14.0, t.mean(), 1e-9);
        assertEquals(Math.sqrt(30.0), t.std(), 1e-9);
        assertEquals(14.0 + 4 * Math.sqrt(30.0), t.value(), 1e-9);
        // the global threshold over the same counts keeps the population deviation
        assertEquals(Math.sqrt(24.0), model.threshold().std(), 1e-9);
    }

    @Test
    void templateThresholdIsEmptyWithoutHistory() {
        var model = new BaselineModel(DetectorConfig.defaults());
        for (int i = 0; i < 5; i++) model.learn(window(i, 10));

        assertTrue(model.templateThreshold("never-seen").isEmpty());
        assertEquals(14.0, model.templateThreshold("t1").orElseThrow().value(), 1e-9);
        assertEquals(List.of(), model.templateHistory("never-seen"));
    }

    @Test
    void historyEvictsOldestFirst() {
        var h = new BaselineHistory(3);
        for (long v = 1; v <= 5; v++) h.add(v);

        assertEquals(List.of(3L, 4L, 5L), h.values());
        assertEquals(4.0, h.mean(), 1e-9);
        assertEquals(3, h.capacity());
    }

    @Test
    void emptyAndSingleHistoriesHaveNoDeviation() {
        var h = new BaselineHistory(3);
        assertEquals(0.0, h.mean());
        assertEquals(0.0, h.std());
        h.add(7);
        assertEquals(0.0, h.std());
        assertEquals(0.0, h.sampleStd());
    }
}
