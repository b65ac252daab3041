package com.hting007.logiq.detect;

import com.hting007.logiq.model.LogEvent;
import com.hting007.logiq.model.WindowSnapshot;

import java.time.Instant;
import java.util.*;

/**
 * Buckets template events into fixed-width windows:
 * {@code windowStart = floor(epochSeconds / windowSeconds) * windowSeconds}.
 */
public class WindowAggregator {

    public record WindowKey(Instant windowStart, String templateId) {}

    private final int windowSeconds;

    public WindowAggregator(int windowSeconds) {
        if (windowSeconds <= 0) throw new IllegalArgumentException("windowSeconds must be > 0");
        this.windowSeconds = windowSeconds;
    }

    public int getWindowSeconds() {
        return windowSeconds;
    }

    public Instant windowStart(Instant ts) {
        long epoch = ts.getEpochSecond();
        long start = Math.floorDiv(epoch, (long) windowSeconds) * windowSeconds;
        return Instant.ofEpochSecond(start);
    }

    public Instant windowEnd(Instant windowStart) {
        return windowStart.plusSeconds(windowSeconds);
    }

    /**
     * Counts every given event into one window, regardless of its timestamp. This is the
     * poll form: the caller already fetched "what arrived during the last interval".
     */
    public WindowSnapshot snapshot(Instant windowStart, List<LogEvent> events) {
        long total = 0;
        Map<String, Long> counts = new LinkedHashMap<>();
        Map<String, String> templates = new LinkedHashMap<>();

        for (LogEvent e : events) {
            total++;
            if (!e.hasTemplate()) continue; // blank lines add to the volume only

            counts.merge(e.templateId(), 1L, Long::sum);
            templates.putIfAbsent(e.templateId(), e.template());
        }
        return new WindowSnapshot(windowStart, total, counts, templates);
    }

    /**
     * Groups events by floored window, oldest first. After each occupied window at most
     * {@code maxQuietWindows} of the quiet windows that follow it are present as empty
     * snapshots, so a far-off timestamp cannot blow up the number of windows.
     */
    public SortedMap<Instant, WindowSnapshot> windows(List<LogEvent> events, int maxQuietWindows) {
        if (maxQuietWindows < 0) throw new IllegalArgumentException("maxQuietWindows must be >= 0");

        SortedMap<Instant, List<LogEvent>> buckets = new TreeMap<>();
        for (LogEvent e : events) {
            buckets.computeIfAbsent(windowStart(e.timestamp()), k -> new ArrayList<>()).add(e);
        }

        SortedMap<Instant, WindowSnapshot> out = new TreeMap<>();
        Instant previous = null;
        for (var entry : buckets.entrySet()) {
            if (previous != null) {
                Instant ws = windowEnd(previous);
                for (int filled = 0; filled < maxQuietWindows && ws.isBefore(entry.getKey()); filled++) {
                    out.put(ws, WindowSnapshot.empty(ws));
                    ws = windowEnd(ws);
                }
            }
            out.put(entry.getKey(), snapshot(entry.getKey(), entry.getValue()));
            previous = entry.getKey();
        }
        return out;
    }

    /**
     * Per-template counts for every window in which the template occurred, ordered by
     * window then template id. Events without a template are left out.
     */
    public Map<WindowKey, Long> countByTemplate(List<LogEvent> events) {
        // deterministic order for output/testing
        Map<WindowKey, Long> counts = new TreeMap<>(Comparator
                .comparing((WindowKey wk) -> wk.windowStart())
                .thenComparing(wk -> wk.templateId()));

        for (LogEvent e : events) {
            if (!e.hasTemplate()) continue;

            WindowKey wk = new WindowKey(windowStart(e.timestamp()), e.templateId());
            counts.put(wk, counts.getOrDefault(wk, 0L) + 1);
        }

        return counts;
    }

    /**
     * Like {@link #countByTemplate(List)} restricted to events in {@code [now - lookbackSeconds, now)}.
     */
    public Map<WindowKey, Long> countByTemplate(List<LogEvent> events, Instant now, int lookbackSeconds) {
        Instant from = now.minusSeconds(lookbackSeconds);
        List<LogEvent> recent = new ArrayList<>();
        for (LogEvent e : events) {
            if (!e.timestamp().isBefore(from) && e.timestamp().isBefore(now)) recent.add(e);
        }
        return countByTemplate(recent);
    }
}
