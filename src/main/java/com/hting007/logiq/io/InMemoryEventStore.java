package com.hting007.logiq.io;

import com.hting007.logiq.model.LogEvent;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Event source fed in-process, e.g. by a file tailer. Events are expected in roughly
 * increasing time order; anything older than the retention is dropped on append.
 * Safe for one or more writers and a polling reader.
 */
public class InMemoryEventStore implements EventSource {

    private final Deque<LogEvent> events = new ArrayDeque<>();
    private final Duration retention;
    private final Clock clock;

    public InMemoryEventStore(Duration retention, Clock clock) {
        this.retention = retention;
        this.clock = clock;
    }

    public synchronized void append(LogEvent event) {
        events.addLast(event);
        Instant horizon = clock.instant().minus(retention);
        while (!events.isEmpty() && events.peekFirst().timestamp().isBefore(horizon)) {
            events.removeFirst();
        }
    }

    @Override
    public synchronized List<LogEvent> fetch(Instant from, Instant to) {
        List<LogEvent> out = new ArrayList<>();
        for (LogEvent e : events) {
            if (!e.timestamp().isBefore(from) && e.timestamp().isBefore(to)) out.add(e);
        }
        return out;
    }

    public synchronized int size() {
        return events.size();
    }
}
