package com.hting007.logiq.io;

import com.hting007.logiq.model.LogEvent;

import java.time.Instant;
import java.util.List;

/**
 * Pull side of the pipeline.
 */
public interface EventSource {

    /**
     * Events with {@code from <= timestamp < to}. An empty list is a quiet window, not an error.
     *
     * @throws TransientIoException when the backing store cannot be reached right now
     */
    List<LogEvent> fetch(Instant from, Instant to) throws TransientIoException;
}
