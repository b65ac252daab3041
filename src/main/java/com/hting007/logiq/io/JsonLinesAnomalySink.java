package com.hting007.logiq.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hting007.logiq.model.AnomalyRecord;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * One JSON object per line, flushed after every record.
 */
public class JsonLinesAnomalySink implements AnomalySink, Closeable {

    private final ObjectMapper mapper = Json.newMapper();
    private final Writer writer;

    public JsonLinesAnomalySink(Writer writer) {
        this.writer = writer;
    }

    /** Appends to {@code path}, creating it if needed. */
    public static JsonLinesAnomalySink open(Path path) throws IOException {
        BufferedWriter w = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        return new JsonLinesAnomalySink(w);
    }

    @Override
    public synchronized void publish(AnomalyRecord record) throws TransientIoException {
        try {
            writer.write(mapper.writeValueAsString(record));
            writer.write('\n');
            writer.flush();
        } catch (IOException e) {
            throw new TransientIoException("Could not write anomaly record", e);
        }
    }

    @Override
    public synchronized void close() throws IOException {
        writer.close();
    }
}
