package com.hting007.logiq.monitor;

import lombok.extern.log4j.Log4j2;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Follows a growing file and hands every new line to a consumer, like {@code tail -f}.
 * Starts at the beginning of the file. A line is only handed on once its terminator has
 * been written, so a line flushed in several chunks still arrives whole.
 */
@Log4j2
public class FileTailer implements Runnable {

    private final Path path;
    private final Consumer<String> lines;
    private final long idleMillis;
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    private volatile boolean running = true;

    public FileTailer(Path path, Consumer<String> lines, long idleMillis) {
        this.path = path;
        this.lines = lines;
        this.idleMillis = idleMillis;
    }

    @Override
    public void run() {
        byte[] buf = new byte[8192];
        try (InputStream in = Files.newInputStream(path)) {
            while (running) {
                int n = in.read(buf);
                if (n < 0) {
                    Thread.sleep(idleMillis);
                    continue;
                }
                consume(buf, n);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            log.error("Stopped following {}: {}", path, e.getMessage(), e);
        }
    }

    // bytes are decoded per complete line, so a multi-byte char split across reads stays intact
    private void consume(byte[] buf, int n) {
        for (int i = 0; i < n; i++) {
            if (buf[i] == '\n') {
                lines.accept(takeLine());
            } else {
                pending.write(buf[i]);
            }
        }
    }

    private String takeLine() {
        String line = pending.toString(StandardCharsets.UTF_8);
        pending.reset();
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    public void stop() {
        running = false;
    }
}
