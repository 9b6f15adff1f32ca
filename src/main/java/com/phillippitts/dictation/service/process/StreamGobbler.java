package com.phillippitts.dictation.service.process;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

/**
 * Drains a child process stream on a daemon thread.
 *
 * <p>Each line is handed to an optional observer (readiness markers) and appended to a capped
 * buffer (diagnostics). Once the cap is hit the stream is still drained, so the child never blocks
 * on a full pipe, but further output is discarded.
 */
public final class StreamGobbler implements Runnable {

    private static final Logger LOG = LogManager.getLogger(StreamGobbler.class);

    private final InputStream inputStream;
    private final StringBuilder sink = new StringBuilder();
    private final String name;
    private final int maxBytes;
    private final Consumer<String> lineObserver;

    public StreamGobbler(InputStream inputStream, String name, int maxBytes, Consumer<String> lineObserver) {
        this.inputStream = inputStream;
        this.name = name;
        this.maxBytes = maxBytes;
        this.lineObserver = lineObserver;
    }

    /**
     * Starts draining on a new daemon thread named after the stream.
     */
    public Thread start() {
        Thread thread = new Thread(this, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    @Override
    public void run() {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line;
            boolean capReached = false;
            while ((line = br.readLine()) != null) {
                if (lineObserver != null) {
                    lineObserver.accept(line);
                }
                synchronized (sink) {
                    if (sink.length() >= maxBytes) {
                        if (!capReached) {
                            LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                            capReached = true;
                        }
                        continue;
                    }
                    if (!sink.isEmpty()) {
                        sink.append('\n');
                    }
                    int available = maxBytes - sink.length();
                    sink.append(line, 0, Math.min(line.length(), available));
                }
            }
        } catch (IOException e) {
            LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
        }
    }

    /**
     * @return output captured so far (up to the cap)
     */
    public String captured() {
        synchronized (sink) {
            return sink.toString();
        }
    }

    /**
     * @return the first {@code maxChars} characters of the captured output
     */
    public String snippet(int maxChars) {
        synchronized (sink) {
            return sink.substring(0, Math.min(maxChars, sink.length()));
        }
    }
}
