package org.teamelites.swarm.telemetry;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Structured swarm events: routing misses, evaluated/merged/rejected candidates, provisioning
 * outcomes and processor failures.
 * <p>
 * Every event is logged through SLF4J at INFO and, when a file is configured, appended as one
 * JSON object per line ({@code {"timestamp": ..., "event": ..., ...data}}). File append failures
 * never reach the caller; the first one is logged at WARN, later ones at DEBUG.
 * <p>
 * <strong>Thread Safety:</strong> thread-safe; appends are serialized.
 */
public class SwarmEventLog {

    private static final Logger log = LoggerFactory.getLogger(SwarmEventLog.class);

    /** Default file name inside the data directory. */
    public static final String FILE_NAME = "swarm-events.jsonl";

    private final Path file;
    private final Gson gson = new GsonBuilder().disableHtmlEscaping().serializeNulls().create();
    private boolean appendFailureReported;

    /**
     * @param file JSON lines file, or null to log through SLF4J only.
     */
    public SwarmEventLog(Path file) {
        this.file = file;
    }

    /**
     * Creates an event log that only writes to SLF4J.
     */
    public static SwarmEventLog loggingOnly() {
        return new SwarmEventLog(null);
    }

    /**
     * Records one event.
     *
     * @param event event name, e.g. {@code evolution_candidate_merged}.
     * @param data  event attributes; values must be JSON-serializable.
     */
    public void record(String event, Map<String, ?> data) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("timestamp", Instant.now().toString());
        entry.put("event", event);
        entry.putAll(data);

        String json = gson.toJson(entry);
        log.info("[swarm] {}: {}", event, gson.toJson(data));

        if (file != null) {
            append(json);
        }
    }

    private synchronized void append(String json) {
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, json + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            if (!appendFailureReported) {
                appendFailureReported = true;
                log.warn("Failed to append swarm event to {}: {}", file, e.getMessage());
            } else {
                log.debug("Failed to append swarm event to {}", file, e);
            }
        }
    }

    public Path getFile() {
        return file;
    }
}
