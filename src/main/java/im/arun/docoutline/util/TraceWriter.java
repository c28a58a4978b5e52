package im.arun.docoutline.util;

import im.arun.docoutline.config.OutlineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects the per-document decision trace (thresholds, candidates, accept/reject reasons)
 * and writes it as one JSON file when the document is done. A disabled writer ignores
 * everything.
 */
public class TraceWriter {
    private static final Logger logger = LoggerFactory.getLogger(TraceWriter.class);

    private final boolean enabled;
    private final Path tracePath;
    private final List<Object> entries = new ArrayList<>();

    public TraceWriter(Path documentPath, OutlineConfig.Trace config) {
        this.enabled = config.isEnabled();
        String timestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
        String docName = documentPath == null ? "document" : JsonFiles.baseName(documentPath);
        this.tracePath = Paths.get(config.getDirectory(), String.format("%s_%s_trace.json", docName, timestamp));
    }

    public static TraceWriter disabled() {
        OutlineConfig.Trace off = new OutlineConfig.Trace();
        off.setEnabled(false);
        return new TraceWriter(null, off);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void record(String stage, Object data) {
        if (!enabled) {
            return;
        }
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("stage", stage);
        entry.put("data", data);
        entries.add(entry);
    }

    public void record(String stage, int page, Object data) {
        if (!enabled) {
            return;
        }
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("stage", stage);
        entry.put("page", page);
        entry.put("data", data);
        entries.add(entry);
    }

    /**
     * Writes the collected trace. Trace output is diagnostic only, so a write failure is logged
     * and does not fail the document.
     */
    public void flush() {
        if (!enabled || entries.isEmpty()) {
            return;
        }
        try {
            JsonFiles.writeAtomically(tracePath, entries);
            logger.debug("Wrote trace {}", tracePath);
        } catch (IOException e) {
            logger.error("Failed to write trace file: {}", tracePath, e);
        }
    }

    public Path getTracePath() {
        return tracePath;
    }

    public List<Object> getEntries() {
        return List.copyOf(entries);
    }
}
