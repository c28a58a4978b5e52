package im.arun.docoutline.util;

import com.fasterxml.jackson.databind.JsonNode;
import im.arun.docoutline.config.OutlineConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/** Unit tests for {@link TraceWriter}. */
class TraceWriterTest {

    @Test
    @DisplayName("Recorded stages are written to a per-document trace file")
    void shouldWriteTrace(@TempDir Path dir) throws IOException {
        TraceWriter trace = new TraceWriter(Path.of("input", "report.pdf"), enabledIn(dir));

        trace.record("title", "Annual Report");
        trace.record("page", 2, Map.of("lines", 14));
        trace.flush();

        Path written = trace.getTracePath();
        assertThat(written.getFileName().toString()).startsWith("report_").endsWith("_trace.json");
        JsonNode json = JsonFiles.mapper().readTree(written.toFile());
        assertThat(json).hasSize(2);
        assertThat(json.get(0).path("stage").asText()).isEqualTo("title");
        assertThat(json.get(1).path("page").asInt()).isEqualTo(2);
        assertThat(json.get(1).path("data").path("lines").asInt()).isEqualTo(14);
    }

    @Test
    @DisplayName("A disabled trace records and writes nothing")
    void shouldIgnoreEverything_whenDisabled(@TempDir Path dir) throws IOException {
        OutlineConfig.Trace config = enabledIn(dir);
        config.setEnabled(false);
        TraceWriter trace = new TraceWriter(Path.of("report.pdf"), config);

        trace.record("title", "Annual Report");
        trace.flush();

        assertThat(trace.getEntries()).isEmpty();
        assertThat(TraceWriter.disabled().isEnabled()).isFalse();
        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    @DisplayName("An empty trace is not written")
    void shouldSkipEmptyTrace(@TempDir Path dir) {
        TraceWriter trace = new TraceWriter(Path.of("report.pdf"), enabledIn(dir));

        trace.flush();

        assertThat(trace.getTracePath()).doesNotExist();
    }

    private static OutlineConfig.Trace enabledIn(Path dir) {
        OutlineConfig.Trace config = new OutlineConfig.Trace();
        config.setEnabled(true);
        config.setDirectory(dir.toString());
        return config;
    }
}
