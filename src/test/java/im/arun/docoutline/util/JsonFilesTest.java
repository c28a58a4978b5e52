package im.arun.docoutline.util;

import com.fasterxml.jackson.databind.JsonNode;
import im.arun.docoutline.model.DocumentOutline;
import im.arun.docoutline.model.HeadingLevel;
import im.arun.docoutline.model.OutlineItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/** Unit tests for {@link JsonFiles}. */
class JsonFilesTest {

    @Test
    @DisplayName("Outlines serialize as title plus level, text and page")
    void shouldWriteOutlineShape(@TempDir Path dir) throws IOException {
        DocumentOutline outline = new DocumentOutline("Annual Report",
            List.of(new OutlineItem(HeadingLevel.H1, "1. Introduction", 1, 90f)));
        Path target = dir.resolve("out").resolve("report.json");

        JsonFiles.writeAtomically(target, outline);

        JsonNode json = JsonFiles.mapper().readTree(target.toFile());
        assertThat(json.path("title").asText()).isEqualTo("Annual Report");
        JsonNode item = json.path("outline").get(0);
        assertThat(item.path("level").asText()).isEqualTo("H1");
        assertThat(item.path("text").asText()).isEqualTo("1. Introduction");
        assertThat(item.path("page").asInt()).isEqualTo(1);
        assertThat(item.has("position")).isFalse();
    }

    @Test
    @DisplayName("No temporary file is left next to the output")
    void shouldLeaveOnlyTarget(@TempDir Path dir) throws IOException {
        Path target = dir.resolve("report.json");

        JsonFiles.writeAtomically(target, DocumentOutline.empty());
        JsonFiles.writeAtomically(target, DocumentOutline.empty());

        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files).containsExactly(target);
        }
    }

    @Test
    @DisplayName("Base names drop only the last extension")
    void shouldStripExtension() {
        assertThat(JsonFiles.baseName(Path.of("input", "South of France - Tips.pdf"))).isEqualTo("South of France - Tips");
        assertThat(JsonFiles.baseName(Path.of("report.v2.pdf"))).isEqualTo("report.v2");
        assertThat(JsonFiles.baseName(Path.of(".hidden"))).isEqualTo(".hidden");
    }
}
