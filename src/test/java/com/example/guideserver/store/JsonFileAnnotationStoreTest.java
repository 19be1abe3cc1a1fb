package com.example.guideserver.store;

import com.example.guideserver.model.guide.CellAnnotation;
import com.example.guideserver.model.guide.GuideData;
import com.example.guideserver.model.guide.NormalizedTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JsonFileAnnotationStore")
class JsonFileAnnotationStoreTest {

    @TempDir
    Path tempDir;

    private JsonFileAnnotationStore store;

    @BeforeEach
    void setUp() {
        store = new JsonFileAnnotationStore(tempDir.resolve("data").toFile());
    }

    private void writeRaw(String slug, String json) throws IOException {
        File file = store.fileFor(slug);
        file.getParentFile().mkdirs();
        Files.write(file.toPath(), json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("missing file loads as empty")
    void missingFile() {
        assertThat(store.load("nothing-here")).isEmpty();
    }

    @Test
    @DisplayName("malformed JSON loads as empty")
    void malformedJson() throws IOException {
        writeRaw("broken", "{\"cellData\": {\"table_1_row_0_col_0\": ");

        assertThat(store.load("broken")).isEmpty();
    }

    @Test
    @DisplayName("entries with invalid ids or non-object values are dropped")
    void invalidEntriesDropped() throws IOException {
        writeRaw("mixed", "{\"title\":\"Mixed\",\"cellData\":{"
                + "\"table_1_row_0_col_0\":{\"content\":\"Drug\",\"summary\":\"\"},"
                + "\"header_0\":{\"content\":\"Old\",\"summary\":\"x\"},"
                + "\"table_1_row_1_col_0\":\"just a string\","
                + "\"table_1_row_2_col_0\":{\"content\":\"Aspirin\",\"summary\":\"Antiplatelet\","
                + "\"lastUpdated\":\"2024-05-01\",\"source\":\"manual\"}}}");

        Map<String, CellAnnotation> loaded = store.load("mixed");

        assertThat(loaded).containsOnlyKeys("table_1_row_0_col_0", "table_1_row_2_col_0");
        assertThat(loaded.get("table_1_row_2_col_0"))
                .isEqualTo(new CellAnnotation("Aspirin", "Antiplatelet", "2024-05-01"));
    }

    @Test
    @DisplayName("file without cellData loads as empty")
    void noCellData() throws IOException {
        writeRaw("bare", "{\"title\":\"Bare\"}");

        assertThat(store.load("bare")).isEmpty();
    }

    @Test
    @DisplayName("saved data reloads and omits missing lastUpdated")
    void saveAndReload() throws IOException {
        GuideData data = new GuideData();
        data.setTitle("Cardio Guide");
        data.setCourse("Pharm 1");
        data.setCourseSlug("pharm-1");
        data.setTags(Arrays.asList("cardiac", "exam"));
        List<List<String>> rows = Collections.singletonList(Collections.singletonList("Aspirin"));
        data.setTables(Collections.singletonList(new NormalizedTable(Collections.singletonList("Drug"), rows)));
        data.getCellData().put("table_1_row_0_col_0", CellAnnotation.fresh("Drug"));
        data.getCellData().put("table_1_row_1_col_0", new CellAnnotation("Aspirin", "Antiplatelet", "2024-05-01"));

        store.save("pharm-1-cardio-guide", data);

        String text = new String(Files.readAllBytes(store.fileFor("pharm-1-cardio-guide").toPath()),
                StandardCharsets.UTF_8);
        assertThat(text).endsWith("}\n");
        assertThat(text.indexOf("\"title\"")).isLessThan(text.indexOf("\"cellData\""));
        assertThat(text).containsOnlyOnce("lastUpdated");

        Map<String, CellAnnotation> loaded = store.load("pharm-1-cardio-guide");
        assertThat(loaded).isEqualTo(data.getCellData());
    }

    @Test
    @DisplayName("save fails when the output location is not a directory")
    void saveFailure() throws IOException {
        File notADir = tempDir.resolve("occupied").toFile();
        Files.write(notADir.toPath(), "x".getBytes(StandardCharsets.UTF_8));
        JsonFileAnnotationStore blocked = new JsonFileAnnotationStore(notADir);

        assertThatThrownBy(() -> blocked.save("guide", new GuideData())).isInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("loadGuide reads the whole document with the same lenient cellData")
    void loadGuide() throws IOException {
        writeRaw("cardio", "{\"title\":\"Cardio\",\"course\":\"Pharm 1\",\"tags\":[\"exam\"],"
                + "\"tables\":[{\"headers\":[\"Drug\"],\"rows\":[[\"Aspirin\"]]}],\"cellData\":{"
                + "\"table_1_row_1_col_0\":{\"content\":\"Aspirin\",\"summary\":\"Antiplatelet\"},"
                + "\"table_01_row_1_col_0\":{\"content\":\"Aspirin\",\"summary\":\"x\"},"
                + "\"table_1_row_0_col_0\":42}}");

        GuideData data = store.loadGuide("cardio");

        assertThat(data.getTitle()).isEqualTo("Cardio");
        assertThat(data.getTags()).containsExactly("exam");
        assertThat(data.getTables()).hasSize(1);
        assertThat(data.getCellData()).containsOnlyKeys("table_1_row_1_col_0");
    }

    @Test
    @DisplayName("loadGuide returns null for missing or unreadable files")
    void loadGuideMissing() throws IOException {
        assertThat(store.loadGuide("nothing-here")).isNull();

        writeRaw("broken", "{\"title\": ");
        assertThat(store.loadGuide("broken")).isNull();

        writeRaw("array", "[1, 2]");
        assertThat(store.loadGuide("array")).isNull();
    }
}
