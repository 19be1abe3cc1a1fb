package com.example.guideserver.service;

import com.example.guideserver.exception.AnnotationNotFoundException;
import com.example.guideserver.model.guide.CellAnnotation;
import com.example.guideserver.model.guide.GuideData;
import com.example.guideserver.store.JsonFileAnnotationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CellAnnotationService")
class CellAnnotationServiceTest {

    @TempDir
    Path tempDir;

    private JsonFileAnnotationStore store;
    private CellAnnotationService service;

    @BeforeEach
    void setUp() throws IOException {
        store = new JsonFileAnnotationStore(tempDir.toFile());
        service = new CellAnnotationService(store);

        GuideData data = new GuideData();
        data.setTitle("Cardio");
        data.getCellData().put("table_1_row_0_col_0", CellAnnotation.fresh("Drug"));
        data.getCellData().put("table_1_row_1_col_0", new CellAnnotation("Aspirin", "Antiplatelet", "2024-05-01"));
        store.save("pharm-1-cardio", data);
    }

    @Test
    @DisplayName("update writes summary and lastUpdated and keeps content")
    void update() throws IOException {
        CellAnnotation updated = service.update("pharm-1-cardio", "table_1_row_0_col_0", "  Column of drug names ",
                "2024-06-01T08:00:00+0000");

        assertThat(updated).isEqualTo(new CellAnnotation("Drug", "Column of drug names", "2024-06-01T08:00:00+0000"));
        assertThat(store.load("pharm-1-cardio").get("table_1_row_0_col_0")).isEqualTo(updated);
        assertThat(store.loadGuide("pharm-1-cardio").getTitle()).isEqualTo("Cardio");
    }

    @Test
    @DisplayName("update without lastUpdated stamps the current time")
    void updateStampsTime() throws IOException {
        CellAnnotation updated = service.update("pharm-1-cardio", "table_1_row_1_col_0", "P2Y12", null);

        assertThat(updated.getLastUpdated()).matches("\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}\\+0000");
    }

    @Test
    @DisplayName("clear resets the entry to its converted state")
    void clear() throws IOException {
        CellAnnotation cleared = service.clear("pharm-1-cardio", "table_1_row_1_col_0");

        assertThat(cleared).isEqualTo(CellAnnotation.fresh("Aspirin"));
        assertThat(store.load("pharm-1-cardio")).containsEntry("table_1_row_1_col_0", CellAnnotation.fresh("Aspirin"));
    }

    @Test
    @DisplayName("unknown guides and cells are reported as not found")
    void notFound() {
        assertThatThrownBy(() -> service.update("pharm-9-missing", "table_1_row_0_col_0", "x", null))
                .isInstanceOf(AnnotationNotFoundException.class);
        assertThatThrownBy(() -> service.clear("pharm-1-cardio", "table_2_row_0_col_0"))
                .isInstanceOf(AnnotationNotFoundException.class);
        assertThat(store.load("pharm-1-cardio")).doesNotContainKey("table_2_row_0_col_0");
    }
}
