package com.example.guideserver.util.html;

import com.example.guideserver.model.docx.DocxCell;
import com.example.guideserver.model.docx.DocxParagraph;
import com.example.guideserver.model.docx.DocxRun;
import com.example.guideserver.model.docx.DocxTable;
import com.example.guideserver.model.guide.CellAnnotation;
import com.example.guideserver.util.annotation.AnnotationMerger;
import com.example.guideserver.util.table.MergeGeometry;
import com.example.guideserver.util.table.TableGeometry;
import com.example.guideserver.util.table.TableNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.example.guideserver.DocxFixtures.cell;
import static com.example.guideserver.DocxFixtures.cont;
import static com.example.guideserver.DocxFixtures.para;
import static com.example.guideserver.DocxFixtures.restart;
import static com.example.guideserver.DocxFixtures.row;
import static com.example.guideserver.DocxFixtures.span;
import static com.example.guideserver.DocxFixtures.table;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GuideHtmlRenderer")
class GuideHtmlRendererTest {

    private static Document render(DocxTable... tables) {
        List<TableGeometry> geometries = new ArrayList<>();
        for (int i = 0; i < tables.length; i++) {
            geometries.add(MergeGeometry.resolve(tables[i], i + 1));
        }
        return Jsoup.parseBodyFragment(GuideHtmlRenderer.renderFragment("cardio-anticoagulants", geometries));
    }

    @Test
    @DisplayName("fragment wraps numbered tables in a guide section")
    void fragmentStructure() {
        Document doc = render(table(row("A", "B"), row("1", "2")), table(row("C")));

        Element section = doc.selectFirst("section.guide-fragment");
        assertThat(section).isNotNull();
        assertThat(section.attr("data-guide")).isEqualTo("cardio-anticoagulants");

        Elements tables = section.select("table");
        assertThat(tables).hasSize(2);
        assertThat(tables.get(0).classNames()).contains("guide-table", "guide-table-1");
        assertThat(tables.get(1).attr("data-table-index")).isEqualTo("2");
        assertThat(tables.get(0).attr("data-rows")).isEqualTo("2");
        assertThat(tables.get(0).attr("data-columns")).isEqualTo("2");
        assertThat(tables.get(0).attr("style")).isEqualTo("border-collapse: collapse;");
    }

    @Test
    @DisplayName("first row uses th and later rows use td")
    void headerCells() {
        Document doc = render(table(row("Drug", "Dose"), row("Aspirin", "81 mg")));

        assertThat(doc.select("tr").get(0).select("th")).hasSize(2);
        assertThat(doc.select("tr").get(1).select("td")).hasSize(2);
        assertThat(doc.select("tr").get(1).select("td").get(0).text()).isEqualTo("Aspirin");
    }

    @Test
    @DisplayName("vertical merge emits rowspan and never renders continuations")
    void verticalMerge() {
        Document doc = render(table(
                row(restart("Class"), cell("Drug")),
                row(cont(), cell("Aspirin")),
                row(cont(), cell("Clopidogrel"))));

        Element merged = doc.selectFirst("th");
        assertThat(merged.attr("rowspan")).isEqualTo("3");
        assertThat(doc.select("td")).hasSize(2);
        assertThat(doc.select("td").eachText()).containsExactly("Aspirin", "Clopidogrel");
    }

    @Test
    @DisplayName("every cellData key addresses exactly one rendered cell")
    void cellIdsMatchCellData() {
        DocxTable merged = table(
                row(restart("Class"), cell("Drug")),
                row(cont(), cell("Aspirin")));
        DocxTable plain = table(row(span("Dosing", 2)), row("Adult", "Child"));
        Document doc = render(merged, plain);

        Map<String, CellAnnotation> cellData =
                AnnotationMerger.freshCellData(TableNormalizer.normalizeAll(Arrays.asList(merged, plain)));
        assertThat(cellData).containsKeys("table_1_row_0_col_0", "table_1_row_0_col_1", "table_1_row_1_col_1");
        for (String cellId : cellData.keySet()) {
            assertThat(doc.select("[data-cell-id=" + cellId + "]")).as(cellId).hasSize(1);
        }

        // 跳过的延续单元格不占用ID，其后的单元格仍用物理下标
        assertThat(doc.select("td").get(0).attr("data-cell-id")).isEqualTo("table_1_row_1_col_1");
        assertThat(doc.select("[data-cell-id=table_1_row_1_col_0]")).isEmpty();
    }

    @Test
    @DisplayName("gridSpan becomes colspan")
    void horizontalMerge() {
        Document doc = render(table(row(span("Dosing", 2)), row("Adult", "Child")));

        assertThat(doc.selectFirst("th").attr("colspan")).isEqualTo("2");
        assertThat(doc.selectFirst("table").attr("data-columns")).isEqualTo("2");
    }

    @Test
    @DisplayName("row of only continuations is kept as an empty tr")
    void allContinuationRow() {
        String html = GuideHtmlRenderer.renderTable(MergeGeometry.resolve(table(
                row(restart("A"), restart("B")),
                row(cont(), cont())), 1), 1);

        assertThat(html).contains("  <tr></tr>");
        assertThat(html).doesNotContain("<td");
    }

    @Test
    @DisplayName("empty content renders as nbsp")
    void emptyCell() {
        assertThat(GuideHtmlRenderer.renderCell(cell())).isEqualTo("&nbsp;");
        assertThat(GuideHtmlRenderer.renderCell(cell(""))).isEqualTo("<p>&nbsp;</p>");
    }

    @Test
    @DisplayName("guide without tables renders the placeholder")
    void noTables() {
        String html = GuideHtmlRenderer.renderFragment("empty", Collections.<TableGeometry>emptyList());

        assertThat(html).contains(GuideHtmlRenderer.EMPTY_PLACEHOLDER);
        assertThat(Jsoup.parseBodyFragment(html).select("table")).isEmpty();
    }

    @Test
    @DisplayName("run formatting nests strong, em, underline, then color")
    void runNesting() {
        DocxRun run = new DocxRun("Warfarin");
        run.setBold(true);
        run.setItalic(true);
        run.setUnderline(true);
        run.setColor("FF0000");
        run.setHighlight("yellow");

        assertThat(GuideHtmlRenderer.renderRun(run)).isEqualTo(
                "<strong><em><span style=\"text-decoration: underline;\">"
                        + "<span style=\"color: #FF0000; background-color: #fff200;\">Warfarin</span>"
                        + "</span></em></strong>");
    }

    @Test
    @DisplayName("run text is escaped")
    void runTextEscaped() {
        assertThat(GuideHtmlRenderer.renderRun(new DocxRun("INR < 2 & rising")))
                .isEqualTo("INR &lt; 2 &amp; rising");
    }

    @Test
    @DisplayName("paragraph carries style and list classes")
    void paragraphClasses() {
        DocxParagraph p = para("Monitor ", "platelets");
        p.setStyleName("List Paragraph");
        p.setListItem(true);
        p.setSpaceAfterPt(4.0);

        Element el = Jsoup.parseBodyFragment(GuideHtmlRenderer.renderParagraph(p)).selectFirst("p");
        assertThat(el.classNames()).containsExactlyInAnyOrder("para-list-paragraph", "para-list");
        assertThat(el.attr("style")).isEqualTo("margin-bottom: 4.00pt;");
        assertThat(el.text()).isEqualTo("Monitor platelets");
    }

    @Test
    @DisplayName("cell styles are inlined on the cell element")
    void cellStyleInlined() {
        DocxCell c = cell("x");
        c.setFill("FFFF00");
        DocxTable t = table(row(c));

        Element th = render(t).selectFirst("th");
        assertThat(th.attr("style")).isEqualTo("background-color: #FFFF00;");
        assertThat(th.select("p").text()).isEqualTo("x");
    }
}
