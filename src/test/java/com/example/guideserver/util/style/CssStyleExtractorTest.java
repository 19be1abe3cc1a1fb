package com.example.guideserver.util.style;

import com.example.guideserver.model.docx.BorderSide;
import com.example.guideserver.model.docx.DocxBorder;
import com.example.guideserver.model.docx.DocxCell;
import com.example.guideserver.model.docx.DocxParagraph;
import com.example.guideserver.model.docx.DocxRun;
import com.example.guideserver.model.docx.DocxTable;
import com.example.guideserver.model.docx.ParagraphAlign;
import com.example.guideserver.model.docx.VerticalAlign;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;

import static com.example.guideserver.DocxFixtures.cell;
import static com.example.guideserver.DocxFixtures.row;
import static com.example.guideserver.DocxFixtures.table;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CssStyleExtractor")
class CssStyleExtractorTest {

    @Test
    @DisplayName("cell declarations follow the fixed order")
    void cellDeclarationOrder() {
        DocxCell c = cell("x");
        c.setFill("D9E2F3");
        c.setVerticalAlign(VerticalAlign.CENTER);
        c.getBorders().put(BorderSide.RIGHT, new DocxBorder("single", "8", "000000"));
        c.getBorders().put(BorderSide.TOP, new DocxBorder("double", "12", "FF0000"));
        c.getMargins().put(BorderSide.LEFT, "100");
        c.getMargins().put(BorderSide.TOP, "40");

        assertThat(CssStyleExtractor.cellDeclarations(c)).containsExactly(
                "background-color: #D9E2F3",
                "vertical-align: middle",
                "border-top: 1.50pt double #FF0000",
                "border-right: 1.00pt solid #000000",
                "padding-top: 2.00pt",
                "padding-left: 5.00pt");
    }

    @Test
    @DisplayName("auto fill and missing properties emit nothing")
    void autoFillOmitted() {
        DocxCell c = cell("x");
        c.setFill("auto");

        assertThat(CssStyleExtractor.cellDeclarations(c)).isEmpty();
    }

    @Test
    @DisplayName("nil and none borders render as none")
    void nilBorderIsNone() {
        DocxCell c = cell("x");
        c.getBorders().put(BorderSide.TOP, new DocxBorder("nil", null, null));
        c.getBorders().put(BorderSide.BOTTOM, new DocxBorder("none", "4", "000000"));

        assertThat(CssStyleExtractor.cellDeclarations(c))
                .containsExactly("border-top: none", "border-bottom: none");
    }

    @Test
    @DisplayName("border defaults for width, color and unknown style")
    void borderDefaults() {
        assertThat(CssStyleExtractor.borderValue(new DocxBorder("single", null, null)))
                .isEqualTo("1pt solid #13294b");
        assertThat(CssStyleExtractor.borderValue(new DocxBorder("single", "0", "auto")))
                .isEqualTo("1pt solid #13294b");
        assertThat(CssStyleExtractor.borderValue(new DocxBorder("starsBlack", "abc", "00FF00")))
                .isEqualTo("1pt solid #00FF00");
        assertThat(CssStyleExtractor.borderValue(new DocxBorder("wave", "4", "112233")))
                .isEqualTo("0.50pt wavy #112233");
        assertThat(CssStyleExtractor.borderValue(new DocxBorder("dashDotDot", "24", null)))
                .isEqualTo("3.00pt dashed #13294b");
    }

    @Test
    @DisplayName("malformed margins are skipped")
    void malformedMarginSkipped() {
        DocxCell c = cell("x");
        c.getMargins().put(BorderSide.TOP, "wide");
        c.getMargins().put(BorderSide.BOTTOM, "60");

        assertThat(CssStyleExtractor.cellDeclarations(c)).containsExactly("padding-bottom: 3.00pt");
    }

    @Test
    @DisplayName("table border uses the first side that is not none")
    void tableBorderFirstVisibleSide() {
        DocxTable t = table(row("x"));
        t.getBorders().put(BorderSide.TOP, new DocxBorder("nil", null, null));
        t.getBorders().put(BorderSide.INSIDE_H, new DocxBorder("single", "4", "AAAAAA"));
        t.getBorders().put(BorderSide.LEFT, new DocxBorder("dotted", "16", "BBBBBB"));

        assertThat(CssStyleExtractor.tableDeclarations(t)).containsExactly(
                "border-collapse: collapse",
                "border: 2.00pt dotted #BBBBBB");
    }

    @Test
    @DisplayName("table spacing takes the largest cell margin")
    void tableSpacingIsMaxMargin() {
        DocxTable t = table(row("x"));
        t.getCellMargins().put(BorderSide.TOP, "0");
        t.getCellMargins().put(BorderSide.LEFT, "108");
        t.getCellMargins().put(BorderSide.RIGHT, "40");

        assertThat(CssStyleExtractor.tableDeclarations(t)).containsExactly(
                "border-collapse: collapse",
                "border-spacing: 5.40pt");
    }

    @Test
    @DisplayName("table without properties only collapses borders")
    void bareTable() {
        assertThat(CssStyleExtractor.tableDeclarations(table(row("x"))))
                .containsExactly("border-collapse: collapse");
    }

    @Test
    @DisplayName("paragraph declarations")
    void paragraphDeclarations() {
        DocxParagraph p = new DocxParagraph(new ArrayList<DocxRun>());
        p.setAlignment(ParagraphAlign.CENTER);
        p.setFontSizePt(14.0);
        p.setFontColor("1F3864");
        p.setSpaceBeforePt(6.0);
        p.setSpaceAfterPt(0.0);
        p.setLineSpacing(1.15);

        assertThat(CssStyleExtractor.paragraphDeclarations(p)).containsExactly(
                "text-align: center",
                "font-size: 14.00pt",
                "color: #1F3864",
                "margin-top: 6.00pt",
                "line-height: 1.15");
    }

    @Test
    @DisplayName("left alignment is the default and is not emitted")
    void leftAlignmentOmitted() {
        DocxParagraph p = new DocxParagraph(new ArrayList<DocxRun>());
        p.setAlignment(ParagraphAlign.LEFT);

        assertThat(CssStyleExtractor.paragraphDeclarations(p)).isEmpty();
    }

    @Test
    @DisplayName("highlight maps through the palette and unknown names are dropped")
    void highlightPalette() {
        DocxRun run = new DocxRun("x");
        run.setHighlight("darkCyan");
        run.setColor("C00000");
        assertThat(CssStyleExtractor.runDeclarations(run))
                .containsExactly("color: #C00000", "background-color: #31859b");

        run.setHighlight("none");
        run.setColor("auto");
        assertThat(CssStyleExtractor.runDeclarations(run)).isEmpty();
        assertThat(CssStyleExtractor.highlightColor("yellow")).isEqualTo("#fff200");
        assertThat(CssStyleExtractor.highlightColor(null)).isNull();
    }

    @Test
    @DisplayName("style attribute joins with semicolons")
    void styleAttribute() {
        assertThat(CssStyleExtractor.toStyleAttribute(Arrays.asList("a: 1", "b: 2;", " ")))
                .isEqualTo("a: 1; b: 2;");
        assertThat(CssStyleExtractor.toStyleAttribute(Collections.<String>emptyList())).isEmpty();
    }
}
