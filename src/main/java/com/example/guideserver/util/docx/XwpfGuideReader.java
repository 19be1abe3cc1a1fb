package com.example.guideserver.util.docx;

import com.example.guideserver.exception.TableStructureException;
import com.example.guideserver.model.docx.DocxCell;
import com.example.guideserver.model.docx.DocxDocument;
import com.example.guideserver.model.docx.DocxParagraph;
import com.example.guideserver.model.docx.DocxRow;
import com.example.guideserver.model.docx.DocxRun;
import com.example.guideserver.model.docx.DocxTable;
import com.example.guideserver.model.docx.ParagraphAlign;
import com.example.guideserver.model.docx.VerticalAlign;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.UnderlinePatterns;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTStyle;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTblPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTcPr;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 把 XWPFDocument 转成文档对象模型（只读，不修改输入）
 *
 * - 只处理 body 中的顶层表格，按出现顺序
 * - 某张表读取失败时记录 TableStructureException 并跳过，继续后面的表格
 */
@Slf4j
public class XwpfGuideReader {

    private static final String DEFAULT_PARAGRAPH_STYLE = "Normal";

    private final XWPFStyles styles;
    private final Map<String, Optional<XWPFStyle>> styleCache = new HashMap<>();

    private XwpfGuideReader(XWPFDocument doc) {
        this.styles = doc.getStyles();
    }

    public static DocxReadResult read(InputStream in) throws IOException {
        try (XWPFDocument doc = new XWPFDocument(in)) {
            return read(doc);
        }
    }

    public static DocxReadResult read(XWPFDocument doc) {
        XwpfGuideReader reader = new XwpfGuideReader(doc);
        List<DocxTable> tables = new ArrayList<>();
        List<TableStructureException> problems = new ArrayList<>();

        int tableIdx = 0;
        for (IBodyElement be : doc.getBodyElements()) {
            if (!(be instanceof XWPFTable)) continue;
            tableIdx++;
            try {
                tables.add(reader.readTable((XWPFTable) be, tableIdx));
            } catch (TableStructureException e) {
                log.warn("跳过表格 {}: {}", tableIdx, e.getMessage());
                problems.add(e);
            } catch (RuntimeException e) {
                log.warn("跳过表格 {}: 读取失败 {}", tableIdx, e.toString());
                problems.add(new TableStructureException(tableIdx, "表格 " + tableIdx + " 读取失败: " + e, e));
            }
        }
        return new DocxReadResult(new DocxDocument(tables), problems);
    }

    // ==================== 表格 ====================

    DocxTable readTable(XWPFTable table, int tableIdx) {
        DocxTable out = new DocxTable();
        CTTblPr tblPr = table.getCTTbl().getTblPr();
        out.setBorders(XwpfProps.tableBorders(tblPr));
        out.setCellMargins(XwpfProps.tableCellMargins(tblPr));

        List<DocxRow> rows = new ArrayList<>();
        int rowIdx = 0;
        for (XWPFTableRow row : table.getRows()) {
            rowIdx++;
            if (row == null) {
                throw new TableStructureException(tableIdx, String.format("表格 %d 第%d行引用为空", tableIdx, rowIdx));
            }
            List<DocxCell> cells = new ArrayList<>();
            for (XWPFTableCell cell : row.getTableCells()) {
                if (cell == null) {
                    throw new TableStructureException(tableIdx,
                            String.format("表格 %d 第%d行存在空单元格引用", tableIdx, rowIdx));
                }
                cells.add(readCell(cell));
            }
            rows.add(new DocxRow(cells));
        }
        out.setRows(rows);
        return out;
    }

    DocxCell readCell(XWPFTableCell cell) {
        DocxCell out = new DocxCell();
        CTTcPr tcPr = cell.getCTTc().getTcPr();

        out.setGridSpan(XwpfProps.gridSpan(tcPr).orElse(null));
        out.setVMerge(XwpfProps.vMerge(tcPr));
        out.setFill(XwpfProps.fill(tcPr).orElse(null));
        out.setVerticalAlign(verticalAlign(XwpfProps.verticalAlign(tcPr)));
        out.setBorders(XwpfProps.cellBorders(tcPr));
        out.setMargins(XwpfProps.cellMargins(tcPr));

        List<DocxParagraph> paragraphs = new ArrayList<>();
        for (XWPFParagraph p : cell.getParagraphs()) {
            paragraphs.add(readParagraph(p));
        }
        out.setParagraphs(paragraphs);
        return out;
    }

    static VerticalAlign verticalAlign(Optional<String> val) {
        if (!val.isPresent()) {
            return null;
        }
        switch (val.get()) {
            case "top":
                return VerticalAlign.TOP;
            case "center":
                return VerticalAlign.CENTER;
            case "bottom":
                return VerticalAlign.BOTTOM;
            default:
                return null;
        }
    }

    // ==================== 段落 ====================

    DocxParagraph readParagraph(XWPFParagraph p) {
        DocxParagraph out = new DocxParagraph();
        CTPPr pPr = p.getCTP().getPPr();

        out.setAlignment(alignment(XwpfProps.justification(pPr)));
        out.setListItem(XwpfProps.isListItem(pPr));

        out.setSpaceBeforePt(XwpfProps.spacingBefore(pPr).map(v -> v / 20.0).orElse(null));
        out.setSpaceAfterPt(XwpfProps.spacingAfter(pPr).map(v -> v / 20.0).orElse(null));
        Optional<String> lineRule = XwpfProps.lineRule(pPr);
        if (!lineRule.isPresent() || "auto".equals(lineRule.get())) {
            // 行距单位为 1/240 行
            out.setLineSpacing(XwpfProps.spacingLine(pPr).map(v -> v / 240.0).orElse(null));
        }

        Optional<XWPFStyle> style = style(p.getStyleID());
        if (style.isPresent()) {
            out.setStyleName(style.get().getName());
            CTStyle ctStyle = style.get().getCTStyle();
            CTRPr styleRPr = ctStyle != null && ctStyle.isSetRPr() ? ctStyle.getRPr() : null;
            // w:sz 为半磅
            out.setFontSizePt(XwpfProps.fontSize(styleRPr).map(v -> v / 2.0).orElse(null));
            out.setFontColor(XwpfProps.color(styleRPr).orElse(null));
        }

        List<DocxRun> runs = new ArrayList<>();
        for (XWPFRun r : p.getRuns()) {
            runs.add(readRun(r));
        }
        out.setRuns(runs);
        return out;
    }

    static ParagraphAlign alignment(Optional<String> jc) {
        if (!jc.isPresent()) {
            return null;
        }
        switch (jc.get()) {
            case "center":
                return ParagraphAlign.CENTER;
            case "right":
            case "end":
                return ParagraphAlign.RIGHT;
            case "both":
                return ParagraphAlign.JUSTIFY;
            default:
                return ParagraphAlign.LEFT;
        }
    }

    /**
     * 段落没有 pStyle 时使用默认段落样式 Normal
     */
    private Optional<XWPFStyle> style(String styleId) {
        if (styles == null) {
            return Optional.empty();
        }
        String id = styleId != null ? styleId : DEFAULT_PARAGRAPH_STYLE;
        Optional<XWPFStyle> cached = styleCache.get(id);
        if (cached == null) {
            cached = Optional.ofNullable(styles.getStyle(id));
            styleCache.put(id, cached);
        }
        return cached;
    }

    // ==================== Run ====================

    static DocxRun readRun(XWPFRun r) {
        DocxRun out = new DocxRun(r.text());
        out.setBold(r.isBold());
        out.setItalic(r.isItalic());
        out.setUnderline(r.getUnderline() != UnderlinePatterns.NONE);
        String color = r.getColor();
        out.setColor(color == null || "auto".equalsIgnoreCase(color) ? null : color);
        CTRPr rPr = r.getCTR().isSetRPr() ? r.getCTR().getRPr() : null;
        out.setHighlight(XwpfProps.highlight(rPr).orElse(null));
        return out;
    }
}
