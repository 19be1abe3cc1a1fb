package com.example.guideserver.util.table;

import com.example.guideserver.model.docx.DocxCell;
import com.example.guideserver.model.docx.DocxParagraph;
import com.example.guideserver.model.docx.DocxRow;
import com.example.guideserver.model.docx.DocxTable;
import com.example.guideserver.model.guide.NormalizedTable;

import java.util.ArrayList;
import java.util.List;

/**
 * 表格归一化：第一行 -> headers，其余行 -> rows
 *
 * 单元格文本：每个段落的 run 文本拼接后 trim，非空段落之间用 &lt;br&gt; 连接。
 * 单元格按物理顺序输出，不展开合并。
 */
public class TableNormalizer {

    public static final String LINE_BREAK = "<br>";

    /**
     * 归一化多张表，没有行的表直接丢弃
     */
    public static List<NormalizedTable> normalizeAll(List<DocxTable> tables) {
        List<NormalizedTable> out = new ArrayList<>();
        for (DocxTable table : tables) {
            NormalizedTable normalized = normalize(table);
            if (normalized != null) {
                out.add(normalized);
            }
        }
        return out;
    }

    /**
     * @return 归一化结果；表格没有行时返回 null
     */
    public static NormalizedTable normalize(DocxTable table) {
        List<DocxRow> rows = table.getRows();
        if (rows == null || rows.isEmpty()) {
            return null;
        }
        List<String> headers = rowText(rows.get(0));
        List<List<String>> body = new ArrayList<>();
        for (int i = 1; i < rows.size(); i++) {
            body.add(rowText(rows.get(i)));
        }
        return new NormalizedTable(headers, body);
    }

    public static String cellText(DocxCell cell) {
        List<String> lines = new ArrayList<>();
        for (DocxParagraph paragraph : cell.getParagraphs()) {
            String text = paragraph.getText().trim();
            if (!text.isEmpty()) {
                lines.add(text);
            }
        }
        return String.join(LINE_BREAK, lines).trim();
    }

    private static List<String> rowText(DocxRow row) {
        List<String> out = new ArrayList<>();
        for (DocxCell cell : row.getCells()) {
            out.add(cellText(cell));
        }
        return out;
    }
}
