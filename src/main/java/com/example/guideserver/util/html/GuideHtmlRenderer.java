package com.example.guideserver.util.html;

import com.example.guideserver.model.docx.DocxCell;
import com.example.guideserver.model.docx.DocxParagraph;
import com.example.guideserver.model.docx.DocxRow;
import com.example.guideserver.model.docx.DocxRun;
import com.example.guideserver.model.docx.DocxTable;
import com.example.guideserver.util.annotation.CellId;
import com.example.guideserver.util.common.SlugUtils;
import com.example.guideserver.util.style.CssStyleExtractor;
import com.example.guideserver.util.table.CellGeometry;
import com.example.guideserver.util.table.TableGeometry;
import org.jsoup.nodes.Entities;

import java.util.ArrayList;
import java.util.List;

/**
 * 生成指南 HTML 片段
 *
 * 结构：
 * <pre>
 * &lt;section class="guide-fragment" data-guide="{slug}"&gt;
 * &lt;table class="guide-table guide-table-1" data-table-index="1" data-rows=".." data-columns=".." style=".."&gt;
 *   &lt;tr&gt;
 *     &lt;th data-cell-id="table_N_row_R_col_C" colspan=".." rowspan=".." style=".."&gt;&lt;p ..&gt;..&lt;/p&gt;&lt;/th&gt;
 *   &lt;/tr&gt;
 * &lt;/table&gt;
 * &lt;/section&gt;
 * </pre>
 *
 * 第一行用 th，其余用 td；合并延续单元格整个跳过。
 * 样式全部内联，不依赖外部样式表。
 */
public class GuideHtmlRenderer {

    public static final String NBSP = "&nbsp;";
    public static final String EMPTY_PLACEHOLDER = "<p class=\"guide-empty\">No tables were found in this guide.</p>";

    /**
     * @param slug 文档 slug，写入 data-guide
     * @param tables 已计算好几何的表格，按源顺序
     */
    public static String renderFragment(String slug, List<TableGeometry> tables) {
        List<String> parts = new ArrayList<>();
        for (int i = 0; i < tables.size(); i++) {
            parts.add(renderTable(tables.get(i), i + 1));
        }
        if (parts.isEmpty()) {
            parts.add(EMPTY_PLACEHOLDER);
        }
        return "<section class=\"guide-fragment\" data-guide=\"" + escape(slug) + "\">\n"
                + String.join("\n", parts)
                + "\n</section>";
    }

    public static String renderTable(TableGeometry geometry, int index) {
        DocxTable table = geometry.getTable();
        List<String> rowsHtml = new ArrayList<>();

        for (int r = 0; r < table.getRows().size(); r++) {
            DocxRow row = table.getRows().get(r);
            String tag = r == 0 ? "th" : "td";
            List<String> chunks = new ArrayList<>();

            for (int c = 0; c < row.getCells().size(); c++) {
                CellGeometry g = geometry.get(r, c);
                if (g.isSkipped()) {
                    continue;
                }
                DocxCell cell = row.getCells().get(c);

                List<String> attrs = new ArrayList<>();
                // 与 cellData 的键一致：列号取物理单元格下标
                attrs.add("data-cell-id=\"" + CellId.format(index, r, c) + "\"");
                if (g.getColSpan() > 1) {
                    attrs.add("colspan=\"" + g.getColSpan() + "\"");
                }
                if (g.getRowSpan() > 1) {
                    attrs.add("rowspan=\"" + g.getRowSpan() + "\"");
                }
                String style = CssStyleExtractor.toStyleAttribute(CssStyleExtractor.cellDeclarations(cell));
                if (!style.isEmpty()) {
                    attrs.add("style=\"" + style + "\"");
                }
                String attrString = attrs.isEmpty() ? "" : " " + String.join(" ", attrs);
                chunks.add("    <" + tag + attrString + ">" + renderCell(cell) + "</" + tag + ">");
            }

            // 整行都是延续单元格时保留空行，rowspan 才能对得上
            if (chunks.isEmpty()) {
                rowsHtml.add("  <tr></tr>");
            } else {
                rowsHtml.add("  <tr>\n" + String.join("\n", chunks) + "\n  </tr>");
            }
        }

        List<String> tableAttrs = new ArrayList<>();
        tableAttrs.add("class=\"guide-table guide-table-" + index + "\"");
        tableAttrs.add("data-table-index=\"" + index + "\"");
        tableAttrs.add("data-rows=\"" + geometry.getRowCount() + "\"");
        if (geometry.getColumnCount() > 0) {
            tableAttrs.add("data-columns=\"" + geometry.getColumnCount() + "\"");
        }
        String tableStyle = CssStyleExtractor.toStyleAttribute(CssStyleExtractor.tableDeclarations(table));
        if (!tableStyle.isEmpty()) {
            tableAttrs.add("style=\"" + tableStyle + "\"");
        }

        return "<table " + String.join(" ", tableAttrs) + ">\n"
                + String.join("\n", rowsHtml)
                + "\n</table>";
    }

    /**
     * 单元格内容：段落之间换行；没有段落时输出 &amp;nbsp;
     */
    public static String renderCell(DocxCell cell) {
        List<String> paragraphs = new ArrayList<>();
        for (DocxParagraph paragraph : cell.getParagraphs()) {
            paragraphs.add(renderParagraph(paragraph));
        }
        String merged = String.join("\n", paragraphs);
        return merged.isEmpty() ? NBSP : merged;
    }

    public static String renderParagraph(DocxParagraph paragraph) {
        StringBuilder text = new StringBuilder();
        for (DocxRun run : paragraph.getRuns()) {
            text.append(renderRun(run));
        }
        String textHtml = text.length() == 0 ? NBSP : text.toString();

        List<String> classNames = new ArrayList<>();
        String styleSlug = SlugUtils.slugify(paragraph.getStyleName());
        if (!styleSlug.isEmpty()) {
            classNames.add("para-" + styleSlug);
        }
        if (paragraph.isListItem()) {
            classNames.add("para-list");
        }
        String style = CssStyleExtractor.toStyleAttribute(CssStyleExtractor.paragraphDeclarations(paragraph));

        StringBuilder sb = new StringBuilder("<p");
        if (!classNames.isEmpty()) {
            sb.append(" class=\"").append(String.join(" ", classNames)).append('"');
        }
        if (!style.isEmpty()) {
            sb.append(" style=\"").append(style).append('"');
        }
        return sb.append('>').append(textHtml).append("</p>").toString();
    }

    /**
     * 嵌套顺序固定：strong > em > 下划线 span > 颜色/高亮 span
     */
    public static String renderRun(DocxRun run) {
        String text = run.getText();
        if (text == null || text.isEmpty()) {
            return "";
        }

        StringBuilder open = new StringBuilder();
        List<String> close = new ArrayList<>();
        if (run.isBold()) {
            open.append("<strong>");
            close.add(0, "</strong>");
        }
        if (run.isItalic()) {
            open.append("<em>");
            close.add(0, "</em>");
        }
        if (run.isUnderline()) {
            open.append("<span style=\"text-decoration: underline;\">");
            close.add(0, "</span>");
        }
        String style = CssStyleExtractor.toStyleAttribute(CssStyleExtractor.runDeclarations(run));
        if (!style.isEmpty()) {
            open.append("<span style=\"").append(style).append("\">");
            close.add(0, "</span>");
        }
        return open + escape(text) + String.join("", close);
    }

    private static String escape(String text) {
        return Entities.escape(text);
    }
}
