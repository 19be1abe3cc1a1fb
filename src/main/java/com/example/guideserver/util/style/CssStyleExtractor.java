package com.example.guideserver.util.style;

import com.example.guideserver.model.docx.BorderSide;
import com.example.guideserver.model.docx.DocxBorder;
import com.example.guideserver.model.docx.DocxCell;
import com.example.guideserver.model.docx.DocxParagraph;
import com.example.guideserver.model.docx.DocxRun;
import com.example.guideserver.model.docx.DocxTable;
import com.example.guideserver.model.docx.ParagraphAlign;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 从 docx 格式属性推导 CSS 声明
 *
 * 输出为有序的 "属性: 值" 列表（不带分号），顺序固定：
 * - 单元格：background-color, vertical-align, border-top/bottom/left/right, padding-top/bottom/left/right
 * - 表格：border-collapse, border, border-spacing
 *
 * 缺失或格式错误的属性不输出对应声明，不抛异常。
 * 磅值统一保留两位小数。
 */
public class CssStyleExtractor {

    public static final String DEFAULT_BORDER_COLOR = "#13294b";
    public static final String DEFAULT_BORDER_WIDTH = "1pt";

    private static final List<BorderSide> CELL_SIDES = Collections.unmodifiableList(Arrays.asList(
            BorderSide.TOP, BorderSide.BOTTOM, BorderSide.LEFT, BorderSide.RIGHT));

    private static final List<BorderSide> TABLE_BORDER_SIDES = Collections.unmodifiableList(Arrays.asList(
            BorderSide.TOP, BorderSide.BOTTOM, BorderSide.LEFT, BorderSide.RIGHT,
            BorderSide.INSIDE_H, BorderSide.INSIDE_V));

    /**
     * w:val 线型 -> CSS border-style，未识别的按 solid
     */
    private static final Map<String, String> BORDER_STYLE_MAP = createBorderStyleMap();

    /**
     * w:highlight 枚举 -> 颜色（15种），未识别的忽略
     */
    private static final Map<String, String> HIGHLIGHT_COLORS = createHighlightMap();

    private static Map<String, String> createBorderStyleMap() {
        Map<String, String> map = new HashMap<>();
        map.put("nil", "none");
        map.put("none", "none");
        map.put("single", "solid");
        map.put("double", "double");
        map.put("dashed", "dashed");
        map.put("dotted", "dotted");
        map.put("thick", "solid");
        map.put("hairline", "solid");
        map.put("wave", "wavy");
        map.put("dashSmallGap", "dashed");
        map.put("dashDot", "dashed");
        map.put("dashDotDot", "dashed");
        map.put("triple", "double");
        return Collections.unmodifiableMap(map);
    }

    private static Map<String, String> createHighlightMap() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("yellow", "#fff200");
        map.put("cyan", "#00a8e8");         // turquoise
        map.put("green", "#66ff00");        // bright green
        map.put("magenta", "#ff66cc");      // pink
        map.put("blue", "#4f81bd");
        map.put("red", "#ff0000");
        map.put("darkBlue", "#17365d");
        map.put("darkCyan", "#31859b");     // teal
        map.put("darkGreen", "#00b050");
        map.put("darkMagenta", "#7030a0");  // violet
        map.put("darkRed", "#c00000");
        map.put("darkYellow", "#806000");
        map.put("darkGray", "#808080");
        map.put("lightGray", "#c0c0c0");
        map.put("black", "#000000");
        return Collections.unmodifiableMap(map);
    }

    // ==================== 单元格 ====================

    public static List<String> cellDeclarations(DocxCell cell) {
        List<String> styles = new ArrayList<>();

        String background = cellBackground(cell);
        if (background != null) {
            styles.add("background-color: " + background);
        }
        if (cell.getVerticalAlign() != null) {
            styles.add("vertical-align: " + cell.getVerticalAlign().getCss());
        }

        Map<BorderSide, DocxBorder> borders = cell.getBorders();
        if (borders != null) {
            for (BorderSide side : CELL_SIDES) {
                DocxBorder border = borders.get(side);
                if (border == null) {
                    continue;
                }
                String value = isNone(border) ? "none" : borderValue(border);
                styles.add("border-" + side.getCssName() + ": " + value);
            }
        }

        Map<BorderSide, String> margins = cell.getMargins();
        if (margins != null) {
            for (BorderSide side : CELL_SIDES) {
                Double pt = twipsToPt(margins.get(side));
                if (pt != null) {
                    styles.add("padding-" + side.getCssName() + ": " + formatPt(pt));
                }
            }
        }
        return styles;
    }

    /**
     * 只有显式且非 auto 的底纹才输出
     */
    static String cellBackground(DocxCell cell) {
        String fill = cell.getFill();
        if (fill == null || fill.isEmpty() || "auto".equals(fill)) {
            return null;
        }
        return "#" + fill;
    }

    // ==================== 表格 ====================

    public static List<String> tableDeclarations(DocxTable table) {
        List<String> styles = new ArrayList<>();
        styles.add("border-collapse: collapse");

        // 只取按 top, bottom, left, right, insideH, insideV 顺序找到的第一条非 none 边框
        Map<BorderSide, DocxBorder> borders = table.getBorders();
        if (borders != null) {
            for (BorderSide side : TABLE_BORDER_SIDES) {
                DocxBorder border = borders.get(side);
                if (border == null || isNone(border)) {
                    continue;
                }
                styles.add("border: " + borderValue(border));
                break;
            }
        }

        // 四边边距取最大值
        Map<BorderSide, String> margins = table.getCellMargins();
        if (margins != null) {
            Double max = null;
            for (BorderSide side : CELL_SIDES) {
                Double pt = twipsToPt(margins.get(side));
                if (pt != null && (max == null || pt > max)) {
                    max = pt;
                }
            }
            if (max != null) {
                styles.add("border-spacing: " + formatPt(max));
            }
        }
        return styles;
    }

    // ==================== 段落 / Run ====================

    /**
     * 段落样式：text-align（仅 center/right/justify）、font-size、color、margin-top、margin-bottom、line-height
     */
    public static List<String> paragraphDeclarations(DocxParagraph paragraph) {
        List<String> styles = new ArrayList<>();
        ParagraphAlign align = paragraph.getAlignment();
        if (align == ParagraphAlign.CENTER) {
            styles.add("text-align: center");
        } else if (align == ParagraphAlign.RIGHT) {
            styles.add("text-align: right");
        } else if (align == ParagraphAlign.JUSTIFY) {
            styles.add("text-align: justify");
        }
        if (isPositive(paragraph.getFontSizePt())) {
            styles.add("font-size: " + formatPt(paragraph.getFontSizePt()));
        }
        String color = explicitColor(paragraph.getFontColor());
        if (color != null) {
            styles.add("color: " + color);
        }
        if (isPositive(paragraph.getSpaceBeforePt())) {
            styles.add("margin-top: " + formatPt(paragraph.getSpaceBeforePt()));
        }
        if (isPositive(paragraph.getSpaceAfterPt())) {
            styles.add("margin-bottom: " + formatPt(paragraph.getSpaceAfterPt()));
        }
        if (isPositive(paragraph.getLineSpacing())) {
            styles.add("line-height: " + paragraph.getLineSpacing());
        }
        return styles;
    }

    /**
     * Run 样式：color、background-color（高亮）
     */
    public static List<String> runDeclarations(DocxRun run) {
        List<String> styles = new ArrayList<>();
        String color = explicitColor(run.getColor());
        if (color != null) {
            styles.add("color: " + color);
        }
        String highlight = highlightColor(run.getHighlight());
        if (highlight != null) {
            styles.add("background-color: " + highlight);
        }
        return styles;
    }

    public static String highlightColor(String highlight) {
        if (highlight == null) {
            return null;
        }
        return HIGHLIGHT_COLORS.get(highlight);
    }

    // ==================== 公共 ====================

    /**
     * 声明列表 -> style 属性值："a: 1; b: 2;"，空列表返回空串
     */
    public static String toStyleAttribute(List<String> declarations) {
        List<String> filtered = new ArrayList<>();
        for (String d : declarations) {
            if (d == null) continue;
            String s = d.trim();
            while (s.endsWith(";")) {
                s = s.substring(0, s.length() - 1);
            }
            if (!s.isEmpty()) {
                filtered.add(s);
            }
        }
        if (filtered.isEmpty()) {
            return "";
        }
        return String.join("; ", filtered) + ";";
    }

    /**
     * 边框值："宽度 线型 颜色"
     * 宽度：w:sz 为 1/8 磅；缺省、为0或无法解析时用 1pt
     */
    static String borderValue(DocxBorder border) {
        String style = BORDER_STYLE_MAP.get(border.getVal());
        if (style == null) {
            style = "solid";
        }
        Double sizePt = eighthPtToPt(border.getSize());
        String width = (sizePt != null && sizePt != 0.0) ? formatPt(sizePt) : DEFAULT_BORDER_WIDTH;
        String color = border.getColor();
        String colorPart = (color != null && !color.isEmpty() && !"auto".equals(color))
                ? "#" + color : DEFAULT_BORDER_COLOR;
        return width + " " + style + " " + colorPart;
    }

    static boolean isNone(DocxBorder border) {
        return "nil".equals(border.getVal()) || "none".equals(border.getVal());
    }

    static Double twipsToPt(String raw) {
        Integer v = parseInt(raw);
        return v == null ? null : v / 20.0;
    }

    static Double eighthPtToPt(String raw) {
        Integer v = parseInt(raw);
        return v == null ? null : v / 8.0;
    }

    static String formatPt(double pt) {
        return String.format(Locale.ROOT, "%.2fpt", pt);
    }

    private static String explicitColor(String hex) {
        if (hex == null || hex.isEmpty() || "auto".equalsIgnoreCase(hex)) {
            return null;
        }
        return "#" + hex;
    }

    private static boolean isPositive(Double v) {
        return v != null && v > 0;
    }

    private static Integer parseInt(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
