package com.example.guideserver.util.annotation;

import com.example.guideserver.model.guide.CellAnnotation;
import com.example.guideserver.model.guide.NormalizedTable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * cellData 生成与合并
 *
 * 1. {@link #freshCellData}：从归一化表格生成只有 content 的新 cellData
 * 2. {@link #merge}：把上一次保存的 summary/lastUpdated 迁移到新 cellData
 *    - 先按单元格ID匹配（内容一致时）
 *    - 再按归一化内容匹配（行列插入导致ID变化）
 *    - 旧 cellData 中没有对应新单元格的条目直接丢弃
 *
 * 两个方法都不修改入参，返回新的 Map。
 */
public final class AnnotationMerger {

    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final String NBSP = "&nbsp;";

    private AnnotationMerger() {
    }

    /**
     * 去掉 HTML 标签并 trim
     */
    public static String normalizeContent(String content) {
        if (content == null) {
            return "";
        }
        return TAG.matcher(content).replaceAll("").trim();
    }

    /**
     * 为所有非空单元格生成 cellData，表格序号从1开始，表头为第0行
     */
    public static Map<String, CellAnnotation> freshCellData(List<NormalizedTable> tables) {
        Map<String, CellAnnotation> cellData = new LinkedHashMap<>();
        for (int t = 0; t < tables.size(); t++) {
            NormalizedTable table = tables.get(t);
            int tableIndex = t + 1;

            List<String> headers = table.getHeaders();
            if (headers != null) {
                for (int col = 0; col < headers.size(); col++) {
                    addCell(cellData, tableIndex, 0, col, headers.get(col));
                }
            }
            List<List<String>> rows = table.getRows();
            if (rows != null) {
                for (int r = 0; r < rows.size(); r++) {
                    List<String> row = rows.get(r);
                    for (int col = 0; col < row.size(); col++) {
                        addCell(cellData, tableIndex, r + 1, col, row.get(col));
                    }
                }
            }
        }
        return cellData;
    }

    private static void addCell(Map<String, CellAnnotation> cellData, int table, int row, int col, String raw) {
        if (raw == null) {
            return;
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty() || NBSP.equals(trimmed)) {
            return;
        }
        String normalized = normalizeContent(raw);
        if (!normalized.isEmpty()) {
            cellData.put(CellId.format(table, row, col), CellAnnotation.fresh(normalized));
        }
    }

    /**
     * 合并新旧 cellData
     *
     * @param fresh 本次生成的 cellData（只有 content）
     * @param previous 上次保存的 cellData，可为 null
     * @return 新的 cellData，键集合与 fresh 相同、顺序相同
     */
    public static Map<String, CellAnnotation> merge(Map<String, CellAnnotation> fresh,
                                                    Map<String, CellAnnotation> previous) {
        Map<String, CellAnnotation> prev = previous == null
                ? Collections.<String, CellAnnotation>emptyMap() : previous;
        Map<String, CellAnnotation> byContent = buildContentIndex(prev);

        Map<String, CellAnnotation> merged = new LinkedHashMap<>();
        for (Map.Entry<String, CellAnnotation> e : fresh.entrySet()) {
            String cellId = e.getKey();
            CellAnnotation result = e.getValue().copy();
            String content = normalizeContent(result.getContent());

            CellAnnotation sameId = prev.get(cellId);
            if (sameId != null && content.equals(normalizeContent(sameId.getContent()))) {
                // 同ID同内容：原样保留，包括 "no data"
                if (sameId.getSummary() != null && !sameId.getSummary().isEmpty()) {
                    result.setSummary(sameId.getSummary());
                }
                if (sameId.getLastUpdated() != null) {
                    result.setLastUpdated(sameId.getLastUpdated());
                }
            } else {
                CellAnnotation matched = byContent.get(content);
                if (matched != null) {
                    result.setSummary(matched.getSummary().trim());
                    String lastUpdated = matched.getLastUpdated();
                    if (lastUpdated != null && !lastUpdated.isEmpty()) {
                        result.setLastUpdated(lastUpdated);
                    }
                }
            }
            merged.put(cellId, result);
        }
        return merged;
    }

    /**
     * 内容 -> 旧标注；只收录 summary 非空且不是 "no data" 的条目。
     * 同一内容出现多次时后出现的覆盖先出现的。
     */
    static Map<String, CellAnnotation> buildContentIndex(Map<String, CellAnnotation> previous) {
        Map<String, CellAnnotation> index = new LinkedHashMap<>();
        for (CellAnnotation entry : previous.values()) {
            if (entry == null || !entry.hasUsableSummary()) {
                continue;
            }
            String normalized = normalizeContent(entry.getContent());
            if (!normalized.isEmpty()) {
                index.put(normalized, entry);
            }
        }
        return index;
    }
}
