package com.example.guideserver.util.table;

import com.example.guideserver.exception.TableStructureException;
import com.example.guideserver.model.docx.DocxCell;
import com.example.guideserver.model.docx.DocxParagraph;
import com.example.guideserver.model.docx.DocxRow;
import com.example.guideserver.model.docx.DocxTable;
import com.example.guideserver.model.docx.VMergeState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 由 gridSpan / vMerge 计算每个物理单元格的 rowspan、colspan
 *
 * 说明：
 * - colspan 来自 gridSpan（缺省或无法解析时为1）
 * - NONE：rowspan=1
 * - RESTART：rowspan = 1 + 同一逻辑列向下连续的 CONTINUE 行数
 * - CONTINUE：rowspan=0，渲染时跳过
 * - 向下扫描遇到某行没有覆盖该逻辑列的单元格（参差行）即停止
 *
 * 几何只在渲染前计算一次，渲染按 [行][单元格] 下标查询。
 */
public final class MergeGeometry {

    private static final Logger log = LoggerFactory.getLogger(MergeGeometry.class);

    private MergeGeometry() {
    }

    // 第一遍的中间结构
    private static final class Temp {
        int logicalCol, colspan, rowspan;
        VMergeState vm;
        DocxCell cell;
    }

    /**
     * @param table 表格
     * @param tableIndex 表格序号（从1开始），仅用于异常与日志
     * @throws TableStructureException 行或单元格引用为空
     */
    public static TableGeometry resolve(DocxTable table, int tableIndex) {
        List<DocxRow> rows = table.getRows();
        if (rows == null) {
            throw new TableStructureException(tableIndex, "表格 " + tableIndex + " 没有行列表");
        }

        // 1) 第一遍：逐行计算 logicalCol 与 colspan，rowspan 先占 1
        List<List<Temp>> grid = new ArrayList<>();
        int columnCount = 0;
        for (int r = 0; r < rows.size(); r++) {
            DocxRow row = rows.get(r);
            if (row == null || row.getCells() == null) {
                throw new TableStructureException(tableIndex,
                        String.format("表格 %d 第%d行引用为空", tableIndex, r + 1));
            }
            int logicalCol = 0;
            List<Temp> rowTemps = new ArrayList<>();
            for (int c = 0; c < row.getCells().size(); c++) {
                DocxCell cell = row.getCells().get(c);
                if (cell == null) {
                    throw new TableStructureException(tableIndex,
                            String.format("表格 %d 第%d行第%d个单元格引用为空", tableIndex, r + 1, c + 1));
                }
                Temp t = new Temp();
                t.cell = cell;
                t.logicalCol = logicalCol;
                t.colspan = parseGridSpan(cell.getGridSpan());
                t.vm = cell.getVMerge();
                t.rowspan = 1;
                rowTemps.add(t);
                logicalCol += t.colspan;
            }
            columnCount = Math.max(columnCount, logicalCol);
            grid.add(rowTemps);
        }

        // 2) 第二遍：RESTART 向下统计连续 CONTINUE；CONTINUE 置0
        for (int r = 0; r < grid.size(); r++) {
            for (Temp t : grid.get(r)) {
                if (t.vm == VMergeState.CONTINUE) {
                    t.rowspan = 0;
                    if (!hasRestartAbove(grid, r, t.logicalCol) && hasText(t.cell)) {
                        log.warn("表格 {} 第{}行逻辑列{}: 延续单元格上方没有合并起点，内容将被跳过",
                                tableIndex, r + 1, t.logicalCol);
                    }
                    continue;
                }
                if (t.vm != VMergeState.RESTART) continue;
                int span = 1;
                for (int down = r + 1; down < grid.size(); down++) {
                    Temp cont = findByLogicalCol(grid.get(down), t.logicalCol);
                    if (cont != null && cont.vm == VMergeState.CONTINUE) {
                        span++;
                    } else break;
                }
                t.rowspan = span;
            }
        }

        // 3) 输出
        List<List<CellGeometry>> out = new ArrayList<>();
        for (List<Temp> rowTemps : grid) {
            List<CellGeometry> rowOut = new ArrayList<>();
            for (Temp t : rowTemps) {
                rowOut.add(new CellGeometry(t.rowspan, t.colspan, t.logicalCol, t.vm));
            }
            out.add(rowOut);
        }
        return new TableGeometry(table, out, columnCount);
    }

    /**
     * gridSpan 原值解析，缺省、非数字或小于1都按1处理
     */
    static int parseGridSpan(String raw) {
        if (raw == null) {
            return 1;
        }
        try {
            int v = Integer.parseInt(raw.trim());
            return v < 1 ? 1 : v;
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    private static boolean hasRestartAbove(List<List<Temp>> grid, int r, int logicalCol) {
        for (int up = r - 1; up >= 0; up--) {
            Temp u = findByLogicalCol(grid.get(up), logicalCol);
            if (u == null) return false;
            if (u.vm == VMergeState.RESTART) return true;
            if (u.vm != VMergeState.CONTINUE) return false;
        }
        return false;
    }

    private static Temp findByLogicalCol(List<Temp> row, int logicalCol) {
        for (Temp t : row) {
            if (logicalCol >= t.logicalCol && logicalCol < t.logicalCol + t.colspan) return t;
        }
        return null;
    }

    private static boolean hasText(DocxCell cell) {
        if (cell.getParagraphs() == null) return false;
        for (DocxParagraph p : cell.getParagraphs()) {
            if (!p.getText().trim().isEmpty()) return true;
        }
        return false;
    }
}
