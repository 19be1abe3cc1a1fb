package com.example.guideserver.util.table;

import com.example.guideserver.model.docx.VMergeState;

/**
 * 物理单元格的渲染几何：rowspan / colspan / 是否作为合并延续被跳过
 */
public final class CellGeometry {

    private final int rowSpan;       // 延续单元格为0
    private final int colSpan;
    private final int logicalCol;    // gridSpan 展开后的逻辑列起点（从0起）
    private final VMergeState vMerge;

    CellGeometry(int rowSpan, int colSpan, int logicalCol, VMergeState vMerge) {
        this.rowSpan = rowSpan;
        this.colSpan = colSpan;
        this.logicalCol = logicalCol;
        this.vMerge = vMerge;
    }

    public int getRowSpan() { return rowSpan; }
    public int getColSpan() { return colSpan; }
    public int getLogicalCol() { return logicalCol; }
    public VMergeState getVMerge() { return vMerge; }

    /**
     * 合并延续：渲染时整个跳过，不输出空单元格
     */
    public boolean isSkipped() {
        return rowSpan == 0;
    }

    @Override
    public String toString() {
        return isSkipped() ? "skip" : ("span(" + rowSpan + "x" + colSpan + "@" + logicalCol + ")");
    }
}
