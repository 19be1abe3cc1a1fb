package com.example.guideserver.util.table;

import com.example.guideserver.model.docx.DocxTable;

import java.util.List;

/**
 * 一张表的合并几何，按 [行][物理单元格] 索引
 */
public final class TableGeometry {

    private final DocxTable table;
    private final List<List<CellGeometry>> cells;
    private final int columnCount;

    TableGeometry(DocxTable table, List<List<CellGeometry>> cells, int columnCount) {
        this.table = table;
        this.cells = cells;
        this.columnCount = columnCount;
    }

    public DocxTable getTable() { return table; }

    public CellGeometry get(int row, int cell) {
        return cells.get(row).get(cell);
    }

    public List<CellGeometry> row(int row) {
        return cells.get(row);
    }

    public int getRowCount() {
        return cells.size();
    }

    /** 展开 gridSpan 后最宽一行的逻辑列数 */
    public int getColumnCount() {
        return columnCount;
    }
}
