package com.example.guideserver.model.docx;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 表格（w:tbl）
 *
 * borders 来自 w:tblBorders，cellMargins 来自 w:tblCellMar（twips 原值）
 */
public class DocxTable {

    private List<DocxRow> rows = new ArrayList<>();
    private Map<BorderSide, DocxBorder> borders = new EnumMap<>(BorderSide.class);
    private Map<BorderSide, String> cellMargins = new EnumMap<>(BorderSide.class);

    public DocxTable() {
    }

    public DocxTable(List<DocxRow> rows) {
        this.rows = rows;
    }

    public List<DocxRow> getRows() { return rows; }
    public void setRows(List<DocxRow> rows) { this.rows = rows; }

    public Map<BorderSide, DocxBorder> getBorders() { return borders; }
    public void setBorders(Map<BorderSide, DocxBorder> borders) { this.borders = borders; }

    public Map<BorderSide, String> getCellMargins() { return cellMargins; }
    public void setCellMargins(Map<BorderSide, String> cellMargins) { this.cellMargins = cellMargins; }
}
