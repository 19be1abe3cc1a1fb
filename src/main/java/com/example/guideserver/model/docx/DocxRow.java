package com.example.guideserver.model.docx;

import java.util.ArrayList;
import java.util.List;

/**
 * 表格行（w:tr），单元格按物理顺序排列，未展开合并
 */
public class DocxRow {

    private List<DocxCell> cells = new ArrayList<>();

    public DocxRow() {
    }

    public DocxRow(List<DocxCell> cells) {
        this.cells = cells;
    }

    public List<DocxCell> getCells() { return cells; }
    public void setCells(List<DocxCell> cells) { this.cells = cells; }
}
