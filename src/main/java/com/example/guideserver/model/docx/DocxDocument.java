package com.example.guideserver.model.docx;

import java.util.ArrayList;
import java.util.List;

/**
 * 文档对象模型：按出现顺序的顶层表格
 */
public class DocxDocument {

    private List<DocxTable> tables = new ArrayList<>();

    public DocxDocument() {
    }

    public DocxDocument(List<DocxTable> tables) {
        this.tables = tables;
    }

    public List<DocxTable> getTables() { return tables; }
    public void setTables(List<DocxTable> tables) { this.tables = tables; }
}
