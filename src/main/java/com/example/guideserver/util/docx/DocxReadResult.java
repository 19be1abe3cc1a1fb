package com.example.guideserver.util.docx;

import com.example.guideserver.exception.TableStructureException;
import com.example.guideserver.model.docx.DocxDocument;

import java.util.ArrayList;
import java.util.List;

/**
 * 读取结果：可用的表格 + 因结构问题被跳过的表格
 */
public class DocxReadResult {

    private final DocxDocument document;
    private final List<TableStructureException> problems;

    public DocxReadResult(DocxDocument document, List<TableStructureException> problems) {
        this.document = document;
        this.problems = problems == null ? new ArrayList<TableStructureException>() : problems;
    }

    public DocxDocument getDocument() { return document; }
    public List<TableStructureException> getProblems() { return problems; }
}
