package com.example.guideserver;

import com.example.guideserver.model.docx.DocxCell;
import com.example.guideserver.model.docx.DocxParagraph;
import com.example.guideserver.model.docx.DocxRow;
import com.example.guideserver.model.docx.DocxRun;
import com.example.guideserver.model.docx.DocxTable;
import com.example.guideserver.model.docx.VMergeState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 测试用文档对象模型构造器
 */
public final class DocxFixtures {

    private DocxFixtures() {
    }

    public static DocxRun run(String text) {
        return new DocxRun(text);
    }

    public static DocxParagraph para(String... runTexts) {
        List<DocxRun> runs = new ArrayList<>();
        for (String t : runTexts) {
            runs.add(run(t));
        }
        return new DocxParagraph(runs);
    }

    /** 每个参数一个段落；无参数时单元格没有段落 */
    public static DocxCell cell(String... paragraphs) {
        List<DocxParagraph> list = new ArrayList<>();
        for (String p : paragraphs) {
            list.add(para(p));
        }
        return new DocxCell(list);
    }

    public static DocxCell restart(String text) {
        DocxCell c = cell(text);
        c.setVMerge(VMergeState.RESTART);
        return c;
    }

    public static DocxCell cont() {
        DocxCell c = cell("");
        c.setVMerge(VMergeState.CONTINUE);
        return c;
    }

    public static DocxCell span(String text, int gridSpan) {
        DocxCell c = cell(text);
        c.setGridSpan(String.valueOf(gridSpan));
        return c;
    }

    public static DocxRow row(DocxCell... cells) {
        return new DocxRow(new ArrayList<>(Arrays.asList(cells)));
    }

    public static DocxRow row(String... texts) {
        List<DocxCell> cells = new ArrayList<>();
        for (String t : texts) {
            cells.add(cell(t));
        }
        return new DocxRow(cells);
    }

    public static DocxTable table(DocxRow... rows) {
        return new DocxTable(new ArrayList<>(Arrays.asList(rows)));
    }
}
