package com.example.guideserver.model.docx;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 表格单元格（w:tc）
 *
 * 合并信息：gridSpan（横向，原值）+ vMerge（纵向）
 * 格式信息：底纹 fill、四边边框、四边边距（w:tcMar，单位 twips，原值）、垂直对齐
 */
public class DocxCell {

    private List<DocxParagraph> paragraphs = new ArrayList<>();
    private String gridSpan;
    private VMergeState vMerge = VMergeState.NONE;
    private String fill;
    private VerticalAlign verticalAlign;
    private Map<BorderSide, DocxBorder> borders = new EnumMap<>(BorderSide.class);
    private Map<BorderSide, String> margins = new EnumMap<>(BorderSide.class);

    public DocxCell() {
    }

    public DocxCell(List<DocxParagraph> paragraphs) {
        this.paragraphs = paragraphs;
    }

    public List<DocxParagraph> getParagraphs() { return paragraphs; }
    public void setParagraphs(List<DocxParagraph> paragraphs) { this.paragraphs = paragraphs; }

    public String getGridSpan() { return gridSpan; }
    public void setGridSpan(String gridSpan) { this.gridSpan = gridSpan; }

    public VMergeState getVMerge() { return vMerge; }
    public void setVMerge(VMergeState vMerge) { this.vMerge = vMerge == null ? VMergeState.NONE : vMerge; }

    public String getFill() { return fill; }
    public void setFill(String fill) { this.fill = fill; }

    public VerticalAlign getVerticalAlign() { return verticalAlign; }
    public void setVerticalAlign(VerticalAlign verticalAlign) { this.verticalAlign = verticalAlign; }

    public Map<BorderSide, DocxBorder> getBorders() { return borders; }
    public void setBorders(Map<BorderSide, DocxBorder> borders) { this.borders = borders; }

    public Map<BorderSide, String> getMargins() { return margins; }
    public void setMargins(Map<BorderSide, String> margins) { this.margins = margins; }
}
