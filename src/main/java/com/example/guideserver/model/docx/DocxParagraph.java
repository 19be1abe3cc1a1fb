package com.example.guideserver.model.docx;

import java.util.ArrayList;
import java.util.List;

/**
 * 段落（w:p）
 *
 * 字号/颜色取自段落样式，间距取自段落自身的 w:spacing
 */
public class DocxParagraph {

    private List<DocxRun> runs = new ArrayList<>();
    private ParagraphAlign alignment;
    private String styleName;
    private Double fontSizePt;
    private String fontColor;
    private Double spaceBeforePt;
    private Double spaceAfterPt;
    private Double lineSpacing;   // 行距倍数（lineRule=auto）
    private boolean listItem;     // 段落带 w:numPr

    public DocxParagraph() {
    }

    public DocxParagraph(List<DocxRun> runs) {
        this.runs = runs;
    }

    /**
     * 段落纯文本：所有 run 文本直接拼接
     */
    public String getText() {
        StringBuilder sb = new StringBuilder();
        for (DocxRun run : runs) {
            if (run.getText() != null) {
                sb.append(run.getText());
            }
        }
        return sb.toString();
    }

    public List<DocxRun> getRuns() { return runs; }
    public void setRuns(List<DocxRun> runs) { this.runs = runs; }

    public ParagraphAlign getAlignment() { return alignment; }
    public void setAlignment(ParagraphAlign alignment) { this.alignment = alignment; }

    public String getStyleName() { return styleName; }
    public void setStyleName(String styleName) { this.styleName = styleName; }

    public Double getFontSizePt() { return fontSizePt; }
    public void setFontSizePt(Double fontSizePt) { this.fontSizePt = fontSizePt; }

    public String getFontColor() { return fontColor; }
    public void setFontColor(String fontColor) { this.fontColor = fontColor; }

    public Double getSpaceBeforePt() { return spaceBeforePt; }
    public void setSpaceBeforePt(Double spaceBeforePt) { this.spaceBeforePt = spaceBeforePt; }

    public Double getSpaceAfterPt() { return spaceAfterPt; }
    public void setSpaceAfterPt(Double spaceAfterPt) { this.spaceAfterPt = spaceAfterPt; }

    public Double getLineSpacing() { return lineSpacing; }
    public void setLineSpacing(Double lineSpacing) { this.lineSpacing = lineSpacing; }

    public boolean isListItem() { return listItem; }
    public void setListItem(boolean listItem) { this.listItem = listItem; }
}
