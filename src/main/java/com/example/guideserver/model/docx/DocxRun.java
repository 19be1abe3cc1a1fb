package com.example.guideserver.model.docx;

/**
 * 文本运行（w:r）
 */
public class DocxRun {

    private String text;
    private boolean bold;
    private boolean italic;
    private boolean underline;
    private String color;      // 十六进制，不含 #
    private String highlight;  // w:highlight 的原值，如 yellow / darkBlue

    public DocxRun() {
    }

    public DocxRun(String text) {
        this.text = text;
    }

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public boolean isBold() { return bold; }
    public void setBold(boolean bold) { this.bold = bold; }

    public boolean isItalic() { return italic; }
    public void setItalic(boolean italic) { this.italic = italic; }

    public boolean isUnderline() { return underline; }
    public void setUnderline(boolean underline) { this.underline = underline; }

    public String getColor() { return color; }
    public void setColor(String color) { this.color = color; }

    public String getHighlight() { return highlight; }
    public void setHighlight(String highlight) { this.highlight = highlight; }
}
