package com.example.guideserver.model.docx;

/**
 * 单元格垂直对齐（w:vAlign）
 */
public enum VerticalAlign {
    TOP("top"),
    CENTER("middle"),
    BOTTOM("bottom");

    private final String css;

    VerticalAlign(String css) {
        this.css = css;
    }

    public String getCss() {
        return css;
    }
}
