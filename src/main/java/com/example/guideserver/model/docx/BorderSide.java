package com.example.guideserver.model.docx;

/**
 * 边框/边距的方向
 * INSIDE_H / INSIDE_V 只在表格级（w:tblBorders）出现
 */
public enum BorderSide {
    TOP("top"),
    BOTTOM("bottom"),
    LEFT("left"),
    RIGHT("right"),
    INSIDE_H("insideH"),
    INSIDE_V("insideV");

    private final String xmlName;

    BorderSide(String xmlName) {
        this.xmlName = xmlName;
    }

    /** OOXML 中的元素名，如 insideH */
    public String getXmlName() {
        return xmlName;
    }

    /** CSS 属性后缀，如 border-top 里的 top */
    public String getCssName() {
        return xmlName.toLowerCase();
    }
}
