package com.example.guideserver.model.docx;

/**
 * 单条边框（w:top / w:left ...）
 * 属性保持 XML 原值，数值解析交给样式提取
 */
public class DocxBorder {

    private String val;    // 线型，如 single / double / nil
    private String size;   // w:sz，单位 1/8 磅
    private String color;  // 十六进制或 auto

    public DocxBorder() {
    }

    public DocxBorder(String val, String size, String color) {
        this.val = val;
        this.size = size;
        this.color = color;
    }

    public String getVal() { return val; }
    public void setVal(String val) { this.val = val; }

    public String getSize() { return size; }
    public void setSize(String size) { this.size = size; }

    public String getColor() { return color; }
    public void setColor(String color) { this.color = color; }

    @Override
    public String toString() {
        return "DocxBorder{" + val + "," + size + "," + color + "}";
    }
}
