package com.example.guideserver.model.guide;

import java.util.ArrayList;
import java.util.List;

/**
 * 单个文档的转换结果：JSON 数据 + HTML 片段 + 被跳过表格的告警
 */
public class GuideConversionResult {

    private final GuideData data;
    private final String html;
    private final List<String> warnings;

    public GuideConversionResult(GuideData data, String html, List<String> warnings) {
        this.data = data;
        this.html = html;
        this.warnings = warnings == null ? new ArrayList<String>() : warnings;
    }

    public GuideData getData() { return data; }
    public String getHtml() { return html; }
    public List<String> getWarnings() { return warnings; }

    public int getTableCount() {
        return data.getTables().size();
    }
}
