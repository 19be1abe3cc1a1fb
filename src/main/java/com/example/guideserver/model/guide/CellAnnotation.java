package com.example.guideserver.model.guide;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * 单元格标注（cellData 的值）
 *
 * summary 为空串表示尚未查询；{@link #NO_DATA} 表示查询过但没有结果。
 * lastUpdated 缺省时不输出。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"content", "summary", "lastUpdated"})
public class CellAnnotation {

    public static final String NO_DATA = "no data";

    private String content = "";
    private String summary = "";
    private String lastUpdated;

    public CellAnnotation() {
    }

    public CellAnnotation(String content, String summary, String lastUpdated) {
        this.content = content;
        this.summary = summary;
        this.lastUpdated = lastUpdated;
    }

    public static CellAnnotation fresh(String content) {
        return new CellAnnotation(content, "", null);
    }

    public CellAnnotation copy() {
        return new CellAnnotation(content, summary, lastUpdated);
    }

    /**
     * summary 非空且不是 "no data"
     */
    public boolean hasUsableSummary() {
        String s = summary == null ? "" : summary.trim();
        return !s.isEmpty() && !NO_DATA.equals(s);
    }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public String getSummary() { return summary; }
    public void setSummary(String summary) { this.summary = summary; }

    public String getLastUpdated() { return lastUpdated; }
    public void setLastUpdated(String lastUpdated) { this.lastUpdated = lastUpdated; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CellAnnotation)) return false;
        CellAnnotation that = (CellAnnotation) o;
        return Objects.equals(content, that.content)
                && Objects.equals(summary, that.summary)
                && Objects.equals(lastUpdated, that.lastUpdated);
    }

    @Override
    public int hashCode() {
        return Objects.hash(content, summary, lastUpdated);
    }

    @Override
    public String toString() {
        return "CellAnnotation{content='" + content + "', summary='" + summary + "', lastUpdated=" + lastUpdated + "}";
    }
}
