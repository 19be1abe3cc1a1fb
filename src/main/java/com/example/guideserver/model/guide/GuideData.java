package com.example.guideserver.model.guide;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 指南 JSON（&lt;slug&gt;.json）的完整内容
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"title", "course", "courseSlug", "tags", "tables", "cellData"})
public class GuideData {

    private String title;
    private String course;
    private String courseSlug;
    private List<String> tags = new ArrayList<>();
    private List<NormalizedTable> tables = new ArrayList<>();
    private Map<String, CellAnnotation> cellData = new LinkedHashMap<>();

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getCourse() { return course; }
    public void setCourse(String course) { this.course = course; }

    public String getCourseSlug() { return courseSlug; }
    public void setCourseSlug(String courseSlug) { this.courseSlug = courseSlug; }

    public List<String> getTags() { return tags; }
    public void setTags(List<String> tags) { this.tags = tags; }

    public List<NormalizedTable> getTables() { return tables; }
    public void setTables(List<NormalizedTable> tables) { this.tables = tables; }

    public Map<String, CellAnnotation> getCellData() { return cellData; }
    public void setCellData(Map<String, CellAnnotation> cellData) { this.cellData = cellData; }
}
