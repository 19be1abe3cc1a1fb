package com.example.guideserver.model.guide;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/**
 * guides.index.json
 */
@JsonPropertyOrder({"generated", "guides"})
public class GuideIndex {

    private String generated;
    private List<Entry> guides = new ArrayList<>();

    public String getGenerated() { return generated; }
    public void setGenerated(String generated) { this.generated = generated; }

    public List<Entry> getGuides() { return guides; }
    public void setGuides(List<Entry> guides) { this.guides = guides; }

    @JsonPropertyOrder({"title", "course", "courseSlug", "tags", "slug", "dataFile", "fragment", "sourceFile", "tables"})
    public static class Entry {
        private String title;
        private String course;
        private String courseSlug;
        private List<String> tags = new ArrayList<>();
        private String slug;
        private String dataFile;
        private String fragment;
        private String sourceFile;
        private int tables;

        public String getTitle() { return title; }
        public void setTitle(String title) { this.title = title; }

        public String getCourse() { return course; }
        public void setCourse(String course) { this.course = course; }

        public String getCourseSlug() { return courseSlug; }
        public void setCourseSlug(String courseSlug) { this.courseSlug = courseSlug; }

        public List<String> getTags() { return tags; }
        public void setTags(List<String> tags) { this.tags = tags; }

        public String getSlug() { return slug; }
        public void setSlug(String slug) { this.slug = slug; }

        public String getDataFile() { return dataFile; }
        public void setDataFile(String dataFile) { this.dataFile = dataFile; }

        public String getFragment() { return fragment; }
        public void setFragment(String fragment) { this.fragment = fragment; }

        public String getSourceFile() { return sourceFile; }
        public void setSourceFile(String sourceFile) { this.sourceFile = sourceFile; }

        public int getTables() { return tables; }
        public void setTables(int tables) { this.tables = tables; }
    }
}
