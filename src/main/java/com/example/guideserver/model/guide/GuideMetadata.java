package com.example.guideserver.model.guide;

import com.example.guideserver.util.common.SlugUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * 单个指南文档的元数据：标题、课程、slug、标签
 */
public class GuideMetadata {

    private final String title;
    private final CourseContext course;
    private final String slug;
    private final String sourceFile;
    private final List<String> tags;

    public GuideMetadata(String title, CourseContext course, String slug, String sourceFile, List<String> tags) {
        this.title = title;
        this.course = course;
        this.slug = slug;
        this.sourceFile = sourceFile;
        this.tags = tags;
    }

    /**
     * 由文件名（不含扩展名）和课程推导元数据
     *
     * @param stem 文件名主干，如 "Cardio_Drug-Guide"
     * @param course 课程
     * @param sourceFile 源文件路径，仅用于索引
     */
    public static GuideMetadata of(String stem, CourseContext course, String sourceFile) {
        String title = stem.replace("-", " ").replace("_", " ").trim();
        if (title.isEmpty()) {
            title = stem;
        }
        String documentSlug = SlugUtils.slugify(stem);
        String slug = (course.getSlug() != null && !course.getSlug().isEmpty())
                ? SlugUtils.slugify(course.getSlug() + "-" + documentSlug)
                : documentSlug;
        return new GuideMetadata(title, course, slug, sourceFile, new ArrayList<>(course.getTags()));
    }

    public String getTitle() { return title; }
    public CourseContext getCourse() { return course; }
    public String getSlug() { return slug; }
    public String getSourceFile() { return sourceFile; }
    public List<String> getTags() { return tags; }
}
