package com.example.guideserver.model.guide;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * 课程：源目录下的一个子文件夹
 */
public class CourseContext {

    private final String name;
    private final String slug;
    private final File path;
    private final List<String> tags;

    public CourseContext(String name, String slug, File path, List<String> tags) {
        this.name = name;
        this.slug = slug;
        this.path = path;
        this.tags = tags == null ? new ArrayList<String>() : tags;
    }

    public String getName() { return name; }
    public String getSlug() { return slug; }
    public File getPath() { return path; }
    public List<String> getTags() { return tags; }
}
