package com.example.guideserver.service;

import com.example.guideserver.model.guide.BatchReport;
import com.example.guideserver.model.guide.CellAnnotation;
import com.example.guideserver.model.guide.CourseContext;
import com.example.guideserver.model.guide.GuideConversionResult;
import com.example.guideserver.model.guide.GuideIndex;
import com.example.guideserver.model.guide.GuideMetadata;
import com.example.guideserver.store.AnnotationStore;
import com.example.guideserver.store.JsonFileAnnotationStore;
import com.example.guideserver.util.common.SlugUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 批量转换：源目录下每个子目录是一门课程，课程目录中的每个 .docx 是一份指南
 *
 * 输出：
 * - &lt;output&gt;/&lt;slug&gt;.json
 * - &lt;output&gt;/html/&lt;slug&gt;.html
 * - &lt;output&gt;/guides.index.json
 *
 * 单个文档失败只记入汇总，不影响其它文档。
 */
@Slf4j
@Service
public class GuideBatchService {

    static final String TAGS_FILE = "tags.txt";
    static final DateTimeFormatter GENERATED_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssZ");

    private final GuideConversionService conversionService;
    private final AnnotationStore annotationStore;
    private final File sourceDir;
    private final File outputDir;
    private final String indexFileName;
    private final String htmlSubdir;

    public GuideBatchService(GuideConversionService conversionService,
                             AnnotationStore annotationStore,
                             @Value("${guide.source-dir:Drug Guides}") String sourceDir,
                             @Value("${guide.output-dir:data}") String outputDir,
                             @Value("${guide.index-file:guides.index.json}") String indexFileName,
                             @Value("${guide.html-subdir:html}") String htmlSubdir) {
        this.conversionService = conversionService;
        this.annotationStore = annotationStore;
        this.sourceDir = new File(sourceDir).getAbsoluteFile();
        this.outputDir = new File(outputDir).getAbsoluteFile();
        this.indexFileName = indexFileName;
        this.htmlSubdir = htmlSubdir;
    }

    /**
     * 转换全部课程
     *
     * @throws IllegalStateException 源目录不存在或没有课程目录
     */
    public BatchReport convertAll() {
        if (!sourceDir.isDirectory()) {
            throw new IllegalStateException("源目录不存在: " + sourceDir.getAbsolutePath());
        }
        List<CourseContext> courses = discoverCourses(sourceDir);
        if (courses.isEmpty()) {
            throw new IllegalStateException("源目录下没有课程目录: " + sourceDir.getAbsolutePath());
        }

        BatchReport report = new BatchReport();
        List<IndexedGuide> converted = new ArrayList<>();

        for (CourseContext course : courses) {
            File[] documents = course.getPath().listFiles(
                    (dir, name) -> name.toLowerCase().endsWith(".docx") && !name.startsWith("~$"));
            if (documents == null || documents.length == 0) {
                log.warn("跳过课程 {}: 没有 .docx 文件", course.getName());
                continue;
            }
            Arrays.sort(documents, Comparator.comparing(File::getName));

            for (File docx : documents) {
                GuideMetadata meta = GuideMetadata.of(SlugUtils.stem(docx.getName()), course, docx.getPath());
                try {
                    GuideConversionResult result = convertOne(meta, docx);
                    converted.add(new IndexedGuide(meta, result.getTableCount()));
                    report.recordSuccess(meta.getSlug(), result.getWarnings());
                    log.info("转换完成 {} -> {}.json, {}/{}.html ({} 张表, 跳过 {} 张) [course={}]",
                            docx.getName(), meta.getSlug(), htmlSubdir, meta.getSlug(),
                            result.getTableCount(), result.getWarnings().size(), course.getName());
                } catch (IOException | RuntimeException e) {
                    log.error("转换失败 {}: {}", docx.getPath(), e.getMessage(), e);
                    report.recordFailure(docx.getPath(), String.valueOf(e.getMessage()));
                }
            }
        }

        if (!report.isSuccess()) {
            log.error("没有任何指南转换成功，请确认课程目录中包含 .docx 文件");
            return report;
        }

        File indexFile = new File(outputDir, indexFileName);
        try {
            writeIndex(indexFile, converted);
            report.setIndexFile(indexFile.getAbsolutePath());
            log.info("索引已更新: {}", indexFile.getAbsolutePath());
        } catch (IOException e) {
            log.error("索引写入失败: {}", indexFile.getAbsolutePath(), e);
        }
        log.info("批量转换结束: 成功 {}, 失败 {}", report.getConverted(), report.getFailed());
        return report;
    }

    /**
     * 单个文档：先读旧标注，再转换；HTML 先写到临时文件，JSON 保存成功后再换入正式位置
     */
    GuideConversionResult convertOne(GuideMetadata meta, File docx) throws IOException {
        Map<String, CellAnnotation> previous = annotationStore.load(meta.getSlug());

        GuideConversionResult result;
        try (InputStream in = Files.newInputStream(docx.toPath())) {
            result = conversionService.convert(meta, in, previous);
        }

        File htmlFile = new File(new File(outputDir, htmlSubdir), meta.getSlug() + ".html");
        File pending = new File(htmlFile.getParentFile(), htmlFile.getName() + ".tmp");
        try {
            writeHtml(pending, result.getHtml());
            annotationStore.save(meta.getSlug(), result.getData());
            Files.move(pending.toPath(), htmlFile.toPath(), StandardCopyOption.REPLACE_EXISTING);
        } finally {
            if (pending.exists() && !pending.delete()) {
                log.warn("临时文件删除失败: {}", pending.getAbsolutePath());
            }
        }
        return result;
    }

    // ==================== 课程发现 ====================

    public static List<CourseContext> discoverCourses(File sourceDir) {
        File[] dirs = sourceDir.listFiles(File::isDirectory);
        List<CourseContext> courses = new ArrayList<>();
        if (dirs == null) {
            return courses;
        }
        Arrays.sort(dirs, Comparator.comparing((File f) -> f.getName().toLowerCase()));
        for (File dir : dirs) {
            String name = dir.getName().replace("_", " ").trim();
            if (name.isEmpty()) {
                name = dir.getName();
            }
            courses.add(new CourseContext(name, SlugUtils.slugify(name), dir, readCourseTags(dir)));
        }
        return courses;
    }

    /**
     * tags.txt：每行一个标签，整理规则见 {@link #normalizeTags(Collection)}
     */
    public static List<String> readCourseTags(File courseDir) {
        File tagsFile = new File(courseDir, TAGS_FILE);
        List<String> lines = new ArrayList<>();
        if (!tagsFile.isFile()) {
            return lines;
        }
        try {
            lines = Files.readAllLines(tagsFile.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("读取标签文件失败: {} ({})", tagsFile.getAbsolutePath(), e.getMessage());
        }
        return normalizeTags(lines);
    }

    /**
     * 去掉首尾空白和空标签；忽略大小写去重（保留第一次出现的写法），再忽略大小写排序
     */
    public static List<String> normalizeTags(Collection<String> tags) {
        List<String> unique = new ArrayList<>();
        if (tags == null) {
            return unique;
        }
        Set<String> seen = new HashSet<>();
        for (String raw : tags) {
            String tag = raw == null ? "" : raw.trim();
            if (!tag.isEmpty() && seen.add(tag.toLowerCase())) {
                unique.add(tag);
            }
        }
        unique.sort(Comparator.comparing((String t) -> t.toLowerCase()));
        return unique;
    }

    // ==================== 输出 ====================

    private void writeIndex(File indexFile, List<IndexedGuide> guides) throws IOException {
        List<IndexedGuide> sorted = new ArrayList<>(guides);
        sorted.sort(Comparator.comparing((IndexedGuide g) -> g.meta.getTitle().toLowerCase()));

        GuideIndex index = new GuideIndex();
        index.setGenerated(ZonedDateTime.now(ZoneOffset.UTC).format(GENERATED_FORMAT));
        for (IndexedGuide g : sorted) {
            GuideIndex.Entry entry = new GuideIndex.Entry();
            entry.setTitle(g.meta.getTitle());
            entry.setCourse(g.meta.getCourse().getName());
            entry.setCourseSlug(g.meta.getCourse().getSlug());
            entry.setTags(g.meta.getTags());
            entry.setSlug(g.meta.getSlug());
            entry.setDataFile(g.meta.getSlug() + ".json");
            entry.setFragment(htmlSubdir + "/" + g.meta.getSlug() + ".html");
            entry.setSourceFile(g.meta.getSourceFile());
            entry.setTables(g.tableCount);
            index.getGuides().add(entry);
        }

        File parent = indexFile.getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            throw new IOException("无法创建输出目录: " + parent.getAbsolutePath());
        }
        JsonFileAnnotationStore.writeJson(indexFile, index);
    }

    static void writeHtml(File file, String markup) throws IOException {
        File parent = file.getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            throw new IOException("无法创建 HTML 目录: " + parent.getAbsolutePath());
        }
        try (OutputStream os = Files.newOutputStream(file.toPath());
             Writer writer = new OutputStreamWriter(os, StandardCharsets.UTF_8)) {
            writer.write(markup);
            if (!markup.endsWith("\n")) {
                writer.write("\n");
            }
        }
    }

    public File getOutputDir() {
        return outputDir;
    }

    private static final class IndexedGuide {
        final GuideMetadata meta;
        final int tableCount;

        IndexedGuide(GuideMetadata meta, int tableCount) {
            this.meta = meta;
            this.tableCount = tableCount;
        }
    }
}
