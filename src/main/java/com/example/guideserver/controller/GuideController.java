package com.example.guideserver.controller;

import com.example.guideserver.exception.AnnotationNotFoundException;
import com.example.guideserver.model.guide.BatchReport;
import com.example.guideserver.model.guide.CellAnnotation;
import com.example.guideserver.model.guide.CourseContext;
import com.example.guideserver.model.guide.GuideConversionResult;
import com.example.guideserver.model.guide.GuideMetadata;
import com.example.guideserver.service.CellAnnotationService;
import com.example.guideserver.service.GuideBatchService;
import com.example.guideserver.service.GuideConversionService;
import com.example.guideserver.store.AnnotationStore;
import com.example.guideserver.util.annotation.CellId;
import com.example.guideserver.util.common.SlugUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 指南转换控制器
 */
@Slf4j
@RestController
@RequestMapping("/api/guides")
public class GuideController {

    @Autowired
    private GuideConversionService conversionService;

    @Autowired
    private GuideBatchService batchService;

    @Autowired
    private AnnotationStore annotationStore;

    @Autowired
    private CellAnnotationService cellAnnotationService;

    /**
     * 转换单个上传的 docx
     *
     * @param file docx 文件
     * @param course 课程名
     * @param tags 标签（可选）
     * @param persist 是否写回标注仓库（默认 false，只返回结果）
     */
    @PostMapping("/convert")
    public ResponseEntity<Map<String, Object>> convert(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "course", required = false, defaultValue = "") String course,
            @RequestParam(value = "tags", required = false) List<String> tags,
            @RequestParam(value = "persist", required = false, defaultValue = "false") boolean persist) {

        Map<String, Object> result = new HashMap<>();

        if (file.isEmpty()) {
            result.put("success", false);
            result.put("message", "文件不能为空");
            return ResponseEntity.badRequest().body(result);
        }
        String originalFilename = file.getOriginalFilename();
        if (originalFilename == null || !originalFilename.toLowerCase().endsWith(".docx")) {
            result.put("success", false);
            result.put("message", "只支持.docx文件");
            return ResponseEntity.badRequest().body(result);
        }

        String courseName = course.replace("_", " ").trim();
        CourseContext courseContext = new CourseContext(courseName, SlugUtils.slugify(courseName), null,
                GuideBatchService.normalizeTags(tags));
        GuideMetadata meta = GuideMetadata.of(SlugUtils.stem(originalFilename), courseContext, originalFilename);

        try (InputStream in = file.getInputStream()) {
            log.info("接收文件: {}, slug={}, persist={}", originalFilename, meta.getSlug(), persist);
            Map<String, CellAnnotation> previous = annotationStore.load(meta.getSlug());
            GuideConversionResult converted = conversionService.convert(meta, in, previous);
            if (persist) {
                annotationStore.save(meta.getSlug(), converted.getData());
            }

            result.put("success", true);
            result.put("slug", meta.getSlug());
            result.put("data", converted.getData());
            result.put("html", converted.getHtml());
            result.put("warnings", converted.getWarnings());
            return ResponseEntity.ok(result);

        } catch (IOException | RuntimeException e) {
            log.error("转换失败: {}", originalFilename, e);
            result.put("success", false);
            result.put("message", "转换失败: " + e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        }
    }

    /**
     * 批量转换配置的源目录
     */
    @PostMapping("/batch")
    public ResponseEntity<Map<String, Object>> batch() {
        Map<String, Object> result = new HashMap<>();
        try {
            BatchReport report = batchService.convertAll();
            result.put("success", report.isSuccess());
            result.put("converted", report.getConverted());
            result.put("failed", report.getFailed());
            result.put("failures", report.getFailures());
            result.put("warnings", report.getStructuralWarnings());
            result.put("indexFile", report.getIndexFile());
            return report.isSuccess()
                    ? ResponseEntity.ok(result)
                    : ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        } catch (IllegalStateException e) {
            result.put("success", false);
            result.put("message", e.getMessage());
            return ResponseEntity.badRequest().body(result);
        }
    }

    /**
     * 查询单个单元格标注
     */
    @GetMapping("/{slug}/cells/{cellId}")
    public ResponseEntity<Map<String, Object>> cell(@PathVariable("slug") String slug,
                                                    @PathVariable("cellId") String cellId) {
        Map<String, Object> result = new HashMap<>();
        ResponseEntity<Map<String, Object>> invalid = checkCellPath(slug, cellId, result);
        if (invalid != null) {
            return invalid;
        }
        CellAnnotation annotation = annotationStore.load(slug).get(cellId);
        if (annotation == null) {
            result.put("success", false);
            result.put("message", "未找到单元格: " + cellId);
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(result);
        }
        result.put("success", true);
        result.put("cellId", cellId);
        result.put("cell", annotation);
        return ResponseEntity.ok(result);
    }

    /**
     * 写入单元格摘要
     *
     * 请求体：{"summary": "...", "lastUpdated": "..."}，lastUpdated 可省略
     */
    @PutMapping("/{slug}/cells/{cellId}")
    public ResponseEntity<Map<String, Object>> updateCell(@PathVariable("slug") String slug,
                                                          @PathVariable("cellId") String cellId,
                                                          @RequestBody Map<String, String> body) {
        Map<String, Object> result = new HashMap<>();
        ResponseEntity<Map<String, Object>> invalid = checkCellPath(slug, cellId, result);
        if (invalid != null) {
            return invalid;
        }
        String summary = body.get("summary");
        if (summary == null) {
            result.put("success", false);
            result.put("message", "缺少 summary");
            return ResponseEntity.badRequest().body(result);
        }
        try {
            CellAnnotation updated = cellAnnotationService.update(slug, cellId, summary, body.get("lastUpdated"));
            result.put("success", true);
            result.put("cellId", cellId);
            result.put("cell", updated);
            return ResponseEntity.ok(result);
        } catch (AnnotationNotFoundException e) {
            result.put("success", false);
            result.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(result);
        } catch (IOException e) {
            log.error("保存标注失败: {} / {}", slug, cellId, e);
            result.put("success", false);
            result.put("message", "保存失败: " + e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        }
    }

    /**
     * 清除单元格摘要，条目本身保留
     */
    @DeleteMapping("/{slug}/cells/{cellId}")
    public ResponseEntity<Map<String, Object>> deleteCell(@PathVariable("slug") String slug,
                                                          @PathVariable("cellId") String cellId) {
        Map<String, Object> result = new HashMap<>();
        ResponseEntity<Map<String, Object>> invalid = checkCellPath(slug, cellId, result);
        if (invalid != null) {
            return invalid;
        }
        try {
            CellAnnotation cleared = cellAnnotationService.clear(slug, cellId);
            result.put("success", true);
            result.put("cellId", cellId);
            result.put("cell", cleared);
            return ResponseEntity.ok(result);
        } catch (AnnotationNotFoundException e) {
            result.put("success", false);
            result.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(result);
        } catch (IOException e) {
            log.error("保存标注失败: {} / {}", slug, cellId, e);
            result.put("success", false);
            result.put("message", "保存失败: " + e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        }
    }

    /**
     * slug 必须已是 slug 形式，cellId 必须符合 ID 格式；不合法时返回 400 响应，否则返回 null
     */
    private static ResponseEntity<Map<String, Object>> checkCellPath(String slug, String cellId,
                                                                     Map<String, Object> result) {
        if (slug.isEmpty() || !slug.equals(SlugUtils.slugify(slug))) {
            result.put("success", false);
            result.put("message", "slug格式错误: " + slug);
            return ResponseEntity.badRequest().body(result);
        }
        if (!CellId.isValid(cellId)) {
            result.put("success", false);
            result.put("message", "单元格ID格式错误: " + cellId);
            return ResponseEntity.badRequest().body(result);
        }
        return null;
    }
}
