package com.example.guideserver.service;

import com.example.guideserver.exception.TableStructureException;
import com.example.guideserver.model.docx.DocxDocument;
import com.example.guideserver.model.docx.DocxTable;
import com.example.guideserver.model.guide.CellAnnotation;
import com.example.guideserver.model.guide.GuideConversionResult;
import com.example.guideserver.model.guide.GuideData;
import com.example.guideserver.model.guide.GuideMetadata;
import com.example.guideserver.model.guide.NormalizedTable;
import com.example.guideserver.util.annotation.AnnotationMerger;
import com.example.guideserver.util.docx.DocxReadResult;
import com.example.guideserver.util.docx.XwpfGuideReader;
import com.example.guideserver.util.html.GuideHtmlRenderer;
import com.example.guideserver.util.table.MergeGeometry;
import com.example.guideserver.util.table.TableGeometry;
import com.example.guideserver.util.table.TableNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 指南转换：文档对象模型 -> {JSON 数据, HTML 片段}
 *
 * 流程：
 * 1. 计算每张表的合并几何，结构损坏的表跳过并记录告警
 * 2. 没有行的表同时从 JSON 与 HTML 中剔除，保证两边的表格序号一致
 * 3. 归一化表格 -> 新 cellData -> 与上次的 cellData 合并
 * 4. 渲染 HTML 片段
 *
 * 无共享可变状态，可以被多个文档顺序调用。
 */
@Slf4j
@Service
public class GuideConversionService {

    /**
     * 解析 docx 后转换
     *
     * @param previousCellData 上次保存的 cellData，首次转换传空 Map 或 null
     */
    public GuideConversionResult convert(GuideMetadata meta, InputStream docx,
                                         Map<String, CellAnnotation> previousCellData) throws IOException {
        DocxReadResult read = XwpfGuideReader.read(docx);
        List<String> warnings = new ArrayList<>();
        for (TableStructureException e : read.getProblems()) {
            warnings.add(e.getMessage());
        }
        return convert(meta, read.getDocument(), previousCellData, warnings);
    }

    public GuideConversionResult convert(GuideMetadata meta, DocxDocument document,
                                         Map<String, CellAnnotation> previousCellData) {
        return convert(meta, document, previousCellData, new ArrayList<String>());
    }

    private GuideConversionResult convert(GuideMetadata meta, DocxDocument document,
                                          Map<String, CellAnnotation> previousCellData, List<String> warnings) {
        List<TableGeometry> surviving = new ArrayList<>();
        List<DocxTable> tables = document.getTables();
        for (int i = 0; i < tables.size(); i++) {
            DocxTable table = tables.get(i);
            if (table.getRows() != null && table.getRows().isEmpty()) {
                continue;
            }
            try {
                surviving.add(MergeGeometry.resolve(table, i + 1));
            } catch (TableStructureException e) {
                log.warn("[{}] 跳过表格: {}", meta.getSlug(), e.getMessage());
                warnings.add(e.getMessage());
            }
        }

        List<DocxTable> survivingTables = new ArrayList<>();
        for (TableGeometry g : surviving) {
            survivingTables.add(g.getTable());
        }
        List<NormalizedTable> normalized = TableNormalizer.normalizeAll(survivingTables);

        Map<String, CellAnnotation> fresh = AnnotationMerger.freshCellData(normalized);
        Map<String, CellAnnotation> merged = AnnotationMerger.merge(fresh, previousCellData);

        GuideData data = new GuideData();
        data.setTitle(meta.getTitle());
        data.setCourse(meta.getCourse().getName());
        data.setCourseSlug(meta.getCourse().getSlug());
        data.setTags(new ArrayList<>(meta.getTags()));
        data.setTables(normalized);
        data.setCellData(merged);

        String html = GuideHtmlRenderer.renderFragment(meta.getSlug(), surviving);

        log.debug("[{}] 转换完成: {} 张表, {} 个单元格标注", meta.getSlug(), normalized.size(), merged.size());
        return new GuideConversionResult(data, html, warnings);
    }
}
