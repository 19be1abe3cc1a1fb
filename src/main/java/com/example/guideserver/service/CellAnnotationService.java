package com.example.guideserver.service;

import com.example.guideserver.exception.AnnotationNotFoundException;
import com.example.guideserver.model.guide.CellAnnotation;
import com.example.guideserver.model.guide.GuideData;
import com.example.guideserver.store.AnnotationStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * 编辑已保存指南中的单元格标注：读出整份指南，改一条 cellData，再整份写回
 *
 * 单元格必须已经存在于 cellData 中；content 只由转换生成，这里不改。
 */
@Slf4j
@Service
public class CellAnnotationService {

    private final AnnotationStore annotationStore;

    public CellAnnotationService(AnnotationStore annotationStore) {
        this.annotationStore = annotationStore;
    }

    /**
     * 写入摘要
     *
     * @param lastUpdated 为空时取当前时间
     * @throws AnnotationNotFoundException 指南或单元格不存在
     */
    public synchronized CellAnnotation update(String slug, String cellId, String summary, String lastUpdated)
            throws IOException {
        GuideData data = requireGuide(slug);
        CellAnnotation cell = requireCell(data, slug, cellId);

        cell.setSummary(summary.trim());
        cell.setLastUpdated(lastUpdated == null || lastUpdated.trim().isEmpty()
                ? ZonedDateTime.now(ZoneOffset.UTC).format(GuideBatchService.GENERATED_FORMAT)
                : lastUpdated.trim());
        annotationStore.save(slug, data);
        log.info("更新标注 {} / {}", slug, cellId);
        return cell;
    }

    /**
     * 清除摘要：条目恢复为刚转换出来的状态（只保留 content）
     *
     * @throws AnnotationNotFoundException 指南或单元格不存在
     */
    public synchronized CellAnnotation clear(String slug, String cellId) throws IOException {
        GuideData data = requireGuide(slug);
        CellAnnotation cell = requireCell(data, slug, cellId);

        CellAnnotation cleared = CellAnnotation.fresh(cell.getContent());
        data.getCellData().put(cellId, cleared);
        annotationStore.save(slug, data);
        log.info("清除标注 {} / {}", slug, cellId);
        return cleared;
    }

    private GuideData requireGuide(String slug) {
        GuideData data = annotationStore.loadGuide(slug);
        if (data == null) {
            throw new AnnotationNotFoundException("未找到指南: " + slug);
        }
        return data;
    }

    private static CellAnnotation requireCell(GuideData data, String slug, String cellId) {
        CellAnnotation cell = data.getCellData().get(cellId);
        if (cell == null) {
            throw new AnnotationNotFoundException("未找到单元格: " + slug + " / " + cellId);
        }
        return cell;
    }
}
