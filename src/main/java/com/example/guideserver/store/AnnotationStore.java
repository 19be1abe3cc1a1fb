package com.example.guideserver.store;

import com.example.guideserver.model.guide.CellAnnotation;
import com.example.guideserver.model.guide.GuideData;

import java.io.IOException;
import java.util.Map;

/**
 * 标注持久化：按文档 slug 存取 cellData
 *
 * 同一 slug 的读写需要调用方串行化。
 */
public interface AnnotationStore {

    /**
     * 读取上次保存的 cellData；不存在或无法读取时返回空 Map，不抛异常
     */
    Map<String, CellAnnotation> load(String slug);

    /**
     * 读取完整的指南数据，cellData 的处理同 {@link #load(String)}；文件不存在或无法解析时返回 null
     */
    GuideData loadGuide(String slug);

    /**
     * 保存完整的指南数据，写入失败抛 IOException
     */
    void save(String slug, GuideData data) throws IOException;
}
