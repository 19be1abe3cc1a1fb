package com.example.guideserver.store;

import com.example.guideserver.model.guide.CellAnnotation;
import com.example.guideserver.model.guide.GuideData;
import com.example.guideserver.util.annotation.CellId;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 以 &lt;outputDir&gt;/&lt;slug&gt;.json 为存储的标注仓库
 *
 * 读：只取 cellData；文件缺失、损坏、ID 不合法的条目都按空处理
 * 写：格式化 JSON，UTF-8，末尾换行
 */
@Slf4j
public class JsonFileAnnotationStore implements AnnotationStore {

    static final ObjectMapper JSON_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final File outputDir;

    public JsonFileAnnotationStore(File outputDir) {
        this.outputDir = outputDir;
    }

    public File fileFor(String slug) {
        return new File(outputDir, slug + ".json");
    }

    @Override
    public Map<String, CellAnnotation> load(String slug) {
        File file = fileFor(slug);
        if (!file.isFile()) {
            return new LinkedHashMap<>();
        }
        try {
            JsonNode root = JSON_MAPPER.readTree(file);
            return readCellData(file, root == null ? null : root.get("cellData"));
        } catch (IOException e) {
            log.warn("读取已有标注失败，按空处理: {} ({})", file.getAbsolutePath(), e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    @Override
    public GuideData loadGuide(String slug) {
        File file = fileFor(slug);
        if (!file.isFile()) {
            return null;
        }
        try {
            JsonNode root = JSON_MAPPER.readTree(file);
            if (root == null || !root.isObject()) {
                log.warn("指南文件不是 JSON 对象: {}", file.getAbsolutePath());
                return null;
            }
            JsonNode cellData = ((ObjectNode) root).remove("cellData");
            GuideData data = JSON_MAPPER.treeToValue(root, GuideData.class);
            data.setCellData(readCellData(file, cellData));
            return data;
        } catch (IOException | IllegalArgumentException e) {
            log.warn("读取指南文件失败: {} ({})", file.getAbsolutePath(), e.getMessage());
            return null;
        }
    }

    /**
     * 逐条解析 cellData，ID 不合法或值不是对象的条目丢弃
     */
    private static Map<String, CellAnnotation> readCellData(File file, JsonNode cellData) {
        Map<String, CellAnnotation> out = new LinkedHashMap<>();
        if (cellData == null || !cellData.isObject()) {
            return out;
        }

        int dropped = 0;
        Iterator<Map.Entry<String, JsonNode>> fields = cellData.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!CellId.isValid(field.getKey()) || !field.getValue().isObject()) {
                dropped++;
                continue;
            }
            try {
                out.put(field.getKey(), JSON_MAPPER.treeToValue(field.getValue(), CellAnnotation.class));
            } catch (IOException | IllegalArgumentException e) {
                dropped++;
            }
        }
        if (dropped > 0) {
            log.warn("{} 中有 {} 条 cellData 无法识别，已忽略", file.getName(), dropped);
        }
        return out;
    }

    @Override
    public void save(String slug, GuideData data) throws IOException {
        File file = fileFor(slug);
        File parent = file.getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            throw new IOException("无法创建输出目录: " + parent.getAbsolutePath());
        }
        writeJson(file, data);
    }

    /**
     * 格式化写出任意对象，末尾补换行
     */
    public static void writeJson(File file, Object value) throws IOException {
        try (OutputStream os = Files.newOutputStream(file.toPath());
             Writer writer = new OutputStreamWriter(os, StandardCharsets.UTF_8)) {
            writer.write(JSON_MAPPER.writeValueAsString(value));
            writer.write("\n");
        }
    }
}
