package com.example.guideserver.model.guide;

import java.util.ArrayList;
import java.util.List;

/**
 * 批量转换汇总：成功/失败计数、失败明细、被跳过表格的告警
 */
public class BatchReport {

    private int converted;
    private int failed;
    private final List<String> failures = new ArrayList<>();
    private final List<String> structuralWarnings = new ArrayList<>();
    private String indexFile;

    public void recordSuccess(String slug, List<String> warnings) {
        converted++;
        for (String w : warnings) {
            structuralWarnings.add(slug + ": " + w);
        }
    }

    public void recordFailure(String source, String message) {
        failed++;
        failures.add(source + ": " + message);
    }

    /**
     * 只要有一个文档转换成功就算成功
     */
    public boolean isSuccess() {
        return converted > 0;
    }

    public int getConverted() { return converted; }
    public int getFailed() { return failed; }
    public List<String> getFailures() { return failures; }
    public List<String> getStructuralWarnings() { return structuralWarnings; }

    public String getIndexFile() { return indexFile; }
    public void setIndexFile(String indexFile) { this.indexFile = indexFile; }

    @Override
    public String toString() {
        return "BatchReport{converted=" + converted + ", failed=" + failed + "}";
    }
}
