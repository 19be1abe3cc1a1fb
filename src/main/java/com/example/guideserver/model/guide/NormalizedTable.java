package com.example.guideserver.model.guide;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/**
 * 归一化表格：第一行作为表头，其余为数据行
 * 列数由表头长度隐含，数据行不强制对齐
 */
@JsonPropertyOrder({"headers", "rows"})
public class NormalizedTable {

    private List<String> headers = new ArrayList<>();
    private List<List<String>> rows = new ArrayList<>();

    public NormalizedTable() {
    }

    public NormalizedTable(List<String> headers, List<List<String>> rows) {
        this.headers = headers;
        this.rows = rows;
    }

    public List<String> getHeaders() { return headers; }
    public void setHeaders(List<String> headers) { this.headers = headers; }

    public List<List<String>> getRows() { return rows; }
    public void setRows(List<List<String>> rows) { this.rows = rows; }
}
