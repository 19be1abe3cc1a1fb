package com.example.guideserver.exception;

/**
 * 表格物理网格损坏（空单元格引用、XML 结构异常等）
 * 只跳过出问题的表格，不影响同一文档的其它表格
 */
public class TableStructureException extends RuntimeException {

    private final int tableIndex;

    public TableStructureException(int tableIndex, String message) {
        super(message);
        this.tableIndex = tableIndex;
    }

    public TableStructureException(int tableIndex, String message, Throwable cause) {
        super(message, cause);
        this.tableIndex = tableIndex;
    }

    /** 源文档中的表格序号（从1开始） */
    public int getTableIndex() {
        return tableIndex;
    }
}
