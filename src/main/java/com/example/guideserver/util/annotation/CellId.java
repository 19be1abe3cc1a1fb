package com.example.guideserver.util.annotation;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 单元格ID：table_{表格序号,从1开始}_row_{行,从0开始}_col_{列,从0开始}
 * 第0行固定为表头行；数字不带前导零，每个坐标只有一种写法
 */
public final class CellId {

    private static final Pattern GRAMMAR = Pattern.compile("^table_([1-9]\\d*)_row_(0|[1-9]\\d*)_col_(0|[1-9]\\d*)$");

    private final int table;
    private final int row;
    private final int col;

    private CellId(int table, int row, int col) {
        this.table = table;
        this.row = row;
        this.col = col;
    }

    public static CellId of(int table, int row, int col) {
        if (table < 1 || row < 0 || col < 0) {
            throw new IllegalArgumentException("非法单元格坐标: table=" + table + ", row=" + row + ", col=" + col);
        }
        return new CellId(table, row, col);
    }

    public static String format(int table, int row, int col) {
        return of(table, row, col).toString();
    }

    /**
     * 解析ID，不符合格式时抛 IllegalArgumentException
     */
    public static CellId parse(String id) {
        if (id == null) {
            throw new IllegalArgumentException("单元格ID为空");
        }
        Matcher m = GRAMMAR.matcher(id);
        if (!m.matches()) {
            throw new IllegalArgumentException("单元格ID格式错误: " + id);
        }
        try {
            return of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("单元格ID数值越界: " + id, e);
        }
    }

    public static boolean isValid(String id) {
        try {
            parse(id);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public int getTable() { return table; }
    public int getRow() { return row; }
    public int getCol() { return col; }

    public boolean isHeader() {
        return row == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CellId)) return false;
        CellId other = (CellId) o;
        return table == other.table && row == other.row && col == other.col;
    }

    @Override
    public int hashCode() {
        return (table * 31 + row) * 31 + col;
    }

    @Override
    public String toString() {
        return "table_" + table + "_row_" + row + "_col_" + col;
    }
}
