package com.example.guideserver.model.docx;

/**
 * 单元格纵向合并状态（w:vMerge）
 *
 * - NONE：没有 vMerge 元素
 * - RESTART：合并块起点（w:val="restart"）
 * - CONTINUE：合并延续（&lt;w:vMerge/&gt; 或 w:val="continue"）
 */
public enum VMergeState { NONE, RESTART, CONTINUE }
