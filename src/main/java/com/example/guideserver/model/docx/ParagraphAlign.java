package com.example.guideserver.model.docx;

/**
 * 段落对齐（w:jc），只区分渲染需要的几种
 */
public enum ParagraphAlign { LEFT, CENTER, RIGHT, JUSTIFY }
