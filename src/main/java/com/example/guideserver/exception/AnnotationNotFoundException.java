package com.example.guideserver.exception;

/**
 * 指南文件或单元格不存在
 */
public class AnnotationNotFoundException extends RuntimeException {

    public AnnotationNotFoundException(String message) {
        super(message);
    }
}
