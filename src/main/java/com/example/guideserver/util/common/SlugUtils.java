package com.example.guideserver.util.common;

import java.util.regex.Pattern;

/**
 * slug 工具类
 */
public class SlugUtils {

    private static final Pattern NON_ALNUM = Pattern.compile("[^A-Za-z0-9]+");

    /**
     * 非字母数字的连续字符替换为 "-"，去掉首尾 "-"，转小写
     *
     * 例："Heading 1" -> "heading-1"，"  Course_9 " -> "course-9"
     */
    public static String slugify(String text) {
        if (text == null) {
            return "";
        }
        String normalized = NON_ALNUM.matcher(text).replaceAll("-");
        int start = 0;
        int end = normalized.length();
        while (start < end && normalized.charAt(start) == '-') start++;
        while (end > start && normalized.charAt(end - 1) == '-') end--;
        return normalized.substring(start, end).toLowerCase();
    }

    /**
     * 去掉扩展名
     */
    public static String stem(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
