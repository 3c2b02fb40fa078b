package com.example.docxstyle.util.style;

/**
 * 内置样式库分类，按声明顺序加载
 */
public enum BuiltInStyleCategory {
    HEADING,
    BODY_TEXT,
    LIST,
    TABLE,
    TECHNICAL
}
