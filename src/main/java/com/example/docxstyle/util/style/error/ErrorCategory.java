package com.example.docxstyle.util.style.error;

/**
 * 错误大类
 */
public enum ErrorCategory {
    GENERAL,
    FILE_IO,
    XML_PARSING,
    ELEMENT_OPERATION,
    VALIDATION,
    STYLE_SYSTEM
}
