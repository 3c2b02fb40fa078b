package com.example.docxstyle.service;

import com.example.docxstyle.util.style.error.StyleError;

/**
 * 样式处理失败，携带结构化错误
 */
public class StyleProcessingException extends Exception {

    private final StyleError error;

    public StyleProcessingException(StyleError error) {
        super(error.getMessage());
        this.error = error;
    }

    public StyleError getError() {
        return error;
    }
}
