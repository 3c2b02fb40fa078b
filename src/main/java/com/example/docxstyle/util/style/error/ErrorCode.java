package com.example.docxstyle.util.style.error;

/**
 * 错误码，每个错误码归属于一个固定的 {@link ErrorCategory}
 */
public enum ErrorCode {

    // 通用
    INVALID_ARGUMENT(ErrorCategory.GENERAL),

    // 文件
    FILE_NOT_FOUND(ErrorCategory.FILE_IO),
    FILE_ACCESS_FAILED(ErrorCategory.FILE_IO),

    // 定义文档解析
    XML_PARSE_ERROR(ErrorCategory.XML_PARSING),
    XML_INVALID_STRUCTURE(ErrorCategory.XML_PARSING),
    XML_ATTRIBUTE_MISSING(ErrorCategory.XML_PARSING),
    XML_NAMESPACE_ERROR(ErrorCategory.XML_PARSING),
    XML_UNSUPPORTED_VERSION(ErrorCategory.XML_PARSING),

    // 文档元素
    ELEMENT_OPERATION_FAILED(ErrorCategory.ELEMENT_OPERATION),

    // 校验
    VALIDATION_FAILED(ErrorCategory.VALIDATION),
    INVALID_FONT_SIZE(ErrorCategory.VALIDATION),
    INVALID_COLOR_FORMAT(ErrorCategory.VALIDATION),
    INVALID_ALIGNMENT(ErrorCategory.VALIDATION),
    INVALID_SPACING(ErrorCategory.VALIDATION),
    INVALID_TABLE_DIMENSION(ErrorCategory.VALIDATION),
    INVALID_BORDER(ErrorCategory.VALIDATION),
    INVALID_MARGIN(ErrorCategory.VALIDATION),
    INVALID_WIDTH(ErrorCategory.VALIDATION),
    INVALID_HEIGHT(ErrorCategory.VALIDATION),

    // 样式系统
    STYLE_NOT_FOUND(ErrorCategory.STYLE_SYSTEM),
    STYLE_ALREADY_EXISTS(ErrorCategory.STYLE_SYSTEM),
    STYLE_PROPERTY_INVALID(ErrorCategory.STYLE_SYSTEM),
    STYLE_INHERITANCE_CYCLE(ErrorCategory.STYLE_SYSTEM),
    STYLE_DEPENDENCY_MISSING(ErrorCategory.STYLE_SYSTEM);

    private final ErrorCategory category;

    ErrorCode(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
