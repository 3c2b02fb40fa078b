package com.example.docxstyle.util.style;

/**
 * 样式类型
 */
public enum StyleType {
    PARAGRAPH,
    CHARACTER,
    TABLE,
    NUMBERING,
    /** 同时包含段落与字符属性 */
    MIXED;

    boolean allowsParagraphProperties() {
        return this == PARAGRAPH || this == MIXED;
    }

    boolean allowsCharacterProperties() {
        return this == CHARACTER || this == MIXED;
    }

    boolean allowsTableProperties() {
        return this == TABLE;
    }

    /**
     * 写入 w:style 的 w:type 属性值
     */
    String ooxmlType() {
        switch (this) {
            case CHARACTER:
                return "character";
            case TABLE:
                return "table";
            case NUMBERING:
                return "numbering";
            default:
                return "paragraph";
        }
    }
}
