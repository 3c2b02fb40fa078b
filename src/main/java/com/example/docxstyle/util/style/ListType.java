package com.example.docxstyle.util.style;

import java.util.Locale;

/**
 * 列表类型
 */
public enum ListType {
    NONE,
    BULLET,
    NUMBER;

    public static ListType fromText(String text) {
        if (text == null) {
            return null;
        }
        switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "none":
                return NONE;
            case "bullet":
            case "unordered":
                return BULLET;
            case "number":
            case "numbered":
            case "ordered":
            case "decimal":
                return NUMBER;
            default:
                return null;
        }
    }
}
