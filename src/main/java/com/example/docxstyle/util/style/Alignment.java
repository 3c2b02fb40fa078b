package com.example.docxstyle.util.style;

import java.util.Locale;

/**
 * 段落对齐方式
 */
public enum Alignment {
    LEFT("left"),
    CENTER("center"),
    RIGHT("right"),
    JUSTIFY("both");

    private final String ooxmlValue;

    Alignment(String ooxmlValue) {
        this.ooxmlValue = ooxmlValue;
    }

    public String getOoxmlValue() {
        return ooxmlValue;
    }

    /**
     * 解析定义文档中的对齐字面量，未知值返回 null
     */
    public static Alignment fromText(String text) {
        if (text == null) {
            return null;
        }
        switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "left":
                return LEFT;
            case "center":
                return CENTER;
            case "right":
                return RIGHT;
            case "justify":
            case "both":
                return JUSTIFY;
            default:
                return null;
        }
    }
}
