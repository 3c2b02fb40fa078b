package com.example.docxstyle.util.style;

import java.util.Locale;

/**
 * 文本高亮色，取值与 OOXML w:highlight 一致
 */
public enum HighlightColor {
    YELLOW("yellow"),
    LIGHT_GRAY("lightGray"),
    GREEN("green"),
    CYAN("cyan"),
    MAGENTA("magenta"),
    BLUE("blue"),
    RED("red"),
    DARK_BLUE("darkBlue"),
    DARK_CYAN("darkCyan"),
    DARK_GREEN("darkGreen"),
    DARK_MAGENTA("darkMagenta"),
    DARK_RED("darkRed"),
    DARK_YELLOW("darkYellow"),
    WHITE("white"),
    BLACK("black");

    private final String ooxmlValue;

    HighlightColor(String ooxmlValue) {
        this.ooxmlValue = ooxmlValue;
    }

    public String getOoxmlValue() {
        return ooxmlValue;
    }

    /**
     * 宽松解析：忽略大小写、横线和下划线，lightgrey 视同 lightgray；未知值返回 null
     */
    public static HighlightColor fromText(String text) {
        if (text == null) {
            return null;
        }
        String key = text.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
        if ("lightgrey".equals(key)) {
            key = "lightgray";
        }
        for (HighlightColor color : values()) {
            if (color.ooxmlValue.toLowerCase(Locale.ROOT).equals(key)) {
                return color;
            }
        }
        return null;
    }
}
