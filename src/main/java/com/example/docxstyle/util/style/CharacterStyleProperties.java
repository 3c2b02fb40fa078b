package com.example.docxstyle.util.style;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * 字符样式属性
 *
 * 字号单位为磅，颜色为 6 位十六进制（不带 #），formattingFlags 为 {@link FormattingFlag} 掩码
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CharacterStyleProperties {

    @JsonProperty("font_name")
    private String fontName;

    @JsonProperty("font_size_pts")
    private Double fontSizePts;

    @JsonProperty("font_color")
    private String fontColorHex;

    @JsonProperty("highlight")
    private HighlightColor highlightColor;

    @JsonProperty("formatting_flags")
    private Integer formattingFlags;

    public CharacterStyleProperties() {
    }

    public CharacterStyleProperties(CharacterStyleProperties other) {
        this.fontName = other.fontName;
        this.fontSizePts = other.fontSizePts;
        this.fontColorHex = other.fontColorHex;
        this.highlightColor = other.highlightColor;
        this.formattingFlags = other.formattingFlags;
    }

    public CharacterStyleProperties overlay(CharacterStyleProperties overlay) {
        if (overlay == null) {
            return this;
        }
        if (overlay.fontName != null) fontName = overlay.fontName;
        if (overlay.fontSizePts != null) fontSizePts = overlay.fontSizePts;
        if (overlay.fontColorHex != null) fontColorHex = overlay.fontColorHex;
        if (overlay.highlightColor != null) highlightColor = overlay.highlightColor;
        if (overlay.formattingFlags != null) formattingFlags = overlay.formattingFlags;
        return this;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return fontName == null && fontSizePts == null && fontColorHex == null
                && highlightColor == null && formattingFlags == null;
    }

    /**
     * 判断某个格式标志是否开启；掩码未指定时视为关闭
     */
    public boolean hasFlag(FormattingFlag flag) {
        return formattingFlags != null && flag.isSetIn(formattingFlags);
    }

    public String getFontName() { return fontName; }
    public void setFontName(String fontName) { this.fontName = fontName; }

    public Double getFontSizePts() { return fontSizePts; }
    public void setFontSizePts(Double fontSizePts) { this.fontSizePts = fontSizePts; }

    public String getFontColorHex() { return fontColorHex; }
    public void setFontColorHex(String fontColorHex) { this.fontColorHex = fontColorHex; }

    public HighlightColor getHighlightColor() { return highlightColor; }
    public void setHighlightColor(HighlightColor highlightColor) { this.highlightColor = highlightColor; }

    public Integer getFormattingFlags() { return formattingFlags; }
    public void setFormattingFlags(Integer formattingFlags) { this.formattingFlags = formattingFlags; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CharacterStyleProperties)) return false;
        CharacterStyleProperties that = (CharacterStyleProperties) o;
        return Objects.equals(fontName, that.fontName)
                && Objects.equals(fontSizePts, that.fontSizePts)
                && Objects.equals(fontColorHex, that.fontColorHex)
                && highlightColor == that.highlightColor
                && Objects.equals(formattingFlags, that.formattingFlags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fontName, fontSizePts, fontColorHex, highlightColor, formattingFlags);
    }

    @Override
    public String toString() {
        return "CharacterStyleProperties{font=" + fontName + ", size=" + fontSizePts
                + ", color=" + fontColorHex + ", highlight=" + highlightColor
                + ", flags=" + formattingFlags + '}';
    }
}
