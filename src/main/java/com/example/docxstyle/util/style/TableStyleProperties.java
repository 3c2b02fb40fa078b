package com.example.docxstyle.util.style;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * 表格样式属性（长度单位为磅）
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TableStyleProperties {

    /** 支持的边框线型，取值与 WordprocessingML 的 w:val 一致 */
    public static final Set<String> BORDER_STYLES = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
            "nil", "none", "single", "thick", "double", "dotted", "dashed", "dotDash", "dotDotDash", "triple",
            "thinThickSmallGap", "thickThinSmallGap", "thinThickThinSmallGap",
            "thinThickMediumGap", "thickThinMediumGap", "thinThickThinMediumGap",
            "thinThickLargeGap", "thickThinLargeGap", "thinThickThinLargeGap",
            "wave", "doubleWave", "dashSmallGap", "dashDotStroked", "threeDEmboss", "threeDEngrave",
            "outset", "inset")));

    @JsonProperty("border_style")
    private String borderStyle;

    @JsonProperty("border_width_pts")
    private Double borderWidthPts;

    @JsonProperty("border_color")
    private String borderColorHex;

    @JsonProperty("cell_padding_pts")
    private Double cellPaddingPts;

    @JsonProperty("table_width_pts")
    private Double tableWidthPts;

    /** left / center / right */
    @JsonProperty("table_alignment")
    private String tableAlignment;

    public TableStyleProperties() {
    }

    public TableStyleProperties(TableStyleProperties other) {
        this.borderStyle = other.borderStyle;
        this.borderWidthPts = other.borderWidthPts;
        this.borderColorHex = other.borderColorHex;
        this.cellPaddingPts = other.cellPaddingPts;
        this.tableWidthPts = other.tableWidthPts;
        this.tableAlignment = other.tableAlignment;
    }

    public TableStyleProperties overlay(TableStyleProperties overlay) {
        if (overlay == null) {
            return this;
        }
        if (overlay.borderStyle != null) borderStyle = overlay.borderStyle;
        if (overlay.borderWidthPts != null) borderWidthPts = overlay.borderWidthPts;
        if (overlay.borderColorHex != null) borderColorHex = overlay.borderColorHex;
        if (overlay.cellPaddingPts != null) cellPaddingPts = overlay.cellPaddingPts;
        if (overlay.tableWidthPts != null) tableWidthPts = overlay.tableWidthPts;
        if (overlay.tableAlignment != null) tableAlignment = overlay.tableAlignment;
        return this;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return borderStyle == null && borderWidthPts == null && borderColorHex == null
                && cellPaddingPts == null && tableWidthPts == null && tableAlignment == null;
    }

    public String getBorderStyle() { return borderStyle; }
    public void setBorderStyle(String borderStyle) { this.borderStyle = borderStyle; }

    public Double getBorderWidthPts() { return borderWidthPts; }
    public void setBorderWidthPts(Double borderWidthPts) { this.borderWidthPts = borderWidthPts; }

    public String getBorderColorHex() { return borderColorHex; }
    public void setBorderColorHex(String borderColorHex) { this.borderColorHex = borderColorHex; }

    public Double getCellPaddingPts() { return cellPaddingPts; }
    public void setCellPaddingPts(Double cellPaddingPts) { this.cellPaddingPts = cellPaddingPts; }

    public Double getTableWidthPts() { return tableWidthPts; }
    public void setTableWidthPts(Double tableWidthPts) { this.tableWidthPts = tableWidthPts; }

    public String getTableAlignment() { return tableAlignment; }
    public void setTableAlignment(String tableAlignment) { this.tableAlignment = tableAlignment; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableStyleProperties)) return false;
        TableStyleProperties that = (TableStyleProperties) o;
        return Objects.equals(borderStyle, that.borderStyle)
                && Objects.equals(borderWidthPts, that.borderWidthPts)
                && Objects.equals(borderColorHex, that.borderColorHex)
                && Objects.equals(cellPaddingPts, that.cellPaddingPts)
                && Objects.equals(tableWidthPts, that.tableWidthPts)
                && Objects.equals(tableAlignment, that.tableAlignment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(borderStyle, borderWidthPts, borderColorHex, cellPaddingPts, tableWidthPts, tableAlignment);
    }

    @Override
    public String toString() {
        return "TableStyleProperties{border=" + borderStyle + "/" + borderWidthPts + "/" + borderColorHex
                + ", padding=" + cellPaddingPts + ", width=" + tableWidthPts
                + ", alignment=" + tableAlignment + '}';
    }
}
