package com.example.docxstyle.util.style;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * 段落样式属性
 *
 * 所有字段可空，null 表示"未指定"；长度单位为磅，行距为倍数
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParagraphStyleProperties {

    @JsonProperty("alignment")
    private Alignment alignment;

    @JsonProperty("space_before_pts")
    private Double spaceBeforePts;

    @JsonProperty("space_after_pts")
    private Double spaceAfterPts;

    @JsonProperty("line_spacing")
    private Double lineSpacing;

    @JsonProperty("left_indent_pts")
    private Double leftIndentPts;

    @JsonProperty("right_indent_pts")
    private Double rightIndentPts;

    @JsonProperty("first_line_indent_pts")
    private Double firstLineIndentPts;

    @JsonProperty("list_type")
    private ListType listType;

    @JsonProperty("list_level")
    private Integer listLevel;

    public ParagraphStyleProperties() {
    }

    public ParagraphStyleProperties(ParagraphStyleProperties other) {
        this.alignment = other.alignment;
        this.spaceBeforePts = other.spaceBeforePts;
        this.spaceAfterPts = other.spaceAfterPts;
        this.lineSpacing = other.lineSpacing;
        this.leftIndentPts = other.leftIndentPts;
        this.rightIndentPts = other.rightIndentPts;
        this.firstLineIndentPts = other.firstLineIndentPts;
        this.listType = other.listType;
        this.listLevel = other.listLevel;
    }

    /**
     * 用 overlay 中已指定的字段覆盖当前对象，返回 this
     */
    public ParagraphStyleProperties overlay(ParagraphStyleProperties overlay) {
        if (overlay == null) {
            return this;
        }
        if (overlay.alignment != null) alignment = overlay.alignment;
        if (overlay.spaceBeforePts != null) spaceBeforePts = overlay.spaceBeforePts;
        if (overlay.spaceAfterPts != null) spaceAfterPts = overlay.spaceAfterPts;
        if (overlay.lineSpacing != null) lineSpacing = overlay.lineSpacing;
        if (overlay.leftIndentPts != null) leftIndentPts = overlay.leftIndentPts;
        if (overlay.rightIndentPts != null) rightIndentPts = overlay.rightIndentPts;
        if (overlay.firstLineIndentPts != null) firstLineIndentPts = overlay.firstLineIndentPts;
        if (overlay.listType != null) listType = overlay.listType;
        if (overlay.listLevel != null) listLevel = overlay.listLevel;
        return this;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return alignment == null && spaceBeforePts == null && spaceAfterPts == null
                && lineSpacing == null && leftIndentPts == null && rightIndentPts == null
                && firstLineIndentPts == null && listType == null && listLevel == null;
    }

    // Getters and Setters
    public Alignment getAlignment() { return alignment; }
    public void setAlignment(Alignment alignment) { this.alignment = alignment; }

    public Double getSpaceBeforePts() { return spaceBeforePts; }
    public void setSpaceBeforePts(Double spaceBeforePts) { this.spaceBeforePts = spaceBeforePts; }

    public Double getSpaceAfterPts() { return spaceAfterPts; }
    public void setSpaceAfterPts(Double spaceAfterPts) { this.spaceAfterPts = spaceAfterPts; }

    public Double getLineSpacing() { return lineSpacing; }
    public void setLineSpacing(Double lineSpacing) { this.lineSpacing = lineSpacing; }

    public Double getLeftIndentPts() { return leftIndentPts; }
    public void setLeftIndentPts(Double leftIndentPts) { this.leftIndentPts = leftIndentPts; }

    public Double getRightIndentPts() { return rightIndentPts; }
    public void setRightIndentPts(Double rightIndentPts) { this.rightIndentPts = rightIndentPts; }

    public Double getFirstLineIndentPts() { return firstLineIndentPts; }
    public void setFirstLineIndentPts(Double firstLineIndentPts) { this.firstLineIndentPts = firstLineIndentPts; }

    public ListType getListType() { return listType; }
    public void setListType(ListType listType) { this.listType = listType; }

    public Integer getListLevel() { return listLevel; }
    public void setListLevel(Integer listLevel) { this.listLevel = listLevel; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParagraphStyleProperties)) return false;
        ParagraphStyleProperties that = (ParagraphStyleProperties) o;
        return alignment == that.alignment
                && Objects.equals(spaceBeforePts, that.spaceBeforePts)
                && Objects.equals(spaceAfterPts, that.spaceAfterPts)
                && Objects.equals(lineSpacing, that.lineSpacing)
                && Objects.equals(leftIndentPts, that.leftIndentPts)
                && Objects.equals(rightIndentPts, that.rightIndentPts)
                && Objects.equals(firstLineIndentPts, that.firstLineIndentPts)
                && listType == that.listType
                && Objects.equals(listLevel, that.listLevel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alignment, spaceBeforePts, spaceAfterPts, lineSpacing, leftIndentPts,
                rightIndentPts, firstLineIndentPts, listType, listLevel);
    }

    @Override
    public String toString() {
        return "ParagraphStyleProperties{alignment=" + alignment + ", spaceBefore=" + spaceBeforePts
                + ", spaceAfter=" + spaceAfterPts + ", lineSpacing=" + lineSpacing
                + ", leftIndent=" + leftIndentPts + ", rightIndent=" + rightIndentPts
                + ", firstLineIndent=" + firstLineIndentPts + ", listType=" + listType
                + ", listLevel=" + listLevel + '}';
    }
}
