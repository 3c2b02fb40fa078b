package com.example.docxstyle.util.docx.element;

import java.util.List;

/**
 * 表格元素，长度单位为磅
 */
public interface TableElement extends StyledElement {

    Double getWidth();

    void setWidth(double points);

    /**
     * @return left / center / right，未设置时返回 null
     */
    String getAlignment();

    void setAlignment(String alignment);

    String getBorderStyle();

    void setBorderStyle(String borderStyle);

    Double getBorderWidth();

    void setBorderWidth(double points);

    String getBorderColor();

    void setBorderColor(String hexColor);

    Double getCellMargin();

    /**
     * 统一设置四个方向的单元格边距
     */
    void setCellMargins(double points);

    /**
     * @return 所有单元格中的段落，按行、列顺序
     */
    List<ParagraphElement> getCellParagraphs();

    @Override
    default <R> R accept(StyledElementVisitor<R> visitor) {
        return visitor.visitTable(this);
    }
}
