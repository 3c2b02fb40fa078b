package com.example.docxstyle.util.docx.element;

import com.example.docxstyle.util.style.HighlightColor;

/**
 * 文本片段（run）
 */
public interface RunElement extends StyledElement {

    String getFontName();

    void setFontName(String fontName);

    Double getFontSize();

    void setFontSize(double points);

    /**
     * @return 6 位十六进制颜色，未设置时返回 null
     */
    String getColor();

    void setColor(String hexColor);

    HighlightColor getHighlight();

    void setHighlight(HighlightColor highlight);

    /**
     * @return {@link com.example.docxstyle.util.style.FormattingFlag} 掩码，无任何格式时为 0
     */
    int getFormattingFlags();

    /**
     * 按掩码整体设置格式，未包含的标志会被关闭
     */
    void setFormattingFlags(int flags);

    String getText();

    @Override
    default <R> R accept(StyledElementVisitor<R> visitor) {
        return visitor.visitRun(this);
    }
}
