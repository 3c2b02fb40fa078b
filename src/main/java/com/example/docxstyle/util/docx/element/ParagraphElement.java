package com.example.docxstyle.util.docx.element;

import com.example.docxstyle.util.style.Alignment;
import com.example.docxstyle.util.style.ListType;

import java.util.List;

/**
 * 段落元素。长度单位均为磅，getter 在未设置时返回 null
 */
public interface ParagraphElement extends StyledElement {

    Alignment getAlignment();

    void setAlignment(Alignment alignment);

    Double getSpaceBefore();

    void setSpaceBefore(double points);

    Double getSpaceAfter();

    void setSpaceAfter(double points);

    /**
     * @return 行距倍数
     */
    Double getLineSpacing();

    void setLineSpacing(double multiplier);

    Double getLeftIndent();

    void setLeftIndent(double points);

    Double getRightIndent();

    void setRightIndent(double points);

    Double getFirstLineIndent();

    void setFirstLineIndent(double points);

    ListType getListType();

    Integer getListLevel();

    /**
     * 设置列表样式，{@link ListType#NONE} 表示移除列表编号
     */
    void setListStyle(ListType listType, int level);

    List<RunElement> getRuns();

    String getText();

    @Override
    default <R> R accept(StyledElementVisitor<R> visitor) {
        return visitor.visitParagraph(this);
    }
}
