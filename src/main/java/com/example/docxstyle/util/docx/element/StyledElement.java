package com.example.docxstyle.util.docx.element;

/**
 * 可以挂接命名样式的文档元素
 *
 * <p>具体种类（段落、文本片段、表格）通过 {@link #accept(StyledElementVisitor)} 分派，调用方无需向下转型。</p>
 */
public interface StyledElement {

    <R> R accept(StyledElementVisitor<R> visitor);

    /**
     * @return 当前引用的样式名，没有时返回 null
     */
    String getStyleName();

    void setStyleName(String styleName);

    void removeStyleName();
}
