package com.example.docxstyle.util.docx.element;

/**
 * 按元素种类分派
 *
 * @param <R> 访问结果类型
 */
public interface StyledElementVisitor<R> {

    R visitParagraph(ParagraphElement paragraph);

    R visitRun(RunElement run);

    R visitTable(TableElement table);
}
