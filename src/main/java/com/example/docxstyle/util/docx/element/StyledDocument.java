package com.example.docxstyle.util.docx.element;

import java.util.List;

/**
 * 文档：按文档顺序遍历段落、文本片段和表格
 */
public interface StyledDocument {

    /**
     * @return 正文段落以及表格单元格中的段落，按出现顺序
     */
    List<ParagraphElement> getParagraphs();

    /**
     * @return {@link #getParagraphs()} 中所有段落的文本片段
     */
    List<RunElement> getRuns();

    List<TableElement> getTables();
}
