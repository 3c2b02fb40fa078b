package com.example.docxstyle.util.docx;

import com.example.docxstyle.util.docx.element.ParagraphElement;
import com.example.docxstyle.util.docx.element.RunElement;
import com.example.docxstyle.util.docx.element.StyledDocument;
import com.example.docxstyle.util.docx.element.TableElement;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于 POI {@link XWPFDocument} 的文档视图
 */
public class XwpfStyledDocument implements StyledDocument {

    private final XWPFDocument document;
    private final XwpfListNumbering listNumbering;

    public XwpfStyledDocument(XWPFDocument document) {
        this.document = document;
        this.listNumbering = new XwpfListNumbering(document);
    }

    public XWPFDocument getDocument() {
        return document;
    }

    @Override
    public List<ParagraphElement> getParagraphs() {
        List<ParagraphElement> paragraphs = new ArrayList<>();
        for (IBodyElement element : document.getBodyElements()) {
            if (element instanceof XWPFParagraph) {
                paragraphs.add(new XwpfParagraphElement((XWPFParagraph) element, listNumbering));
            } else if (element instanceof XWPFTable) {
                paragraphs.addAll(new XwpfTableElement((XWPFTable) element, listNumbering).getCellParagraphs());
            }
        }
        return paragraphs;
    }

    @Override
    public List<RunElement> getRuns() {
        List<RunElement> runs = new ArrayList<>();
        for (ParagraphElement paragraph : getParagraphs()) {
            runs.addAll(paragraph.getRuns());
        }
        return runs;
    }

    @Override
    public List<TableElement> getTables() {
        List<TableElement> tables = new ArrayList<>();
        for (XWPFTable table : document.getTables()) {
            tables.add(new XwpfTableElement(table, listNumbering));
        }
        return tables;
    }
}
