package com.example.docxstyle.util.docx;

import com.example.docxstyle.util.docx.element.ParagraphElement;
import com.example.docxstyle.util.docx.element.RunElement;
import com.example.docxstyle.util.docx.element.StyledElementVisitor;
import com.example.docxstyle.util.docx.element.TableElement;
import com.example.docxstyle.util.style.Alignment;
import com.example.docxstyle.util.style.FormattingFlag;
import com.example.docxstyle.util.style.HighlightColor;
import com.example.docxstyle.util.style.ListType;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class XwpfElementsTest {

    private final XWPFDocument document = new XWPFDocument();

    @AfterEach
    void tearDown() throws Exception {
        document.close();
    }

    @Test
    void paragraphReportsUnsetValuesAsNull() {
        XwpfParagraphElement paragraph = new XwpfParagraphElement(document.createParagraph());

        assertNull(paragraph.getStyleName());
        assertNull(paragraph.getAlignment());
        assertNull(paragraph.getSpaceBefore());
        assertNull(paragraph.getLineSpacing());
        assertNull(paragraph.getLeftIndent());
        assertNull(paragraph.getListType());
    }

    @Test
    void paragraphPropertiesRoundTripInPoints() {
        XwpfParagraphElement paragraph = new XwpfParagraphElement(document.createParagraph());

        paragraph.setStyleName("Quote");
        paragraph.setAlignment(Alignment.JUSTIFY);
        paragraph.setSpaceBefore(12);
        paragraph.setSpaceAfter(6.5);
        paragraph.setLineSpacing(1.5);
        paragraph.setLeftIndent(36);
        paragraph.setFirstLineIndent(18);

        assertEquals("Quote", paragraph.getStyleName());
        assertEquals(Alignment.JUSTIFY, paragraph.getAlignment());
        assertEquals(12.0, paragraph.getSpaceBefore());
        assertEquals(6.5, paragraph.getSpaceAfter());
        assertEquals(1.5, paragraph.getLineSpacing(), 1e-9);
        assertEquals(36.0, paragraph.getLeftIndent());
        assertEquals(18.0, paragraph.getFirstLineIndent());

        paragraph.removeStyleName();
        assertNull(paragraph.getStyleName());
    }

    @Test
    void listStyleCreatesNumbering() {
        XwpfStyledDocument styled = new XwpfStyledDocument(document);
        document.createParagraph();
        document.createParagraph();
        List<ParagraphElement> paragraphs = styled.getParagraphs();

        paragraphs.get(0).setListStyle(ListType.BULLET, 1);
        paragraphs.get(1).setListStyle(ListType.NUMBER, 0);

        assertEquals(ListType.BULLET, paragraphs.get(0).getListType());
        assertEquals(Integer.valueOf(1), paragraphs.get(0).getListLevel());
        assertEquals(ListType.NUMBER, paragraphs.get(1).getListType());

        paragraphs.get(0).setListStyle(ListType.NONE, 0);
        assertNull(paragraphs.get(0).getListType());
    }

    @Test
    void runFormattingFlagsReplaceExistingFormatting() {
        XWPFRun run = document.createParagraph().createRun();
        XwpfRunElement element = new XwpfRunElement(run);

        element.setFormattingFlags(FormattingFlag.combine(FormattingFlag.BOLD, FormattingFlag.ITALIC, FormattingFlag.SUBSCRIPT));
        assertEquals(FormattingFlag.combine(FormattingFlag.BOLD, FormattingFlag.ITALIC, FormattingFlag.SUBSCRIPT),
                element.getFormattingFlags());

        element.setFormattingFlags(FormattingFlag.UNDERLINE.mask());
        assertEquals(FormattingFlag.UNDERLINE.mask(), element.getFormattingFlags());
    }

    @Test
    void runCharacterProperties() {
        XwpfRunElement run = new XwpfRunElement(document.createParagraph().createRun());

        assertNull(run.getFontSize());
        assertNull(run.getColor());
        assertNull(run.getHighlight());

        run.setStyleName("Code");
        run.setFontName("Consolas");
        run.setFontSize(10.5);
        run.setColor("1f2f3f");
        run.setHighlight(HighlightColor.YELLOW);

        assertEquals("Code", run.getStyleName());
        assertEquals("Consolas", run.getFontName());
        assertEquals(10.5, run.getFontSize());
        assertEquals("1F2F3F", run.getColor());
        assertEquals(HighlightColor.YELLOW, run.getHighlight());

        run.removeStyleName();
        assertNull(run.getStyleName());
    }

    @Test
    void tableBordersKeepUnchangedParts() {
        XwpfTableElement table = new XwpfTableElement(document.createTable());

        table.setBorderColor("FF0000");
        table.setBorderWidth(1.5);
        table.setBorderStyle("double");

        assertEquals("double", table.getBorderStyle());
        assertEquals(1.5, table.getBorderWidth());
        assertEquals("FF0000", table.getBorderColor());
    }

    @Test
    void tableBorderStyleUsesWordprocessingNames() {
        XwpfTableElement table = new XwpfTableElement(document.createTable());

        table.setBorderStyle("dotDash");
        assertEquals(XWPFTable.XWPFBorderType.DOT_DASH, table.getTable().getTopBorderType());
        assertEquals("dotDash", table.getBorderStyle());

        table.setBorderStyle("threeDEmboss");
        assertEquals("threeDEmboss", table.getBorderStyle());
    }

    @Test
    void tableLayoutProperties() {
        XwpfTableElement table = new XwpfTableElement(document.createTable());
        assertNull(table.getWidth());
        assertNull(table.getCellMargin());

        table.setWidth(300);
        table.setAlignment("Right");
        table.setCellMargins(4);
        table.setStyleName("Grid");

        assertEquals(300.0, table.getWidth());
        assertEquals("right", table.getAlignment());
        assertEquals(4.0, table.getCellMargin());
        assertEquals("Grid", table.getStyleName());
        assertThrows(IllegalArgumentException.class, () -> table.setAlignment("middle"));

        table.removeStyleName();
        assertNull(table.getStyleName());
    }

    @Test
    void documentListsCellParagraphsInOrder() {
        XWPFParagraph first = document.createParagraph();
        first.createRun().setText("前");
        XWPFTable table = document.createTable(1, 2);
        table.getRow(0).getCell(0).getParagraphs().get(0).createRun().setText("单元格");
        document.createParagraph().createRun().setText("后");

        XwpfStyledDocument styled = new XwpfStyledDocument(document);
        List<ParagraphElement> paragraphs = styled.getParagraphs();

        assertEquals(4, paragraphs.size());
        assertEquals("前", paragraphs.get(0).getText());
        assertEquals("单元格", paragraphs.get(1).getText());
        assertEquals("后", paragraphs.get(3).getText());
        assertEquals(3, styled.getRuns().size());
        assertEquals(1, styled.getTables().size());
    }

    @Test
    void visitorDispatchesToElementKind() {
        StyledElementVisitor<String> kind = new StyledElementVisitor<String>() {
            @Override
            public String visitParagraph(ParagraphElement paragraph) {
                return "paragraph";
            }

            @Override
            public String visitRun(RunElement run) {
                return "run";
            }

            @Override
            public String visitTable(TableElement table) {
                return "table";
            }
        };
        XWPFParagraph paragraph = document.createParagraph();

        assertEquals("paragraph", new XwpfParagraphElement(paragraph).accept(kind));
        assertEquals("run", new XwpfRunElement(paragraph.createRun()).accept(kind));
        assertEquals("table", new XwpfTableElement(document.createTable()).accept(kind));
    }
}
