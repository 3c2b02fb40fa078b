package com.example.docxstyle.util.docx;

import com.example.docxstyle.util.docx.element.ParagraphElement;
import com.example.docxstyle.util.docx.element.RunElement;
import com.example.docxstyle.util.style.Alignment;
import com.example.docxstyle.util.style.ListType;
import org.apache.poi.xwpf.usermodel.LineSpacingRule;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTNumPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPPr;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * 基于 POI {@link XWPFParagraph} 的段落元素
 *
 * 磅与 twips 换算：1pt = 20 twips；POI 在间距/缩进未设置时返回 -1
 */
public class XwpfParagraphElement implements ParagraphElement {

    private final XWPFParagraph paragraph;
    private final XwpfListNumbering listNumbering;

    public XwpfParagraphElement(XWPFParagraph paragraph) {
        this(paragraph, new XwpfListNumbering(paragraph.getDocument()));
    }

    XwpfParagraphElement(XWPFParagraph paragraph, XwpfListNumbering listNumbering) {
        this.paragraph = paragraph;
        this.listNumbering = listNumbering;
    }

    public XWPFParagraph getParagraph() {
        return paragraph;
    }

    @Override
    public String getStyleName() {
        String style = paragraph.getStyle();
        return style == null || style.isEmpty() ? null : style;
    }

    @Override
    public void setStyleName(String styleName) {
        paragraph.setStyle(styleName);
    }

    @Override
    public void removeStyleName() {
        CTPPr ppr = paragraph.getCTP().getPPr();
        if (ppr != null && ppr.isSetPStyle()) {
            ppr.unsetPStyle();
        }
    }

    @Override
    public Alignment getAlignment() {
        CTPPr ppr = paragraph.getCTP().getPPr();
        if (ppr == null || !ppr.isSetJc()) {
            return null;
        }
        String value = paragraph.getAlignment().name();
        switch (value) {
            case "CENTER":
                return Alignment.CENTER;
            case "RIGHT":
            case "END":
                return Alignment.RIGHT;
            case "BOTH":
            case "DISTRIBUTE":
                return Alignment.JUSTIFY;
            default:
                return Alignment.LEFT;
        }
    }

    @Override
    public void setAlignment(Alignment alignment) {
        switch (alignment) {
            case CENTER:
                paragraph.setAlignment(ParagraphAlignment.CENTER);
                break;
            case RIGHT:
                paragraph.setAlignment(ParagraphAlignment.RIGHT);
                break;
            case JUSTIFY:
                paragraph.setAlignment(ParagraphAlignment.BOTH);
                break;
            default:
                paragraph.setAlignment(ParagraphAlignment.LEFT);
        }
    }

    @Override
    public Double getSpaceBefore() {
        return fromTwips(paragraph.getSpacingBefore());
    }

    @Override
    public void setSpaceBefore(double points) {
        paragraph.setSpacingBefore(toTwips(points));
    }

    @Override
    public Double getSpaceAfter() {
        return fromTwips(paragraph.getSpacingAfter());
    }

    @Override
    public void setSpaceAfter(double points) {
        paragraph.setSpacingAfter(toTwips(points));
    }

    @Override
    public Double getLineSpacing() {
        double spacing = paragraph.getSpacingBetween();
        return spacing < 0 ? null : spacing;
    }

    @Override
    public void setLineSpacing(double multiplier) {
        paragraph.setSpacingBetween(multiplier, LineSpacingRule.AUTO);
    }

    @Override
    public Double getLeftIndent() {
        return fromTwips(paragraph.getIndentationLeft());
    }

    @Override
    public void setLeftIndent(double points) {
        paragraph.setIndentationLeft(toTwips(points));
    }

    @Override
    public Double getRightIndent() {
        return fromTwips(paragraph.getIndentationRight());
    }

    @Override
    public void setRightIndent(double points) {
        paragraph.setIndentationRight(toTwips(points));
    }

    @Override
    public Double getFirstLineIndent() {
        return fromTwips(paragraph.getIndentationFirstLine());
    }

    @Override
    public void setFirstLineIndent(double points) {
        paragraph.setIndentationFirstLine(toTwips(points));
    }

    @Override
    public ListType getListType() {
        if (paragraph.getNumID() == null) {
            return null;
        }
        String numFmt = paragraph.getNumFmt();
        if (numFmt == null) {
            return null;
        }
        return "bullet".equals(numFmt) ? ListType.BULLET : ListType.NUMBER;
    }

    @Override
    public Integer getListLevel() {
        BigInteger level = paragraph.getNumIlvl();
        return level == null ? null : level.intValue();
    }

    @Override
    public void setListStyle(ListType listType, int level) {
        CTPPr ppr = paragraph.getCTP().isSetPPr() ? paragraph.getCTP().getPPr() : paragraph.getCTP().addNewPPr();
        if (listType == ListType.NONE) {
            if (ppr.isSetNumPr()) {
                ppr.unsetNumPr();
            }
            return;
        }
        BigInteger numId = listNumbering.numIdFor(listType);
        CTNumPr numPr = ppr.isSetNumPr() ? ppr.getNumPr() : ppr.addNewNumPr();
        (numPr.isSetNumId() ? numPr.getNumId() : numPr.addNewNumId()).setVal(numId);
        (numPr.isSetIlvl() ? numPr.getIlvl() : numPr.addNewIlvl()).setVal(BigInteger.valueOf(level));
    }

    @Override
    public List<RunElement> getRuns() {
        List<RunElement> runs = new ArrayList<>();
        for (XWPFRun run : paragraph.getRuns()) {
            runs.add(new XwpfRunElement(run));
        }
        return runs;
    }

    @Override
    public String getText() {
        return paragraph.getText();
    }

    private static int toTwips(double points) {
        return (int) Math.round(points * 20);
    }

    private static Double fromTwips(int twips) {
        return twips < 0 ? null : twips / 20.0;
    }
}
