package com.example.docxstyle.util.docx;

import com.example.docxstyle.util.docx.element.RunElement;
import com.example.docxstyle.util.style.FormattingFlag;
import com.example.docxstyle.util.style.HighlightColor;
import org.apache.poi.xwpf.usermodel.UnderlinePatterns;
import org.apache.poi.xwpf.usermodel.VerticalAlign;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.openxmlformats.schemas.officeDocument.x2006.sharedTypes.STVerticalAlignRun;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRPr;

import java.util.Locale;

/**
 * 基于 POI {@link XWPFRun} 的文本片段
 */
public class XwpfRunElement implements RunElement {

    private final XWPFRun run;

    public XwpfRunElement(XWPFRun run) {
        this.run = run;
    }

    public XWPFRun getRun() {
        return run;
    }

    @Override
    public String getStyleName() {
        String style = run.getStyle();
        return style == null || style.isEmpty() ? null : style;
    }

    @Override
    public void setStyleName(String styleName) {
        run.setStyle(styleName);
    }

    @Override
    public void removeStyleName() {
        CTRPr rpr = run.getCTR().getRPr();
        if (rpr == null) {
            return;
        }
        while (rpr.sizeOfRStyleArray() > 0) {
            rpr.removeRStyle(0);
        }
    }

    @Override
    public String getFontName() {
        return run.getFontFamily();
    }

    @Override
    public void setFontName(String fontName) {
        run.setFontFamily(fontName);
    }

    @Override
    public Double getFontSize() {
        return run.getFontSizeAsDouble();
    }

    @Override
    public void setFontSize(double points) {
        run.setFontSize(points);
    }

    @Override
    public String getColor() {
        String color = run.getColor();
        return color == null || "auto".equalsIgnoreCase(color) ? null : color.toUpperCase(Locale.ROOT);
    }

    @Override
    public void setColor(String hexColor) {
        run.setColor(hexColor);
    }

    @Override
    public HighlightColor getHighlight() {
        if (!run.isHighlighted()) {
            return null;
        }
        return HighlightColor.fromText(run.getTextHightlightColor().toString());
    }

    @Override
    public void setHighlight(HighlightColor highlight) {
        run.setTextHighlightColor(highlight.getOoxmlValue());
    }

    @Override
    public int getFormattingFlags() {
        int flags = 0;
        if (run.isBold()) flags |= FormattingFlag.BOLD.mask();
        if (run.isItalic()) flags |= FormattingFlag.ITALIC.mask();
        if (run.getUnderline() != UnderlinePatterns.NONE) flags |= FormattingFlag.UNDERLINE.mask();
        if (run.isStrikeThrough()) flags |= FormattingFlag.STRIKETHROUGH.mask();
        if (run.isSmallCaps()) flags |= FormattingFlag.SMALLCAPS.mask();
        if (run.isShadowed()) flags |= FormattingFlag.SHADOW.mask();

        CTRPr rpr = run.getCTR().getRPr();
        if (rpr != null && rpr.sizeOfVertAlignArray() > 0) {
            STVerticalAlignRun.Enum vertAlign = rpr.getVertAlignArray(0).getVal();
            if (vertAlign == STVerticalAlignRun.SUBSCRIPT) {
                flags |= FormattingFlag.SUBSCRIPT.mask();
            } else if (vertAlign == STVerticalAlignRun.SUPERSCRIPT) {
                flags |= FormattingFlag.SUPERSCRIPT.mask();
            }
        }
        return flags;
    }

    @Override
    public void setFormattingFlags(int flags) {
        run.setBold(FormattingFlag.BOLD.isSetIn(flags));
        run.setItalic(FormattingFlag.ITALIC.isSetIn(flags));
        run.setUnderline(FormattingFlag.UNDERLINE.isSetIn(flags) ? UnderlinePatterns.SINGLE : UnderlinePatterns.NONE);
        run.setStrikeThrough(FormattingFlag.STRIKETHROUGH.isSetIn(flags));
        run.setSmallCaps(FormattingFlag.SMALLCAPS.isSetIn(flags));
        run.setShadow(FormattingFlag.SHADOW.isSetIn(flags));
        if (FormattingFlag.SUBSCRIPT.isSetIn(flags)) {
            run.setSubscript(VerticalAlign.SUBSCRIPT);
        } else if (FormattingFlag.SUPERSCRIPT.isSetIn(flags)) {
            run.setSubscript(VerticalAlign.SUPERSCRIPT);
        } else {
            run.setSubscript(VerticalAlign.BASELINE);
        }
    }

    @Override
    public String getText() {
        return run.text();
    }
}
