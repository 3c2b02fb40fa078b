package com.example.docxstyle.util.docx;

import com.example.docxstyle.util.style.Alignment;
import com.example.docxstyle.util.style.CharacterStyleProperties;
import com.example.docxstyle.util.style.FormattingFlag;
import com.example.docxstyle.util.style.ParagraphStyleProperties;
import com.example.docxstyle.util.style.Style;
import com.example.docxstyle.util.style.StyleManager;
import com.example.docxstyle.util.style.StyleType;
import com.example.docxstyle.util.style.TableStyleProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.apache.xmlbeans.XmlBeans;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTBorder;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTFonts;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTHpsMeasure;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTInd;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPPrGeneral;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTSpacing;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTStyle;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTblBorders;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTblCellMar;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTblPrBase;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTblWidth;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STBorder;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STHighlightColor;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STJc;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STJcTable;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STLineSpacingRule;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STStyleType;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STTblWidth;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STUnderline;

import java.math.BigInteger;

/**
 * 把 StyleManager 中的样式写入 DOCX 的样式部件（styles.xml）
 *
 * 文档中已存在的同名样式保持不变
 */
@Slf4j
public class StyleSheetWriter {

    private StyleSheetWriter() {
    }

    /**
     * @return 新写入的样式个数
     */
    public static int writeStyles(XWPFDocument document, StyleManager manager) {
        XWPFStyles styles = document.createStyles();
        int written = 0;
        int skipped = 0;

        for (Style style : manager.getAllStyles()) {
            if (styles.styleExist(style.getName())) {
                skipped++;
                log.debug("文档中已存在样式，跳过: {}", style.getName());
                continue;
            }
            styles.addStyle(buildStyle(style));
            written++;
        }

        log.info("写入样式表: 新增 {} 个, 跳过已存在 {} 个", written, skipped);
        return written;
    }

    static XWPFStyle buildStyle(Style style) {
        CTStyle ctStyle = (CTStyle) XmlBeans.getContextTypeLoader().newInstance(CTStyle.type, null);
        ctStyle.setStyleId(style.getName());
        ctStyle.setType(styleType(style.getType()));
        ctStyle.addNewName().setVal(style.getName());
        if (style.hasBaseStyle()) {
            ctStyle.addNewBasedOn().setVal(style.getBaseStyle());
        }

        StyleType type = style.getType();
        if (type == StyleType.PARAGRAPH || type == StyleType.MIXED) {
            writeParagraph(ctStyle, style.getParagraphProperties());
        }
        if (type == StyleType.CHARACTER || type == StyleType.MIXED) {
            writeCharacter(ctStyle, style.getCharacterProperties());
        }
        if (type == StyleType.TABLE) {
            writeTable(ctStyle, style.getTableProperties());
        }
        ctStyle.addNewQFormat();
        return new XWPFStyle(ctStyle);
    }

    private static STStyleType.Enum styleType(StyleType type) {
        switch (type) {
            case CHARACTER:
                return STStyleType.CHARACTER;
            case TABLE:
                return STStyleType.TABLE;
            case NUMBERING:
                return STStyleType.NUMBERING;
            default:
                return STStyleType.PARAGRAPH;
        }
    }

    private static void writeParagraph(CTStyle ctStyle, ParagraphStyleProperties props) {
        if (props.isEmpty()) {
            return;
        }
        CTPPrGeneral ppr = ctStyle.isSetPPr() ? ctStyle.getPPr() : ctStyle.addNewPPr();

        if (props.getAlignment() != null) {
            ppr.addNewJc().setVal(STJc.Enum.forInt(paragraphAlignment(props.getAlignment()).getValue()));
        }
        if (props.getSpaceBeforePts() != null || props.getSpaceAfterPts() != null || props.getLineSpacing() != null) {
            CTSpacing spacing = ppr.addNewSpacing();
            if (props.getSpaceBeforePts() != null) {
                spacing.setBefore(twips(props.getSpaceBeforePts()));
            }
            if (props.getSpaceAfterPts() != null) {
                spacing.setAfter(twips(props.getSpaceAfterPts()));
            }
            if (props.getLineSpacing() != null) {
                spacing.setLine(BigInteger.valueOf(Math.round(props.getLineSpacing() * 240)));
                spacing.setLineRule(STLineSpacingRule.AUTO);
            }
        }
        if (props.getLeftIndentPts() != null || props.getRightIndentPts() != null || props.getFirstLineIndentPts() != null) {
            CTInd ind = ppr.addNewInd();
            if (props.getLeftIndentPts() != null) {
                ind.setLeft(twips(props.getLeftIndentPts()));
            }
            if (props.getRightIndentPts() != null) {
                ind.setRight(twips(props.getRightIndentPts()));
            }
            if (props.getFirstLineIndentPts() != null) {
                ind.setFirstLine(twips(props.getFirstLineIndentPts()));
            }
        }
    }

    private static ParagraphAlignment paragraphAlignment(Alignment alignment) {
        switch (alignment) {
            case CENTER:
                return ParagraphAlignment.CENTER;
            case RIGHT:
                return ParagraphAlignment.RIGHT;
            case JUSTIFY:
                return ParagraphAlignment.BOTH;
            default:
                return ParagraphAlignment.LEFT;
        }
    }

    private static void writeCharacter(CTStyle ctStyle, CharacterStyleProperties props) {
        if (props.isEmpty()) {
            return;
        }
        CTRPr rpr = ctStyle.isSetRPr() ? ctStyle.getRPr() : ctStyle.addNewRPr();

        if (props.getFontName() != null) {
            CTFonts fonts = rpr.addNewRFonts();
            fonts.setAscii(props.getFontName());
            fonts.setHAnsi(props.getFontName());
        }
        if (props.hasFlag(FormattingFlag.BOLD)) {
            rpr.addNewB();
            rpr.addNewBCs();
        }
        if (props.hasFlag(FormattingFlag.ITALIC)) {
            rpr.addNewI();
            rpr.addNewICs();
        }
        if (props.hasFlag(FormattingFlag.STRIKETHROUGH)) {
            rpr.addNewStrike();
        }
        if (props.getFontColorHex() != null) {
            rpr.addNewColor().setVal(props.getFontColorHex());
        }
        if (props.getHighlightColor() != null) {
            rpr.addNewHighlight().setVal(STHighlightColor.Enum.forString(props.getHighlightColor().getOoxmlValue()));
        }
        if (props.getFontSizePts() != null) {
            BigInteger halfPts = BigInteger.valueOf(Math.round(props.getFontSizePts() * 2));
            CTHpsMeasure sz = rpr.addNewSz();
            sz.setVal(halfPts);
            CTHpsMeasure szCs = rpr.addNewSzCs();
            szCs.setVal(halfPts);
        }
        if (props.hasFlag(FormattingFlag.UNDERLINE)) {
            rpr.addNewU().setVal(STUnderline.SINGLE);
        }
    }

    private static void writeTable(CTStyle ctStyle, TableStyleProperties props) {
        if (props.isEmpty()) {
            return;
        }
        CTTblPrBase tblPr = ctStyle.isSetTblPr() ? ctStyle.getTblPr() : ctStyle.addNewTblPr();

        if (props.getTableWidthPts() != null) {
            CTTblWidth width = tblPr.addNewTblW();
            width.setW(twips(props.getTableWidthPts()));
            width.setType(STTblWidth.DXA);
        }
        if (props.getTableAlignment() != null) {
            tblPr.addNewJc().setVal(STJcTable.Enum.forString(props.getTableAlignment()));
        }
        if (props.getBorderStyle() != null || props.getBorderWidthPts() != null || props.getBorderColorHex() != null) {
            STBorder.Enum borderType = props.getBorderStyle() != null ? STBorder.Enum.forString(props.getBorderStyle()) : null;
            if (borderType == null) {
                borderType = STBorder.SINGLE;
            }
            BigInteger size = BigInteger.valueOf(props.getBorderWidthPts() != null ? Math.round(props.getBorderWidthPts() * 8) : 4);
            String color = props.getBorderColorHex() != null ? props.getBorderColorHex() : "auto";

            CTTblBorders borders = tblPr.addNewTblBorders();
            CTBorder[] sides = {
                    borders.addNewTop(), borders.addNewLeft(), borders.addNewBottom(),
                    borders.addNewRight(), borders.addNewInsideH(), borders.addNewInsideV()
            };
            for (CTBorder side : sides) {
                side.setVal(borderType);
                side.setSz(size);
                side.setSpace(BigInteger.ZERO);
                side.setColor(color);
            }
        }
        if (props.getCellPaddingPts() != null) {
            BigInteger padding = twips(props.getCellPaddingPts());
            CTTblCellMar margins = tblPr.addNewTblCellMar();
            CTTblWidth[] sides = {margins.addNewTop(), margins.addNewLeft(), margins.addNewBottom(), margins.addNewRight()};
            for (CTTblWidth side : sides) {
                side.setW(padding);
                side.setType(STTblWidth.DXA);
            }
        }
    }

    private static BigInteger twips(double points) {
        return BigInteger.valueOf(Math.round(points * 20));
    }
}
