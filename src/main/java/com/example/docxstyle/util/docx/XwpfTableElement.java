package com.example.docxstyle.util.docx;

import com.example.docxstyle.util.docx.element.ParagraphElement;
import com.example.docxstyle.util.docx.element.TableElement;
import org.apache.poi.xwpf.usermodel.TableRowAlign;
import org.apache.poi.xwpf.usermodel.TableWidthType;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTable.XWPFBorderType;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTblPr;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 基于 POI {@link XWPFTable} 的表格元素
 *
 * 边框作为整体处理：读取以上边框为准，写入时同时更新上下左右及内部边框
 */
public class XwpfTableElement implements TableElement {

    private static final int DEFAULT_BORDER_SIZE = 4;

    private final XWPFTable table;
    private final XwpfListNumbering listNumbering;

    public XwpfTableElement(XWPFTable table) {
        this(table, new XwpfListNumbering(table.getBody().getXWPFDocument()));
    }

    XwpfTableElement(XWPFTable table, XwpfListNumbering listNumbering) {
        this.table = table;
        this.listNumbering = listNumbering;
    }

    public XWPFTable getTable() {
        return table;
    }

    @Override
    public String getStyleName() {
        String style = table.getStyleID();
        return style == null || style.isEmpty() ? null : style;
    }

    @Override
    public void setStyleName(String styleName) {
        table.setStyleID(styleName);
    }

    @Override
    public void removeStyleName() {
        CTTblPr tblPr = table.getCTTbl().getTblPr();
        if (tblPr != null && tblPr.isSetTblStyle()) {
            tblPr.unsetTblStyle();
        }
    }

    @Override
    public Double getWidth() {
        if (table.getWidthType() != TableWidthType.DXA) {
            return null;
        }
        int width = table.getWidth();
        return width <= 0 ? null : width / 20.0;
    }

    @Override
    public void setWidth(double points) {
        table.setWidth((int) Math.round(points * 20));
        table.setWidthType(TableWidthType.DXA);
    }

    @Override
    public String getAlignment() {
        TableRowAlign align = table.getTableAlignment();
        return align == null ? null : align.name().toLowerCase(Locale.ROOT);
    }

    @Override
    public void setAlignment(String alignment) {
        switch (alignment.trim().toLowerCase(Locale.ROOT)) {
            case "left":
                table.setTableAlignment(TableRowAlign.LEFT);
                break;
            case "center":
                table.setTableAlignment(TableRowAlign.CENTER);
                break;
            case "right":
                table.setTableAlignment(TableRowAlign.RIGHT);
                break;
            default:
                throw new IllegalArgumentException("不支持的表格对齐方式: " + alignment);
        }
    }

    /**
     * @return WordprocessingML 线型名，例如 single、dotDash
     */
    @Override
    public String getBorderStyle() {
        XWPFBorderType type = table.getTopBorderType();
        if (type == null) {
            return null;
        }
        StringBuilder name = new StringBuilder();
        boolean upper = false;
        for (char c : type.name().toLowerCase(Locale.ROOT).toCharArray()) {
            if (c == '_') {
                upper = true;
            } else {
                name.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        return name.toString();
    }

    /**
     * @param borderStyle WordprocessingML 线型名，例如 single、dotDash、threeDEmboss
     */
    @Override
    public void setBorderStyle(String borderStyle) {
        StringBuilder name = new StringBuilder();
        String trimmed = borderStyle.trim();
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (Character.isUpperCase(c) && i > 0) {
                name.append('_');
            }
            name.append(c == '-' ? '_' : Character.toUpperCase(c));
        }
        updateBorders(XWPFBorderType.valueOf(name.toString()), null, null);
    }

    @Override
    public Double getBorderWidth() {
        int size = table.getTopBorderSize();
        return size < 0 ? null : size / 8.0;
    }

    @Override
    public void setBorderWidth(double points) {
        updateBorders(null, (int) Math.round(points * 8), null);
    }

    @Override
    public String getBorderColor() {
        String color = table.getTopBorderColor();
        return color == null || "auto".equalsIgnoreCase(color) ? null : color.toUpperCase(Locale.ROOT);
    }

    @Override
    public void setBorderColor(String hexColor) {
        updateBorders(null, null, hexColor);
    }

    @Override
    public Double getCellMargin() {
        CTTblPr tblPr = table.getCTTbl().getTblPr();
        if (tblPr == null || !tblPr.isSetTblCellMar()) {
            return null;
        }
        return table.getCellMarginLeft() / 20.0;
    }

    @Override
    public void setCellMargins(double points) {
        int twips = (int) Math.round(points * 20);
        table.setCellMargins(twips, twips, twips, twips);
    }

    @Override
    public List<ParagraphElement> getCellParagraphs() {
        List<ParagraphElement> paragraphs = new ArrayList<>();
        for (XWPFTableRow row : table.getRows()) {
            for (XWPFTableCell cell : row.getTableCells()) {
                for (XWPFParagraph paragraph : cell.getParagraphs()) {
                    paragraphs.add(new XwpfParagraphElement(paragraph, listNumbering));
                }
            }
        }
        return paragraphs;
    }

    /**
     * 未传入的部分沿用当前上边框的值
     */
    private void updateBorders(XWPFBorderType type, Integer size, String color) {
        XWPFBorderType currentType = table.getTopBorderType();
        int currentSize = table.getTopBorderSize();
        String currentColor = table.getTopBorderColor();

        XWPFBorderType newType = type != null ? type : (currentType != null ? currentType : XWPFBorderType.SINGLE);
        int newSize = size != null ? size : (currentSize >= 0 ? currentSize : DEFAULT_BORDER_SIZE);
        String newColor = color != null ? color : (currentColor != null ? currentColor : "auto");

        table.setTopBorder(newType, newSize, 0, newColor);
        table.setBottomBorder(newType, newSize, 0, newColor);
        table.setLeftBorder(newType, newSize, 0, newColor);
        table.setRightBorder(newType, newSize, 0, newColor);
        table.setInsideHBorder(newType, newSize, 0, newColor);
        table.setInsideVBorder(newType, newSize, 0, newColor);
    }
}
