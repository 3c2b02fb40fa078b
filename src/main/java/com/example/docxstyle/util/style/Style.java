package com.example.docxstyle.util.style;

import com.example.docxstyle.util.style.error.ErrorCode;
import com.example.docxstyle.util.style.error.ErrorContext;
import com.example.docxstyle.util.style.error.Result;
import com.example.docxstyle.util.style.error.StyleError;

import java.util.Locale;

/**
 * 命名样式
 *
 * <p>样式类型决定可以持有哪些属性：PARAGRAPH 只有段落属性，CHARACTER 只有字符属性，
 * TABLE 只有表格属性，MIXED 同时持有段落和字符属性。所有 setter 先校验再赋值，
 * 校验失败时返回失败结果且不修改任何已有属性。</p>
 *
 * <p>属性 getter 返回副本，修改副本不会影响样式本身；内置标记只能由 {@link StyleManager} 设置。</p>
 */
public class Style {

    public static final int MAX_NAME_LENGTH = 255;
    static final double MAX_FONT_SIZE = 1000.0;

    private final String name;
    private final StyleType type;
    private boolean builtIn;
    private String baseStyle;

    private ParagraphStyleProperties paragraphProperties = new ParagraphStyleProperties();
    private CharacterStyleProperties characterProperties = new CharacterStyleProperties();
    private TableStyleProperties tableProperties = new TableStyleProperties();

    public Style(String name, StyleType type) {
        if (type == null) {
            throw new IllegalArgumentException("样式类型不能为空");
        }
        this.name = name == null ? "" : name;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public StyleType getType() {
        return type;
    }

    public boolean isBuiltIn() {
        return builtIn;
    }

    void markBuiltIn() {
        this.builtIn = true;
    }

    /**
     * @return 基础样式名，没有基础样式时返回 null
     */
    public String getBaseStyle() {
        return baseStyle;
    }

    public boolean hasBaseStyle() {
        return baseStyle != null;
    }

    public ParagraphStyleProperties getParagraphProperties() {
        return new ParagraphStyleProperties(paragraphProperties);
    }

    public CharacterStyleProperties getCharacterProperties() {
        return new CharacterStyleProperties(characterProperties);
    }

    public TableStyleProperties getTableProperties() {
        return new TableStyleProperties(tableProperties);
    }

    // ==================== 属性设置 ====================

    public Result<Void> setParagraphProperties(ParagraphStyleProperties props) {
        String op = "set_paragraph_properties";
        if (props == null) {
            return fail(ErrorCode.INVALID_ARGUMENT, "段落属性不能为空", op);
        }
        if (!type.allowsParagraphProperties()) {
            return incompatible("段落", op);
        }
        Result<Void> check = checkParagraph(props, op);
        if (check.isFailed()) {
            return check;
        }
        this.paragraphProperties = new ParagraphStyleProperties(props);
        return Result.ok();
    }

    public Result<Void> setCharacterProperties(CharacterStyleProperties props) {
        String op = "set_character_properties";
        if (props == null) {
            return fail(ErrorCode.INVALID_ARGUMENT, "字符属性不能为空", op);
        }
        if (!type.allowsCharacterProperties()) {
            return incompatible("字符", op);
        }
        Result<Void> check = checkCharacter(props, op);
        if (check.isFailed()) {
            return check;
        }
        CharacterStyleProperties copy = new CharacterStyleProperties(props);
        if (copy.getFontColorHex() != null) {
            copy.setFontColorHex(StyleUnits.normalizeHexColor(copy.getFontColorHex()));
        }
        this.characterProperties = copy;
        return Result.ok();
    }

    public Result<Void> setTableProperties(TableStyleProperties props) {
        String op = "set_table_properties";
        if (props == null) {
            return fail(ErrorCode.INVALID_ARGUMENT, "表格属性不能为空", op);
        }
        if (!type.allowsTableProperties()) {
            return incompatible("表格", op);
        }
        Result<Void> check = checkTable(props, op);
        if (check.isFailed()) {
            return check;
        }
        TableStyleProperties copy = new TableStyleProperties(props);
        if (copy.getBorderColorHex() != null) {
            copy.setBorderColorHex(StyleUnits.normalizeHexColor(copy.getBorderColorHex()));
        }
        if (copy.getTableAlignment() != null) {
            copy.setTableAlignment(copy.getTableAlignment().trim().toLowerCase(Locale.ROOT));
        }
        this.tableProperties = copy;
        return Result.ok();
    }

    public Result<Void> setBaseStyle(String baseStyleName) {
        String op = "set_base_style";
        if (baseStyleName == null || baseStyleName.isEmpty()) {
            return fail(ErrorCode.INVALID_ARGUMENT, "基础样式名不能为空", op);
        }
        if (baseStyleName.equals(name)) {
            return Result.fail(new StyleError(ErrorCode.STYLE_INHERITANCE_CYCLE,
                    "样式不能继承自身: " + name, context(op).with("base", baseStyleName)));
        }
        this.baseStyle = baseStyleName;
        return Result.ok();
    }

    public void clearBaseStyle() {
        this.baseStyle = null;
    }

    /**
     * 设置字体名称和字号
     */
    public Result<Void> setFont(String fontName, double sizePts) {
        String op = "set_font";
        if (!type.allowsCharacterProperties()) {
            return incompatible("字符", op);
        }
        if (fontName == null || fontName.trim().isEmpty()) {
            return fail(ErrorCode.INVALID_ARGUMENT, "字体名称不能为空", op);
        }
        if (!validFontSize(sizePts)) {
            return fail(ErrorCode.INVALID_FONT_SIZE, "字号超出范围 (0, 1000]: " + sizePts, op);
        }
        characterProperties.setFontName(fontName);
        characterProperties.setFontSizePts(sizePts);
        return Result.ok();
    }

    public Result<Void> setColor(String hexColor) {
        String op = "set_color";
        if (!type.allowsCharacterProperties()) {
            return incompatible("字符", op);
        }
        String normalized = StyleUnits.normalizeHexColor(hexColor);
        if (normalized == null) {
            return fail(ErrorCode.INVALID_COLOR_FORMAT, "颜色必须是6位十六进制: " + hexColor, op);
        }
        characterProperties.setFontColorHex(normalized);
        return Result.ok();
    }

    public Result<Void> setAlignment(Alignment alignment) {
        String op = "set_alignment";
        if (!type.allowsParagraphProperties()) {
            return incompatible("段落", op);
        }
        if (alignment == null) {
            return fail(ErrorCode.INVALID_ALIGNMENT, "对齐方式不能为空", op);
        }
        paragraphProperties.setAlignment(alignment);
        return Result.ok();
    }

    /**
     * 设置段前、段后间距（磅）
     */
    public Result<Void> setSpacing(double beforePts, double afterPts) {
        String op = "set_spacing";
        if (!type.allowsParagraphProperties()) {
            return incompatible("段落", op);
        }
        if (beforePts < 0 || afterPts < 0) {
            return fail(ErrorCode.INVALID_SPACING, "间距不能为负: " + beforePts + "/" + afterPts, op);
        }
        paragraphProperties.setSpaceBeforePts(beforePts);
        paragraphProperties.setSpaceAfterPts(afterPts);
        return Result.ok();
    }

    // ==================== 校验 ====================

    /**
     * 校验名称和当前持有的全部属性
     */
    public Result<Void> validate() {
        String op = "validate_style";
        if (name.isEmpty()) {
            return fail(ErrorCode.VALIDATION_FAILED, "样式名不能为空", op);
        }
        if (name.length() > MAX_NAME_LENGTH) {
            return fail(ErrorCode.VALIDATION_FAILED, "样式名超过" + MAX_NAME_LENGTH + "个字符", op);
        }
        Result<Void> result = checkParagraph(paragraphProperties, op);
        if (result.isFailed()) {
            return result;
        }
        result = checkCharacter(characterProperties, op);
        if (result.isFailed()) {
            return result;
        }
        return checkTable(tableProperties, op);
    }

    private Result<Void> checkParagraph(ParagraphStyleProperties props, String op) {
        if (negative(props.getSpaceBeforePts()) || negative(props.getSpaceAfterPts())) {
            return fail(ErrorCode.INVALID_SPACING, "段前/段后间距不能为负", op);
        }
        if (props.getLineSpacing() != null && props.getLineSpacing() <= 0) {
            return fail(ErrorCode.INVALID_SPACING, "行距必须大于0: " + props.getLineSpacing(), op);
        }
        if (props.getListLevel() != null && (props.getListLevel() < 0 || props.getListLevel() > 8)) {
            return fail(ErrorCode.VALIDATION_FAILED, "列表级别必须在0-8之间: " + props.getListLevel(), op);
        }
        return Result.ok();
    }

    private Result<Void> checkCharacter(CharacterStyleProperties props, String op) {
        if (props.getFontSizePts() != null && !validFontSize(props.getFontSizePts())) {
            return fail(ErrorCode.INVALID_FONT_SIZE, "字号超出范围 (0, 1000]: " + props.getFontSizePts(), op);
        }
        if (props.getFontName() != null && props.getFontName().trim().isEmpty()) {
            return fail(ErrorCode.INVALID_ARGUMENT, "字体名称不能为空", op);
        }
        if (props.getFontColorHex() != null && StyleUnits.normalizeHexColor(props.getFontColorHex()) == null) {
            return fail(ErrorCode.INVALID_COLOR_FORMAT, "颜色必须是6位十六进制: " + props.getFontColorHex(), op);
        }
        return Result.ok();
    }

    private Result<Void> checkTable(TableStyleProperties props, String op) {
        if (negative(props.getBorderWidthPts())) {
            return fail(ErrorCode.INVALID_BORDER, "边框宽度不能为负", op);
        }
        if (props.getBorderStyle() != null && props.getBorderStyle().trim().isEmpty()) {
            return fail(ErrorCode.INVALID_BORDER, "边框样式不能为空", op);
        }
        if (props.getBorderStyle() != null && !TableStyleProperties.BORDER_STYLES.contains(props.getBorderStyle())) {
            return fail(ErrorCode.INVALID_BORDER, "不支持的边框样式: " + props.getBorderStyle(), op);
        }
        if (props.getBorderColorHex() != null && StyleUnits.normalizeHexColor(props.getBorderColorHex()) == null) {
            return fail(ErrorCode.INVALID_COLOR_FORMAT, "边框颜色必须是6位十六进制: " + props.getBorderColorHex(), op);
        }
        if (negative(props.getCellPaddingPts())) {
            return fail(ErrorCode.INVALID_MARGIN, "单元格边距不能为负", op);
        }
        if (props.getTableWidthPts() != null && props.getTableWidthPts() <= 0) {
            return fail(ErrorCode.INVALID_WIDTH, "表格宽度必须大于0", op);
        }
        if (props.getTableAlignment() != null) {
            String alignment = props.getTableAlignment().trim().toLowerCase(Locale.ROOT);
            if (!"left".equals(alignment) && !"center".equals(alignment) && !"right".equals(alignment)) {
                return fail(ErrorCode.INVALID_ALIGNMENT, "表格对齐必须是 left/center/right: " + props.getTableAlignment(), op);
            }
        }
        return Result.ok();
    }

    private static boolean validFontSize(double size) {
        return size > 0 && size <= MAX_FONT_SIZE;
    }

    private static boolean negative(Double value) {
        return value != null && value < 0;
    }

    private ErrorContext context(String op) {
        return ErrorContext.forOperation(op).with("style", name);
    }

    private Result<Void> fail(ErrorCode code, String message, String op) {
        return Result.fail(new StyleError(code, message, context(op)));
    }

    private Result<Void> incompatible(String bag, String op) {
        return Result.fail(new StyleError(ErrorCode.STYLE_PROPERTY_INVALID,
                type + " 类型的样式不能持有" + bag + "属性", context(op).with("type", type)));
    }

    // ==================== 序列化 ====================

    /**
     * 生成 WordprocessingML 的 w:style 片段
     */
    public String toMarkup() {
        StringBuilder xml = new StringBuilder();
        xml.append("<w:style w:type=\"").append(type.ooxmlType())
                .append("\" w:styleId=\"").append(escape(name)).append("\">\n");
        xml.append("  <w:name w:val=\"").append(escape(name)).append("\"/>\n");
        if (baseStyle != null) {
            xml.append("  <w:basedOn w:val=\"").append(escape(baseStyle)).append("\"/>\n");
        }

        if (type.allowsParagraphProperties()) {
            appendParagraphMarkup(xml);
        }
        if (type.allowsCharacterProperties()) {
            appendCharacterMarkup(xml);
        }
        if (type.allowsTableProperties()) {
            appendTableMarkup(xml);
        }

        xml.append("</w:style>\n");
        return xml.toString();
    }

    private void appendParagraphMarkup(StringBuilder xml) {
        ParagraphStyleProperties p = paragraphProperties;
        if (p.isEmpty()) {
            return;
        }
        xml.append("  <w:pPr>\n");
        if (p.getAlignment() != null) {
            xml.append("    <w:jc w:val=\"").append(p.getAlignment().getOoxmlValue()).append("\"/>\n");
        }
        if (p.getSpaceBeforePts() != null || p.getSpaceAfterPts() != null || p.getLineSpacing() != null) {
            xml.append("    <w:spacing");
            if (p.getSpaceBeforePts() != null) {
                xml.append(" w:before=\"").append(twips(p.getSpaceBeforePts())).append('"');
            }
            if (p.getSpaceAfterPts() != null) {
                xml.append(" w:after=\"").append(twips(p.getSpaceAfterPts())).append('"');
            }
            if (p.getLineSpacing() != null) {
                xml.append(" w:line=\"").append(Math.round(p.getLineSpacing() * 240)).append("\" w:lineRule=\"auto\"");
            }
            xml.append("/>\n");
        }
        if (p.getLeftIndentPts() != null || p.getRightIndentPts() != null || p.getFirstLineIndentPts() != null) {
            xml.append("    <w:ind");
            if (p.getLeftIndentPts() != null) {
                xml.append(" w:left=\"").append(twips(p.getLeftIndentPts())).append('"');
            }
            if (p.getRightIndentPts() != null) {
                xml.append(" w:right=\"").append(twips(p.getRightIndentPts())).append('"');
            }
            if (p.getFirstLineIndentPts() != null) {
                xml.append(" w:firstLine=\"").append(twips(p.getFirstLineIndentPts())).append('"');
            }
            xml.append("/>\n");
        }
        xml.append("  </w:pPr>\n");
    }

    private void appendCharacterMarkup(StringBuilder xml) {
        CharacterStyleProperties c = characterProperties;
        if (c.isEmpty()) {
            return;
        }
        xml.append("  <w:rPr>\n");
        if (c.getFontName() != null) {
            xml.append("    <w:rFonts w:ascii=\"").append(escape(c.getFontName()))
                    .append("\" w:hAnsi=\"").append(escape(c.getFontName())).append("\"/>\n");
        }
        if (c.hasFlag(FormattingFlag.BOLD)) {
            xml.append("    <w:b/>\n    <w:bCs/>\n");
        }
        if (c.hasFlag(FormattingFlag.ITALIC)) {
            xml.append("    <w:i/>\n    <w:iCs/>\n");
        }
        if (c.hasFlag(FormattingFlag.STRIKETHROUGH)) {
            xml.append("    <w:strike/>\n");
        }
        if (c.getFontColorHex() != null) {
            xml.append("    <w:color w:val=\"").append(c.getFontColorHex()).append("\"/>\n");
        }
        if (c.getFontSizePts() != null) {
            long halfPoints = Math.round(c.getFontSizePts() * 2);
            xml.append("    <w:sz w:val=\"").append(halfPoints).append("\"/>\n");
            xml.append("    <w:szCs w:val=\"").append(halfPoints).append("\"/>\n");
        }
        if (c.getHighlightColor() != null) {
            xml.append("    <w:highlight w:val=\"").append(c.getHighlightColor().getOoxmlValue()).append("\"/>\n");
        }
        if (c.hasFlag(FormattingFlag.UNDERLINE)) {
            xml.append("    <w:u w:val=\"single\"/>\n");
        }
        xml.append("  </w:rPr>\n");
    }

    private void appendTableMarkup(StringBuilder xml) {
        TableStyleProperties t = tableProperties;
        if (t.isEmpty()) {
            return;
        }
        xml.append("  <w:tblPr>\n");
        if (t.getTableWidthPts() != null) {
            xml.append("    <w:tblW w:w=\"").append(twips(t.getTableWidthPts())).append("\" w:type=\"dxa\"/>\n");
        }
        if (t.getTableAlignment() != null) {
            xml.append("    <w:jc w:val=\"").append(t.getTableAlignment()).append("\"/>\n");
        }
        if (t.getBorderStyle() != null || t.getBorderWidthPts() != null || t.getBorderColorHex() != null) {
            String style = t.getBorderStyle() != null ? t.getBorderStyle() : "single";
            long size = t.getBorderWidthPts() != null ? Math.round(t.getBorderWidthPts() * 8) : 4;
            String color = t.getBorderColorHex() != null ? t.getBorderColorHex() : "auto";
            xml.append("    <w:tblBorders>\n");
            for (String side : new String[]{"top", "left", "bottom", "right", "insideH", "insideV"}) {
                xml.append("      <w:").append(side).append(" w:val=\"").append(escape(style))
                        .append("\" w:sz=\"").append(size).append("\" w:space=\"0\" w:color=\"")
                        .append(color).append("\"/>\n");
            }
            xml.append("    </w:tblBorders>\n");
        }
        if (t.getCellPaddingPts() != null) {
            long padding = twips(t.getCellPaddingPts());
            xml.append("    <w:tblCellMar>\n");
            for (String side : new String[]{"top", "left", "bottom", "right"}) {
                xml.append("      <w:").append(side).append(" w:w=\"").append(padding).append("\" w:type=\"dxa\"/>\n");
            }
            xml.append("    </w:tblCellMar>\n");
        }
        xml.append("  </w:tblPr>\n");
    }

    static long twips(double points) {
        return Math.round(points * 20);
    }

    static String escape(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '&':
                    sb.append("&amp;");
                    break;
                case '<':
                    sb.append("&lt;");
                    break;
                case '>':
                    sb.append("&gt;");
                    break;
                case '"':
                    sb.append("&quot;");
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "Style{name='" + name + "', type=" + type + (baseStyle != null ? ", base='" + baseStyle + "'" : "")
                + (builtIn ? ", builtIn" : "") + '}';
    }
}
