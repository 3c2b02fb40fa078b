package com.example.docxstyle.util.style;

import com.example.docxstyle.util.style.error.ErrorCode;
import com.example.docxstyle.util.style.error.ErrorContext;
import com.example.docxstyle.util.style.error.Result;
import com.example.docxstyle.util.style.error.StyleError;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 样式定义文档解析器
 *
 * <pre>
 * &lt;StyleSheet xmlns="http://docxstyle.example.com/styles" version="1.0"&gt;
 *     &lt;Style name="MyHeading" type="mixed" base="Normal"&gt;
 *         &lt;Paragraph&gt;
 *             &lt;Alignment&gt;center&lt;/Alignment&gt;
 *             &lt;SpaceBefore&gt;24pt&lt;/SpaceBefore&gt;
 *             &lt;LineSpacing&gt;1.5&lt;/LineSpacing&gt;
 *             &lt;Indentation left="0pt" right="0pt" firstLine="0pt"/&gt;
 *         &lt;/Paragraph&gt;
 *         &lt;Character&gt;
 *             &lt;Font name="Arial" size="18pt"/&gt;
 *             &lt;Color&gt;#000080&lt;/Color&gt;
 *             &lt;Format bold="true"/&gt;
 *         &lt;/Character&gt;
 *     &lt;/Style&gt;
 *     &lt;StyleSet name="Report" description="..."&gt;
 *         &lt;Include&gt;MyHeading&lt;/Include&gt;
 *     &lt;/StyleSet&gt;
 * &lt;/StyleSheet&gt;
 * </pre>
 *
 * 先用 StAX 检查文档是否格式良好，再用 jsoup 的 XML 解析模式遍历元素，标签名和属性名大小写敏感
 */
@Slf4j
public class XmlStyleParser {

    public static final String NAMESPACE_URI = "http://docxstyle.example.com/styles";
    public static final String SUPPORTED_VERSION = "1.0";

    /** 表格宽度为百分比时，100% 对应的磅值 */
    static final double FULL_TABLE_WIDTH_PTS = 400.0;

    private static final XMLInputFactory XML_INPUT_FACTORY = createInputFactory();

    private static XMLInputFactory createInputFactory() {
        XMLInputFactory factory = XMLInputFactory.newInstance();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        return factory;
    }

    // ==================== 入口 ====================

    public Result<List<Style>> loadStylesFromFile(Path path) {
        return readFile(path).flatMap(this::loadStylesFromString);
    }

    public Result<List<Style>> loadStylesFromString(String xml) {
        return parseRoot(xml).flatMap(this::parseStyles);
    }

    public Result<List<StyleSet>> loadStyleSetsFromFile(Path path) {
        return readFile(path).flatMap(this::loadStyleSetsFromString);
    }

    public Result<List<StyleSet>> loadStyleSetsFromString(String xml) {
        return parseRoot(xml).flatMap(this::parseStyleSets);
    }

    public Result<StyleSheetDefinition> loadStyleSheetFromFile(Path path) {
        return readFile(path).flatMap(this::loadStyleSheetFromString);
    }

    /**
     * 一次解析出全部样式和样式集
     */
    public Result<StyleSheetDefinition> loadStyleSheetFromString(String xml) {
        Result<Element> root = parseRoot(xml);
        if (root.isFailed()) {
            return root.propagate();
        }
        Result<List<Style>> styles = parseStyles(root.getValue());
        if (styles.isFailed()) {
            return styles.propagate();
        }
        Result<List<StyleSet>> sets = parseStyleSets(root.getValue());
        if (sets.isFailed()) {
            return sets.propagate();
        }
        log.info("解析样式定义完成: 样式 {} 个, 样式集 {} 个", styles.getValue().size(), sets.getValue().size());
        return Result.ok(new StyleSheetDefinition(styles.getValue(), sets.getValue()));
    }

    // ==================== 文档级 ====================

    private Result<String> readFile(Path path) {
        if (path == null) {
            return Result.fail(StyleError.of(ErrorCode.INVALID_ARGUMENT, "文件路径不能为空", "load_style_file"));
        }
        try {
            String content = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
            if (content.startsWith("\uFEFF")) {
                content = content.substring(1);
            }
            log.debug("读取样式定义文件: {}", path);
            return Result.ok(content);
        } catch (NoSuchFileException e) {
            return Result.fail(new StyleError(ErrorCode.FILE_NOT_FOUND, "样式定义文件不存在: " + path,
                    ErrorContext.forOperation("load_style_file").with("path", path)));
        } catch (IOException e) {
            return Result.fail(new StyleError(ErrorCode.FILE_ACCESS_FAILED, "读取样式定义文件失败: " + e.getMessage(),
                    ErrorContext.forOperation("load_style_file").with("path", path)));
        }
    }

    /**
     * 解析并校验根元素：名称、命名空间、版本
     */
    private Result<Element> parseRoot(String xml) {
        String op = "parse_style_sheet";
        if (xml == null || xml.trim().isEmpty()) {
            return Result.fail(StyleError.of(ErrorCode.XML_PARSE_ERROR, "样式定义内容为空", op));
        }
        Result<Void> wellFormed = checkWellFormed(xml);
        if (wellFormed.isFailed()) {
            return wellFormed.propagate();
        }
        Document doc = Jsoup.parse(xml, "", Parser.xmlParser());
        Element root = doc.children().first();
        if (root == null) {
            return Result.fail(StyleError.of(ErrorCode.XML_PARSE_ERROR, "样式定义缺少根元素", op));
        }
        if (!"StyleSheet".equals(root.tagName())) {
            return Result.fail(new StyleError(ErrorCode.XML_INVALID_STRUCTURE,
                    "根元素必须是 StyleSheet: " + root.tagName(), ErrorContext.forOperation(op).with("root", root.tagName())));
        }
        if (!NAMESPACE_URI.equals(root.attr("xmlns"))) {
            return Result.fail(new StyleError(ErrorCode.XML_NAMESPACE_ERROR,
                    "xmlns 缺失或不正确，应为: " + NAMESPACE_URI, ErrorContext.forOperation(op).with("xmlns", root.attr("xmlns"))));
        }
        if (!root.hasAttr("version")) {
            return Result.fail(new StyleError(ErrorCode.XML_ATTRIBUTE_MISSING,
                    "StyleSheet 缺少 version 属性", ErrorContext.forOperation(op)));
        }
        if (!SUPPORTED_VERSION.equals(root.attr("version"))) {
            return Result.fail(new StyleError(ErrorCode.XML_UNSUPPORTED_VERSION,
                    "不支持的定义版本: " + root.attr("version") + "，支持: " + SUPPORTED_VERSION,
                    ErrorContext.forOperation(op).with("version", root.attr("version"))));
        }
        return Result.ok(root);
    }

    /**
     * 截断、标签不匹配等格式错误在这里统一报告为 XML_PARSE_ERROR
     */
    private static Result<Void> checkWellFormed(String xml) {
        XMLStreamReader reader = null;
        try {
            reader = XML_INPUT_FACTORY.createXMLStreamReader(new StringReader(xml));
            while (reader.hasNext()) {
                reader.next();
            }
            return Result.ok();
        } catch (XMLStreamException e) {
            ErrorContext context = ErrorContext.forOperation("parse_style_sheet");
            if (e.getLocation() != null) {
                context.with("line", e.getLocation().getLineNumber()).with("column", e.getLocation().getColumnNumber());
            }
            return Result.fail(new StyleError(ErrorCode.XML_PARSE_ERROR, "样式定义不是合法的 XML: " + e.getMessage(), context));
        } finally {
            if (reader != null) {
                try {
                    reader.close();
                } catch (XMLStreamException e) {
                    log.debug("关闭 XML 读取器失败: {}", e.getMessage());
                }
            }
        }
    }

    private Result<List<Style>> parseStyles(Element root) {
        List<Style> styles = new ArrayList<>();
        for (Element styleNode : childElements(root, "Style")) {
            Result<Style> style = parseStyle(styleNode);
            if (style.isFailed()) {
                return sheetFailure("样式解析失败: " + styleNode.attr("name"), style.getError());
            }
            styles.add(style.getValue());
        }
        return Result.ok(styles);
    }

    private Result<List<StyleSet>> parseStyleSets(Element root) {
        List<StyleSet> sets = new ArrayList<>();
        for (Element setNode : childElements(root, "StyleSet")) {
            Result<StyleSet> set = parseStyleSet(setNode);
            if (set.isFailed()) {
                return sheetFailure("样式集解析失败: " + setNode.attr("name"), set.getError());
            }
            sets.add(set.getValue());
        }
        return Result.ok(sets);
    }

    // ==================== Style / StyleSet ====================

    private Result<Style> parseStyle(Element node) {
        String op = "parse_style";
        if (!node.hasAttr("name") || node.attr("name").isEmpty()) {
            return missingAttribute("Style", "name");
        }
        String name = node.attr("name");
        if (!node.hasAttr("type")) {
            return missingAttribute("Style", "type");
        }
        StyleType type = parseStyleType(node.attr("type"));
        if (type == null) {
            return Result.fail(new StyleError(ErrorCode.INVALID_ARGUMENT, "未知的样式类型: " + node.attr("type"),
                    ErrorContext.forOperation(op).with("style", name)));
        }

        Style style = new Style(name, type);
        if (node.hasAttr("base")) {
            Result<Void> base = style.setBaseStyle(node.attr("base"));
            if (base.isFailed()) {
                return base.propagate();
            }
        }

        Element paragraphNode = firstChild(node, "Paragraph");
        if (paragraphNode != null) {
            Result<Void> applied = parseParagraph(paragraphNode).flatMap(style::setParagraphProperties);
            if (applied.isFailed()) {
                return wrap(applied.getError(), name);
            }
        }
        Element characterNode = firstChild(node, "Character");
        if (characterNode != null) {
            Result<Void> applied = parseCharacter(characterNode, name).flatMap(style::setCharacterProperties);
            if (applied.isFailed()) {
                return wrap(applied.getError(), name);
            }
        }
        Element tableNode = firstChild(node, "Table");
        if (tableNode != null) {
            Result<Void> applied = parseTable(tableNode).flatMap(style::setTableProperties);
            if (applied.isFailed()) {
                return wrap(applied.getError(), name);
            }
        }

        Result<Void> valid = style.validate();
        if (valid.isFailed()) {
            return Result.fail(new StyleError(ErrorCode.VALIDATION_FAILED, "样式校验失败: " + name,
                    ErrorContext.forOperation(op).with("style", name)).causedBy(valid.getError()));
        }
        return Result.ok(style);
    }

    private Result<StyleSet> parseStyleSet(Element node) {
        String op = "parse_style_set";
        if (!node.hasAttr("name") || node.attr("name").isEmpty()) {
            return missingAttribute("StyleSet", "name");
        }
        StyleSet set = new StyleSet(node.attr("name"));
        set.setDescription(node.attr("description"));

        for (Element include : childElements(node, "Include")) {
            String styleName = include.text();
            if (styleName.isEmpty()) {
                return Result.fail(new StyleError(ErrorCode.XML_INVALID_STRUCTURE, "Include 元素内容为空",
                        ErrorContext.forOperation(op).with("style_set", set.getName())));
            }
            set.addStyle(styleName);
        }
        if (set.getIncludedStyles().isEmpty()) {
            return Result.fail(new StyleError(ErrorCode.VALIDATION_FAILED, "样式集至少需要包含一个样式: " + set.getName(),
                    ErrorContext.forOperation(op).with("style_set", set.getName())));
        }
        return Result.ok(set);
    }

    private static StyleType parseStyleType(String text) {
        switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "paragraph":
                return StyleType.PARAGRAPH;
            case "character":
                return StyleType.CHARACTER;
            case "table":
                return StyleType.TABLE;
            case "numbering":
                return StyleType.NUMBERING;
            case "mixed":
                return StyleType.MIXED;
            default:
                return null;
        }
    }

    // ==================== 属性块 ====================

    private Result<ParagraphStyleProperties> parseParagraph(Element node) {
        ParagraphStyleProperties props = new ParagraphStyleProperties();

        Element alignmentNode = firstChild(node, "Alignment");
        if (alignmentNode != null) {
            Alignment alignment = Alignment.fromText(alignmentNode.text());
            if (alignment == null) {
                return Result.fail(new StyleError(ErrorCode.INVALID_ALIGNMENT, "无效的对齐方式: " + alignmentNode.text(),
                        ErrorContext.forOperation("parse_paragraph")));
            }
            props.setAlignment(alignment);
        }

        Result<Double> length = optionalLength(firstChild(node, "SpaceBefore"));
        if (length.isFailed()) return length.propagate();
        props.setSpaceBeforePts(length.getValue());

        length = optionalLength(firstChild(node, "SpaceAfter"));
        if (length.isFailed()) return length.propagate();
        props.setSpaceAfterPts(length.getValue());

        Element lineSpacingNode = firstChild(node, "LineSpacing");
        if (lineSpacingNode != null) {
            Result<Double> lineSpacing = parseLineSpacing(lineSpacingNode.text());
            if (lineSpacing.isFailed()) return lineSpacing.propagate();
            props.setLineSpacing(lineSpacing.getValue());
        }

        Element indentation = firstChild(node, "Indentation");
        if (indentation != null) {
            length = optionalLengthAttr(indentation, "left");
            if (length.isFailed()) return length.propagate();
            props.setLeftIndentPts(length.getValue());

            length = optionalLengthAttr(indentation, "right");
            if (length.isFailed()) return length.propagate();
            props.setRightIndentPts(length.getValue());

            length = optionalLengthAttr(indentation, "firstLine");
            if (length.isFailed()) return length.propagate();
            props.setFirstLineIndentPts(length.getValue());
        }

        Element listNode = firstChild(node, "List");
        if (listNode != null) {
            ListType listType = ListType.fromText(listNode.attr("type"));
            if (listType == null) {
                return Result.fail(new StyleError(ErrorCode.INVALID_ARGUMENT, "无效的列表类型: " + listNode.attr("type"),
                        ErrorContext.forOperation("parse_paragraph")));
            }
            props.setListType(listType);
            if (listNode.hasAttr("level")) {
                try {
                    props.setListLevel(Integer.parseInt(listNode.attr("level").trim()));
                } catch (NumberFormatException e) {
                    return Result.fail(new StyleError(ErrorCode.INVALID_ARGUMENT, "无效的列表级别: " + listNode.attr("level"),
                            ErrorContext.forOperation("parse_paragraph")));
                }
            }
        }
        return Result.ok(props);
    }

    /**
     * 行距可以是倍数（1.5）或百分比（150%）
     */
    private static Result<Double> parseLineSpacing(String text) {
        if (text.endsWith("%")) {
            return StyleUnits.parsePercentage(text);
        }
        try {
            return Result.ok(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            return Result.fail(new StyleError(ErrorCode.INVALID_ARGUMENT, "无效的行距: " + text,
                    ErrorContext.forOperation("parse_paragraph")));
        }
    }

    private Result<CharacterStyleProperties> parseCharacter(Element node, String styleName) {
        CharacterStyleProperties props = new CharacterStyleProperties();

        Element font = firstChild(node, "Font");
        if (font != null) {
            if (font.hasAttr("name")) {
                props.setFontName(font.attr("name"));
            }
            Result<Double> size = optionalLengthAttr(font, "size");
            if (size.isFailed()) return size.propagate();
            props.setFontSizePts(size.getValue());
        }

        Element color = firstChild(node, "Color");
        if (color != null) {
            Result<String> parsed = StyleUnits.parseColor(color.text());
            if (parsed.isFailed()) return parsed.propagate();
            props.setFontColorHex(parsed.getValue());
        }

        Element highlight = firstChild(node, "Highlight");
        if (highlight != null && !highlight.text().isEmpty()) {
            HighlightColor highlightColor = HighlightColor.fromText(highlight.text());
            if (highlightColor != null) {
                props.setHighlightColor(highlightColor);
            } else {
                log.warn("样式 {} 的高亮色无法识别，已忽略: {}", styleName, highlight.text());
            }
        }

        Element format = firstChild(node, "Format");
        if (format != null) {
            int flags = 0;
            if (isTrue(format, "bold")) flags |= FormattingFlag.BOLD.mask();
            if (isTrue(format, "italic")) flags |= FormattingFlag.ITALIC.mask();
            if (isTrue(format, "underline")) flags |= FormattingFlag.UNDERLINE.mask();
            if (isTrue(format, "strikethrough")) flags |= FormattingFlag.STRIKETHROUGH.mask();
            if (isTrue(format, "smallCaps")) flags |= FormattingFlag.SMALLCAPS.mask();
            if (isTrue(format, "shadow")) flags |= FormattingFlag.SHADOW.mask();
            if (isTrue(format, "subscript")) flags |= FormattingFlag.SUBSCRIPT.mask();
            if (isTrue(format, "superscript")) flags |= FormattingFlag.SUPERSCRIPT.mask();
            if (flags != 0) {
                props.setFormattingFlags(flags);
            }
        }
        return Result.ok(props);
    }

    private Result<TableStyleProperties> parseTable(Element node) {
        TableStyleProperties props = new TableStyleProperties();

        Element width = firstChild(node, "Width");
        if (width != null) {
            String text = width.text();
            Result<Double> parsed = text.endsWith("%")
                    ? StyleUnits.parsePercentage(text).map(ratio -> ratio * FULL_TABLE_WIDTH_PTS)
                    : StyleUnits.parseValueWithUnit(text);
            if (parsed.isFailed()) return parsed.propagate();
            props.setTableWidthPts(parsed.getValue());
        }

        Element alignment = firstChild(node, "Alignment");
        if (alignment != null) {
            props.setTableAlignment(alignment.text());
        }

        Element borders = firstChild(node, "Borders");
        if (borders != null) {
            if (borders.hasAttr("style")) {
                props.setBorderStyle(borders.attr("style"));
            }
            Result<Double> borderWidth = optionalLengthAttr(borders, "width");
            if (borderWidth.isFailed()) return borderWidth.propagate();
            props.setBorderWidthPts(borderWidth.getValue());
            if (borders.hasAttr("color")) {
                Result<String> color = StyleUnits.parseColor(borders.attr("color"));
                if (color.isFailed()) return color.propagate();
                props.setBorderColorHex(color.getValue());
            }
        }

        Result<Double> padding = optionalLength(firstChild(node, "CellPadding"));
        if (padding.isFailed()) return padding.propagate();
        props.setCellPaddingPts(padding.getValue());

        return Result.ok(props);
    }

    // ==================== 工具 ====================

    private static List<Element> childElements(Element parent, String tagName) {
        List<Element> result = new ArrayList<>();
        for (Element child : parent.children()) {
            if (tagName.equals(child.tagName())) {
                result.add(child);
            }
        }
        return result;
    }

    private static Element firstChild(Element parent, String tagName) {
        for (Element child : parent.children()) {
            if (tagName.equals(child.tagName())) {
                return child;
            }
        }
        return null;
    }

    private static Result<Double> optionalLength(Element node) {
        if (node == null) {
            return Result.ok(null);
        }
        return StyleUnits.parseValueWithUnit(node.text());
    }

    private static Result<Double> optionalLengthAttr(Element node, String attribute) {
        if (!node.hasAttr(attribute)) {
            return Result.ok(null);
        }
        return StyleUnits.parseValueWithUnit(node.attr(attribute));
    }

    private static boolean isTrue(Element node, String attribute) {
        String value = node.attr(attribute).trim().toLowerCase(Locale.ROOT);
        return "true".equals(value) || "1".equals(value) || "yes".equals(value);
    }

    private static <T> Result<T> missingAttribute(String element, String attribute) {
        return Result.fail(new StyleError(ErrorCode.XML_ATTRIBUTE_MISSING,
                element + " 缺少必需属性: " + attribute,
                ErrorContext.forOperation("parse_style_sheet").with("element", element).with("attribute", attribute)));
    }

    private static <T> Result<T> sheetFailure(String message, StyleError cause) {
        return Result.fail(new StyleError(ErrorCode.XML_PARSE_ERROR, message,
                ErrorContext.forOperation("parse_style_sheet")).causedBy(cause));
    }

    private static <T> Result<T> wrap(StyleError error, String styleName) {
        return Result.fail(new StyleError(ErrorCode.STYLE_PROPERTY_INVALID, "样式属性无效: " + styleName,
                ErrorContext.forOperation("parse_style").with("style", styleName)).causedBy(error));
    }
}
