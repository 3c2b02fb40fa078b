package com.example.docxstyle.util.style;

import com.example.docxstyle.util.style.error.ErrorCode;
import com.example.docxstyle.util.style.error.Result;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class XmlStyleParserTest {

    private static final String HEADER = "<StyleSheet xmlns=\"" + XmlStyleParser.NAMESPACE_URI + "\" version=\"1.0\">";

    private final XmlStyleParser parser = new XmlStyleParser();

    private static String sheet(String body) {
        return HEADER + body + "</StyleSheet>";
    }

    private static String fixture() throws Exception {
        try (InputStream in = XmlStyleParserTest.class.getResourceAsStream("/styles/technical-styles.xml")) {
            assertNotNull(in);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void parsesMixedStyleWithParagraphAndCharacterBlocks() throws Exception {
        List<Style> styles = parser.loadStylesFromString(fixture()).getValue();

        assertEquals(4, styles.size());
        Style heading = styles.get(0);
        assertEquals("CustomHeading", heading.getName());
        assertEquals(StyleType.MIXED, heading.getType());
        assertEquals("Heading 1", heading.getBaseStyle());

        ParagraphStyleProperties paragraph = heading.getParagraphProperties();
        assertEquals(Alignment.CENTER, paragraph.getAlignment());
        assertEquals(24.0, paragraph.getSpaceBeforePts());
        assertEquals(12.0, paragraph.getSpaceAfterPts());
        assertEquals(1.5, paragraph.getLineSpacing());

        CharacterStyleProperties character = heading.getCharacterProperties();
        assertEquals("Arial", character.getFontName());
        assertEquals(18.0, character.getFontSizePts());
        assertEquals("000080", character.getFontColorHex());
        assertEquals(Integer.valueOf(FormattingFlag.BOLD.mask()), character.getFormattingFlags());
    }

    @Test
    void parsesParagraphCharacterAndTableStyles() throws Exception {
        List<Style> styles = parser.loadStylesFromString(fixture()).getValue();

        Style body = styles.get(1);
        assertEquals(Alignment.JUSTIFY, body.getParagraphProperties().getAlignment());
        assertEquals(21.0, body.getParagraphProperties().getFirstLineIndentPts());
        assertEquals(0.0, body.getParagraphProperties().getLeftIndentPts());

        Style code = styles.get(2);
        assertEquals(StyleType.CHARACTER, code.getType());
        assertEquals(HighlightColor.LIGHT_GRAY, code.getCharacterProperties().getHighlightColor());
        assertNull(code.getCharacterProperties().getFormattingFlags());

        TableStyleProperties table = styles.get(3).getTableProperties();
        assertEquals(XmlStyleParser.FULL_TABLE_WIDTH_PTS, table.getTableWidthPts(), 1e-9);
        assertEquals("center", table.getTableAlignment());
        assertEquals("single", table.getBorderStyle());
        assertEquals(1.0, table.getBorderWidthPts());
        assertEquals("808080", table.getBorderColorHex());
        assertEquals(5.0, table.getCellPaddingPts());
    }

    @Test
    void parsesStyleSets() throws Exception {
        List<StyleSet> sets = parser.loadStyleSetsFromString(fixture()).getValue();

        assertEquals(1, sets.size());
        assertEquals("TechnicalDocument", sets.get(0).getName());
        assertEquals("技术文档", sets.get(0).getDescription());
        assertEquals(Arrays.asList("CustomBody", "InlineCode", "DataTable"), sets.get(0).getIncludedStyles());
    }

    @Test
    void loadsWholeStyleSheetFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("styles.xml");
        Files.write(file, fixture().getBytes(StandardCharsets.UTF_8));

        StyleSheetDefinition definition = parser.loadStyleSheetFromFile(file).getValue();

        assertEquals(4, definition.getStyles().size());
        assertEquals(1, definition.getStyleSets().size());
    }

    @Test
    void missingFileIsReported(@TempDir Path dir) {
        Result<List<Style>> result = parser.loadStylesFromFile(dir.resolve("absent.xml"));

        assertEquals(ErrorCode.FILE_NOT_FOUND, result.getError().getCode());
    }

    @Test
    void rootElementIsValidated() {
        assertEquals(ErrorCode.XML_PARSE_ERROR,
                parser.loadStylesFromString("   ").getError().getCode());
        assertEquals(ErrorCode.XML_INVALID_STRUCTURE,
                parser.loadStylesFromString("<Styles xmlns=\"" + XmlStyleParser.NAMESPACE_URI + "\" version=\"1.0\"/>").getError().getCode());
        assertEquals(ErrorCode.XML_NAMESPACE_ERROR,
                parser.loadStylesFromString("<StyleSheet xmlns=\"urn:other\" version=\"1.0\"/>").getError().getCode());
        assertEquals(ErrorCode.XML_ATTRIBUTE_MISSING,
                parser.loadStylesFromString("<StyleSheet xmlns=\"" + XmlStyleParser.NAMESPACE_URI + "\"/>").getError().getCode());
        assertEquals(ErrorCode.XML_UNSUPPORTED_VERSION,
                parser.loadStylesFromString("<StyleSheet xmlns=\"" + XmlStyleParser.NAMESPACE_URI + "\" version=\"2.0\"/>").getError().getCode());
    }

    @Test
    void malformedDocumentsAreRejected() {
        Result<List<Style>> truncated = parser.loadStylesFromString(HEADER
                + "<Style name=\"A\" type=\"paragraph\"><Paragraph><SpaceAfter>6pt</SpaceAfter>");
        assertEquals(ErrorCode.XML_PARSE_ERROR, truncated.getError().getCode());
        assertNull(truncated.getError().getCause());

        Result<List<Style>> mismatched = parser.loadStylesFromString(sheet(
                "<Style name=\"A\" type=\"paragraph\"><Paragraph><SpaceAfter>6pt</SpaceAfter></Paragraph></Styel>"));
        assertEquals(ErrorCode.XML_PARSE_ERROR, mismatched.getError().getCode());

        assertEquals(ErrorCode.XML_PARSE_ERROR,
                parser.loadStyleSheetFromString("this is not xml").getError().getCode());
    }

    @Test
    void byteOrderMarkInFileIsAccepted(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("bom.xml");
        Files.write(file, ("\uFEFF" + sheet("<Style name=\"A\" type=\"paragraph\"/>")).getBytes(StandardCharsets.UTF_8));

        assertEquals(1, parser.loadStylesFromFile(file).getValue().size());
    }

    @Test
    void styleRequiresNameAndKnownType() {
        Result<List<Style>> unnamed = parser.loadStylesFromString(sheet("<Style type=\"paragraph\"/>"));
        assertEquals(ErrorCode.XML_PARSE_ERROR, unnamed.getError().getCode());
        assertEquals("parse_style_sheet", unnamed.getError().getContext().getOperation());
        assertEquals(ErrorCode.XML_ATTRIBUTE_MISSING, unnamed.getError().getCause().getCode());
        assertEquals(ErrorCode.XML_ATTRIBUTE_MISSING,
                parser.loadStylesFromString(sheet("<Style name=\"A\"/>")).getError().getCause().getCode());
        assertEquals(ErrorCode.INVALID_ARGUMENT,
                parser.loadStylesFromString(sheet("<Style name=\"A\" type=\"fancy\"/>")).getError().getCause().getCode());
    }

    @Test
    void parsedStylesAreValidated() {
        StringBuilder name = new StringBuilder();
        for (int i = 0; i < 300; i++) {
            name.append('n');
        }
        Result<List<Style>> tooLong = parser.loadStylesFromString(sheet(
                "<Style name=\"" + name + "\" type=\"paragraph\"/>"));

        assertTrue(tooLong.isFailed());
        assertEquals(ErrorCode.VALIDATION_FAILED, tooLong.getError().getCause().getCode());
        assertEquals(ErrorCode.VALIDATION_FAILED, tooLong.getError().getRootCause().getCode());

        Result<List<Style>> border = parser.loadStylesFromString(sheet(
                "<Style name=\"T\" type=\"table\"><Table><Borders style=\"solid\"/></Table></Style>"));
        assertEquals(ErrorCode.INVALID_BORDER, border.getError().getRootCause().getCode());
    }

    @Test
    void invalidPropertyValuesAreWrapped() {
        Result<List<Style>> alignment = parser.loadStylesFromString(sheet(
                "<Style name=\"A\" type=\"paragraph\"><Paragraph><Alignment>sideways</Alignment></Paragraph></Style>"));
        assertEquals(ErrorCode.XML_PARSE_ERROR, alignment.getError().getCode());
        assertEquals(ErrorCode.STYLE_PROPERTY_INVALID, alignment.getError().getCause().getCode());
        assertEquals(ErrorCode.INVALID_ALIGNMENT, alignment.getError().getRootCause().getCode());

        Result<List<Style>> size = parser.loadStylesFromString(sheet(
                "<Style name=\"B\" type=\"character\"><Character><Font size=\"2000pt\"/></Character></Style>"));
        assertEquals(ErrorCode.INVALID_FONT_SIZE, size.getError().getRootCause().getCode());

        Result<List<Style>> color = parser.loadStylesFromString(sheet(
                "<Style name=\"C\" type=\"character\"><Character><Color>#ZZZZZZ</Color></Character></Style>"));
        assertEquals(ErrorCode.INVALID_COLOR_FORMAT, color.getError().getRootCause().getCode());

        Result<List<Style>> incompatible = parser.loadStylesFromString(sheet(
                "<Style name=\"D\" type=\"character\"><Paragraph><SpaceAfter>6pt</SpaceAfter></Paragraph></Style>"));
        assertEquals(ErrorCode.STYLE_PROPERTY_INVALID, incompatible.getError().getRootCause().getCode());
    }

    @Test
    void unknownHighlightIsIgnored() {
        Style style = parser.loadStylesFromString(sheet(
                "<Style name=\"H\" type=\"character\"><Character><Highlight>sparkly</Highlight></Character></Style>"))
                .getValue().get(0);

        assertNull(style.getCharacterProperties().getHighlightColor());
    }

    @Test
    void listAndPercentageLineSpacingAreParsed() {
        Style style = parser.loadStylesFromString(sheet(
                "<Style name=\"L\" type=\"paragraph\"><Paragraph>"
                        + "<LineSpacing>150%</LineSpacing><List type=\"bullet\" level=\"2\"/>"
                        + "</Paragraph></Style>")).getValue().get(0);

        assertEquals(1.5, style.getParagraphProperties().getLineSpacing(), 1e-9);
        assertEquals(ListType.BULLET, style.getParagraphProperties().getListType());
        assertEquals(Integer.valueOf(2), style.getParagraphProperties().getListLevel());
    }

    @Test
    void styleSetIncludesAreValidated() {
        Result<List<StyleSet>> empty = parser.loadStyleSetsFromString(sheet(
                "<StyleSet name=\"S\"><Include></Include></StyleSet>"));
        assertEquals(ErrorCode.XML_PARSE_ERROR, empty.getError().getCode());
        assertEquals(ErrorCode.XML_INVALID_STRUCTURE, empty.getError().getCause().getCode());

        Result<List<StyleSet>> none = parser.loadStyleSetsFromString(sheet("<StyleSet name=\"S\"/>"));
        assertEquals(ErrorCode.VALIDATION_FAILED, none.getError().getCause().getCode());

        Result<List<StyleSet>> unnamed = parser.loadStyleSetsFromString(sheet("<StyleSet><Include>A</Include></StyleSet>"));
        assertEquals(ErrorCode.XML_ATTRIBUTE_MISSING, unnamed.getError().getCause().getCode());
    }
}
