package com.example.docxstyle.service;

import com.example.docxstyle.config.StyleConfig;
import com.example.docxstyle.util.style.Alignment;
import com.example.docxstyle.util.style.ParagraphStyleProperties;
import com.example.docxstyle.util.style.TableStyleProperties;
import com.example.docxstyle.util.style.error.ErrorCode;
import com.example.docxstyle.util.style.error.LoggingStyleErrorHandler;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DocxStyleServiceTest {

    private StyleConfig config;
    private DocxStyleService service;
    private String styleSheet;

    @BeforeEach
    void setUp() throws Exception {
        config = new StyleConfig();
        service = new DocxStyleService(config, new LoggingStyleErrorHandler());
        try (InputStream in = getClass().getResourceAsStream("/styles/technical-styles.xml")) {
            styleSheet = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static byte[] sampleDocx() throws Exception {
        try (XWPFDocument document = new XWPFDocument()) {
            XWPFParagraph heading = document.createParagraph();
            heading.setStyle("Heading1");
            heading.createRun().setText("概述");
            document.createParagraph().createRun().setText("正文内容");
            document.createTable(2, 2);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.write(out);
            return out.toByteArray();
        }
    }

    @Test
    void appliesStyleSetMappingsAndInstallsStyles() throws Exception {
        byte[] output = service.applyStyles(new ByteArrayInputStream(sampleDocx()), styleSheet,
                "TechnicalDocument", "{\"heading1\":\"CustomHeading\"}");

        try (XWPFDocument result = new XWPFDocument(new ByteArrayInputStream(output))) {
            List<XWPFParagraph> paragraphs = result.getParagraphs();
            assertEquals("CustomHeading", paragraphs.get(0).getStyle());
            assertEquals("CustomBody", paragraphs.get(1).getStyle());
            assertEquals("DataTable", result.getTables().get(0).getStyleID());
            assertTrue(result.getStyles().styleExist("CustomHeading"));
            assertTrue(result.getStyles().styleExist("Heading 1"));
        }
    }

    @Test
    void styleSheetInstallationCanBeDisabled() throws Exception {
        config.setInstallStyleSheet(false);

        byte[] output = service.applyStyles(new ByteArrayInputStream(sampleDocx()), styleSheet, null, null);

        try (XWPFDocument result = new XWPFDocument(new ByteArrayInputStream(output))) {
            assertNull(result.getParagraphs().get(1).getStyle());
            assertTrue(result.getStyles() == null || !result.getStyles().styleExist("CustomBody"));
        }
    }

    @Test
    void defaultStyleSetAndDefinitionFileComeFromConfig(@TempDir Path dir) throws Exception {
        Path definition = dir.resolve("styles.xml");
        Files.write(definition, styleSheet.getBytes(StandardCharsets.UTF_8));
        config.setDefinitionPath(definition.toString());
        config.setDefaultStyleSet("TechnicalDocument");

        byte[] output = service.applyStyles(new ByteArrayInputStream(sampleDocx()), null, null, null);

        try (XWPFDocument result = new XWPFDocument(new ByteArrayInputStream(output))) {
            assertEquals("CustomBody", result.getParagraphs().get(1).getStyle());
        }
    }

    @Test
    void unknownStyleSetFails() {
        StyleProcessingException e = assertThrows(StyleProcessingException.class, () ->
                service.applyStyles(new ByteArrayInputStream(sampleDocx()), styleSheet, "Missing", null));

        assertEquals(ErrorCode.STYLE_NOT_FOUND, e.getError().getCode());
    }

    @Test
    void malformedMappingsAreRejected() {
        StyleProcessingException e = assertThrows(StyleProcessingException.class, () ->
                service.applyStyles(new ByteArrayInputStream(sampleDocx()), styleSheet, null, "[1, 2"));

        assertEquals(ErrorCode.INVALID_ARGUMENT, e.getError().getCode());
    }

    @Test
    void invalidStyleSheetFails() {
        StyleProcessingException e = assertThrows(StyleProcessingException.class, () ->
                service.previewStyles("<StyleSheet xmlns=\"urn:wrong\" version=\"1.0\"/>"));

        assertEquals(ErrorCode.XML_NAMESPACE_ERROR, e.getError().getCode());
    }

    @Test
    void danglingBaseStyleFailsValidation() {
        config.setLoadBuiltIns(false);

        StyleProcessingException e = assertThrows(StyleProcessingException.class, () ->
                service.previewStyles(styleSheet));

        assertEquals(ErrorCode.VALIDATION_FAILED, e.getError().getCode());
        assertEquals(ErrorCode.STYLE_DEPENDENCY_MISSING, e.getError().getCause().getCode());
    }

    @Test
    @SuppressWarnings("unchecked")
    void previewListsStylesAndSets() throws Exception {
        Map<String, Object> preview = service.previewStyles(styleSheet);

        List<Map<String, Object>> styles = (List<Map<String, Object>>) preview.get("styles");
        assertEquals(12, styles.size());
        assertEquals(Collections.singletonList("TechnicalDocument"), preview.get("styleSets"));
        assertTrue(((String) preview.get("stylesXml")).contains("w:styleId=\"DataTable\""));
    }

    @Test
    @SuppressWarnings("unchecked")
    void previewCarriesResolvedProperties() throws Exception {
        Map<String, Object> preview = service.previewStyles(styleSheet);

        Map<String, Object> body = null;
        Map<String, Object> table = null;
        for (Map<String, Object> item : (List<Map<String, Object>>) preview.get("styles")) {
            if ("CustomBody".equals(item.get("name"))) {
                body = item;
            } else if ("DataTable".equals(item.get("name"))) {
                table = item;
            }
        }
        assertNotNull(body);
        assertNotNull(table);

        ParagraphStyleProperties paragraph = (ParagraphStyleProperties) body.get("paragraph");
        assertEquals(Alignment.JUSTIFY, paragraph.getAlignment());
        assertEquals(21.0, paragraph.getFirstLineIndentPts());
        assertFalse(body.containsKey("table"));

        TableStyleProperties tableProps = (TableStyleProperties) table.get("table");
        assertEquals("single", tableProps.getBorderStyle());
        assertFalse(table.containsKey("paragraph"));
    }
}
