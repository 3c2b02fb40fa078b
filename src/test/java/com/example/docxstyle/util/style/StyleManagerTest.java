package com.example.docxstyle.util.style;

import com.example.docxstyle.util.style.error.ErrorCode;
import com.example.docxstyle.util.style.error.Result;
import com.example.docxstyle.util.style.error.StyleError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StyleManagerTest {

    private final List<StyleError> reported = new ArrayList<>();
    private StyleManager manager;

    @BeforeEach
    void setUp() {
        reported.clear();
        manager = new StyleManager(reported::add);
    }

    @Test
    void createAndLookUpStyles() {
        Result<Style> created = manager.createParagraphStyle("Body");

        assertTrue(created.isOk());
        assertTrue(manager.hasStyle("Body"));
        assertSame(created.getValue(), manager.getStyle("Body").getValue());
        assertEquals(StyleType.PARAGRAPH, created.getValue().getType());
        assertEquals(1, manager.styleCount());
        assertTrue(reported.isEmpty());
    }

    @Test
    void duplicateNamesAreRejectedAndReported() {
        manager.createCharacterStyle("Emphasis");
        Result<Style> duplicate = manager.createMixedStyle("Emphasis");

        assertEquals(ErrorCode.STYLE_ALREADY_EXISTS, duplicate.getError().getCode());
        assertEquals(1, reported.size());
        assertEquals(ErrorCode.STYLE_ALREADY_EXISTS, reported.get(0).getCode());
        assertEquals(StyleType.CHARACTER, manager.getStyle("Emphasis").getValue().getType());
    }

    @Test
    void invalidNamesAreRejected() {
        assertEquals(ErrorCode.INVALID_ARGUMENT, manager.createTableStyle("").getError().getCode());
        assertEquals(ErrorCode.INVALID_ARGUMENT, manager.createStyle("X", null).getError().getCode());
        assertEquals(0, manager.styleCount());
    }

    @Test
    void missingStyleIsReportedAsNotFound() {
        Result<Style> missing = manager.getStyle("Nope");

        assertEquals(ErrorCode.STYLE_NOT_FOUND, missing.getError().getCode());
        assertEquals(1, reported.size());
    }

    @Test
    void namesAreListedInOrderAndByType() {
        manager.createParagraphStyle("Zeta");
        manager.createCharacterStyle("Alpha");
        manager.createParagraphStyle("Mid");

        assertEquals(Arrays.asList("Alpha", "Mid", "Zeta"), manager.getAllStyleNames());
        assertEquals(Arrays.asList("Mid", "Zeta"), manager.getStyleNamesByType(StyleType.PARAGRAPH));
        assertTrue(manager.getStyleNamesByType(StyleType.TABLE).isEmpty());
    }

    @Test
    void builtInStylesAreLoadedOnce() {
        assertTrue(manager.loadAllBuiltInStyles().isOk());
        assertEquals(8, manager.styleCount());
        assertTrue(manager.loadAllBuiltInStyles().isOk());
        assertEquals(8, manager.styleCount());

        for (BuiltInStyleCategory category : BuiltInStyleCategory.values()) {
            assertTrue(manager.isCategoryLoaded(category));
        }
        Style heading = manager.getStyle("Heading 3").getValue();
        assertTrue(heading.isBuiltIn());
        assertEquals(StyleType.MIXED, heading.getType());
        assertEquals(12.0, heading.getCharacterProperties().getFontSizePts());
        assertTrue(heading.getCharacterProperties().hasFlag(FormattingFlag.BOLD));
        assertEquals(Alignment.LEFT, heading.getParagraphProperties().getAlignment());

        Style code = manager.getStyle("Code").getValue();
        assertEquals(StyleType.CHARACTER, code.getType());
        assertEquals("Consolas", code.getCharacterProperties().getFontName());
        assertEquals("333333", code.getCharacterProperties().getFontColorHex());
    }

    @Test
    void builtInCategoryFailsWholeOnNameConflict() {
        manager.createParagraphStyle("Heading 4");

        Result<Void> result = manager.loadBuiltInStyles(BuiltInStyleCategory.HEADING);

        assertEquals(ErrorCode.STYLE_ALREADY_EXISTS, result.getError().getCode());
        assertEquals(1, manager.styleCount());
        assertFalse(manager.isCategoryLoaded(BuiltInStyleCategory.HEADING));
    }

    @Test
    void clearAllStylesForgetsLoadedCategories() {
        manager.loadBuiltInStyles(BuiltInStyleCategory.BODY_TEXT);
        manager.clearAllStyles();

        assertEquals(0, manager.styleCount());
        assertFalse(manager.isCategoryLoaded(BuiltInStyleCategory.BODY_TEXT));
        assertTrue(manager.loadBuiltInStyles(BuiltInStyleCategory.BODY_TEXT).isOk());
        assertTrue(manager.hasStyle("Normal"));
    }

    @Test
    void normalLeavesSpaceBeforeUnset() {
        manager.loadBuiltInStyles(BuiltInStyleCategory.BODY_TEXT);
        ParagraphStyleProperties own = manager.getStyle("Normal").getValue().getParagraphProperties();

        assertNull(own.getSpaceBeforePts());
        assertEquals(6.0, own.getSpaceAfterPts());
        assertEquals(Alignment.LEFT, own.getAlignment());

        ParagraphStyleProperties start = new ParagraphStyleProperties();
        start.setSpaceBeforePts(10.0);
        ParagraphStyleProperties resolved = manager.resolveParagraphProperties(start, "Normal").getValue();
        assertEquals(10.0, resolved.getSpaceBeforePts());
        assertEquals(6.0, resolved.getSpaceAfterPts());
    }

    @Test
    void inheritanceOverlaysOwnPropertiesOnBase() {
        Style base = manager.createParagraphStyle("Base").getValue();
        base.setAlignment(Alignment.CENTER);
        base.setSpacing(12, 12);
        Style child = manager.createParagraphStyle("Child").getValue();
        child.setBaseStyle("Base");
        ParagraphStyleProperties own = new ParagraphStyleProperties();
        own.setSpaceAfterPts(3.0);
        child.setParagraphProperties(own);

        ParagraphStyleProperties start = new ParagraphStyleProperties();
        start.setLineSpacing(2.0);
        start.setAlignment(Alignment.RIGHT);
        ParagraphStyleProperties resolved = manager.resolveParagraphProperties(start, "Child").getValue();

        assertEquals(Alignment.CENTER, resolved.getAlignment());
        assertEquals(12.0, resolved.getSpaceBeforePts());
        assertEquals(3.0, resolved.getSpaceAfterPts());
        assertEquals(2.0, resolved.getLineSpacing());
        assertEquals(Alignment.RIGHT, start.getAlignment());
    }

    @Test
    void derivedStyleWinsOverBaseOnConflicts() {
        manager.createParagraphStyle("B").getValue().setSpacing(10, 0);
        Style derived = manager.createParagraphStyle("D").getValue();
        derived.setBaseStyle("B");
        ParagraphStyleProperties own = new ParagraphStyleProperties();
        own.setSpaceBeforePts(20.0);
        own.setAlignment(Alignment.CENTER);
        derived.setParagraphProperties(own);

        ParagraphStyleProperties resolved = manager.resolveParagraphProperties(new ParagraphStyleProperties(), "D").getValue();

        assertEquals(20.0, resolved.getSpaceBeforePts());
        assertEquals(Alignment.CENTER, resolved.getAlignment());
        assertEquals(0.0, resolved.getSpaceAfterPts());
    }

    @Test
    void resolvingUnknownStyleReturnsCopyOfStart() {
        CharacterStyleProperties start = new CharacterStyleProperties();
        start.setFontName("Arial");

        CharacterStyleProperties resolved = manager.resolveCharacterProperties(start, "Missing").getValue();

        assertEquals(start, resolved);
        resolved.setFontName("Times");
        assertEquals("Arial", start.getFontName());
    }

    @Test
    void inheritanceCycleIsDetected() {
        manager.createParagraphStyle("A").getValue().setBaseStyle("B");
        manager.createParagraphStyle("B").getValue().setBaseStyle("A");

        Result<ParagraphStyleProperties> resolved = manager.resolveParagraphProperties(null, "A");
        assertEquals(ErrorCode.STYLE_INHERITANCE_CYCLE, resolved.getError().getCode());

        Result<Void> validation = manager.validateAllStyles();
        assertEquals(ErrorCode.VALIDATION_FAILED, validation.getError().getCode());
        assertEquals(ErrorCode.STYLE_INHERITANCE_CYCLE, validation.getError().getRootCause().getCode());
    }

    @Test
    void validationReportsMissingBaseStyle() {
        manager.createCharacterStyle("Orphan").getValue().setBaseStyle("Ghost");

        Result<Void> validation = manager.validateAllStyles();

        assertEquals(ErrorCode.STYLE_DEPENDENCY_MISSING, validation.getError().getCause().getCode());
    }

    @Test
    void baseStyleCannotBeRemovedWhileReferenced() {
        manager.createParagraphStyle("Base");
        manager.createParagraphStyle("Child").getValue().setBaseStyle("Base");

        assertEquals(ErrorCode.STYLE_DEPENDENCY_MISSING, manager.removeStyle("Base").getError().getCode());
        manager.createParagraphStyle("Other");
        manager.getStyle("Child").getValue().setBaseStyle("Other");
        assertTrue(manager.removeStyle("Base").isOk());
        assertTrue(manager.removeStyle("Child").isOk());
        assertTrue(manager.removeStyle("Other").isOk());
        assertEquals(ErrorCode.STYLE_NOT_FOUND, manager.removeStyle("Base").getError().getCode());
    }

    @Test
    void registerStyleValidatesFirst() {
        Style style = new Style("", StyleType.PARAGRAPH);
        assertTrue(manager.registerStyle(style).isFailed());

        Style valid = new Style("Quote", StyleType.PARAGRAPH);
        valid.setAlignment(Alignment.CENTER);
        assertTrue(manager.registerStyle(valid).isOk());
        assertTrue(manager.hasStyle("Quote"));
    }

    @Test
    void styleSetsRequireExistingStyles() {
        manager.createParagraphStyle("Body");
        StyleSet set = new StyleSet("Report").addStyle("Body").addStyle("Missing");

        assertEquals(ErrorCode.STYLE_NOT_FOUND, manager.registerStyleSet(set).getError().getCode());
        assertFalse(manager.hasStyleSet("Report"));

        manager.createCharacterStyle("Missing");
        assertTrue(manager.registerStyleSet(set).isOk());
        assertEquals(ErrorCode.STYLE_ALREADY_EXISTS, manager.registerStyleSet(set).getError().getCode());
        assertEquals(Arrays.asList("Report"), manager.listStyleSets());

        StyleSet copy = manager.getStyleSet("Report").getValue();
        copy.addStyle("Other");
        assertEquals(2, manager.getStyleSet("Report").getValue().getIncludedStyles().size());

        assertTrue(manager.removeStyleSet("Report").isOk());
        assertEquals(ErrorCode.STYLE_NOT_FOUND, manager.removeStyleSet("Report").getError().getCode());
    }

    @Test
    void compareStylesListsDifferences() {
        manager.loadBuiltInStyles(BuiltInStyleCategory.HEADING);

        String report = manager.compareStyles("Heading 1", "Heading 2").getValue();

        assertTrue(report.startsWith("样式对比: 'Heading 1' vs 'Heading 2'"));
        assertTrue(report.contains("字号: 16.0 vs 14.0"));
        assertFalse(report.contains("字体"));

        String same = manager.compareStyles("Heading 1", "Heading 1").getValue();
        assertTrue(same.contains("未发现差异"));

        assertEquals(ErrorCode.STYLE_NOT_FOUND, manager.compareStyles("Heading 1", "Nope").getError().getCode());
    }

    @Test
    void compareShowsUnsetValues() {
        manager.createParagraphStyle("Plain");
        manager.createCharacterStyle("Mono").getValue().setFont("Consolas", 10);

        String report = manager.compareStyles("Plain", "Mono").getValue();

        assertTrue(report.contains("类型: PARAGRAPH vs CHARACTER"));
        assertTrue(report.contains("字体: (未设置) vs Consolas"));
    }

    @Test
    void stylesXmlContainsEveryStyleInOrder() {
        manager.loadBuiltInStyles(BuiltInStyleCategory.BODY_TEXT);
        manager.loadBuiltInStyles(BuiltInStyleCategory.TECHNICAL);

        String xml = manager.generateStylesXml();

        assertTrue(xml.startsWith("<?xml"));
        assertTrue(xml.contains("<w:styles xmlns:w=\"http://schemas.openxmlformats.org/wordprocessingml/2006/main\">"));
        int code = xml.indexOf("w:styleId=\"Code\"");
        int normal = xml.indexOf("w:styleId=\"Normal\"");
        assertTrue(code > 0 && normal > code);
        assertTrue(xml.trim().endsWith("</w:styles>"));
    }

    @Test
    void defaultConstructorUsesLoggingHandler() {
        StyleManager logging = new StyleManager();
        Result<Style> missing = logging.getStyle("Nope");
        assertNotNull(missing.getError());
    }
}
