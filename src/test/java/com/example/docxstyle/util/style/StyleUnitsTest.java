package com.example.docxstyle.util.style;

import com.example.docxstyle.util.style.error.ErrorCode;
import com.example.docxstyle.util.style.error.Result;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StyleUnitsTest {

    @Test
    void parsesLengthsIntoPoints() {
        assertEquals(12.0, StyleUnits.parseValueWithUnit("12pt").getValue(), 1e-9);
        assertEquals(12.0, StyleUnits.parseValueWithUnit("16px").getValue(), 1e-9);
        assertEquals(72.0, StyleUnits.parseValueWithUnit("1in").getValue(), 1e-9);
        assertEquals(28.35, StyleUnits.parseValueWithUnit("1cm").getValue(), 1e-9);
        assertEquals(28.35, StyleUnits.parseValueWithUnit("10mm").getValue(), 1e-9);
        assertEquals(10.0, StyleUnits.parseValueWithUnit("10").getValue(), 1e-9);
        assertEquals(10.5, StyleUnits.parseValueWithUnit(" 10.5 PT ").getValue(), 1e-9);
    }

    @Test
    void rejectsUnknownUnitsAndMissingNumbers() {
        Result<Double> unit = StyleUnits.parseValueWithUnit("12em");
        assertTrue(unit.isFailed());
        assertEquals(ErrorCode.INVALID_ARGUMENT, unit.getError().getCode());

        assertTrue(StyleUnits.parseValueWithUnit("pt").isFailed());
        assertTrue(StyleUnits.parseValueWithUnit("").isFailed());
        assertTrue(StyleUnits.parseValueWithUnit(null).isFailed());
        assertTrue(StyleUnits.parseValueWithUnit("1.2.3pt").isFailed());
    }

    @Test
    void formatsPointsInRequestedUnit() {
        assertEquals("1in", StyleUnits.formatValueWithUnit(72, "in").getValue());
        assertEquals("12pt", StyleUnits.formatValueWithUnit(12, "pt").getValue());
        assertEquals("1.5pt", StyleUnits.formatValueWithUnit(1.5, "pt").getValue());
        assertTrue(StyleUnits.formatValueWithUnit(12, "em").isFailed());
    }

    @Test
    void parsesPercentages() {
        assertEquals(0.5, StyleUnits.parsePercentage("50%").getValue(), 1e-9);
        assertEquals(1.5, StyleUnits.parsePercentage("150%").getValue(), 1e-9);
        assertEquals(1.0, StyleUnits.parsePercentage("100%").getValue(), 1e-9);
        assertTrue(StyleUnits.parsePercentage("50").isFailed());
        assertTrue(StyleUnits.parsePercentage("abc%").isFailed());
        assertTrue(StyleUnits.parsePercentage("%").isFailed());
    }

    @Test
    void parsesNamedAndHexColors() {
        assertEquals("FF0000", StyleUnits.parseColor("red").getValue());
        assertEquals("FF0000", StyleUnits.parseColor("#FF0000").getValue());
        assertEquals("000080", StyleUnits.parseColor("#000080").getValue());
        assertEquals("ABCDEF", StyleUnits.parseColor("abcdef").getValue());

        Result<String> invalid = StyleUnits.parseColor("#12345");
        assertTrue(invalid.isFailed());
        assertEquals(ErrorCode.INVALID_COLOR_FORMAT, invalid.getError().getCode());
        assertTrue(StyleUnits.parseColor("GGGGGG").isFailed());
        assertTrue(StyleUnits.parseColor(" ").isFailed());
    }

    @Test
    void normalizesHexColors() {
        assertEquals("00FF7F", StyleUnits.normalizeHexColor("#00ff7f"));
        assertNull(StyleUnits.normalizeHexColor("00ff7"));
        assertNull(StyleUnits.normalizeHexColor(null));
    }
}
