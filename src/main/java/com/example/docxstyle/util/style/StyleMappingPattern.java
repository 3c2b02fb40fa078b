package com.example.docxstyle.util.style;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 样式映射的匹配模式
 *
 * <ul>
 *   <li>headingN / hN（N=1..6）：当前样式为 "Heading N" 或 "HeadingN" 的段落</li>
 *   <li>heading* / h*：当前样式以 Heading 开头的段落</li>
 *   <li>table / tables：所有表格</li>
 *   <li>normal / body：无样式或样式为 Normal 的段落</li>
 *   <li>code：样式为 Code 的段落和文本片段</li>
 *   <li>其他：当前样式名与模式完全相同的段落、文本片段和表格</li>
 * </ul>
 */
public final class StyleMappingPattern {

    private static final Pattern HEADING_LEVEL = Pattern.compile("(?:heading|h)([1-6])");

    private enum Kind {
        HEADING_LEVEL,
        ANY_HEADING,
        TABLES,
        BODY,
        CODE,
        EXACT
    }

    private final String pattern;
    private final Kind kind;
    private final int headingLevel;

    private StyleMappingPattern(String pattern, Kind kind, int headingLevel) {
        this.pattern = pattern;
        this.kind = kind;
        this.headingLevel = headingLevel;
    }

    public static StyleMappingPattern parse(String pattern) {
        String key = pattern.trim().toLowerCase(Locale.ROOT);
        Matcher matcher = HEADING_LEVEL.matcher(key);
        if (matcher.matches()) {
            return new StyleMappingPattern(pattern, Kind.HEADING_LEVEL, Integer.parseInt(matcher.group(1)));
        }
        switch (key) {
            case "heading*":
            case "h*":
                return new StyleMappingPattern(pattern, Kind.ANY_HEADING, 0);
            case "table":
            case "tables":
                return new StyleMappingPattern(pattern, Kind.TABLES, 0);
            case "normal":
            case "body":
                return new StyleMappingPattern(pattern, Kind.BODY, 0);
            case "code":
                return new StyleMappingPattern(pattern, Kind.CODE, 0);
            default:
                return new StyleMappingPattern(pattern, Kind.EXACT, 0);
        }
    }

    public boolean matchesParagraph(String currentStyle) {
        switch (kind) {
            case HEADING_LEVEL:
                return currentStyle != null
                        && (currentStyle.equalsIgnoreCase("Heading " + headingLevel)
                        || currentStyle.equalsIgnoreCase("Heading" + headingLevel));
            case ANY_HEADING:
                return currentStyle != null && currentStyle.toLowerCase(Locale.ROOT).startsWith("heading");
            case BODY:
                return currentStyle == null || "Normal".equalsIgnoreCase(currentStyle);
            case CODE:
                return "Code".equalsIgnoreCase(currentStyle);
            case EXACT:
                return pattern.equals(currentStyle);
            default:
                return false;
        }
    }

    public boolean matchesRun(String currentStyle) {
        switch (kind) {
            case CODE:
                return "Code".equalsIgnoreCase(currentStyle);
            case EXACT:
                return pattern.equals(currentStyle);
            default:
                return false;
        }
    }

    public boolean matchesTable(String currentStyle) {
        switch (kind) {
            case TABLES:
                return true;
            case EXACT:
                return pattern.equals(currentStyle);
            default:
                return false;
        }
    }

    @Override
    public String toString() {
        return pattern;
    }
}
