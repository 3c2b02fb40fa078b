package com.example.docxstyle.util.style;

import com.example.docxstyle.util.style.error.ErrorCode;
import com.example.docxstyle.util.style.error.ErrorContext;
import com.example.docxstyle.util.style.error.Result;
import com.example.docxstyle.util.style.error.StyleError;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 长度、百分比、颜色字面量解析
 *
 * <p>长度统一换算为磅（pt）：无单位/pt ×1，px ×0.75，in ×72，cm ×28.35，mm ×2.835</p>
 */
public class StyleUnits {

    private static final Map<String, Double> UNIT_TO_POINTS = new HashMap<>();
    private static final Map<String, String> NAMED_COLORS = new HashMap<>();

    static {
        UNIT_TO_POINTS.put("", 1.0);
        UNIT_TO_POINTS.put("pt", 1.0);
        UNIT_TO_POINTS.put("px", 0.75);
        UNIT_TO_POINTS.put("in", 72.0);
        UNIT_TO_POINTS.put("cm", 28.35);
        UNIT_TO_POINTS.put("mm", 2.835);

        NAMED_COLORS.put("black", "000000");
        NAMED_COLORS.put("white", "FFFFFF");
        NAMED_COLORS.put("red", "FF0000");
        NAMED_COLORS.put("green", "008000");
        NAMED_COLORS.put("blue", "0000FF");
        NAMED_COLORS.put("yellow", "FFFF00");
        NAMED_COLORS.put("cyan", "00FFFF");
        NAMED_COLORS.put("magenta", "FF00FF");
    }

    private StyleUnits() {
    }

    /**
     * 解析带单位的长度，返回磅值
     *
     * @param text 例如 "12pt"、"16px"、"1in"、"2.5cm"、"10"
     */
    public static Result<Double> parseValueWithUnit(String text) {
        if (text == null || text.trim().isEmpty()) {
            return invalid("长度值为空", text);
        }
        String value = text.trim();

        int split = 0;
        while (split < value.length()) {
            char c = value.charAt(split);
            if (Character.isDigit(c) || c == '.' || c == '-' || c == '+') {
                split++;
            } else {
                break;
            }
        }

        String numberPart = value.substring(0, split);
        String unitPart = value.substring(split).trim().toLowerCase(Locale.ROOT);
        if (numberPart.isEmpty()) {
            return invalid("长度值缺少数字部分", text);
        }

        Double factor = UNIT_TO_POINTS.get(unitPart);
        if (factor == null) {
            return invalid("不支持的长度单位: " + unitPart, text);
        }

        double number;
        try {
            number = Double.parseDouble(numberPart);
        } catch (NumberFormatException e) {
            return invalid("无法解析数字: " + numberPart, text);
        }
        return Result.ok(number * factor);
    }

    /**
     * 把磅值格式化为目标单位的字面量，例如 (72, "in") → "1in"
     */
    public static Result<String> formatValueWithUnit(double points, String unit) {
        String key = unit == null ? "" : unit.trim().toLowerCase(Locale.ROOT);
        Double factor = UNIT_TO_POINTS.get(key);
        if (factor == null) {
            return invalid("不支持的长度单位: " + unit, unit);
        }
        double converted = points / factor;
        String number;
        if (converted == Math.rint(converted) && !Double.isInfinite(converted)) {
            number = String.valueOf((long) converted);
        } else {
            number = String.valueOf(converted);
        }
        return Result.ok(number + key);
    }

    /**
     * 解析百分比，"50%" → 0.5
     */
    public static Result<Double> parsePercentage(String text) {
        if (text == null) {
            return invalid("百分比为空", null);
        }
        String value = text.trim();
        if (value.length() < 2 || !value.endsWith("%")) {
            return invalid("百分比必须以%结尾", text);
        }
        try {
            return Result.ok(Double.parseDouble(value.substring(0, value.length() - 1).trim()) / 100.0);
        } catch (NumberFormatException e) {
            return invalid("无法解析百分比: " + text, text);
        }
    }

    /**
     * 解析颜色：命名颜色或 6 位十六进制（可带 #），返回大写 6 位十六进制
     */
    public static Result<String> parseColor(String text) {
        if (text == null || text.trim().isEmpty()) {
            return Result.fail(new StyleError(ErrorCode.INVALID_COLOR_FORMAT, "颜色值为空",
                    ErrorContext.forOperation("parse_color")));
        }
        String value = text.trim();
        String named = NAMED_COLORS.get(value.toLowerCase(Locale.ROOT));
        if (named != null) {
            return Result.ok(named);
        }
        String normalized = normalizeHexColor(value);
        if (normalized == null) {
            return Result.fail(new StyleError(ErrorCode.INVALID_COLOR_FORMAT, "无效的颜色: " + text,
                    ErrorContext.forOperation("parse_color").with("value", text)));
        }
        return Result.ok(normalized);
    }

    /**
     * 校验 6 位十六进制颜色（可带 #，大小写不敏感），合法时返回去掉 # 的大写形式，否则返回 null
     */
    public static String normalizeHexColor(String color) {
        if (color == null) {
            return null;
        }
        String hex = color.startsWith("#") ? color.substring(1) : color;
        if (hex.length() != 6) {
            return null;
        }
        for (int i = 0; i < hex.length(); i++) {
            if (Character.digit(hex.charAt(i), 16) < 0) {
                return null;
            }
        }
        return hex.toUpperCase(Locale.ROOT);
    }

    private static <T> Result<T> invalid(String message, String value) {
        return Result.fail(new StyleError(ErrorCode.INVALID_ARGUMENT, message,
                ErrorContext.forOperation("parse_unit").with("value", value)));
    }
}
