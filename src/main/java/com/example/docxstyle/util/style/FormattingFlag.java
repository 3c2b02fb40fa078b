package com.example.docxstyle.util.style;

/**
 * 字符格式位标志，多个标志按位或组合成掩码
 */
public enum FormattingFlag {
    BOLD(1),
    ITALIC(1 << 1),
    UNDERLINE(1 << 2),
    STRIKETHROUGH(1 << 3),
    SMALLCAPS(1 << 4),
    SHADOW(1 << 5),
    SUBSCRIPT(1 << 6),
    SUPERSCRIPT(1 << 7);

    private final int mask;

    FormattingFlag(int mask) {
        this.mask = mask;
    }

    public int mask() {
        return mask;
    }

    public boolean isSetIn(int flags) {
        return (flags & mask) != 0;
    }

    public static int combine(FormattingFlag... flags) {
        int result = 0;
        for (FormattingFlag flag : flags) {
            result |= flag.mask;
        }
        return result;
    }
}
