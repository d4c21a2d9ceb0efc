package com.example.docxstyle.util.numbering;

/**
 * 编号格式（w:numFmt）及其对应的CSS计数器样式
 *
 * 未支持的Word格式（中文/日文计数、序数词等）统一降级为 DECIMAL。
 * 字母格式使用样式表中定义的 symbolic 计数器样式，超过 z 后与 Word 一样重复字母。
 */
public enum NumberFormat {

    DECIMAL("decimal", "decimal"),
    DECIMAL_ZERO("decimalZero", "decimal-leading-zero"),
    LOWER_LETTER("lowerLetter", "docx-lower-letter"),
    UPPER_LETTER("upperLetter", "docx-upper-letter"),
    LOWER_ROMAN("lowerRoman", "lower-roman"),
    UPPER_ROMAN("upperRoman", "upper-roman"),
    BULLET("bullet", null),
    NONE("none", null);

    private static final String[] ROMAN_SYMBOLS = {"m", "cm", "d", "cd", "c", "xc", "l", "xl", "x", "ix", "v", "iv", "i"};
    private static final int[] ROMAN_VALUES = {1000, 900, 500, 400, 100, 90, 50, 40, 10, 9, 5, 4, 1};

    private final String wordName;
    private final String cssCounterStyle;

    NumberFormat(String wordName, String cssCounterStyle) {
        this.wordName = wordName;
        this.cssCounterStyle = cssCounterStyle;
    }

    public String getWordName() { return wordName; }

    /**
     * CSS list-style / counter() 使用的计数器样式；项目符号与 none 返回null
     */
    public String getCssCounterStyle() { return cssCounterStyle; }

    public boolean isCounter() {
        return cssCounterStyle != null;
    }

    public boolean isLetter() {
        return this == LOWER_LETTER || this == UPPER_LETTER;
    }

    /**
     * Word格式名 → 枚举，缺省或未知格式返回 DECIMAL
     */
    public static NumberFormat fromWord(String value) {
        if (value == null) {
            return DECIMAL;
        }
        for (NumberFormat format : values()) {
            if (format.wordName.equals(value)) {
                return format;
            }
        }
        return DECIMAL;
    }

    /**
     * 是否为直接支持的格式（否则会被降级）
     */
    public static boolean isSupported(String value) {
        if (value == null) {
            return true;
        }
        for (NumberFormat format : values()) {
            if (format.wordName.equals(value)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 按格式输出序号文本（项目符号与 none 返回空串）
     */
    public String format(int value) {
        switch (this) {
            case DECIMAL:
                return String.valueOf(value);
            case DECIMAL_ZERO:
                return value >= 0 && value < 10 ? "0" + value : String.valueOf(value);
            case LOWER_LETTER:
                return toLetters(value);
            case UPPER_LETTER:
                return toLetters(value).toUpperCase();
            case LOWER_ROMAN:
                return toRoman(value);
            case UPPER_ROMAN:
                return toRoman(value).toUpperCase();
            default:
                return "";
        }
    }

    /**
     * Word 的字母编号：a..z, aa..zz, aaa...（重复字母，不是进位制）
     */
    static String toLetters(int value) {
        if (value <= 0) {
            return String.valueOf(value);
        }
        char letter = (char) ('a' + (value - 1) % 26);
        int repeat = (value - 1) / 26 + 1;
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < repeat; i++) {
            sb.append(letter);
        }
        return sb.toString();
    }

    static String toRoman(int value) {
        if (value <= 0 || value >= 4000) {
            return String.valueOf(value);
        }
        StringBuilder sb = new StringBuilder();
        int remaining = value;
        for (int i = 0; i < ROMAN_VALUES.length; i++) {
            while (remaining >= ROMAN_VALUES[i]) {
                sb.append(ROMAN_SYMBOLS[i]);
                remaining -= ROMAN_VALUES[i];
            }
        }
        return sb.toString();
    }
}
