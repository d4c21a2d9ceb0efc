package com.example.docxstyle.util.style;

/**
 * 制表位前导符 → 显示字符
 */
public final class LeaderChars {

    public static final String DEFAULT = ".";

    private LeaderChars() {
    }

    /**
     * @param leader w:leader 取值（名称或旧式数字编码）
     * @return 显示字符；none 返回null
     */
    public static String fromWord(String leader) {
        if (leader == null) {
            return null;
        }
        switch (leader) {
            case "dot":
            case "1":
                return ".";
            case "hyphen":
            case "2":
                return "-";
            case "underscore":
            case "3":
                return "_";
            case "heavy":
            case "4":
                return "=";
            case "middleDot":
            case "5":
                return "·";
            case "none":
            case "0":
                return null;
            default:
                return DEFAULT;
        }
    }
}
