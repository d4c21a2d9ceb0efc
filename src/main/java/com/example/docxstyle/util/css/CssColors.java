package com.example.docxstyle.util.css;

import java.util.HashMap;
import java.util.Map;

/**
 * Word 高亮色名称 → CSS 颜色
 */
final class CssColors {

    private static final Map<String, String> HIGHLIGHTS = new HashMap<>();

    static {
        HIGHLIGHTS.put("yellow", "#ffff00");
        HIGHLIGHTS.put("green", "#00ff00");
        HIGHLIGHTS.put("cyan", "#00ffff");
        HIGHLIGHTS.put("magenta", "#ff00ff");
        HIGHLIGHTS.put("blue", "#0000ff");
        HIGHLIGHTS.put("red", "#ff0000");
        HIGHLIGHTS.put("darkBlue", "#000080");
        HIGHLIGHTS.put("darkCyan", "#008080");
        HIGHLIGHTS.put("darkGreen", "#008000");
        HIGHLIGHTS.put("darkMagenta", "#800080");
        HIGHLIGHTS.put("darkRed", "#800000");
        HIGHLIGHTS.put("darkYellow", "#808000");
        HIGHLIGHTS.put("darkGray", "#808080");
        HIGHLIGHTS.put("lightGray", "#c0c0c0");
        HIGHLIGHTS.put("black", "#000000");
        HIGHLIGHTS.put("white", "#ffffff");
    }

    private CssColors() {
    }

    static String highlight(String name) {
        if (name == null || "none".equals(name)) {
            return null;
        }
        return HIGHLIGHTS.get(name);
    }

    /**
     * 十六进制颜色值加 #；非法值返回null
     */
    static String hex(String value) {
        if (value == null || !value.matches("[0-9A-Fa-f]{6}")) {
            return null;
        }
        return "#" + value.toUpperCase();
    }
}
