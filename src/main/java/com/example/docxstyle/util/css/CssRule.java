package com.example.docxstyle.util.css;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一条CSS规则，声明按添加顺序输出
 */
class CssRule {

    private final String selector;
    private final Map<String, String> declarations = new LinkedHashMap<>();

    CssRule(String selector) {
        this.selector = selector;
    }

    /**
     * 添加声明；value 为null时忽略
     */
    CssRule decl(String property, String value) {
        if (value != null) {
            declarations.put(property, value);
        }
        return this;
    }

    boolean isEmpty() {
        return declarations.isEmpty();
    }

    void appendTo(StringBuilder out) {
        out.append(selector).append(" {\n");
        for (Map.Entry<String, String> e : declarations.entrySet()) {
            out.append("  ").append(e.getKey()).append(": ").append(e.getValue()).append(";\n");
        }
        out.append("}\n");
    }

    /**
     * CSS字符串字面量（双引号，转义反斜杠和引号）
     */
    static String quote(String text) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' || c == '\\') {
                sb.append('\\').append(c);
            } else if (c == '\n') {
                sb.append("\\A ");
            } else if (c == '\t') {
                sb.append("\\9 ");
            } else {
                sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
