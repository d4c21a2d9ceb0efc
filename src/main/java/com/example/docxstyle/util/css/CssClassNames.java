package com.example.docxstyle.util.css;

import com.example.docxstyle.util.style.StyleKind;
import com.example.docxstyle.util.style.StyleRecord;
import com.example.docxstyle.util.style.StyleTable;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 样式id → CSS类名
 *
 * 规则：类型前缀 + 样式id（转小写，非 [a-z0-9] 字符替换为 "-"）。
 * 不同样式规范化后重名时，按文档顺序在后来者上追加 -2、-3 …，保证稳定且不冲突。
 * 样式表生成器与HTML渲染器共用同一个实例。
 */
public class CssClassNames {

    private final Map<StyleKind, Map<String, String>> classes = new EnumMap<>(StyleKind.class);

    public CssClassNames(StyleTable styles) {
        Set<String> used = new HashSet<>();
        for (StyleKind kind : StyleKind.values()) {
            Map<String, String> byId = new LinkedHashMap<>();
            for (StyleRecord record : styles.styles(kind).values()) {
                String base = kind.getClassPrefix() + sanitize(record.getId());
                String name = base;
                int suffix = 2;
                while (used.contains(name)) {
                    name = base + "-" + suffix++;
                }
                used.add(name);
                byId.put(record.getId(), name);
            }
            classes.put(kind, byId);
        }
    }

    /**
     * @return 类名；样式不存在时返回null
     */
    public String classFor(StyleKind kind, String styleId) {
        if (kind == null || styleId == null) {
            return null;
        }
        return classes.get(kind).get(styleId);
    }

    /**
     * 样式id规范化：转小写，非字母数字替换为 "-"
     */
    public static String sanitize(String id) {
        if (id == null || id.isEmpty()) {
            return "unnamed";
        }
        String lower = id.toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(lower.length());
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            sb.append((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') ? c : '-');
        }
        return sb.toString();
    }
}
