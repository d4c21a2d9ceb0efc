package com.example.docxstyle.util.numbering;

import java.util.HashMap;
import java.util.Map;

/**
 * Symbol / Wingdings 字体私有区（PUA）项目符号 → Unicode 字符
 */
public final class BulletGlyphs {

    public static final String DEFAULT_BULLET = "•";

    private static final Map<Character, String> PUA_GLYPHS = new HashMap<>();

    static {
        PUA_GLYPHS.put('\uF0B7', "•");
        PUA_GLYPHS.put('\uF0A7', "▪");
        PUA_GLYPHS.put('\uF06F', "○");
        PUA_GLYPHS.put('\uF0D8', "➢");
        PUA_GLYPHS.put('\uF0FC', "✓");
        PUA_GLYPHS.put('\uF076', "❖");
        PUA_GLYPHS.put('\uF0A8', "□");
        PUA_GLYPHS.put('\uF06E', "■");
        PUA_GLYPHS.put('\uF0E0', "➤");
        PUA_GLYPHS.put('\uF02D', "–");
    }

    private BulletGlyphs() {
    }

    /**
     * 将模板文本中的私有区字符映射为可显示字符；空文本返回默认圆点
     */
    public static String toDisplay(String text) {
        if (text == null || text.isEmpty()) {
            return DEFAULT_BULLET;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            String mapped = PUA_GLYPHS.get(c);
            if (mapped != null) {
                sb.append(mapped);
            } else if (c >= '\uE000' && c <= '\uF8FF') {
                sb.append(DEFAULT_BULLET);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
