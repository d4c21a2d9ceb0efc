package com.example.docxstyle.util.style;

import lombok.Value;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 主题信息：配色方案（角色 → 十六进制颜色，不含#）与主/次字体
 */
@Value
public class ThemeInfo {

    public static final String DEFAULT_MAJOR_FONT = "Calibri Light";
    public static final String DEFAULT_MINOR_FONT = "Calibri";

    private static final Map<String, String> ROLE_ALIASES = new HashMap<>();

    static {
        ROLE_ALIASES.put("tx1", "dk1");
        ROLE_ALIASES.put("text1", "dk1");
        ROLE_ALIASES.put("bg1", "lt1");
        ROLE_ALIASES.put("background1", "lt1");
        ROLE_ALIASES.put("tx2", "dk2");
        ROLE_ALIASES.put("text2", "dk2");
        ROLE_ALIASES.put("bg2", "lt2");
        ROLE_ALIASES.put("background2", "lt2");
        ROLE_ALIASES.put("dark1", "dk1");
        ROLE_ALIASES.put("light1", "lt1");
        ROLE_ALIASES.put("dark2", "dk2");
        ROLE_ALIASES.put("light2", "lt2");
        ROLE_ALIASES.put("hyperlink", "hlink");
        ROLE_ALIASES.put("followedHyperlink", "folHlink");
    }

    String majorFont;
    String minorFont;
    Map<String, String> colors;

    public ThemeInfo(String majorFont, String minorFont, Map<String, String> colors) {
        this.majorFont = majorFont != null ? majorFont : DEFAULT_MAJOR_FONT;
        this.minorFont = minorFont != null ? minorFont : DEFAULT_MINOR_FONT;
        this.colors = colors == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(colors));
    }

    public static ThemeInfo defaults() {
        return new ThemeInfo(DEFAULT_MAJOR_FONT, DEFAULT_MINOR_FONT, null);
    }

    /**
     * 按角色取颜色，支持 tx1/bg1 等别名
     *
     * @return 十六进制颜色（不含#），未定义时返回null
     */
    public String color(String role) {
        if (role == null) {
            return null;
        }
        String value = colors.get(role);
        if (value == null) {
            String alias = ROLE_ALIASES.get(role);
            value = alias != null ? colors.get(alias) : null;
        }
        return value;
    }

    /**
     * 主题字体引用（majorHAnsi / minorEastAsia 等）→ 字体名
     */
    public String font(String themeFontRef) {
        if (themeFontRef == null) {
            return null;
        }
        return themeFontRef.startsWith("major") ? majorFont : minorFont;
    }
}
