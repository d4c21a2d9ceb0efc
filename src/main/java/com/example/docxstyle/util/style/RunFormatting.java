package com.example.docxstyle.util.style;

import lombok.Builder;
import lombok.Value;

/**
 * 字符格式（w:rPr）
 *
 * 所有属性均为可空：null 表示"未设置，继承父样式"，与显式 false 区分。
 * sizeHalfPoints 单位为半磅，color 为不带 # 的十六进制值。
 */
@Value
@Builder(toBuilder = true)
public class RunFormatting {

    String fontAscii;
    String fontHAnsi;
    String fontEastAsia;
    String fontComplex;
    String fontAsciiTheme;
    Integer sizeHalfPoints;
    Boolean bold;
    Boolean italic;
    String underline;
    Boolean strike;
    Boolean caps;
    Boolean smallCaps;
    String color;
    String themeColor;
    String highlight;

    public static final RunFormatting EMPTY = RunFormatting.builder().build();

    /**
     * 逐属性合并：override 中已设置的属性覆盖 base，返回新对象
     */
    public static RunFormatting merge(RunFormatting base, RunFormatting override) {
        if (base == null) {
            return override != null ? override : EMPTY;
        }
        if (override == null) {
            return base;
        }
        return RunFormatting.builder()
                .fontAscii(pick(base.fontAscii, override.fontAscii))
                .fontHAnsi(pick(base.fontHAnsi, override.fontHAnsi))
                .fontEastAsia(pick(base.fontEastAsia, override.fontEastAsia))
                .fontComplex(pick(base.fontComplex, override.fontComplex))
                // 显式字体优先于主题字体引用
                .fontAsciiTheme(override.fontAscii != null ? override.fontAsciiTheme : pick(base.fontAsciiTheme, override.fontAsciiTheme))
                .sizeHalfPoints(pick(base.sizeHalfPoints, override.sizeHalfPoints))
                .bold(pick(base.bold, override.bold))
                .italic(pick(base.italic, override.italic))
                .underline(pick(base.underline, override.underline))
                .strike(pick(base.strike, override.strike))
                .caps(pick(base.caps, override.caps))
                .smallCaps(pick(base.smallCaps, override.smallCaps))
                .color(pick(base.color, override.color))
                .themeColor(override.color != null ? override.themeColor : pick(base.themeColor, override.themeColor))
                .highlight(pick(base.highlight, override.highlight))
                .build();
    }

    public boolean isEmpty() {
        return this.equals(EMPTY);
    }

    private static <T> T pick(T base, T override) {
        return override != null ? override : base;
    }
}
