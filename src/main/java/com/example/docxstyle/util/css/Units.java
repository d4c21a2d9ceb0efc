package com.example.docxstyle.util.css;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 长度单位换算
 *
 * twip（1/20 磅）和边框宽度（1/8 磅）的换算是精确的十进制除法，不使用浮点数。
 */
public final class Units {

    private static final BigDecimal TWIPS_PER_POINT = BigDecimal.valueOf(20);
    private static final BigDecimal EIGHTHS_PER_POINT = BigDecimal.valueOf(8);
    private static final BigDecimal HALF_POINTS_PER_POINT = BigDecimal.valueOf(2);
    private static final BigDecimal AUTO_LINE_UNIT = BigDecimal.valueOf(240);

    private Units() {
    }

    /**
     * twip → 磅，如 240 → 12.0
     */
    public static BigDecimal twipsToPoints(int twips) {
        return BigDecimal.valueOf(twips).setScale(1).divide(TWIPS_PER_POINT);
    }

    /**
     * 1/8 磅 → 磅，如 8 → 1.0
     */
    public static BigDecimal eighthsToPoints(int eighths) {
        return BigDecimal.valueOf(eighths).setScale(1).divide(EIGHTHS_PER_POINT);
    }

    /**
     * 半磅（w:sz）→ 磅
     */
    public static BigDecimal halfPointsToPoints(int halfPoints) {
        return BigDecimal.valueOf(halfPoints).setScale(1).divide(HALF_POINTS_PER_POINT);
    }

    /**
     * auto 行距（240 = 单倍行距）→ 无单位行高倍数，保留4位小数
     */
    public static BigDecimal lineMultiplier(int line) {
        return BigDecimal.valueOf(line).divide(AUTO_LINE_UNIT, 4, RoundingMode.HALF_UP);
    }

    /**
     * 输出为CSS数值：去掉多余的0，不使用科学计数法
     */
    public static String format(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() < 0) {
            stripped = stripped.setScale(0);
        }
        return stripped.toPlainString();
    }

    public static String pt(BigDecimal value) {
        return format(value) + "pt";
    }

    public static String twipsPt(int twips) {
        return pt(twipsToPoints(twips));
    }
}
