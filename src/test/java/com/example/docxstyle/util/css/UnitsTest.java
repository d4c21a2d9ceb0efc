package com.example.docxstyle.util.css;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class UnitsTest {

    @Test
    @DisplayName("twip 与 1/8 磅的换算是精确的")
    void exactConversions() {
        assertThat(Units.twipsToPoints(240)).isEqualByComparingTo(new BigDecimal("12.0"));
        assertThat(Units.eighthsToPoints(8)).isEqualByComparingTo(new BigDecimal("1.0"));
        assertThat(Units.eighthsToPoints(4)).isEqualByComparingTo(new BigDecimal("0.5"));
        assertThat(Units.halfPointsToPoints(21)).isEqualByComparingTo(new BigDecimal("10.5"));
        assertThat(Units.twipsToPoints(1)).isEqualByComparingTo(new BigDecimal("0.05"));
    }

    @Test
    @DisplayName("CSS数值去掉多余的0")
    void formatsForCss() {
        assertThat(Units.twipsPt(240)).isEqualTo("12pt");
        assertThat(Units.twipsPt(1134)).isEqualTo("56.7pt");
        assertThat(Units.twipsPt(0)).isEqualTo("0pt");
        assertThat(Units.format(Units.lineMultiplier(276))).isEqualTo("1.15");
        assertThat(Units.format(Units.lineMultiplier(240))).isEqualTo("1");
    }
}
