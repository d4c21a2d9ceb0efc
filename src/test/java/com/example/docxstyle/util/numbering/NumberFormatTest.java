package com.example.docxstyle.util.numbering;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NumberFormatTest {

    @Test
    @DisplayName("Word格式名映射到CSS计数器样式，未知格式降级为 decimal")
    void mapsWordFormats() {
        assertThat(NumberFormat.fromWord("lowerRoman").getCssCounterStyle()).isEqualTo("lower-roman");
        assertThat(NumberFormat.fromWord("upperLetter").getCssCounterStyle()).isEqualTo("docx-upper-letter");
        assertThat(NumberFormat.fromWord("upperLetter").isLetter()).isTrue();
        assertThat(NumberFormat.LOWER_ROMAN.isLetter()).isFalse();
        assertThat(NumberFormat.fromWord("ordinal")).isEqualTo(NumberFormat.DECIMAL);
        assertThat(NumberFormat.fromWord(null)).isEqualTo(NumberFormat.DECIMAL);
        assertThat(NumberFormat.isSupported("japaneseCounting")).isFalse();
        assertThat(NumberFormat.BULLET.isCounter()).isFalse();
    }

    @Test
    @DisplayName("字母编号超过 z 后重复字母")
    void lettersRepeatAfterZ() {
        assertThat(NumberFormat.LOWER_LETTER.format(1)).isEqualTo("a");
        assertThat(NumberFormat.LOWER_LETTER.format(26)).isEqualTo("z");
        assertThat(NumberFormat.LOWER_LETTER.format(27)).isEqualTo("aa");
        assertThat(NumberFormat.UPPER_LETTER.format(28)).isEqualTo("BB");
    }

    @Test
    @DisplayName("罗马数字与前导零")
    void romanAndLeadingZero() {
        assertThat(NumberFormat.UPPER_ROMAN.format(1994)).isEqualTo("MCMXCIV");
        assertThat(NumberFormat.LOWER_ROMAN.format(4)).isEqualTo("iv");
        assertThat(NumberFormat.DECIMAL_ZERO.format(7)).isEqualTo("07");
        assertThat(NumberFormat.DECIMAL_ZERO.format(12)).isEqualTo("12");
    }
}
