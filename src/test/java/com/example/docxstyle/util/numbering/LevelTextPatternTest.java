package com.example.docxstyle.util.numbering;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LevelTextPatternTest {

    @Test
    @DisplayName("多级模板拆分为占位符与分隔符")
    void parsesMultiLevelTemplate() {
        LevelTextPattern pattern = LevelTextPattern.parse("%1.%2.");

        assertThat(pattern.getTokens()).containsExactly(
                new LevelTextPattern.Token(0, "", "", "."),
                new LevelTextPattern.Token(1, "", ".", ""));
        assertThat(pattern.render(level -> String.valueOf(level + 1))).isEqualTo("1.2.");
    }

    @Test
    @DisplayName("前缀文本只出现在第一个占位符上")
    void keepsPrefixAndSuffix() {
        LevelTextPattern pattern = LevelTextPattern.parse("Article %1 -");

        assertThat(pattern.getTokens()).hasSize(1);
        assertThat(pattern.getTokens().get(0).getLiteralBefore()).isEqualTo("Article ");
        assertThat(pattern.getTokens().get(0).getLiteralAfter()).isEqualTo(" -");
        assertThat(pattern.render(level -> "IV")).isEqualTo("Article IV -");
    }

    @Test
    @DisplayName("没有占位符的模板只有字面文本")
    void literalOnlyTemplate() {
        LevelTextPattern pattern = LevelTextPattern.parse("-");

        assertThat(pattern.isLiteralOnly()).isTrue();
        assertThat(pattern.getLiteral()).isEqualTo("-");
        assertThat(pattern.render(level -> "x")).isEqualTo("-");
    }

    @Test
    @DisplayName("% 后不是 1-9 时按普通文本处理")
    void percentWithoutDigitIsLiteral() {
        LevelTextPattern pattern = LevelTextPattern.parse("%0%");

        assertThat(pattern.isLiteralOnly()).isTrue();
        assertThat(pattern.getLiteral()).isEqualTo("%0%");
    }
}
