package com.example.docxstyle.util.numbering;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NumberingCounterTest {

    private NumberingCounter counter;

    @BeforeEach
    void setUp() {
        counter = new NumberingCounter(NumberingFixtures.table());
    }

    @Test
    @DisplayName("更高级别出现后重置下级计数")
    void resetsDeeperLevels() {
        assertThat(counter.next("1", 0)).contains("1.");
        assertThat(counter.next("1", 1)).contains("a)");
        assertThat(counter.next("1", 1)).contains("b)");
        assertThat(counter.next("1", 0)).contains("2.");
        assertThat(counter.next("1", 1)).contains("a)");
    }

    @Test
    @DisplayName("多级模板引用上级当前值；lvlRestart=0 的级别从不重置")
    void multiLevelTemplateAndNoRestart() {
        assertThat(counter.next("5", 0)).contains("1.");
        assertThat(counter.next("5", 1)).contains("1.1.");
        assertThat(counter.next("5", 2)).contains("(i)");
        assertThat(counter.next("5", 1)).contains("1.2.");
        assertThat(counter.next("5", 2)).contains("(ii)");
        assertThat(counter.next("5", 0)).contains("2.");
        assertThat(counter.next("5", 1)).contains("2.1.");
        assertThat(counter.next("5", 2)).contains("(iii)");
    }

    @Test
    @DisplayName("startOverride 决定第一项的序号")
    void honoursStartOverride() {
        assertThat(counter.next("2", 0)).contains("5.");
        assertThat(counter.next("2", 0)).contains("6.");
    }

    @Test
    @DisplayName("法律格式下引用的上级显示为阿拉伯数字")
    void legalNumberingUsesArabicForParents() {
        assertThat(counter.next("6", 0)).contains("I.");
        assertThat(counter.next("6", 1)).contains("1.1.");
    }

    @Test
    @DisplayName("不同 numId 各自计数")
    void instancesCountIndependently() {
        counter.next("1", 0);
        counter.next("1", 0);

        assertThat(counter.next("4", 0)).contains("III:");
        assertThat(counter.next("1", 0)).contains("3.");
    }

    @Test
    @DisplayName("项目符号返回符号字符，不可解析的级别返回空")
    void bulletsAndUnresolvable() {
        assertThat(counter.next("3", 0)).contains("•");
        assertThat(counter.next("99", 0)).isEmpty();
        assertThat(counter.next("9", 0)).isEmpty();
    }
}
