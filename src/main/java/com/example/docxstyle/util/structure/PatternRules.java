package com.example.docxstyle.util.structure;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 特殊段落形状规则表（有序）
 *
 * 每条规则独立计数；打标签时按表中顺序取第一条已提升的匹配规则。
 * 新增结构线索只需在表中追加一行。
 */
public final class PatternRules {

    public static final String WORD_FOR_WORD = "word_for_word";
    public static final String WORD_COMMA = "word_comma";
    public static final String WORD_PARENTHESIS = "word_parenthesis";

    public static final int DEFAULT_MIN_OCCURRENCES = 2;

    // ==================== 规则定义 ====================

    /**
     * 单词 + for + 其余文本，如 "Rationale for the change"
     */
    private static final Pattern WORD_FOR_WORD_PATTERN =
            Pattern.compile("^\\w+\\s+for\\s+.+$", Pattern.CASE_INSENSITIVE);

    /**
     * 单词 + 逗号，如 "However, ..."
     */
    private static final Pattern WORD_COMMA_PATTERN =
            Pattern.compile("^\\w+,\\s*.*$", Pattern.CASE_INSENSITIVE);

    /**
     * 单词 + 括号内容，如 "Scope (informative) ..."
     */
    private static final Pattern WORD_PARENTHESIS_PATTERN =
            Pattern.compile("^\\w+\\s+\\([^)]+\\)\\s*.*$", Pattern.CASE_INSENSITIVE);

    private PatternRules() {
    }

    public static List<PatternRule> defaults() {
        return defaults(DEFAULT_MIN_OCCURRENCES);
    }

    public static List<PatternRule> defaults(int minOccurrences) {
        return Collections.unmodifiableList(new ArrayList<>(Arrays.asList(
                new PatternRule(WORD_FOR_WORD, WORD_FOR_WORD_PATTERN, minOccurrences),
                new PatternRule(WORD_COMMA, WORD_COMMA_PATTERN, minOccurrences),
                new PatternRule(WORD_PARENTHESIS, WORD_PARENTHESIS_PATTERN, minOccurrences))));
    }
}
