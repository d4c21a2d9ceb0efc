package com.example.docxstyle.util.structure;

import java.util.regex.Pattern;

/**
 * 特殊段落形状规则：{patternKind, matcher, minOccurrences}
 */
public class PatternRule {

    private final String patternKind;
    private final Pattern matcher;
    private final int minOccurrences;

    public PatternRule(String patternKind, Pattern matcher, int minOccurrences) {
        this.patternKind = patternKind;
        this.matcher = matcher;
        this.minOccurrences = minOccurrences;
    }

    public String getPatternKind() { return patternKind; }

    public Pattern getMatcher() { return matcher; }

    public int getMinOccurrences() { return minOccurrences; }

    public boolean matches(String firstLine) {
        return firstLine != null && !firstLine.isEmpty() && matcher.matcher(firstLine).matches();
    }

    public PatternRule withMinOccurrences(int min) {
        return new PatternRule(patternKind, matcher, min);
    }
}
