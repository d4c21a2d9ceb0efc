package com.example.docxstyle.util.numbering;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.IntFunction;

/**
 * 编号文本模板（w:lvlText）的结构化形式
 *
 * "%1.%2." 解析为两个 token：
 * <pre>
 *   {levelRef=0, literalBefore="", separator=".", literalAfter=""}
 *   {levelRef=1, literalBefore="", separator="",  literalAfter="."}
 * </pre>
 * literalBefore 只出现在第一个 token（前缀），literalAfter 只出现在最后一个 token（后缀），
 * separator 是当前占位符与下一个占位符之间的文本。
 * 没有占位符的模板（项目符号等）只有 literal。
 */
public final class LevelTextPattern {

    private final String raw;
    private final List<Token> tokens;
    private final String literal;

    private LevelTextPattern(String raw, List<Token> tokens, String literal) {
        this.raw = raw;
        this.tokens = Collections.unmodifiableList(tokens);
        this.literal = literal;
    }

    /**
     * 解析模板；"%" 后不是 1-9 的数字时按普通文本处理
     */
    public static LevelTextPattern parse(String raw) {
        String text = raw != null ? raw : "";
        List<Integer> refs = new ArrayList<>();
        List<String> literals = new ArrayList<>();
        StringBuilder current = new StringBuilder();

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '%' && i + 1 < text.length() && text.charAt(i + 1) >= '1' && text.charAt(i + 1) <= '9') {
                literals.add(current.toString());
                current.setLength(0);
                refs.add(text.charAt(i + 1) - '1');
                i++;
            } else {
                current.append(c);
            }
        }
        literals.add(current.toString());

        if (refs.isEmpty()) {
            return new LevelTextPattern(text, new ArrayList<>(), text);
        }

        List<Token> tokens = new ArrayList<>();
        for (int i = 0; i < refs.size(); i++) {
            boolean first = i == 0;
            boolean last = i == refs.size() - 1;
            tokens.add(new Token(
                    refs.get(i),
                    first ? literals.get(0) : "",
                    last ? literals.get(i + 1) : "",
                    last ? "" : literals.get(i + 1)));
        }
        return new LevelTextPattern(text, tokens, null);
    }

    public String getRaw() { return raw; }

    public List<Token> getTokens() { return tokens; }

    /**
     * 无占位符模板的字面文本；有占位符时为null
     */
    public String getLiteral() { return literal; }

    public boolean isLiteralOnly() {
        return tokens.isEmpty();
    }

    /**
     * 用各级别的显示值渲染模板
     *
     * @param levelValue 级别(0-8) → 已格式化的序号文本
     */
    public String render(IntFunction<String> levelValue) {
        if (isLiteralOnly()) {
            return literal;
        }
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            sb.append(token.getLiteralBefore());
            sb.append(levelValue.apply(token.getLevelRef()));
            sb.append(token.getSeparator());
            sb.append(token.getLiteralAfter());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return raw;
    }

    /**
     * 模板中的一个级别占位符
     */
    public static final class Token {
        private final int levelRef;
        private final String literalBefore;
        private final String literalAfter;
        private final String separator;

        public Token(int levelRef, String literalBefore, String literalAfter, String separator) {
            this.levelRef = levelRef;
            this.literalBefore = literalBefore;
            this.literalAfter = literalAfter;
            this.separator = separator;
        }

        /** 引用的级别（0起） */
        public int getLevelRef() { return levelRef; }

        public String getLiteralBefore() { return literalBefore; }

        public String getLiteralAfter() { return literalAfter; }

        public String getSeparator() { return separator; }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Token)) {
                return false;
            }
            Token token = (Token) o;
            return levelRef == token.levelRef
                    && literalBefore.equals(token.literalBefore)
                    && literalAfter.equals(token.literalAfter)
                    && separator.equals(token.separator);
        }

        @Override
        public int hashCode() {
            return Objects.hash(levelRef, literalBefore, literalAfter, separator);
        }

        @Override
        public String toString() {
            return "{levelRef=" + levelRef + ", before='" + literalBefore + "', separator='" + separator
                    + "', after='" + literalAfter + "'}";
        }
    }
}
