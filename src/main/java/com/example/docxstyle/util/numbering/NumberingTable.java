package com.example.docxstyle.util.numbering;

import com.example.docxstyle.util.style.Indentation;
import com.example.docxstyle.util.style.ParagraphFormatting;
import com.example.docxstyle.util.style.RunFormatting;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 编号表：(numId, level) → EffectiveLevel
 *
 * 优先级：实例级别覆盖 &gt; 抽象级别定义 &gt; 系统默认值。
 * 整级覆盖（w:lvlOverride/w:lvl）整体替换格式、模板和缩进；startOverride 只替换起始值。
 * numId 或级别无法解析时返回空，调用方按无编号段落处理。
 */
public class NumberingTable {

    static final String DEFAULT_ALIGNMENT = "left";
    static final String DEFAULT_SUFFIX = "tab";
    static final int DEFAULT_START = 1;

    private final Map<String, AbstractNumbering> abstracts;
    private final Map<String, NumberingInstance> instances;

    public NumberingTable(Map<String, AbstractNumbering> abstracts, Map<String, NumberingInstance> instances) {
        this.abstracts = abstracts == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(abstracts));
        this.instances = instances == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(instances));
    }

    public static NumberingTable empty() {
        return new NumberingTable(null, null);
    }

    public Collection<NumberingInstance> instances() {
        return instances.values();
    }

    public Collection<AbstractNumbering> abstractNumberings() {
        return abstracts.values();
    }

    public NumberingInstance instance(String numId) {
        return numId == null ? null : instances.get(numId);
    }

    public boolean isEmpty() {
        return instances.isEmpty();
    }

    /**
     * 实例实际使用的抽象定义
     *
     * 抽象定义本身没有级别且声明了 numStyleLink 时，改用 styleLink 同名的那个抽象定义（只跟随一跳）。
     */
    public AbstractNumbering abstractFor(NumberingInstance instance) {
        if (instance == null || instance.getAbstractNumId() == null) {
            return null;
        }
        AbstractNumbering abs = abstracts.get(instance.getAbstractNumId());
        if (abs != null && !abs.hasLevels() && abs.getNumStyleLink() != null) {
            for (AbstractNumbering candidate : abstracts.values()) {
                if (candidate != abs && abs.getNumStyleLink().equals(candidate.getStyleLink()) && candidate.hasLevels()) {
                    return candidate;
                }
            }
        }
        return abs;
    }

    /**
     * 计算有效级别
     *
     * @param numId 编号实例id
     * @param level 级别（0-8）
     * @return 有效级别；numId 不存在、级别越界或该级别没有任何定义时为空
     */
    public Optional<EffectiveLevel> effectiveLevel(String numId, int level) {
        if (level < 0 || level >= AbstractNumbering.LEVEL_COUNT) {
            return Optional.empty();
        }
        NumberingInstance instance = instance(numId);
        if (instance == null) {
            return Optional.empty();
        }
        AbstractNumbering abs = abstractFor(instance);
        LevelDef base = abs != null ? abs.level(level) : null;
        LevelOverride override = instance.override(level);
        LevelDef replacement = override != null ? override.getLevelDef() : null;

        if (base == null && replacement == null) {
            return Optional.empty();
        }

        String format;
        String text;
        ParagraphFormatting paragraph;
        if (replacement != null) {
            format = replacement.getFormat();
            text = replacement.getTextPattern();
            paragraph = replacement.getParagraph();
        } else {
            format = base.getFormat();
            text = base.getTextPattern();
            paragraph = base.getParagraph();
        }
        if (text == null) {
            text = "%" + (level + 1) + ".";
        }

        Integer start = null;
        if (override != null && override.getStartOverride() != null) {
            start = override.getStartOverride();
        } else if (replacement != null && replacement.getStart() != null) {
            start = replacement.getStart();
        } else if (base != null) {
            start = base.getStart();
        }

        RunFormatting run = replacement != null && !replacement.getRun().isEmpty()
                ? replacement.getRun()
                : (base != null ? base.getRun() : RunFormatting.EMPTY);

        Indentation indentation = paragraph != null && paragraph.getIndentation() != null
                ? paragraph.getIndentation()
                : Indentation.EMPTY;

        return Optional.of(EffectiveLevel.builder()
                .numId(numId)
                .abstractNumId(abs != null ? abs.getId() : instance.getAbstractNumId())
                .level(level)
                .format(NumberFormat.fromWord(format))
                .sourceFormat(format != null ? format : NumberFormat.DECIMAL.getWordName())
                .pattern(LevelTextPattern.parse(text))
                .alignment(firstNonNull(
                        replacement != null ? replacement.getAlignment() : null,
                        base != null ? base.getAlignment() : null,
                        DEFAULT_ALIGNMENT))
                .start(start != null ? start : DEFAULT_START)
                .restartAfterLevel(firstNonNull(
                        replacement != null ? replacement.getRestartAfterLevel() : null,
                        base != null ? base.getRestartAfterLevel() : null,
                        null))
                .legal(Boolean.TRUE.equals(firstNonNull(
                        replacement != null ? replacement.getLegal() : null,
                        base != null ? base.getLegal() : null,
                        Boolean.FALSE)))
                .suffix(firstNonNull(
                        replacement != null ? replacement.getSuffix() : null,
                        base != null ? base.getSuffix() : null,
                        DEFAULT_SUFFIX))
                .indentation(indentation)
                .paragraph(paragraph != null ? paragraph : ParagraphFormatting.EMPTY)
                .run(run)
                .build());
    }

    /**
     * 实例所有可解析级别（按级别顺序）
     */
    public List<EffectiveLevel> effectiveLevels(String numId) {
        List<EffectiveLevel> result = new ArrayList<>();
        for (int level = 0; level < AbstractNumbering.LEVEL_COUNT; level++) {
            effectiveLevel(numId, level).ifPresent(result::add);
        }
        return result;
    }

    private static <T> T firstNonNull(T first, T second, T fallback) {
        if (first != null) {
            return first;
        }
        return second != null ? second : fallback;
    }
}
