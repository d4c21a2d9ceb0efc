package com.example.docxstyle.util.numbering;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 编号序列计数器：按文档顺序回放编号段落，计算每一项的显示序号（如 "1."、"1.2."、"a)"）
 *
 * 重置规则（w:lvlRestart）：
 * - 未设置：任一更高（数值更小）级别出现后重置
 * - 0：从不重置
 * - n：级别 n（1起）或更高级别出现后重置
 *
 * 每次转换新建一个实例。
 */
public class NumberingCounter {

    private final NumberingTable numbering;
    private final Map<String, int[]> countsByNumId = new HashMap<>();

    public NumberingCounter(NumberingTable numbering) {
        this.numbering = numbering;
    }

    /**
     * 记录一个编号段落并返回它的显示序号
     *
     * @return 序号文本；级别不可解析时为空（计数不变）
     */
    public Optional<String> next(String numId, int level) {
        Optional<EffectiveLevel> effective = numbering.effectiveLevel(numId, level);
        if (!effective.isPresent()) {
            return Optional.empty();
        }
        int[] counts = countsByNumId.computeIfAbsent(numId, k -> new int[AbstractNumbering.LEVEL_COUNT]);
        counts[level]++;

        for (int deeper = level + 1; deeper < AbstractNumbering.LEVEL_COUNT; deeper++) {
            Integer restart = numbering.effectiveLevel(numId, deeper)
                    .map(EffectiveLevel::getRestartAfterLevel)
                    .orElse(null);
            if (restart == null || (restart != 0 && level < restart)) {
                counts[deeper] = 0;
            }
        }

        EffectiveLevel current = effective.get();
        if (current.isBullet()) {
            return Optional.of(current.bulletGlyph());
        }
        if (current.getFormat() == NumberFormat.NONE) {
            return Optional.of("");
        }
        return Optional.of(current.getPattern().render(ref -> formatLevel(numId, ref, counts, current)));
    }

    private String formatLevel(String numId, int ref, int[] counts, EffectiveLevel current) {
        if (ref == current.getLevel()) {
            return current.getFormat().format(current.getStart() + counts[ref] - 1);
        }
        Optional<EffectiveLevel> other = numbering.effectiveLevel(numId, ref);
        int start = other.map(EffectiveLevel::getStart).orElse(1);
        int value = counts[ref] == 0 ? start : start + counts[ref] - 1;
        NumberFormat format = other.map(EffectiveLevel::getFormat).orElse(NumberFormat.DECIMAL);
        // 法律格式（isLgl）下引用的其他级别一律显示为阿拉伯数字
        if (current.isLegal() || !format.isCounter()) {
            format = NumberFormat.DECIMAL;
        }
        return format.format(value);
    }
}
