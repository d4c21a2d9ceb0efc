package com.example.docxstyle.util.style;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 段落格式（w:pPr）
 *
 * borders 的键为边名（top/left/bottom/right/between），顺序固定。
 */
@Value
@Builder(toBuilder = true)
public class ParagraphFormatting {

    String alignment;
    Indentation indentation;
    Spacing spacing;
    @Builder.Default
    Map<String, BorderSpec> borders = Collections.emptyMap();
    Shading shading;
    @Builder.Default
    List<TabStop> tabs = Collections.emptyList();
    NumberingRef numbering;
    Boolean keepNext;
    Boolean keepLines;
    Boolean pageBreakBefore;
    Boolean widowControl;
    Integer outlineLevel;

    public static final ParagraphFormatting EMPTY = ParagraphFormatting.builder().build();

    /**
     * 逐属性组合并，返回新对象
     *
     * 缩进、间距按属性合并；边框按边合并；制表位按位置合并，clear 类型移除父样式同位置制表位。
     */
    public static ParagraphFormatting merge(ParagraphFormatting base, ParagraphFormatting override) {
        if (base == null) {
            return override != null ? override : EMPTY;
        }
        if (override == null) {
            return base;
        }
        Map<String, BorderSpec> borders = new LinkedHashMap<>(base.borders);
        borders.putAll(override.borders);

        return ParagraphFormatting.builder()
                .alignment(pick(base.alignment, override.alignment))
                .indentation(Indentation.merge(base.indentation, override.indentation))
                .spacing(Spacing.merge(base.spacing, override.spacing))
                .borders(Collections.unmodifiableMap(borders))
                .shading(pick(base.shading, override.shading))
                .tabs(mergeTabs(base.tabs, override.tabs))
                .numbering(pick(base.numbering, override.numbering))
                .keepNext(pick(base.keepNext, override.keepNext))
                .keepLines(pick(base.keepLines, override.keepLines))
                .pageBreakBefore(pick(base.pageBreakBefore, override.pageBreakBefore))
                .widowControl(pick(base.widowControl, override.widowControl))
                .outlineLevel(pick(base.outlineLevel, override.outlineLevel))
                .build();
    }

    /**
     * 右对齐且带前导符的制表位（目录页码常用）
     */
    public TabStop rightLeaderTab() {
        for (TabStop tab : tabs) {
            if (tab.isRight() && tab.hasLeader()) {
                return tab;
            }
        }
        return null;
    }

    private static List<TabStop> mergeTabs(List<TabStop> base, List<TabStop> override) {
        if (override.isEmpty()) {
            return base;
        }
        Map<Integer, TabStop> byPosition = new TreeMap<>();
        for (TabStop tab : base) {
            byPosition.put(tab.getPosition(), tab);
        }
        for (TabStop tab : override) {
            if (tab.isClear()) {
                byPosition.remove(tab.getPosition());
            } else {
                byPosition.put(tab.getPosition(), tab);
            }
        }
        List<TabStop> merged = new ArrayList<>(byPosition.values());
        merged.sort(Comparator.comparingInt(TabStop::getPosition));
        return Collections.unmodifiableList(merged);
    }

    private static <T> T pick(T base, T override) {
        return override != null ? override : base;
    }
}
