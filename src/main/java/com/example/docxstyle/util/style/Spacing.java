package com.example.docxstyle.util.style;

import lombok.Builder;
import lombok.Value;

/**
 * 段落间距：before/after/line 单位为twip，lineRule 为 auto/exact/atLeast
 */
@Value
@Builder(toBuilder = true)
public class Spacing {

    Integer before;
    Integer after;
    Integer line;
    String lineRule;

    public static Spacing merge(Spacing base, Spacing override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        return Spacing.builder()
                .before(override.before != null ? override.before : base.before)
                .after(override.after != null ? override.after : base.after)
                .line(override.line != null ? override.line : base.line)
                .lineRule(override.line != null ? override.lineRule : base.lineRule)
                .build();
    }
}
