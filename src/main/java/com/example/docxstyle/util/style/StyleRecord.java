package com.example.docxstyle.util.style;

import lombok.Builder;
import lombok.Value;

/**
 * 规范化后的样式定义
 *
 * basedOn 只是弱引用（样式id），合并后的有效属性通过 {@link StyleTable#resolveEffective} 获取。
 */
@Value
@Builder(toBuilder = true)
public class StyleRecord {

    String id;
    StyleKind kind;
    String name;
    String basedOn;
    boolean defaultStyle;
    @Builder.Default
    RunFormatting run = RunFormatting.EMPTY;
    @Builder.Default
    ParagraphFormatting paragraph = ParagraphFormatting.EMPTY;
    @Builder.Default
    TableFormatting table = TableFormatting.EMPTY;

    /**
     * 在 base 之上应用本样式的直接属性，返回新记录（保留本样式的标识）
     */
    public StyleRecord over(StyleRecord base) {
        if (base == null) {
            return this;
        }
        return toBuilder()
                .run(RunFormatting.merge(base.run, run))
                .paragraph(ParagraphFormatting.merge(base.paragraph, paragraph))
                .table(TableFormatting.merge(base.table, table))
                .build();
    }
}
