package com.example.docxstyle.util.style;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 表格样式格式（w:tblPr）：边框（含 insideH/insideV）与默认单元格边距（twip）
 */
@Value
@Builder(toBuilder = true)
public class TableFormatting {

    @Builder.Default
    Map<String, BorderSpec> borders = Collections.emptyMap();
    @Builder.Default
    Map<String, Integer> cellMargins = Collections.emptyMap();
    String alignment;

    public static final TableFormatting EMPTY = TableFormatting.builder().build();

    public static TableFormatting merge(TableFormatting base, TableFormatting override) {
        if (base == null) {
            return override != null ? override : EMPTY;
        }
        if (override == null) {
            return base;
        }
        Map<String, BorderSpec> borders = new LinkedHashMap<>(base.borders);
        borders.putAll(override.borders);
        Map<String, Integer> margins = new LinkedHashMap<>(base.cellMargins);
        margins.putAll(override.cellMargins);
        return TableFormatting.builder()
                .borders(Collections.unmodifiableMap(borders))
                .cellMargins(Collections.unmodifiableMap(margins))
                .alignment(override.alignment != null ? override.alignment : base.alignment)
                .build();
    }
}
