package com.example.docxstyle.util.css;

import com.example.docxstyle.util.style.DocumentDefaults;
import com.example.docxstyle.util.style.StyleKind;
import com.example.docxstyle.util.style.StyleRecord;
import com.example.docxstyle.util.style.StyleTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CssClassNamesTest {

    @Test
    @DisplayName("类名 = 类型前缀 + 规范化的样式id")
    void prefixesByKind() {
        CssClassNames names = new CssClassNames(table(
                style("Heading1", StyleKind.PARAGRAPH),
                style("Strong", StyleKind.CHARACTER),
                style("TableGrid", StyleKind.TABLE),
                style("ListBullet", StyleKind.NUMBERING)));

        assertThat(names.classFor(StyleKind.PARAGRAPH, "Heading1")).isEqualTo("docx-p-heading1");
        assertThat(names.classFor(StyleKind.CHARACTER, "Strong")).isEqualTo("docx-c-strong");
        assertThat(names.classFor(StyleKind.TABLE, "TableGrid")).isEqualTo("docx-t-tablegrid");
        assertThat(names.classFor(StyleKind.NUMBERING, "ListBullet")).isEqualTo("docx-n-listbullet");
        assertThat(names.classFor(StyleKind.PARAGRAPH, "Missing")).isNull();
    }

    @Test
    @DisplayName("规范化后重名的样式按文档顺序追加序号")
    void disambiguatesCollisions() {
        CssClassNames names = new CssClassNames(table(
                style("Heading 1", StyleKind.PARAGRAPH),
                style("heading_1", StyleKind.PARAGRAPH),
                style("HEADING.1", StyleKind.PARAGRAPH)));

        assertThat(names.classFor(StyleKind.PARAGRAPH, "Heading 1")).isEqualTo("docx-p-heading-1");
        assertThat(names.classFor(StyleKind.PARAGRAPH, "heading_1")).isEqualTo("docx-p-heading-1-2");
        assertThat(names.classFor(StyleKind.PARAGRAPH, "HEADING.1")).isEqualTo("docx-p-heading-1-3");
    }

    @Test
    @DisplayName("非字母数字字符替换为连字符")
    void sanitizes() {
        assertThat(CssClassNames.sanitize("TOC 1")).isEqualTo("toc-1");
        assertThat(CssClassNames.sanitize("标题1")).isEqualTo("--1");
        assertThat(CssClassNames.sanitize("")).isEqualTo("unnamed");
    }

    static StyleRecord style(String id, StyleKind kind) {
        return StyleRecord.builder().id(id).kind(kind).name(id).build();
    }

    static StyleTable table(StyleRecord... records) {
        Map<StyleKind, Map<String, StyleRecord>> byKind = new EnumMap<>(StyleKind.class);
        for (StyleRecord record : records) {
            byKind.computeIfAbsent(record.getKind(), k -> new LinkedHashMap<>()).put(record.getId(), record);
        }
        return new StyleTable(byKind, DocumentDefaults.EMPTY, StyleTable.DEFAULT_MAX_HOPS);
    }
}
