package com.example.docxstyle.util.style;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

class ParagraphFormattingTest {

    @Test
    @DisplayName("缩进按字段合并，子级未设置的字段保留父级")
    void mergesIndentationPerField() {
        ParagraphFormatting base = ParagraphFormatting.builder()
                .indentation(Indentation.builder().left(720).hanging(360).build())
                .alignment("both")
                .build();
        ParagraphFormatting child = ParagraphFormatting.builder()
                .indentation(Indentation.builder().left(1440).build())
                .build();

        ParagraphFormatting merged = ParagraphFormatting.merge(base, child);

        assertThat(merged.getIndentation().getLeft()).isEqualTo(1440);
        assertThat(merged.getIndentation().getHanging()).isEqualTo(360);
        assertThat(merged.getAlignment()).isEqualTo("both");
    }

    @Test
    @DisplayName("制表位按位置合并，clear 移除父级同位置制表位")
    void mergesTabsByPosition() {
        ParagraphFormatting base = ParagraphFormatting.builder()
                .tabs(Arrays.asList(
                        TabStop.builder().position(720).alignment("left").build(),
                        TabStop.builder().position(9350).alignment("right").leader("dot").build()))
                .build();
        ParagraphFormatting child = ParagraphFormatting.builder()
                .tabs(Collections.singletonList(TabStop.builder().position(720).alignment("clear").build()))
                .build();

        ParagraphFormatting merged = ParagraphFormatting.merge(base, child);

        assertThat(merged.getTabs()).extracting(TabStop::getPosition).containsExactly(9350);
        assertThat(merged.rightLeaderTab().getLeader()).isEqualTo("dot");
    }
}
