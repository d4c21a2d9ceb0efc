package com.example.docxstyle.config;

import com.example.docxstyle.util.docx.PipelineOptions;
import com.example.docxstyle.util.reconstruct.RenderOptions;
import com.example.docxstyle.util.xml.WordNamespaces;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

class DocxStylePropertiesTest {

    @Test
    @DisplayName("默认配置映射为默认流水线选项")
    void defaults() {
        PipelineOptions options = new DocxStyleProperties().toPipelineOptions();

        assertThat(options.getMaxBasedOnHops()).isEqualTo(32);
        assertThat(options.getSynthesis().isFlattenBasedOn()).isTrue();
        assertThat(options.getAnalyzer().getTocExitMinEntries()).isEqualTo(5);
        assertThat(options.getAnalyzer().getMinOccurrences()).isEqualTo(2);
        assertThat(options.getNamespaces().uri("w")).isEqualTo(WordNamespaces.W);
    }

    @Test
    @DisplayName("配置值传递到各阶段选项")
    void mapsOverrides() {
        DocxStyleProperties properties = new DocxStyleProperties();
        properties.setNamespaces(Collections.singletonMap("w", "http://purl.oclc.org/ooxml/wordprocessingml/main"));
        properties.getStyles().setMaxBasedOnHops(4);
        properties.getStyles().setFlattenBasedOn(false);
        properties.getToc().setExitMinEntries(2);
        properties.getPatterns().setMinOccurrences(3);
        properties.getRender().setTocLineWidth(40);
        properties.getRender().setShowTocPageNumbers(false);

        PipelineOptions options = properties.toPipelineOptions();
        RenderOptions render = properties.toRenderOptions();

        assertThat(options.getNamespaces().uri("w")).isEqualTo("http://purl.oclc.org/ooxml/wordprocessingml/main");
        assertThat(options.getNamespaces().uri("a")).isEqualTo(WordNamespaces.A);
        assertThat(options.getMaxBasedOnHops()).isEqualTo(4);
        assertThat(options.getSynthesis().isFlattenBasedOn()).isFalse();
        assertThat(options.getAnalyzer().getTocExitMinEntries()).isEqualTo(2);
        assertThat(options.getAnalyzer().effectiveRules()).allSatisfy(rule ->
                assertThat(rule.getMinOccurrences()).isEqualTo(3));
        assertThat(render.getTocLineWidth()).isEqualTo(40);
        assertThat(render.isShowTocPageNumbers()).isFalse();
    }
}
