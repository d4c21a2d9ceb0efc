package com.example.docxstyle.util.docx;

import com.example.docxstyle.util.css.SynthesisOptions;
import com.example.docxstyle.util.structure.AnalyzerOptions;
import com.example.docxstyle.util.style.StyleTable;
import com.example.docxstyle.util.xml.WordNamespaces;
import lombok.Builder;
import lombok.Value;

/**
 * 转换流水线配置（不可变，可在并发转换之间共享）
 */
@Value
@Builder
public class PipelineOptions {

    @Builder.Default
    WordNamespaces namespaces = WordNamespaces.defaults();

    @Builder.Default
    int maxBasedOnHops = StyleTable.DEFAULT_MAX_HOPS;

    @Builder.Default
    SynthesisOptions synthesis = SynthesisOptions.defaults();

    @Builder.Default
    AnalyzerOptions analyzer = AnalyzerOptions.defaults();

    public static PipelineOptions defaults() {
        return PipelineOptions.builder().build();
    }
}
