package com.example.docxstyle.util.structure;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 结构分析阈值
 */
@Value
@Builder
public class AnalyzerOptions {

    /** 目录至少记录多少条后，空段落或 Normal 段落才结束目录 */
    @Builder.Default
    int tocExitMinEntries = 5;

    /** 形状出现多少次后提升为结构模式 */
    @Builder.Default
    int minOccurrences = PatternRules.DEFAULT_MIN_OCCURRENCES;

    /** 每个模式保留的示例数 */
    @Builder.Default
    int maxExamples = 3;

    /** 每个样式保留的样本数及样本长度 */
    @Builder.Default
    int styleSamples = 3;

    @Builder.Default
    int styleSampleLength = 100;

    /** 自定义规则表；为null时使用默认规则 */
    List<PatternRule> rules;

    public static AnalyzerOptions defaults() {
        return AnalyzerOptions.builder().build();
    }

    public List<PatternRule> effectiveRules() {
        return rules != null ? rules : PatternRules.defaults(minOccurrences);
    }
}
