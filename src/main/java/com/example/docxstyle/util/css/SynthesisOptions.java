package com.example.docxstyle.util.css;

import lombok.Builder;
import lombok.Value;

/**
 * 样式表生成选项
 */
@Value
@Builder
public class SynthesisOptions {

    /** 类规则使用 basedOn 合并后的属性（false 时只输出样式自身的直接属性） */
    @Builder.Default
    boolean flattenBasedOn = true;

    public static SynthesisOptions defaults() {
        return SynthesisOptions.builder().build();
    }
}
