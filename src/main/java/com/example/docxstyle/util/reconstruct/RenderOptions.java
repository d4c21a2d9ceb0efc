package com.example.docxstyle.util.reconstruct;

import lombok.Builder;
import lombok.Value;

/**
 * 渲染选项（目录页码、引导符宽度）
 */
@Value
@Builder
public class RenderOptions {

    @Builder.Default
    boolean showTocPageNumbers = true;

    /** Markdown 目录行中文本加引导符的总宽度 */
    @Builder.Default
    int tocLineWidth = 60;

    /** HTML 引导符 span 中填充的字符数（由CSS截断） */
    @Builder.Default
    int htmlLeaderLength = 120;

    public static RenderOptions defaults() {
        return RenderOptions.builder().build();
    }
}
