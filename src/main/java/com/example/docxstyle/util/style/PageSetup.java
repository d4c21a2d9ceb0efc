package com.example.docxstyle.util.style;

import lombok.Builder;
import lombok.Value;

/**
 * 页面设置（最后一个 w:sectPr），单位为twip
 */
@Value
@Builder
public class PageSetup {

    @Builder.Default
    int marginTop = 1440;
    @Builder.Default
    int marginBottom = 1440;
    @Builder.Default
    int marginLeft = 1440;
    @Builder.Default
    int marginRight = 1440;
    @Builder.Default
    int marginHeader = 720;
    @Builder.Default
    int marginFooter = 720;
    @Builder.Default
    int gutter = 0;
    @Builder.Default
    int width = 12240;
    @Builder.Default
    int height = 15840;
    @Builder.Default
    String orientation = "portrait";

    public static PageSetup defaults() {
        return PageSetup.builder().build();
    }
}
