package com.example.docxstyle.util.style;

import lombok.Builder;
import lombok.Value;

/**
 * 文档级设置（word/settings.xml + 页面设置）
 */
@Value
@Builder
public class DocumentSettings {

    @Builder.Default
    int defaultTabStop = 720;
    @Builder.Default
    String characterSpacingControl = "normal";
    boolean doNotHyphenateCaps;
    boolean rtlGutter;
    boolean evenAndOddHeaders;
    @Builder.Default
    PageSetup pageSetup = PageSetup.defaults();

    public static DocumentSettings defaults() {
        return DocumentSettings.builder().build();
    }
}
