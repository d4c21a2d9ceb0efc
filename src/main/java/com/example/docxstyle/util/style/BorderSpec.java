package com.example.docxstyle.util.style;

import lombok.Builder;
import lombok.Value;

/**
 * 单边边框：size 单位为 1/8 磅
 */
@Value
@Builder
public class BorderSpec {

    String style;
    Integer size;
    Integer space;
    String color;

    /**
     * nil / none 表示显式无边框
     */
    public boolean isNone() {
        return style == null || "nil".equals(style) || "none".equals(style);
    }
}
