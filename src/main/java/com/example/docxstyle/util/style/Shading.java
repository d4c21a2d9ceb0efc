package com.example.docxstyle.util.style;

import lombok.Builder;
import lombok.Value;

/**
 * 底纹（w:shd）
 */
@Value
@Builder
public class Shading {

    String pattern;
    String color;
    String fill;
}
