package com.example.docxstyle.util.style;

import lombok.Value;

/**
 * 段落/样式上的编号引用（w:numPr）
 */
@Value
public class NumberingRef {

    String numId;
    Integer level;
}
