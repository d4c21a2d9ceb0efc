package com.example.docxstyle.util.style;

import lombok.Value;

/**
 * 文档级默认格式（w:docDefaults）
 */
@Value
public class DocumentDefaults {

    public static final DocumentDefaults EMPTY = new DocumentDefaults(RunFormatting.EMPTY, ParagraphFormatting.EMPTY);

    RunFormatting run;
    ParagraphFormatting paragraph;
}
