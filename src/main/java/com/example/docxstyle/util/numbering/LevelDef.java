package com.example.docxstyle.util.numbering;

import com.example.docxstyle.util.style.ParagraphFormatting;
import com.example.docxstyle.util.style.RunFormatting;
import lombok.Builder;
import lombok.Value;

/**
 * 编号级别定义（w:lvl），字段为null表示源数据中未设置
 *
 * format 保留Word原始格式名（如 "chineseCounting"），降级在 {@link NumberFormat#fromWord} 中进行。
 */
@Value
@Builder(toBuilder = true)
public class LevelDef {

    int level;
    String format;
    String textPattern;
    String alignment;
    Integer start;
    /** w:lvlRestart：0 表示从不重置，n 表示在级别 n（1起）或更高级别出现后重置 */
    Integer restartAfterLevel;
    Boolean legal;
    /** 编号后缀：tab / space / nothing */
    String suffix;
    String paragraphStyle;
    Boolean tentative;
    @Builder.Default
    ParagraphFormatting paragraph = ParagraphFormatting.EMPTY;
    @Builder.Default
    RunFormatting run = RunFormatting.EMPTY;
}
