package com.example.docxstyle.util.numbering;

import com.example.docxstyle.util.style.Indentation;
import com.example.docxstyle.util.style.ParagraphFormatting;
import com.example.docxstyle.util.style.RunFormatting;
import lombok.Builder;
import lombok.Value;

/**
 * 合并后的有效级别：实例覆盖 &gt; 抽象定义 &gt; 系统默认值，所有必需字段均已填充
 */
@Value
@Builder
public class EffectiveLevel {

    String numId;
    String abstractNumId;
    int level;
    NumberFormat format;
    /** Word原始格式名（降级前） */
    String sourceFormat;
    LevelTextPattern pattern;
    String alignment;
    int start;
    Integer restartAfterLevel;
    boolean legal;
    String suffix;
    Indentation indentation;
    ParagraphFormatting paragraph;
    RunFormatting run;

    public boolean isBullet() {
        return format == NumberFormat.BULLET;
    }

    /**
     * 项目符号级别的显示字符
     */
    public String bulletGlyph() {
        return BulletGlyphs.toDisplay(pattern.isLiteralOnly() ? pattern.getLiteral() : pattern.getRaw());
    }
}
