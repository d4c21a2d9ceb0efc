package com.example.docxstyle.util.structure;

import lombok.Builder;
import lombok.Value;

/**
 * 正文段落记录（按文档顺序，只读）
 *
 * numId / level 未编号时为null；numId 为 "0" 表示编号被显式移除。
 */
@Value
@Builder(toBuilder = true)
public class ParagraphRecord {

    int index;
    @Builder.Default
    String text = "";
    String styleId;
    String numId;
    Integer level;
    /** 段落内出现 TOC 域的开始标记（fldChar begin + instrText TOC，或 fldSimple TOC） */
    boolean tocFieldBegin;
    /** 段落自身声明的右对齐制表位前导符（w:leader 原值） */
    String tabLeader;

    public boolean isNumbered() {
        return numId != null && !"0".equals(numId);
    }

    public int levelOrZero() {
        return level != null ? level : 0;
    }

    public boolean isBlank() {
        return text == null || text.trim().isEmpty();
    }

    /**
     * 第一行（去首尾空白）
     */
    public String firstLine() {
        if (text == null) {
            return "";
        }
        int newline = text.indexOf('\n');
        return (newline >= 0 ? text.substring(0, newline) : text).trim();
    }
}
