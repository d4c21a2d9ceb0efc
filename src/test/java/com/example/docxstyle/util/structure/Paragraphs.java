package com.example.docxstyle.util.structure;

import java.util.ArrayList;
import java.util.List;

/**
 * 按顺序构造段落流，自动分配段落序号
 */
public final class Paragraphs {

    private final List<ParagraphRecord> records = new ArrayList<>();

    public static Paragraphs builder() {
        return new Paragraphs();
    }

    public Paragraphs text(String text) {
        return add(ParagraphRecord.builder().text(text));
    }

    public Paragraphs styled(String styleId, String text) {
        return add(ParagraphRecord.builder().styleId(styleId).text(text));
    }

    public Paragraphs blank() {
        return add(ParagraphRecord.builder().text(""));
    }

    public Paragraphs numbered(String numId, int level, String text) {
        return add(ParagraphRecord.builder().numId(numId).level(level).text(text));
    }

    public Paragraphs tocField(String text) {
        return add(ParagraphRecord.builder().tocFieldBegin(true).text(text));
    }

    public Paragraphs add(ParagraphRecord.ParagraphRecordBuilder builder) {
        records.add(builder.index(records.size()).build());
        return this;
    }

    public List<ParagraphRecord> build() {
        return records;
    }
}
