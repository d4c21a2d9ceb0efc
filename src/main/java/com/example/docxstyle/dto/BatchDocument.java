package com.example.docxstyle.dto;

/**
 * 批量转换的一个输入文档；同名文件按上传顺序分别处理
 */
public class BatchDocument {

    private final int index;

    private final String name;

    private final byte[] content;

    public BatchDocument(int index, String name, byte[] content) {
        this.index = index;
        this.name = name;
        this.content = content;
    }

    public int getIndex() { return index; }

    public String getName() { return name; }

    public byte[] getContent() { return content; }
}
