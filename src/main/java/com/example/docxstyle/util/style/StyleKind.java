package com.example.docxstyle.util.style;

/**
 * 样式类型（w:style/@w:type）
 */
public enum StyleKind {

    PARAGRAPH("paragraph", "docx-p-"),
    CHARACTER("character", "docx-c-"),
    TABLE("table", "docx-t-"),
    NUMBERING("numbering", "docx-n-");

    private final String xmlValue;
    private final String classPrefix;

    StyleKind(String xmlValue, String classPrefix) {
        this.xmlValue = xmlValue;
        this.classPrefix = classPrefix;
    }

    public String getXmlValue() { return xmlValue; }

    public String getClassPrefix() { return classPrefix; }

    /**
     * 按 w:type 取值解析，未知类型返回null
     */
    public static StyleKind fromXml(String value) {
        if (value == null) {
            // w:type 缺省时按段落样式处理
            return PARAGRAPH;
        }
        for (StyleKind kind : values()) {
            if (kind.xmlValue.equals(value)) {
                return kind;
            }
        }
        return null;
    }
}
