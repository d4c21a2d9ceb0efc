package com.example.docxstyle.util.docx;

import org.w3c.dom.Document;

/**
 * DOCX包中本服务使用的五个XML部件，缺失的部件为null
 */
public class DocxParts {

    public static final String STYLES = "/word/styles.xml";
    public static final String NUMBERING = "/word/numbering.xml";
    public static final String DOCUMENT = "/word/document.xml";
    public static final String THEME = "/word/theme/theme1.xml";
    public static final String SETTINGS = "/word/settings.xml";

    private Document styles;
    private Document numbering;
    private Document document;
    private Document theme;
    private Document settings;

    public DocxParts() {
    }

    public DocxParts(Document styles, Document numbering, Document document, Document theme, Document settings) {
        this.styles = styles;
        this.numbering = numbering;
        this.document = document;
        this.theme = theme;
        this.settings = settings;
    }

    public boolean isEmpty() {
        return styles == null && numbering == null && document == null && theme == null && settings == null;
    }

    // Getters and Setters
    public Document getStyles() { return styles; }
    public void setStyles(Document styles) { this.styles = styles; }

    public Document getNumbering() { return numbering; }
    public void setNumbering(Document numbering) { this.numbering = numbering; }

    public Document getDocument() { return document; }
    public void setDocument(Document document) { this.document = document; }

    public Document getTheme() { return theme; }
    public void setTheme(Document theme) { this.theme = theme; }

    public Document getSettings() { return settings; }
    public void setSettings(Document settings) { this.settings = settings; }
}
