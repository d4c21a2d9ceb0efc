package com.example.docxstyle.util.css;

/**
 * 基础样式表：样式表生成失败时原样返回，不依赖任何已解析的状态
 */
public final class FallbackStylesheet {

    public static final String CSS = ""
            + "/* docx-style fallback stylesheet */\n"
            + ".docx-document { font-family: \"Calibri\", sans-serif; font-size: 11pt; line-height: 1.15; }\n"
            + ".docx-document h1, .docx-document h2, .docx-document h3 { font-family: \"Calibri Light\", sans-serif; color: #2F5496; }\n"
            + ".docx-document h1 { font-size: 16pt; }\n"
            + ".docx-document h2 { font-size: 13pt; }\n"
            + ".docx-document h3 { font-size: 12pt; }\n"
            + ".docx-document p { margin: 0 0 8pt 0; }\n"
            + ".docx-document table { width: 100%; border-collapse: collapse; }\n"
            + ".docx-document td, .docx-document th { border: 1px solid #ddd; padding: 5pt; }\n"
            + ".docx-toc-entry { display: flex; align-items: baseline; white-space: nowrap; }\n"
            + ".docx-toc-text { flex-grow: 0; }\n"
            + ".docx-toc-dots { flex-grow: 1; overflow: hidden; margin: 0 4pt; }\n"
            + ".docx-toc-pagenum { flex-shrink: 0; text-align: right; }\n"
            + "ol.docx-list { list-style-type: none; padding-left: 0; }\n"
            + "ol.docx-list > li { position: relative; padding-left: 2.5em; }\n"
            + "ol.docx-list > li::before { position: absolute; left: 0; content: attr(data-label); }\n"
            + "ul.docx-list { list-style-type: disc; padding-left: 2.5em; }\n";

    private FallbackStylesheet() {
    }
}
