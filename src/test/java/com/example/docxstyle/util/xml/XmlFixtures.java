package com.example.docxstyle.util.xml;

import com.example.docxstyle.util.diagnostic.Diagnostics;
import org.apache.poi.ooxml.util.DocumentHelper;
import org.w3c.dom.Document;
import org.xml.sax.SAXException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 测试用XML片段构造
 */
public final class XmlFixtures {

    public static final String W_NS = "xmlns:w=\"" + WordNamespaces.W + "\"";
    public static final String A_NS = "xmlns:a=\"" + WordNamespaces.A + "\"";

    private XmlFixtures() {
    }

    public static Document parse(String xml) {
        try {
            return DocumentHelper.readDocument(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
        } catch (IOException | SAXException e) {
            throw new IllegalStateException("测试XML解析失败: " + e.getMessage(), e);
        }
    }

    public static Document styles(String body) {
        return parse("<w:styles " + W_NS + ">" + body + "</w:styles>");
    }

    public static Document numbering(String body) {
        return parse("<w:numbering " + W_NS + ">" + body + "</w:numbering>");
    }

    public static Document document(String body) {
        return parse("<w:document " + W_NS + "><w:body>" + body + "</w:body></w:document>");
    }

    public static String paragraph(String text) {
        return "<w:p><w:r><w:t xml:space=\"preserve\">" + text + "</w:t></w:r></w:p>";
    }

    public static WordXmlQuery query() {
        return new WordXmlQuery(WordNamespaces.defaults(), new Diagnostics());
    }
}
