package com.example.docxstyle.util.xml;

import com.example.docxstyle.util.diagnostic.DiagnosticKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WordXmlQueryTest {

    private WordXmlQuery query;
    private Document doc;

    @BeforeEach
    void setUp() {
        query = XmlFixtures.query();
        doc = XmlFixtures.document(
                "<w:p><w:pPr><w:pStyle w:val=\"Heading1\"/></w:pPr><w:r><w:rPr><w:b/><w:i w:val=\"0\"/></w:rPr>"
                        + "<w:t>Title</w:t></w:r><w:r><w:t>Text</w:t></w:r></w:p>"
                        + "<w:p><w:pPr><w:pStyle w:val=\"\"/></w:pPr></w:p>");
    }

    @Test
    @DisplayName("按注入的前缀查询元素，保持文档顺序")
    void selectsWithInjectedPrefixes() {
        List<Element> paragraphs = query.selectElements("//w:body/w:p", doc);

        assertThat(paragraphs).hasSize(2);
        assertThat(query.textOf(paragraphs.get(0))).isEqualTo("TitleText");
        assertThat(query.selectElement("//w:r", doc)).isNotNull();
    }

    @Test
    @DisplayName("非法表达式记录 QUERY_FAILURE 并返回空结果")
    void invalidExpressionIsRecordedNotThrown() {
        List<Element> result = query.selectElements("//w:p[", doc);

        assertThat(result).isEmpty();
        assertThat(query.getDiagnostics().has(DiagnosticKind.QUERY_FAILURE)).isTrue();
    }

    @Test
    @DisplayName("属性缺失或为空字符串时返回null")
    void attributeAbsentOrEmptyIsNull() {
        List<Element> paragraphs = query.selectElements("//w:body/w:p", doc);
        Element first = query.child(paragraphs.get(0), "w:pPr");
        Element second = query.child(paragraphs.get(1), "w:pPr");

        assertThat(query.childAttr(first, "w:pStyle", "w:val")).isEqualTo("Heading1");
        assertThat(query.childAttr(second, "w:pStyle", "w:val")).isNull();
        assertThat(query.childAttr(first, "w:numPr", "w:val")).isNull();
        assertThat(query.attr(null, "w:val")).isNull();
    }

    @Test
    @DisplayName("开关属性：存在为true，w:val=0 为false，缺失为null")
    void onOffSemantics() {
        Element rPr = query.selectElement("//w:rPr", doc);

        assertThat(query.onOff(query.child(rPr, "w:b"))).isTrue();
        assertThat(query.onOff(query.child(rPr, "w:i"))).isFalse();
        assertThat(query.onOff(query.child(rPr, "w:u"))).isNull();
    }

    @Test
    @DisplayName("整数属性容忍小数形式，无法解析时为null")
    void parsesLenientIntegers() {
        assertThat(WordXmlQuery.parseInt("240")).isEqualTo(240);
        assertThat(WordXmlQuery.parseInt(" 12.5 ")).isEqualTo(12);
        assertThat(WordXmlQuery.parseInt("auto")).isNull();
        assertThat(WordXmlQuery.parseInt(null)).isNull();
    }

    @Test
    @DisplayName("自定义命名空间映射替换默认前缀")
    void customNamespaceMapping() {
        WordNamespaces custom = WordNamespaces.of(Collections.singletonMap("word", WordNamespaces.W));
        WordXmlQuery customQuery = new WordXmlQuery(custom, query.getDiagnostics());

        assertThat(customQuery.selectElements("//word:p", doc)).hasSize(2);
        assertThat(customQuery.selectElements("//w:p", doc)).hasSize(2);
    }

    @Test
    @DisplayName("上下文为null时返回空列表")
    void nullContext() {
        assertThat(query.selectElements("//w:p", null)).isEmpty();
        assertThat(query.children(null, "w:p")).isEmpty();
        assertThat(query.getDiagnostics().isEmpty()).isTrue();
    }
}
