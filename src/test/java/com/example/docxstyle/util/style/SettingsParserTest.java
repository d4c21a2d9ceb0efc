package com.example.docxstyle.util.style;

import com.example.docxstyle.util.diagnostic.DiagnosticKind;
import com.example.docxstyle.util.xml.WordXmlQuery;
import com.example.docxstyle.util.xml.XmlFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;

import static org.assertj.core.api.Assertions.assertThat;

class SettingsParserTest {

    @Test
    @DisplayName("读取默认制表位与开关设置")
    void parsesSettings() {
        Document settings = XmlFixtures.parse("<w:settings " + XmlFixtures.W_NS + ">"
                + "<w:defaultTabStop w:val=\"708\"/>"
                + "<w:evenAndOddHeaders/>"
                + "<w:characterSpacingControl w:val=\"doNotCompress\"/>"
                + "</w:settings>");

        DocumentSettings result = new SettingsParser(XmlFixtures.query()).parse(settings, null);

        assertThat(result.getDefaultTabStop()).isEqualTo(708);
        assertThat(result.isEvenAndOddHeaders()).isTrue();
        assertThat(result.isRtlGutter()).isFalse();
        assertThat(result.getCharacterSpacingControl()).isEqualTo("doNotCompress");
        assertThat(result.getPageSetup()).isEqualTo(PageSetup.defaults());
    }

    @Test
    @DisplayName("页面设置取正文最后一个 sectPr，未给出的边距使用默认值")
    void pageSetupFromLastSection() {
        Document document = XmlFixtures.document(
                "<w:p><w:pPr><w:sectPr><w:pgSz w:w=\"16838\" w:h=\"11906\" w:orient=\"landscape\"/></w:sectPr></w:pPr></w:p>"
                        + "<w:sectPr><w:pgSz w:w=\"11906\" w:h=\"16838\"/>"
                        + "<w:pgMar w:top=\"1134\" w:right=\"850\" w:bottom=\"1134\" w:left=\"1701\"/></w:sectPr>");

        PageSetup page = new SettingsParser(XmlFixtures.query()).parsePageSetup(document);

        assertThat(page.getWidth()).isEqualTo(11906);
        assertThat(page.getMarginLeft()).isEqualTo(1701);
        assertThat(page.getMarginHeader()).isEqualTo(720);
        assertThat(page.getOrientation()).isEqualTo("portrait");
    }

    @Test
    @DisplayName("settings.xml 缺失时使用默认设置")
    void missingSettings() {
        WordXmlQuery query = XmlFixtures.query();

        DocumentSettings result = new SettingsParser(query).parse(null, null);

        assertThat(result.getDefaultTabStop()).isEqualTo(720);
        assertThat(query.getDiagnostics().has(DiagnosticKind.MISSING_PART)).isTrue();
    }
}
