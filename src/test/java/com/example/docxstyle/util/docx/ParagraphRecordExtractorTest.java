package com.example.docxstyle.util.docx;

import com.example.docxstyle.util.diagnostic.DiagnosticKind;
import com.example.docxstyle.util.diagnostic.Diagnostics;
import com.example.docxstyle.util.structure.ParagraphRecord;
import com.example.docxstyle.util.xml.WordNamespaces;
import com.example.docxstyle.util.xml.WordXmlQuery;
import com.example.docxstyle.util.xml.XmlFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ParagraphRecordExtractorTest {

    private Diagnostics diagnostics;
    private ParagraphRecordExtractor extractor;

    @BeforeEach
    void setUp() {
        diagnostics = new Diagnostics();
        extractor = new ParagraphRecordExtractor(new WordXmlQuery(WordNamespaces.defaults(), diagnostics));
    }

    @Test
    @DisplayName("拼接文本：制表位为\\t，换行为\\n，删除文本和域指令被跳过")
    void concatenatesRunText() {
        List<ParagraphRecord> records = extractor.extract(XmlFixtures.document(""
                + "<w:p><w:pPr><w:pStyle w:val=\"BodyText\"/></w:pPr>"
                + "<w:r><w:t>Name</w:t></w:r><w:r><w:tab/><w:t xml:space=\"preserve\">Value </w:t></w:r>"
                + "<w:r><w:br/><w:t>next line</w:t></w:r>"
                + "<w:del><w:r><w:delText>removed</w:delText></w:r></w:del>"
                + "</w:p>"
                + XmlFixtures.paragraph("Second")));

        assertThat(records).hasSize(2);
        ParagraphRecord first = records.get(0);
        assertThat(first.getIndex()).isEqualTo(0);
        assertThat(first.getStyleId()).isEqualTo("BodyText");
        assertThat(first.getText()).isEqualTo("Name\tValue \nnext line");
        assertThat(first.isNumbered()).isFalse();
        assertThat(records.get(1).getIndex()).isEqualTo(1);
        assertThat(records.get(1).getText()).isEqualTo("Second");
    }

    @Test
    @DisplayName("直接编号引用：缺省 ilvl 视为 0，numId 0 表示移除编号")
    void readsNumberingReference() {
        List<ParagraphRecord> records = extractor.extract(XmlFixtures.document(""
                + "<w:p><w:pPr><w:numPr><w:ilvl w:val=\"2\"/><w:numId w:val=\"4\"/></w:numPr></w:pPr>"
                + "<w:r><w:t>deep</w:t></w:r></w:p>"
                + "<w:p><w:pPr><w:numPr><w:numId w:val=\"4\"/></w:numPr></w:pPr><w:r><w:t>top</w:t></w:r></w:p>"
                + "<w:p><w:pPr><w:numPr><w:ilvl w:val=\"0\"/><w:numId w:val=\"0\"/></w:numPr></w:pPr></w:p>"));

        assertThat(records.get(0).getNumId()).isEqualTo("4");
        assertThat(records.get(0).getLevel()).isEqualTo(2);
        assertThat(records.get(1).getLevel()).isEqualTo(0);
        assertThat(records.get(2).getNumId()).isEqualTo("0");
        assertThat(records.get(2).isNumbered()).isFalse();
    }

    @Test
    @DisplayName("识别复杂域与简单域形式的 TOC 域开始标记")
    void detectsTocFields() {
        List<ParagraphRecord> records = extractor.extract(XmlFixtures.document(""
                + "<w:p><w:r><w:fldChar w:fldCharType=\"begin\"/></w:r>"
                + "<w:r><w:instrText xml:space=\"preserve\"> TOC \\o \"1-3\" \\h \\z \\u </w:instrText></w:r>"
                + "<w:r><w:fldChar w:fldCharType=\"separate\"/></w:r><w:r><w:t>Contents</w:t></w:r></w:p>"
                + "<w:p><w:fldSimple w:instr=\" TOC \\o \"><w:r><w:t>Entry</w:t></w:r></w:fldSimple></w:p>"
                + "<w:p><w:r><w:fldChar w:fldCharType=\"begin\"/></w:r>"
                + "<w:r><w:instrText> PAGEREF _Toc1 \\h </w:instrText></w:r></w:p>"));

        assertThat(records).extracting(ParagraphRecord::isTocFieldBegin).containsExactly(true, true, false);
        assertThat(records.get(0).getText()).isEqualTo("Contents");
        assertThat(records.get(1).getText()).isEqualTo("Entry");
    }

    @Test
    @DisplayName("记录段落自身的右对齐制表位前导符")
    void readsRightTabLeader() {
        List<ParagraphRecord> records = extractor.extract(XmlFixtures.document(""
                + "<w:p><w:pPr><w:tabs><w:tab w:val=\"left\" w:leader=\"dot\" w:pos=\"400\"/>"
                + "<w:tab w:val=\"right\" w:leader=\"underscore\" w:pos=\"9350\"/></w:tabs></w:pPr></w:p>"
                + "<w:p><w:pPr><w:tabs><w:tab w:val=\"right\" w:leader=\"none\" w:pos=\"9350\"/></w:tabs></w:pPr></w:p>"));

        assertThat(records.get(0).getTabLeader()).isEqualTo("underscore");
        assertThat(records.get(1).getTabLeader()).isNull();
    }

    @Test
    @DisplayName("包含表格单元格中的段落，不包含文本框中嵌套的段落")
    void includesTableCellsButNotTextBoxes() {
        List<ParagraphRecord> records = extractor.extract(XmlFixtures.document(""
                + "<w:tbl><w:tr><w:tc>" + XmlFixtures.paragraph("cell") + "</w:tc></w:tr></w:tbl>"
                + "<w:p><w:r><w:t>anchor</w:t><w:txbxContent>" + XmlFixtures.paragraph("inside box")
                + "</w:txbxContent></w:r></w:p>"));

        assertThat(records).extracting(ParagraphRecord::getText).containsExactly("cell", "anchor");
    }

    @Test
    @DisplayName("正文部件缺失时返回空列表并记录诊断")
    void missingDocumentPart() {
        assertThat(extractor.extract(null)).isEmpty();
        assertThat(diagnostics.has(DiagnosticKind.MISSING_PART)).isTrue();
    }
}
