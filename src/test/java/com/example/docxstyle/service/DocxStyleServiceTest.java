package com.example.docxstyle.service;

import com.example.docxstyle.config.DocxStyleProperties;
import com.example.docxstyle.dto.BatchDocument;
import com.example.docxstyle.dto.BatchItemResult;
import com.example.docxstyle.exception.DocxStyleException;
import com.example.docxstyle.util.diagnostic.Diagnostic;
import com.example.docxstyle.util.diagnostic.DiagnosticKind;
import com.example.docxstyle.util.docx.ConversionResult;
import com.example.docxstyle.util.docx.DocxFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class DocxStyleServiceTest {

    private DocxStyleService service;

    @BeforeEach
    void setUp() {
        DocxStyleProperties properties = new DocxStyleProperties();
        properties.getBatch().setParallelism(2);
        service = new DocxStyleService(properties);
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    @Test
    @DisplayName("转换POI生成的DOCX，缺失的样式和编号部件只记录诊断")
    void convertsMinimalDocx() {
        ConversionResult result = service.convert(DocxFixtures.docx("Hello", "World"));

        assertThat(result.getParagraphCount()).isEqualTo(2);
        assertThat(result.getCss()).contains(".docx-document");
        assertThat(result.getDiagnostics())
                .filteredOn(d -> d.getKind() == DiagnosticKind.MISSING_PART)
                .extracting(Diagnostic::getSource)
                .contains("word/numbering.xml");
    }

    @Test
    @DisplayName("无效内容抛出 DocxStyleException")
    void rejectsInvalidDocx() {
        byte[] garbage = "plain text".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> service.convert(garbage)).isInstanceOf(DocxStyleException.class);
    }

    @Test
    @DisplayName("批量转换保持输入顺序，单个失败不影响其他文档")
    void isolatesBatchFailures() {
        List<BatchDocument> documents = Arrays.asList(
                new BatchDocument(0, "first.docx", DocxFixtures.docx("One")),
                new BatchDocument(1, "broken.docx", "broken".getBytes(StandardCharsets.UTF_8)),
                new BatchDocument(2, "third.docx", DocxFixtures.docx("Three")));

        List<BatchItemResult> results = service.convertBatch(documents);

        assertThat(results).extracting(BatchItemResult::getName)
                .containsExactly("first.docx", "broken.docx", "third.docx");
        assertThat(results.get(0).isSuccess()).isTrue();
        assertThat(results.get(0).getResult().getParagraphCount()).isEqualTo(1);
        assertThat(results.get(1).isSuccess()).isFalse();
        assertThat(results.get(1).getError()).isNotBlank();
        assertThat(results.get(1).getResult()).isNull();
        assertThat(results.get(2).isSuccess()).isTrue();
    }

    @Test
    @DisplayName("同名文档分别转换，结果按序号区分")
    void keepsDocumentsWithSameName() {
        List<BatchDocument> documents = Arrays.asList(
                new BatchDocument(0, "a.docx", DocxFixtures.docx("One")),
                new BatchDocument(1, "a.docx", DocxFixtures.docx("Two", "Three")));

        List<BatchItemResult> results = service.convertBatch(documents);

        assertThat(results).extracting(BatchItemResult::getIndex, BatchItemResult::getName)
                .containsExactly(tuple(0, "a.docx"), tuple(1, "a.docx"));
        assertThat(results).extracting(item -> item.getResult().getParagraphCount())
                .containsExactly(1, 2);
    }

    @Test
    @DisplayName("渲染Markdown与完整HTML")
    void rendersOutputs() {
        byte[] docx = DocxFixtures.docx("Quarterly summary");

        assertThat(service.renderMarkdown(docx)).isEqualTo("Quarterly summary\n");
        String html = service.renderHtml(docx, "summary", true);
        assertThat(html).contains("<style>").contains("<title>summary</title>").contains("Quarterly summary");
        assertThat(service.renderHtml(docx, "summary", false)).doesNotContain("<style>");
    }
}
