package com.example.docxstyle.util.docx;

import com.example.docxstyle.exception.DocxStyleException;
import com.example.docxstyle.util.diagnostic.Diagnostics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocxPackageReaderTest {

    private final DocxPackageReader reader = new DocxPackageReader();

    @Test
    @DisplayName("读取POI生成的DOCX：正文部件存在，未创建的部件为null")
    void readsGeneratedDocx() {
        DocxParts parts = reader.read(DocxFixtures.docx("Hello", "World"), new Diagnostics());

        assertThat(parts.getDocument()).isNotNull();
        assertThat(parts.getDocument().getDocumentElement().getLocalName()).isEqualTo("document");
        assertThat(parts.getNumbering()).isNull();
        assertThat(parts.isEmpty()).isFalse();
    }

    @Test
    @DisplayName("非OOXML内容抛出 DocxStyleException")
    void rejectsGarbage() {
        byte[] garbage = "definitely not a zip archive".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> reader.read(garbage, new Diagnostics()))
                .isInstanceOf(DocxStyleException.class);
    }

    @Test
    @DisplayName("空内容抛出 DocxStyleException")
    void rejectsEmptyInput() {
        assertThatThrownBy(() -> reader.read(new byte[0], new Diagnostics()))
                .isInstanceOf(DocxStyleException.class)
                .hasMessageContaining("为空");
    }
}
