package com.example.docxstyle.util.docx;

import com.example.docxstyle.exception.DocxStyleException;
import com.example.docxstyle.util.diagnostic.DiagnosticKind;
import com.example.docxstyle.util.diagnostic.Diagnostics;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ooxml.util.DocumentHelper;
import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.openxml4j.exceptions.InvalidOperationException;
import org.apache.poi.openxml4j.opc.OPCPackage;
import org.apache.poi.openxml4j.opc.PackagePart;
import org.apache.poi.openxml4j.opc.PackagePartName;
import org.apache.poi.openxml4j.opc.PackagingURIHelper;
import org.w3c.dom.Document;
import org.xml.sax.SAXException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * DOCX包读取：用 POI OPCPackage 打开包，按固定部件名取出XML并解析为DOM
 *
 * DOM 由 POI DocumentHelper 解析（命名空间感知，禁用外部实体）。
 * 单个部件解析失败按缺失处理，由后续阶段记录 MISSING_PART。
 */
@Slf4j
public class DocxPackageReader {

    /**
     * 读取DOCX字节
     *
     * @throws DocxStyleException 内容不是OOXML包时
     */
    public DocxParts read(byte[] docxBytes, Diagnostics diagnostics) {
        if (docxBytes == null || docxBytes.length == 0) {
            throw new DocxStyleException("DOCX内容为空");
        }
        try (InputStream in = new ByteArrayInputStream(docxBytes)) {
            return read(in, diagnostics);
        } catch (IOException e) {
            throw new DocxStyleException("读取DOCX失败: " + e.getMessage(), e);
        }
    }

    /**
     * 读取DOCX流（不关闭调用方的流）
     */
    public DocxParts read(InputStream in, Diagnostics diagnostics) {
        OPCPackage pkg;
        try {
            pkg = OPCPackage.open(in);
        } catch (InvalidFormatException | IOException | UnsupportedFileFormatException e) {
            throw new DocxStyleException("不是有效的DOCX文件: " + e.getMessage(), e);
        } catch (InvalidOperationException e) {
            // 损坏的zip或缺少 [Content_Types].xml
            throw new DocxStyleException("DOCX包结构损坏: " + e.getMessage(), e);
        }
        try {
            DocxParts parts = new DocxParts(
                    readPart(pkg, diagnostics, DocxParts.STYLES),
                    readPart(pkg, diagnostics, DocxParts.NUMBERING),
                    readPart(pkg, diagnostics, DocxParts.DOCUMENT),
                    readPart(pkg, diagnostics, DocxParts.THEME),
                    readPart(pkg, diagnostics, DocxParts.SETTINGS));
            log.debug("DOCX部件读取完成: styles={}, numbering={}, document={}, theme={}, settings={}",
                    parts.getStyles() != null, parts.getNumbering() != null, parts.getDocument() != null,
                    parts.getTheme() != null, parts.getSettings() != null);
            return parts;
        } finally {
            // 只读打开，不回写
            pkg.revert();
        }
    }

    private Document readPart(OPCPackage pkg, Diagnostics diagnostics, String name) {
        try {
            PackagePartName partName = PackagingURIHelper.createPartName(name);
            PackagePart part = pkg.getPart(partName);
            if (part == null) {
                return null;
            }
            try (InputStream in = part.getInputStream()) {
                return DocumentHelper.readDocument(in);
            }
        } catch (InvalidFormatException | IOException | SAXException e) {
            log.warn("部件解析失败，按缺失处理: {} - {}", name, e.getMessage());
            if (diagnostics != null) {
                diagnostics.add(DiagnosticKind.MALFORMED_NODE, name, "部件解析失败: " + e.getMessage());
            }
            return null;
        }
    }
}
