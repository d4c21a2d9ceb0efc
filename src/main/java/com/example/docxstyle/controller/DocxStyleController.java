package com.example.docxstyle.controller;

import com.example.docxstyle.dto.BatchDocument;
import com.example.docxstyle.dto.BatchItemResult;
import com.example.docxstyle.service.DocxStyleService;
import com.example.docxstyle.util.docx.ConversionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * DOCX样式转换控制器
 */
@Slf4j
@RestController
@RequestMapping("/api/docx-style")
public class DocxStyleController {

    static final MediaType TEXT_CSS = MediaType.valueOf("text/css;charset=UTF-8");
    static final MediaType TEXT_MARKDOWN = MediaType.valueOf("text/markdown;charset=UTF-8");
    static final MediaType TEXT_HTML = MediaType.valueOf("text/html;charset=UTF-8");

    @Autowired
    private DocxStyleService docxStyleService;

    /**
     * 转换DOCX：返回样式表、结构模型、文档树和诊断信息
     *
     * @param file DOCX文件
     */
    @PostMapping("/convert")
    public ResponseEntity<Map<String, Object>> convert(@RequestParam("file") MultipartFile file) throws IOException {
        requireDocx(file);
        log.info("收到转换请求: {}", file.getOriginalFilename());

        ConversionResult conversion = docxStyleService.convert(file.getBytes());

        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("message", "转换成功");
        result.put("originalFilename", file.getOriginalFilename());
        result.put("data", conversion);
        return ResponseEntity.ok(result);
    }

    /**
     * 只返回生成的CSS（text/css）
     */
    @PostMapping("/css")
    public ResponseEntity<String> css(@RequestParam("file") MultipartFile file) throws IOException {
        requireDocx(file);
        String css = docxStyleService.synthesizeCss(file.getBytes());
        return ResponseEntity.ok().contentType(TEXT_CSS).body(css);
    }

    /**
     * 渲染重建后的文档
     *
     * @param format       html 或 markdown
     * @param fullDocument 仅HTML有效：是否输出内嵌样式表的完整文档
     */
    @PostMapping("/render")
    public ResponseEntity<String> render(@RequestParam("file") MultipartFile file,
                                         @RequestParam(value = "format", defaultValue = "html") String format,
                                         @RequestParam(value = "fullDocument", defaultValue = "true") boolean fullDocument)
            throws IOException {
        requireDocx(file);
        if ("markdown".equalsIgnoreCase(format) || "md".equalsIgnoreCase(format)) {
            String markdown = docxStyleService.renderMarkdown(file.getBytes());
            return ResponseEntity.ok().contentType(TEXT_MARKDOWN).body(markdown);
        }
        if (!"html".equalsIgnoreCase(format)) {
            throw new IllegalArgumentException("不支持的输出格式: " + format + "（可选 html / markdown）");
        }
        String html = docxStyleService.renderHtml(file.getBytes(), baseName(file.getOriginalFilename()), fullDocument);
        return ResponseEntity.ok().contentType(TEXT_HTML).body(html);
    }

    /**
     * 批量转换，单个文件失败不影响其他文件
     */
    @PostMapping("/batch")
    public ResponseEntity<Map<String, Object>> batch(@RequestParam("files") MultipartFile[] files) throws IOException {
        if (files == null || files.length == 0) {
            throw new IllegalArgumentException("文件不能为空");
        }
        List<BatchDocument> documents = new ArrayList<>();
        for (MultipartFile file : files) {
            requireDocx(file);
            documents.add(new BatchDocument(documents.size(), file.getOriginalFilename(), file.getBytes()));
        }

        List<BatchItemResult> items = docxStyleService.convertBatch(documents);
        long failed = items.stream().filter(item -> !item.isSuccess()).count();

        Map<String, Object> result = new HashMap<>();
        result.put("success", failed == 0);
        result.put("message", failed == 0 ? "批量转换成功" : "部分文件转换失败: " + failed + "/" + items.size());
        result.put("data", items);
        return ResponseEntity.ok(result);
    }

    private void requireDocx(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("文件不能为空");
        }
        String originalFilename = file.getOriginalFilename();
        if (originalFilename == null || !originalFilename.toLowerCase().endsWith(".docx")) {
            throw new IllegalArgumentException("只支持.docx文件");
        }
    }

    private static String baseName(String filename) {
        if (filename == null) {
            return "document";
        }
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }
}
