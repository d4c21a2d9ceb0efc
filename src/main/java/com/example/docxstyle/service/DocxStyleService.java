package com.example.docxstyle.service;

import com.example.docxstyle.config.DocxStyleProperties;
import com.example.docxstyle.dto.BatchDocument;
import com.example.docxstyle.dto.BatchItemResult;
import com.example.docxstyle.exception.DocxStyleException;
import com.example.docxstyle.util.diagnostic.Diagnostics;
import com.example.docxstyle.util.docx.ConversionResult;
import com.example.docxstyle.util.docx.DocxPackageReader;
import com.example.docxstyle.util.docx.DocxParts;
import com.example.docxstyle.util.docx.DocxStylePipeline;
import com.example.docxstyle.util.reconstruct.RenderOptions;
import com.example.docxstyle.util.reconstruct.StructureHtmlRenderer;
import com.example.docxstyle.util.reconstruct.StructureMarkdownRenderer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * DOCX样式转换服务
 * 读取DOCX包，生成CSS样式表、结构模型和重建后的文档树
 */
@Slf4j
@Service
public class DocxStyleService {

    private final DocxPackageReader reader = new DocxPackageReader();

    private final DocxStylePipeline pipeline;

    private final RenderOptions renderOptions;

    private final ExecutorService batchExecutor;

    public DocxStyleService(DocxStyleProperties properties) {
        this.pipeline = new DocxStylePipeline(properties.toPipelineOptions());
        this.renderOptions = properties.toRenderOptions();
        this.batchExecutor = Executors.newFixedThreadPool(Math.max(1, properties.getBatch().getParallelism()));
    }

    /**
     * 转换单个DOCX
     *
     * @param docxBytes DOCX文件内容
     * @return 转换结果（含诊断信息）
     * @throws DocxStyleException 不是有效的DOCX或没有任何可用部件
     */
    public ConversionResult convert(byte[] docxBytes) {
        String taskId = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        long start = System.currentTimeMillis();
        log.info("[taskId: {}] 开始转换, 大小={} bytes", taskId, docxBytes != null ? docxBytes.length : 0);

        Diagnostics diagnostics = new Diagnostics();
        DocxParts parts = reader.read(docxBytes, diagnostics);
        ConversionResult result = pipeline.convert(parts, null, diagnostics);

        log.info("[taskId: {}] 转换完成, 耗时 {} ms, 诊断 {} 条",
                taskId, System.currentTimeMillis() - start, result.getDiagnostics().size());
        return result;
    }

    /**
     * 只返回生成的样式表
     */
    public String synthesizeCss(byte[] docxBytes) {
        return convert(docxBytes).getCss();
    }

    /**
     * 渲染为HTML
     *
     * @param fullDocument true 时输出带内嵌样式表的完整HTML文档，否则只输出正文片段
     */
    public String renderHtml(byte[] docxBytes, String title, boolean fullDocument) {
        ConversionResult result = convert(docxBytes);
        StructureHtmlRenderer renderer = new StructureHtmlRenderer(result.getClassNames(), renderOptions);
        if (fullDocument) {
            return renderer.renderDocument(result.getTree(), result.getCss(), title);
        }
        return renderer.renderFragment(result.getTree());
    }

    public String renderMarkdown(byte[] docxBytes) {
        ConversionResult result = convert(docxBytes);
        return new StructureMarkdownRenderer(renderOptions).render(result.getTree());
    }

    /**
     * 批量转换，各文档相互独立：单个文档失败只影响它自己的结果
     *
     * @param documents 输入文档（同名文件各自独立）
     * @return 与输入一一对应、顺序相同的结果
     */
    public List<BatchItemResult> convertBatch(List<BatchDocument> documents) {
        List<CompletableFuture<BatchItemResult>> futures = new ArrayList<>();
        for (BatchDocument document : documents) {
            futures.add(CompletableFuture.supplyAsync(() -> convertOne(document), batchExecutor));
        }

        List<BatchItemResult> results = new ArrayList<>();
        int failed = 0;
        for (CompletableFuture<BatchItemResult> future : futures) {
            BatchItemResult item = future.join();
            if (!item.isSuccess()) {
                failed++;
            }
            results.add(item);
        }
        log.info("批量转换完成: 共 {} 个, 失败 {} 个", results.size(), failed);
        return results;
    }

    private BatchItemResult convertOne(BatchDocument document) {
        int index = document.getIndex();
        String name = document.getName();
        try {
            return BatchItemResult.success(index, name, convert(document.getContent()));
        } catch (DocxStyleException e) {
            log.warn("文档转换失败: [{}] {} - {}", index, name, e.getMessage());
            return BatchItemResult.failure(index, name, e.getMessage());
        } catch (RuntimeException e) {
            log.error("文档转换异常: [{}] {}", index, name, e);
            return BatchItemResult.failure(index, name, "转换异常: " + e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        batchExecutor.shutdown();
    }
}
