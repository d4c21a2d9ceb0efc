package com.example.docxstyle.util.docx;

import com.example.docxstyle.exception.DocxStyleException;
import com.example.docxstyle.util.css.CssClassNames;
import com.example.docxstyle.util.css.StylesheetSynthesizer;
import com.example.docxstyle.util.diagnostic.Diagnostics;
import com.example.docxstyle.util.numbering.NumberingResolver;
import com.example.docxstyle.util.numbering.NumberingTable;
import com.example.docxstyle.util.reconstruct.DocumentTree;
import com.example.docxstyle.util.reconstruct.ListTocReconstructor;
import com.example.docxstyle.util.structure.ParagraphRecord;
import com.example.docxstyle.util.structure.StructureAnalyzer;
import com.example.docxstyle.util.structure.StructureModel;
import com.example.docxstyle.util.style.DocumentSettings;
import com.example.docxstyle.util.style.SettingsParser;
import com.example.docxstyle.util.style.StyleTable;
import com.example.docxstyle.util.style.StyleTableBuilder;
import com.example.docxstyle.util.style.ThemeInfo;
import com.example.docxstyle.util.style.ThemeParser;
import com.example.docxstyle.util.xml.WordXmlQuery;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 样式/编号解析与结构重建流水线
 *
 * 各阶段同步顺序执行：样式表 → 主题 → 设置 → 编号 → 段落 → 结构分析 → 样式表生成 → 重建。
 * 每次调用新建全部中间实体，不持有可变状态，多个文档可并发调用同一实例。
 */
@Slf4j
public class DocxStylePipeline {

    private final PipelineOptions options;

    public DocxStylePipeline(PipelineOptions options) {
        this.options = options != null ? options : PipelineOptions.defaults();
    }

    public ConversionResult convert(DocxParts parts) {
        return convert(parts, null, new Diagnostics());
    }

    /**
     * 执行转换
     *
     * @param parts       XML部件
     * @param paragraphs  外部提供的段落流；为null时从 document.xml 提取
     * @param diagnostics 诊断收集器（调用方可能已记录了包读取阶段的诊断）
     * @return 尽力而为的结果及诊断信息
     * @throws DocxStyleException 五个XML部件全部缺失时
     */
    public ConversionResult convert(DocxParts parts, List<ParagraphRecord> paragraphs, Diagnostics diagnostics) {
        if (parts == null || parts.isEmpty()) {
            throw new DocxStyleException("DOCX中没有任何可用的XML部件（styles/numbering/document/theme/settings）");
        }
        Diagnostics diag = diagnostics != null ? diagnostics : new Diagnostics();
        WordXmlQuery query = new WordXmlQuery(options.getNamespaces(), diag);

        // Step 1: 样式、主题、设置
        StyleTable styles = new StyleTableBuilder(query, options.getMaxBasedOnHops()).build(parts.getStyles());
        ThemeInfo theme = new ThemeParser(query).parse(parts.getTheme());
        DocumentSettings settings = new SettingsParser(query).parse(parts.getSettings(), parts.getDocument());

        // Step 2: 编号
        NumberingTable numbering = new NumberingResolver(query).resolve(parts.getNumbering());

        // Step 3: 段落流与结构分析
        List<ParagraphRecord> records = paragraphs != null
                ? paragraphs
                : new ParagraphRecordExtractor(query).extract(parts.getDocument());
        StructureModel structure = new StructureAnalyzer(options.getAnalyzer(), styles).analyze(records);

        // Step 4: 样式表
        CssClassNames classNames = new CssClassNames(styles);
        String css = new StylesheetSynthesizer(options.getSynthesis(), diag)
                .synthesize(styles, numbering, theme, settings, classNames);

        // Step 5: 列表与目录重建
        DocumentTree tree = new ListTocReconstructor(numbering).reconstruct(records, structure);

        ConversionResult result = new ConversionResult();
        result.setCss(css);
        result.setStructure(structure);
        result.setTree(tree);
        result.setDiagnostics(diag.list());
        result.setParagraphCount(records.size());
        result.setStyleCount(styles.size());
        result.setStyles(styles);
        result.setNumbering(numbering);
        result.setTheme(theme);
        result.setSettings(settings);
        result.setClassNames(classNames);
        result.setParagraphs(records);

        log.info("转换完成: 样式={}, 段落={}, 列表={}, 目录条目={}, 诊断={}",
                styles.size(), records.size(), structure.getLists().size(),
                structure.getTocEntries().size(), result.getDiagnostics().size());
        return result;
    }
}
