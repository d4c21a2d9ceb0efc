package com.example.docxstyle.util.style;

import com.example.docxstyle.util.diagnostic.DiagnosticKind;
import com.example.docxstyle.util.diagnostic.Diagnostics;
import com.example.docxstyle.util.xml.WordXmlQuery;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 样式表构建器（word/styles.xml）
 *
 * 功能：
 * - 解析 w:docDefaults 的文档级默认字符/段落格式
 * - 解析每个 w:style 为 StyleRecord，按类型分到四张表
 * - 单个样式解析失败只跳过该样式（记 MALFORMED_NODE）
 * - 构建完成后校验所有 basedOn 链，截断的链各记一条 UNRESOLVABLE_REFERENCE
 *
 * 不在这里合并 basedOn，合并由 {@link StyleTable#resolveEffective} 按需完成。
 */
@Slf4j
public class StyleTableBuilder {

    private final WordXmlQuery query;
    private final FormattingParser formatting;
    private final Diagnostics diagnostics;
    private final int maxHops;

    public StyleTableBuilder(WordXmlQuery query) {
        this(query, StyleTable.DEFAULT_MAX_HOPS);
    }

    public StyleTableBuilder(WordXmlQuery query, int maxHops) {
        this.query = query;
        this.formatting = new FormattingParser(query);
        this.diagnostics = query.getDiagnostics();
        this.maxHops = maxHops;
    }

    /**
     * 构建样式表
     *
     * @param stylesDoc styles.xml 解析结果，缺失时为null
     * @return 样式表（缺失时为空表）
     */
    public StyleTable build(Document stylesDoc) {
        if (stylesDoc == null) {
            log.warn("styles.xml 不存在，使用空样式表");
            diagnostics.add(DiagnosticKind.MISSING_PART, "word/styles.xml", "样式定义部件缺失，使用默认样式");
            return StyleTable.empty();
        }

        DocumentDefaults defaults = parseDocumentDefaults(stylesDoc);

        Map<StyleKind, Map<String, StyleRecord>> byKind = new EnumMap<>(StyleKind.class);
        for (StyleKind kind : StyleKind.values()) {
            byKind.put(kind, new LinkedHashMap<>());
        }

        int skipped = 0;
        for (Element styleNode : query.selectElements("/w:styles/w:style", stylesDoc)) {
            try {
                StyleRecord record = parseStyle(styleNode);
                if (record == null) {
                    skipped++;
                    continue;
                }
                Map<String, StyleRecord> target = byKind.get(record.getKind());
                if (target.containsKey(record.getId())) {
                    log.warn("重复的样式id，保留第一个定义: {}", record.getId());
                    diagnostics.add(DiagnosticKind.MALFORMED_NODE, "w:style/" + record.getId(), "重复的样式id");
                    continue;
                }
                target.put(record.getId(), record);
            } catch (RuntimeException e) {
                skipped++;
                String id = query.attr(styleNode, "w:styleId");
                log.warn("样式解析失败，已跳过: {} - {}", id, e.getMessage());
                diagnostics.add(DiagnosticKind.MALFORMED_NODE, "w:style/" + id, String.valueOf(e.getMessage()));
            }
        }

        StyleTable table = new StyleTable(byKind, defaults, maxHops);
        validateChains(table);

        log.info("样式表构建完成: 段落={}, 字符={}, 表格={}, 编号={}, 跳过={}",
                byKind.get(StyleKind.PARAGRAPH).size(),
                byKind.get(StyleKind.CHARACTER).size(),
                byKind.get(StyleKind.TABLE).size(),
                byKind.get(StyleKind.NUMBERING).size(),
                skipped);
        return table;
    }

    /**
     * 解析单个 w:style
     *
     * @return 样式记录；缺少 styleId 或类型未知时返回null
     */
    StyleRecord parseStyle(Element styleNode) {
        String id = query.attr(styleNode, "w:styleId");
        if (id == null) {
            log.warn("样式缺少 w:styleId，已跳过");
            diagnostics.add(DiagnosticKind.MALFORMED_NODE, "w:style", "缺少 w:styleId");
            return null;
        }
        String type = query.attr(styleNode, "w:type");
        StyleKind kind = StyleKind.fromXml(type);
        if (kind == null) {
            log.warn("未知样式类型: {} ({})", type, id);
            diagnostics.add(DiagnosticKind.MALFORMED_NODE, "w:style/" + id, "未知样式类型: " + type);
            return null;
        }

        String name = query.childAttr(styleNode, "w:name", "w:val");
        String basedOn = query.childAttr(styleNode, "w:basedOn", "w:val");
        if (id.equals(basedOn)) {
            // 自引用视为断链
            log.warn("样式 basedOn 指向自身: {}", id);
            diagnostics.add(DiagnosticKind.UNRESOLVABLE_REFERENCE, "w:style/" + id, "basedOn 指向自身");
            basedOn = null;
        }

        return StyleRecord.builder()
                .id(id)
                .kind(kind)
                .name(name != null ? name : id)
                .basedOn(basedOn)
                .defaultStyle("1".equals(query.attr(styleNode, "w:default"))
                        || "true".equals(query.attr(styleNode, "w:default")))
                .run(formatting.parseRun(query.child(styleNode, "w:rPr")))
                .paragraph(formatting.parseParagraph(query.child(styleNode, "w:pPr")))
                .table(formatting.parseTable(query.child(styleNode, "w:tblPr")))
                .build();
    }

    private DocumentDefaults parseDocumentDefaults(Document stylesDoc) {
        Element docDefaults = query.selectElement("/w:styles/w:docDefaults", stylesDoc);
        if (docDefaults == null) {
            return DocumentDefaults.EMPTY;
        }
        RunFormatting run = formatting.parseRun(
                query.selectElement("w:rPrDefault/w:rPr", docDefaults));
        ParagraphFormatting paragraph = formatting.parseParagraph(
                query.selectElement("w:pPrDefault/w:pPr", docDefaults));
        return new DocumentDefaults(run, paragraph);
    }

    private void validateChains(StyleTable table) {
        Set<String> reported = new HashSet<>();
        for (StyleKind kind : StyleKind.values()) {
            for (StyleRecord record : table.styles(kind).values()) {
                if (record.getBasedOn() == null) {
                    continue;
                }
                StyleTable.Chain chain = table.resolveChain(kind, record.getId());
                // 每个断点只报告一次，避免整条链重复报告
                if (!chain.isBroken() || !reported.add(kind + ":" + chain.getBrokenAt())) {
                    continue;
                }
                StyleRecord brokenAt = table.get(kind, chain.getBrokenAt());
                log.warn("样式 basedOn 链被截断: {} -> {} ({})",
                        brokenAt.getId(), brokenAt.getBasedOn(), chain.getBreakReason());
                diagnostics.add(DiagnosticKind.UNRESOLVABLE_REFERENCE, "w:style/" + brokenAt.getId(),
                        "basedOn=" + brokenAt.getBasedOn() + " " + chain.getBreakReason());
            }
        }
    }
}
