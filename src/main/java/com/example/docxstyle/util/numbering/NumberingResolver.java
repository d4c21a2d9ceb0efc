package com.example.docxstyle.util.numbering;

import com.example.docxstyle.util.diagnostic.DiagnosticKind;
import com.example.docxstyle.util.diagnostic.Diagnostics;
import com.example.docxstyle.util.style.FormattingParser;
import com.example.docxstyle.util.xml.WordXmlQuery;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 编号定义解析（word/numbering.xml）
 *
 * 步骤：
 * 1. 解析所有 w:abstractNum 及其级别
 * 2. 解析所有 w:num，记录 abstractNumId 与级别覆盖（startOverride 或整级替换）
 * 3. 返回 NumberingTable，由其按 (numId, level) 计算有效级别
 *
 * 单个节点格式错误只跳过该节点并记录警告，不向外抛出异常。
 */
@Slf4j
public class NumberingResolver {

    private final WordXmlQuery query;
    private final FormattingParser formatting;
    private final Diagnostics diagnostics;

    public NumberingResolver(WordXmlQuery query) {
        this.query = query;
        this.formatting = new FormattingParser(query);
        this.diagnostics = query.getDiagnostics();
    }

    /**
     * @param numberingDoc numbering.xml 解析结果，缺失时为null
     * @return 编号表（缺失时为空表）
     */
    public NumberingTable resolve(Document numberingDoc) {
        if (numberingDoc == null) {
            log.info("numbering.xml 不存在，文档不含编号定义");
            diagnostics.add(DiagnosticKind.MISSING_PART, "word/numbering.xml", "编号定义部件缺失");
            return NumberingTable.empty();
        }

        Map<String, AbstractNumbering> abstracts = new LinkedHashMap<>();
        for (Element node : query.selectElements("/w:numbering/w:abstractNum", numberingDoc)) {
            try {
                AbstractNumbering abs = parseAbstract(node);
                if (abs != null) {
                    abstracts.putIfAbsent(abs.getId(), abs);
                }
            } catch (RuntimeException e) {
                log.warn("抽象编号定义解析失败，已跳过: {} - {}", query.attr(node, "w:abstractNumId"), e.getMessage());
                diagnostics.add(DiagnosticKind.MALFORMED_NODE,
                        "w:abstractNum/" + query.attr(node, "w:abstractNumId"), String.valueOf(e.getMessage()));
            }
        }

        Map<String, NumberingInstance> instances = new LinkedHashMap<>();
        for (Element node : query.selectElements("/w:numbering/w:num", numberingDoc)) {
            try {
                NumberingInstance instance = parseInstance(node);
                if (instance == null) {
                    continue;
                }
                if (instance.getAbstractNumId() == null || !abstracts.containsKey(instance.getAbstractNumId())) {
                    log.warn("编号实例引用了不存在的抽象定义: numId={}, abstractNumId={}",
                            instance.getNumId(), instance.getAbstractNumId());
                    diagnostics.add(DiagnosticKind.UNRESOLVABLE_REFERENCE, "w:num/" + instance.getNumId(),
                            "abstractNumId=" + instance.getAbstractNumId() + " 不存在");
                }
                instances.putIfAbsent(instance.getNumId(), instance);
            } catch (RuntimeException e) {
                log.warn("编号实例解析失败，已跳过: {} - {}", query.attr(node, "w:numId"), e.getMessage());
                diagnostics.add(DiagnosticKind.MALFORMED_NODE,
                        "w:num/" + query.attr(node, "w:numId"), String.valueOf(e.getMessage()));
            }
        }

        log.info("编号定义解析完成: 抽象定义={}, 编号实例={}", abstracts.size(), instances.size());
        return new NumberingTable(abstracts, instances);
    }

    private AbstractNumbering parseAbstract(Element node) {
        String id = query.attr(node, "w:abstractNumId");
        if (id == null) {
            log.warn("w:abstractNum 缺少 w:abstractNumId，已跳过");
            diagnostics.add(DiagnosticKind.MALFORMED_NODE, "w:abstractNum", "缺少 w:abstractNumId");
            return null;
        }
        LevelDef[] levels = new LevelDef[AbstractNumbering.LEVEL_COUNT];
        for (Element lvl : query.children(node, "w:lvl")) {
            LevelDef def = parseLevelSafely(lvl, "w:abstractNum/" + id);
            if (def != null && levels[def.getLevel()] == null) {
                levels[def.getLevel()] = def;
            }
        }
        return new AbstractNumbering(
                id,
                query.childAttr(node, "w:multiLevelType", "w:val"),
                query.childAttr(node, "w:styleLink", "w:val"),
                query.childAttr(node, "w:numStyleLink", "w:val"),
                levels);
    }

    private NumberingInstance parseInstance(Element node) {
        String numId = query.attr(node, "w:numId");
        if (numId == null) {
            log.warn("w:num 缺少 w:numId，已跳过");
            diagnostics.add(DiagnosticKind.MALFORMED_NODE, "w:num", "缺少 w:numId");
            return null;
        }
        LevelOverride[] overrides = new LevelOverride[AbstractNumbering.LEVEL_COUNT];
        for (Element override : query.children(node, "w:lvlOverride")) {
            Integer level = query.intAttr(override, "w:ilvl");
            if (!isValidLevel(level)) {
                log.warn("级别覆盖的 w:ilvl 无效: numId={}, ilvl={}", numId, level);
                diagnostics.add(DiagnosticKind.MALFORMED_NODE, "w:num/" + numId, "无效的覆盖级别: " + level);
                continue;
            }
            Integer startOverride = query.intAttr(query.child(override, "w:startOverride"), "w:val");
            Element lvl = query.child(override, "w:lvl");
            LevelDef replacement = lvl != null ? parseLevelSafely(lvl, "w:num/" + numId) : null;
            if (replacement != null && replacement.getLevel() != level) {
                // 以 lvlOverride 的级别为准
                replacement = replacement.toBuilder().level(level).build();
            }
            overrides[level] = new LevelOverride(level, startOverride, replacement);
        }
        return new NumberingInstance(numId, query.childAttr(node, "w:abstractNumId", "w:val"), overrides);
    }

    private LevelDef parseLevelSafely(Element lvl, String owner) {
        try {
            return parseLevel(lvl, owner);
        } catch (RuntimeException e) {
            log.warn("编号级别解析失败，已跳过: {} - {}", owner, e.getMessage());
            diagnostics.add(DiagnosticKind.MALFORMED_NODE, owner + "/w:lvl", String.valueOf(e.getMessage()));
            return null;
        }
    }

    /**
     * 解析级别定义；未设置的字段保持null，默认值在 NumberingTable 中统一填充
     */
    LevelDef parseLevel(Element lvl, String owner) {
        Integer level = query.intAttr(lvl, "w:ilvl");
        if (!isValidLevel(level)) {
            log.warn("编号级别 w:ilvl 无效: {} ilvl={}", owner, level);
            diagnostics.add(DiagnosticKind.MALFORMED_NODE, owner + "/w:lvl", "无效的 w:ilvl: " + level);
            return null;
        }
        String format = query.childAttr(lvl, "w:numFmt", "w:val");
        if (format != null && !NumberFormat.isSupported(format)) {
            log.debug("不支持的编号格式降级为 decimal: {} level={} format={}", owner, level, format);
        }

        // w:lvlText 存在但 w:val 为空表示不显示编号
        Element lvlText = query.child(lvl, "w:lvlText");
        String text = null;
        if (lvlText != null) {
            text = query.attr(lvlText, "w:val");
            if (text == null) {
                text = "";
            }
        }

        String tentative = query.attr(lvl, "w:tentative");
        return LevelDef.builder()
                .level(level)
                .format(format)
                .textPattern(text)
                .alignment(query.childAttr(lvl, "w:lvlJc", "w:val"))
                .start(query.intAttr(query.child(lvl, "w:start"), "w:val"))
                .restartAfterLevel(query.intAttr(query.child(lvl, "w:lvlRestart"), "w:val"))
                .legal(query.onOff(query.child(lvl, "w:isLgl")))
                .suffix(query.childAttr(lvl, "w:suff", "w:val"))
                .paragraphStyle(query.childAttr(lvl, "w:pStyle", "w:val"))
                .tentative(tentative == null ? null : "1".equals(tentative) || "true".equals(tentative))
                .paragraph(formatting.parseParagraph(query.child(lvl, "w:pPr")))
                .run(formatting.parseRun(query.child(lvl, "w:rPr")))
                .build();
    }

    private static boolean isValidLevel(Integer level) {
        return level != null && level >= 0 && level < AbstractNumbering.LEVEL_COUNT;
    }
}
