package com.example.docxstyle.util.structure;

import com.example.docxstyle.util.style.LeaderChars;
import com.example.docxstyle.util.style.StyleKind;
import com.example.docxstyle.util.style.StyleRecord;
import com.example.docxstyle.util.style.StyleTable;
import com.example.docxstyle.util.style.TabStop;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 文档结构分析器（启发式状态机）
 *
 * 两遍扫描：
 * 1. 模式统计：每个非空段落的第一行按规则表逐条匹配，出现次数达到阈值的形状提升为结构模式
 * 2. 状态机扫描：Scanning / InToc 两个状态识别目录条目，同时按 numId 变化切分列表分组、记录标题
 *
 * 每次进入 InToc 开始一个新的目录区，条目数按目录区计数。
 *
 * 启发式规则不抛异常：未识别的段落保持为普通段落。
 */
@Slf4j
public class StructureAnalyzer {

    // ==================== 常量定义 ====================

    /**
     * 目录标题文本（整段匹配，忽略大小写）
     */
    private static final Pattern TOC_HEADING_PATTERN =
            Pattern.compile("^\\s*(table\\s+of\\s+contents|contents|目\\s*录)\\s*$", Pattern.CASE_INSENSITIVE);

    /**
     * 目录条目：文本 + 点/空格引导 + 页码
     */
    private static final Pattern TOC_ENTRY_PATTERN =
            Pattern.compile("^(.*?\\S)[\\s.·…_\\-]+(\\d{1,4})\\s*$");

    /**
     * 目录样式级别，如 TOC1 / toc 2
     */
    private static final Pattern TOC_STYLE_LEVEL_PATTERN =
            Pattern.compile("(?i)toc\\s*(\\d)");

    /**
     * 标题样式，如 Heading1 / heading 2 / Title
     */
    private static final Pattern HEADING_STYLE_PATTERN =
            Pattern.compile("(?i)^(heading\\s*(\\d)|title)$");

    /**
     * 进入目录后连续多少个非条目段落视为误判并退出
     */
    private static final int TOC_MAX_GAP = 5;

    /**
     * 标题锚点 id 前缀，后接段落序号
     */
    public static final String HEADING_ANCHOR_PREFIX = "docx-heading-";

    private final AnalyzerOptions options;
    private final StyleTable styles;

    public StructureAnalyzer(AnalyzerOptions options, StyleTable styles) {
        this.options = options != null ? options : AnalyzerOptions.defaults();
        this.styles = styles != null ? styles : StyleTable.empty();
    }

    /**
     * 分析段落流
     *
     * @param paragraphs 按文档顺序的段落记录
     * @return 结构模型
     */
    public StructureModel analyze(List<ParagraphRecord> paragraphs) {
        StructureModel model = new StructureModel();
        if (paragraphs == null || paragraphs.isEmpty()) {
            return model;
        }

        List<PatternRule> promoted = countPatterns(paragraphs, model);
        scan(paragraphs, promoted, model);

        log.info("结构分析完成: 段落={}, 目录={}, 目录条目={}, 标题={}, 列表分组={}, 特殊模式={}",
                paragraphs.size(), model.isHasToc(), model.getTocEntries().size(), model.getHeadings().size(),
                model.getLists().size(), model.getSpecialPatterns().size());
        return model;
    }

    // ==================== 第一遍：模式统计 ====================

    private List<PatternRule> countPatterns(List<ParagraphRecord> paragraphs, StructureModel model) {
        List<PatternRule> rules = options.effectiveRules();
        Map<String, StructureModel.PatternMatch> stats = new LinkedHashMap<>();

        for (ParagraphRecord p : paragraphs) {
            recordStyleUsage(p, model);
            String firstLine = p.firstLine();
            if (firstLine.isEmpty()) {
                continue;
            }
            for (PatternRule rule : rules) {
                if (!rule.matches(firstLine)) {
                    continue;
                }
                StructureModel.PatternMatch match = stats.computeIfAbsent(rule.getPatternKind(),
                        k -> new StructureModel.PatternMatch(k, 0, new ArrayList<>()));
                match.setOccurrenceCount(match.getOccurrenceCount() + 1);
                if (match.getExamples().size() < options.getMaxExamples()) {
                    match.getExamples().add(firstLine);
                }
            }
        }

        List<PatternRule> promoted = new ArrayList<>();
        for (PatternRule rule : rules) {
            StructureModel.PatternMatch match = stats.get(rule.getPatternKind());
            if (match != null && match.getOccurrenceCount() >= rule.getMinOccurrences()) {
                promoted.add(rule);
                model.getSpecialPatterns().add(match);
                log.debug("提升结构模式: {} ({}次)", rule.getPatternKind(), match.getOccurrenceCount());
            }
        }
        return promoted;
    }

    private void recordStyleUsage(ParagraphRecord p, StructureModel model) {
        if (p.getStyleId() == null) {
            return;
        }
        StructureModel.StyleUsage usage = model.getStyleUsage()
                .computeIfAbsent(p.getStyleId(), k -> new StructureModel.StyleUsage());
        usage.setCount(usage.getCount() + 1);
        if (!p.isBlank() && usage.getSamples().size() < options.getStyleSamples()) {
            String text = p.getText().trim();
            usage.getSamples().add(text.length() > options.getStyleSampleLength()
                    ? text.substring(0, options.getStyleSampleLength())
                    : text);
        }
    }

    // ==================== 第二遍：状态机 ====================

    private void scan(List<ParagraphRecord> paragraphs, List<PatternRule> promoted, StructureModel model) {
        ScanState state = ScanState.SCANNING;
        StructureModel.ListGroup current = null;
        int gap = 0;
        int region = -1;
        int regionEntries = 0;

        for (ParagraphRecord p : paragraphs) {
            if (state == ScanState.SCANNING && entersToc(p)) {
                state = ScanState.IN_TOC;
                gap = 0;
                region++;
                regionEntries = 0;
                current = null;
                model.setHasToc(true);
                if (model.getTocStartIndex() == null) {
                    model.setTocStartIndex(p.getIndex());
                }
                log.debug("进入目录: 段落 {}, 目录区 {}", p.getIndex(), region);
            }

            if (state == ScanState.IN_TOC) {
                StructureModel.TocEntry entry = parseTocEntry(p);
                if (entry != null) {
                    entry.setTocRegion(region);
                    model.getTocEntries().add(entry);
                    regionEntries++;
                    gap = 0;
                    continue;
                }
                if (shouldExitToc(p, regionEntries, ++gap)) {
                    state = ScanState.SCANNING;
                    log.debug("退出目录: 段落 {}", p.getIndex());
                } else {
                    continue;
                }
            }

            recordHeading(p, model);
            current = updateLists(p, current, promoted, model);
        }
    }

    private void recordHeading(ParagraphRecord p, StructureModel model) {
        if (p.isBlank()) {
            return;
        }
        Integer level = headingLevel(p.getStyleId());
        if (level != null) {
            model.getHeadings().add(new StructureModel.Heading(p.getIndex(), level, p.getText().trim(),
                    HEADING_ANCHOR_PREFIX + p.getIndex()));
        }
    }

    /**
     * 是否从 Scanning 进入 InToc：目录样式、目录标题文本或 TOC 域开始标记
     */
    boolean entersToc(ParagraphRecord p) {
        return p.isTocFieldBegin()
                || isTocStyle(p.getStyleId())
                || isTocHeadingText(p);
    }

    private static boolean isTocHeadingText(ParagraphRecord p) {
        return p.getText() != null && TOC_HEADING_PATTERN.matcher(p.getText()).matches();
    }

    private boolean shouldExitToc(ParagraphRecord p, int entries, int gap) {
        if (entries >= options.getTocExitMinEntries() && (p.isBlank() || isNormal(p.getStyleId()))) {
            return true;
        }
        if (entries >= 1 && isHeadingStyle(p.getStyleId())) {
            return true;
        }
        // 目录标题、目录样式段落留在目录区内
        if (isTocStyle(p.getStyleId()) || isTocHeadingText(p)) {
            return false;
        }
        return gap >= TOC_MAX_GAP && !p.isBlank();
    }

    /**
     * 解析目录条目；不符合"文本 + 引导符 + 页码"形状时返回null
     */
    StructureModel.TocEntry parseTocEntry(ParagraphRecord p) {
        if (p.isBlank()) {
            return null;
        }
        String text = p.getText().replace('\n', ' ').trim();
        Matcher m = TOC_ENTRY_PATTERN.matcher(text);
        if (!m.matches()) {
            return null;
        }
        String title = m.group(1).trim();
        int page = Integer.parseInt(m.group(2));
        return new StructureModel.TocEntry(p.getIndex(), tocLevel(p.getStyleId()), title, page, leaderOf(p), 0);
    }

    private StructureModel.ListGroup updateLists(ParagraphRecord p, StructureModel.ListGroup current,
                                                 List<PatternRule> promoted, StructureModel model) {
        if (p.isNumbered()) {
            if (current == null || !current.getNumId().equals(p.getNumId())) {
                current = new StructureModel.ListGroup(p.getNumId());
                model.getLists().add(current);
            }
            current.getItems().add(new StructureModel.ListItem(p.getIndex(), p.levelOrZero(), false, null));
            return current;
        }
        if (current == null) {
            return null;
        }
        String kind = matchPromoted(p, promoted);
        if (kind == null) {
            return null;
        }
        List<StructureModel.ListItem> items = current.getItems();
        int level = items.get(items.size() - 1).getLevel();
        items.add(new StructureModel.ListItem(p.getIndex(), level, true, kind));
        return current;
    }

    private static String matchPromoted(ParagraphRecord p, List<PatternRule> promoted) {
        String firstLine = p.firstLine();
        for (PatternRule rule : promoted) {
            if (rule.matches(firstLine)) {
                return rule.getPatternKind();
            }
        }
        return null;
    }

    // ==================== 样式判断 ====================

    private boolean isTocStyle(String styleId) {
        if (styleId == null) {
            return false;
        }
        if (styleId.toLowerCase().contains("toc")) {
            return true;
        }
        StyleRecord record = styles.get(StyleKind.PARAGRAPH, styleId);
        return record != null && record.getName() != null && record.getName().toLowerCase().startsWith("toc");
    }

    private boolean isNormal(String styleId) {
        if (styleId == null || "Normal".equalsIgnoreCase(styleId)) {
            return true;
        }
        StyleRecord defaultStyle = styles.defaultStyle(StyleKind.PARAGRAPH);
        return defaultStyle != null && defaultStyle.getId().equals(styleId);
    }

    private boolean isHeadingStyle(String styleId) {
        return headingLevel(styleId) != null;
    }

    /**
     * 标题级别 1-6：Heading N 取 N，Title 为 1，其余按大纲级别 + 1；非标题返回null
     */
    Integer headingLevel(String styleId) {
        if (styleId == null || isTocStyle(styleId)) {
            return null;
        }
        Matcher m = HEADING_STYLE_PATTERN.matcher(styleId);
        if (m.matches()) {
            return m.group(2) != null ? clampHeading(Integer.parseInt(m.group(2))) : 1;
        }
        // 大纲级别 0-8 为标题，9 为正文
        Integer outline = styles.resolveEffective(StyleKind.PARAGRAPH, styleId)
                .map(s -> s.getParagraph().getOutlineLevel())
                .orElse(null);
        if (outline != null && outline >= 0 && outline < 9) {
            return clampHeading(outline + 1);
        }
        return null;
    }

    private static int clampHeading(int level) {
        return Math.max(1, Math.min(6, level));
    }

    private int tocLevel(String styleId) {
        if (styleId == null) {
            return 1;
        }
        Matcher m = TOC_STYLE_LEVEL_PATTERN.matcher(styleId);
        if (m.find()) {
            return Integer.parseInt(m.group(1));
        }
        StyleRecord record = styles.get(StyleKind.PARAGRAPH, styleId);
        if (record != null && record.getName() != null) {
            m = TOC_STYLE_LEVEL_PATTERN.matcher(record.getName());
            if (m.find()) {
                return Integer.parseInt(m.group(1));
            }
        }
        return 1;
    }

    /**
     * 前导符：段落自身的右对齐制表位优先，其次是样式（含 basedOn）中的右对齐制表位
     */
    private String leaderOf(ParagraphRecord p) {
        if (p.getTabLeader() != null) {
            return LeaderChars.fromWord(p.getTabLeader());
        }
        Optional<TabStop> styleTab = styles.resolveEffective(StyleKind.PARAGRAPH, p.getStyleId())
                .map(s -> s.getParagraph().rightLeaderTab());
        return styleTab.map(tab -> LeaderChars.fromWord(tab.getLeader())).orElse(null);
    }
}
