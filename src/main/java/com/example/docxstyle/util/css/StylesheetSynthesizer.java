package com.example.docxstyle.util.css;

import com.example.docxstyle.util.diagnostic.DiagnosticKind;
import com.example.docxstyle.util.diagnostic.Diagnostics;
import com.example.docxstyle.util.numbering.AbstractNumbering;
import com.example.docxstyle.util.numbering.EffectiveLevel;
import com.example.docxstyle.util.numbering.LevelTextPattern;
import com.example.docxstyle.util.numbering.NumberFormat;
import com.example.docxstyle.util.numbering.NumberingInstance;
import com.example.docxstyle.util.numbering.NumberingTable;
import com.example.docxstyle.util.style.BorderSpec;
import com.example.docxstyle.util.style.DocumentDefaults;
import com.example.docxstyle.util.style.DocumentSettings;
import com.example.docxstyle.util.style.Indentation;
import com.example.docxstyle.util.style.PageSetup;
import com.example.docxstyle.util.style.ParagraphFormatting;
import com.example.docxstyle.util.style.RunFormatting;
import com.example.docxstyle.util.style.Spacing;
import com.example.docxstyle.util.style.StyleKind;
import com.example.docxstyle.util.style.StyleRecord;
import com.example.docxstyle.util.style.StyleTable;
import com.example.docxstyle.util.style.TableFormatting;
import com.example.docxstyle.util.style.ThemeInfo;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 样式表生成器
 *
 * 输出顺序固定：文档默认 → 段落样式 → 字符样式 → 表格样式 → 编号规则 → 列表容器 → 目录。
 * 相同输入得到逐字节相同的输出（不含时间戳、随机值）。
 * 生成过程中出现任何异常时返回 {@link FallbackStylesheet#CSS}。
 */
@Slf4j
public class StylesheetSynthesizer {

    public static final String DOCUMENT_CLASS = "docx-document";
    public static final String LIST_CLASS = "docx-list";

    private static final int TOC_LEVELS = 9;
    private static final int DEFAULT_TOC_INDENT_TWIPS = 220;

    private static final Map<String, String> BORDER_STYLES = new HashMap<>();

    static {
        BORDER_STYLES.put("single", "solid");
        BORDER_STYLES.put("thick", "solid");
        BORDER_STYLES.put("double", "double");
        BORDER_STYLES.put("dotted", "dotted");
        BORDER_STYLES.put("dashed", "dashed");
        BORDER_STYLES.put("dotDash", "dashed");
        BORDER_STYLES.put("dotDotDash", "dotted");
        BORDER_STYLES.put("triple", "double");
        BORDER_STYLES.put("wave", "solid");
        BORDER_STYLES.put("threeDEmboss", "ridge");
        BORDER_STYLES.put("threeDEngrave", "groove");
        BORDER_STYLES.put("outset", "outset");
        BORDER_STYLES.put("inset", "inset");
    }

    private final SynthesisOptions options;
    private final Diagnostics diagnostics;

    public StylesheetSynthesizer(SynthesisOptions options, Diagnostics diagnostics) {
        this.options = options != null ? options : SynthesisOptions.defaults();
        this.diagnostics = diagnostics;
    }

    public String synthesize(StyleTable styles, NumberingTable numbering, ThemeInfo theme, DocumentSettings settings) {
        try {
            return synthesize(styles, numbering, theme, settings, new CssClassNames(styles));
        } catch (RuntimeException e) {
            return fallback(e);
        }
    }

    /**
     * 生成样式表
     *
     * @param classNames 与HTML渲染共用的类名表
     * @return CSS文本；失败时为固定的基础样式表
     */
    public String synthesize(StyleTable styles, NumberingTable numbering, ThemeInfo theme,
                             DocumentSettings settings, CssClassNames classNames) {
        try {
            ThemeInfo th = theme != null ? theme : ThemeInfo.defaults();
            DocumentSettings ds = settings != null ? settings : DocumentSettings.defaults();
            NumberingTable nt = numbering != null ? numbering : NumberingTable.empty();

            StringBuilder out = new StringBuilder();
            out.append("/* docx-style generated stylesheet */\n");

            section(out, "document defaults", documentRules(styles.getDocumentDefaults(), th, ds));
            section(out, "paragraph styles", styleRules(styles, StyleKind.PARAGRAPH, classNames, th));
            section(out, "character styles", styleRules(styles, StyleKind.CHARACTER, classNames, th));
            section(out, "table styles", styleRules(styles, StyleKind.TABLE, classNames, th));
            section(out, "numbering", numberingRules(nt, th));
            section(out, "list containers", listContainerRules());
            section(out, "table of contents", tocRules(styles, th));

            String css = out.toString();
            log.debug("样式表生成完成: {} 字符", css.length());
            return css;
        } catch (RuntimeException e) {
            return fallback(e);
        }
    }

    private String fallback(RuntimeException e) {
        log.error("样式表生成失败，使用基础样式表: {}", e.getMessage(), e);
        if (diagnostics != null) {
            diagnostics.add(DiagnosticKind.SYNTHESIS_FALLBACK, "stylesheet", String.valueOf(e.getMessage()));
        }
        return FallbackStylesheet.CSS;
    }

    // ==================== 文档默认 ====================

    private List<CssRule> documentRules(DocumentDefaults defaults, ThemeInfo theme, DocumentSettings settings) {
        List<CssRule> rules = new ArrayList<>();
        PageSetup page = settings.getPageSetup();

        CssRule document = new CssRule("." + DOCUMENT_CLASS)
                .decl("font-family", CssRule.quote(theme.getMinorFont()) + ", sans-serif")
                .decl("font-size", "11pt");
        runDeclarations(document, defaults.getRun(), theme);
        int contentWidth = page.getWidth() - page.getMarginLeft() - page.getMarginRight() - page.getGutter();
        if (contentWidth > 0) {
            document.decl("max-width", Units.twipsPt(contentWidth));
        }
        document.decl("padding", Units.twipsPt(page.getMarginTop()) + " " + Units.twipsPt(page.getMarginRight())
                + " " + Units.twipsPt(page.getMarginBottom()) + " " + Units.twipsPt(page.getMarginLeft()));
        document.decl("tab-size", Units.twipsPt(settings.getDefaultTabStop()));
        rules.add(document);

        CssRule paragraph = new CssRule("." + DOCUMENT_CLASS + " p")
                .decl("margin-top", "0")
                .decl("margin-bottom", "0");
        paragraphDeclarations(paragraph, defaults.getParagraph());
        rules.add(paragraph);

        rules.add(new CssRule("." + DOCUMENT_CLASS + " h1, ." + DOCUMENT_CLASS + " h2, ." + DOCUMENT_CLASS + " h3, ."
                + DOCUMENT_CLASS + " h4, ." + DOCUMENT_CLASS + " h5, ." + DOCUMENT_CLASS + " h6")
                .decl("font-family", CssRule.quote(theme.getMajorFont()) + ", sans-serif"));
        return rules;
    }

    // ==================== 样式类 ====================

    private List<CssRule> styleRules(StyleTable styles, StyleKind kind, CssClassNames classNames, ThemeInfo theme) {
        List<CssRule> rules = new ArrayList<>();
        for (StyleRecord direct : styles.styles(kind).values()) {
            String className = classNames.classFor(kind, direct.getId());
            if (className == null) {
                continue;
            }
            StyleRecord record = options.isFlattenBasedOn()
                    ? styles.resolveEffective(kind, direct.getId()).orElse(direct)
                    : direct;

            if (kind == StyleKind.TABLE) {
                rules.addAll(tableRules(className, record, theme));
                continue;
            }
            CssRule rule = new CssRule("." + className);
            if (kind == StyleKind.PARAGRAPH) {
                paragraphDeclarations(rule, record.getParagraph());
            }
            runDeclarations(rule, record.getRun(), theme);
            rules.add(rule);
        }
        return rules;
    }

    private List<CssRule> tableRules(String className, StyleRecord record, ThemeInfo theme) {
        List<CssRule> rules = new ArrayList<>();
        TableFormatting table = record.getTable();

        CssRule tableRule = new CssRule("table." + className)
                .decl("border-collapse", "collapse");
        for (String side : new String[]{"top", "right", "bottom", "left"}) {
            tableRule.decl("border-" + side, border(table.getBorders().get(side)));
        }
        if ("center".equals(table.getAlignment())) {
            tableRule.decl("margin-left", "auto").decl("margin-right", "auto");
        }
        rules.add(tableRule);

        CssRule cellRule = new CssRule("table." + className + " td, table." + className + " th");
        String insideH = border(table.getBorders().get("insideH"));
        String insideV = border(table.getBorders().get("insideV"));
        cellRule.decl("border-top", insideH).decl("border-bottom", insideH);
        cellRule.decl("border-left", insideV).decl("border-right", insideV);
        for (Map.Entry<String, Integer> margin : table.getCellMargins().entrySet()) {
            cellRule.decl("padding-" + margin.getKey(), Units.twipsPt(margin.getValue()));
        }
        paragraphDeclarations(cellRule, record.getParagraph());
        runDeclarations(cellRule, record.getRun(), theme);
        rules.add(cellRule);
        return rules;
    }

    // ==================== 编号 ====================

    private List<CssRule> numberingRules(NumberingTable numbering, ThemeInfo theme) {
        List<CssRule> rules = new ArrayList<>();
        StringBuilder resets = new StringBuilder();

        List<CssRule> levelRules = new ArrayList<>();
        Set<NumberFormat> letterFormats = EnumSet.noneOf(NumberFormat.class);
        for (NumberingInstance instance : numbering.instances()) {
            List<EffectiveLevel> levels = numbering.effectiveLevels(instance.getNumId());
            EffectiveLevel[] byLevel = new EffectiveLevel[AbstractNumbering.LEVEL_COUNT];
            for (EffectiveLevel level : levels) {
                byLevel[level.getLevel()] = level;
                appendCounter(resets, counterName(level.getNumId(), level.getLevel()), level.getStart() - 1);
                if (level.getFormat().isLetter()) {
                    letterFormats.add(level.getFormat());
                }
            }
            for (EffectiveLevel level : levels) {
                levelRules.add(itemRule(level, byLevel));
                levelRules.add(markerRule(level, byLevel, theme));
            }
        }
        for (NumberFormat format : letterFormats) {
            rules.add(letterCounterStyle(format));
        }
        if (resets.length() > 0) {
            rules.add(new CssRule("." + DOCUMENT_CLASS).decl("counter-reset", resets.toString()));
        }
        rules.addAll(levelRules);
        return rules;
    }

    /**
     * Word 的字母编号超过 z 后重复字母（27 → aa, 28 → bb），对应 symbolic 计数器样式
     */
    static CssRule letterCounterStyle(NumberFormat format) {
        boolean upper = format == NumberFormat.UPPER_LETTER;
        StringBuilder symbols = new StringBuilder();
        for (char c = 'a'; c <= 'z'; c++) {
            if (symbols.length() > 0) {
                symbols.append(' ');
            }
            symbols.append(CssRule.quote(String.valueOf(upper ? Character.toUpperCase(c) : c)));
        }
        return new CssRule("@counter-style " + format.getCssCounterStyle())
                .decl("system", "symbolic")
                .decl("symbols", symbols.toString())
                .decl("fallback", upper ? "upper-alpha" : "lower-alpha");
    }

    private CssRule itemRule(EffectiveLevel level, EffectiveLevel[] byLevel) {
        CssRule rule = new CssRule(levelSelector(level))
                .decl("display", "block")
                .decl("list-style-type", "none");
        if (level.getFormat().isCounter()) {
            rule.decl("counter-increment", counterName(level.getNumId(), level.getLevel()));
        }

        StringBuilder resets = new StringBuilder();
        for (int deeper = level.getLevel() + 1; deeper < byLevel.length; deeper++) {
            EffectiveLevel child = byLevel[deeper];
            if (child == null) {
                continue;
            }
            Integer restart = child.getRestartAfterLevel();
            if (restart == null || (restart != 0 && level.getLevel() < restart)) {
                appendCounter(resets, counterName(child.getNumId(), deeper), child.getStart() - 1);
            }
        }
        if (resets.length() > 0) {
            rule.decl("counter-reset", resets.toString());
        }

        // 嵌套列表的缩进相对于上一级别
        Indentation ind = level.getIndentation();
        int parentLeft = 0;
        for (int shallower = level.getLevel() - 1; shallower >= 0; shallower--) {
            EffectiveLevel parent = byLevel[shallower];
            if (parent != null && parent.getIndentation().getLeft() != null) {
                parentLeft = parent.getIndentation().getLeft();
                break;
            }
        }
        if (ind.getLeft() != null) {
            rule.decl("padding-left", Units.twipsPt(Math.max(0, ind.getLeft() - parentLeft)));
        }
        if (ind.getHanging() != null) {
            rule.decl("text-indent", Units.pt(Units.twipsToPoints(ind.getHanging()).negate()));
        } else if (ind.getFirstLine() != null) {
            rule.decl("text-indent", Units.twipsPt(ind.getFirstLine()));
        }
        return rule;
    }

    private CssRule markerRule(EffectiveLevel level, EffectiveLevel[] byLevel, ThemeInfo theme) {
        CssRule rule = new CssRule(levelSelector(level) + "::before")
                .decl("content", markerContent(level, byLevel))
                .decl("display", "inline-block");
        Indentation ind = level.getIndentation();
        if (ind.getHanging() != null && "tab".equals(level.getSuffix())) {
            rule.decl("min-width", Units.twipsPt(ind.getHanging()));
        }
        rule.decl("text-align", cssAlignment(level.getAlignment()));

        RunFormatting run = level.getRun();
        if (level.isBullet() && isSymbolFont(run.getFontAscii())) {
            // 私有区字符已映射为Unicode，不再使用符号字体
            run = run.toBuilder().fontAscii(null).fontHAnsi(null).build();
        }
        runDeclarations(rule, run, theme);
        return rule;
    }

    /**
     * 由编号模板生成 ::before 的 content 值
     */
    String markerContent(EffectiveLevel level, EffectiveLevel[] byLevel) {
        String suffix = "space".equals(level.getSuffix()) ? " " + CssRule.quote(" ") : "";
        if (level.isBullet()) {
            return CssRule.quote(level.bulletGlyph()) + suffix;
        }
        if (level.getFormat() == NumberFormat.NONE) {
            return CssRule.quote("");
        }
        LevelTextPattern pattern = level.getPattern();
        if (pattern.isLiteralOnly()) {
            return CssRule.quote(pattern.getLiteral()) + suffix;
        }

        List<String> parts = new ArrayList<>();
        for (LevelTextPattern.Token token : pattern.getTokens()) {
            if (!token.getLiteralBefore().isEmpty()) {
                parts.add(CssRule.quote(token.getLiteralBefore()));
            }
            int ref = token.getLevelRef();
            EffectiveLevel referenced = ref < byLevel.length ? byLevel[ref] : null;
            String counterStyle = NumberFormat.DECIMAL.getCssCounterStyle();
            if (ref == level.getLevel()) {
                counterStyle = level.getFormat().getCssCounterStyle();
            } else if (referenced != null && referenced.getFormat().isCounter() && !level.isLegal()) {
                counterStyle = referenced.getFormat().getCssCounterStyle();
            }
            parts.add("counter(" + counterName(level.getNumId(), ref) + ", " + counterStyle + ")");
            if (!token.getSeparator().isEmpty()) {
                parts.add(CssRule.quote(token.getSeparator()));
            }
            if (!token.getLiteralAfter().isEmpty()) {
                parts.add(CssRule.quote(token.getLiteralAfter()));
            }
        }
        return String.join(" ", parts) + suffix;
    }

    private List<CssRule> listContainerRules() {
        List<CssRule> rules = new ArrayList<>();
        rules.add(new CssRule("." + LIST_CLASS)
                .decl("list-style", "none")
                .decl("margin", "0")
                .decl("padding", "0"));
        rules.add(new CssRule("." + LIST_CLASS + " > li")
                .decl("margin", "0"));
        rules.add(new CssRule("." + LIST_CLASS + " .docx-list-special")
                .decl("display", "block")
                .decl("list-style-type", "none"));
        return rules;
    }

    // ==================== 目录 ====================

    private List<CssRule> tocRules(StyleTable styles, ThemeInfo theme) {
        List<CssRule> rules = new ArrayList<>();
        rules.add(new CssRule(".docx-toc")
                .decl("margin", "0 0 12pt 0"));
        rules.add(new CssRule(".docx-toc-entry")
                .decl("display", "flex")
                .decl("align-items", "baseline")
                .decl("white-space", "nowrap"));
        rules.add(new CssRule(".docx-toc-text")
                .decl("flex-grow", "0")
                .decl("overflow", "hidden")
                .decl("text-overflow", "ellipsis"));
        rules.add(new CssRule(".docx-toc-dots")
                .decl("flex-grow", "1")
                .decl("overflow", "hidden")
                .decl("margin", "0 4pt"));
        rules.add(new CssRule(".docx-toc-pagenum")
                .decl("flex-shrink", "0")
                .decl("text-align", "right"));

        for (int level = 1; level <= TOC_LEVELS; level++) {
            CssRule rule = new CssRule(".docx-toc-level-" + level);
            Optional<StyleRecord> tocStyle = tocStyle(styles, level);
            Integer left = tocStyle
                    .map(s -> s.getParagraph().getIndentation())
                    .map(Indentation::getLeft)
                    .orElse(null);
            rule.decl("margin-left", Units.twipsPt(left != null ? left : DEFAULT_TOC_INDENT_TWIPS * (level - 1)));
            tocStyle.ifPresent(s -> runDeclarations(rule, s.getRun(), theme));
            rules.add(rule);
        }
        return rules;
    }

    private Optional<StyleRecord> tocStyle(StyleTable styles, int level) {
        Optional<StyleRecord> style = styles.resolveEffective(StyleKind.PARAGRAPH, "TOC" + level);
        if (!style.isPresent()) {
            style = styles.resolveEffective(StyleKind.PARAGRAPH, "toc" + level);
        }
        return style;
    }

    // ==================== 属性 → 声明 ====================

    private void runDeclarations(CssRule rule, RunFormatting run, ThemeInfo theme) {
        if (run == null) {
            return;
        }
        String font = run.getFontAscii() != null ? run.getFontAscii()
                : run.getFontHAnsi() != null ? run.getFontHAnsi()
                : theme.font(run.getFontAsciiTheme());
        if (font != null) {
            StringBuilder family = new StringBuilder(CssRule.quote(font));
            if (run.getFontEastAsia() != null && !run.getFontEastAsia().equals(font)) {
                family.append(", ").append(CssRule.quote(run.getFontEastAsia()));
            }
            family.append(", sans-serif");
            rule.decl("font-family", family.toString());
        }
        if (run.getSizeHalfPoints() != null) {
            rule.decl("font-size", Units.pt(Units.halfPointsToPoints(run.getSizeHalfPoints())));
        }
        if (run.getBold() != null) {
            rule.decl("font-weight", run.getBold() ? "bold" : "normal");
        }
        if (run.getItalic() != null) {
            rule.decl("font-style", run.getItalic() ? "italic" : "normal");
        }
        String decoration = textDecoration(run);
        if (decoration != null) {
            rule.decl("text-decoration", decoration);
            if ("double".equals(run.getUnderline())) {
                rule.decl("text-decoration-style", "double");
            }
        }
        if (Boolean.TRUE.equals(run.getCaps())) {
            rule.decl("text-transform", "uppercase");
        }
        if (Boolean.TRUE.equals(run.getSmallCaps())) {
            rule.decl("font-variant", "small-caps");
        }
        String color = CssColors.hex(run.getColor());
        if (color == null && run.getThemeColor() != null) {
            color = CssColors.hex(theme.color(run.getThemeColor()));
        }
        rule.decl("color", color);
        rule.decl("background-color", CssColors.highlight(run.getHighlight()));
    }

    private void paragraphDeclarations(CssRule rule, ParagraphFormatting paragraph) {
        if (paragraph == null) {
            return;
        }
        rule.decl("text-align", paragraph.getAlignment() != null ? cssAlignment(paragraph.getAlignment()) : null);

        Spacing spacing = paragraph.getSpacing();
        if (spacing != null) {
            if (spacing.getBefore() != null) {
                rule.decl("margin-top", Units.twipsPt(spacing.getBefore()));
            }
            if (spacing.getAfter() != null) {
                rule.decl("margin-bottom", Units.twipsPt(spacing.getAfter()));
            }
            if (spacing.getLine() != null && spacing.getLine() > 0) {
                String lineRule = spacing.getLineRule();
                if (lineRule == null || "auto".equals(lineRule)) {
                    rule.decl("line-height", Units.format(Units.lineMultiplier(spacing.getLine())));
                } else {
                    rule.decl("line-height", Units.twipsPt(spacing.getLine()));
                }
            }
        }

        Indentation ind = paragraph.getIndentation();
        if (ind != null) {
            if (ind.getLeft() != null) {
                rule.decl("margin-left", Units.twipsPt(ind.getLeft()));
            }
            if (ind.getRight() != null) {
                rule.decl("margin-right", Units.twipsPt(ind.getRight()));
            }
            if (ind.getHanging() != null) {
                rule.decl("padding-left", Units.twipsPt(ind.getHanging()));
                rule.decl("text-indent", Units.pt(Units.twipsToPoints(ind.getHanging()).negate()));
            } else if (ind.getFirstLine() != null) {
                rule.decl("text-indent", Units.twipsPt(ind.getFirstLine()));
            }
        }

        for (String side : new String[]{"top", "right", "bottom", "left"}) {
            rule.decl("border-" + side, border(paragraph.getBorders().get(side)));
        }

        if (paragraph.getShading() != null) {
            String fill = paragraph.getShading().getFill();
            rule.decl("background-color", "auto".equals(fill) ? null : CssColors.hex(fill));
        }
        if (Boolean.TRUE.equals(paragraph.getKeepNext())) {
            rule.decl("page-break-after", "avoid");
        }
        if (Boolean.TRUE.equals(paragraph.getKeepLines())) {
            rule.decl("page-break-inside", "avoid");
        }
        if (Boolean.TRUE.equals(paragraph.getPageBreakBefore())) {
            rule.decl("page-break-before", "always");
        }
    }

    /**
     * 边框声明值：宽度（1/8磅换算） 样式 颜色；nil/none 为 none；未设置返回null
     */
    static String border(BorderSpec borderSpec) {
        if (borderSpec == null) {
            return null;
        }
        if (borderSpec.isNone()) {
            return "none";
        }
        String style = BORDER_STYLES.getOrDefault(borderSpec.getStyle(), "solid");
        int size = borderSpec.getSize() != null ? borderSpec.getSize() : 4;
        String color = CssColors.hex(borderSpec.getColor());
        return Units.pt(Units.eighthsToPoints(size)) + " " + style + " " + (color != null ? color : "currentColor");
    }

    private static String textDecoration(RunFormatting run) {
        boolean underline = run.getUnderline() != null && !"none".equals(run.getUnderline());
        boolean strike = Boolean.TRUE.equals(run.getStrike());
        if (underline && strike) {
            return "underline line-through";
        }
        if (underline) {
            return "underline";
        }
        if (strike) {
            return "line-through";
        }
        if ("none".equals(run.getUnderline()) || Boolean.FALSE.equals(run.getStrike())) {
            return "none";
        }
        return null;
    }

    private static String cssAlignment(String alignment) {
        if (alignment == null) {
            return "left";
        }
        switch (alignment) {
            case "center":
                return "center";
            case "right":
            case "end":
                return "right";
            case "both":
            case "distribute":
                return "justify";
            default:
                return "left";
        }
    }

    private static boolean isSymbolFont(String font) {
        return font != null && (font.equalsIgnoreCase("Symbol") || font.toLowerCase().startsWith("wingdings"));
    }

    private static void section(StringBuilder out, String title, List<CssRule> rules) {
        if (rules.isEmpty()) {
            return;
        }
        out.append("\n/* ").append(title).append(" */\n");
        for (CssRule rule : rules) {
            rule.appendTo(out);
        }
    }

    private static void appendCounter(StringBuilder resets, String name, int value) {
        if (resets.length() > 0) {
            resets.append(' ');
        }
        resets.append(name).append(' ').append(value);
    }

    /**
     * 计数器名：docx-num-{numId}-{level}
     */
    public static String counterName(String numId, int level) {
        return "docx-num-" + CssClassNames.sanitize(numId) + "-" + level;
    }

    /**
     * 编号项选择器：[data-num-id="N"][data-num-level="L"]
     */
    public static String levelSelector(EffectiveLevel level) {
        return "[data-num-id=" + CssRule.quote(level.getNumId()) + "][data-num-level=\"" + level.getLevel() + "\"]";
    }
}
