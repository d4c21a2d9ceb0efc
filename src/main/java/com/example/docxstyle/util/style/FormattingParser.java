package com.example.docxstyle.util.style;

import com.example.docxstyle.util.xml.WordXmlQuery;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * w:rPr / w:pPr / w:tblPr 格式子树解析
 *
 * 样式表和编号级别共用。每个节点独立解析，不保留跨节点状态。
 */
public class FormattingParser {

    private static final String[] PARAGRAPH_BORDER_SIDES = {"top", "left", "bottom", "right", "between"};
    private static final String[] TABLE_BORDER_SIDES = {"top", "left", "bottom", "right", "insideH", "insideV"};
    private static final String[] CELL_MARGIN_SIDES = {"top", "left", "bottom", "right"};

    private final WordXmlQuery query;

    public FormattingParser(WordXmlQuery query) {
        this.query = query;
    }

    /**
     * 解析字符格式
     *
     * @param rPr w:rPr 元素（可为null）
     */
    public RunFormatting parseRun(Element rPr) {
        if (rPr == null) {
            return RunFormatting.EMPTY;
        }
        Element fonts = query.child(rPr, "w:rFonts");
        Element color = query.child(rPr, "w:color");
        Element underline = query.child(rPr, "w:u");

        String underlineKind = null;
        if (underline != null) {
            underlineKind = query.attr(underline, "w:val");
            if (underlineKind == null) {
                underlineKind = "single";
            }
        }

        String colorValue = query.attr(color, "w:val");
        if ("auto".equals(colorValue)) {
            colorValue = null;
        }

        return RunFormatting.builder()
                .fontAscii(query.attr(fonts, "w:ascii"))
                .fontHAnsi(query.attr(fonts, "w:hAnsi"))
                .fontEastAsia(query.attr(fonts, "w:eastAsia"))
                .fontComplex(query.attr(fonts, "w:cs"))
                .fontAsciiTheme(query.attr(fonts, "w:asciiTheme"))
                .sizeHalfPoints(query.intAttr(query.child(rPr, "w:sz"), "w:val"))
                .bold(query.onOff(query.child(rPr, "w:b")))
                .italic(query.onOff(query.child(rPr, "w:i")))
                .underline(underlineKind)
                .strike(query.onOff(query.child(rPr, "w:strike")))
                .caps(query.onOff(query.child(rPr, "w:caps")))
                .smallCaps(query.onOff(query.child(rPr, "w:smallCaps")))
                .color(colorValue)
                .themeColor(query.attr(color, "w:themeColor"))
                .highlight(query.childAttr(rPr, "w:highlight", "w:val"))
                .build();
    }

    /**
     * 解析段落格式
     *
     * @param pPr w:pPr 元素（可为null）
     */
    public ParagraphFormatting parseParagraph(Element pPr) {
        if (pPr == null) {
            return ParagraphFormatting.EMPTY;
        }
        return ParagraphFormatting.builder()
                .alignment(query.childAttr(pPr, "w:jc", "w:val"))
                .indentation(parseIndentation(query.child(pPr, "w:ind")))
                .spacing(parseSpacing(query.child(pPr, "w:spacing")))
                .borders(parseBorders(query.child(pPr, "w:pBdr"), PARAGRAPH_BORDER_SIDES))
                .shading(parseShading(query.child(pPr, "w:shd")))
                .tabs(parseTabs(query.child(pPr, "w:tabs")))
                .numbering(parseNumberingRef(query.child(pPr, "w:numPr")))
                .keepNext(query.onOff(query.child(pPr, "w:keepNext")))
                .keepLines(query.onOff(query.child(pPr, "w:keepLines")))
                .pageBreakBefore(query.onOff(query.child(pPr, "w:pageBreakBefore")))
                .widowControl(query.onOff(query.child(pPr, "w:widowControl")))
                .outlineLevel(query.intAttr(query.child(pPr, "w:outlineLvl"), "w:val"))
                .build();
    }

    /**
     * 解析表格样式格式
     *
     * @param tblPr w:tblPr 元素（可为null）
     */
    public TableFormatting parseTable(Element tblPr) {
        if (tblPr == null) {
            return TableFormatting.EMPTY;
        }
        Map<String, Integer> margins = new LinkedHashMap<>();
        Element cellMar = query.child(tblPr, "w:tblCellMar");
        for (String side : CELL_MARGIN_SIDES) {
            Element margin = query.child(cellMar, "w:" + side);
            if (margin == null && ("left".equals(side) || "right".equals(side))) {
                // 新版本使用 start/end
                margin = query.child(cellMar, "left".equals(side) ? "w:start" : "w:end");
            }
            Integer width = query.intAttr(margin, "w:w");
            if (width != null) {
                margins.put(side, width);
            }
        }
        return TableFormatting.builder()
                .borders(parseBorders(query.child(tblPr, "w:tblBorders"), TABLE_BORDER_SIDES))
                .cellMargins(Collections.unmodifiableMap(margins))
                .alignment(query.childAttr(tblPr, "w:jc", "w:val"))
                .build();
    }

    public Indentation parseIndentation(Element ind) {
        if (ind == null) {
            return null;
        }
        Integer left = query.intAttr(ind, "w:left");
        if (left == null) {
            left = query.intAttr(ind, "w:start");
        }
        Integer right = query.intAttr(ind, "w:right");
        if (right == null) {
            right = query.intAttr(ind, "w:end");
        }
        return Indentation.builder()
                .left(left)
                .right(right)
                .firstLine(query.intAttr(ind, "w:firstLine"))
                .hanging(query.intAttr(ind, "w:hanging"))
                .build();
    }

    public Spacing parseSpacing(Element spacing) {
        if (spacing == null) {
            return null;
        }
        return Spacing.builder()
                .before(query.intAttr(spacing, "w:before"))
                .after(query.intAttr(spacing, "w:after"))
                .line(query.intAttr(spacing, "w:line"))
                .lineRule(query.attr(spacing, "w:lineRule"))
                .build();
    }

    public Shading parseShading(Element shd) {
        if (shd == null) {
            return null;
        }
        return Shading.builder()
                .pattern(query.attr(shd, "w:val"))
                .color(query.attr(shd, "w:color"))
                .fill(query.attr(shd, "w:fill"))
                .build();
    }

    public List<TabStop> parseTabs(Element tabs) {
        if (tabs == null) {
            return Collections.emptyList();
        }
        List<TabStop> result = new ArrayList<>();
        for (Element tab : query.children(tabs, "w:tab")) {
            Integer pos = query.intAttr(tab, "w:pos");
            if (pos == null) {
                continue;
            }
            result.add(TabStop.builder()
                    .position(pos)
                    .alignment(query.attr(tab, "w:val"))
                    .leader(query.attr(tab, "w:leader"))
                    .build());
        }
        return Collections.unmodifiableList(result);
    }

    public NumberingRef parseNumberingRef(Element numPr) {
        if (numPr == null) {
            return null;
        }
        String numId = query.childAttr(numPr, "w:numId", "w:val");
        Integer level = query.intAttr(query.child(numPr, "w:ilvl"), "w:val");
        if (numId == null && level == null) {
            return null;
        }
        return new NumberingRef(numId, level != null ? level : 0);
    }

    private Map<String, BorderSpec> parseBorders(Element container, String[] sides) {
        if (container == null) {
            return Collections.emptyMap();
        }
        Map<String, BorderSpec> borders = new LinkedHashMap<>();
        for (String side : sides) {
            Element border = query.child(container, "w:" + side);
            if (border == null && ("left".equals(side) || "right".equals(side))) {
                border = query.child(container, "left".equals(side) ? "w:start" : "w:end");
            }
            if (border == null) {
                continue;
            }
            String color = query.attr(border, "w:color");
            borders.put(side, BorderSpec.builder()
                    .style(query.attr(border, "w:val"))
                    .size(query.intAttr(border, "w:sz"))
                    .space(query.intAttr(border, "w:space"))
                    .color("auto".equals(color) ? null : color)
                    .build());
        }
        return Collections.unmodifiableMap(borders);
    }
}
