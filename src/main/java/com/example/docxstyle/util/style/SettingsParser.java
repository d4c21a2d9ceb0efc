package com.example.docxstyle.util.style;

import com.example.docxstyle.util.diagnostic.DiagnosticKind;
import com.example.docxstyle.util.diagnostic.Diagnostics;
import com.example.docxstyle.util.xml.WordXmlQuery;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.List;

/**
 * 文档设置解析（word/settings.xml）与页面设置提取（document.xml 最后一个 w:sectPr）
 */
@Slf4j
public class SettingsParser {

    private final WordXmlQuery query;
    private final Diagnostics diagnostics;

    public SettingsParser(WordXmlQuery query) {
        this.query = query;
        this.diagnostics = query.getDiagnostics();
    }

    /**
     * @param settingsDoc settings.xml，缺失时为null
     * @param documentDoc document.xml，缺失时为null（页面设置取默认值）
     */
    public DocumentSettings parse(Document settingsDoc, Document documentDoc) {
        DocumentSettings.DocumentSettingsBuilder builder = DocumentSettings.builder()
                .pageSetup(parsePageSetup(documentDoc));

        if (settingsDoc == null) {
            log.warn("settings.xml 不存在，使用默认设置");
            diagnostics.add(DiagnosticKind.MISSING_PART, "word/settings.xml", "设置部件缺失，使用默认设置");
            return builder.build();
        }

        Element settings = query.selectElement("/w:settings", settingsDoc);
        Integer tabStop = query.intAttr(query.child(settings, "w:defaultTabStop"), "w:val");
        if (tabStop != null && tabStop > 0) {
            builder.defaultTabStop(tabStop);
        }
        String spacingControl = query.childAttr(settings, "w:characterSpacingControl", "w:val");
        if (spacingControl != null) {
            builder.characterSpacingControl(spacingControl);
        }
        builder.doNotHyphenateCaps(isOn(query.child(settings, "w:doNotHyphenateCaps")));
        builder.rtlGutter(isOn(query.child(settings, "w:rtlGutter")));
        builder.evenAndOddHeaders(isOn(query.child(settings, "w:evenAndOddHeaders")));
        return builder.build();
    }

    /**
     * 从正文最后一个 w:sectPr 提取页边距与纸张大小
     */
    public PageSetup parsePageSetup(Document documentDoc) {
        if (documentDoc == null) {
            return PageSetup.defaults();
        }
        List<Element> sections = query.selectElements("//w:sectPr", documentDoc);
        if (sections.isEmpty()) {
            return PageSetup.defaults();
        }
        Element sectPr = sections.get(sections.size() - 1);
        PageSetup defaults = PageSetup.defaults();
        Element pgMar = query.child(sectPr, "w:pgMar");
        Element pgSz = query.child(sectPr, "w:pgSz");
        String orientation = query.attr(pgSz, "w:orient");

        return PageSetup.builder()
                .marginTop(or(query.intAttr(pgMar, "w:top"), defaults.getMarginTop()))
                .marginBottom(or(query.intAttr(pgMar, "w:bottom"), defaults.getMarginBottom()))
                .marginLeft(or(query.intAttr(pgMar, "w:left"), defaults.getMarginLeft()))
                .marginRight(or(query.intAttr(pgMar, "w:right"), defaults.getMarginRight()))
                .marginHeader(or(query.intAttr(pgMar, "w:header"), defaults.getMarginHeader()))
                .marginFooter(or(query.intAttr(pgMar, "w:footer"), defaults.getMarginFooter()))
                .gutter(or(query.intAttr(pgMar, "w:gutter"), defaults.getGutter()))
                .width(or(query.intAttr(pgSz, "w:w"), defaults.getWidth()))
                .height(or(query.intAttr(pgSz, "w:h"), defaults.getHeight()))
                .orientation(orientation != null ? orientation : defaults.getOrientation())
                .build();
    }

    private boolean isOn(Element element) {
        return Boolean.TRUE.equals(query.onOff(element));
    }

    private static int or(Integer value, int fallback) {
        return value != null ? value : fallback;
    }
}
