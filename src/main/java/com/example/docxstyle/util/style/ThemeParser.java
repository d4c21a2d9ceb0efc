package com.example.docxstyle.util.style;

import com.example.docxstyle.util.diagnostic.DiagnosticKind;
import com.example.docxstyle.util.diagnostic.Diagnostics;
import com.example.docxstyle.util.xml.WordXmlQuery;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 主题解析（word/theme/theme1.xml）
 */
@Slf4j
public class ThemeParser {

    private final WordXmlQuery query;
    private final Diagnostics diagnostics;

    public ThemeParser(WordXmlQuery query) {
        this.query = query;
        this.diagnostics = query.getDiagnostics();
    }

    public ThemeInfo parse(Document themeDoc) {
        if (themeDoc == null) {
            log.warn("theme1.xml 不存在，使用默认主题");
            diagnostics.add(DiagnosticKind.MISSING_PART, "word/theme/theme1.xml", "主题部件缺失，使用默认字体");
            return ThemeInfo.defaults();
        }

        String major = query.attr(query.selectElement("//a:fontScheme/a:majorFont/a:latin", themeDoc), "typeface");
        String minor = query.attr(query.selectElement("//a:fontScheme/a:minorFont/a:latin", themeDoc), "typeface");

        Map<String, String> colors = new LinkedHashMap<>();
        for (Element role : query.selectElements("//a:clrScheme/*", themeDoc)) {
            try {
                String value = query.attr(query.child(role, "a:srgbClr"), "val");
                if (value == null) {
                    value = query.attr(query.child(role, "a:sysClr"), "lastClr");
                }
                if (value != null) {
                    colors.put(role.getLocalName(), value.toUpperCase());
                }
            } catch (RuntimeException e) {
                log.warn("主题颜色解析失败: {} - {}", role.getLocalName(), e.getMessage());
                diagnostics.add(DiagnosticKind.MALFORMED_NODE, "a:clrScheme/" + role.getLocalName(),
                        String.valueOf(e.getMessage()));
            }
        }

        ThemeInfo theme = new ThemeInfo(major, minor, colors);
        log.debug("主题解析完成: major={}, minor={}, colors={}", theme.getMajorFont(), theme.getMinorFont(), colors.size());
        return theme;
    }
}
