package com.example.docxstyle.util.style;

import com.example.docxstyle.util.diagnostic.DiagnosticKind;
import com.example.docxstyle.util.xml.WordXmlQuery;
import com.example.docxstyle.util.xml.XmlFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ThemeParserTest {

    private static final String THEME = "<a:theme " + XmlFixtures.A_NS + " name=\"Office Theme\"><a:themeElements>"
            + "<a:clrScheme name=\"Office\">"
            + "<a:dk1><a:sysClr val=\"windowText\" lastClr=\"000000\"/></a:dk1>"
            + "<a:lt1><a:sysClr val=\"window\" lastClr=\"FFFFFF\"/></a:lt1>"
            + "<a:dk2><a:srgbClr val=\"44546a\"/></a:dk2>"
            + "<a:accent1><a:srgbClr val=\"4472C4\"/></a:accent1>"
            + "</a:clrScheme>"
            + "<a:fontScheme name=\"Office\">"
            + "<a:majorFont><a:latin typeface=\"Cambria\"/></a:majorFont>"
            + "<a:minorFont><a:latin typeface=\"Segoe UI\"/></a:minorFont>"
            + "</a:fontScheme>"
            + "</a:themeElements></a:theme>";

    @Test
    @DisplayName("解析配色方案与主次字体，颜色统一大写")
    void parsesColorsAndFonts() {
        ThemeInfo theme = new ThemeParser(XmlFixtures.query()).parse(XmlFixtures.parse(THEME));

        assertThat(theme.getMajorFont()).isEqualTo("Cambria");
        assertThat(theme.getMinorFont()).isEqualTo("Segoe UI");
        assertThat(theme.color("accent1")).isEqualTo("4472C4");
        assertThat(theme.color("dk2")).isEqualTo("44546A");
        assertThat(theme.color("hlink")).isNull();
    }

    @Test
    @DisplayName("tx1/bg1 等别名映射到 dk1/lt1")
    void resolvesRoleAliases() {
        ThemeInfo theme = new ThemeParser(XmlFixtures.query()).parse(XmlFixtures.parse(THEME));

        assertThat(theme.color("tx1")).isEqualTo("000000");
        assertThat(theme.color("background1")).isEqualTo("FFFFFF");
        assertThat(theme.font("majorEastAsia")).isEqualTo("Cambria");
        assertThat(theme.font("minorHAnsi")).isEqualTo("Segoe UI");
    }

    @Test
    @DisplayName("主题缺失时使用默认字体")
    void missingThemeFallsBackToDefaults() {
        WordXmlQuery query = XmlFixtures.query();

        ThemeInfo theme = new ThemeParser(query).parse(null);

        assertThat(theme.getMajorFont()).isEqualTo(ThemeInfo.DEFAULT_MAJOR_FONT);
        assertThat(theme.getMinorFont()).isEqualTo(ThemeInfo.DEFAULT_MINOR_FONT);
        assertThat(theme.getColors()).isEmpty();
        assertThat(query.getDiagnostics().has(DiagnosticKind.MISSING_PART)).isTrue();
    }
}
