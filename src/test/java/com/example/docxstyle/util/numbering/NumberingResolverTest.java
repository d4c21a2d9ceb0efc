package com.example.docxstyle.util.numbering;

import com.example.docxstyle.util.diagnostic.DiagnosticKind;
import com.example.docxstyle.util.xml.WordXmlQuery;
import com.example.docxstyle.util.xml.XmlFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NumberingResolverTest {

    private WordXmlQuery query;
    private NumberingTable table;

    @BeforeEach
    void setUp() {
        query = XmlFixtures.query();
        table = NumberingFixtures.table(query);
    }

    @Test
    @DisplayName("抽象定义的级别属性完整解析")
    void resolvesAbstractLevel() {
        EffectiveLevel level = table.effectiveLevel("1", 0).orElseThrow(IllegalStateException::new);

        assertThat(level.getAbstractNumId()).isEqualTo("0");
        assertThat(level.getFormat()).isEqualTo(NumberFormat.DECIMAL);
        assertThat(level.getPattern().getRaw()).isEqualTo("%1.");
        assertThat(level.getStart()).isEqualTo(1);
        assertThat(level.getAlignment()).isEqualTo("left");
        assertThat(level.getSuffix()).isEqualTo("tab");
        assertThat(level.getIndentation().getLeft()).isEqualTo(720);
        assertThat(level.getIndentation().getHanging()).isEqualTo(360);
    }

    @Test
    @DisplayName("startOverride 只影响被覆盖的级别")
    void startOverrideAppliesToOverriddenLevelOnly() {
        assertThat(table.effectiveLevel("2", 0).get().getStart()).isEqualTo(5);
        assertThat(table.effectiveLevel("2", 1).get().getStart()).isEqualTo(1);
        assertThat(table.effectiveLevel("2", 1).get().getFormat()).isEqualTo(NumberFormat.LOWER_LETTER);
        assertThat(table.effectiveLevel("1", 0).get().getStart()).isEqualTo(1);
    }

    @Test
    @DisplayName("整级覆盖替换格式、模板与缩进，其他级别不受影响")
    void completeOverrideReplacesLevel() {
        EffectiveLevel overridden = table.effectiveLevel("4", 0).orElseThrow(IllegalStateException::new);

        assertThat(overridden.getFormat()).isEqualTo(NumberFormat.UPPER_ROMAN);
        assertThat(overridden.getPattern().getRaw()).isEqualTo("%1:");
        assertThat(overridden.getStart()).isEqualTo(3);
        assertThat(overridden.getIndentation().getLeft()).isEqualTo(360);
        assertThat(overridden.getIndentation().getHanging()).isNull();
        assertThat(table.effectiveLevel("4", 1).get().getFormat()).isEqualTo(NumberFormat.LOWER_LETTER);
    }

    @Test
    @DisplayName("不支持的编号格式降级为十进制，保留原始格式名")
    void unsupportedFormatDegradesToDecimal() {
        EffectiveLevel level = table.effectiveLevel("1", 2).orElseThrow(IllegalStateException::new);

        assertThat(level.getFormat()).isEqualTo(NumberFormat.DECIMAL);
        assertThat(level.getSourceFormat()).isEqualTo("chineseCounting");
        assertThat(level.getStart()).isEqualTo(1);
    }

    @Test
    @DisplayName("项目符号：私有区字符映射为可显示字符")
    void bulletLevel() {
        EffectiveLevel level = table.effectiveLevel("3", 0).orElseThrow(IllegalStateException::new);

        assertThat(level.isBullet()).isTrue();
        assertThat(level.bulletGlyph()).isEqualTo("•");
        assertThat(level.getRun().getFontAscii()).isEqualTo("Symbol");
    }

    @Test
    @DisplayName("未知 numId、未定义级别或越界级别返回空")
    void unresolvableLookupsAreEmpty() {
        assertThat(table.effectiveLevel("99", 0)).isEmpty();
        assertThat(table.effectiveLevel("1", 5)).isEmpty();
        assertThat(table.effectiveLevel("1", 9)).isEmpty();
        assertThat(table.effectiveLevel("1", -1)).isEmpty();
        assertThat(table.effectiveLevel(null, 0)).isEmpty();
    }

    @Test
    @DisplayName("实例引用不存在的抽象定义时记录诊断，级别不可解析")
    void danglingAbstractReference() {
        assertThat(table.instance("9")).isNotNull();
        assertThat(table.effectiveLevel("9", 0)).isEmpty();
        assertThat(query.getDiagnostics().has(DiagnosticKind.UNRESOLVABLE_REFERENCE)).isTrue();
    }

    @Test
    @DisplayName("numStyleLink 跟随到声明了同名 styleLink 的抽象定义")
    void followsNumStyleLink() {
        NumberingTable linked = new NumberingResolver(XmlFixtures.query()).resolve(XmlFixtures.numbering(
                "<w:abstractNum w:abstractNumId=\"10\"><w:styleLink w:val=\"LegalList\"/>"
                        + "<w:lvl w:ilvl=\"0\"><w:numFmt w:val=\"upperLetter\"/><w:lvlText w:val=\"%1.\"/></w:lvl>"
                        + "</w:abstractNum>"
                        + "<w:abstractNum w:abstractNumId=\"11\"><w:numStyleLink w:val=\"LegalList\"/></w:abstractNum>"
                        + "<w:num w:numId=\"1\"><w:abstractNumId w:val=\"11\"/></w:num>"));

        EffectiveLevel level = linked.effectiveLevel("1", 0).orElseThrow(IllegalStateException::new);

        assertThat(level.getFormat()).isEqualTo(NumberFormat.UPPER_LETTER);
        assertThat(level.getAbstractNumId()).isEqualTo("10");
    }

    @Test
    @DisplayName("无效 ilvl 的级别跳过，同一定义的其他级别保留")
    void malformedLevelSkipped() {
        WordXmlQuery q = XmlFixtures.query();
        NumberingTable partial = new NumberingResolver(q).resolve(XmlFixtures.numbering(
                "<w:abstractNum w:abstractNumId=\"0\">"
                        + "<w:lvl w:ilvl=\"12\"><w:numFmt w:val=\"decimal\"/></w:lvl>"
                        + "<w:lvl w:ilvl=\"0\"><w:numFmt w:val=\"lowerRoman\"/><w:lvlText w:val=\"%1)\"/></w:lvl>"
                        + "</w:abstractNum>"
                        + "<w:num w:numId=\"7\"><w:abstractNumId w:val=\"0\"/></w:num>"));

        assertThat(partial.effectiveLevel("7", 0).get().getFormat()).isEqualTo(NumberFormat.LOWER_ROMAN);
        assertThat(q.getDiagnostics().has(DiagnosticKind.MALFORMED_NODE)).isTrue();
    }

    @Test
    @DisplayName("numbering.xml 缺失时返回空表")
    void missingPart() {
        WordXmlQuery q = XmlFixtures.query();

        NumberingTable empty = new NumberingResolver(q).resolve(null);

        assertThat(empty.isEmpty()).isTrue();
        assertThat(q.getDiagnostics().has(DiagnosticKind.MISSING_PART)).isTrue();
    }
}
