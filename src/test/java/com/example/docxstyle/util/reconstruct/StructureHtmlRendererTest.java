package com.example.docxstyle.util.reconstruct;

import com.example.docxstyle.util.css.CssClassNames;
import com.example.docxstyle.util.numbering.NumberingFixtures;
import com.example.docxstyle.util.structure.Paragraphs;
import com.example.docxstyle.util.style.StyleTableBuilder;
import com.example.docxstyle.util.xml.XmlFixtures;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StructureHtmlRendererTest {

    private StructureHtmlRenderer renderer;
    private DocumentTree tree;

    @BeforeEach
    void setUp() {
        CssClassNames classNames = new CssClassNames(new StyleTableBuilder(XmlFixtures.query()).build(XmlFixtures.styles(
                "<w:style w:type=\"paragraph\" w:styleId=\"Heading1\"><w:name w:val=\"heading 1\"/></w:style>")));
        renderer = new StructureHtmlRenderer(classNames, RenderOptions.defaults());
        tree = ListTocReconstructorTest.reconstruct(new ListTocReconstructor(NumberingFixtures.table()),
                Paragraphs.builder()
                        .text("Contents")
                        .text("Scope........2")
                        .styled("Heading1", "Scope")
                        .numbered("1", 0, "A")
                        .numbered("1", 1, "B")
                        .numbered("1", 0, "C")
                        .build());
    }

    @Test
    @DisplayName("列表项带 data-num-* 属性，子列表嵌套在上一项中")
    void rendersTaggedNestedLists() {
        Document html = Jsoup.parseBodyFragment(renderer.renderFragment(tree));

        Element root = html.selectFirst("div.docx-document");
        assertThat(root).isNotNull();
        Elements topItems = html.select("div.docx-document > ol.docx-list > li[data-num-id]");
        assertThat(topItems).hasSize(2);
        assertThat(topItems.get(0).attr("data-label")).isEqualTo("1.");
        assertThat(topItems.get(1).attr("data-label")).isEqualTo("2.");

        Elements nested = topItems.get(0).select("ol.docx-list li");
        assertThat(nested).hasSize(1);
        assertThat(nested.get(0).attr("data-num-level")).isEqualTo("1");
        assertThat(nested.get(0).attr("data-format")).isEqualTo("lowerLetter");
        assertThat(nested.get(0).selectFirst("span.docx-list-text").text()).isEqualTo("B");
    }

    @Test
    @DisplayName("标题段落输出为带锚点的 h 元素，目录输出文本、引导符和页码")
    void rendersHeadingsAndToc() {
        Document html = Jsoup.parseBodyFragment(renderer.renderFragment(tree));

        Element heading = html.selectFirst("h1.docx-p-heading1");
        assertThat(heading).isNotNull();
        assertThat(heading.text()).isEqualTo("Scope");
        assertThat(heading.id()).isEqualTo("docx-heading-2");
        assertThat(html.select("p.docx-p-heading1")).isEmpty();
        Elements entries = html.select("div.docx-toc > p.docx-toc-entry");
        assertThat(entries).hasSize(1);
        assertThat(entries.get(0).hasClass("docx-toc-level-1")).isTrue();
        assertThat(entries.get(0).selectFirst(".docx-toc-text").text()).isEqualTo("Scope");
        assertThat(entries.get(0).selectFirst(".docx-toc-dots").text()).startsWith("...");
        assertThat(entries.get(0).selectFirst(".docx-toc-pagenum").text()).isEqualTo("2");
    }

    @Test
    @DisplayName("目录文本链接到对应标题，未匹配的条目保持为 span")
    void linksTocTextToHeadings() {
        DocumentTree linked = ListTocReconstructorTest.reconstruct(new ListTocReconstructor(NumberingFixtures.table()),
                Paragraphs.builder()
                        .text("Contents")
                        .text("1 Scope........2")
                        .text("Annex........9")
                        .styled("Heading1", "Scope")
                        .build());

        Document html = Jsoup.parseBodyFragment(renderer.renderFragment(linked));

        Element link = html.selectFirst("div.docx-toc a.docx-toc-text");
        assertThat(link).isNotNull();
        assertThat(link.attr("href")).isEqualTo("#docx-heading-3");
        assertThat(link.text()).isEqualTo("1 Scope");
        assertThat(html.getElementById("docx-heading-3")).isNotNull();
        assertThat(html.getElementById("docx-heading-3").tagName()).isEqualTo("h1");
        assertThat(html.select("div.docx-toc span.docx-toc-text").text()).isEqualTo("Annex");
    }

    @Test
    @DisplayName("关闭页码后目录只输出文本")
    void hidesPageNumbers() {
        StructureHtmlRenderer plain = new StructureHtmlRenderer(null,
                RenderOptions.builder().showTocPageNumbers(false).build());

        Document html = Jsoup.parseBodyFragment(plain.renderFragment(tree));

        assertThat(html.select(".docx-toc-pagenum")).isEmpty();
        assertThat(html.select(".docx-toc-text").text()).isEqualTo("Scope");
    }

    @Test
    @DisplayName("完整文档在 head 中内嵌样式表")
    void embedsStylesheet() {
        String css = ".docx-document { font-size: 11pt; }";

        Document html = Jsoup.parse(renderer.renderDocument(tree, css, "report.docx"));

        assertThat(html.title()).isEqualTo("report.docx");
        assertThat(html.head().selectFirst("style").data()).contains(css);
        assertThat(html.body().select("div.docx-document")).hasSize(1);
    }
}
