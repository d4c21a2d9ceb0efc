package com.example.docxstyle.util.reconstruct;

import com.example.docxstyle.util.css.CssClassNames;
import com.example.docxstyle.util.css.StylesheetSynthesizer;
import com.example.docxstyle.util.style.LeaderChars;
import com.example.docxstyle.util.style.StyleKind;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Map;

/**
 * 文档树 → HTML（jsoup）
 *
 * 类名与样式表生成器共用 {@link CssClassNames}；列表项输出 data-num-* 标签，供编号计数器规则匹配。
 * 标题段落输出为 h1-h6 并带锚点 id，目录文本链接到对应标题。
 */
public class StructureHtmlRenderer {

    private final CssClassNames classNames;
    private final RenderOptions options;

    public StructureHtmlRenderer(CssClassNames classNames, RenderOptions options) {
        this.classNames = classNames;
        this.options = options != null ? options : RenderOptions.defaults();
    }

    /**
     * 渲染为HTML片段（根元素为 div.docx-document）
     */
    public String renderFragment(DocumentTree tree) {
        Document doc = Document.createShell("");
        Element root = doc.body().appendElement("div").addClass(StylesheetSynthesizer.DOCUMENT_CLASS);
        appendNodes(root, tree);
        return root.outerHtml();
    }

    /**
     * 渲染为完整HTML文档，样式表内嵌在 head 中
     */
    public String renderDocument(DocumentTree tree, String css, String title) {
        Document doc = Document.createShell("");
        doc.outputSettings().charset("UTF-8");
        doc.head().appendElement("meta").attr("charset", "UTF-8");
        doc.title(title != null ? title : "");
        if (css != null) {
            doc.head().appendElement("style").appendChild(new DataNode(css));
        }
        Element root = doc.body().appendElement("div").addClass(StylesheetSynthesizer.DOCUMENT_CLASS);
        appendNodes(root, tree);
        return doc.outerHtml();
    }

    private void appendNodes(Element root, DocumentTree tree) {
        for (DocumentTree.DocNode node : tree.getNodes()) {
            if (node instanceof DocumentTree.TocNode) {
                appendToc(root, (DocumentTree.TocNode) node);
            } else if (node instanceof DocumentTree.ListNode) {
                appendList(root, (DocumentTree.ListNode) node);
            } else if (node instanceof DocumentTree.ParagraphNode) {
                appendParagraph(root, (DocumentTree.ParagraphNode) node);
            }
        }
    }

    private void appendParagraph(Element parent, DocumentTree.ParagraphNode node) {
        Element p = parent.appendElement(node.getHeadingLevel() != null ? "h" + node.getHeadingLevel() : "p");
        if (node.getAnchorId() != null) {
            p.id(node.getAnchorId());
        }
        addStyleClass(p, node.getStyleId());
        p.text(node.getText() != null ? node.getText() : "");
    }

    private void appendList(Element parent, DocumentTree.ListNode list) {
        Element container = parent.appendElement(list.isOrdered() ? "ol" : "ul")
                .addClass(StylesheetSynthesizer.LIST_CLASS)
                .attr("data-num-list", list.getNumId())
                .attr("data-list-level", String.valueOf(list.getLevel()));
        for (DocumentTree.DocNode child : list.getChildren()) {
            if (child instanceof DocumentTree.ListItemNode) {
                DocumentTree.ListItemNode item = (DocumentTree.ListItemNode) child;
                Element li = container.appendElement("li");
                if (item.getAnchorId() != null) {
                    li.id(item.getAnchorId());
                }
                addStyleClass(li, item.getStyleId());
                for (Map.Entry<String, String> tag : item.getTags().entrySet()) {
                    li.attr(tag.getKey(), tag.getValue());
                }
                li.appendElement("span").addClass("docx-list-text").text(item.getText() != null ? item.getText() : "");
                for (DocumentTree.ListNode sublist : item.getSublists()) {
                    appendList(li, sublist);
                }
            } else if (child instanceof DocumentTree.SpecialParagraphNode) {
                DocumentTree.SpecialParagraphNode special = (DocumentTree.SpecialParagraphNode) child;
                Element li = container.appendElement("li").addClass("docx-list-special")
                        .attr("data-pattern-kind", special.getPatternKind());
                addStyleClass(li, special.getStyleId());
                li.text(special.getText() != null ? special.getText() : "");
            }
        }
    }

    private void appendToc(Element parent, DocumentTree.TocNode toc) {
        Element container = parent.appendElement("div").addClass("docx-toc");
        for (DocumentTree.TocLine line : toc.getLines()) {
            Element entry = container.appendElement("p")
                    .addClass("docx-toc-entry")
                    .addClass("docx-toc-level-" + line.getLevel());
            if (line.getTargetId() != null) {
                entry.appendElement("a").addClass("docx-toc-text")
                        .attr("href", "#" + line.getTargetId())
                        .text(line.getText());
            } else {
                entry.appendElement("span").addClass("docx-toc-text").text(line.getText());
            }
            if (options.isShowTocPageNumbers() && line.getPageNumber() != null) {
                String leader = line.getLeaderChar() != null ? line.getLeaderChar() : LeaderChars.DEFAULT;
                entry.appendElement("span").addClass("docx-toc-dots").text(repeat(leader, options.getHtmlLeaderLength()));
                entry.appendElement("span").addClass("docx-toc-pagenum").text(String.valueOf(line.getPageNumber()));
            }
        }
    }

    private void addStyleClass(Element element, String styleId) {
        String className = classNames != null ? classNames.classFor(StyleKind.PARAGRAPH, styleId) : null;
        if (className != null) {
            element.addClass(className);
        }
    }

    private static String repeat(String s, int count) {
        StringBuilder sb = new StringBuilder(s.length() * count);
        for (int i = 0; i < count; i++) {
            sb.append(s);
        }
        return sb.toString();
    }
}
