package com.example.docxstyle.util.reconstruct;

import com.example.docxstyle.util.style.LeaderChars;

/**
 * 文档树 → Markdown
 *
 * 列表每级缩进两个空格；目录行为 "文本 + 引导符填充到固定宽度 + 页码"。
 */
public class StructureMarkdownRenderer {

    private static final String INDENT = "  ";

    private final RenderOptions options;

    public StructureMarkdownRenderer(RenderOptions options) {
        this.options = options != null ? options : RenderOptions.defaults();
    }

    public String render(DocumentTree tree) {
        StringBuilder out = new StringBuilder();
        for (DocumentTree.DocNode node : tree.getNodes()) {
            if (node instanceof DocumentTree.TocNode) {
                appendToc(out, (DocumentTree.TocNode) node);
            } else if (node instanceof DocumentTree.ListNode) {
                appendList(out, (DocumentTree.ListNode) node, 0);
                out.append('\n');
            } else if (node instanceof DocumentTree.ParagraphNode) {
                appendParagraph(out, (DocumentTree.ParagraphNode) node);
            }
        }
        return out.toString().trim() + "\n";
    }

    private void appendParagraph(StringBuilder out, DocumentTree.ParagraphNode node) {
        String text = node.getText() != null ? node.getText().trim() : "";
        if (text.isEmpty()) {
            return;
        }
        if (node.getHeadingLevel() != null) {
            out.append(repeat("#", node.getHeadingLevel())).append(' ');
        }
        out.append(text).append("\n\n");
    }

    /**
     * 列表：有序列表输出编号计数器生成的序号，没有序号时按兄弟序号输出 "n."；
     * 项目符号输出 "-"；特殊段落缩进到同级、不带标记
     */
    private void appendList(StringBuilder out, DocumentTree.ListNode list, int depth) {
        int position = 0;
        for (DocumentTree.DocNode child : list.getChildren()) {
            String indent = repeat(INDENT, depth);
            if (child instanceof DocumentTree.ListItemNode) {
                DocumentTree.ListItemNode item = (DocumentTree.ListItemNode) child;
                position++;
                String marker = "-";
                if (list.isOrdered()) {
                    marker = item.getLabel() != null && !item.getLabel().trim().isEmpty()
                            ? item.getLabel().trim()
                            : position + ".";
                }
                out.append(indent).append(marker).append(' ').append(oneLine(item.getText())).append('\n');
                for (DocumentTree.ListNode sublist : item.getSublists()) {
                    appendList(out, sublist, depth + 1);
                }
            } else if (child instanceof DocumentTree.SpecialParagraphNode) {
                DocumentTree.SpecialParagraphNode special = (DocumentTree.SpecialParagraphNode) child;
                out.append('\n').append(indent).append(INDENT).append(oneLine(special.getText())).append("\n\n");
            }
        }
    }

    private void appendToc(StringBuilder out, DocumentTree.TocNode toc) {
        for (DocumentTree.TocLine line : toc.getLines()) {
            String indent = repeat(INDENT, Math.max(0, line.getLevel() - 1));
            out.append(indent);
            if (options.isShowTocPageNumbers() && line.getPageNumber() != null) {
                out.append(tocLine(line.getText(), line.getLeaderChar(), line.getPageNumber()));
            } else {
                out.append(line.getText());
            }
            out.append("  \n");
        }
        out.append('\n');
    }

    /**
     * 目录行：文本右侧以引导符填充到 tocLineWidth，再接页码
     */
    String tocLine(String text, String leaderChar, int pageNumber) {
        String leader = leaderChar != null ? leaderChar : LeaderChars.DEFAULT;
        StringBuilder sb = new StringBuilder(text);
        // 至少保留三个引导符
        int fill = Math.max(3, options.getTocLineWidth() - text.length());
        sb.append(repeat(leader, fill));
        sb.append(' ').append(pageNumber);
        return sb.toString();
    }

    private static String oneLine(String text) {
        return text == null ? "" : text.replace('\n', ' ').trim();
    }

    private static String repeat(String s, int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            sb.append(s);
        }
        return sb.toString();
    }
}
