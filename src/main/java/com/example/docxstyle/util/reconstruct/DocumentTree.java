package com.example.docxstyle.util.reconstruct;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 重建后的文档树：段落 / 嵌套列表 / 目录，按文档顺序排列
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DocumentTree {

    public static final String TYPE_PARAGRAPH = "paragraph";
    public static final String TYPE_LIST = "list";
    public static final String TYPE_LIST_ITEM = "list_item";
    public static final String TYPE_SPECIAL = "special_paragraph";
    public static final String TYPE_TOC = "toc";

    @JsonProperty("nodes")
    private List<DocNode> nodes = new ArrayList<>();

    // Getters and Setters
    public List<DocNode> getNodes() { return nodes; }
    public void setNodes(List<DocNode> nodes) { this.nodes = nodes; }

    /**
     * 节点基类
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class DocNode {
        private String type; // "paragraph", "list", "list_item", "special_paragraph", "toc"

        // Getters and Setters
        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
    }

    /**
     * 普通段落；标题段落带 headingLevel（1-6）和锚点 id
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ParagraphNode extends DocNode {
        @JsonProperty("paragraph_index")
        private int paragraphIndex;

        private String text;

        @JsonProperty("style_id")
        private String styleId;

        @JsonProperty("heading_level")
        private Integer headingLevel;

        @JsonProperty("anchor_id")
        private String anchorId;

        public ParagraphNode() {
            setType(TYPE_PARAGRAPH);
        }

        // Getters and Setters
        public int getParagraphIndex() { return paragraphIndex; }
        public void setParagraphIndex(int paragraphIndex) { this.paragraphIndex = paragraphIndex; }

        public String getText() { return text; }
        public void setText(String text) { this.text = text; }

        public String getStyleId() { return styleId; }
        public void setStyleId(String styleId) { this.styleId = styleId; }

        public Integer getHeadingLevel() { return headingLevel; }
        public void setHeadingLevel(Integer headingLevel) { this.headingLevel = headingLevel; }

        public String getAnchorId() { return anchorId; }
        public void setAnchorId(String anchorId) { this.anchorId = anchorId; }
    }

    /**
     * 列表节点：children 为 ListItemNode 或 SpecialParagraphNode
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ListNode extends DocNode {
        @JsonProperty("num_id")
        private String numId;

        private int level;

        private boolean ordered = true;

        private List<DocNode> children = new ArrayList<>();

        public ListNode() {
            setType(TYPE_LIST);
        }

        public ListNode(String numId, int level) {
            this();
            this.numId = numId;
            this.level = level;
        }

        // Getters and Setters
        public String getNumId() { return numId; }
        public void setNumId(String numId) { this.numId = numId; }

        public int getLevel() { return level; }
        public void setLevel(int level) { this.level = level; }

        public boolean isOrdered() { return ordered; }
        public void setOrdered(boolean ordered) { this.ordered = ordered; }

        public List<DocNode> getChildren() { return children; }
        public void setChildren(List<DocNode> children) { this.children = children; }
    }

    /**
     * 编号列表项；sublists 为下一级别的子列表
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ListItemNode extends ParagraphNode {
        private int level;

        private String label;

        private Map<String, String> tags = new LinkedHashMap<>();

        private List<ListNode> sublists = new ArrayList<>();

        public ListItemNode() {
            setType(TYPE_LIST_ITEM);
        }

        // Getters and Setters
        public int getLevel() { return level; }
        public void setLevel(int level) { this.level = level; }

        public String getLabel() { return label; }
        public void setLabel(String label) { this.label = label; }

        public Map<String, String> getTags() { return tags; }
        public void setTags(Map<String, String> tags) { this.tags = tags; }

        public List<ListNode> getSublists() { return sublists; }
        public void setSublists(List<ListNode> sublists) { this.sublists = sublists; }
    }

    /**
     * 列表中的特殊段落（匹配已提升的模式），作为列表项的兄弟节点
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SpecialParagraphNode extends ParagraphNode {
        @JsonProperty("pattern_kind")
        private String patternKind;

        private int level;

        public SpecialParagraphNode() {
            setType(TYPE_SPECIAL);
        }

        // Getters and Setters
        public String getPatternKind() { return patternKind; }
        public void setPatternKind(String patternKind) { this.patternKind = patternKind; }

        public int getLevel() { return level; }
        public void setLevel(int level) { this.level = level; }
    }

    /**
     * 目录：扁平的条目序列
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class TocNode extends DocNode {
        private List<TocLine> lines = new ArrayList<>();

        public TocNode() {
            setType(TYPE_TOC);
        }

        // Getters and Setters
        public List<TocLine> getLines() { return lines; }
        public void setLines(List<TocLine> lines) { this.lines = lines; }
    }

    /**
     * 目录行；targetId 为对应标题的锚点，找不到时为null
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class TocLine {
        @JsonProperty("paragraph_index")
        private int paragraphIndex;

        private int level;

        private String text;

        @JsonProperty("leader_char")
        private String leaderChar;

        @JsonProperty("page_number")
        private Integer pageNumber;

        @JsonProperty("target_id")
        private String targetId;

        // Getters and Setters
        public int getParagraphIndex() { return paragraphIndex; }
        public void setParagraphIndex(int paragraphIndex) { this.paragraphIndex = paragraphIndex; }

        public int getLevel() { return level; }
        public void setLevel(int level) { this.level = level; }

        public String getText() { return text; }
        public void setText(String text) { this.text = text; }

        public String getLeaderChar() { return leaderChar; }
        public void setLeaderChar(String leaderChar) { this.leaderChar = leaderChar; }

        public Integer getPageNumber() { return pageNumber; }
        public void setPageNumber(Integer pageNumber) { this.pageNumber = pageNumber; }

        public String getTargetId() { return targetId; }
        public void setTargetId(String targetId) { this.targetId = targetId; }
    }
}
