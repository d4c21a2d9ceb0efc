package com.example.docxstyle.util.structure;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 文档结构分析结果
 *
 * 包含目录条目、标题、列表分组、特殊段落模式和样式使用统计
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StructureModel {

    @JsonProperty("has_toc")
    private boolean hasToc;

    @JsonProperty("toc_start_index")
    private Integer tocStartIndex;

    @JsonProperty("toc_entries")
    private List<TocEntry> tocEntries = new ArrayList<>();

    @JsonProperty("headings")
    private List<Heading> headings = new ArrayList<>();

    @JsonProperty("lists")
    private List<ListGroup> lists = new ArrayList<>();

    @JsonProperty("special_patterns")
    private List<PatternMatch> specialPatterns = new ArrayList<>();

    @JsonProperty("style_usage")
    private Map<String, StyleUsage> styleUsage = new LinkedHashMap<>();

    // Getters and Setters
    public boolean isHasToc() { return hasToc; }
    public void setHasToc(boolean hasToc) { this.hasToc = hasToc; }

    public Integer getTocStartIndex() { return tocStartIndex; }
    public void setTocStartIndex(Integer tocStartIndex) { this.tocStartIndex = tocStartIndex; }

    public List<TocEntry> getTocEntries() { return tocEntries; }
    public void setTocEntries(List<TocEntry> tocEntries) { this.tocEntries = tocEntries; }

    public List<Heading> getHeadings() { return headings; }
    public void setHeadings(List<Heading> headings) { this.headings = headings; }

    public List<ListGroup> getLists() { return lists; }
    public void setLists(List<ListGroup> lists) { this.lists = lists; }

    public List<PatternMatch> getSpecialPatterns() { return specialPatterns; }
    public void setSpecialPatterns(List<PatternMatch> specialPatterns) { this.specialPatterns = specialPatterns; }

    public Map<String, StyleUsage> getStyleUsage() { return styleUsage; }
    public void setStyleUsage(Map<String, StyleUsage> styleUsage) { this.styleUsage = styleUsage; }

    /**
     * 目录条目；tocRegion 为所属目录的序号（文档中第几个目录，从0开始）
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class TocEntry {
        @JsonProperty("paragraph_index")
        private int paragraphIndex;

        private int level;

        private String text;

        @JsonProperty("page_number")
        private Integer pageNumber;

        @JsonProperty("leader_char")
        private String leaderChar;

        @JsonProperty("toc_region")
        private int tocRegion;

        public TocEntry() {
        }

        public TocEntry(int paragraphIndex, int level, String text, Integer pageNumber, String leaderChar,
                        int tocRegion) {
            this.paragraphIndex = paragraphIndex;
            this.level = level;
            this.text = text;
            this.pageNumber = pageNumber;
            this.leaderChar = leaderChar;
            this.tocRegion = tocRegion;
        }

        // Getters and Setters
        public int getParagraphIndex() { return paragraphIndex; }
        public void setParagraphIndex(int paragraphIndex) { this.paragraphIndex = paragraphIndex; }

        public int getLevel() { return level; }
        public void setLevel(int level) { this.level = level; }

        public String getText() { return text; }
        public void setText(String text) { this.text = text; }

        public Integer getPageNumber() { return pageNumber; }
        public void setPageNumber(Integer pageNumber) { this.pageNumber = pageNumber; }

        public String getLeaderChar() { return leaderChar; }
        public void setLeaderChar(String leaderChar) { this.leaderChar = leaderChar; }

        public int getTocRegion() { return tocRegion; }
        public void setTocRegion(int tocRegion) { this.tocRegion = tocRegion; }
    }

    /**
     * 标题段落（标题样式或大纲级别0-8），level 为 1-6
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Heading {
        @JsonProperty("paragraph_index")
        private int paragraphIndex;

        private int level;

        private String text;

        @JsonProperty("anchor_id")
        private String anchorId;

        public Heading() {
        }

        public Heading(int paragraphIndex, int level, String text, String anchorId) {
            this.paragraphIndex = paragraphIndex;
            this.level = level;
            this.text = text;
            this.anchorId = anchorId;
        }

        // Getters and Setters
        public int getParagraphIndex() { return paragraphIndex; }
        public void setParagraphIndex(int paragraphIndex) { this.paragraphIndex = paragraphIndex; }

        public int getLevel() { return level; }
        public void setLevel(int level) { this.level = level; }

        public String getText() { return text; }
        public void setText(String text) { this.text = text; }

        public String getAnchorId() { return anchorId; }
        public void setAnchorId(String anchorId) { this.anchorId = anchorId; }
    }

    /**
     * 列表分组（同一 numId 的连续段落）
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ListGroup {
        @JsonProperty("num_id")
        private String numId;

        private List<ListItem> items = new ArrayList<>();

        public ListGroup() {
        }

        public ListGroup(String numId) {
            this.numId = numId;
        }

        // Getters and Setters
        public String getNumId() { return numId; }
        public void setNumId(String numId) { this.numId = numId; }

        public List<ListItem> getItems() { return items; }
        public void setItems(List<ListItem> items) { this.items = items; }
    }

    /**
     * 列表成员；isSpecial 为 true 时是匹配已提升模式的非编号段落
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ListItem {
        @JsonProperty("paragraph_index")
        private int paragraphIndex;

        private int level;

        @JsonProperty("is_special")
        private boolean special;

        @JsonProperty("pattern_kind")
        private String patternKind;

        public ListItem() {
        }

        public ListItem(int paragraphIndex, int level, boolean special, String patternKind) {
            this.paragraphIndex = paragraphIndex;
            this.level = level;
            this.special = special;
            this.patternKind = patternKind;
        }

        // Getters and Setters
        public int getParagraphIndex() { return paragraphIndex; }
        public void setParagraphIndex(int paragraphIndex) { this.paragraphIndex = paragraphIndex; }

        public int getLevel() { return level; }
        public void setLevel(int level) { this.level = level; }

        public boolean isSpecial() { return special; }
        public void setSpecial(boolean special) { this.special = special; }

        public String getPatternKind() { return patternKind; }
        public void setPatternKind(String patternKind) { this.patternKind = patternKind; }
    }

    /**
     * 已提升的特殊段落模式
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class PatternMatch {
        @JsonProperty("pattern_kind")
        private String patternKind;

        @JsonProperty("occurrence_count")
        private int occurrenceCount;

        private List<String> examples = new ArrayList<>();

        public PatternMatch() {
        }

        public PatternMatch(String patternKind, int occurrenceCount, List<String> examples) {
            this.patternKind = patternKind;
            this.occurrenceCount = occurrenceCount;
            this.examples = examples;
        }

        // Getters and Setters
        public String getPatternKind() { return patternKind; }
        public void setPatternKind(String patternKind) { this.patternKind = patternKind; }

        public int getOccurrenceCount() { return occurrenceCount; }
        public void setOccurrenceCount(int occurrenceCount) { this.occurrenceCount = occurrenceCount; }

        public List<String> getExamples() { return examples; }
        public void setExamples(List<String> examples) { this.examples = examples; }
    }

    /**
     * 样式使用统计
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class StyleUsage {
        private int count;

        private List<String> samples = new ArrayList<>();

        // Getters and Setters
        public int getCount() { return count; }
        public void setCount(int count) { this.count = count; }

        public List<String> getSamples() { return samples; }
        public void setSamples(List<String> samples) { this.samples = samples; }
    }
}
