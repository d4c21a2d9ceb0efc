package com.example.docxstyle.util.reconstruct;

import com.example.docxstyle.util.numbering.EffectiveLevel;
import com.example.docxstyle.util.numbering.NumberingCounter;
import com.example.docxstyle.util.numbering.NumberingTable;
import com.example.docxstyle.util.style.LeaderChars;
import com.example.docxstyle.util.structure.ParagraphRecord;
import com.example.docxstyle.util.structure.StructureModel;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 列表与目录重建器
 *
 * 算法：
 * 1. 按文档顺序遍历段落
 * 2. 列表分组的第一个成员处整体生成列表节点；用级别栈构建嵌套，
 *    更深的级别挂到上一个列表项的子列表下，回到较浅级别时出栈
 * 3. 特殊成员作为当前级别列表中的兄弟节点，带模式标签
 * 4. 每个目录区的第一个条目处生成该目录的节点，包含本区全部条目（扁平，保持顺序）；
 *    目录行按文本匹配到标题锚点（先精确匹配，再去掉开头的章节编号匹配）
 * 5. 其余段落为普通段落，标题段落带级别和锚点
 */
@Slf4j
public class ListTocReconstructor {

    public static final String TAG_NUM_ID = "data-num-id";
    public static final String TAG_NUM_LEVEL = "data-num-level";
    public static final String TAG_ABSTRACT_NUM = "data-abstract-num";
    public static final String TAG_FORMAT = "data-format";
    public static final String TAG_LABEL = "data-label";

    /**
     * 目录文本开头的章节编号，如 "1 " / "2.3 " / "a) " / "iv. "
     */
    private static final Pattern SECTION_NUMBER_PREFIX =
            Pattern.compile("^(?:\\d+(?:\\.\\d+)*\\.?|[a-z][.)]|[ivxlcdm]+[.)])\\s+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final NumberingTable numbering;

    public ListTocReconstructor(NumberingTable numbering) {
        this.numbering = numbering != null ? numbering : NumberingTable.empty();
    }

    /**
     * 重建文档树
     *
     * @param paragraphs 段落记录（文档顺序）
     * @param model      结构分析结果
     */
    public DocumentTree reconstruct(List<ParagraphRecord> paragraphs, StructureModel model) {
        DocumentTree tree = new DocumentTree();
        if (paragraphs == null || paragraphs.isEmpty()) {
            return tree;
        }

        Map<Integer, ParagraphRecord> byIndex = new HashMap<>();
        for (ParagraphRecord p : paragraphs) {
            byIndex.put(p.getIndex(), p);
        }

        Map<Integer, StructureModel.ListGroup> groupsByFirstIndex = new HashMap<>();
        Set<Integer> listMembers = new HashSet<>();
        for (StructureModel.ListGroup group : model.getLists()) {
            if (group.getItems().isEmpty()) {
                continue;
            }
            groupsByFirstIndex.put(group.getItems().get(0).getParagraphIndex(), group);
            for (StructureModel.ListItem item : group.getItems()) {
                listMembers.add(item.getParagraphIndex());
            }
        }

        Set<Integer> tocMembers = new HashSet<>();
        Map<Integer, List<StructureModel.TocEntry>> regions = new LinkedHashMap<>();
        for (StructureModel.TocEntry entry : model.getTocEntries()) {
            tocMembers.add(entry.getParagraphIndex());
            regions.computeIfAbsent(entry.getTocRegion(), k -> new ArrayList<>()).add(entry);
        }
        Map<Integer, List<StructureModel.TocEntry>> regionsByFirstIndex = new HashMap<>();
        for (List<StructureModel.TocEntry> entries : regions.values()) {
            regionsByFirstIndex.put(entries.get(0).getParagraphIndex(), entries);
        }

        Map<Integer, StructureModel.Heading> headings = new HashMap<>();
        for (StructureModel.Heading heading : model.getHeadings()) {
            headings.put(heading.getParagraphIndex(), heading);
        }

        NumberingCounter counter = new NumberingCounter(numbering);
        int listCount = 0;
        int tocCount = 0;
        for (ParagraphRecord p : paragraphs) {
            int index = p.getIndex();
            List<StructureModel.TocEntry> region = regionsByFirstIndex.get(index);
            if (region != null) {
                tree.getNodes().add(buildToc(region, model.getHeadings()));
                tocCount++;
                continue;
            }
            if (tocMembers.contains(index)) {
                continue;
            }
            StructureModel.ListGroup group = groupsByFirstIndex.get(index);
            if (group != null) {
                tree.getNodes().add(buildList(group, byIndex, headings, counter));
                listCount++;
                continue;
            }
            if (listMembers.contains(index)) {
                continue;
            }
            DocumentTree.ParagraphNode node = paragraphNode(p);
            applyHeading(node, headings.get(index));
            tree.getNodes().add(node);
        }

        log.debug("文档树重建完成: 节点={}, 列表={}, 目录={}, 目录条目={}",
                tree.getNodes().size(), listCount, tocCount, tocMembers.size());
        return tree;
    }

    private DocumentTree.TocNode buildToc(List<StructureModel.TocEntry> entries, List<StructureModel.Heading> headings) {
        DocumentTree.TocNode toc = new DocumentTree.TocNode();
        Set<String> linked = new HashSet<>();
        for (StructureModel.TocEntry entry : entries) {
            DocumentTree.TocLine line = new DocumentTree.TocLine();
            line.setParagraphIndex(entry.getParagraphIndex());
            line.setLevel(entry.getLevel());
            line.setText(entry.getText());
            line.setLeaderChar(entry.getLeaderChar() != null ? entry.getLeaderChar() : LeaderChars.DEFAULT);
            line.setPageNumber(entry.getPageNumber());
            StructureModel.Heading target = findTarget(entry, headings, linked);
            if (target != null) {
                line.setTargetId(target.getAnchorId());
                linked.add(target.getAnchorId());
            } else {
                log.debug("目录条目未找到对应标题: {}", entry.getText());
            }
            toc.getLines().add(line);
        }
        return toc;
    }

    /**
     * 查找目录条目对应的标题：优先目录之后的标题，同一目录内每个标题只链接一次
     */
    private static StructureModel.Heading findTarget(StructureModel.TocEntry entry, List<StructureModel.Heading> headings,
                                                     Set<String> linked) {
        List<StructureModel.Heading> candidates = new ArrayList<>();
        for (StructureModel.Heading heading : headings) {
            if (heading.getParagraphIndex() > entry.getParagraphIndex() && !linked.contains(heading.getAnchorId())) {
                candidates.add(heading);
            }
        }
        for (StructureModel.Heading heading : headings) {
            if (heading.getParagraphIndex() < entry.getParagraphIndex() && !linked.contains(heading.getAnchorId())) {
                candidates.add(heading);
            }
        }

        String key = normalize(entry.getText());
        for (StructureModel.Heading heading : candidates) {
            if (key.equals(normalize(heading.getText()))) {
                return heading;
            }
        }
        String stripped = stripSectionNumber(key);
        for (StructureModel.Heading heading : candidates) {
            if (stripped.equals(stripSectionNumber(normalize(heading.getText())))) {
                return heading;
            }
        }
        return null;
    }

    private static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    private static String stripSectionNumber(String text) {
        return SECTION_NUMBER_PREFIX.matcher(text).replaceFirst("");
    }

    private static void applyHeading(DocumentTree.ParagraphNode node, StructureModel.Heading heading) {
        if (heading != null) {
            node.setHeadingLevel(heading.getLevel());
            node.setAnchorId(heading.getAnchorId());
        }
    }

    /**
     * 用级别栈把一个列表分组构建为嵌套列表
     */
    private DocumentTree.ListNode buildList(StructureModel.ListGroup group, Map<Integer, ParagraphRecord> byIndex,
                                            Map<Integer, StructureModel.Heading> headings, NumberingCounter counter) {
        List<StructureModel.ListItem> items = group.getItems();
        int baseLevel = items.get(0).getLevel();
        DocumentTree.ListNode root = newList(group.getNumId(), baseLevel);

        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, baseLevel));

        for (StructureModel.ListItem item : items) {
            ParagraphRecord p = byIndex.get(item.getParagraphIndex());
            if (p == null) {
                continue;
            }
            if (item.isSpecial()) {
                stack.peek().list.getChildren().add(specialNode(p, item));
                continue;
            }

            int level = item.getLevel();
            while (stack.size() > 1 && stack.peek().level > level) {
                stack.pop();
            }
            Frame top = stack.peek();
            if (level > top.level && top.lastItem != null) {
                DocumentTree.ListNode sublist = newList(group.getNumId(), level);
                top.lastItem.getSublists().add(sublist);
                top = new Frame(sublist, level);
                stack.push(top);
            }

            DocumentTree.ListItemNode node = itemNode(p, group.getNumId(), level, counter);
            applyHeading(node, headings.get(p.getIndex()));
            top.list.getChildren().add(node);
            top.lastItem = node;
        }
        return root;
    }

    private DocumentTree.ListNode newList(String numId, int level) {
        DocumentTree.ListNode list = new DocumentTree.ListNode(numId, level);
        list.setOrdered(numbering.effectiveLevel(numId, level)
                .map(l -> !l.isBullet())
                .orElse(true));
        return list;
    }

    private DocumentTree.ListItemNode itemNode(ParagraphRecord p, String numId, int level, NumberingCounter counter) {
        DocumentTree.ListItemNode node = new DocumentTree.ListItemNode();
        node.setParagraphIndex(p.getIndex());
        node.setText(p.getText());
        node.setStyleId(p.getStyleId());
        node.setLevel(level);

        node.getTags().put(TAG_NUM_ID, numId);
        node.getTags().put(TAG_NUM_LEVEL, String.valueOf(level));
        Optional<EffectiveLevel> effective = numbering.effectiveLevel(numId, level);
        if (effective.isPresent()) {
            node.getTags().put(TAG_ABSTRACT_NUM, effective.get().getAbstractNumId());
            node.getTags().put(TAG_FORMAT, effective.get().getSourceFormat());
            Optional<String> label = counter.next(numId, level);
            if (label.isPresent()) {
                node.setLabel(label.get());
                node.getTags().put(TAG_LABEL, label.get());
            }
        }
        return node;
    }

    private static DocumentTree.SpecialParagraphNode specialNode(ParagraphRecord p, StructureModel.ListItem item) {
        DocumentTree.SpecialParagraphNode node = new DocumentTree.SpecialParagraphNode();
        node.setParagraphIndex(p.getIndex());
        node.setText(p.getText());
        node.setStyleId(p.getStyleId());
        node.setPatternKind(item.getPatternKind());
        node.setLevel(item.getLevel());
        return node;
    }

    private static DocumentTree.ParagraphNode paragraphNode(ParagraphRecord p) {
        DocumentTree.ParagraphNode node = new DocumentTree.ParagraphNode();
        node.setParagraphIndex(p.getIndex());
        node.setText(p.getText());
        node.setStyleId(p.getStyleId());
        return node;
    }

    /**
     * 级别栈中的一层：当前列表、级别、最近的列表项
     */
    private static class Frame {
        private final DocumentTree.ListNode list;
        private final int level;
        private DocumentTree.ListItemNode lastItem;

        Frame(DocumentTree.ListNode list, int level) {
            this.list = list;
            this.level = level;
        }
    }
}
