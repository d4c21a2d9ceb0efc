package com.example.docxstyle.util.style;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 样式表：按类型分组的 styleId → StyleRecord（保持文档顺序）
 *
 * basedOn 链在访问时解析：带访问集合的逐跳遍历，超过最大跳数、遇到环、悬空引用或类型不一致时截断。
 */
public class StyleTable {

    public static final int DEFAULT_MAX_HOPS = 32;

    private final Map<StyleKind, Map<String, StyleRecord>> byKind;
    private final DocumentDefaults documentDefaults;
    private final int maxHops;

    public StyleTable(Map<StyleKind, Map<String, StyleRecord>> byKind, DocumentDefaults documentDefaults, int maxHops) {
        Map<StyleKind, Map<String, StyleRecord>> copy = new EnumMap<>(StyleKind.class);
        for (StyleKind kind : StyleKind.values()) {
            Map<String, StyleRecord> styles = byKind != null ? byKind.get(kind) : null;
            copy.put(kind, styles == null
                    ? Collections.emptyMap()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(styles)));
        }
        this.byKind = Collections.unmodifiableMap(copy);
        this.documentDefaults = documentDefaults != null ? documentDefaults : DocumentDefaults.EMPTY;
        this.maxHops = maxHops;
    }

    public static StyleTable empty() {
        return new StyleTable(null, DocumentDefaults.EMPTY, DEFAULT_MAX_HOPS);
    }

    public Map<String, StyleRecord> styles(StyleKind kind) {
        return byKind.get(kind);
    }

    public Collection<StyleRecord> paragraphStyles() {
        return byKind.get(StyleKind.PARAGRAPH).values();
    }

    public Collection<StyleRecord> characterStyles() {
        return byKind.get(StyleKind.CHARACTER).values();
    }

    public Collection<StyleRecord> tableStyles() {
        return byKind.get(StyleKind.TABLE).values();
    }

    public Collection<StyleRecord> numberingStyles() {
        return byKind.get(StyleKind.NUMBERING).values();
    }

    public DocumentDefaults getDocumentDefaults() {
        return documentDefaults;
    }

    public int size() {
        int total = 0;
        for (Map<String, StyleRecord> styles : byKind.values()) {
            total += styles.size();
        }
        return total;
    }

    public StyleRecord get(StyleKind kind, String id) {
        if (kind == null || id == null) {
            return null;
        }
        return byKind.get(kind).get(id);
    }

    /**
     * 不区分类型查找（段落 → 字符 → 表格 → 编号）
     */
    public StyleRecord find(String id) {
        if (id == null) {
            return null;
        }
        for (StyleKind kind : StyleKind.values()) {
            StyleRecord record = byKind.get(kind).get(id);
            if (record != null) {
                return record;
            }
        }
        return null;
    }

    /**
     * 某类型的默认样式（w:default="1"）
     */
    public StyleRecord defaultStyle(StyleKind kind) {
        for (StyleRecord record : byKind.get(kind).values()) {
            if (record.isDefaultStyle()) {
                return record;
            }
        }
        return null;
    }

    /**
     * 解析有效样式（不区分类型）
     */
    public Optional<StyleRecord> resolveEffective(String id) {
        StyleRecord record = find(id);
        return record == null ? Optional.empty() : resolveEffective(record.getKind(), id);
    }

    /**
     * 解析有效样式：从链根到当前样式依次合并，子样式的已设置属性覆盖父样式
     *
     * @return 合并后的记录（保留当前样式的 id/name/basedOn），样式不存在时为空
     */
    public Optional<StyleRecord> resolveEffective(StyleKind kind, String id) {
        Chain chain = resolveChain(kind, id);
        if (chain.getRecords().isEmpty()) {
            return Optional.empty();
        }
        List<StyleRecord> records = chain.getRecords();
        StyleRecord merged = null;
        for (int i = records.size() - 1; i >= 0; i--) {
            merged = records.get(i).over(merged);
        }
        return Optional.of(merged);
    }

    /**
     * 沿 basedOn 链收集样式（当前样式在前，根在后）
     */
    public Chain resolveChain(StyleKind kind, String id) {
        List<StyleRecord> records = new ArrayList<>();
        StyleRecord current = get(kind, id);
        if (current == null) {
            return new Chain(records, null, null);
        }
        Set<String> visited = new HashSet<>();
        records.add(current);
        visited.add(current.getId());

        int hops = 0;
        while (current.getBasedOn() != null) {
            String parentId = current.getBasedOn();
            if (hops >= maxHops) {
                return new Chain(records, ChainBreak.TOO_DEEP, current.getId());
            }
            if (visited.contains(parentId)) {
                return new Chain(records, ChainBreak.CYCLE, current.getId());
            }
            StyleRecord parent = get(kind, parentId);
            if (parent == null) {
                ChainBreak reason = find(parentId) != null ? ChainBreak.KIND_MISMATCH : ChainBreak.DANGLING;
                return new Chain(records, reason, current.getId());
            }
            records.add(parent);
            visited.add(parentId);
            current = parent;
            hops++;
        }
        return new Chain(records, null, null);
    }

    /**
     * basedOn 链截断原因
     */
    public enum ChainBreak {
        DANGLING, KIND_MISMATCH, CYCLE, TOO_DEEP
    }

    /**
     * basedOn 链解析结果
     */
    public static class Chain {
        private final List<StyleRecord> records;
        private final ChainBreak breakReason;
        private final String brokenAt;

        Chain(List<StyleRecord> records, ChainBreak breakReason, String brokenAt) {
            this.records = Collections.unmodifiableList(records);
            this.breakReason = breakReason;
            this.brokenAt = brokenAt;
        }

        public List<StyleRecord> getRecords() { return records; }

        public ChainBreak getBreakReason() { return breakReason; }

        public String getBrokenAt() { return brokenAt; }

        public boolean isBroken() { return breakReason != null; }
    }
}
