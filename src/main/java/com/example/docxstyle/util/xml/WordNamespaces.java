package com.example.docxstyle.util.xml;

import javax.xml.XMLConstants;
import javax.xml.namespace.NamespaceContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OOXML命名空间前缀表（不可变）
 *
 * 通过构造参数注入给查询工具，不作为全局常量引用。
 */
public final class WordNamespaces {

    public static final String W = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";
    public static final String A = "http://schemas.openxmlformats.org/drawingml/2006/main";
    public static final String R = "http://schemas.openxmlformats.org/officeDocument/2006/relationships";
    public static final String M = "http://schemas.openxmlformats.org/officeDocument/2006/math";
    public static final String V = "urn:schemas-microsoft-com:vml";
    public static final String WP = "http://schemas.openxmlformats.org/drawingml/2006/wordprocessingDrawing";
    public static final String MC = "http://schemas.openxmlformats.org/markup-compatibility/2006";

    private final Map<String, String> prefixToUri;

    private WordNamespaces(Map<String, String> prefixToUri) {
        this.prefixToUri = Collections.unmodifiableMap(new LinkedHashMap<>(prefixToUri));
    }

    /**
     * 默认前缀表：w / a / r / m / v / wp / mc
     */
    public static WordNamespaces defaults() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("w", W);
        map.put("a", A);
        map.put("r", R);
        map.put("m", M);
        map.put("v", V);
        map.put("wp", WP);
        map.put("mc", MC);
        return new WordNamespaces(map);
    }

    /**
     * 以默认前缀表为基础，叠加配置中的前缀
     */
    public static WordNamespaces of(Map<String, String> overrides) {
        Map<String, String> map = new LinkedHashMap<>(defaults().prefixToUri);
        if (overrides != null) {
            map.putAll(overrides);
        }
        return new WordNamespaces(map);
    }

    public String uri(String prefix) {
        return prefixToUri.get(prefix);
    }

    public Map<String, String> asMap() {
        return prefixToUri;
    }

    /**
     * 转换为XPath使用的NamespaceContext
     */
    public NamespaceContext toNamespaceContext() {
        return new NamespaceContext() {
            @Override
            public String getNamespaceURI(String prefix) {
                String uri = prefixToUri.get(prefix);
                return uri != null ? uri : XMLConstants.NULL_NS_URI;
            }

            @Override
            public String getPrefix(String namespaceURI) {
                for (Map.Entry<String, String> e : prefixToUri.entrySet()) {
                    if (e.getValue().equals(namespaceURI)) {
                        return e.getKey();
                    }
                }
                return null;
            }

            @Override
            public Iterator<String> getPrefixes(String namespaceURI) {
                List<String> prefixes = new ArrayList<>();
                for (Map.Entry<String, String> e : prefixToUri.entrySet()) {
                    if (e.getValue().equals(namespaceURI)) {
                        prefixes.add(e.getKey());
                    }
                }
                return prefixes.iterator();
            }
        };
    }
}
