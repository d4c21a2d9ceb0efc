package com.example.docxstyle.util.xml;

import com.example.docxstyle.util.diagnostic.DiagnosticKind;
import com.example.docxstyle.util.diagnostic.Diagnostics;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpression;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 命名空间感知的XML查询工具
 *
 * 每个文档一个实例（XPath对象非线程安全，编译缓存也只在实例内有效）。
 * 查询失败记为 QUERY_FAILURE 并按"无匹配"返回，不向外抛出。
 */
@Slf4j
public class WordXmlQuery {

    private final WordNamespaces namespaces;
    private final Diagnostics diagnostics;
    private final XPath xpath;
    private final Map<String, XPathExpression> compiled = new HashMap<>();

    public WordXmlQuery(WordNamespaces namespaces, Diagnostics diagnostics) {
        this.namespaces = namespaces;
        this.diagnostics = diagnostics;
        this.xpath = XPathFactory.newInstance().newXPath();
        this.xpath.setNamespaceContext(namespaces.toNamespaceContext());
    }

    public WordNamespaces getNamespaces() {
        return namespaces;
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

    /**
     * 查询匹配的元素列表
     *
     * @param expression XPath表达式，使用注入的前缀
     * @param context    上下文节点（为null时返回空列表）
     * @return 匹配的元素（文档顺序），失败时为空列表
     */
    public List<Element> selectElements(String expression, Node context) {
        if (context == null) {
            return Collections.emptyList();
        }
        try {
            NodeList nodes = (NodeList) compile(expression).evaluate(context, XPathConstants.NODESET);
            List<Element> result = new ArrayList<>(nodes.getLength());
            for (int i = 0; i < nodes.getLength(); i++) {
                Node node = nodes.item(i);
                if (node instanceof Element) {
                    result.add((Element) node);
                }
            }
            return result;
        } catch (XPathExpressionException | ClassCastException e) {
            log.warn("XPath查询失败: {} - {}", expression, e.getMessage());
            diagnostics.add(DiagnosticKind.QUERY_FAILURE, expression, String.valueOf(e.getMessage()));
            return Collections.emptyList();
        }
    }

    /**
     * 查询第一个匹配元素
     *
     * @return 匹配元素，无匹配或查询失败时返回null
     */
    public Element selectElement(String expression, Node context) {
        List<Element> list = selectElements(expression, context);
        return list.isEmpty() ? null : list.get(0);
    }

    /**
     * 直接子元素（按限定名，如 "w:rPr"）
     */
    public Element child(Element parent, String qualifiedName) {
        if (parent == null) {
            return null;
        }
        String uri = uriOf(qualifiedName);
        String local = localOf(qualifiedName);
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element && matches((Element) n, uri, local)) {
                return (Element) n;
            }
        }
        return null;
    }

    /**
     * 全部直接子元素（按限定名）
     */
    public List<Element> children(Element parent, String qualifiedName) {
        if (parent == null) {
            return Collections.emptyList();
        }
        String uri = uriOf(qualifiedName);
        String local = localOf(qualifiedName);
        List<Element> result = new ArrayList<>();
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element && matches((Element) n, uri, local)) {
                result.add((Element) n);
            }
        }
        return result;
    }

    /**
     * 读取属性值，如 attr(el, "w:val")
     *
     * @return 属性值，缺失或为空字符串时返回null
     */
    public String attr(Element element, String qualifiedName) {
        if (element == null) {
            return null;
        }
        String value;
        int colon = qualifiedName.indexOf(':');
        if (colon > 0) {
            String uri = namespaces.uri(qualifiedName.substring(0, colon));
            value = uri != null
                    ? element.getAttributeNS(uri, qualifiedName.substring(colon + 1))
                    : element.getAttribute(qualifiedName);
        } else {
            value = element.getAttribute(qualifiedName);
        }
        return value == null || value.isEmpty() ? null : value;
    }

    /**
     * 子元素的属性值，如 childAttr(rPr, "w:sz", "w:val")
     */
    public String childAttr(Element parent, String childName, String attrName) {
        return attr(child(parent, childName), attrName);
    }

    /**
     * 读取整数属性，无法解析时返回null
     */
    public Integer intAttr(Element element, String qualifiedName) {
        return parseInt(attr(element, qualifiedName));
    }

    /**
     * OOXML 开关型属性：元素存在且 w:val 缺失或为 1/true/on 时为true；元素不存在时为null（未设置）
     */
    public Boolean onOff(Element element) {
        if (element == null) {
            return null;
        }
        String val = attr(element, "w:val");
        if (val == null) {
            return Boolean.TRUE;
        }
        return "1".equals(val) || "true".equalsIgnoreCase(val) || "on".equalsIgnoreCase(val);
    }

    /**
     * 元素及其后代中所有 w:t 的文本拼接
     */
    public String textOf(Element element) {
        StringBuilder sb = new StringBuilder();
        for (Element t : selectElements(".//w:t", element)) {
            sb.append(t.getTextContent());
        }
        return sb.toString();
    }

    static Integer parseInt(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            // 部分文档使用小数形式（如 "12.5"），取整数部分
            try {
                return (int) Double.parseDouble(value.trim());
            } catch (NumberFormatException nested) {
                log.debug("无法解析的整数属性值: {}", value);
                return null;
            }
        }
    }

    private XPathExpression compile(String expression) throws XPathExpressionException {
        XPathExpression expr = compiled.get(expression);
        if (expr == null) {
            expr = xpath.compile(expression);
            compiled.put(expression, expr);
        }
        return expr;
    }

    private String uriOf(String qualifiedName) {
        int colon = qualifiedName.indexOf(':');
        return colon > 0 ? namespaces.uri(qualifiedName.substring(0, colon)) : null;
    }

    private static String localOf(String qualifiedName) {
        int colon = qualifiedName.indexOf(':');
        return colon > 0 ? qualifiedName.substring(colon + 1) : qualifiedName;
    }

    private static boolean matches(Element element, String uri, String local) {
        String elementLocal = element.getLocalName() != null ? element.getLocalName() : element.getNodeName();
        if (!local.equals(elementLocal)) {
            return false;
        }
        return uri == null || uri.equals(element.getNamespaceURI());
    }
}
