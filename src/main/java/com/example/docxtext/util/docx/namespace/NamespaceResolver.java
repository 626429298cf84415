package com.example.docxtext.util.docx.namespace;

import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * 元素角色解析
 *
 * 只读，不抛异常：无法归类的元素返回 {@link ElementRole#UNKNOWN}，由调用方告警并跳过。
 */
public final class NamespaceResolver {

    private NamespaceResolver() {
    }

    public static ElementRole roleOf(Element element) {
        if (element == null) {
            return ElementRole.UNKNOWN;
        }
        String prefixed = DocxNamespace.prefixedName(element);
        if (prefixed == null) {
            return ElementRole.UNKNOWN;
        }
        ElementRole role = ElementRole.byPrefixedName(prefixed);
        return role != null ? role : ElementRole.GENERIC;
    }

    public static boolean is(Element element, ElementRole role) {
        return roleOf(element) == role;
    }

    /**
     * 直接子元素（跳过文本、注释等非元素节点）
     */
    public static List<Element> children(Element parent) {
        List<Element> result = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                result.add((Element) child);
            }
        }
        return result;
    }

    /**
     * 第一个指定角色的直接子元素
     */
    public static Element firstChild(Element parent, ElementRole role) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE && roleOf((Element) child) == role) {
                return (Element) child;
            }
        }
        return null;
    }

    /**
     * 第一个指定逻辑名（如 "w:numId"）的直接子元素，用于没有单独角色的属性子元素
     */
    public static Element firstChild(Element parent, String prefixedName) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE
                    && prefixedName.equals(DocxNamespace.prefixedName((Element) child))) {
                return (Element) child;
            }
        }
        return null;
    }

    /**
     * 所有指定逻辑名的直接子元素
     */
    public static List<Element> childrenNamed(Element parent, String prefixedName) {
        List<Element> result = new ArrayList<>();
        for (Element child : children(parent)) {
            if (prefixedName.equals(DocxNamespace.prefixedName(child))) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * 向上查找最近的指定角色祖先（含自身）
     */
    public static Element findAncestor(Element element, ElementRole role) {
        Node node = element;
        while (node != null && node.getNodeType() == Node.ELEMENT_NODE) {
            if (roleOf((Element) node) == role) {
                return (Element) node;
            }
            node = node.getParentNode();
        }
        return null;
    }
}
