package com.example.docxtext.util.docx.text;

import com.example.docxtext.util.docx.namespace.DocxNamespace;
import com.example.docxtext.util.docx.namespace.ElementRole;
import com.example.docxtext.util.docx.namespace.NamespaceResolver;
import com.example.docxtext.util.docx.pkg.RelationshipLookup;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 合并相邻的同格式片段、同目标超链接
 *
 * Word 会因为修订记录、拼写检查等原因把一个词拆成多个 w:r：
 * <pre>
 * &lt;w:p&gt;
 *     &lt;w:hyperlink r:id="rId7"&gt;&lt;w:r&gt;&lt;w:t&gt;hy&lt;/w:t&gt;&lt;/w:r&gt;&lt;/w:hyperlink&gt;
 *     &lt;w:proofErr/&gt;
 *     &lt;w:hyperlink r:id="rId8"&gt;&lt;w:r&gt;&lt;w:t&gt;per&lt;/w:t&gt;&lt;/w:r&gt;&lt;/w:hyperlink&gt;
 * &lt;/w:p&gt;
 * </pre>
 * rId7、rId8 指向同一地址时，合并为一个 w:hyperlink，其中的两个 w:r 格式相同再合并为一个，
 * 最后两个 w:t 拼成 "hyper"。
 *
 * 直接修改传入的DOM子树；只合并同一父元素下的相邻兄弟，不会跨段落。
 */
public class RunMerger {

    private static final Set<ElementRole> MERGEABLE = EnumSet.of(
            ElementRole.RUN, ElementRole.HYPERLINK, ElementRole.TEXT, ElementRole.TEXT_MATH);

    /**
     * 不算内容的元素：可以夹在两个可合并元素之间而不阻止合并
     */
    private static final Set<ElementRole> NON_CONTENT = EnumSet.of(
            ElementRole.GENERIC, ElementRole.UNKNOWN,
            ElementRole.RUN_PROPERTIES, ElementRole.PARAGRAPH_PROPERTIES,
            ElementRole.TABLE_CELL_PROPERTIES, ElementRole.NUMBERING_PROPERTIES,
            ElementRole.BOOKMARK_START);

    /**
     * 含有这些元素的片段不参与合并
     */
    private static final Set<ElementRole> SPECIAL_CONTENT = EnumSet.of(
            ElementRole.BREAK, ElementRole.CARRIAGE_RETURN,
            ElementRole.IMAGE, ElementRole.IMAGE_DATA, ElementRole.DRAWING, ElementRole.PICTURE,
            ElementRole.EMBEDDED_OBJECT, ElementRole.FIELD_CHAR, ElementRole.FIELD_INSTRUCTION,
            ElementRole.SYMBOL, ElementRole.FOOTNOTE_REFERENCE, ElementRole.ENDNOTE_REFERENCE,
            ElementRole.FORM_CHECKBOX, ElementRole.FORM_DROPDOWN);

    private final RelationshipLookup relationships;

    public RunMerger(RelationshipLookup relationships) {
        this.relationships = relationships == null ? RelationshipLookup.EMPTY : relationships;
    }

    /**
     * 递归合并整棵子树
     */
    public void merge(Element tree) {
        List<Element> contentChildren = new ArrayList<>();
        for (Element child : NamespaceResolver.children(tree)) {
            if (hasContent(child)) {
                contentChildren.add(child);
            }
        }

        List<Element> group = new ArrayList<>();
        Object groupKey = null;
        for (Element child : contentChildren) {
            Object key = keyOf(child);
            if (!group.isEmpty() && key.equals(groupKey)) {
                group.add(child);
                continue;
            }
            mergeGroup(tree, group);
            group = new ArrayList<>();
            group.add(child);
            groupKey = key;
        }
        mergeGroup(tree, group);

        for (Element child : NamespaceResolver.children(tree)) {
            merge(child);
        }
    }

    private void mergeGroup(Element tree, List<Element> group) {
        if (group.size() < 2) {
            return;
        }
        Element first = group.get(0);
        ElementRole role = NamespaceResolver.roleOf(first);
        if (role == ElementRole.TEXT || role == ElementRole.TEXT_MATH) {
            StringBuilder text = new StringBuilder();
            for (Element element : group) {
                text.append(element.getTextContent());
            }
            first.setTextContent(text.toString());
            for (Element element : group.subList(1, group.size())) {
                tree.removeChild(element);
            }
            return;
        }
        for (Element element : group.subList(1, group.size())) {
            for (Element child : NamespaceResolver.children(element)) {
                if (role == ElementRole.RUN && NamespaceResolver.roleOf(child) == ElementRole.RUN_PROPERTIES) {
                    continue;
                }
                first.appendChild(child);
            }
            tree.removeChild(element);
        }
    }

    /**
     * 合并键：角色相同且键相同的相邻元素合并；不可合并的元素返回唯一对象
     */
    Object keyOf(Element element) {
        ElementRole role = NamespaceResolver.roleOf(element);
        if (!MERGEABLE.contains(role)) {
            return new Object();
        }
        switch (role) {
            case RUN:
                if (isSpecial(element)) {
                    return new Object();
                }
                return new MergeKey(role, RunFormatting.of(element));
            case HYPERLINK:
                return new MergeKey(role, hyperlinkTarget(element));
            default:
                return new MergeKey(role, null);
        }
    }

    /**
     * 链接目标：关系表中的地址加 #anchor；内部链接只有 anchor
     */
    private String hyperlinkTarget(Element hyperlink) {
        String rId = DocxNamespace.attribute(hyperlink, "r:id");
        String anchor = DocxNamespace.attribute(hyperlink, "w:anchor");
        String target = null;
        if (rId != null) {
            target = relationships.resolve(rId).orElse("unresolved:" + rId);
        }
        if (anchor != null && !anchor.isEmpty()) {
            target = (target == null ? "" : target) + "#" + anchor;
        }
        return target;
    }

    private static boolean isSpecial(Element run) {
        for (Node node = run.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() != Node.ELEMENT_NODE) {
                continue;
            }
            Element child = (Element) node;
            if (SPECIAL_CONTENT.contains(NamespaceResolver.roleOf(child)) || isSpecial(child)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 元素本身或其后代是否有内容（拼写检查、书签这类标记没有）
     */
    static boolean hasContent(Element element) {
        if (!NON_CONTENT.contains(NamespaceResolver.roleOf(element))) {
            return true;
        }
        for (Node node = element.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.ELEMENT_NODE && hasContent((Element) node)) {
                return true;
            }
        }
        return false;
    }

    private static final class MergeKey {
        private final ElementRole role;
        private final Object detail;

        MergeKey(ElementRole role, Object detail) {
            this.role = role;
            this.detail = detail;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof MergeKey)) return false;
            MergeKey that = (MergeKey) o;
            return role == that.role && Objects.equals(detail, that.detail);
        }

        @Override
        public int hashCode() {
            return Objects.hash(role, detail);
        }
    }
}
