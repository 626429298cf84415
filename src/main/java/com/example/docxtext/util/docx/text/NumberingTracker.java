package com.example.docxtext.util.docx.text;

import com.example.docxtext.util.docx.WarningSink;
import com.example.docxtext.util.docx.model.ListPosition;
import com.example.docxtext.util.docx.namespace.DocxNamespace;
import com.example.docxtext.util.docx.namespace.ElementRole;
import com.example.docxtext.util.docx.namespace.NamespaceResolver;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 编号计数器
 *
 * 每个 (numId, ilvl) 一个计数器：第一次出现取该层起始值，之后每次加一；
 * 某一层加一时，同一 numId 下所有更深的层级清零（重新从起始值开始）。
 * <pre>
 * 1) top-level list
 *     a) sublist
 *     b) sublist continues
 * 2) back to top-level list
 *     a) sublist counter has been reset
 * </pre>
 * 每遍历一个内容部件（正文、页眉、脚注...）创建一个新实例，不在部件之间共享。
 */
public class NumberingTracker {

    /** w:ilvl 取值范围 0..8 */
    public static final int MAX_LEVEL = 8;

    private final NumberingFormatSource formats;
    private final WarningSink warnings;

    // numId -> (ilvl -> 从0开始的序号)
    private final Map<String, TreeMap<Integer, Integer>> ordinals = new HashMap<>();

    public NumberingTracker(NumberingFormatSource formats, WarningSink warnings) {
        this.formats = formats;
        this.warnings = warnings;
    }

    /**
     * 编号结果：ascii前缀与结构化位置
     */
    public static final class NumberedItem {

        public static final NumberedItem NONE = new NumberedItem("", ListPosition.NONE);

        private final String prefix;
        private final ListPosition position;

        public NumberedItem(String prefix, ListPosition position) {
            this.prefix = prefix;
            this.position = position;
        }

        public String getPrefix() { return prefix; }

        public ListPosition getPosition() { return position; }

        public boolean isNumbered() {
            return position.isNumbered();
        }
    }

    /**
     * 处理一个段落的编号，非编号段落返回 {@link NumberedItem#NONE}
     *
     * <pre>
     * &lt;w:p&gt;
     *     &lt;w:pPr&gt;
     *         &lt;w:numPr&gt;
     *             &lt;w:ilvl w:val="0"/&gt;
     *             &lt;w:numId w:val="9"/&gt;
     *         &lt;/w:numPr&gt;
     *     &lt;/w:pPr&gt;
     *     ...
     * &lt;/w:p&gt;
     * </pre>
     */
    public NumberedItem next(Element paragraph) {
        Element pPr = NamespaceResolver.firstChild(paragraph, ElementRole.PARAGRAPH_PROPERTIES);
        if (pPr == null) {
            return NumberedItem.NONE;
        }
        Element numPr = NamespaceResolver.firstChild(pPr, ElementRole.NUMBERING_PROPERTIES);
        if (numPr == null) {
            return NumberedItem.NONE;
        }
        Element numIdElement = NamespaceResolver.firstChild(numPr, "w:numId");
        String numId = numIdElement == null ? null : DocxNamespace.attribute(numIdElement, "w:val");
        // numId 为0表示去掉了编号
        if (numId == null || "0".equals(numId)) {
            return NumberedItem.NONE;
        }
        Element ilvlElement = NamespaceResolver.firstChild(numPr, "w:ilvl");
        int ilvl = 0;
        if (ilvlElement != null) {
            try {
                ilvl = Integer.parseInt(DocxNamespace.attribute(ilvlElement, "w:val").trim());
            } catch (NumberFormatException | NullPointerException e) {
                warnings.warn("编号层级无法解析，按第0层处理: numId=" + numId);
            }
        }
        return next(numId, ilvl);
    }

    /**
     * 在 (numId, ilvl) 上前进一步
     */
    public NumberedItem next(String numId, int ilvl) {
        if (ilvl < 0 || ilvl > MAX_LEVEL) {
            warnings.warn("编号层级超出范围 0.." + MAX_LEVEL + "，按第0层处理: numId=" + numId + " ilvl=" + ilvl);
            ilvl = 0;
        }
        int ordinal = increment(numId, ilvl);
        ListPosition position = new ListPosition(numId, pathOf(numId, ilvl));

        String symbol = symbolOf(numId, ilvl, ordinal);
        StringBuilder prefix = new StringBuilder();
        for (int i = 0; i < ilvl; i++) {
            prefix.append('\t');
        }
        prefix.append(symbol);
        if (!NumberingFormats.BULLET.equals(symbol)) {
            prefix.append(')');
        }
        prefix.append('\t');
        return new NumberedItem(prefix.toString(), position);
    }

    private int increment(String numId, int ilvl) {
        TreeMap<Integer, Integer> levels = ordinals.computeIfAbsent(numId, k -> new TreeMap<>());
        Integer current = levels.get(ilvl);
        int ordinal = current == null ? 0 : current + 1;
        levels.put(ilvl, ordinal);
        levels.tailMap(ilvl, false).clear();
        return ordinal;
    }

    private List<Integer> pathOf(String numId, int ilvl) {
        TreeMap<Integer, Integer> levels = ordinals.get(numId);
        List<Integer> path = new ArrayList<>(ilvl + 1);
        for (int level = 0; level <= ilvl; level++) {
            path.add(levels.getOrDefault(level, 0));
        }
        return path;
    }

    /**
     * 格式解析失败时回退为项目符号，计数照常
     */
    private String symbolOf(String numId, int ilvl, int ordinal) {
        Optional<LevelFormat> format = formats.formatOf(numId, ilvl);
        if (!format.isPresent()) {
            warnings.warn("找不到编号格式 numId=" + numId + " ilvl=" + ilvl + "，使用 '" + NumberingFormats.BULLET + "' 代替");
            return NumberingFormats.BULLET;
        }
        String numFmt = format.get().getNumFmt();
        if (!NumberingFormats.isSupported(numFmt)) {
            warnings.warn(numFmt + " 编号格式未实现，使用 '" + NumberingFormats.BULLET + "' 代替");
            return NumberingFormats.BULLET;
        }
        try {
            return NumberingFormats.format(numFmt, format.get().getStart() + ordinal);
        } catch (IllegalArgumentException e) {
            warnings.warn("编号无法格式化 numId=" + numId + " ilvl=" + ilvl + ": " + e.getMessage());
            return NumberingFormats.BULLET;
        }
    }
}
