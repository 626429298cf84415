package com.example.docxtext.util.docx.text;

import com.example.docxtext.util.docx.namespace.DocxNamespace;
import com.example.docxtext.util.docx.namespace.ElementRole;
import com.example.docxtext.util.docx.namespace.NamespaceResolver;
import org.w3c.dom.Element;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 文本片段的格式签名（粗体/斜体/.../字号/颜色）
 *
 * 两个相邻片段签名相同即可合并；样式栈按签名打开和关闭标记。
 * 开关类样式（b、i、caps...）的值为空字符串。
 */
public final class RunFormatting {

    public static final RunFormatting EMPTY = new RunFormatting(new EnumMap<>(StyleKind.class));

    private final Map<StyleKind, String> styles;

    private RunFormatting(EnumMap<StyleKind, String> styles) {
        this.styles = Collections.unmodifiableMap(styles);
    }

    public static RunFormatting of(Map<StyleKind, String> styles) {
        if (styles.isEmpty()) {
            return EMPTY;
        }
        return new RunFormatting(new EnumMap<>(styles));
    }

    /**
     * 从 w:r 元素的 w:rPr 读取格式签名
     *
     * <pre>
     * &lt;w:r&gt;
     *     &lt;w:rPr&gt;
     *         &lt;w:b/&gt;
     *         &lt;w:sz w:val="32"/&gt;
     *         &lt;w:u w:val="single"/&gt;
     *     &lt;/w:rPr&gt;
     *     &lt;w:t&gt;text&lt;/w:t&gt;
     * &lt;/w:r&gt;
     * </pre>
     * 得到 {BOLD="", UNDERLINE="single", FONT_SIZE="32"}
     */
    public static RunFormatting of(Element run) {
        if (run == null) {
            return EMPTY;
        }
        Element rPr = NamespaceResolver.firstChild(run, ElementRole.RUN_PROPERTIES);
        if (rPr == null) {
            return EMPTY;
        }
        EnumMap<StyleKind, String> styles = new EnumMap<>(StyleKind.class);
        for (Element property : NamespaceResolver.children(rPr)) {
            String name = DocxNamespace.prefixedName(property);
            if (name == null) {
                continue;
            }
            String val = DocxNamespace.attribute(property, "w:val");
            switch (name) {
                case "w:b":
                    putToggle(styles, StyleKind.BOLD, val);
                    break;
                case "w:i":
                    putToggle(styles, StyleKind.ITALIC, val);
                    break;
                case "w:u":
                    if (val == null || !"none".equals(val)) {
                        styles.put(StyleKind.UNDERLINE, val == null ? "" : val);
                    }
                    break;
                case "w:strike":
                case "w:dstrike":
                    putToggle(styles, StyleKind.STRIKE, val);
                    break;
                case "w:vertAlign":
                    if ("superscript".equals(val)) {
                        styles.put(StyleKind.SUPERSCRIPT, "");
                    } else if ("subscript".equals(val)) {
                        styles.put(StyleKind.SUBSCRIPT, "");
                    }
                    break;
                case "w:smallCaps":
                    putToggle(styles, StyleKind.SMALL_CAPS, val);
                    break;
                case "w:caps":
                    putToggle(styles, StyleKind.CAPS, val);
                    break;
                case "w:highlight":
                    if (val != null && !"none".equals(val)) {
                        styles.put(StyleKind.HIGHLIGHT, val);
                    }
                    break;
                case "w:sz":
                    if (val != null) {
                        styles.put(StyleKind.FONT_SIZE, val);
                    }
                    break;
                case "w:color":
                    if (val != null) {
                        styles.put(StyleKind.COLOR, val);
                    }
                    break;
                default:
                    break;
            }
        }
        return of(styles);
    }

    private static void putToggle(EnumMap<StyleKind, String> styles, StyleKind kind, String val) {
        // <w:b w:val="0"/> 显式关闭
        if (val != null && ("0".equals(val) || "false".equals(val) || "off".equals(val))) {
            return;
        }
        styles.put(kind, "");
    }

    public Map<StyleKind, String> getStyles() {
        return styles;
    }

    public boolean isEmpty() {
        return styles.isEmpty();
    }

    public boolean has(StyleKind kind) {
        return styles.containsKey(kind);
    }

    public String valueOf(StyleKind kind) {
        return styles.get(kind);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RunFormatting)) return false;
        return styles.equals(((RunFormatting) o).styles);
    }

    @Override
    public int hashCode() {
        return styles.hashCode();
    }

    @Override
    public String toString() {
        return styles.toString();
    }
}
