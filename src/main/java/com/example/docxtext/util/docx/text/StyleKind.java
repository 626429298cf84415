package com.example.docxtext.util.docx.text;

/**
 * 行内样式种类，声明顺序即打开标记时的固定顺序
 */
public enum StyleKind {

    BOLD("b", null),
    ITALIC("i", null),
    UNDERLINE("u", null),
    STRIKE("s", null),
    SUPERSCRIPT("sup", null),
    SUBSCRIPT("sub", null),
    SMALL_CAPS("span", "font-variant:small-caps"),
    CAPS("span", "text-transform:uppercase"),
    HIGHLIGHT("span", "background-color:%s"),
    FONT_SIZE("span", "font-size:%spt"),
    COLOR("span", "color:%s");

    private final String tag;
    private final String cssTemplate;

    StyleKind(String tag, String cssTemplate) {
        this.tag = tag;
        this.cssTemplate = cssTemplate;
    }

    public String getTag() {
        return tag;
    }

    /**
     * 打开标记，如 {@code <b>} 或 {@code <span style="color:FF0000">}
     *
     * @param value rPr 子元素的 w:val，开关类样式为空字符串
     */
    public String open(String value) {
        if (cssTemplate == null) {
            return "<" + tag + ">";
        }
        return "<" + tag + " style=\"" + String.format(cssTemplate, value) + "\">";
    }

    public String close() {
        return "</" + tag + ">";
    }
}
