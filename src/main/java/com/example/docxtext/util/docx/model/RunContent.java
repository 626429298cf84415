package com.example.docxtext.util.docx.model;

/**
 * 文本片段的特殊内容标记
 *
 * 只有 TEXT、BREAK、TAB、NOTE_LABEL、FORM_VALUE、PLACEHOLDER 的文本在html模式下需要转义；
 * LINK、EQUATION、SYMBOL、HEADING 是已经拼好的标记文本，原样输出。
 */
public enum RunContent {

    /** 普通文本 */
    TEXT(true),
    /** 换行 */
    BREAK(true),
    /** 制表符 */
    TAB(true),
    /** 图片、图片替代文本、脚注尾注引用等占位符 */
    PLACEHOLDER(true),
    /** 复选框、下拉框等表单值 */
    FORM_VALUE(true),
    /** 脚注/尾注正文开头的编号 */
    NOTE_LABEL(true),
    /** 编号列表前缀 */
    LIST_PREFIX(true),
    /** 段落样式名（paragraphStyles 选项） */
    PARAGRAPH_STYLE(true),
    /** 超链接，文本已包含 a 标签 */
    LINK(false),
    /** 公式，文本已包含 latex 标签 */
    EQUATION(false),
    /** 符号字符，文本已包含 span 标签 */
    SYMBOL(false),
    /** 标题段落的 h1..h6 标记 */
    HEADING(false);

    private final boolean escaped;

    RunContent(boolean escaped) {
        this.escaped = escaped;
    }

    /**
     * html模式下是否需要转义 &amp; &lt; &gt;
     */
    public boolean isEscaped() {
        return escaped;
    }

    /**
     * 合并相邻文本片段时是否可以参与合并
     */
    public boolean isPlain() {
        return this == TEXT;
    }
}
