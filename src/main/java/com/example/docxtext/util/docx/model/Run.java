package com.example.docxtext.util.docx.model;

import com.example.docxtext.util.docx.text.RunFormatting;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 文本片段：一段格式一致的文本
 *
 * text 为原始文本，rendered 为加上样式标记（html模式）后的输出形式。
 * 段落结束时由样式栈生成，之后不再变化。
 */
public final class Run {

    @JsonIgnore
    private final RunFormatting formatting;

    @JsonProperty("content")
    private final RunContent content;

    @JsonProperty("text")
    private final String text;

    @JsonProperty("rendered")
    private final String rendered;

    public Run(RunFormatting formatting, RunContent content, String text, String rendered) {
        this.formatting = formatting == null ? RunFormatting.EMPTY : formatting;
        this.content = content;
        this.text = text == null ? "" : text;
        this.rendered = rendered == null ? "" : rendered;
    }

    /**
     * 未经样式栈处理的片段，rendered 与 text 相同
     */
    public static Run plain(String text) {
        return new Run(RunFormatting.EMPTY, RunContent.TEXT, text, text);
    }

    public RunFormatting getFormatting() { return formatting; }

    public RunContent getContent() { return content; }

    public String getText() { return text; }

    public String getRendered() { return rendered; }

    @Override
    public String toString() {
        return rendered;
    }
}
