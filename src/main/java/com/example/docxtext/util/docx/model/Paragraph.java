package com.example.docxtext.util.docx.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 段落：固定输出深度第4层的单元
 *
 * 所有片段的 rendered 拼接起来即段落输出文本，每个字符只出现一次。
 * source 指向源xml中的 w:p 元素，只做引用，不拥有该元素；
 * 补出来的空白单元格里的段落没有 source。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Paragraph {

    @JsonProperty("runs")
    private final List<Run> runs;

    @JsonProperty("style")
    private final String style;

    @JsonProperty("html_style")
    private final String htmlStyle;

    @JsonProperty("list_position")
    private final ListPosition listPosition;

    @JsonProperty("lineage")
    private final List<String> lineage;

    @JsonIgnore
    private final transient Element source;

    public Paragraph(List<Run> runs, String style, String htmlStyle, ListPosition listPosition,
                     List<String> lineage, Element source) {
        this.runs = Collections.unmodifiableList(new ArrayList<>(runs));
        this.style = style == null ? "" : style;
        this.htmlStyle = htmlStyle;
        this.listPosition = listPosition == null ? ListPosition.NONE : listPosition;
        this.lineage = lineage == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(lineage));
        this.source = source;
    }

    /**
     * 空白段落，用于合并单元格补位
     */
    public static Paragraph blank() {
        return new Paragraph(Collections.emptyList(), "", null, ListPosition.NONE, null, null);
    }

    public List<Run> getRuns() { return runs; }

    public String getStyle() { return style; }

    public String getHtmlStyle() { return htmlStyle; }

    public ListPosition getListPosition() { return listPosition; }

    public List<String> getLineage() { return lineage; }

    public Element getSource() { return source; }

    /**
     * 有内容的片段输出文本
     */
    @JsonIgnore
    public List<String> getRunStrings() {
        List<String> strings = new ArrayList<>();
        for (Run run : runs) {
            if (!run.getRendered().isEmpty()) {
                strings.add(run.getRendered());
            }
        }
        return strings;
    }

    /**
     * 段落输出文本（含样式标记）
     */
    @JsonProperty("text")
    public String getText() {
        return String.join("", getRunStrings());
    }

    @Override
    public String toString() {
        return getText();
    }
}
