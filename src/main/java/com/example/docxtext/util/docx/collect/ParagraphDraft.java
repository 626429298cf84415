package com.example.docxtext.util.docx.collect;

import com.example.docxtext.util.docx.model.ListPosition;
import com.example.docxtext.util.docx.model.Paragraph;
import com.example.docxtext.util.docx.model.Run;
import com.example.docxtext.util.docx.model.RunContent;
import com.example.docxtext.util.docx.text.InlineStyleStack;
import com.example.docxtext.util.docx.text.RunFormatting;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * 打开中的段落
 *
 * 片段顺序：[段落样式名] [标题标记] [编号前缀] [孤立片段...] [正文片段...] [标题结束标记]。
 * 段落结束时由样式栈一次性生成各片段的输出文本。
 */
final class ParagraphDraft {

    private final Element source;
    private final String style;
    private final String htmlStyle;
    private final List<String> lineage;
    private final ListPosition listPosition;
    private final List<RunDraft> runs = new ArrayList<>();

    ParagraphDraft(Element source, String style, String htmlStyle, List<String> lineage, ListPosition listPosition) {
        this.source = source;
        this.style = style == null ? "" : style;
        this.htmlStyle = htmlStyle;
        this.lineage = lineage;
        this.listPosition = listPosition == null ? ListPosition.NONE : listPosition;
    }

    List<RunDraft> getRuns() {
        return runs;
    }

    String getHtmlStyle() {
        return htmlStyle;
    }

    /**
     * 已有文本的片段数，用于批注范围定位
     */
    int countRuns() {
        int count = 0;
        for (RunDraft run : runs) {
            if (run.hasText()) {
                count++;
            }
        }
        return count;
    }

    /**
     * 生成段落，空片段丢弃
     *
     * @param html 是否输出样式标记
     */
    Paragraph build(boolean html) {
        InlineStyleStack stack = new InlineStyleStack();
        List<Run> built = new ArrayList<>();
        int lastRendered = -1;
        for (RunDraft draft : runs) {
            if (!draft.hasText()) {
                continue;
            }
            String text = draft.getText();
            String rendered;
            if (!html) {
                rendered = text;
            } else if (draft.getContent() == RunContent.HEADING) {
                rendered = stack.closeAll() + text;
            } else {
                String body = draft.getContent().isEscaped() ? InlineStyleStack.escape(text) : text;
                rendered = stack.render(draft.getFormatting(), body);
            }
            built.add(new Run(draft.getFormatting(), draft.getContent(), text, rendered));
            if (!rendered.isEmpty()) {
                lastRendered = built.size() - 1;
            }
        }

        String closing = stack.closeAll();
        if (!closing.isEmpty() && lastRendered >= 0) {
            Run last = built.get(lastRendered);
            built.set(lastRendered, new Run(last.getFormatting(), last.getContent(), last.getText(),
                    last.getRendered() + closing));
        }
        if (html && htmlStyle != null) {
            String close = "</" + htmlStyle + ">";
            built.add(new Run(RunFormatting.EMPTY, RunContent.HEADING, close, close));
        }
        return new Paragraph(built, style, htmlStyle, listPosition, lineage, source);
    }
}
