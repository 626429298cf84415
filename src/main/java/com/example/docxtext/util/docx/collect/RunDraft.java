package com.example.docxtext.util.docx.collect;

import com.example.docxtext.util.docx.model.RunContent;
import com.example.docxtext.util.docx.text.RunFormatting;

/**
 * 遍历过程中尚未完成的片段，文本可以继续追加
 */
final class RunDraft {

    private final RunFormatting formatting;
    private final RunContent content;
    private final StringBuilder text;

    RunDraft(RunFormatting formatting, RunContent content, String text) {
        this.formatting = formatting == null ? RunFormatting.EMPTY : formatting;
        this.content = content;
        this.text = new StringBuilder(text == null ? "" : text);
    }

    static RunDraft open(RunFormatting formatting) {
        return new RunDraft(formatting, RunContent.TEXT, "");
    }

    RunFormatting getFormatting() { return formatting; }

    RunContent getContent() { return content; }

    String getText() { return text.toString(); }

    boolean hasText() {
        return text.length() > 0;
    }

    void append(String more) {
        text.append(more);
    }
}
