package com.example.docxtext.util.docx.collect;

import com.example.docxtext.util.docx.model.Paragraph;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 一个内容部件的提取结果
 *
 * commentRanges 记录每个批注在 emittedRuns 中覆盖的片段区间 [begin, end)。
 */
public final class CollectedPart {

    private final List<List<List<List<Paragraph>>>> tables;
    private final Map<String, int[]> commentRanges;
    private final List<String> emittedRuns;

    CollectedPart(List<List<List<List<Paragraph>>>> tables, Map<String, int[]> commentRanges, List<String> emittedRuns) {
        this.tables = tables;
        this.commentRanges = Collections.unmodifiableMap(commentRanges);
        this.emittedRuns = Collections.unmodifiableList(emittedRuns);
    }

    public List<List<List<List<Paragraph>>>> getTables() {
        return tables;
    }

    public Map<String, int[]> getCommentRanges() {
        return commentRanges;
    }

    /**
     * 批注覆盖的文本，id 不存在时返回null
     */
    public String getCommentReference(String id) {
        int[] range = commentRanges.get(id);
        if (range == null) {
            return null;
        }
        int begin = Math.min(range[0], emittedRuns.size());
        int end = Math.min(Math.max(range[1], begin), emittedRuns.size());
        return String.join("", emittedRuns.subList(begin, end));
    }
}
