package com.example.docxtext.util.docx.collect;

import com.example.docxtext.util.docx.WarningSink;
import com.example.docxtext.util.docx.model.Paragraph;
import com.example.docxtext.util.docx.model.RunContent;
import com.example.docxtext.util.docx.namespace.DocxNamespace;
import com.example.docxtext.util.docx.text.RunFormatting;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 把段落放进固定深度的嵌套列表
 *
 * <pre>
 * [  # 文档      caret深度 1
 *     [  # 表格  caret深度 2
 *         [  # 行      caret深度 3
 *             [  # 单元格  caret深度 4
 *                 Paragraph
 *             ]
 *         ]
 *     ]
 * ]
 * </pre>
 * 遍历时每打开或关闭一个元素，就把"光标"降到或升到该元素的深度：
 * 降低时新建分支，升高时关闭当前分支。段落总是插入在深度4，
 * 所以无论源文件嵌套多深，输出始终是4层。
 *
 * 每次遍历一个内容部件使用一个实例，不在线程间共享。
 */
public class DepthCollector {

    static final int PARAGRAPH_DEPTH = 4;

    private final boolean html;
    private final WarningSink warnings;

    private final List<Object> root = new ArrayList<>();
    private final List<List<Object>> rightmostBranches = new ArrayList<>();

    // ("document", tbl, tr, tc, p)
    private final String[] lineage = {"document", null, null, null, null};

    private final List<ParagraphDraft> openParagraphs = new ArrayList<>();
    private List<RunDraft> orphanRuns = new ArrayList<>();

    private final Map<String, int[]> commentRanges = new LinkedHashMap<>();
    private final Map<List<?>, CellMerge> cellMerges = new IdentityHashMap<>();
    private final List<String> emittedRuns = new ArrayList<>();

    public DepthCollector(boolean html, WarningSink warnings) {
        this.html = html;
        this.warnings = warnings;
        rightmostBranches.add(root);
    }

    int getCaretDepth() {
        return rightmostBranches.size();
    }

    private List<Object> caret() {
        return rightmostBranches.get(rightmostBranches.size() - 1);
    }

    private void dropCaret() {
        if (getCaretDepth() >= PARAGRAPH_DEPTH) {
            throw new IllegalStateException("光标不能低于段落深度");
        }
        List<Object> branch = new ArrayList<>();
        caret().add(branch);
        rightmostBranches.add(branch);
    }

    private void raiseCaret() {
        if (getCaretDepth() == 1) {
            throw new IllegalStateException("光标不能高于文档根");
        }
        rightmostBranches.remove(rightmostBranches.size() - 1);
    }

    /**
     * 把光标移动到指定深度
     *
     * @param depth   1..4，null 表示该元素不影响深度（document、body、不含段落的元素）
     * @param element 打开的元素，记入段落的层级路径；关闭元素时传null
     */
    public void setCaret(Integer depth, Element element) {
        if (depth == null) {
            return;
        }
        while (getCaretDepth() < depth) {
            dropCaret();
        }
        while (getCaretDepth() > depth) {
            lineage[depth] = null;
            raiseCaret();
        }
        lineage[depth] = element == null ? null : DocxNamespace.localName(element);
    }

    List<String> currentLineage() {
        return new ArrayList<>(Arrays.asList(lineage));
    }

    // ---- 段落与片段 ----

    /**
     * 打开段落，之前积累的孤立片段并入该段落
     */
    public void commenceParagraph(ParagraphDraft paragraph) {
        paragraph.getRuns().addAll(orphanRuns);
        paragraph.getRuns().add(RunDraft.open(RunFormatting.EMPTY));
        orphanRuns = new ArrayList<>();
        openParagraphs.add(paragraph);
    }

    /**
     * 关闭最近打开的段落并插入到深度4
     */
    public void concludeParagraph() {
        ParagraphDraft draft = openParagraphs.remove(openParagraphs.size() - 1);
        Paragraph paragraph = draft.build(html);
        emittedRuns.addAll(paragraph.getRunStrings());
        insert(paragraph);
    }

    private void insert(Paragraph paragraph) {
        setCaret(PARAGRAPH_DEPTH, null);
        caret().add(paragraph);
    }

    private List<RunDraft> openRuns() {
        if (!openParagraphs.isEmpty()) {
            return openParagraphs.get(openParagraphs.size() - 1).getRuns();
        }
        return orphanRuns;
    }

    private RunDraft openRun() {
        List<RunDraft> runs = openRuns();
        if (runs.isEmpty()) {
            runs.add(RunDraft.open(RunFormatting.EMPTY));
        }
        return runs.get(runs.size() - 1);
    }

    public void commenceRun(RunFormatting formatting) {
        openRuns().add(RunDraft.open(formatting));
    }

    /**
     * 片段结束后，片段之间的文本进入一个无格式片段
     */
    public void concludeRun() {
        commenceRun(RunFormatting.EMPTY);
    }

    /**
     * 文本追加到当前片段
     */
    public void addTextIntoOpenRun(String text) {
        openRun().append(text);
    }

    /**
     * 插入一个无格式的独立片段（链接、占位符...），之后按原格式重新打开一个片段
     *
     * <pre>
     * &lt;b&gt;some text  &lt;a href=""&gt;link&lt;/a&gt;  &lt;b&gt;other text
     * </pre>
     */
    public void insertTextAsNewRun(RunContent content, String text) {
        insertRun(RunFormatting.EMPTY, content, text);
    }

    /**
     * 插入一个沿用当前片段格式的独立片段（符号字符）
     */
    public void insertStyledRun(RunContent content, String text) {
        insertRun(openRun().getFormatting(), content, text);
    }

    private void insertRun(RunFormatting formatting, RunContent content, String text) {
        RunFormatting openFormatting = openRun().getFormatting();
        List<RunDraft> runs = openRuns();
        runs.add(new RunDraft(formatting, content, text));
        runs.add(RunDraft.open(openFormatting));
    }

    // ---- 批注范围 ----

    private int countRuns() {
        int count = emittedRuns.size();
        for (ParagraphDraft paragraph : openParagraphs) {
            count += paragraph.countRuns();
        }
        for (RunDraft run : orphanRuns) {
            if (run.hasText()) {
                count++;
            }
        }
        return count;
    }

    public void startCommentRange(String id) {
        int count = countRuns();
        commentRanges.put(id, new int[]{count, count});
    }

    public void endCommentRange(String id) {
        int count = countRuns();
        int[] range = commentRanges.get(id);
        if (range == null) {
            warnings.warn("批注范围缺少起点: w:id=" + id);
            commentRanges.put(id, new int[]{count, count});
            return;
        }
        range[1] = count;
    }

    // ---- 合并单元格 ----

    /**
     * 记录刚结束的单元格的合并信息，光标不在单元格深度时忽略
     */
    public void recordCellMerge(CellMerge merge) {
        if (merge == CellMerge.NONE || getCaretDepth() != PARAGRAPH_DEPTH) {
            return;
        }
        cellMerges.put(caret(), merge);
    }

    /**
     * 遍历结束：孤立片段收进一个段落，关闭所有未关闭的段落
     */
    public void finish() {
        boolean orphanText = false;
        for (RunDraft run : orphanRuns) {
            orphanText |= run.hasText();
        }
        if (orphanText) {
            commenceParagraph(new ParagraphDraft(null, "", null, currentLineage(), null));
        }
        while (!openParagraphs.isEmpty()) {
            concludeParagraph();
        }
    }

    /**
     * 未经合并单元格整理的原始结构
     */
    List<Object> getRawTree() {
        return root;
    }

    Map<List<?>, CellMerge> getCellMerges() {
        return cellMerges;
    }

    Map<String, int[]> getCommentRanges() {
        return commentRanges;
    }

    List<String> getEmittedRuns() {
        return emittedRuns;
    }
}
