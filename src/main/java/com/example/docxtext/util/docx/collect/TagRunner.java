package com.example.docxtext.util.docx.collect;

import com.example.docxtext.util.docx.model.ExtractionOptions;
import com.example.docxtext.util.docx.model.IndexedItem;
import com.example.docxtext.util.docx.model.NestedLists;
import com.example.docxtext.util.docx.model.Paragraph;
import com.example.docxtext.util.docx.model.RunContent;
import com.example.docxtext.util.docx.namespace.DocxNamespace;
import com.example.docxtext.util.docx.namespace.ElementRole;
import com.example.docxtext.util.docx.namespace.NamespaceResolver;
import com.example.docxtext.util.docx.text.FormFieldText;
import com.example.docxtext.util.docx.text.InlineStyleStack;
import com.example.docxtext.util.docx.text.NumberingTracker;
import com.example.docxtext.util.docx.text.RunFormatting;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 按元素角色分派的递归遍历
 *
 * 每个元素打开时先把光标移到它的深度，再执行对应的处理；关闭时先处理再移动光标。
 * open 返回 false 表示不再遍历子元素（内容已经由处理方法自己读取）。
 */
@Slf4j
class TagRunner {

    private static final Pattern HEADING_STYLE = Pattern.compile("(?i)heading\\s*([1-6])");

    private final ExtractionContext context;
    private final ExtractionOptions options;
    private final DepthCollector collector;
    private final NumberingTracker numbering;
    private final Map<Element, Integer> depthCache = new IdentityHashMap<>();

    TagRunner(ExtractionContext context) {
        this.context = context;
        this.options = context.getOptions();
        this.collector = new DepthCollector(options.isHtml(), context.getWarnings());
        this.numbering = new NumberingTracker(context.getNumbering(), context.getWarnings());
    }

    /**
     * 元素相对段落的深度：max(4 - 到最近后代段落的广度优先距离, 1)
     *
     * <pre>
     * w:tbl -&gt; w:tr -&gt; w:tc -&gt; w:p
     *   1        2        3       4
     * </pre>
     * document、body 以及不含段落的元素返回null，不影响光标。
     * 按深度而不是按标签判断，脚注、内容控件等非表格容器也会被归入表格/行/单元格的层级。
     */
    Integer depthOf(Element element) {
        if (depthCache.containsKey(element)) {
            return depthCache.get(element);
        }
        Integer depth = null;
        ElementRole role = NamespaceResolver.roleOf(element);
        if (role != ElementRole.DOCUMENT && role != ElementRole.BODY) {
            List<Element> level = new ArrayList<>();
            level.add(element);
            int distance = 0;
            while (!level.isEmpty() && depth == null) {
                List<Element> next = new ArrayList<>();
                for (Element candidate : level) {
                    if (NamespaceResolver.is(candidate, ElementRole.PARAGRAPH)) {
                        depth = Math.max(DepthCollector.PARAGRAPH_DEPTH - distance, 1);
                        break;
                    }
                    next.addAll(NamespaceResolver.children(candidate));
                }
                level = next;
                distance++;
            }
        }
        depthCache.put(element, depth);
        return depth;
    }

    void walk(Element tree) {
        ElementRole role = NamespaceResolver.roleOf(tree);
        if (role == ElementRole.UNKNOWN) {
            context.getWarnings().warn("跳过无法识别的元素: {" + tree.getNamespaceURI() + "}" + DocxNamespace.localName(tree));
            return;
        }
        if (open(tree, role)) {
            for (Element child : NamespaceResolver.children(tree)) {
                walk(child);
            }
        }
        close(tree, role);
    }

    CollectedPart finish() {
        collector.finish();
        List<List<List<List<Paragraph>>>> tables = MergedCellNormalizer.normalize(
                collector.getRawTree(), collector.getCellMerges(), options.isDuplicateMergedCells());
        return new CollectedPart(tables, collector.getCommentRanges(), collector.getEmittedRuns());
    }

    private boolean open(Element tree, ElementRole role) {
        collector.setCaret(depthOf(tree), tree);
        switch (role) {
            case PARAGRAPH:
                openParagraph(tree);
                return true;
            case RUN:
                collector.commenceRun(RunFormatting.of(tree));
                return true;
            case TEXT:
            case TEXT_MATH:
                collector.addTextIntoOpenRun(tree.getTextContent());
                return false;
            case MATH:
                insertEquation(tree.getTextContent());
                return false;
            case BREAK:
            case CARRIAGE_RETURN:
                collector.addTextIntoOpenRun("\n");
                return false;
            case TAB:
                collector.insertTextAsNewRun(RunContent.TAB, "\t");
                return false;
            case SYMBOL:
                openSymbol(tree);
                return false;
            case FOOTNOTE:
                openNote(tree, "footnote");
                return true;
            case ENDNOTE:
                openNote(tree, "endnote");
                return true;
            case FOOTNOTE_REFERENCE:
                collector.insertTextAsNewRun(RunContent.PLACEHOLDER, "----footnote" + DocxNamespace.attribute(tree, "w:id") + "----");
                return false;
            case ENDNOTE_REFERENCE:
                collector.insertTextAsNewRun(RunContent.PLACEHOLDER, "----endnote" + DocxNamespace.attribute(tree, "w:id") + "----");
                return false;
            case HYPERLINK:
                openHyperlink(tree);
                return false;
            case FORM_CHECKBOX:
                insertFormValue(FormFieldText.checkbox(tree), FormFieldText.CHECKBOX_FAILED);
                return false;
            case FORM_DROPDOWN:
                insertFormValue(FormFieldText.dropdown(tree), FormFieldText.DROPDOWN_FAILED);
                return false;
            case IMAGE:
                insertImage(DocxNamespace.attribute(tree, "r:embed"));
                return true;
            case IMAGE_DATA:
                insertImage(DocxNamespace.attribute(tree, "r:id"));
                return true;
            case IMAGE_ALT:
                insertImageAlt(tree);
                return true;
            case COMMENT_RANGE_START:
                collector.startCommentRange(DocxNamespace.attribute(tree, "w:id"));
                return false;
            case COMMENT_RANGE_END:
                collector.endCommentRange(DocxNamespace.attribute(tree, "w:id"));
                return false;
            case ALTERNATE_CONTENT:
                openAlternateContent(tree);
                return false;
            case FIELD_INSTRUCTION:
            case ALTERNATE_FALLBACK:
            case RUN_PROPERTIES:
            case PARAGRAPH_PROPERTIES:
            case TABLE_CELL_PROPERTIES:
                return false;
            default:
                return true;
        }
    }

    private void close(Element tree, ElementRole role) {
        switch (role) {
            case PARAGRAPH:
                collector.concludeParagraph();
                break;
            case RUN:
                collector.concludeRun();
                break;
            case TABLE_CELL:
                collector.recordCellMerge(CellMerge.of(tree, context.getWarnings()));
                break;
            default:
                break;
        }
        collector.setCaret(depthOf(tree), null);
    }

    private void openParagraph(Element paragraph) {
        String style = paragraphStyle(paragraph);
        String htmlStyle = null;
        if (options.isHtml()) {
            Matcher heading = HEADING_STYLE.matcher(style);
            if (heading.matches()) {
                htmlStyle = "h" + heading.group(1);
            }
        }
        NumberingTracker.NumberedItem item = numbering.next(paragraph);
        ParagraphDraft draft = new ParagraphDraft(paragraph, style, htmlStyle, collector.currentLineage(), item.getPosition());
        if (options.isParagraphStyles()) {
            draft.getRuns().add(new RunDraft(RunFormatting.EMPTY, RunContent.PARAGRAPH_STYLE, style.isEmpty() ? "None" : style));
        }
        if (htmlStyle != null) {
            draft.getRuns().add(new RunDraft(RunFormatting.EMPTY, RunContent.HEADING, "<" + htmlStyle + ">"));
        }
        if (item.isNumbered()) {
            draft.getRuns().add(new RunDraft(RunFormatting.EMPTY, RunContent.LIST_PREFIX, item.getPrefix()));
        }
        collector.commenceParagraph(draft);
    }

    /**
     * w:pPr/w:pStyle 的 w:val，没有时为空字符串
     */
    static String paragraphStyle(Element paragraph) {
        Element pPr = NamespaceResolver.firstChild(paragraph, ElementRole.PARAGRAPH_PROPERTIES);
        if (pPr == null) {
            return "";
        }
        Element pStyle = NamespaceResolver.firstChild(pPr, "w:pStyle");
        String val = pStyle == null ? null : DocxNamespace.attribute(pStyle, "w:val");
        return val == null ? "" : val;
    }

    private void openSymbol(Element symbol) {
        String font = DocxNamespace.attribute(symbol, "w:font");
        String code = DocxNamespace.attribute(symbol, "w:char");
        if (code == null || code.isEmpty()) {
            return;
        }
        // F0xx 形式的私用区编码，去掉首位
        collector.insertStyledRun(RunContent.SYMBOL,
                "<span style=font-family:" + font + ">&#x0" + code.substring(1) + ";</span>");
    }

    /**
     * 脚注/尾注正文前加 "footnote2)\t"，分隔符类脚注除外
     */
    private void openNote(Element note, String kind) {
        String type = DocxNamespace.attribute(note, "w:type");
        if (type != null && type.toLowerCase().contains("separator")) {
            return;
        }
        collector.insertTextAsNewRun(RunContent.NOTE_LABEL, kind + DocxNamespace.attribute(note, "w:id") + ")\t");
    }

    private void insertImage(String relationshipId) {
        Optional<String> target = context.getRelationships().resolve(relationshipId);
        if (target.isPresent()) {
            collector.insertTextAsNewRun(RunContent.PLACEHOLDER, "----" + target.get() + "----");
        } else {
            log.debug("图片关系无法解析，省略: {}", relationshipId);
        }
    }

    private void insertImageAlt(Element docPr) {
        String description = DocxNamespace.attribute(docPr, "descr");
        if (description != null) {
            collector.insertTextAsNewRun(RunContent.PLACEHOLDER, "----Image alt text---->" + description + "<");
        }
    }

    /**
     * 超链接：链接内的文本另起一次遍历得到，关系可解析时包成 a 标签，否则只输出文本
     */
    private void openHyperlink(Element hyperlink) {
        String text = textBelow(hyperlink);
        String rId = DocxNamespace.attribute(hyperlink, "r:id");
        Optional<String> target = rId == null ? Optional.empty() : context.getRelationships().resolve(rId);
        if (!target.isPresent()) {
            if (rId != null) {
                log.debug("超链接关系无法解析，只保留文本: {}", rId);
            }
            collector.insertTextAsNewRun(RunContent.LINK, text);
            return;
        }
        String href = target.get();
        String anchor = DocxNamespace.attribute(hyperlink, "w:anchor");
        if (anchor != null && !anchor.isEmpty()) {
            href = href + "#" + anchor;
        }
        collector.insertTextAsNewRun(RunContent.LINK, "<a href=\"" + escapeAttribute(href) + "\">" + text + "</a>");
    }

    /**
     * 属性值中的双引号总是转义；html模式下同时转义 &amp; &lt; &gt;
     */
    private String escapeAttribute(String value) {
        String escaped = options.isHtml() ? InlineStyleStack.escape(value) : value;
        return escaped.replace("\"", "&quot;");
    }

    /**
     * 公式文本包在 latex 标签中，html模式下转义公式内容
     */
    private void insertEquation(String formula) {
        String body = options.isHtml() ? InlineStyleStack.escape(formula) : formula;
        collector.insertTextAsNewRun(RunContent.EQUATION, "<latex>" + body + "</latex>");
    }

    private void insertFormValue(String value, String failedMarker) {
        if (failedMarker.equals(value)) {
            context.getWarnings().warn("表单控件状态无法解析，输出 " + failedMarker);
        }
        collector.insertTextAsNewRun(RunContent.FORM_VALUE, value);
    }

    /**
     * 元素下所有内容的文本（段落之间空一行）
     */
    private String textBelow(Element element) {
        TagRunner below = new TagRunner(context);
        for (Element child : NamespaceResolver.children(element)) {
            below.walk(child);
        }
        List<String> paragraphs = new ArrayList<>();
        for (IndexedItem item : NestedLists.enumAtDepth(below.finish().getTables(), 4)) {
            Paragraph paragraph = item.getValue();
            List<String> strings = paragraph.getRunStrings();
            if (options.isParagraphStyles() && !strings.isEmpty()
                    && paragraph.getRuns().get(0).getContent() == RunContent.PARAGRAPH_STYLE) {
                strings = strings.subList(1, strings.size());
            }
            paragraphs.add(String.join("", strings));
        }
        return String.join("\n\n", paragraphs);
    }

    /**
     * mc:AlternateContent 的各分支是同一内容的不同表示，只遍历第一个 mc:Choice（没有时取 mc:Fallback）
     */
    private void openAlternateContent(Element alternateContent) {
        Element branch = NamespaceResolver.firstChild(alternateContent, ElementRole.ALTERNATE_CHOICE);
        if (branch == null) {
            branch = NamespaceResolver.firstChild(alternateContent, ElementRole.ALTERNATE_FALLBACK);
            if (branch != null) {
                for (Element child : NamespaceResolver.children(branch)) {
                    walk(child);
                }
            }
            return;
        }
        walk(branch);
    }
}
