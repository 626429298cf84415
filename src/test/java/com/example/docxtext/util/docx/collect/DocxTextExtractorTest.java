package com.example.docxtext.util.docx.collect;

import com.example.docxtext.util.docx.CollectingWarningSink;
import com.example.docxtext.util.docx.DocxXml;
import com.example.docxtext.util.docx.model.ExtractionOptions;
import com.example.docxtext.util.docx.model.ListPosition;
import com.example.docxtext.util.docx.model.NestedLists;
import com.example.docxtext.util.docx.model.Paragraph;
import com.example.docxtext.util.docx.pkg.RelationshipLookup;
import com.example.docxtext.util.docx.text.FormFieldText;
import com.example.docxtext.util.docx.text.NumberingDefinitions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.example.docxtext.util.docx.DocxXml.p;
import static com.example.docxtext.util.docx.DocxXml.r;
import static com.example.docxtext.util.docx.DocxXml.tbl;
import static com.example.docxtext.util.docx.DocxXml.tc;
import static com.example.docxtext.util.docx.DocxXml.tr;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("内容部件文本提取")
class DocxTextExtractorTest {

    private final CollectingWarningSink warnings = new CollectingWarningSink();

    private CollectedPart extract(Element root, ExtractionOptions options) {
        return extract(root, options, RelationshipLookup.EMPTY);
    }

    private CollectedPart extract(Element root, ExtractionOptions options, RelationshipLookup relationships) {
        ExtractionContext context = new ExtractionContext(options, relationships, NumberingDefinitions.empty(), warnings);
        return DocxTextExtractor.extract(root, context);
    }

    private List<List<List<List<String>>>> strings(String bodyXml) {
        return NestedLists.paragraphStrings(extract(DocxXml.document(bodyXml), ExtractionOptions.defaults()).getTables());
    }

    private List<Object> paragraphs(String bodyXml, ExtractionOptions options) {
        return NestedLists.listAtDepth(
                NestedLists.paragraphStrings(extract(DocxXml.document(bodyXml), options).getTables()), 4);
    }

    private static ExtractionOptions html() {
        ExtractionOptions options = ExtractionOptions.defaults();
        options.setHtml(true);
        return options;
    }

    // ---- 结构 ----

    @Test
    @DisplayName("正文段落归入一个单行单格的表格")
    void bodyParagraphsShareOneCell() {
        assertThat(strings(p(r("a")) + p(r("b"))))
                .isEqualTo(List.of(List.of(List.of(List.of("a", "b")))));
    }

    @Test
    @DisplayName("表格按 行-单元格 展开")
    void tableRowsAndCells() {
        String body = tbl(tr(tc(p(r("a"))), tc(p(r("b")))), tr(tc(p(r("c"))), tc(p(r("d")) + p(r("e")))));

        assertThat(strings(body)).isEqualTo(List.of(List.of(
                List.of(List.of("a"), List.of("b")),
                List.of(List.of("c"), List.of("d", "e")))));
    }

    @Test
    @DisplayName("段落与表格交替时各自成为独立的表格，顺序不变")
    void paragraphsAroundTable() {
        String body = p(r("before")) + tbl(tr(tc(p(r("inside"))))) + p(r("after"));

        assertThat(strings(body)).isEqualTo(List.of(
                List.of(List.of(List.of("before"))),
                List.of(List.of(List.of("inside"))),
                List.of(List.of(List.of("after")))));
    }

    @Test
    @DisplayName("单元格中嵌套的表格被提到顶层，前后内容保持顺序")
    void nestedTableIsHoisted() {
        String body = tbl(tr(tc(p(r("p1")) + tbl(tr(tc(p(r("p2"))))) + p(r("p2b")))));

        assertThat(strings(body)).isEqualTo(List.of(
                List.of(List.of(List.of("p1"))),
                List.of(List.of(List.of("p2"))),
                List.of(List.of(List.of("p2b")))));
    }

    @Test
    @DisplayName("任意层级的包装元素都归一为4层，每个叶子都是段落")
    void fixedDepthUnderIrregularWrappers() {
        String body = "<w:sdt><w:sdtContent>"
                + "<w:customXml><w:sdt><w:sdtContent>" + p(r("deep")) + "</w:sdtContent></w:sdt></w:customXml>"
                + tbl(tr(tc("<w:sdt><w:sdtContent>" + p(r("cell")) + "</w:sdtContent></w:sdt>")))
                + "</w:sdtContent></w:sdt>";
        CollectedPart part = extract(DocxXml.document(body), ExtractionOptions.defaults());

        List<Object> leaves = NestedLists.listAtDepth(part.getTables(), 4);
        assertThat(leaves).hasSize(2).allMatch(leaf -> leaf instanceof Paragraph);
        assertThat(leaves).extracting(Object::toString).containsExactly("deep", "cell");
    }

    @Test
    @DisplayName("段落记录源元素与层级路径")
    void paragraphLineageAndSource() {
        CollectedPart part = extract(DocxXml.document(tbl(tr(tc(p(r("x")))))), ExtractionOptions.defaults());

        Paragraph paragraph = part.getTables().get(0).get(0).get(0).get(0);
        assertThat(paragraph.getLineage()).containsExactly("document", "tbl", "tr", "tc", "p");
        assertThat(paragraph.getSource()).isNotNull();
        assertThat(paragraph.getSource().getLocalName()).isEqualTo("p");
    }

    // ---- 合并单元格 ----

    private static final String SPANNED = tbl(
            tr(tc("<w:tcPr><w:gridSpan w:val=\"2\"/></w:tcPr>" + p(r("A"))), tc(p(r("B")))),
            tr(tc(p(r("C"))), tc(p(r("D"))), tc(p(r("E")))),
            tr(tc(p(r("F")))));

    @Test
    @DisplayName("gridSpan 展开为多个位置，短行补空白单元格")
    void gridSpanDuplicated() {
        assertThat(strings(SPANNED)).isEqualTo(List.of(List.of(
                List.of(List.of("A"), List.of("A"), List.of("B")),
                List.of(List.of("C"), List.of("D"), List.of("E")),
                List.of(List.of("F"), List.of(""), List.of("")))));
    }

    @Test
    @DisplayName("不复制模式下展开位置为空白单元格")
    void gridSpanBlank() {
        ExtractionOptions options = ExtractionOptions.defaults();
        options.setDuplicateMergedCells(false);
        CollectedPart part = extract(DocxXml.document(SPANNED), options);

        assertThat(NestedLists.paragraphStrings(part.getTables()).get(0).get(0))
                .isEqualTo(List.of(List.of("A"), List.of(""), List.of("B")));
    }

    @Test
    @DisplayName("vMerge 延续单元格复制上方同列内容")
    void verticalMerge() {
        String body = tbl(
                tr(tc("<w:tcPr><w:vMerge w:val=\"restart\"/></w:tcPr>" + p(r("X"))), tc(p(r("Y")))),
                tr(tc("<w:tcPr><w:vMerge/></w:tcPr><w:p/>"), tc(p(r("Z")))));

        assertThat(strings(body).get(0).get(1)).isEqualTo(List.of(List.of("X"), List.of("Z")));

        ExtractionOptions options = ExtractionOptions.defaults();
        options.setDuplicateMergedCells(false);
        List<List<List<List<String>>>> blank = NestedLists.paragraphStrings(
                extract(DocxXml.document(body), options).getTables());
        assertThat(blank.get(0).get(1)).isEqualTo(List.of(List.of(""), List.of("Z")));
    }

    @Test
    @DisplayName("gridSpan 超过 63 列时按 63 处理并告警，后续内容照常提取")
    void oversizedGridSpanIsClamped() {
        String body = tbl(tr(tc("<w:tcPr><w:gridSpan w:val=\"2000000000\"/></w:tcPr>" + p(r("wide")))))
                + p(r("after"));

        List<List<List<List<String>>>> tables = strings(body);

        assertThat(tables).hasSize(2);
        assertThat(tables.get(0).get(0)).hasSize(CellMerge.MAX_GRID_SPAN).containsOnly(List.of("wide"));
        assertThat(tables.get(1)).isEqualTo(List.of(List.of(List.of("after"))));
        assertThat(warnings.getMessages()).anyMatch(message -> message.contains("gridSpan"));
    }

    // ---- 容错 ----

    @Test
    @DisplayName("无法识别的元素连同子树跳过并告警，其余内容照常提取")
    void unknownElementsAreSkipped() {
        String body = p(r("a") + "<x:foreign><w:r><w:t>hidden</w:t></w:r></x:foreign>" + r("b"))
                + "<x:block>" + p(r("lost")) + "</x:block>"
                + p(r("c"));

        assertThat(strings(body)).isEqualTo(List.of(List.of(List.of(List.of("ab", "c")))));
        assertThat(warnings.getMessages()).hasSize(2);
        assertThat(warnings.getMessages().get(0)).contains("foreign");
    }

    @Test
    @DisplayName("mc:AlternateContent 只取第一个 Choice，没有时取 Fallback")
    void alternateContent() {
        String withChoice = p("<w:r><mc:AlternateContent>"
                + "<mc:Choice Requires=\"wps\"><w:t>choice</w:t></mc:Choice>"
                + "<mc:Fallback><w:t>fallback</w:t></mc:Fallback>"
                + "</mc:AlternateContent></w:r>");
        String fallbackOnly = p("<w:r><mc:AlternateContent>"
                + "<mc:Fallback><w:t>fallback</w:t></mc:Fallback>"
                + "</mc:AlternateContent></w:r>");

        assertThat(paragraphs(withChoice, ExtractionOptions.defaults())).containsExactly("choice");
        assertThat(paragraphs(fallbackOnly, ExtractionOptions.defaults())).containsExactly("fallback");
    }

    @Test
    @DisplayName("编号层级超出范围时按第0层处理，后续段落照常提取")
    void outOfRangeNumberingLevel() {
        Element numbering = DocxXml.element("w:numbering",
                "<w:abstractNum w:abstractNumId=\"0\">"
                        + "<w:lvl w:ilvl=\"0\"><w:start w:val=\"1\"/><w:numFmt w:val=\"decimal\"/></w:lvl>"
                        + "</w:abstractNum>"
                        + "<w:num w:numId=\"1\"><w:abstractNumId w:val=\"0\"/></w:num>");
        String body = p("<w:pPr><w:numPr><w:ilvl w:val=\"2147483647\"/><w:numId w:val=\"1\"/></w:numPr></w:pPr>"
                + r("deep")) + p(r("plain"));
        ExtractionContext context = new ExtractionContext(ExtractionOptions.defaults(), RelationshipLookup.EMPTY,
                NumberingDefinitions.parse(numbering, warnings), warnings);

        CollectedPart part = DocxTextExtractor.extract(DocxXml.document(body), context);

        List<Paragraph> cell = part.getTables().get(0).get(0).get(0);
        assertThat(cell).extracting(Paragraph::getText).containsExactly("1)\tdeep", "plain");
        assertThat(cell.get(0).getListPosition()).isEqualTo(new ListPosition("1", Arrays.asList(0)));
        assertThat(warnings.getMessages()).anyMatch(message -> message.contains("2147483647"));
    }

    // ---- 行内内容 ----

    @Test
    @DisplayName("换行、制表符、符号、公式、脚注引用")
    void inlineContent() {
        String body = p("<w:r><w:t>a</w:t><w:br/><w:t>b</w:t><w:tab/><w:t>c</w:t></w:r>")
                + p("<w:r><w:sym w:font=\"Wingdings\" w:char=\"F0FC\"/></w:r>")
                + p("<m:oMath><m:r><m:t>x^2</m:t></m:r></m:oMath>")
                + p(r("see") + "<w:r><w:footnoteReference w:id=\"2\"/></w:r>");

        assertThat(paragraphs(body, ExtractionOptions.defaults())).containsExactly(
                "a\nb\tc",
                "<span style=font-family:Wingdings>&#x00FC;</span>",
                "<latex>x^2</latex>",
                "see----footnote2----");
    }

    @Test
    @DisplayName("表单控件输出选中状态")
    void formFields() {
        String body = p("<w:r><w:fldChar w:fldCharType=\"begin\"><w:ffData><w:checkBox>"
                + "<w:default w:val=\"1\"/></w:checkBox></w:ffData></w:fldChar></w:r>"
                + "<w:r><w:instrText>FORMCHECKBOX</w:instrText></w:r>"
                + "<w:r><w:fldChar w:fldCharType=\"end\"/></w:r>" + r(" done"));

        assertThat(paragraphs(body, ExtractionOptions.defaults())).containsExactly("☒ done");
    }

    @Test
    @DisplayName("表单控件状态无法解析时输出失败标记并告警")
    void unresolvableFormFields() {
        String body = p("<w:r><w:fldChar w:fldCharType=\"begin\"><w:ffData><w:checkBox><w:sizeAuto/>"
                + "</w:checkBox></w:ffData></w:fldChar></w:r>")
                + p("<w:r><w:fldChar w:fldCharType=\"begin\"><w:ffData><w:ddList><w:result w:val=\"5\"/>"
                + "<w:listEntry w:val=\"only\"/></w:ddList></w:ffData></w:fldChar></w:r>");

        assertThat(paragraphs(body, ExtractionOptions.defaults()))
                .containsExactly(FormFieldText.CHECKBOX_FAILED, FormFieldText.DROPDOWN_FAILED);
        assertThat(warnings.getMessages()).hasSize(2);
    }

    @Test
    @DisplayName("html 模式下转义公式内容与链接地址")
    void htmlEscapesEquationAndHref() {
        Map<String, String> targets = new HashMap<>();
        targets.put("rId1", "https://example.com/?q=\"x\"&y=1");
        String body = p("<m:oMath><m:r><m:t>a&lt;b</m:t></m:r></m:oMath>")
                + p("<w:hyperlink r:id=\"rId1\">" + r("site") + "</w:hyperlink>");

        List<Object> escaped = NestedLists.listAtDepth(NestedLists.paragraphStrings(
                extract(DocxXml.document(body), html(), RelationshipLookup.of(targets)).getTables()), 4);
        List<Object> plain = NestedLists.listAtDepth(NestedLists.paragraphStrings(
                extract(DocxXml.document(body), ExtractionOptions.defaults(), RelationshipLookup.of(targets))
                        .getTables()), 4);

        assertThat(escaped).containsExactly(
                "<latex>a&lt;b</latex>",
                "<a href=\"https://example.com/?q=&quot;x&quot;&amp;y=1\">site</a>");
        assertThat(plain).containsExactly(
                "<latex>a<b</latex>",
                "<a href=\"https://example.com/?q=&quot;x&quot;&y=1\">site</a>");
    }

    @Test
    @DisplayName("超链接可解析时包成 a 标签，否则只保留文本")
    void hyperlinks() {
        Map<String, String> targets = new HashMap<>();
        targets.put("rId1", "https://example.com");
        String body = p(r("visit ") + "<w:hyperlink r:id=\"rId1\" w:anchor=\"top\">" + r("site") + "</w:hyperlink>")
                + p("<w:hyperlink r:id=\"rId9\">" + r("dangling") + "</w:hyperlink>");

        List<Object> result = NestedLists.listAtDepth(NestedLists.paragraphStrings(
                extract(DocxXml.document(body), ExtractionOptions.defaults(), RelationshipLookup.of(targets))
                        .getTables()), 4);

        assertThat(result).containsExactly("visit <a href=\"https://example.com#top\">site</a>", "dangling");
    }

    @Test
    @DisplayName("图片输出替代文本与关系目标占位符，关系缺失时省略")
    void images() {
        Map<String, String> targets = new HashMap<>();
        targets.put("rId5", "media/image1.png");
        String drawing = "<w:r><w:drawing><wp:inline><wp:docPr id=\"1\" name=\"Picture 1\" descr=\"a cat\"/>"
                + "<a:graphic><a:graphicData><a:blip r:embed=\"%s\"/></a:graphicData></a:graphic>"
                + "</wp:inline></w:drawing></w:r>";
        String body = p(String.format(drawing, "rId5")) + p(String.format(drawing, "rId404"));

        List<Object> result = NestedLists.listAtDepth(NestedLists.paragraphStrings(
                extract(DocxXml.document(body), ExtractionOptions.defaults(), RelationshipLookup.of(targets))
                        .getTables()), 4);

        assertThat(result).containsExactly(
                "----Image alt text---->a cat<----media/image1.png----",
                "----Image alt text---->a cat<");
    }

    // ---- html ----

    @Test
    @DisplayName("html 模式输出样式标记并转义文本，标记在段落内闭合")
    void htmlStyles() {
        String body = p(r("<w:b/>", "bold") + r(" a &lt; b"))
                + p(r("<w:b/><w:i/>", "both"));

        assertThat(paragraphs(body, html())).containsExactly(
                "<b>bold</b> a &lt; b",
                "<b><i>both</i></b>");
        assertThat(paragraphs(body, ExtractionOptions.defaults())).containsExactly("bold a < b", "both");
    }

    @Test
    @DisplayName("html 模式下 Heading 样式的段落包在 h 标记中")
    void headings() {
        String body = p("<w:pPr><w:pStyle w:val=\"Heading2\"/></w:pPr>" + r("<w:i/>", "Title"));

        assertThat(paragraphs(body, html())).containsExactly("<h2><i>Title</i></h2>");
        assertThat(paragraphs(body, ExtractionOptions.defaults())).containsExactly("Title");
    }

    @Test
    @DisplayName("paragraphStyles 选项把样式名作为第一个片段")
    void paragraphStyles() {
        ExtractionOptions options = ExtractionOptions.defaults();
        options.setParagraphStyles(true);
        String body = p("<w:pPr><w:pStyle w:val=\"Normal\"/></w:pPr>" + r("styled")) + p(r("bare"));
        CollectedPart part = extract(DocxXml.document(body), options);

        List<List<List<List<List<String>>>>> runs = NestedLists.runStrings(part.getTables());
        assertThat(runs.get(0).get(0).get(0)).containsExactly(List.of("Normal", "styled"), List.of("None", "bare"));
    }

    // ---- 编号 ----

    @Test
    @DisplayName("编号段落加ascii前缀并记录列表位置")
    void numberedParagraphs() {
        Element numbering = DocxXml.element("w:numbering",
                "<w:abstractNum w:abstractNumId=\"0\">"
                        + "<w:lvl w:ilvl=\"0\"><w:start w:val=\"1\"/><w:numFmt w:val=\"decimal\"/></w:lvl>"
                        + "<w:lvl w:ilvl=\"1\"><w:start w:val=\"1\"/><w:numFmt w:val=\"bullet\"/></w:lvl>"
                        + "</w:abstractNum>"
                        + "<w:num w:numId=\"3\"><w:abstractNumId w:val=\"0\"/></w:num>");
        String numPr = "<w:pPr><w:numPr><w:ilvl w:val=\"%d\"/><w:numId w:val=\"3\"/></w:numPr></w:pPr>";
        String body = p(String.format(numPr, 0) + r("one"))
                + p(String.format(numPr, 1) + r("sub"))
                + p(String.format(numPr, 0) + r("two"));
        ExtractionContext context = new ExtractionContext(ExtractionOptions.defaults(), RelationshipLookup.EMPTY,
                NumberingDefinitions.parse(numbering, warnings), warnings);

        CollectedPart part = DocxTextExtractor.extract(DocxXml.document(body), context);

        List<Paragraph> cell = part.getTables().get(0).get(0).get(0);
        assertThat(cell).extracting(Paragraph::getText).containsExactly("1)\tone", "\t--\tsub", "2)\ttwo");
        assertThat(cell.get(1).getListPosition()).isEqualTo(new ListPosition("3", Arrays.asList(0, 0)));
        assertThat(cell.get(2).getListPosition()).isEqualTo(new ListPosition("3", Arrays.asList(1)));
    }

    // ---- 脚注与批注 ----

    @Test
    @DisplayName("脚注正文前加编号，分隔符脚注不加")
    void footnotes() {
        Element footnotes = DocxXml.element("w:footnotes",
                "<w:footnote w:type=\"separator\" w:id=\"-1\"><w:p><w:r><w:separator/></w:r></w:p></w:footnote>"
                        + "<w:footnote w:id=\"1\">" + p(r("note text")) + "</w:footnote>");

        CollectedPart part = extract(footnotes, ExtractionOptions.defaults());

        assertThat(NestedLists.listAtDepth(NestedLists.paragraphStrings(part.getTables()), 4))
                .containsExactly("", "footnote1)\tnote text");
    }

    @Test
    @DisplayName("批注范围记录覆盖的片段")
    void commentRanges() {
        String body = p("<w:commentRangeStart w:id=\"0\"/>" + r("commented") + "<w:commentRangeEnd w:id=\"0\"/>"
                + r(" rest"));

        CollectedPart part = extract(DocxXml.document(body), ExtractionOptions.defaults());

        assertThat(part.getCommentRanges()).containsOnlyKeys("0");
        assertThat(part.getCommentReference("0")).isEqualTo("commented");
        assertThat(part.getCommentReference("7")).isNull();
    }
}
