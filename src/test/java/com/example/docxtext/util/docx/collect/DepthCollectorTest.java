package com.example.docxtext.util.docx.collect;

import com.example.docxtext.util.docx.CollectingWarningSink;
import com.example.docxtext.util.docx.DocxXml;
import com.example.docxtext.util.docx.model.ListPosition;
import com.example.docxtext.util.docx.model.NestedLists;
import com.example.docxtext.util.docx.model.Paragraph;
import com.example.docxtext.util.docx.model.RunContent;
import com.example.docxtext.util.docx.text.RunFormatting;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("深度收集器")
class DepthCollectorTest {

    private final CollectingWarningSink warnings = new CollectingWarningSink();

    private static ParagraphDraft draft() {
        return new ParagraphDraft(null, "", null, List.of(), ListPosition.NONE);
    }

    @Test
    @DisplayName("光标只能在 1..4 之间移动")
    void caretBounds() {
        DepthCollector collector = new DepthCollector(false, warnings);

        assertThatThrownBy(() -> collector.setCaret(5, null)).isInstanceOf(IllegalStateException.class);
        DepthCollector other = new DepthCollector(false, warnings);
        assertThatThrownBy(() -> other.setCaret(0, null)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("null 深度不移动光标")
    void nullDepthKeepsCaret() {
        DepthCollector collector = new DepthCollector(false, warnings);
        collector.setCaret(3, null);

        collector.setCaret(null, null);

        assertThat(collector.getCaretDepth()).isEqualTo(3);
    }

    @Test
    @DisplayName("段落外的文本在结束时收进一个段落")
    void orphanRunsBecomeParagraph() {
        DepthCollector collector = new DepthCollector(false, warnings);
        collector.commenceRun(RunFormatting.EMPTY);
        collector.addTextIntoOpenRun("loose");
        collector.concludeRun();

        collector.finish();

        List<Object> leaves = NestedLists.listAtDepth(collector.getRawTree(), 4);
        assertThat(leaves).hasSize(1);
        assertThat(((Paragraph) leaves.get(0)).getText()).isEqualTo("loose");
    }

    @Test
    @DisplayName("孤立片段并入随后打开的段落")
    void orphanRunsJoinNextParagraph() {
        DepthCollector collector = new DepthCollector(false, warnings);
        collector.addTextIntoOpenRun("label ");
        collector.commenceParagraph(draft());
        collector.addTextIntoOpenRun("body");
        collector.concludeParagraph();

        collector.finish();

        assertThat(NestedLists.paragraphStrings(MergedCellNormalizer.normalize(
                collector.getRawTree(), collector.getCellMerges(), true)))
                .isEqualTo(List.of(List.of(List.of(List.of("label body")))));
    }

    @Test
    @DisplayName("批注终点没有起点时告警")
    void danglingCommentEnd() {
        DepthCollector collector = new DepthCollector(false, warnings);

        collector.endCommentRange("3");

        assertThat(warnings.getMessages()).hasSize(1);
        assertThat(collector.getCommentRanges()).containsKey("3");
    }

    @Test
    @DisplayName("插入的独立片段之后恢复原格式")
    void insertedRunRestoresFormatting() {
        DepthCollector collector = new DepthCollector(true, warnings);
        collector.commenceParagraph(draft());
        RunFormatting bold = RunFormatting.of(DocxXml.element("w:r",
                "<w:rPr><w:b/></w:rPr>"));
        collector.commenceRun(bold);
        collector.addTextIntoOpenRun("a");
        collector.insertTextAsNewRun(RunContent.LINK, "<a href=\"x\">x</a>");
        collector.addTextIntoOpenRun("b");
        collector.concludeParagraph();

        Paragraph paragraph = (Paragraph) NestedLists.listAtDepth(collector.getRawTree(), 4).get(0);
        assertThat(paragraph.getText()).isEqualTo("<b>a</b><a href=\"x\">x</a><b>b</b>");
    }
}
