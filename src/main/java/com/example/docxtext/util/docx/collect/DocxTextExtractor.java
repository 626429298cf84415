package com.example.docxtext.util.docx.collect;

import com.example.docxtext.util.docx.text.RunMerger;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Element;

/**
 * 内容部件（正文、页眉、页脚、脚注、尾注、批注）的文本提取入口
 *
 * 先合并相邻的同格式片段，再遍历整棵树，最后整理合并单元格。
 * 编号计数、样式栈等状态都属于这一次调用，不同部件可以并行提取。
 */
@Slf4j
public final class DocxTextExtractor {

    private DocxTextExtractor() {
    }

    /**
     * @param root    部件根元素（w:document、w:hdr、w:footnotes...），或其中任意子树
     * @param context 选项、关系表、编号定义、告警出口
     */
    public static CollectedPart extract(Element root, ExtractionContext context) {
        new RunMerger(context.getRelationships()).merge(root);
        TagRunner runner = new TagRunner(context);
        runner.walk(root);
        CollectedPart part = runner.finish();
        log.debug("部件提取完成: {}, 表格数: {}", root.getLocalName(), part.getTables().size());
        return part;
    }
}
