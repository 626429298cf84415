package com.example.docxtext.util.docx;

import com.example.docxtext.util.docx.model.ExtractionOptions;
import com.example.docxtext.util.docx.model.Link;
import com.example.docxtext.util.docx.model.NestedLists;
import com.example.docxtext.util.docx.model.Paragraph;
import com.example.docxtext.util.docx.namespace.ElementRole;
import com.example.docxtext.util.docx.namespace.NamespaceResolver;
import com.example.docxtext.util.docx.pkg.DocxPart;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 基于提取结果的常用操作：链接、标题、文本替换、表格判断
 */
@Slf4j
public final class DocxUtilities {

    private static final Pattern HEADING_STYLE = Pattern.compile("Heading\\d.*");

    private DocxUtilities() {
    }

    /**
     * 文档中所有超链接 (href, text)
     */
    public static List<Link> getLinks(DocxContent content) {
        List<Link> links = new ArrayList<>();
        for (String run : NestedLists.<String>iterAtDepth(content.getDocumentRuns(), 5)) {
            if (!run.contains("<a ")) {
                continue;
            }
            for (org.jsoup.nodes.Element anchor : Jsoup.parseBodyFragment(run).select("a[href]")) {
                links.add(new Link(anchor.attr("href"), anchor.text()));
            }
        }
        return links;
    }

    /**
     * 样式为 Heading1、Heading2... 的段落（片段字符串）
     */
    public static List<List<String>> getHeadings(DocxContent content) {
        List<List<String>> headings = new ArrayList<>();
        for (Paragraph paragraph : NestedLists.<Paragraph>iterAtDepth(content.getDocumentPars(), 4)) {
            if (HEADING_STYLE.matcher(paragraph.getStyle()).matches()) {
                headings.add(paragraph.getRunStrings());
            }
        }
        return headings;
    }

    /**
     * 该表格是否来自源文件中的 w:tbl（而不是正文段落、脚注等被归入的伪表格）
     */
    public static boolean isTable(List<List<List<Paragraph>>> table) {
        boolean any = false;
        for (Paragraph paragraph : NestedLists.<Paragraph>iterAtDepth(table, 3)) {
            if (paragraph.getSource() == null) {
                continue;
            }
            any = true;
            List<String> lineage = paragraph.getLineage();
            if (lineage.size() < 2 || !"tbl".equals(lineage.get(1))) {
                return false;
            }
        }
        return any;
    }

    /**
     * 把 root 下所有文本元素中的 old 替换为 replacement
     *
     * 替换文本中的换行转为 w:br。
     */
    public static void replaceRootText(Element root, String old, String replacement) {
        for (Element child : NamespaceResolver.children(root)) {
            if (!NamespaceResolver.is(child, ElementRole.TEXT)) {
                replaceRootText(child, old, replacement);
                continue;
            }
            String text = child.getTextContent();
            if (text == null || !text.contains(old)) {
                continue;
            }
            String[] lines = text.replace(old, replacement).split("\n", -1);
            Node parent = child.getParentNode();
            for (int i = 0; i < lines.length; i++) {
                if (i > 0) {
                    Element br = child.getOwnerDocument().createElementNS(child.getNamespaceURI(), qualified(child, "br"));
                    parent.insertBefore(br, child);
                }
                Element line = (Element) child.cloneNode(true);
                line.setTextContent(lines[i]);
                parent.insertBefore(line, child);
            }
            parent.removeChild(child);
        }
    }

    private static String qualified(Element sibling, String localName) {
        String prefix = sibling.getPrefix();
        return prefix == null ? localName : prefix + ":" + localName;
    }

    /**
     * 替换docx中的文本并另存
     *
     * 先经过一次提取，使被拆开的同格式片段合并，跨片段的词也能被替换。
     *
     * @param replacements 原文 -> 替换文本，按顺序执行
     */
    public static void replaceDocxText(File input, File output, Map<String, String> replacements, boolean html) throws IOException {
        ExtractionOptions options = ExtractionOptions.defaults();
        options.setHtml(html);
        try (DocxContent content = DocxContent.open(input, options)) {
            for (DocxPart part : content.getReader().contentParts()) {
                for (Map.Entry<String, String> replacement : replacements.entrySet()) {
                    replaceRootText(part.getRootElement(), replacement.getKey(), replacement.getValue());
                }
            }
            content.getReader().save(output);
        }
        log.info("文本替换完成: {} -> {}", input.getName(), output.getName());
    }
}
