package com.example.docxtext.util.docx;

import com.example.docxtext.exception.DocxExtractionException;
import com.example.docxtext.util.docx.collect.CollectedPart;
import com.example.docxtext.util.docx.collect.DocxTextExtractor;
import com.example.docxtext.util.docx.collect.ExtractionContext;
import com.example.docxtext.util.docx.model.Comment;
import com.example.docxtext.util.docx.model.ExtractionOptions;
import com.example.docxtext.util.docx.model.NestedLists;
import com.example.docxtext.util.docx.model.Paragraph;
import com.example.docxtext.util.docx.namespace.DocxNamespace;
import com.example.docxtext.util.docx.pkg.DocxPart;
import com.example.docxtext.util.docx.pkg.DocxReader;
import com.example.docxtext.util.docx.pkg.PartType;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Element;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * docx 文本提取结果
 *
 * 打开时即提取页眉、正文、页脚、脚注、尾注，每个部件独立遍历（编号计数互不影响）。
 * 各部件的输出都是 表格-行-单元格-段落 四层结构：
 * <ul>
 *     <li>getXxxPars()：段落对象</li>
 *     <li>getXxxRuns()：段落拆成片段字符串（5层）</li>
 *     <li>getXxx()：段落字符串（4层）</li>
 * </ul>
 * getDocument() 按 页眉、正文、页脚、脚注、尾注 的顺序拼接。
 */
@Slf4j
public class DocxContent implements Closeable {

    private final DocxReader reader;
    private final ExtractionOptions options;
    private final CollectingWarningSink warnings;
    private final Map<PartType, List<CollectedPart>> collected = new EnumMap<>(PartType.class);

    private DocxContent(DocxReader reader, ExtractionOptions options, CollectingWarningSink warnings) {
        this.reader = reader;
        this.options = options;
        this.warnings = warnings;
    }

    public static DocxContent open(File file, ExtractionOptions options) {
        log.info("开始提取docx: {}", file.getName());
        CollectingWarningSink warnings = new CollectingWarningSink();
        return create(DocxReader.open(file, warnings), options, warnings);
    }

    public static DocxContent open(InputStream in, ExtractionOptions options) {
        CollectingWarningSink warnings = new CollectingWarningSink();
        return create(DocxReader.open(in, warnings), options, warnings);
    }

    public static DocxContent open(byte[] bytes, ExtractionOptions options) {
        CollectingWarningSink warnings = new CollectingWarningSink();
        return create(DocxReader.open(bytes, warnings), options, warnings);
    }

    private static DocxContent create(DocxReader reader, ExtractionOptions options, CollectingWarningSink warnings) {
        DocxContent content = new DocxContent(reader, options == null ? ExtractionOptions.defaults() : options, warnings);
        try {
            content.extractAll();
            if (content.options.getImageFolder() != null) {
                content.saveImages(content.options.getImageFolder());
            }
        } catch (IOException e) {
            reader.close();
            throw new DocxExtractionException("图片写出失败: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            reader.close();
            throw e;
        }
        return content;
    }

    private void extractAll() {
        for (DocxPart part : reader.contentParts()) {
            ExtractionContext context = contextFor(part);
            CollectedPart result = DocxTextExtractor.extract(part.getRootElement(), context);
            collected.computeIfAbsent(part.getType(), k -> new ArrayList<>()).add(result);
        }
        log.info("docx提取完成，部件数: {}，告警数: {}", reader.contentParts().size(), warnings.getMessages().size());
    }

    private ExtractionContext contextFor(DocxPart part) {
        return new ExtractionContext(options, part.getRelationships(), reader.getNumbering(), warnings);
    }

    private List<List<List<List<Paragraph>>>> parsOf(PartType type) {
        List<List<List<List<Paragraph>>>> tables = new ArrayList<>();
        for (CollectedPart part : collected.getOrDefault(type, Collections.emptyList())) {
            tables.addAll(part.getTables());
        }
        return tables;
    }

    // ---- 段落对象 ----

    public List<List<List<List<Paragraph>>>> getHeaderPars() { return parsOf(PartType.HEADER); }

    public List<List<List<List<Paragraph>>>> getBodyPars() { return parsOf(PartType.OFFICE_DOCUMENT); }

    public List<List<List<List<Paragraph>>>> getFooterPars() { return parsOf(PartType.FOOTER); }

    public List<List<List<List<Paragraph>>>> getFootnotesPars() { return parsOf(PartType.FOOTNOTES); }

    public List<List<List<List<Paragraph>>>> getEndnotesPars() { return parsOf(PartType.ENDNOTES); }

    public List<List<List<List<Paragraph>>>> getDocumentPars() {
        List<List<List<List<Paragraph>>>> tables = new ArrayList<>();
        for (PartType type : DocxReader.CONTENT_TYPES) {
            tables.addAll(parsOf(type));
        }
        return tables;
    }

    // ---- 片段字符串 ----

    public List<List<List<List<List<String>>>>> getHeaderRuns() { return NestedLists.runStrings(getHeaderPars()); }

    public List<List<List<List<List<String>>>>> getBodyRuns() { return NestedLists.runStrings(getBodyPars()); }

    public List<List<List<List<List<String>>>>> getFooterRuns() { return NestedLists.runStrings(getFooterPars()); }

    public List<List<List<List<List<String>>>>> getFootnotesRuns() { return NestedLists.runStrings(getFootnotesPars()); }

    public List<List<List<List<List<String>>>>> getEndnotesRuns() { return NestedLists.runStrings(getEndnotesPars()); }

    public List<List<List<List<List<String>>>>> getDocumentRuns() { return NestedLists.runStrings(getDocumentPars()); }

    // ---- 段落字符串 ----

    public List<List<List<List<String>>>> getHeader() { return NestedLists.paragraphStrings(getHeaderPars()); }

    public List<List<List<List<String>>>> getBody() { return NestedLists.paragraphStrings(getBodyPars()); }

    public List<List<List<List<String>>>> getFooter() { return NestedLists.paragraphStrings(getFooterPars()); }

    public List<List<List<List<String>>>> getFootnotes() { return NestedLists.paragraphStrings(getFootnotesPars()); }

    public List<List<List<List<String>>>> getEndnotes() { return NestedLists.paragraphStrings(getEndnotesPars()); }

    public List<List<List<List<String>>>> getDocument() { return NestedLists.paragraphStrings(getDocumentPars()); }

    /**
     * 全部段落，空行分隔
     */
    public String getText() {
        return NestedLists.getText(getDocument());
    }

    public String getHtmlMap() {
        return NestedLists.getHtmlMap(getDocument());
    }

    /**
     * 批注列表：(被批注的正文, 作者, 日期, 批注内容)
     *
     * 正文中的批注范围数与批注部件中的批注数不一致时告警并返回空列表。
     */
    public List<Comment> getComments() {
        List<CollectedPart> bodyParts = collected.getOrDefault(PartType.OFFICE_DOCUMENT, Collections.emptyList());
        if (bodyParts.isEmpty()) {
            return Collections.emptyList();
        }
        CollectedPart body = bodyParts.get(0);
        List<Element> elements = reader.getCommentElements();
        if (body.getCommentRanges().size() != elements.size()) {
            warnings.warn("批注范围数(" + body.getCommentRanges().size() + ")与批注数(" + elements.size()
                    + ")不一致，无法提取批注");
            return Collections.emptyList();
        }
        Optional<DocxPart> commentsPart = reader.partOf(PartType.COMMENTS);
        if (elements.isEmpty() || !commentsPart.isPresent()) {
            return Collections.emptyList();
        }

        ExtractionContext context = contextFor(commentsPart.get());
        List<Comment> comments = new ArrayList<>(elements.size());
        for (Element element : elements) {
            String id = DocxNamespace.attribute(element, "w:id");
            String author = DocxNamespace.attribute(element, "w:author");
            String date = DocxNamespace.attribute(element, "w:date");
            CollectedPart text = DocxTextExtractor.extract(element, context);
            String reference = body.getCommentReference(id);
            comments.add(new Comment(reference == null ? "" : reference, author, date,
                    NestedLists.getText(NestedLists.paragraphStrings(text.getTables()))));
        }
        return comments;
    }

    public Map<String, String> getCoreProperties() {
        return reader.getCoreProperties();
    }

    /**
     * 图片：文件名 -> 字节
     */
    public Map<String, byte[]> getImages() {
        return reader.getImages();
    }

    /**
     * 把图片写入目录（不存在时创建）
     */
    public Map<String, byte[]> saveImages(String imageFolder) throws IOException {
        Map<String, byte[]> images = getImages();
        Path folder = Paths.get(imageFolder);
        Files.createDirectories(folder);
        for (Map.Entry<String, byte[]> image : images.entrySet()) {
            Files.write(folder.resolve(image.getKey()), image.getValue());
        }
        log.info("图片已写出: {} 张 -> {}", images.size(), folder);
        return images;
    }

    public List<String> getWarnings() {
        return warnings.getMessages();
    }

    public ExtractionOptions getOptions() {
        return options;
    }

    /**
     * 底层包读取器，可用于修改DOM后另存
     */
    public DocxReader getReader() {
        return reader;
    }

    @Override
    public void close() {
        reader.close();
    }
}
