package com.example.docxtext.util.docx.pkg;

import com.example.docxtext.exception.DocxExtractionException;
import com.example.docxtext.util.docx.WarningSink;
import com.example.docxtext.util.docx.namespace.NamespaceResolver;
import com.example.docxtext.util.docx.text.NumberingDefinitions;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ooxml.util.DocumentHelper;
import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.openxml4j.opc.OPCPackage;
import org.apache.poi.openxml4j.opc.PackagePart;
import org.apache.poi.openxml4j.opc.PackageProperties;
import org.apache.poi.openxml4j.opc.PackageRelationship;
import org.apache.poi.openxml4j.opc.TargetMode;
import org.apache.poi.util.XMLHelper;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.text.SimpleDateFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Date;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TimeZone;

/**
 * docx 包读取
 *
 * 用 POI 的 OPCPackage 打开压缩包，按关系类型找到正文及页眉、页脚、脚注、尾注、批注、编号部件，
 * 各部件解析为 W3C DOM 供提取使用。包在内存中打开，修改DOM后可以另存。
 */
@Slf4j
public class DocxReader implements Closeable {

    /**
     * 提取顺序
     */
    public static final List<PartType> CONTENT_TYPES = List.of(
            PartType.HEADER, PartType.OFFICE_DOCUMENT, PartType.FOOTER, PartType.FOOTNOTES, PartType.ENDNOTES);

    private final OPCPackage pkg;
    private final WarningSink warnings;
    private final Map<PartType, List<DocxPart>> parts = new EnumMap<>(PartType.class);
    private NumberingDefinitions numbering;

    private DocxReader(OPCPackage pkg, WarningSink warnings) {
        this.pkg = pkg;
        this.warnings = warnings;
    }

    public static DocxReader open(File file, WarningSink warnings) {
        try (InputStream in = Files.newInputStream(file.toPath())) {
            return open(in, warnings);
        } catch (IOException e) {
            throw new DocxExtractionException("读取docx文件失败: " + file, e);
        }
    }

    public static DocxReader open(byte[] bytes, WarningSink warnings) {
        return open(new ByteArrayInputStream(bytes), warnings);
    }

    /**
     * 从输入流打开（整个包读入内存，不关闭传入的流）
     */
    public static DocxReader open(InputStream in, WarningSink warnings) {
        OPCPackage pkg;
        try {
            pkg = OPCPackage.open(in);
        } catch (InvalidFormatException | IOException | RuntimeException e) {
            throw new DocxExtractionException("无法打开docx包: " + e.getMessage(), e);
        }
        DocxReader reader = new DocxReader(pkg, warnings);
        try {
            reader.load();
        } catch (RuntimeException e) {
            pkg.revert();
            throw e;
        }
        return reader;
    }

    private void load() {
        PackagePart main = findMainPart();
        List<PackagePart> headers = new ArrayList<>();
        List<PackagePart> footers = new ArrayList<>();
        Map<PartType, PackagePart> singles = new EnumMap<>(PartType.class);

        for (PackageRelationship rel : relationshipsOf(main)) {
            if (rel.getTargetMode() == TargetMode.EXTERNAL) {
                continue;
            }
            for (PartType type : PartType.values()) {
                if (type == PartType.OFFICE_DOCUMENT || type == PartType.IMAGE || !type.matches(rel.getRelationshipType())) {
                    continue;
                }
                PackagePart target = relatedPart(main, rel);
                if (target == null) {
                    continue;
                }
                if (type == PartType.HEADER) {
                    headers.add(target);
                } else if (type == PartType.FOOTER) {
                    footers.add(target);
                } else {
                    singles.putIfAbsent(type, target);
                }
            }
        }
        // header1、header2... 按编号排序，而不是按关系id
        Comparator<PackagePart> byName = Comparator
                .comparingInt((PackagePart p) -> p.getPartName().getName().length())
                .thenComparing(p -> p.getPartName().getName());
        headers.sort(byName);
        footers.sort(byName);

        addPart(PartType.OFFICE_DOCUMENT, main);
        headers.forEach(p -> addPart(PartType.HEADER, p));
        footers.forEach(p -> addPart(PartType.FOOTER, p));
        for (PartType type : List.of(PartType.FOOTNOTES, PartType.ENDNOTES, PartType.COMMENTS, PartType.NUMBERING)) {
            if (singles.containsKey(type)) {
                addPart(type, singles.get(type));
            }
        }

        List<DocxPart> numberingParts = parts.getOrDefault(PartType.NUMBERING, Collections.emptyList());
        numbering = numberingParts.isEmpty()
                ? NumberingDefinitions.empty()
                : NumberingDefinitions.parse(numberingParts.get(0).getRootElement(), warnings);
        log.debug("docx部件: {}", parts.values());
    }

    private PackagePart findMainPart() {
        for (PackageRelationship rel : pkg.getRelationships()) {
            if (PartType.OFFICE_DOCUMENT.matches(rel.getRelationshipType())) {
                PackagePart part = pkg.getPart(rel);
                if (part != null) {
                    return part;
                }
            }
        }
        throw new DocxExtractionException("docx包中找不到正文部件（officeDocument）");
    }

    private void addPart(PartType type, PackagePart part) {
        Document document;
        try (InputStream in = part.getInputStream()) {
            document = DocumentHelper.readDocument(in);
        } catch (IOException | SAXException e) {
            if (type == PartType.OFFICE_DOCUMENT) {
                throw new DocxExtractionException("正文xml解析失败: " + part.getPartName(), e);
            }
            warnings.warn("部件xml解析失败，已跳过: " + part.getPartName() + " (" + e.getMessage() + ")");
            return;
        }
        parts.computeIfAbsent(type, k -> new ArrayList<>())
                .add(new DocxPart(type, part, document, relationshipLookup(part)));
    }

    private Iterable<PackageRelationship> relationshipsOf(PackagePart part) {
        try {
            return part.getRelationships();
        } catch (InvalidFormatException e) {
            warnings.warn("部件关系读取失败: " + part.getPartName() + " (" + e.getMessage() + ")");
            return Collections.emptyList();
        }
    }

    private PackagePart relatedPart(PackagePart source, PackageRelationship rel) {
        try {
            return source.getRelatedPart(rel);
        } catch (InvalidFormatException | IllegalArgumentException e) {
            warnings.warn("关系目标不存在: " + rel.getId() + " -> " + rel.getTargetURI());
            return null;
        }
    }

    /**
     * 关系id -> 关系文件中的 Target 原文（内部部件为相对路径，外部链接为完整地址）
     */
    private RelationshipLookup relationshipLookup(PackagePart part) {
        Map<String, String> targets = new HashMap<>();
        for (PackageRelationship rel : relationshipsOf(part)) {
            targets.put(rel.getId(), rel.getTargetURI().toString());
        }
        return RelationshipLookup.of(targets);
    }

    // ---- 查询 ----

    public List<DocxPart> partsOf(PartType type) {
        return Collections.unmodifiableList(parts.getOrDefault(type, Collections.emptyList()));
    }

    public Optional<DocxPart> partOf(PartType type) {
        List<DocxPart> list = parts.getOrDefault(type, Collections.emptyList());
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    /**
     * 可提取文本的部件：页眉、正文、页脚、脚注、尾注
     */
    public List<DocxPart> contentParts() {
        List<DocxPart> content = new ArrayList<>();
        for (PartType type : CONTENT_TYPES) {
            content.addAll(partsOf(type));
        }
        return content;
    }

    public NumberingDefinitions getNumbering() {
        return numbering;
    }

    /**
     * 批注部件中的 w:comment 元素
     */
    public List<Element> getCommentElements() {
        Optional<DocxPart> comments = partOf(PartType.COMMENTS);
        if (!comments.isPresent()) {
            return Collections.emptyList();
        }
        return NamespaceResolver.childrenNamed(comments.get().getRootElement(), "w:comment");
    }

    /**
     * 核心属性（docProps/core.xml），没有的项不出现
     */
    public Map<String, String> getCoreProperties() {
        Map<String, String> properties = new LinkedHashMap<>();
        PackageProperties core;
        try {
            core = pkg.getPackageProperties();
        } catch (InvalidFormatException e) {
            warnings.warn("找不到核心属性（docProps/core.xml），返回空属性: " + e.getMessage());
            return properties;
        }
        putIfPresent(properties, "title", core.getTitleProperty());
        putIfPresent(properties, "subject", core.getSubjectProperty());
        putIfPresent(properties, "creator", core.getCreatorProperty());
        putIfPresent(properties, "keywords", core.getKeywordsProperty());
        putIfPresent(properties, "description", core.getDescriptionProperty());
        putIfPresent(properties, "lastModifiedBy", core.getLastModifiedByProperty());
        putIfPresent(properties, "revision", core.getRevisionProperty());
        putIfPresent(properties, "category", core.getCategoryProperty());
        putIfPresent(properties, "contentStatus", core.getContentStatusProperty());
        putIfPresent(properties, "created", core.getCreatedProperty().map(DocxReader::formatDate));
        putIfPresent(properties, "modified", core.getModifiedProperty().map(DocxReader::formatDate));
        putIfPresent(properties, "lastPrinted", core.getLastPrintedProperty().map(DocxReader::formatDate));
        return properties;
    }

    private static void putIfPresent(Map<String, String> properties, String key, Optional<String> value) {
        value.filter(v -> !v.isEmpty()).ifPresent(v -> properties.put(key, v));
    }

    private static String formatDate(Date date) {
        SimpleDateFormat format = new SimpleDateFormat("yyyy-MM-dd'T'HH:mm:ss'Z'");
        format.setTimeZone(TimeZone.getTimeZone("UTC"));
        return format.format(date);
    }

    /**
     * 所有部件引用的图片：文件名 -> 字节
     */
    public Map<String, byte[]> getImages() {
        Map<String, byte[]> images = new LinkedHashMap<>();
        for (List<DocxPart> list : parts.values()) {
            for (DocxPart part : list) {
                for (PackageRelationship rel : relationshipsOf(part.getPackagePart())) {
                    if (rel.getTargetMode() == TargetMode.EXTERNAL || !PartType.IMAGE.matches(rel.getRelationshipType())) {
                        continue;
                    }
                    String name = new File(rel.getTargetURI().getPath()).getName();
                    if (images.containsKey(name)) {
                        continue;
                    }
                    PackagePart image = relatedPart(part.getPackagePart(), rel);
                    if (image == null) {
                        continue;
                    }
                    try (InputStream in = image.getInputStream()) {
                        images.put(name, in.readAllBytes());
                    } catch (IOException e) {
                        warnings.warn("图片读取失败: " + name + " (" + e.getMessage() + ")");
                    }
                }
            }
        }
        return images;
    }

    /**
     * 把各部件当前的DOM（可能已被修改）写回并另存为新文件
     */
    public void save(File output) throws IOException {
        for (List<DocxPart> list : parts.values()) {
            for (DocxPart part : list) {
                writeBack(part);
            }
        }
        pkg.save(output);
        log.info("docx已保存: {}", output);
    }

    private void writeBack(DocxPart part) throws IOException {
        try (OutputStream out = part.getPackagePart().getOutputStream()) {
            Transformer transformer = XMLHelper.newTransformer();
            transformer.transform(new DOMSource(part.getDocument()), new StreamResult(out));
        } catch (TransformerException e) {
            throw new IOException("部件写回失败: " + part.getName(), e);
        }
    }

    /**
     * 丢弃包（不写回源文件）
     */
    @Override
    public void close() {
        pkg.revert();
    }
}
