package com.example.docxtext.util.docx;

import org.apache.poi.ooxml.util.DocumentHelper;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

/**
 * 测试用的 WordprocessingML 片段构造
 */
public final class DocxXml {

    public static final String NAMESPACES =
            " xmlns:w=\"http://schemas.openxmlformats.org/wordprocessingml/2006/main\""
                    + " xmlns:r=\"http://schemas.openxmlformats.org/officeDocument/2006/relationships\""
                    + " xmlns:m=\"http://schemas.openxmlformats.org/officeDocument/2006/math\""
                    + " xmlns:a=\"http://schemas.openxmlformats.org/drawingml/2006/main\""
                    + " xmlns:wp=\"http://schemas.openxmlformats.org/drawingml/2006/wordprocessingDrawing\""
                    + " xmlns:v=\"urn:schemas-microsoft-com:vml\""
                    + " xmlns:mc=\"http://schemas.openxmlformats.org/markup-compatibility/2006\""
                    + " xmlns:x=\"urn:example:unknown\"";

    public static final String STRICT_NAMESPACES =
            " xmlns:w=\"http://purl.oclc.org/ooxml/wordprocessingml/main\""
                    + " xmlns:r=\"http://purl.oclc.org/ooxml/officeDocument/relationships\"";

    private DocxXml() {
    }

    /**
     * 把 body 内容包进 w:document/w:body，返回 w:document 元素
     */
    public static Element document(String bodyXml) {
        return parse("<w:document" + NAMESPACES + "><w:body>" + bodyXml + "</w:body></w:document>");
    }

    /**
     * 任意根元素，命名空间声明自动补上
     */
    public static Element element(String rootName, String innerXml) {
        return parse("<" + rootName + NAMESPACES + ">" + innerXml + "</" + rootName + ">");
    }

    public static Element parse(String xml) {
        try {
            Document document = DocumentHelper.readDocument(
                    new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
            return document.getDocumentElement();
        } catch (Exception e) {
            throw new IllegalArgumentException("测试xml无法解析: " + e.getMessage(), e);
        }
    }

    public static String p(String innerXml) {
        return "<w:p>" + innerXml + "</w:p>";
    }

    public static String r(String text) {
        return "<w:r><w:t xml:space=\"preserve\">" + text + "</w:t></w:r>";
    }

    public static String r(String rPr, String text) {
        return "<w:r><w:rPr>" + rPr + "</w:rPr><w:t xml:space=\"preserve\">" + text + "</w:t></w:r>";
    }

    public static String tc(String innerXml) {
        return "<w:tc>" + innerXml + "</w:tc>";
    }

    public static String tr(String... cells) {
        return "<w:tr>" + String.join("", cells) + "</w:tr>";
    }

    public static String tbl(String... rows) {
        return "<w:tbl>" + String.join("", rows) + "</w:tbl>";
    }
}
