package com.example.docxtext.util.docx.namespace;

import org.w3c.dom.Element;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * docx xml命名空间表
 *
 * 同一个前缀（w、r、m、a、wp）在 transitional 和 strict 两种方言下对应不同的URI，
 * 这里统一把URI折算回"逻辑前缀"，后续按 前缀:本地名 判断元素角色。
 *
 * 例如 strict 文件中的 {http://purl.oclc.org/ooxml/wordprocessingml/main}p
 * 和 transitional 文件中的 {http://schemas.openxmlformats.org/wordprocessingml/2006/main}p
 * 都会被看作 "w:p"。
 */
public final class DocxNamespace {

    public static final String W = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";
    public static final String W_STRICT = "http://purl.oclc.org/ooxml/wordprocessingml/main";

    public static final String R = "http://schemas.openxmlformats.org/officeDocument/2006/relationships";
    public static final String R_STRICT = "http://purl.oclc.org/ooxml/officeDocument/relationships";

    public static final String M = "http://schemas.openxmlformats.org/officeDocument/2006/math";
    public static final String M_STRICT = "http://purl.oclc.org/ooxml/officeDocument/math";

    public static final String A = "http://schemas.openxmlformats.org/drawingml/2006/main";
    public static final String A_STRICT = "http://purl.oclc.org/ooxml/drawingml/main";

    public static final String WP = "http://schemas.openxmlformats.org/drawingml/2006/wordprocessingDrawing";
    public static final String WP_STRICT = "http://purl.oclc.org/ooxml/drawingml/wordprocessingDrawing";

    public static final String PIC = "http://schemas.openxmlformats.org/drawingml/2006/picture";
    public static final String PIC_STRICT = "http://purl.oclc.org/ooxml/drawingml/picture";

    public static final String V = "urn:schemas-microsoft-com:vml";
    public static final String O = "urn:schemas-microsoft-com:office:office";
    public static final String MC = "http://schemas.openxmlformats.org/markup-compatibility/2006";

    /**
     * URI -> 逻辑前缀
     */
    private static final Map<String, String> URI_TO_PREFIX = createUriMap();

    /**
     * 逻辑前缀 -> transitional URI（用于构造测试xml、输出等）
     */
    private static final Map<String, String> PREFIX_TO_URI = createPrefixMap();

    private static Map<String, String> createUriMap() {
        Map<String, String> map = new HashMap<>();
        // 两种方言
        map.put(W, "w");
        map.put(W_STRICT, "w");
        map.put(R, "r");
        map.put(R_STRICT, "r");
        map.put(M, "m");
        map.put(M_STRICT, "m");
        map.put(A, "a");
        map.put(A_STRICT, "a");
        map.put(WP, "wp");
        map.put(WP_STRICT, "wp");
        map.put(PIC, "pic");
        map.put(PIC_STRICT, "pic");

        // 旧版VML与兼容性标记
        map.put(V, "v");
        map.put(O, "o");
        map.put(MC, "mc");
        map.put("urn:schemas-microsoft-com:office:word", "w10");

        // Office 扩展命名空间（内容照常遍历，只是没有专门的处理逻辑）
        map.put("http://schemas.microsoft.com/office/word/2010/wordml", "w14");
        map.put("http://schemas.microsoft.com/office/word/2012/wordml", "w15");
        map.put("http://schemas.microsoft.com/office/word/2015/wordml/symex", "w16se");
        map.put("http://schemas.microsoft.com/office/word/2016/wordml/cid", "w16cid");
        map.put("http://schemas.microsoft.com/office/word/2018/wordml", "w16");
        map.put("http://schemas.microsoft.com/office/word/2018/wordml/cex", "w16cex");
        map.put("http://schemas.microsoft.com/office/word/2020/wordml/sdtdatahash", "w16sdtdh");
        map.put("http://schemas.microsoft.com/office/word/2006/wordml", "wne");
        map.put("http://schemas.microsoft.com/office/word/2010/wordprocessingShape", "wps");
        map.put("http://schemas.microsoft.com/office/word/2010/wordprocessingGroup", "wpg");
        map.put("http://schemas.microsoft.com/office/word/2010/wordprocessingCanvas", "wpc");
        map.put("http://schemas.microsoft.com/office/word/2010/wordprocessingInk", "wpi");
        map.put("http://schemas.microsoft.com/office/word/2010/wordprocessingDrawing", "wp14");
        map.put("http://schemas.microsoft.com/office/drawing/2010/main", "a14");
        map.put("http://schemas.microsoft.com/office/drawing/2014/main", "a16");
        map.put("http://schemas.openxmlformats.org/drawingml/2006/chart", "c");
        map.put("http://schemas.openxmlformats.org/drawingml/2006/diagram", "dgm");
        return Collections.unmodifiableMap(map);
    }

    private static Map<String, String> createPrefixMap() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("w", W);
        map.put("r", R);
        map.put("m", M);
        map.put("a", A);
        map.put("wp", WP);
        map.put("pic", PIC);
        map.put("v", V);
        map.put("o", O);
        map.put("mc", MC);
        return Collections.unmodifiableMap(map);
    }

    private DocxNamespace() {
    }

    /**
     * 把URI折算为逻辑前缀
     *
     * @param namespaceUri 元素或属性的命名空间
     * @return 逻辑前缀，未登记的命名空间返回null
     */
    public static String prefixOf(String namespaceUri) {
        if (namespaceUri == null) {
            return null;
        }
        return URI_TO_PREFIX.get(namespaceUri);
    }

    /**
     * transitional 方言下的URI
     */
    public static String uriOf(String prefix) {
        String uri = PREFIX_TO_URI.get(prefix);
        if (uri == null) {
            throw new IllegalArgumentException("未登记的命名空间前缀: " + prefix);
        }
        return uri;
    }

    /**
     * 元素的 前缀:本地名 形式（如 "w:p"），命名空间未登记时返回null
     */
    public static String prefixedName(Element element) {
        String prefix = prefixOf(element.getNamespaceURI());
        if (prefix == null) {
            return null;
        }
        return prefix + ":" + localName(element);
    }

    public static String localName(Element element) {
        String local = element.getLocalName();
        return local != null ? local : element.getTagName();
    }

    /**
     * 读取带前缀的属性，方言跟随元素本身。
     *
     * strict 文件中的 w:val 属性与元素同属 purl.oclc.org 命名空间，
     * 所以先用元素自己的URI查，再回退到两种方言的URI。
     *
     * @param element 元素
     * @param prefixedAttribute 如 "w:val"、"r:id"
     * @return 属性值，不存在时返回null（空字符串视为存在）
     */
    public static String attribute(Element element, String prefixedAttribute) {
        int colon = prefixedAttribute.indexOf(':');
        if (colon < 0) {
            return element.hasAttribute(prefixedAttribute) ? element.getAttribute(prefixedAttribute) : null;
        }
        String prefix = prefixedAttribute.substring(0, colon);
        String local = prefixedAttribute.substring(colon + 1);

        String own = element.getNamespaceURI();
        if (own != null && prefix.equals(prefixOf(own)) && element.hasAttributeNS(own, local)) {
            return element.getAttributeNS(own, local);
        }
        for (Map.Entry<String, String> entry : URI_TO_PREFIX.entrySet()) {
            if (entry.getValue().equals(prefix) && element.hasAttributeNS(entry.getKey(), local)) {
                return element.getAttributeNS(entry.getKey(), local);
            }
        }
        return null;
    }
}
