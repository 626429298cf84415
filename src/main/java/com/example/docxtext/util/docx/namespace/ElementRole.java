package com.example.docxtext.util.docx.namespace;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * 提取过程关心的元素角色
 *
 * GENERIC 表示命名空间已登记、但没有专门处理逻辑的元素（sdt、smartTag、ins 等），
 * 照常向下遍历；UNKNOWN 表示无法识别的元素（没有命名空间或外来命名空间），
 * 整棵子树跳过并告警。
 */
public enum ElementRole {

    DOCUMENT("w:document"),
    BODY("w:body"),
    PARAGRAPH("w:p"),
    PARAGRAPH_PROPERTIES("w:pPr"),
    RUN("w:r"),
    RUN_PROPERTIES("w:rPr"),
    TEXT("w:t"),
    TEXT_MATH("m:t"),
    TABLE("w:tbl"),
    TABLE_ROW("w:tr"),
    TABLE_CELL("w:tc"),
    TABLE_CELL_PROPERTIES("w:tcPr"),
    HYPERLINK("w:hyperlink"),
    BOOKMARK_START("w:bookmarkStart"),
    NUMBERING_PROPERTIES("w:numPr"),
    BREAK("w:br"),
    CARRIAGE_RETURN("w:cr"),
    TAB("w:tab"),
    SYMBOL("w:sym"),
    FOOTNOTE("w:footnote"),
    ENDNOTE("w:endnote"),
    FOOTNOTE_REFERENCE("w:footnoteReference"),
    ENDNOTE_REFERENCE("w:endnoteReference"),
    FORM_CHECKBOX("w:checkBox"),
    FORM_DROPDOWN("w:ddList"),
    FIELD_CHAR("w:fldChar"),
    FIELD_INSTRUCTION("w:instrText"),
    IMAGE("a:blip"),
    IMAGE_ALT("wp:docPr"),
    IMAGE_DATA("v:imagedata"),
    DRAWING("w:drawing"),
    PICTURE("w:pict"),
    EMBEDDED_OBJECT("w:object"),
    MATH("m:oMath"),
    COMMENT_RANGE_START("w:commentRangeStart"),
    COMMENT_RANGE_END("w:commentRangeEnd"),
    COMMENT("w:comment"),
    ALTERNATE_CONTENT("mc:AlternateContent"),
    ALTERNATE_CHOICE("mc:Choice"),
    ALTERNATE_FALLBACK("mc:Fallback"),
    GENERIC(null),
    UNKNOWN(null);

    private static final Map<String, ElementRole> BY_NAME = createIndex();

    private final String prefixedName;

    ElementRole(String prefixedName) {
        this.prefixedName = prefixedName;
    }

    private static Map<String, ElementRole> createIndex() {
        Map<String, ElementRole> map = new HashMap<>();
        for (ElementRole role : values()) {
            if (role.prefixedName != null) {
                map.put(role.prefixedName, role);
            }
        }
        return Collections.unmodifiableMap(map);
    }

    /**
     * 逻辑名，如 "w:p"；GENERIC/UNKNOWN 没有
     */
    public String getPrefixedName() {
        return prefixedName;
    }

    static ElementRole byPrefixedName(String prefixedName) {
        return BY_NAME.get(prefixedName);
    }
}
