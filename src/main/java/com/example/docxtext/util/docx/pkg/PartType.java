package com.example.docxtext.util.docx.pkg;

/**
 * 内容部件类型，按关系类型URI的最后一段识别（transitional、strict 两种方言通用）
 */
public enum PartType {

    OFFICE_DOCUMENT("officeDocument"),
    HEADER("header"),
    FOOTER("footer"),
    FOOTNOTES("footnotes"),
    ENDNOTES("endnotes"),
    COMMENTS("comments"),
    NUMBERING("numbering"),
    IMAGE("image");

    private final String relationshipSuffix;

    PartType(String relationshipSuffix) {
        this.relationshipSuffix = relationshipSuffix;
    }

    public String getRelationshipSuffix() {
        return relationshipSuffix;
    }

    /**
     * @param relationshipType 如 http://schemas.openxmlformats.org/officeDocument/2006/relationships/header
     */
    public boolean matches(String relationshipType) {
        return relationshipType != null && relationshipType.endsWith("/" + relationshipSuffix);
    }
}
