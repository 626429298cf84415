package com.example.docxtext.util.docx.pkg;

import org.apache.poi.openxml4j.opc.PackagePart;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * 已解析为DOM的内容部件
 */
public final class DocxPart {

    private final PartType type;
    private final PackagePart packagePart;
    private final Document document;
    private final RelationshipLookup relationships;

    DocxPart(PartType type, PackagePart packagePart, Document document, RelationshipLookup relationships) {
        this.type = type;
        this.packagePart = packagePart;
        this.document = document;
        this.relationships = relationships;
    }

    public PartType getType() { return type; }

    /**
     * 部件在包内的路径，如 /word/header1.xml
     */
    public String getName() {
        return packagePart.getPartName().getName();
    }

    PackagePart getPackagePart() { return packagePart; }

    public Document getDocument() { return document; }

    public Element getRootElement() {
        return document.getDocumentElement();
    }

    public RelationshipLookup getRelationships() { return relationships; }

    @Override
    public String toString() {
        return type + ":" + getName();
    }
}
