package com.example.docxtext.util.docx.collect;

import com.example.docxtext.util.docx.Slf4jWarningSink;
import com.example.docxtext.util.docx.WarningSink;
import com.example.docxtext.util.docx.model.ExtractionOptions;
import com.example.docxtext.util.docx.pkg.RelationshipLookup;
import com.example.docxtext.util.docx.text.NumberingDefinitions;
import com.example.docxtext.util.docx.text.NumberingFormatSource;

/**
 * 遍历一个内容部件所需的只读信息：选项、关系表、编号定义、告警出口
 */
public final class ExtractionContext {

    private final ExtractionOptions options;
    private final RelationshipLookup relationships;
    private final NumberingFormatSource numbering;
    private final WarningSink warnings;

    public ExtractionContext(ExtractionOptions options, RelationshipLookup relationships,
                             NumberingFormatSource numbering, WarningSink warnings) {
        this.options = options == null ? ExtractionOptions.defaults() : options;
        this.relationships = relationships == null ? RelationshipLookup.EMPTY : relationships;
        this.numbering = numbering == null ? NumberingDefinitions.empty() : numbering;
        this.warnings = warnings == null ? Slf4jWarningSink.INSTANCE : warnings;
    }

    public static ExtractionContext of(ExtractionOptions options) {
        return new ExtractionContext(options, null, null, null);
    }

    public ExtractionOptions getOptions() { return options; }

    public RelationshipLookup getRelationships() { return relationships; }

    public NumberingFormatSource getNumbering() { return numbering; }

    public WarningSink getWarnings() { return warnings; }
}
