package com.example.docxtext.util.docx.collect;

import com.example.docxtext.util.docx.WarningSink;
import com.example.docxtext.util.docx.namespace.DocxNamespace;
import com.example.docxtext.util.docx.namespace.ElementRole;
import com.example.docxtext.util.docx.namespace.NamespaceResolver;
import org.w3c.dom.Element;

/**
 * 单元格的合并信息（w:tcPr 中的 gridSpan、vMerge）
 *
 * <pre>
 * &lt;w:tc&gt;
 *     &lt;w:tcPr&gt;
 *         &lt;w:gridSpan w:val="2"/&gt;
 *         &lt;w:vMerge/&gt;   // 无 w:val 或 "continue" 表示延续上方单元格；"restart" 表示合并起点
 *     &lt;/w:tcPr&gt;
 * &lt;/w:tc&gt;
 * </pre>
 */
public final class CellMerge {

    public static final CellMerge NONE = new CellMerge(1, false);

    /** Word 表格最多 63 列 */
    public static final int MAX_GRID_SPAN = 63;

    private final int gridSpan;
    private final boolean verticalContinuation;

    public CellMerge(int gridSpan, boolean verticalContinuation) {
        this.gridSpan = Math.min(MAX_GRID_SPAN, Math.max(1, gridSpan));
        this.verticalContinuation = verticalContinuation;
    }

    public static CellMerge of(Element tc, WarningSink warnings) {
        Element tcPr = NamespaceResolver.firstChild(tc, ElementRole.TABLE_CELL_PROPERTIES);
        if (tcPr == null) {
            return NONE;
        }
        int span = 1;
        Element gridSpan = NamespaceResolver.firstChild(tcPr, "w:gridSpan");
        if (gridSpan != null) {
            String val = DocxNamespace.attribute(gridSpan, "w:val");
            try {
                span = val == null ? 1 : Integer.parseInt(val.trim());
            } catch (NumberFormatException e) {
                warnings.warn("gridSpan 无法解析，按 1 处理: " + val);
                span = 1;
            }
            if (span > MAX_GRID_SPAN) {
                warnings.warn("gridSpan 超过 " + MAX_GRID_SPAN + " 列，按 " + MAX_GRID_SPAN + " 处理: " + val);
                span = MAX_GRID_SPAN;
            }
        }
        boolean continuation = false;
        Element vMerge = NamespaceResolver.firstChild(tcPr, "w:vMerge");
        if (vMerge != null) {
            String val = DocxNamespace.attribute(vMerge, "w:val");
            continuation = val == null || val.isEmpty() || "continue".equals(val);
        }
        if (span == 1 && !continuation) {
            return NONE;
        }
        return new CellMerge(span, continuation);
    }

    public int getGridSpan() { return gridSpan; }

    public boolean isVerticalContinuation() { return verticalContinuation; }

    @Override
    public String toString() {
        return "CellMerge(gridSpan=" + gridSpan + ", vMerge=" + verticalContinuation + ")";
    }
}
