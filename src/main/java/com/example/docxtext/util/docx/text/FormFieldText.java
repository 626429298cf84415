package com.example.docxtext.util.docx.text;

import com.example.docxtext.util.docx.namespace.DocxNamespace;
import com.example.docxtext.util.docx.namespace.NamespaceResolver;
import org.w3c.dom.Element;

import java.util.List;

/**
 * 表单控件（复选框、下拉框）的文本表示
 */
public final class FormFieldText {

    public static final String UNCHECKED = "☐";
    public static final String CHECKED = "☒";
    public static final String CHECKBOX_FAILED = "----checkbox failed----";
    public static final String DROPDOWN_FAILED = "----dropdown failed----";

    private FormFieldText() {
    }

    /**
     * 复选框
     *
     * <pre>
     * &lt;w:checkBox&gt;
     *     &lt;w:sizeAuto/&gt;
     *     &lt;w:default w:val="1"/&gt;
     *     &lt;w:checked w:val="0"/&gt;
     * &lt;/w:checkBox&gt;
     * </pre>
     * 优先取 checked（有元素无 w:val 视为选中），其次取 default，都没有时返回失败标记。
     */
    public static String checkbox(Element checkBox) {
        String val = null;
        Element checked = NamespaceResolver.firstChild(checkBox, "w:checked");
        if (checked != null) {
            val = DocxNamespace.attribute(checked, "w:val");
            if (val == null || val.isEmpty()) {
                val = "1";
            }
        } else {
            Element defaultValue = NamespaceResolver.firstChild(checkBox, "w:default");
            if (defaultValue != null) {
                val = DocxNamespace.attribute(defaultValue, "w:val");
            }
        }
        if ("0".equals(val) || "false".equals(val)) {
            return UNCHECKED;
        }
        if ("1".equals(val) || "true".equals(val)) {
            return CHECKED;
        }
        return CHECKBOX_FAILED;
    }

    /**
     * 下拉框只输出选中的一项，缺少 w:result 时为第0项
     *
     * <pre>
     * &lt;w:ddList&gt;
     *     &lt;w:result w:val="1"/&gt;
     *     &lt;w:listEntry w:val="selection 1"/&gt;
     *     &lt;w:listEntry w:val="selection 2"/&gt;
     * &lt;/w:ddList&gt;
     * </pre>
     */
    public static String dropdown(Element ddList) {
        List<Element> entries = NamespaceResolver.childrenNamed(ddList, "w:listEntry");
        int index = 0;
        Element result = NamespaceResolver.firstChild(ddList, "w:result");
        if (result != null) {
            String val = DocxNamespace.attribute(result, "w:val");
            try {
                index = val == null ? 0 : Integer.parseInt(val.trim());
            } catch (NumberFormatException e) {
                return DROPDOWN_FAILED;
            }
        }
        if (index < 0 || index >= entries.size()) {
            return DROPDOWN_FAILED;
        }
        String value = DocxNamespace.attribute(entries.get(index), "w:val");
        return value == null ? "" : value;
    }
}
