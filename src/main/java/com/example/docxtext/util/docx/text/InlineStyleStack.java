package com.example.docxtext.util.docx.text;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 段落内的行内样式栈
 *
 * 每个片段输出前：从栈顶向下关闭，直到最深的一个"已不再生效或值发生变化"的标记为止；
 * 再按固定顺序打开尚未打开的样式；最后输出文本。段落结束时关闭全部标记。
 * <pre>
 * runs:   [b]"a"  [b,i]"b"  [i]"c"
 * output: &lt;b&gt;a  &lt;i&gt;b  &lt;/i&gt;&lt;/b&gt;&lt;i&gt;c  &lt;/i&gt;
 * </pre>
 * 这样标记不会跨段落，同类标记不会嵌套，每个段落内开闭平衡。
 * 每个段落使用一个新实例。
 */
public class InlineStyleStack {

    private final List<StyleKind> openKinds = new ArrayList<>();
    private final Map<StyleKind, String> openValues = new EnumMap<>(StyleKind.class);

    /**
     * 输出一个片段（text 需已转义）
     *
     * 空文本的片段不输出任何标记，也不改变栈。
     */
    public String render(RunFormatting formatting, String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder();

        int deepestStale = -1;
        for (int i = 0; i < openKinds.size(); i++) {
            StyleKind kind = openKinds.get(i);
            if (!formatting.has(kind) || !formatting.valueOf(kind).equals(openValues.get(kind))) {
                deepestStale = i;
                break;
            }
        }
        if (deepestStale >= 0) {
            closeDownTo(deepestStale, out);
        }

        for (Map.Entry<StyleKind, String> style : formatting.getStyles().entrySet()) {
            if (!openValues.containsKey(style.getKey())) {
                out.append(style.getKey().open(style.getValue()));
                openKinds.add(style.getKey());
                openValues.put(style.getKey(), style.getValue());
            }
        }
        out.append(text);
        return out.toString();
    }

    /**
     * 关闭所有打开的标记（段落结束）
     */
    public String closeAll() {
        StringBuilder out = new StringBuilder();
        closeDownTo(0, out);
        return out.toString();
    }

    public boolean isEmpty() {
        return openKinds.isEmpty();
    }

    private void closeDownTo(int index, StringBuilder out) {
        for (int i = openKinds.size() - 1; i >= index; i--) {
            StyleKind kind = openKinds.remove(i);
            openValues.remove(kind);
            out.append(kind.close());
        }
    }

    /**
     * 转义 &amp; &lt; &gt;
     */
    public static String escape(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
