package com.example.docxtext.util.docx.model;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

/**
 * 嵌套列表（表格-行-单元格-段落[-片段]）遍历工具
 *
 * 输出结构固定为：
 * <pre>
 * [  # tables
 *     [  # table
 *         [  # row
 *             [  # cell
 *                 "paragraph"
 *             ]
 *         ]
 *     ]
 * ]
 * </pre>
 * 这些方法可以在任意固定深度上遍历，不需要层层嵌套循环。
 */
public final class NestedLists {

    private NestedLists() {
    }

    /**
     * 在指定深度上枚举（下标路径, 元素）
     *
     * <ul>
     *     <li>1 =&gt; ((i), nested[i])</li>
     *     <li>2 =&gt; ((i, j), nested[i][j])</li>
     *     <li>3 =&gt; ((i, j, k), nested[i][j][k])</li>
     * </ul>
     * 返回值可以反复遍历，每次 iterator() 都从头开始，遍历过程不修改列表。
     *
     * @param nested 嵌套列表
     * @param depth  遍历深度，从1开始
     * @throws IllegalArgumentException depth小于1；或遍历时遇到深度不足的元素
     */
    public static Iterable<IndexedItem> enumAtDepth(List<?> nested, int depth) {
        if (depth < 1) {
            throw new IllegalArgumentException("depth必须大于等于1: " + depth);
        }
        return () -> new DepthIterator(nested, depth);
    }

    /**
     * 在指定深度上遍历元素（不带下标）
     */
    public static <T> Iterable<T> iterAtDepth(List<?> nested, int depth) {
        Iterable<IndexedItem> items = enumAtDepth(nested, depth);
        return () -> new Iterator<T>() {
            private final Iterator<IndexedItem> delegate = items.iterator();

            @Override
            public boolean hasNext() {
                return delegate.hasNext();
            }

            @Override
            public T next() {
                return delegate.next().getValue();
            }
        };
    }

    public static <T> List<T> listAtDepth(List<?> nested, int depth) {
        List<T> result = new ArrayList<>();
        for (T item : NestedLists.<T>iterAtDepth(nested, depth)) {
            result.add(item);
        }
        return result;
    }

    /**
     * 把指定深度的叶子用 joint 拼接，深度减一
     *
     * 最常见的用法是把 5 层的片段列表拼成 4 层的段落列表：joinLeaves("", runs, 4)。
     *
     * @param joint   拼接符
     * @param tree    所有叶子都在同一深度的嵌套列表
     * @param toDepth 拼接后的深度；0 表示整棵树拼成一个字符串
     * @return toDepth 为0时返回字符串，否则返回嵌套列表
     */
    public static Object joinLeaves(String joint, List<?> tree, int toDepth) {
        if (toDepth == 0) {
            return tree.stream().map(String::valueOf).collect(Collectors.joining(joint));
        }
        List<Object> joined = new ArrayList<>(tree.size());
        for (Object branch : tree) {
            joined.add(joinLeaves(joint, (List<?>) branch, toDepth - 1));
        }
        return joined;
    }

    /**
     * 段落 -> 片段字符串（5层）
     */
    public static List<List<List<List<List<String>>>>> runStrings(List<List<List<List<Paragraph>>>> tables) {
        List<List<List<List<List<String>>>>> result = new ArrayList<>(tables.size());
        for (List<List<List<Paragraph>>> table : tables) {
            List<List<List<List<String>>>> rows = new ArrayList<>(table.size());
            for (List<List<Paragraph>> row : table) {
                List<List<List<String>>> cells = new ArrayList<>(row.size());
                for (List<Paragraph> cell : row) {
                    List<List<String>> paragraphs = new ArrayList<>(cell.size());
                    for (Paragraph paragraph : cell) {
                        paragraphs.add(paragraph.getRunStrings());
                    }
                    cells.add(paragraphs);
                }
                rows.add(cells);
            }
            result.add(rows);
        }
        return result;
    }

    /**
     * 段落 -> 段落字符串（4层）
     */
    @SuppressWarnings("unchecked")
    public static List<List<List<List<String>>>> paragraphStrings(List<List<List<List<Paragraph>>>> tables) {
        return (List<List<List<List<String>>>>) joinLeaves("", runStrings(tables), 4);
    }

    /**
     * 所有段落用空行连接
     */
    public static String getText(List<?> tables) {
        List<String> paragraphs = new ArrayList<>();
        for (Object paragraph : NestedLists.iterAtDepth(tables, 4)) {
            paragraphs.add(String.valueOf(paragraph));
        }
        return String.join("\n\n", paragraphs);
    }

    /**
     * 生成可在浏览器中查看的html结构图
     *
     * 每个表格画成带边框的网格，每个段落前加上它的下标路径，如 "(0, 0, 0, 0) text"。
     */
    public static String getHtmlMap(List<?> tables) {
        Document html = Document.createShell("");
        Element body = html.body();
        for (int i = 0; i < tables.size(); i++) {
            Element table = body.appendElement("table").attr("border", "1");
            List<?> rows = (List<?>) tables.get(i);
            for (int j = 0; j < rows.size(); j++) {
                Element tr = table.appendElement("tr");
                List<?> cells = (List<?>) rows.get(j);
                for (int k = 0; k < cells.size(); k++) {
                    Element td = tr.appendElement("td");
                    List<?> paragraphs = (List<?>) cells.get(k);
                    for (int m = 0; m < paragraphs.size(); m++) {
                        String address = "(" + i + ", " + j + ", " + k + ", " + m + ") ";
                        td.appendElement("pre").append(address + paragraphs.get(m));
                    }
                }
            }
        }
        return html.outerHtml();
    }

    private static final class DepthIterator implements Iterator<IndexedItem> {

        private final int depth;
        private final int[] index;
        private final Deque<ListIterator<?>> stack = new ArrayDeque<>();
        private IndexedItem next;

        DepthIterator(List<?> root, int depth) {
            this.depth = depth;
            this.index = new int[depth];
            stack.push(root.listIterator());
            advance();
        }

        private void advance() {
            next = null;
            while (!stack.isEmpty()) {
                ListIterator<?> top = stack.peek();
                if (!top.hasNext()) {
                    stack.pop();
                    continue;
                }
                int level = stack.size() - 1;
                index[level] = top.nextIndex();
                Object item = top.next();
                if (level == depth - 1) {
                    List<Integer> address = new ArrayList<>(depth);
                    Arrays.stream(index).forEach(address::add);
                    next = new IndexedItem(address, item);
                    return;
                }
                if (!(item instanceof List)) {
                    throw new IllegalArgumentException("第" + (level + 1) + "层元素不是列表，无法继续向下遍历: " + item);
                }
                stack.push(((List<?>) item).listIterator());
            }
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public IndexedItem next() {
            if (next == null) {
                throw new NoSuchElementException();
            }
            IndexedItem current = next;
            advance();
            return current;
        }
    }
}
