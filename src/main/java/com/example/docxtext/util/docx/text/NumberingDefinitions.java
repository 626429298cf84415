package com.example.docxtext.util.docx.text;

import com.example.docxtext.util.docx.WarningSink;
import com.example.docxtext.util.docx.namespace.DocxNamespace;
import com.example.docxtext.util.docx.namespace.NamespaceResolver;
import org.w3c.dom.Element;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 编号定义（word/numbering.xml）
 *
 * numbering.xml 分两部分：
 * <pre>
 * &lt;w:abstractNum w:abstractNumId="0"&gt;
 *     &lt;w:lvl w:ilvl="0"&gt;&lt;w:start w:val="1"/&gt;&lt;w:numFmt w:val="decimal"/&gt;&lt;/w:lvl&gt;
 *     &lt;w:lvl w:ilvl="1"&gt;&lt;w:numFmt w:val="lowerLetter"/&gt;&lt;/w:lvl&gt;
 * &lt;/w:abstractNum&gt;
 * &lt;w:num w:numId="1"&gt;
 *     &lt;w:abstractNumId w:val="0"/&gt;
 *     &lt;w:lvlOverride w:ilvl="0"&gt;&lt;w:startOverride w:val="5"/&gt;&lt;/w:lvlOverride&gt;
 * &lt;/w:num&gt;
 * </pre>
 * 多个 num 可以引用同一个 abstractNum，但各自独立计数。
 */
public final class NumberingDefinitions implements NumberingFormatSource {

    private static final NumberingDefinitions EMPTY = new NumberingDefinitions(
            Collections.emptyMap(), Collections.emptyMap(), Collections.emptyMap());

    // abstractNumId -> (ilvl -> 格式)
    private final Map<String, Map<Integer, LevelFormat>> abstractLevels;

    // numId -> abstractNumId
    private final Map<String, String> numToAbstract;

    // numId -> (ilvl -> 覆盖)
    private final Map<String, Map<Integer, LevelOverride>> overrides;

    private NumberingDefinitions(Map<String, Map<Integer, LevelFormat>> abstractLevels,
                                 Map<String, String> numToAbstract,
                                 Map<String, Map<Integer, LevelOverride>> overrides) {
        this.abstractLevels = abstractLevels;
        this.numToAbstract = numToAbstract;
        this.overrides = overrides;
    }

    public static NumberingDefinitions empty() {
        return EMPTY;
    }

    /**
     * 解析 numbering.xml 的根元素
     *
     * @param root     w:numbering 元素，为null时返回空定义
     * @param warnings 结构不完整时告警
     */
    public static NumberingDefinitions parse(Element root, WarningSink warnings) {
        if (root == null) {
            return EMPTY;
        }
        Map<String, Map<Integer, LevelFormat>> abstractLevels = new HashMap<>();
        for (Element abstractNum : NamespaceResolver.childrenNamed(root, "w:abstractNum")) {
            String id = DocxNamespace.attribute(abstractNum, "w:abstractNumId");
            if (id == null) {
                warnings.warn("abstractNum缺少abstractNumId，已忽略");
                continue;
            }
            abstractLevels.put(id, parseLevels(abstractNum));
        }

        Map<String, String> numToAbstract = new HashMap<>();
        Map<String, Map<Integer, LevelOverride>> overrides = new HashMap<>();
        for (Element num : NamespaceResolver.childrenNamed(root, "w:num")) {
            String numId = DocxNamespace.attribute(num, "w:numId");
            Element abstractNumId = NamespaceResolver.firstChild(num, "w:abstractNumId");
            if (numId == null || abstractNumId == null) {
                continue;
            }
            numToAbstract.put(numId, DocxNamespace.attribute(abstractNumId, "w:val"));

            Map<Integer, LevelOverride> numOverrides = new HashMap<>();
            for (Element lvlOverride : NamespaceResolver.childrenNamed(num, "w:lvlOverride")) {
                Integer ilvl = parseInt(DocxNamespace.attribute(lvlOverride, "w:ilvl"));
                if (ilvl == null) {
                    continue;
                }
                LevelOverride override = new LevelOverride();
                Element startOverride = NamespaceResolver.firstChild(lvlOverride, "w:startOverride");
                if (startOverride != null) {
                    override.start = parseInt(DocxNamespace.attribute(startOverride, "w:val"));
                }
                Element lvl = NamespaceResolver.firstChild(lvlOverride, "w:lvl");
                if (lvl != null) {
                    override.level = parseLevel(lvl);
                }
                numOverrides.put(ilvl, override);
            }
            if (!numOverrides.isEmpty()) {
                overrides.put(numId, numOverrides);
            }
        }
        return new NumberingDefinitions(abstractLevels, numToAbstract, overrides);
    }

    private static Map<Integer, LevelFormat> parseLevels(Element abstractNum) {
        Map<Integer, LevelFormat> levels = new HashMap<>();
        List<Element> lvls = NamespaceResolver.childrenNamed(abstractNum, "w:lvl");
        for (int position = 0; position < lvls.size(); position++) {
            Element lvl = lvls.get(position);
            Integer ilvl = parseInt(DocxNamespace.attribute(lvl, "w:ilvl"));
            levels.put(ilvl != null ? ilvl : position, parseLevel(lvl));
        }
        return levels;
    }

    private static LevelFormat parseLevel(Element lvl) {
        Element numFmt = NamespaceResolver.firstChild(lvl, "w:numFmt");
        Element start = NamespaceResolver.firstChild(lvl, "w:start");
        String fmt = numFmt == null ? null : DocxNamespace.attribute(numFmt, "w:val");
        Integer startValue = start == null ? null : parseInt(DocxNamespace.attribute(start, "w:val"));
        return new LevelFormat(fmt, startValue != null ? startValue : 1);
    }

    private static Integer parseInt(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * 查询 (numId, ilvl) 的编号格式
     *
     * @return 找不到 numId、层级或 numFmt 时返回 empty，由调用方回退为项目符号
     */
    @Override
    public Optional<LevelFormat> formatOf(String numId, int ilvl) {
        LevelFormat format = null;
        String abstractId = numToAbstract.get(numId);
        if (abstractId != null) {
            Map<Integer, LevelFormat> levels = abstractLevels.get(abstractId);
            if (levels != null) {
                format = levels.get(ilvl);
            }
        }
        LevelOverride override = overrides.getOrDefault(numId, Collections.emptyMap()).get(ilvl);
        if (override != null) {
            if (override.level != null && override.level.getNumFmt() != null) {
                format = override.level;
            }
            if (format != null && override.start != null) {
                format = format.withStart(override.start);
            }
        }
        if (format == null || format.getNumFmt() == null) {
            return Optional.empty();
        }
        return Optional.of(format);
    }

    public boolean isEmpty() {
        return numToAbstract.isEmpty();
    }

    private static final class LevelOverride {
        Integer start;
        LevelFormat level;
    }
}
