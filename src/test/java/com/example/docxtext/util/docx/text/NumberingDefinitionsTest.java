package com.example.docxtext.util.docx.text;

import com.example.docxtext.util.docx.CollectingWarningSink;
import com.example.docxtext.util.docx.DocxXml;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("numbering.xml 解析")
class NumberingDefinitionsTest {

    private static final String NUMBERING =
            "<w:abstractNum w:abstractNumId=\"0\">"
                    + "<w:lvl w:ilvl=\"0\"><w:start w:val=\"1\"/><w:numFmt w:val=\"decimal\"/></w:lvl>"
                    + "<w:lvl w:ilvl=\"1\"><w:start w:val=\"3\"/><w:numFmt w:val=\"lowerLetter\"/></w:lvl>"
                    + "</w:abstractNum>"
                    + "<w:abstractNum w:abstractNumId=\"1\">"
                    + "<w:lvl><w:numFmt w:val=\"bullet\"/></w:lvl>"
                    + "</w:abstractNum>"
                    + "<w:num w:numId=\"1\"><w:abstractNumId w:val=\"0\"/></w:num>"
                    + "<w:num w:numId=\"2\"><w:abstractNumId w:val=\"0\"/>"
                    + "<w:lvlOverride w:ilvl=\"0\"><w:startOverride w:val=\"5\"/></w:lvlOverride>"
                    + "<w:lvlOverride w:ilvl=\"1\"><w:lvl w:ilvl=\"1\"><w:numFmt w:val=\"upperRoman\"/></w:lvl></w:lvlOverride>"
                    + "</w:num>"
                    + "<w:num w:numId=\"3\"><w:abstractNumId w:val=\"1\"/></w:num>";

    private final NumberingDefinitions definitions =
            NumberingDefinitions.parse(DocxXml.element("w:numbering", NUMBERING), new CollectingWarningSink());

    @Test
    @DisplayName("numId 经 abstractNumId 找到层级格式")
    void resolvesThroughAbstractNum() {
        LevelFormat level0 = definitions.formatOf("1", 0).orElseThrow();
        LevelFormat level1 = definitions.formatOf("1", 1).orElseThrow();

        assertThat(level0.getNumFmt()).isEqualTo("decimal");
        assertThat(level0.getStart()).isEqualTo(1);
        assertThat(level1.getNumFmt()).isEqualTo("lowerLetter");
        assertThat(level1.getStart()).isEqualTo(3);
    }

    @Test
    @DisplayName("lvlOverride 覆盖起始值与格式")
    void appliesOverrides() {
        LevelFormat restarted = definitions.formatOf("2", 0).orElseThrow();

        assertThat(restarted.getNumFmt()).isEqualTo("decimal");
        assertThat(restarted.getStart()).isEqualTo(5);
        assertThat(definitions.formatOf("2", 1).orElseThrow().getNumFmt()).isEqualTo("upperRoman");
    }

    @Test
    @DisplayName("缺少 ilvl 属性的 lvl 按位置编号；未知 numId 或层级返回 empty")
    void positionalLevelsAndMisses() {
        assertThat(definitions.formatOf("3", 0).orElseThrow().getNumFmt()).isEqualTo("bullet");
        assertThat(definitions.formatOf("9", 0)).isEmpty();
        assertThat(definitions.formatOf("1", 5)).isEmpty();
        assertThat(definitions.isEmpty()).isFalse();
        assertThat(NumberingDefinitions.parse(null, new CollectingWarningSink()).isEmpty()).isTrue();
    }
}
