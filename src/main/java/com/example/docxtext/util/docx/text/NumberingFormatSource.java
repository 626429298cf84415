package com.example.docxtext.util.docx.text;

import java.util.Optional;

/**
 * 按 (numId, ilvl) 查询编号格式
 */
public interface NumberingFormatSource {

    /**
     * @return 无法解析时返回 empty
     */
    Optional<LevelFormat> formatOf(String numId, int ilvl);
}
