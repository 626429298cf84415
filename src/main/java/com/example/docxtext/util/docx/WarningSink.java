package com.example.docxtext.util.docx;

/**
 * 提取过程中的告警出口
 *
 * 无法识别的元素、编号格式回退、缺失的关系id等都只告警不中断。
 * 实现类不允许抛出异常。
 */
public interface WarningSink {

    void warn(String message);
}
