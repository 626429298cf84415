package com.example.docxtext.exception;

/**
 * docx 无法读取（文件损坏、不是docx、IO失败）
 *
 * 文档内部的不规范内容不会抛出此异常，只会告警后跳过。
 */
public class DocxExtractionException extends RuntimeException {

    public DocxExtractionException(String message) {
        super(message);
    }

    public DocxExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
