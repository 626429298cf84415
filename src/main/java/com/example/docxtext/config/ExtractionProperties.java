package com.example.docxtext.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * docx 提取默认配置（application.properties 中 docx.extract.*）
 *
 * 请求参数未指定时使用这里的值。
 */
@ConfigurationProperties(prefix = "docx.extract")
public class ExtractionProperties {

    /**
     * 默认是否输出html样式标记
     */
    private boolean html = false;

    /**
     * 默认是否在段落前输出段落样式名
     */
    private boolean paragraphStyles = false;

    /**
     * 默认是否复制合并单元格内容
     */
    private boolean duplicateMergedCells = true;

    /**
     * 跨域允许的来源，空表示允许所有来源
     */
    private List<String> allowedOrigins = new ArrayList<>();

    public boolean isHtml() { return html; }
    public void setHtml(boolean html) { this.html = html; }

    public boolean isParagraphStyles() { return paragraphStyles; }
    public void setParagraphStyles(boolean paragraphStyles) { this.paragraphStyles = paragraphStyles; }

    public boolean isDuplicateMergedCells() { return duplicateMergedCells; }
    public void setDuplicateMergedCells(boolean duplicateMergedCells) { this.duplicateMergedCells = duplicateMergedCells; }

    public List<String> getAllowedOrigins() { return allowedOrigins; }
    public void setAllowedOrigins(List<String> allowedOrigins) { this.allowedOrigins = allowedOrigins; }
}
