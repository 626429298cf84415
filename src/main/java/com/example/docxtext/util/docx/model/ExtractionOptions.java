package com.example.docxtext.util.docx.model;

/**
 * 提取选项
 */
public class ExtractionOptions {

    /**
     * 输出行内样式标记（b、i、span...）与标题 h1..h6，并转义文本中的 &amp; &lt; &gt;
     */
    private boolean html = false;

    /**
     * 每个段落的第一个片段为段落样式名（无样式时为 "None"）
     */
    private boolean paragraphStyles = false;

    /**
     * 合并单元格补出的位置复制原单元格内容；为false时补空白单元格
     */
    private boolean duplicateMergedCells = true;

    /**
     * 非空时把图片写入该目录
     */
    private String imageFolder;

    public static ExtractionOptions defaults() {
        return new ExtractionOptions();
    }

    public boolean isHtml() { return html; }
    public void setHtml(boolean html) { this.html = html; }

    public boolean isParagraphStyles() { return paragraphStyles; }
    public void setParagraphStyles(boolean paragraphStyles) { this.paragraphStyles = paragraphStyles; }

    public boolean isDuplicateMergedCells() { return duplicateMergedCells; }
    public void setDuplicateMergedCells(boolean duplicateMergedCells) { this.duplicateMergedCells = duplicateMergedCells; }

    public String getImageFolder() { return imageFolder; }
    public void setImageFolder(String imageFolder) { this.imageFolder = imageFolder; }

    @Override
    public String toString() {
        return "ExtractionOptions{html=" + html + ", paragraphStyles=" + paragraphStyles
                + ", duplicateMergedCells=" + duplicateMergedCells + ", imageFolder=" + imageFolder + "}";
    }
}
