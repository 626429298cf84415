package com.example.docxtext.service;

import com.example.docxtext.config.ExtractionProperties;
import com.example.docxtext.util.docx.DocxContent;
import com.example.docxtext.util.docx.DocxUtilities;
import com.example.docxtext.util.docx.model.ExtractionOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * docx 文本提取服务
 *
 * 上传文件在内存中打开，不落盘。
 */
@Slf4j
@Service
public class DocxExtractService {

    private final ExtractionProperties properties;

    public DocxExtractService(ExtractionProperties properties) {
        this.properties = properties;
    }

    /**
     * 合并默认配置与请求参数，请求参数为null时使用默认值
     */
    public ExtractionOptions buildOptions(Boolean html, Boolean paragraphStyles, Boolean duplicateMergedCells) {
        ExtractionOptions options = ExtractionOptions.defaults();
        options.setHtml(html != null ? html : properties.isHtml());
        options.setParagraphStyles(paragraphStyles != null ? paragraphStyles : properties.isParagraphStyles());
        options.setDuplicateMergedCells(duplicateMergedCells != null
                ? duplicateMergedCells : properties.isDuplicateMergedCells());
        return options;
    }

    /**
     * 提取全部文本
     *
     * @return header/body/footer/footnotes/endnotes 的 4 层段落列表，以及 text、comments、properties、warnings
     * @throws IOException 读取上传文件失败
     */
    public Map<String, Object> extract(MultipartFile file, ExtractionOptions options) throws IOException {
        log.info("提取docx: {}, {}", file.getOriginalFilename(), options);
        long start = System.currentTimeMillis();

        Map<String, Object> result = new LinkedHashMap<>();
        try (InputStream in = file.getInputStream();
             DocxContent content = DocxContent.open(in, options)) {
            result.put("header", content.getHeader());
            result.put("body", content.getBody());
            result.put("footer", content.getFooter());
            result.put("footnotes", content.getFootnotes());
            result.put("endnotes", content.getEndnotes());
            result.put("text", content.getText());
            result.put("comments", content.getComments());
            result.put("links", DocxUtilities.getLinks(content));
            result.put("properties", content.getCoreProperties());
            result.put("images", content.getImages().keySet());
            result.put("warnings", content.getWarnings());
        }

        log.info("提取完成: {}, 耗时 {} ms", file.getOriginalFilename(), System.currentTimeMillis() - start);
        return result;
    }

    /**
     * 生成文档结构的html图
     */
    public String htmlMap(MultipartFile file, ExtractionOptions options) throws IOException {
        try (InputStream in = file.getInputStream();
             DocxContent content = DocxContent.open(in, options)) {
            return content.getHtmlMap();
        }
    }
}
