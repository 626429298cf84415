package com.example.docxtext.controller;

import com.example.docxtext.exception.DocxExtractionException;
import com.example.docxtext.service.DocxExtractService;
import com.example.docxtext.util.docx.model.ExtractionOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * DOCX文本提取控制器
 */
@Slf4j
@RestController
@RequestMapping("/api/docx")
public class DocxController {

    @Autowired
    private DocxExtractService docxExtractService;

    /**
     * 提取DOCX文本
     *
     * 返回 页眉/正文/页脚/脚注/尾注 的 表格-行-单元格-段落 结构，以及全文、批注、链接、文档属性。
     *
     * @param file                 DOCX文件
     * @param html                 是否输出html样式标记（默认取配置）
     * @param paragraphStyles      是否输出段落样式名（默认取配置）
     * @param duplicateMergedCells 是否复制合并单元格内容（默认取配置）
     */
    @PostMapping("/extract")
    public ResponseEntity<Map<String, Object>> extract(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "html", required = false) Boolean html,
            @RequestParam(value = "paragraphStyles", required = false) Boolean paragraphStyles,
            @RequestParam(value = "duplicateMergedCells", required = false) Boolean duplicateMergedCells) {

        Map<String, Object> result = new HashMap<>();
        String error = validate(file);
        if (error != null) {
            result.put("success", false);
            result.put("message", error);
            return ResponseEntity.badRequest().body(result);
        }

        try {
            ExtractionOptions options = docxExtractService.buildOptions(html, paragraphStyles, duplicateMergedCells);
            result.putAll(docxExtractService.extract(file, options));
            result.put("success", true);
            result.put("originalFilename", file.getOriginalFilename());
            result.put("message", "提取成功");
            return ResponseEntity.ok(result);

        } catch (DocxExtractionException | IOException e) {
            log.error("提取失败: {}, {}", file.getOriginalFilename(), e.getMessage(), e);
            result.put("success", false);
            result.put("message", "提取失败: " + e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        }
    }

    /**
     * 以html网格查看文档结构，每个段落前带下标路径
     */
    @PostMapping(value = "/html-map")
    public ResponseEntity<String> htmlMap(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "html", required = false) Boolean html,
            @RequestParam(value = "paragraphStyles", required = false) Boolean paragraphStyles,
            @RequestParam(value = "duplicateMergedCells", required = false) Boolean duplicateMergedCells) {

        String error = validate(file);
        if (error != null) {
            return ResponseEntity.badRequest().contentType(MediaType.TEXT_PLAIN).body(error);
        }

        try {
            ExtractionOptions options = docxExtractService.buildOptions(html, paragraphStyles, duplicateMergedCells);
            String page = docxExtractService.htmlMap(file, options);
            return ResponseEntity.ok().contentType(MediaType.TEXT_HTML).body(page);

        } catch (DocxExtractionException | IOException e) {
            log.error("生成结构图失败: {}, {}", file.getOriginalFilename(), e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .contentType(MediaType.TEXT_PLAIN)
                    .body("生成结构图失败: " + e.getMessage());
        }
    }

    private static String validate(MultipartFile file) {
        if (file.isEmpty()) {
            return "文件不能为空";
        }
        String originalFilename = file.getOriginalFilename();
        if (originalFilename == null || !originalFilename.toLowerCase().endsWith(".docx")) {
            return "只支持.docx文件";
        }
        return null;
    }
}
