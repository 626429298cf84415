package com.example.docxtext.controller;

import com.example.docxtext.config.ExtractionProperties;
import com.example.docxtext.service.DocxExtractService;
import com.example.docxtext.util.docx.DocxContentTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("docx提取接口")
class DocxControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        DocxController controller = new DocxController();
        ReflectionTestUtils.setField(controller, "docxExtractService", new DocxExtractService(new ExtractionProperties()));
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    private static MockMultipartFile docx(String name, byte[] bytes) {
        return new MockMultipartFile("file", name, "application/vnd.openxmlformats-officedocument.wordprocessingml.document", bytes);
    }

    @Test
    @DisplayName("上传docx返回各部件文本")
    void extract() throws Exception {
        mockMvc.perform(multipart("/api/docx/extract").file(docx("sample.docx", DocxContentTest.sampleDocx())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.originalFilename").value("sample.docx"))
                .andExpect(jsonPath("$.header[0][0][0][0]").value("Header text"))
                .andExpect(jsonPath("$.body[1][0][1][0]").value("b"))
                .andExpect(jsonPath("$.comments[0].author").value("Alice"))
                .andExpect(jsonPath("$.links[0].href").value("https://example.com"))
                .andExpect(jsonPath("$.properties.title").value("Quarterly"))
                .andExpect(jsonPath("$.images[0]").value("image1.png"));
    }

    @Test
    @DisplayName("html 参数覆盖默认配置")
    void extractHtml() throws Exception {
        mockMvc.perform(multipart("/api/docx/extract")
                        .file(docx("sample.docx", DocxContentTest.sampleDocx()))
                        .param("html", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.body[2][0][0][1]").value("<h1>Chapter</h1>"));
    }

    @Test
    @DisplayName("空文件或非docx文件返回400")
    void rejectsBadUploads() throws Exception {
        mockMvc.perform(multipart("/api/docx/extract").file(docx("empty.docx", new byte[0])))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("文件不能为空"));

        mockMvc.perform(multipart("/api/docx/extract").file(docx("notes.txt", new byte[]{1})))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("只支持.docx文件"));
    }

    @Test
    @DisplayName("损坏的docx返回500")
    void brokenDocx() throws Exception {
        mockMvc.perform(multipart("/api/docx/extract").file(docx("broken.docx", new byte[]{1, 2, 3})))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message", containsString("提取失败")));
    }

    @Test
    @DisplayName("结构图接口返回html")
    void htmlMap() throws Exception {
        mockMvc.perform(multipart("/api/docx/html-map").file(docx("sample.docx", DocxContentTest.sampleDocx())))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_HTML))
                .andExpect(content().string(containsString("(0, 0, 0, 0) Header text")));
    }
}
