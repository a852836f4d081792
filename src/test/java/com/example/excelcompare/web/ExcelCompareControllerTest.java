package com.example.excelcompare.web;

import com.example.excelcompare.service.CompareRequest;
import com.example.excelcompare.service.excel.WorkbookFixtures;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.poi.ss.usermodel.Workbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ExcelCompareControllerTest {

    private static final String XLSX = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

    @TempDir
    static Path uploadDir;

    @DynamicPropertySource
    static void uploadDir(DynamicPropertyRegistry registry) {
        registry.add("excel.compare.upload-dir", () -> uploadDir.toString());
    }

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @Test
    void upload_compare_and_download() throws Exception {
        String left = upload("左表.xlsx", List.of(
                List.of("id", "name"),
                List.of(1, "Ann"),
                List.of(2, "Bob")
        ));
        String right = upload("右表.xlsx", List.of(
                List.of("id", "name"),
                List.of(1, "Anne"),
                List.of(3, "Cid")
        ));

        MvcResult compared = mockMvc.perform(post("/api/excel/compare")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new CompareRequest(left, right, "Sheet1", "Sheet1", List.of("id")))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.onlyInFile1").value(1))
                .andExpect(jsonPath("$.onlyInFile2").value(1))
                .andExpect(jsonPath("$.commonWithDiff").value(1))
                .andExpect(jsonPath("$.hasMarkedFiles").value(true))
                .andReturn();
        JsonNode body = objectMapper.readTree(compared.getResponse().getContentAsString(StandardCharsets.UTF_8));
        String resultId = body.get("resultId").asText();
        assertTrue(body.get("result").asText().contains("文件1: 左表.xlsx (Sheet: Sheet1)"));

        MvcResult report = mockMvc.perform(get("/api/excel/download/{id}", resultId))
                .andExpect(status().isOk())
                .andReturn();
        assertEquals(body.get("result").asText(), report.getResponse().getContentAsString(StandardCharsets.UTF_8));

        MvcResult marked = mockMvc.perform(get("/api/excel/download/{id}/{no}", resultId, 2))
                .andExpect(status().isOk())
                .andReturn();
        assertTrue(marked.getResponse().getHeader("Content-Disposition").contains("UTF-8''"));
        try (Workbook workbook = WorkbookFixtures.read(marked.getResponse().getContentAsByteArray())) {
            assertNotNull(workbook.getSheet("Sheet1").getRow(2).getCell(0).getCellComment());
        }
    }

    @Test
    void upload_lists_sheets_and_columns() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "data.xlsx", XLSX,
                WorkbookFixtures.bytes(Map.of("Orders", List.of(List.of("order", "qty")))));

        mockMvc.perform(multipart("/api/excel/upload").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.originalName").value("data.xlsx"))
                .andExpect(jsonPath("$.sheets.Orders[0]").value("order"))
                .andExpect(jsonPath("$.sheets.Orders[1]").value("qty"));
    }

    @Test
    void upload_rejects_files_that_are_not_workbooks() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "notes.xlsx", XLSX,
                "plain text".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/excel/upload").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void missing_key_column_is_a_bad_request() throws Exception {
        String left = upload("a.xlsx", List.of(List.of("id", "name"), List.of(1, "Ann")));
        String right = upload("b.xlsx", List.of(List.of("code", "name"), List.of(1, "Ann")));

        mockMvc.perform(post("/api/excel/compare")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new CompareRequest(left, right, "Sheet1", "Sheet1", List.of("id")))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("b.xlsx中不存在列: id"));
    }

    @Test
    void incomplete_request_and_unknown_ids_are_rejected() throws Exception {
        mockMvc.perform(post("/api/excel/compare")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"file1Id\":\"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("参数不完整"));

        mockMvc.perform(post("/api/excel/compare")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new CompareRequest("x", "y", "Sheet1", "Sheet1", List.of("id")))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("文件不存在"));
    }

    @Test
    void unknown_result_and_bad_file_number() throws Exception {
        mockMvc.perform(get("/api/excel/download/{id}", "missing"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/excel/download/{id}/{no}", "missing", 3))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("无效的文件编号"));
    }

    private String upload(String name, List<List<Object>> rows) throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", name, XLSX,
                WorkbookFixtures.bytes(Map.of("Sheet1", rows)));
        MvcResult result = mockMvc.perform(multipart("/api/excel/upload").file(file))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString(StandardCharsets.UTF_8))
                .get("fileId").asText();
    }
}
