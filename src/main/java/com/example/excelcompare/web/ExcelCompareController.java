package com.example.excelcompare.web;

import com.example.excelcompare.service.CompareArtifacts;
import com.example.excelcompare.service.CompareRequest;
import com.example.excelcompare.service.CompareResponse;
import com.example.excelcompare.service.ExcelCompareService;
import com.example.excelcompare.service.MarkedFile;
import com.example.excelcompare.service.UploadInfo;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

@RestController
@RequestMapping("/api/excel")
@RequiredArgsConstructor
public class ExcelCompareController {
    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ExcelCompareService excelCompareService;

    @PostMapping("/upload")
    public UploadInfo upload(@RequestParam("file") MultipartFile file) {
        return excelCompareService.upload(file);
    }

    @PostMapping("/compare")
    public CompareResponse compare(@RequestBody CompareRequest request) {
        return excelCompareService.compare(request);
    }

    @GetMapping("/download/{resultId}")
    public ResponseEntity<byte[]> downloadReport(@PathVariable String resultId) {
        CompareArtifacts artifacts = excelCompareService.findResult(resultId)
                .orElseThrow(() -> new ResultNotFoundException("文件不存在"));
        String fileName = "compare_result_" + LocalDateTime.now().format(FILE_TIMESTAMP) + ".txt";
        return ResponseEntity.ok()
                .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8))
                .header(HttpHeaders.CONTENT_DISPOSITION, attachment(fileName))
                .body(artifacts.report().getBytes(StandardCharsets.UTF_8));
    }

    @GetMapping("/download/{resultId}/{fileNo}")
    public ResponseEntity<byte[]> downloadMarked(@PathVariable String resultId, @PathVariable int fileNo) {
        if (fileNo != 1 && fileNo != 2) {
            throw new IllegalArgumentException("无效的文件编号");
        }
        MarkedFile marked = excelCompareService.findResult(resultId)
                .flatMap(artifacts -> artifacts.markedFile(fileNo))
                .orElseThrow(() -> new ResultNotFoundException("文件不存在"));
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(marked.contentType()))
                .header(HttpHeaders.CONTENT_DISPOSITION, attachment(marked.downloadName()))
                .body(marked.content());
    }

    private static String attachment(String fileName) {
        return ContentDisposition.attachment()
                .filename(fileName, StandardCharsets.UTF_8)
                .build()
                .toString();
    }
}
