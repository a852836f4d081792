package com.example.excelcompare.service;

import java.util.List;
import java.util.Map;

public record UploadInfo(
        String fileId,
        String originalName,
        Map<String, List<String>> sheets
) {
}
