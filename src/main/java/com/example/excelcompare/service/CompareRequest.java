package com.example.excelcompare.service;

import java.util.List;

public record CompareRequest(
        String file1Id,
        String file2Id,
        String sheet1,
        String sheet2,
        List<String> keys
) {
}
