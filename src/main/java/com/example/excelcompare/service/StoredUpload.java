package com.example.excelcompare.service;

import java.nio.file.Path;

public record StoredUpload(
        String fileId,
        String originalName,
        Path path
) {

    public String baseName() {
        String name = originalName == null || originalName.isBlank() ? fileId : originalName;
        String lower = name.toLowerCase();
        if (lower.endsWith(".xlsx")) {
            return name.substring(0, name.length() - 5);
        }
        if (lower.endsWith(".xls")) {
            return name.substring(0, name.length() - 4);
        }
        return name;
    }
}
