package com.example.excelcompare.service;

public record MarkedFile(
        String downloadName,
        String contentType,
        byte[] content
) {
}
