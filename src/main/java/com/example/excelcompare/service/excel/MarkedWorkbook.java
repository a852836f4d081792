package com.example.excelcompare.service.excel;

public record MarkedWorkbook(
        byte[] content,
        String extension,
        String contentType
) {
    static final String XLSX_CONTENT_TYPE = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";
    static final String XLS_CONTENT_TYPE = "application/vnd.ms-excel";
}
