package com.example.excelcompare.service;

public record CompareResponse(
        String result,
        String resultId,
        boolean hasMarkedFiles,
        int onlyInFile1,
        int onlyInFile2,
        long commonWithDiff
) {
}
