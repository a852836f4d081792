package com.example.excelcompare.service.compare;

public record TableSummary(
        String sourceName,
        String sheetName,
        int rowCount,
        int columnCount,
        int uniqueRows,
        int differingCells,
        int duplicateKeys
) {
}
