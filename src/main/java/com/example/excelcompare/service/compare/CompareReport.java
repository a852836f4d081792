package com.example.excelcompare.service.compare;

import java.util.List;

public record CompareReport(
        TableSummary left,
        TableSummary right,
        int commonRows,
        long rowsWithDifferences,
        List<String> lines
) {

    public CompareReport {
        lines = List.copyOf(lines);
    }

    public String render() {
        return String.join("\n", lines);
    }
}
