package com.example.excelcompare.service.compare;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record SheetTable(
        String sourceName,
        String sheetName,
        List<String> columns,
        Map<String, Integer> columnPositions,
        int headerRowNo,
        List<TableRow> rows
) {

    public SheetTable {
        columns = List.copyOf(columns);
        columnPositions = Map.copyOf(columnPositions);
        rows = List.copyOf(rows);
    }

    public boolean hasColumn(String column) {
        return columnPositions.containsKey(column);
    }

    public int columnPosition(String column) {
        Integer position = columnPositions.get(column);
        if (position == null) {
            throw new MissingColumnException(sourceName, column);
        }
        return position;
    }

    // 表头在第1行，数据从第2行起
    public static SheetTable of(String sourceName, String sheetName, List<String> columns,
                                List<Map<String, CellValue>> rows) {
        Map<String, Integer> positions = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            positions.put(columns.get(i), i);
        }
        List<TableRow> tableRows = new ArrayList<>();
        for (int r = 0; r < rows.size(); r++) {
            Map<String, CellValue> values = new LinkedHashMap<>();
            for (String column : columns) {
                CellValue value = rows.get(r).get(column);
                values.put(column, value == null ? CellValue.empty() : value);
            }
            tableRows.add(new TableRow(r + 2, values));
        }
        return new SheetTable(sourceName, sheetName, columns, positions, 1, tableRows);
    }
}
