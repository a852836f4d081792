package com.example.excelcompare.service.compare;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

// rowNo 为 Excel 中显示的行号
public record TableRow(int rowNo, Map<String, CellValue> values) {

    public TableRow {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public boolean hasColumn(String column) {
        return values.containsKey(column);
    }

    public CellValue get(String column) {
        CellValue value = values.get(column);
        return value == null ? CellValue.empty() : value;
    }
}
