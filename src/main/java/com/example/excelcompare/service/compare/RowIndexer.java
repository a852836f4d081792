package com.example.excelcompare.service.compare;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// 重复键以首次出现的行为准，其余行记入 DuplicateKey
@Slf4j
@Component
@RequiredArgsConstructor
public class RowIndexer {

    private final KeyExtractor keyExtractor;

    public RowIndex index(SheetTable table, List<String> keyColumns) {
        LinkedHashMap<CompositeKey, TableRow> rowsByKey = new LinkedHashMap<>();
        Map<CompositeKey, List<Integer>> occurrences = new LinkedHashMap<>();

        for (TableRow row : table.rows()) {
            CompositeKey key = keyExtractor.extract(row, keyColumns, table.sourceName());
            rowsByKey.putIfAbsent(key, row);
            occurrences.computeIfAbsent(key, k -> new ArrayList<>(1)).add(row.rowNo());
        }

        List<DuplicateKey> duplicates = new ArrayList<>();
        for (Map.Entry<CompositeKey, List<Integer>> entry : occurrences.entrySet()) {
            if (entry.getValue().size() > 1) {
                duplicates.add(new DuplicateKey(entry.getKey(), entry.getValue()));
            }
        }
        if (!duplicates.isEmpty()) {
            log.warn("{} [{}] 存在 {} 个重复键，按首次出现的行参与对比",
                    table.sourceName(), table.sheetName(), duplicates.size());
        }
        return new RowIndex(rowsByKey, duplicates);
    }
}
