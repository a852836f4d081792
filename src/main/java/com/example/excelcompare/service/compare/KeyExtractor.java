package com.example.excelcompare.service.compare;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@RequiredArgsConstructor
public class KeyExtractor {

    private final ValueNormalizer normalizer;

    public CompositeKey extract(TableRow row, List<String> keyColumns, String sourceName) {
        List<String> parts = new ArrayList<>(keyColumns.size());
        for (String column : keyColumns) {
            if (!row.hasColumn(column)) {
                throw new MissingColumnException(sourceName, column);
            }
            parts.add(normalizer.normalize(row.get(column)));
        }
        return new CompositeKey(parts);
    }
}
