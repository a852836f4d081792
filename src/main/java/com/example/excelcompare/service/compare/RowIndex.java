package com.example.excelcompare.service.compare;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class RowIndex {

    private final Map<CompositeKey, TableRow> rowsByKey;
    private final List<DuplicateKey> duplicates;

    RowIndex(LinkedHashMap<CompositeKey, TableRow> rowsByKey, List<DuplicateKey> duplicates) {
        this.rowsByKey = Collections.unmodifiableMap(rowsByKey);
        this.duplicates = List.copyOf(duplicates);
    }

    public List<CompositeKey> keys() {
        return List.copyOf(rowsByKey.keySet());
    }

    public boolean contains(CompositeKey key) {
        return rowsByKey.containsKey(key);
    }

    public TableRow row(CompositeKey key) {
        return rowsByKey.get(key);
    }

    public int size() {
        return rowsByKey.size();
    }

    public List<DuplicateKey> duplicates() {
        return duplicates;
    }
}
