package com.example.excelcompare.service.compare;

import java.util.List;

public record DuplicateKey(CompositeKey key, List<Integer> rowNos) {

    public DuplicateKey {
        rowNos = List.copyOf(rowNos);
    }

    public int occurrences() {
        return rowNos.size();
    }
}
