package com.example.excelcompare.service.compare;

import java.util.List;

public record SchemaReconciliation(
        List<String> sharedColumns,
        List<String> onlyLeftColumns,
        List<String> onlyRightColumns
) {

    public SchemaReconciliation {
        sharedColumns = List.copyOf(sharedColumns);
        onlyLeftColumns = List.copyOf(onlyLeftColumns);
        onlyRightColumns = List.copyOf(onlyRightColumns);
    }

    public boolean hasMismatch() {
        return !onlyLeftColumns.isEmpty() || !onlyRightColumns.isEmpty();
    }
}
