package com.example.excelcompare.service.compare;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
public class SchemaReconciler {

    public SchemaReconciliation reconcile(SheetTable left, SheetTable right) {
        List<String> shared = new ArrayList<>();
        List<String> onlyLeft = new ArrayList<>();
        for (String column : left.columns()) {
            if (right.hasColumn(column)) {
                shared.add(column);
            } else {
                onlyLeft.add(column);
            }
        }
        List<String> onlyRight = right.columns().stream()
                .filter(column -> !left.hasColumn(column))
                .toList();

        SchemaReconciliation schema = new SchemaReconciliation(shared, onlyLeft, onlyRight);
        if (schema.hasMismatch()) {
            log.warn("列不一致：仅在{}中 {}，仅在{}中 {}",
                    left.sourceName(), onlyLeft, right.sourceName(), onlyRight);
        }
        return schema;
    }
}
