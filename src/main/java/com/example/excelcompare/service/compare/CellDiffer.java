package com.example.excelcompare.service.compare;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@RequiredArgsConstructor
public class CellDiffer {

    private final ValueNormalizer normalizer;

    public List<CellDiff> diff(CompositeKey key, TableRow left, TableRow right, List<String> sharedColumns) {
        List<CellDiff> diffs = new ArrayList<>();
        for (String column : sharedColumns) {
            CellValue leftValue = left.get(column);
            CellValue rightValue = right.get(column);
            if (!normalizer.equivalent(leftValue, rightValue)) {
                diffs.add(new CellDiff(key, column, leftValue, rightValue, left.rowNo(), right.rowNo()));
            }
        }
        return diffs;
    }
}
