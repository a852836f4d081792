package com.example.excelcompare.service.compare;

import java.util.List;

// cellDiffs 以文件1为视角，是差异单元格的唯一来源
public record ComparisonResult(
        SheetTable left,
        SheetTable right,
        List<String> keyColumns,
        RowIndex leftIndex,
        RowIndex rightIndex,
        PartitionResult partition,
        SchemaReconciliation schema,
        List<CellDiff> cellDiffs
) {

    public ComparisonResult {
        keyColumns = List.copyOf(keyColumns);
        cellDiffs = List.copyOf(cellDiffs);
    }

    public List<CellDiff> leftToRightDiffs() {
        return cellDiffs;
    }

    public List<CellDiff> rightToLeftDiffs() {
        return cellDiffs.stream().map(CellDiff::swap).toList();
    }

    public List<CellDiff> diffsFrom(TableSide side) {
        return side == TableSide.LEFT ? leftToRightDiffs() : rightToLeftDiffs();
    }

    public SheetTable table(TableSide side) {
        return side == TableSide.LEFT ? left : right;
    }

    public RowIndex index(TableSide side) {
        return side == TableSide.LEFT ? leftIndex : rightIndex;
    }

    public long rowsWithDifferences() {
        return cellDiffs.stream().map(CellDiff::key).distinct().count();
    }
}
