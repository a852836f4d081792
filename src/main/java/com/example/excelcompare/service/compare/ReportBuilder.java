package com.example.excelcompare.service.compare;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

// 报告正文不含时间戳，相同输入得到相同输出
@Component
public class ReportBuilder {

    static final String BANNER = "=".repeat(60);
    static final String SEPARATOR = "-".repeat(60);

    public CompareReport build(ComparisonResult result) {
        SheetTable left = result.left();
        SheetTable right = result.right();
        PartitionResult partition = result.partition();
        int differingCells = result.cellDiffs().size();

        TableSummary leftSummary = summarize(left, result.leftIndex(), partition.onlyLeft().size(), differingCells);
        TableSummary rightSummary = summarize(right, result.rightIndex(), partition.onlyRight().size(), differingCells);
        long rowsWithDifferences = result.rowsWithDifferences();

        List<String> lines = new ArrayList<>();
        lines.add(BANNER);
        lines.add("Excel文件对比结果");
        lines.add(BANNER);
        lines.add("文件1: " + left.sourceName() + " (Sheet: " + left.sheetName() + ")");
        lines.add("文件2: " + right.sourceName() + " (Sheet: " + right.sheetName() + ")");
        lines.add("组合键列: " + result.keyColumns());
        lines.add(SEPARATOR);
        lines.add("文件1行数: " + leftSummary.rowCount() + ", 列数: " + leftSummary.columnCount());
        lines.add("文件2行数: " + rightSummary.rowCount() + ", 列数: " + rightSummary.columnCount());

        lines.add(SEPARATOR);
        lines.add("行级别差异统计:");
        lines.add("  仅在文件1中存在的行: " + partition.onlyLeft().size());
        lines.add("  仅在文件2中存在的行: " + partition.onlyRight().size());
        lines.add("  两文件共有的行: " + partition.common().size());
        lines.add("  存在差异的共有行: " + rowsWithDifferences);
        lines.add("  差异单元格数: " + differingCells);
        lines.add("  文件1重复键: " + leftSummary.duplicateKeys());
        lines.add("  文件2重复键: " + rightSummary.duplicateKeys());

        appendUniqueRows(lines, TableSide.LEFT, partition.onlyLeft(), result.leftIndex());
        appendUniqueRows(lines, TableSide.RIGHT, partition.onlyRight(), result.rightIndex());
        appendCellDiffs(lines, result.cellDiffs());
        appendDuplicates(lines, TableSide.LEFT, result.leftIndex().duplicates());
        appendDuplicates(lines, TableSide.RIGHT, result.rightIndex().duplicates());
        appendSchema(lines, result.schema());

        lines.add(BANNER);
        lines.add("对比完成");
        lines.add(BANNER);

        return new CompareReport(leftSummary, rightSummary, partition.common().size(), rowsWithDifferences, lines);
    }

    private TableSummary summarize(SheetTable table, RowIndex index, int uniqueRows, int differingCells) {
        return new TableSummary(
                table.sourceName(),
                table.sheetName(),
                table.rows().size(),
                table.columns().size(),
                uniqueRows,
                differingCells,
                index.duplicates().size()
        );
    }

    private void appendUniqueRows(List<String> lines, TableSide side, List<CompositeKey> keys, RowIndex index) {
        if (keys.isEmpty()) {
            return;
        }
        int fileNo = side.fileNo();
        lines.add(SEPARATOR);
        lines.add("仅在文件" + fileNo + "中存在的行:");
        for (CompositeKey key : keys) {
            lines.add("  [文件" + fileNo + "第" + index.row(key).rowNo() + "行] 键值: " + key.display());
        }
    }

    private void appendCellDiffs(List<String> lines, List<CellDiff> diffs) {
        lines.add(SEPARATOR);
        lines.add("共有行的数据差异:");
        if (diffs.isEmpty()) {
            lines.add("  无数据差异");
            return;
        }
        // diffs 已按共有键顺序、列顺序排列
        Map<CompositeKey, List<CellDiff>> byKey = new LinkedHashMap<>();
        for (CellDiff diff : diffs) {
            byKey.computeIfAbsent(diff.key(), k -> new ArrayList<>()).add(diff);
        }
        for (Map.Entry<CompositeKey, List<CellDiff>> entry : byKey.entrySet()) {
            CellDiff first = entry.getValue().get(0);
            lines.add("  键值: " + entry.getKey().display()
                    + " [文件1第" + first.leftRowNo() + "行 vs 文件2第" + first.rightRowNo() + "行]");
            for (CellDiff diff : entry.getValue()) {
                lines.add("    列[" + diff.column() + "]: 文件1='" + diff.leftValue().display()
                        + "' vs 文件2='" + diff.rightValue().display() + "'");
            }
        }
    }

    private void appendDuplicates(List<String> lines, TableSide side, List<DuplicateKey> duplicates) {
        if (duplicates.isEmpty()) {
            return;
        }
        int fileNo = side.fileNo();
        lines.add(SEPARATOR);
        lines.add("文件" + fileNo + "中的重复键:");
        for (DuplicateKey duplicate : duplicates) {
            String rows = duplicate.rowNos().stream()
                    .map(String::valueOf)
                    .collect(Collectors.joining(", "));
            lines.add("  键值: " + duplicate.key().display() + " 出现" + duplicate.occurrences()
                    + "次 (第" + rows + "行)，以第" + duplicate.rowNos().get(0) + "行参与对比");
        }
    }

    private void appendSchema(List<String> lines, SchemaReconciliation schema) {
        if (!schema.hasMismatch()) {
            return;
        }
        lines.add(SEPARATOR);
        lines.add("列级别差异:");
        if (!schema.onlyLeftColumns().isEmpty()) {
            lines.add("  仅在文件1中存在的列: " + schema.onlyLeftColumns());
        }
        if (!schema.onlyRightColumns().isEmpty()) {
            lines.add("  仅在文件2中存在的列: " + schema.onlyRightColumns());
        }
    }
}
