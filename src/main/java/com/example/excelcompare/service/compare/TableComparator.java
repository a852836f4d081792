package com.example.excelcompare.service.compare;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class TableComparator {

    private final RowIndexer rowIndexer;
    private final SetPartitioner setPartitioner;
    private final SchemaReconciler schemaReconciler;
    private final CellDiffer cellDiffer;
    private final Annotator annotator;

    public static TableComparator create() {
        ValueNormalizer normalizer = new ValueNormalizer();
        return new TableComparator(
                new RowIndexer(new KeyExtractor(normalizer)),
                new SetPartitioner(),
                new SchemaReconciler(),
                new CellDiffer(normalizer),
                new Annotator()
        );
    }

    public ComparisonResult compare(SheetTable left, SheetTable right, List<String> keyColumns) {
        List<String> keys = validateKeyColumns(left, right, keyColumns);

        RowIndex leftIndex = rowIndexer.index(left, keys);
        RowIndex rightIndex = rowIndexer.index(right, keys);
        PartitionResult partition = setPartitioner.partition(leftIndex, rightIndex);
        log.info("行级别统计：仅在文件1 {}，仅在文件2 {}，共有 {}",
                partition.onlyLeft().size(), partition.onlyRight().size(), partition.common().size());

        SchemaReconciliation schema = schemaReconciler.reconcile(left, right);
        List<CellDiff> diffs = new ArrayList<>();
        for (CompositeKey key : partition.common()) {
            diffs.addAll(cellDiffer.diff(key, leftIndex.row(key), rightIndex.row(key), schema.sharedColumns()));
        }
        log.info("共有行差异单元格 {} 个", diffs.size());

        return new ComparisonResult(left, right, keys, leftIndex, rightIndex, partition, schema, diffs);
    }

    public AnnotatedTable annotate(ComparisonResult result, TableSide side) {
        return annotator.annotate(
                result.table(side),
                result.index(side),
                result.partition().uniqueTo(side),
                result.diffsFrom(side),
                side,
                result.keyColumns()
        );
    }

    private List<String> validateKeyColumns(SheetTable left, SheetTable right, List<String> keyColumns) {
        if (keyColumns == null || keyColumns.isEmpty()) {
            throw new MissingColumnException("请至少指定一个组合键列。");
        }
        List<String> keys = new ArrayList<>(new LinkedHashSet<>(keyColumns));
        for (String column : keys) {
            if (!left.hasColumn(column)) {
                throw new MissingColumnException(left.sourceName(), column);
            }
            if (!right.hasColumn(column)) {
                throw new MissingColumnException(right.sourceName(), column);
            }
        }
        return keys;
    }
}
