package com.example.excelcompare.service.compare;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class Annotator {

    static final String UNIQUE_ROW_NOTE = "仅在此文件中存在的行";

    public AnnotatedTable annotate(SheetTable table, RowIndex index, List<CompositeKey> uniqueKeys,
                                   List<CellDiff> diffs, TableSide side, List<String> keyColumns) {
        List<RowMarker> rowMarkers = new ArrayList<>(uniqueKeys.size());
        for (CompositeKey key : uniqueKeys) {
            TableRow row = index.row(key);
            if (row == null) {
                throw new IllegalArgumentException("键值不属于" + table.sourceName() + ": " + key);
            }
            rowMarkers.add(new RowMarker(row.rowNo(), key, UNIQUE_ROW_NOTE));
        }

        int otherFileNo = side.opposite().fileNo();
        List<CellMarker> cellMarkers = new ArrayList<>(diffs.size());
        for (CellDiff diff : diffs) {
            if (!table.hasColumn(diff.column())) {
                continue;
            }
            String note = "与文件" + otherFileNo + "第" + diff.rightRowNo() + "行[" + diff.column() + "]列不同\n"
                    + "文件" + otherFileNo + "值: " + diff.rightValue().display();
            cellMarkers.add(new CellMarker(diff.leftRowNo(), diff.column(), diff.rightValue(), note));
        }
        return new AnnotatedTable(table, side, keyColumns, rowMarkers, cellMarkers);
    }
}
