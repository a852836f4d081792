package com.example.excelcompare.service.compare;

import java.util.List;
import java.util.Optional;

public record AnnotatedTable(
        SheetTable table,
        TableSide side,
        List<String> keyColumns,
        List<RowMarker> rowMarkers,
        List<CellMarker> cellMarkers
) {

    public AnnotatedTable {
        keyColumns = List.copyOf(keyColumns);
        rowMarkers = List.copyOf(rowMarkers);
        cellMarkers = List.copyOf(cellMarkers);
    }

    public Optional<RowMarker> rowMarker(int rowNo) {
        return rowMarkers.stream().filter(m -> m.rowNo() == rowNo).findFirst();
    }

    public Optional<CellMarker> cellMarker(int rowNo, String column) {
        return cellMarkers.stream()
                .filter(m -> m.rowNo() == rowNo && m.column().equals(column))
                .findFirst();
    }
}
