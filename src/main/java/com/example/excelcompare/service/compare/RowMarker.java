package com.example.excelcompare.service.compare;

public record RowMarker(int rowNo, CompositeKey key, String note) {
}
