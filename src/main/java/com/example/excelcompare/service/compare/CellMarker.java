package com.example.excelcompare.service.compare;

public record CellMarker(int rowNo, String column, CellValue counterpartValue, String note) {
}
