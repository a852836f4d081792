package com.example.excelcompare.service.compare;

public enum TableSide {
    LEFT(1),
    RIGHT(2);

    private final int fileNo;

    TableSide(int fileNo) {
        this.fileNo = fileNo;
    }

    public int fileNo() {
        return fileNo;
    }

    public TableSide opposite() {
        return this == LEFT ? RIGHT : LEFT;
    }
}
