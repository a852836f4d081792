package com.example.excelcompare.service.compare;

public class MissingColumnException extends ExcelCompareException {

    private final String sourceName;
    private final String column;

    public MissingColumnException(String sourceName, String column) {
        super(sourceName + "中不存在列: " + column);
        this.sourceName = sourceName;
        this.column = column;
    }

    public MissingColumnException(String message) {
        super(message);
        this.sourceName = null;
        this.column = null;
    }

    public String getSourceName() {
        return sourceName;
    }

    public String getColumn() {
        return column;
    }
}
