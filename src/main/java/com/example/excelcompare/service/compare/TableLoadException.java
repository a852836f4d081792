package com.example.excelcompare.service.compare;

public class TableLoadException extends ExcelCompareException {

    public TableLoadException(String message) {
        super(message);
    }

    public TableLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
