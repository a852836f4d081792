package com.example.excelcompare.service.compare;

public class ExcelCompareException extends RuntimeException {

    public ExcelCompareException(String message) {
        super(message);
    }

    public ExcelCompareException(String message, Throwable cause) {
        super(message, cause);
    }
}
