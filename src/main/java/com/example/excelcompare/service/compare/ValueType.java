package com.example.excelcompare.service.compare;

public enum ValueType {
    EMPTY,
    TEXT,
    NUMBER,
    BOOLEAN,
    DATE
}
