package com.example.excelcompare.service.compare;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.LocalTime;

public record CellValue(ValueType type, Object value) {

    private static final CellValue EMPTY = new CellValue(ValueType.EMPTY, null);

    public static CellValue empty() {
        return EMPTY;
    }

    public static CellValue text(String text) {
        if (text == null) {
            return EMPTY;
        }
        return new CellValue(ValueType.TEXT, text);
    }

    public static CellValue number(BigDecimal number) {
        if (number == null) {
            return EMPTY;
        }
        return new CellValue(ValueType.NUMBER, number);
    }

    public static CellValue number(double number) {
        return number(BigDecimal.valueOf(number));
    }

    public static CellValue bool(boolean value) {
        return new CellValue(ValueType.BOOLEAN, value);
    }

    public static CellValue date(LocalDateTime dateTime) {
        if (dateTime == null) {
            return EMPTY;
        }
        return new CellValue(ValueType.DATE, dateTime);
    }

    public boolean isEmpty() {
        return type == ValueType.EMPTY;
    }

    public String display() {
        return switch (type) {
            case EMPTY -> "";
            case TEXT -> (String) value;
            case NUMBER -> ((BigDecimal) value).stripTrailingZeros().toPlainString();
            case BOOLEAN -> ((Boolean) value) ? "TRUE" : "FALSE";
            case DATE -> {
                LocalDateTime dt = (LocalDateTime) value;
                yield LocalTime.MIDNIGHT.equals(dt.toLocalTime())
                        ? dt.toLocalDate().toString()
                        : dt.toString();
            }
        };
    }

    @Override
    public String toString() {
        return display();
    }
}
