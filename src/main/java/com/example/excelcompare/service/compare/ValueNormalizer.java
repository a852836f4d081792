package com.example.excelcompare.service.compare;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.regex.Pattern;

@Component
public class ValueNormalizer {

    // 超出该范围的指数展开后过长，按文本比较
    private static final int MAX_PLAIN_SCALE = 1000;
    private static final Pattern DECIMAL_PATTERN = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");

    public String normalize(CellValue value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        if (value.type() == ValueType.TEXT) {
            return normalizeText((String) value.value());
        }
        return value.display();
    }

    public boolean equivalent(CellValue left, CellValue right) {
        return normalize(left).equals(normalize(right));
    }

    private String normalizeText(String raw) {
        String s = raw.trim();
        if (s.isBlank()) {
            return "";
        }
        if (!DECIMAL_PATTERN.matcher(s).matches()) {
            return s;
        }
        // 数字文本与数值单元格统一：去掉尾随零，"007" 与 7 视为同一值
        BigDecimal number;
        try {
            number = new BigDecimal(s).stripTrailingZeros();
        } catch (NumberFormatException e) {
            return s;
        }
        if (Math.abs((long) number.scale()) > MAX_PLAIN_SCALE) {
            return s;
        }
        return number.toPlainString();
    }
}
