package com.example.excelcompare.service.compare;

public record CellDiff(
        CompositeKey key,
        String column,
        CellValue leftValue,
        CellValue rightValue,
        int leftRowNo,
        int rightRowNo
) {

    // 换成以文件2为视角
    public CellDiff swap() {
        return new CellDiff(key, column, rightValue, leftValue, rightRowNo, leftRowNo);
    }
}
