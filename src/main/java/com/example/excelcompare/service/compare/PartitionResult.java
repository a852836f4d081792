package com.example.excelcompare.service.compare;

import java.util.List;

// onlyLeft、common 按文件1出现顺序，onlyRight 按文件2出现顺序
public record PartitionResult(
        List<CompositeKey> onlyLeft,
        List<CompositeKey> onlyRight,
        List<CompositeKey> common
) {

    public PartitionResult {
        onlyLeft = List.copyOf(onlyLeft);
        onlyRight = List.copyOf(onlyRight);
        common = List.copyOf(common);
    }

    public List<CompositeKey> uniqueTo(TableSide side) {
        return side == TableSide.LEFT ? onlyLeft : onlyRight;
    }
}
