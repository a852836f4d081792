package com.example.excelcompare.service.compare;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class SetPartitioner {

    public PartitionResult partition(RowIndex left, RowIndex right) {
        List<CompositeKey> onlyLeft = new ArrayList<>();
        List<CompositeKey> common = new ArrayList<>();
        for (CompositeKey key : left.keys()) {
            if (right.contains(key)) {
                common.add(key);
            } else {
                onlyLeft.add(key);
            }
        }

        List<CompositeKey> onlyRight = new ArrayList<>();
        for (CompositeKey key : right.keys()) {
            if (!left.contains(key)) {
                onlyRight.add(key);
            }
        }
        return new PartitionResult(onlyLeft, onlyRight, common);
    }
}
