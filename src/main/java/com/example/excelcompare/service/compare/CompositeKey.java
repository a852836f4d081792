package com.example.excelcompare.service.compare;

import java.util.List;

public record CompositeKey(List<String> parts) {

    static final String SEPARATOR = "||";

    public CompositeKey {
        parts = List.copyOf(parts);
    }

    public static CompositeKey of(String... parts) {
        return new CompositeKey(List.of(parts));
    }

    public String display() {
        return String.join(SEPARATOR, parts);
    }

    @Override
    public String toString() {
        return display();
    }
}
