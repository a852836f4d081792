package com.example.excelcompare.service.compare;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.excelcompare.service.compare.TestTables.*;
import static org.junit.jupiter.api.Assertions.*;

class RowIndexerTest {

    private final RowIndexer indexer = new RowIndexer(new KeyExtractor(new ValueNormalizer()));

    @Test
    void keys_keep_sheet_order() {
        SheetTable t = table("L", cols("id", "v"), row(3, "c"), row(1, "a"), row(2, "b"));

        RowIndex index = indexer.index(t, List.of("id"));

        assertEquals(List.of(CompositeKey.of("3"), CompositeKey.of("1"), CompositeKey.of("2")), index.keys());
        assertEquals(3, index.size());
        assertTrue(index.duplicates().isEmpty());
    }

    @Test
    void duplicate_key_keeps_first_row_and_is_reported() {
        SheetTable t = table("L", cols("id", "v"), row(1, "x"), row(1, "y"));

        RowIndex index = indexer.index(t, List.of("id"));

        assertEquals(1, index.size());
        assertEquals("x", index.row(CompositeKey.of("1")).get("v").display());
        assertEquals(1, index.duplicates().size());
        DuplicateKey duplicate = index.duplicates().get(0);
        assertEquals(CompositeKey.of("1"), duplicate.key());
        assertEquals(List.of(2, 3), duplicate.rowNos());
        assertEquals(2, duplicate.occurrences());
    }

    @Test
    void duplicates_are_listed_in_first_appearance_order() {
        SheetTable t = table("L", cols("id"), row(5), row(4), row(4), row(5), row(5));

        RowIndex index = indexer.index(t, List.of("id"));

        assertEquals(2, index.duplicates().size());
        assertEquals(CompositeKey.of("5"), index.duplicates().get(0).key());
        assertEquals(List.of(2, 5, 6), index.duplicates().get(0).rowNos());
        assertEquals(CompositeKey.of("4"), index.duplicates().get(1).key());
    }
}
