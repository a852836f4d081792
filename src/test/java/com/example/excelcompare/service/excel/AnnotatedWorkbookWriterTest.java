package com.example.excelcompare.service.excel;

import com.example.excelcompare.service.compare.AnnotatedTable;
import com.example.excelcompare.service.compare.ComparisonResult;
import com.example.excelcompare.service.compare.SheetTable;
import com.example.excelcompare.service.compare.TableComparator;
import com.example.excelcompare.service.compare.TableSide;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Comment;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AnnotatedWorkbookWriterTest {

    @TempDir
    Path tempDir;

    private final ExcelTableLoader loader = new ExcelTableLoader();
    private final TableComparator comparator = TableComparator.create();
    private final AnnotatedWorkbookWriter writer = new AnnotatedWorkbookWriter();

    private Path leftFile;
    private ComparisonResult result;

    @BeforeEach
    void setUp() throws Exception {
        Map<String, List<List<Object>>> leftSheets = new LinkedHashMap<>();
        leftSheets.put("Notes", List.of(List.of("keep out")));
        leftSheets.put("Data", List.of(
                List.of("id", "name", "qty"),
                List.of(1, "Ann", 10),
                List.of(2, "Bob", 20)
        ));
        leftFile = WorkbookFixtures.write(tempDir.resolve("left.xlsx"), leftSheets);
        Path rightFile = WorkbookFixtures.write(tempDir.resolve("right.xlsx"), "Data", List.of(
                List.of("id", "name", "qty"),
                List.of(1, "Anne", 10),
                List.of(3, "Cid", 30)
        ));

        SheetTable left = loader.load(leftFile, "Data");
        SheetTable right = loader.load(rightFile, "Data");
        result = comparator.compare(left, right, List.of("id"));
    }

    @Test
    void unique_rows_are_filled_and_noted_on_the_first_key_cell() throws Exception {
        MarkedWorkbook marked = writer.write(leftFile, comparator.annotate(result, TableSide.LEFT));

        assertEquals(".xlsx", marked.extension());
        try (Workbook workbook = WorkbookFixtures.read(marked.content())) {
            Sheet sheet = workbook.getSheetAt(0);
            for (int c = 0; c < 3; c++) {
                Cell cell = sheet.getRow(2).getCell(c);
                assertEquals(FillPatternType.SOLID_FOREGROUND, cell.getCellStyle().getFillPattern());
                assertEquals(IndexedColors.LIGHT_GREEN.getIndex(), cell.getCellStyle().getFillForegroundColor());
            }
            Comment comment = sheet.getRow(2).getCell(0).getCellComment();
            assertNotNull(comment);
            assertEquals("仅在此文件中存在的行", comment.getString().getString());
            assertEquals(AnnotatedWorkbookWriter.COMMENT_AUTHOR, comment.getAuthor());
        }
    }

    @Test
    void changed_cells_are_highlighted_with_the_counterpart_value() throws Exception {
        MarkedWorkbook marked = writer.write(leftFile, comparator.annotate(result, TableSide.LEFT));

        try (Workbook workbook = WorkbookFixtures.read(marked.content())) {
            Sheet sheet = workbook.getSheetAt(0);
            Cell changed = sheet.getRow(1).getCell(1);
            assertEquals("Ann", changed.getStringCellValue());
            assertEquals(IndexedColors.YELLOW.getIndex(), changed.getCellStyle().getFillForegroundColor());
            assertEquals(IndexedColors.RED.getIndex(),
                    workbook.getFontAt(changed.getCellStyle().getFontIndex()).getColor());
            assertEquals("与文件2第2行[name]列不同\n文件2值: Anne", changed.getCellComment().getString().getString());

            Cell untouched = sheet.getRow(1).getCell(2);
            assertEquals(10.0, untouched.getNumericCellValue());
            assertNull(untouched.getCellComment());
            assertEquals(FillPatternType.NO_FILL, untouched.getCellStyle().getFillPattern());
        }
    }

    @Test
    void only_the_compared_sheet_is_kept() throws Exception {
        AnnotatedTable annotated = comparator.annotate(result, TableSide.LEFT);

        try (Workbook workbook = WorkbookFixtures.read(writer.write(leftFile, annotated).content())) {
            assertEquals(1, workbook.getNumberOfSheets());
            assertEquals("Data", workbook.getSheetName(0));
        }
    }
}
