package com.example.excelcompare.service.excel;

import com.example.excelcompare.service.compare.CellValue;
import com.example.excelcompare.service.compare.SheetTable;
import com.example.excelcompare.service.compare.TableLoadException;
import com.example.excelcompare.service.compare.TableRow;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

@Slf4j
@Component
public class ExcelTableLoader {
    private static final int HEADER_SCAN_LIMIT = 30;

    public Map<String, List<String>> describe(Path file) {
        try (Workbook workbook = open(file)) {
            DataFormatter fmt = new DataFormatter();
            Map<String, List<String>> sheets = new LinkedHashMap<>();
            for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                Sheet sheet = workbook.getSheetAt(i);
                int headerRow = findFirstNonEmptyRow(sheet, fmt);
                List<String> columns = headerRow < 0
                        ? List.of()
                        : List.copyOf(buildColumnMapping(sheet.getRow(headerRow), fmt).keySet());
                sheets.put(sheet.getSheetName(), columns);
            }
            return sheets;
        } catch (IOException e) {
            throw new TableLoadException("读取文件失败: " + file.getFileName() + " (" + e.getMessage() + ")", e);
        }
    }

    public SheetTable load(Path file, String sheetName) {
        return load(file, sheetName, file.getFileName().toString());
    }

    public SheetTable load(Path file, String sheetName, String sourceName) {
        try (Workbook workbook = open(file)) {
            Sheet sheet = workbook.getSheet(sheetName);
            if (sheet == null) {
                throw new TableLoadException("加载文件失败: " + sourceName + " 中不存在工作表 '" + sheetName + "'");
            }
            DataFormatter fmt = new DataFormatter();
            int headerRow = findFirstNonEmptyRow(sheet, fmt);
            if (headerRow < 0) {
                throw new TableLoadException("加载文件失败: " + sourceName + " [" + sheetName + "] 未找到表头行");
            }
            Map<String, Integer> columnMap = buildColumnMapping(sheet.getRow(headerRow), fmt);
            List<String> columns = List.copyOf(columnMap.keySet());

            List<TableRow> rows = new ArrayList<>();
            for (int r = headerRow + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (isRowBlank(row, fmt)) {
                    continue;
                }
                Map<String, CellValue> values = new LinkedHashMap<>();
                for (Map.Entry<String, Integer> column : columnMap.entrySet()) {
                    values.put(column.getKey(), readCell(row.getCell(column.getValue())));
                }
                rows.add(new TableRow(r + 1, values));
            }
            log.info("{} [{}] 行数: {}, 列数: {}", sourceName, sheetName, rows.size(), columns.size());
            return new SheetTable(sourceName, sheetName, columns, columnMap, headerRow + 1, rows);
        } catch (IOException e) {
            throw new TableLoadException("加载文件失败: " + sourceName + " (" + e.getMessage() + ")", e);
        }
    }

    private Workbook open(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new TableLoadException("加载文件失败: 文件不存在 " + file);
        }
        try {
            return WorkbookFactory.create(file.toFile(), null, true);
        } catch (IOException | RuntimeException e) {
            throw new TableLoadException("加载文件失败: " + file.getFileName() + " 不是有效的Excel文件 (" + e.getMessage() + ")", e);
        }
    }

    CellValue readCell(Cell cell) {
        if (cell == null) {
            return CellValue.empty();
        }
        CellType cellType = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();
        return switch (cellType) {
            case STRING -> CellValue.text(cell.getStringCellValue());
            case NUMERIC -> DateUtil.isCellDateFormatted(cell)
                    ? CellValue.date(cell.getLocalDateTimeCellValue())
                    : CellValue.number(BigDecimal.valueOf(cell.getNumericCellValue()));
            case BOOLEAN -> CellValue.bool(cell.getBooleanCellValue());
            case ERROR -> CellValue.text(FormulaError.forInt(cell.getErrorCellValue()).getString());
            default -> CellValue.empty();
        };
    }

    private int findFirstNonEmptyRow(Sheet sheet, DataFormatter fmt) {
        int first = sheet.getFirstRowNum();
        int last = Math.min(sheet.getLastRowNum(), first + HEADER_SCAN_LIMIT);
        for (int r = first; r <= last; r++) {
            if (!isRowBlank(sheet.getRow(r), fmt)) {
                return r;
            }
        }
        return -1;
    }

    // 跳过空表头；重复表头加 .1、.2 后缀
    private Map<String, Integer> buildColumnMapping(Row headerRow, DataFormatter fmt) {
        Map<String, Integer> map = new LinkedHashMap<>();
        if (headerRow == null || headerRow.getFirstCellNum() < 0) {
            return map;
        }
        Set<String> headerNames = new HashSet<>();
        for (int c = headerRow.getFirstCellNum(); c < headerRow.getLastCellNum(); c++) {
            String name = headerName(headerRow.getCell(c), fmt);
            if (!name.isEmpty()) {
                headerNames.add(name);
            }
        }
        Map<String, Integer> suffixes = new HashMap<>();
        for (int c = headerRow.getFirstCellNum(); c < headerRow.getLastCellNum(); c++) {
            String name = headerName(headerRow.getCell(c), fmt);
            if (name.isEmpty()) {
                continue;
            }
            if (map.containsKey(name)) {
                // 后缀不能与已有表头或后面出现的表头同名
                String renamed;
                int n = suffixes.getOrDefault(name, 0);
                do {
                    n++;
                    renamed = name + "." + n;
                } while (map.containsKey(renamed) || headerNames.contains(renamed));
                suffixes.put(name, n);
                log.warn("表头列重复: {}，第{}列重命名为 {}", name, c + 1, renamed);
                name = renamed;
            }
            map.put(name, c);
        }
        return map;
    }

    private String headerName(Cell cell, DataFormatter fmt) {
        return cell == null ? "" : fmt.formatCellValue(cell).trim();
    }

    private boolean isRowBlank(Row row, DataFormatter fmt) {
        if (row == null || row.getFirstCellNum() < 0) {
            return true;
        }
        for (int c = row.getFirstCellNum(); c < row.getLastCellNum(); c++) {
            Cell cell = row.getCell(c);
            String v = cell == null ? "" : fmt.formatCellValue(cell);
            if (v != null && !v.trim().isBlank()) {
                return false;
            }
        }
        return true;
    }
}
