package com.example.excelcompare.service.excel;

import com.example.excelcompare.service.compare.AnnotatedTable;
import com.example.excelcompare.service.compare.CellMarker;
import com.example.excelcompare.service.compare.RowMarker;
import com.example.excelcompare.service.compare.SheetTable;
import com.example.excelcompare.service.compare.TableLoadException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@Component
public class AnnotatedWorkbookWriter {
    static final String COMMENT_AUTHOR = "Excel对比工具";

    public MarkedWorkbook write(Path source, AnnotatedTable annotated) {
        SheetTable table = annotated.table();
        try (InputStream in = Files.newInputStream(source);
             Workbook workbook = WorkbookFactory.create(in)) {
            Sheet sheet = workbook.getSheet(table.sheetName());
            if (sheet == null) {
                throw new TableLoadException("生成标注文件失败: 不存在工作表 '" + table.sheetName() + "'");
            }
            // 只保留对比的 sheet
            for (int i = workbook.getNumberOfSheets() - 1; i >= 0; i--) {
                if (!workbook.getSheetName(i).equals(table.sheetName())) {
                    workbook.removeSheetAt(i);
                }
            }
            workbook.setActiveSheet(0);
            workbook.setSelectedTab(0);

            MarkerStyles styles = new MarkerStyles(workbook);
            Drawing<?> drawing = sheet.createDrawingPatriarch();
            CreationHelper helper = workbook.getCreationHelper();

            Integer noteColumn = annotated.keyColumns().isEmpty()
                    ? null
                    : table.columnPosition(annotated.keyColumns().get(0));
            for (RowMarker marker : annotated.rowMarkers()) {
                Row row = getOrCreateRow(sheet, marker.rowNo() - 1);
                for (Integer col : table.columnPositions().values()) {
                    Cell cell = getOrCreateCell(row, col);
                    cell.setCellStyle(styles.uniqueRow(cell.getCellStyle()));
                }
                if (noteColumn != null) {
                    attachComment(getOrCreateCell(row, noteColumn), marker.note(), drawing, helper);
                }
            }

            for (CellMarker marker : annotated.cellMarkers()) {
                Row row = getOrCreateRow(sheet, marker.rowNo() - 1);
                Cell cell = getOrCreateCell(row, table.columnPosition(marker.column()));
                cell.setCellStyle(styles.changedCell(cell.getCellStyle()));
                attachComment(cell, marker.note(), drawing, helper);
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            workbook.write(out);
            log.info("{} [{}] 标注完成：独有行 {}，差异单元格 {}", table.sourceName(), table.sheetName(),
                    annotated.rowMarkers().size(), annotated.cellMarkers().size());
            return workbook instanceof XSSFWorkbook
                    ? new MarkedWorkbook(out.toByteArray(), ".xlsx", MarkedWorkbook.XLSX_CONTENT_TYPE)
                    : new MarkedWorkbook(out.toByteArray(), ".xls", MarkedWorkbook.XLS_CONTENT_TYPE);
        } catch (IOException e) {
            throw new IllegalStateException("生成标注文件失败：" + e.getMessage(), e);
        }
    }

    private void attachComment(Cell cell, String note, Drawing<?> drawing, CreationHelper helper) {
        if (cell.getCellComment() != null) {
            cell.removeCellComment();
        }
        ClientAnchor anchor = helper.createClientAnchor();
        // 锚点起始于单元格本身，POI 以此定位批注所属单元格
        anchor.setCol1(cell.getColumnIndex());
        anchor.setCol2(cell.getColumnIndex() + 3);
        anchor.setRow1(cell.getRowIndex());
        anchor.setRow2(cell.getRowIndex() + 4);
        Comment comment = drawing.createCellComment(anchor);
        comment.setString(helper.createRichTextString(note));
        comment.setAuthor(COMMENT_AUTHOR);
        cell.setCellComment(comment);
    }

    private Row getOrCreateRow(Sheet sheet, int rowIndex) {
        Row row = sheet.getRow(rowIndex);
        return row == null ? sheet.createRow(rowIndex) : row;
    }

    private Cell getOrCreateCell(Row row, int col) {
        Cell cell = row.getCell(col);
        return cell == null ? row.createCell(col) : cell;
    }

    // 每种原样式只派生一次，避免超出工作簿样式数上限
    private static final class MarkerStyles {
        private final Workbook workbook;
        private final Map<Integer, CellStyle> uniqueRowStyles = new HashMap<>();
        private final Map<Integer, CellStyle> changedCellStyles = new HashMap<>();
        private final Map<Integer, Font> redFonts = new HashMap<>();

        MarkerStyles(Workbook workbook) {
            this.workbook = workbook;
        }

        CellStyle uniqueRow(CellStyle base) {
            return uniqueRowStyles.computeIfAbsent(base.getIndex() & 0xFFFF, k -> {
                CellStyle style = workbook.createCellStyle();
                style.cloneStyleFrom(base);
                style.setFillForegroundColor(IndexedColors.LIGHT_GREEN.getIndex());
                style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
                return style;
            });
        }

        CellStyle changedCell(CellStyle base) {
            return changedCellStyles.computeIfAbsent(base.getIndex() & 0xFFFF, k -> {
                CellStyle style = workbook.createCellStyle();
                style.cloneStyleFrom(base);
                style.setFillForegroundColor(IndexedColors.YELLOW.getIndex());
                style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
                style.setFont(redFont(base.getFontIndex()));
                return style;
            });
        }

        private Font redFont(int baseFontIndex) {
            return redFonts.computeIfAbsent(baseFontIndex, k -> {
                Font base = workbook.getFontAt(baseFontIndex);
                Font font = workbook.createFont();
                font.setFontName(base.getFontName());
                font.setFontHeight(base.getFontHeight());
                font.setBold(base.getBold());
                font.setItalic(base.getItalic());
                font.setUnderline(base.getUnderline());
                font.setColor(IndexedColors.RED.getIndex());
                return font;
            });
        }
    }
}
