package com.example.excelcompare.cli;

import com.example.excelcompare.service.compare.CompareReport;
import com.example.excelcompare.service.compare.ComparisonResult;
import com.example.excelcompare.service.compare.ExcelCompareException;
import com.example.excelcompare.service.compare.ReportBuilder;
import com.example.excelcompare.service.compare.SheetTable;
import com.example.excelcompare.service.compare.TableComparator;
import com.example.excelcompare.service.compare.TableSide;
import com.example.excelcompare.service.excel.AnnotatedWorkbookWriter;
import com.example.excelcompare.service.excel.ExcelTableLoader;
import com.example.excelcompare.service.excel.MarkedWorkbook;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

// 命令行对比，不启动 Spring。退出码：0 完成，1 加载失败或缺列，2 参数错误
@Slf4j
public class ExcelCompareCli {
    public static final String COMMAND = "compare";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ExcelTableLoader tableLoader;
    private final TableComparator tableComparator;
    private final ReportBuilder reportBuilder;
    private final AnnotatedWorkbookWriter workbookWriter;

    public ExcelCompareCli() {
        this(new ExcelTableLoader(), TableComparator.create(), new ReportBuilder(), new AnnotatedWorkbookWriter());
    }

    ExcelCompareCli(ExcelTableLoader tableLoader, TableComparator tableComparator,
                    ReportBuilder reportBuilder, AnnotatedWorkbookWriter workbookWriter) {
        this.tableLoader = tableLoader;
        this.tableComparator = tableComparator;
        this.reportBuilder = reportBuilder;
        this.workbookWriter = workbookWriter;
    }

    public static void main(String[] args) {
        System.exit(new ExcelCompareCli().run(args));
    }

    public int run(String[] args) {
        CliArgs cli;
        try {
            cli = CliArgs.parse(args);
        } catch (IllegalArgumentException e) {
            log.error(e.getMessage());
            log.error(CliArgs.usage());
            return EXIT_USAGE;
        }

        Path output = cli.output() != null
                ? Path.of(cli.output())
                : Path.of("compare_result_" + LocalDateTime.now().format(FILE_TIMESTAMP) + ".log");
        Path file1 = Path.of(cli.file1());
        Path file2 = Path.of(cli.file2());
        log.info("文件1: {} (Sheet: {})", file1, cli.sheet1());
        log.info("文件2: {} (Sheet: {})", file2, cli.sheet2());
        log.info("组合键列: {}", cli.keys());

        ComparisonResult result;
        CompareReport report;
        try {
            SheetTable left = tableLoader.load(file1, cli.sheet1(), file1.toString());
            SheetTable right = tableLoader.load(file2, cli.sheet2(), file2.toString());
            result = tableComparator.compare(left, right, cli.keys());
            report = reportBuilder.build(result);
        } catch (ExcelCompareException e) {
            log.error(e.getMessage());
            writeText(output, e.getMessage());
            return EXIT_FAILED;
        }

        report.lines().forEach(log::info);
        if (!writeText(output, report.render())) {
            return EXIT_FAILED;
        }
        if (cli.markedDir() != null) {
            writeMarked(Path.of(cli.markedDir()), result, file1, file2);
        }
        log.info("对比结果已保存到: {}", output);
        return EXIT_OK;
    }

    private boolean writeText(Path output, String text) {
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, text + System.lineSeparator(), StandardCharsets.UTF_8);
            return true;
        } catch (IOException e) {
            log.error("写入结果文件失败 {}: {}", output, e.getMessage());
            return false;
        }
    }

    private void writeMarked(Path dir, ComparisonResult result, Path file1, Path file2) {
        try {
            Files.createDirectories(dir);
            MarkedWorkbook marked1 = workbookWriter.write(file1, tableComparator.annotate(result, TableSide.LEFT));
            MarkedWorkbook marked2 = workbookWriter.write(file2, tableComparator.annotate(result, TableSide.RIGHT));
            String base1 = baseName(file1);
            String base2 = baseName(file2);
            boolean sameName = base1.equals(base2);
            Path out1 = dir.resolve(base1 + (sameName ? "（标注1）" : "（标注）") + marked1.extension());
            Path out2 = dir.resolve(base2 + (sameName ? "（标注2）" : "（标注）") + marked2.extension());
            Files.write(out1, marked1.content());
            Files.write(out2, marked2.content());
            log.info("标注文件已保存到: {}, {}", out1, out2);
        } catch (IOException | RuntimeException e) {
            log.warn("生成标注文件失败: {}", e.getMessage(), e);
        }
    }

    private static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
