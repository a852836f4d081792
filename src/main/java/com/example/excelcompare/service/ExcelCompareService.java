package com.example.excelcompare.service;

import com.example.excelcompare.service.compare.ComparisonResult;
import com.example.excelcompare.service.compare.CompareReport;
import com.example.excelcompare.service.compare.ReportBuilder;
import com.example.excelcompare.service.compare.SheetTable;
import com.example.excelcompare.service.compare.TableComparator;
import com.example.excelcompare.service.compare.TableLoadException;
import com.example.excelcompare.service.compare.TableSide;
import com.example.excelcompare.service.excel.AnnotatedWorkbookWriter;
import com.example.excelcompare.service.excel.ExcelTableLoader;
import com.example.excelcompare.service.excel.MarkedWorkbook;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ExcelCompareService {

    private final UploadStore uploadStore;
    private final ResultStore resultStore;
    private final ExcelTableLoader tableLoader;
    private final TableComparator tableComparator;
    private final ReportBuilder reportBuilder;
    private final AnnotatedWorkbookWriter workbookWriter;

    public UploadInfo upload(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("没有选择文件");
        }
        StoredUpload upload = uploadStore.save(file);
        try {
            Map<String, List<String>> sheets = tableLoader.describe(upload.path());
            return new UploadInfo(upload.fileId(), upload.originalName(), sheets);
        } catch (TableLoadException e) {
            uploadStore.delete(upload.fileId());
            throw e;
        }
    }

    public CompareResponse compare(CompareRequest request) {
        if (request == null || isBlank(request.file1Id()) || isBlank(request.file2Id())
                || isBlank(request.sheet1()) || isBlank(request.sheet2())
                || request.keys() == null || request.keys().isEmpty()) {
            throw new IllegalArgumentException("参数不完整");
        }
        StoredUpload first = uploadStore.find(request.file1Id())
                .orElseThrow(() -> new IllegalArgumentException("文件不存在"));
        StoredUpload second = uploadStore.find(request.file2Id())
                .orElseThrow(() -> new IllegalArgumentException("文件不存在"));

        try (RunWorkspace workspace = RunWorkspace.create(uploadStore.baseDir().resolve("runs"))) {
            Path file1 = workspace.stage(first.path(), "file1-" + first.path().getFileName());
            Path file2 = workspace.stage(second.path(), "file2-" + second.path().getFileName());

            SheetTable left = tableLoader.load(file1, request.sheet1(), first.originalName());
            SheetTable right = tableLoader.load(file2, request.sheet2(), second.originalName());
            ComparisonResult result = tableComparator.compare(left, right, request.keys());
            CompareReport report = reportBuilder.build(result);

            Map<Integer, MarkedFile> markedFiles = markFiles(result, file1, file2, first, second);
            String resultId = resultStore.put(new CompareArtifacts(report.render(), markedFiles));
            log.info("对比完成 resultId={}", resultId);
            return new CompareResponse(
                    report.render(),
                    resultId,
                    !markedFiles.isEmpty(),
                    result.partition().onlyLeft().size(),
                    result.partition().onlyRight().size(),
                    report.rowsWithDifferences()
            );
        }
    }

    public Optional<CompareArtifacts> findResult(String resultId) {
        return resultStore.find(resultId);
    }

    // 标注文件生成失败不影响文本报告
    private Map<Integer, MarkedFile> markFiles(ComparisonResult result, Path file1, Path file2,
                                               StoredUpload first, StoredUpload second) {
        try {
            MarkedWorkbook marked1 = workbookWriter.write(file1, tableComparator.annotate(result, TableSide.LEFT));
            MarkedWorkbook marked2 = workbookWriter.write(file2, tableComparator.annotate(result, TableSide.RIGHT));
            Map<Integer, MarkedFile> files = new LinkedHashMap<>();
            files.put(1, toMarkedFile(first, marked1));
            files.put(2, toMarkedFile(second, marked2));
            return files;
        } catch (RuntimeException e) {
            log.warn("生成标注文件失败: {}", e.getMessage(), e);
            return Map.of();
        }
    }

    private MarkedFile toMarkedFile(StoredUpload upload, MarkedWorkbook workbook) {
        return new MarkedFile(upload.baseName() + "（标注）" + workbook.extension(),
                workbook.contentType(), workbook.content());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
