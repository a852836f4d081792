package com.example.excelcompare.service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Component
public class UploadStore {

    private final Path baseDir;
    // 超过上限时淘汰最久未使用的上传文件，并删除磁盘文件
    private final Map<String, StoredUpload> uploads;

    public UploadStore(@Value("${excel.compare.upload-dir}") String baseDir,
                       @Value("${excel.compare.upload-limit:100}") int limit) {
        this.baseDir = Path.of(baseDir).toAbsolutePath().normalize();
        this.uploads = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, StoredUpload> eldest) {
                if (size() <= limit) {
                    return false;
                }
                deleteFile(eldest.getValue());
                log.info("上传文件数超过上限 {}，已清理 {}", limit, eldest.getValue().originalName());
                return true;
            }
        };
    }

    public Path baseDir() {
        return baseDir;
    }

    public StoredUpload save(MultipartFile file) {
        String fileId = UUID.randomUUID().toString();
        Path target = baseDir.resolve(fileId + extensionOf(file.getOriginalFilename()));
        try {
            Files.createDirectories(baseDir);
            try (var in = file.getInputStream()) {
                Files.copy(in, target);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("保存上传文件失败：" + e.getMessage(), e);
        }
        StoredUpload upload = new StoredUpload(fileId, file.getOriginalFilename(), target);
        synchronized (this) {
            uploads.put(fileId, upload);
        }
        log.info("已保存上传文件 {} -> {}", file.getOriginalFilename(), fileId);
        return upload;
    }

    public synchronized Optional<StoredUpload> find(String fileId) {
        if (fileId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(uploads.get(fileId))
                .filter(upload -> Files.isRegularFile(upload.path()));
    }

    public synchronized void delete(String fileId) {
        StoredUpload upload = uploads.remove(fileId);
        if (upload != null) {
            deleteFile(upload);
        }
    }

    public synchronized int size() {
        return uploads.size();
    }

    private void deleteFile(StoredUpload upload) {
        try {
            Files.deleteIfExists(upload.path());
        } catch (IOException e) {
            log.warn("删除上传文件失败 {}: {}", upload.path(), e.getMessage());
        }
    }

    @PreDestroy
    public synchronized void cleanup() throws IOException {
        uploads.clear();
        FileSystemUtils.deleteRecursively(baseDir);
    }

    private static String extensionOf(String originalName) {
        if (originalName != null && originalName.toLowerCase().endsWith(".xls")) {
            return ".xls";
        }
        return ".xlsx";
    }
}
