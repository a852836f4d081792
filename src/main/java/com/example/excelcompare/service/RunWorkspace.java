package com.example.excelcompare.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

@Slf4j
public final class RunWorkspace implements AutoCloseable {

    private final Path dir;

    private RunWorkspace(Path dir) {
        this.dir = dir;
    }

    public static RunWorkspace create(Path parent) {
        try {
            Files.createDirectories(parent);
            return new RunWorkspace(Files.createTempDirectory(parent, "run-"));
        } catch (IOException e) {
            throw new UncheckedIOException("创建对比工作目录失败：" + e.getMessage(), e);
        }
    }

    public Path dir() {
        return dir;
    }

    public Path stage(Path source, String name) {
        Path target = dir.resolve(name);
        try {
            return Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("复制文件到工作目录失败：" + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        try {
            FileSystemUtils.deleteRecursively(dir);
        } catch (IOException e) {
            log.warn("清理工作目录失败 {}: {}", dir, e.getMessage());
        }
    }
}
