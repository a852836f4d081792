package com.example.excelcompare.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class UploadStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void oldest_upload_is_evicted_and_its_file_deleted() {
        UploadStore store = new UploadStore(tempDir.toString(), 2);

        StoredUpload first = store.save(file("a.xlsx"));
        StoredUpload second = store.save(file("b.xlsx"));
        StoredUpload third = store.save(file("c.xlsx"));

        assertEquals(2, store.size());
        assertTrue(store.find(first.fileId()).isEmpty());
        assertFalse(Files.exists(first.path()));
        assertTrue(store.find(second.fileId()).isPresent());
        assertTrue(Files.exists(third.path()));
    }

    @Test
    void recently_used_upload_survives_eviction() {
        UploadStore store = new UploadStore(tempDir.toString(), 2);

        StoredUpload first = store.save(file("a.xlsx"));
        StoredUpload second = store.save(file("b.xlsx"));
        store.find(first.fileId());
        store.save(file("c.xlsx"));

        assertTrue(store.find(first.fileId()).isPresent());
        assertTrue(store.find(second.fileId()).isEmpty());
        assertFalse(Files.exists(second.path()));
    }

    @Test
    void delete_removes_entry_and_file() {
        UploadStore store = new UploadStore(tempDir.toString(), 5);
        StoredUpload upload = store.save(file("old.xls"));

        assertTrue(upload.path().toString().endsWith(".xls"));
        store.delete(upload.fileId());

        assertEquals(0, store.size());
        assertFalse(Files.exists(upload.path()));
    }

    private static MockMultipartFile file(String name) {
        return new MockMultipartFile("file", name, "application/octet-stream",
                name.getBytes(StandardCharsets.UTF_8));
    }
}
