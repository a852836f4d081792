package com.example.excelcompare.service;

import java.util.Map;
import java.util.Optional;

public record CompareArtifacts(
        String report,
        Map<Integer, MarkedFile> markedFiles
) {

    public CompareArtifacts {
        markedFiles = Map.copyOf(markedFiles);
    }

    public Optional<MarkedFile> markedFile(int fileNo) {
        return Optional.ofNullable(markedFiles.get(fileNo));
    }
}
