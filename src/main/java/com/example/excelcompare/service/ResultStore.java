package com.example.excelcompare.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Component
public class ResultStore {

    private final Map<String, CompareArtifacts> results;

    public ResultStore(@Value("${excel.compare.result-limit:50}") int limit) {
        this.results = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CompareArtifacts> eldest) {
                return size() > limit;
            }
        };
    }

    public synchronized String put(CompareArtifacts artifacts) {
        String resultId = UUID.randomUUID().toString();
        results.put(resultId, artifacts);
        return resultId;
    }

    public synchronized Optional<CompareArtifacts> find(String resultId) {
        return Optional.ofNullable(results.get(resultId));
    }
}
