package com.kmg.merch.service;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class ImageMappingResolver {
    private final Map<String, String> mappings = new ConcurrentHashMap<>();

    public void submit(String originalPath, String resolvedPath) {
        if (originalPath == null || originalPath.isBlank()) {
            throw new IllegalArgumentException("Original path is required.");
        }
        if (resolvedPath == null || resolvedPath.isBlank()) {
            throw new IllegalArgumentException("Resolved path is required.");
        }
        mappings.put(originalPath, resolvedPath);
    }

    public String resolve(String originalPath) {
        if (originalPath == null) {
            return null;
        }
        return mappings.getOrDefault(originalPath, originalPath);
    }

    public boolean isMapped(String originalPath) {
        return originalPath != null && mappings.containsKey(originalPath);
    }

    public Map<String, String> mappings() {
        return Collections.unmodifiableMap(new TreeMap<>(mappings));
    }
}
