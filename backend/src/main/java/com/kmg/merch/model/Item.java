package com.kmg.merch.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Item(
        int index,
        String title,
        String imagePath,
        String resolvedImagePath,
        Map<String, String> attributes
) {
    public Item {
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Item of(int index, String title, String imagePath, Map<String, String> attributes) {
        return new Item(index, title, imagePath, imagePath, attributes);
    }

    public Item withResolvedImagePath(String resolved) {
        return new Item(index, title, imagePath, resolved, attributes);
    }
}
