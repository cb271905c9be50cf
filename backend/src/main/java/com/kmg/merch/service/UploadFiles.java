package com.kmg.merch.service;

import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

final class UploadFiles {
    private UploadFiles() {
    }

    static String extensionOf(String filename) {
        String extension = StringUtils.getFilenameExtension(filename);
        return extension == null ? "" : extension.toLowerCase(Locale.ROOT);
    }

    static void requireAllowed(MultipartFile file, Set<String> allowed, String what) {
        if (file == null || file.isEmpty() || !StringUtils.hasText(file.getOriginalFilename())) {
            throw new InputException("No " + what + " selected");
        }
        if (!allowed.contains(extensionOf(file.getOriginalFilename()))) {
            throw new InputException(what.substring(0, 1).toUpperCase(Locale.ROOT) + what.substring(1)
                    + " type not allowed. Please upload one of: " + String.join(", ", new TreeSet<>(allowed)));
        }
    }

    static String safeName(String original) {
        String name = StringUtils.getFilename(StringUtils.cleanPath(original.replace('\\', '/')));
        String cleaned = name == null ? "" : name.replaceAll("[^A-Za-z0-9._-]", "_");
        while (cleaned.startsWith(".")) {
            cleaned = cleaned.substring(1);
        }
        return cleaned.isBlank() ? "upload" : cleaned;
    }

    static Path save(MultipartFile file, Path dir) {
        Path target = dir.resolve(safeName(file.getOriginalFilename())).toAbsolutePath().normalize();
        try (InputStream in = file.getInputStream()) {
            Files.createDirectories(dir);
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            return target;
        } catch (IOException e) {
            throw new InputException("Failed to store " + file.getOriginalFilename() + ": " + e.getMessage(), e);
        }
    }
}
