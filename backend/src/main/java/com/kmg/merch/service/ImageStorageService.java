package com.kmg.merch.service;

import com.kmg.merch.config.MerchProperties;
import com.kmg.merch.dto.ImageUploadResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

@Service
public class ImageStorageService {
    private static final Logger log = LoggerFactory.getLogger(ImageStorageService.class);
    private static final Set<String> ALLOWED = Set.of("png", "jpg", "jpeg", "gif");

    private final ImageMappingResolver imageMappingResolver;
    private final Path imageDir;

    public ImageStorageService(ImageMappingResolver imageMappingResolver, MerchProperties properties) {
        this.imageMappingResolver = imageMappingResolver;
        this.imageDir = Path.of(properties.getStorage().getImageDir());
    }

    public ImageUploadResponse store(MultipartFile image, String index, String originalPath) {
        UploadFiles.requireAllowed(image, ALLOWED, "image");
        if (!StringUtils.hasText(index) || !StringUtils.hasText(originalPath)) {
            throw new InputException("Missing image index or original path");
        }

        Path saved = UploadFiles.save(image, imageDir);
        imageMappingResolver.submit(originalPath, saved.toString());
        log.info("Image for row {} mapped: {} -> {}", index, originalPath, saved);
        return new ImageUploadResponse(true, "Image uploaded successfully", saved.toString());
    }

    public Map<String, String> mappings() {
        return imageMappingResolver.mappings();
    }
}
