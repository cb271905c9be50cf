package com.kmg.merch.api;

import com.kmg.merch.dto.ImageUploadResponse;
import com.kmg.merch.dto.SpreadsheetUploadResponse;
import com.kmg.merch.service.ImageStorageService;
import com.kmg.merch.service.SpreadsheetService;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.Map;

@RestController
@RequestMapping("/api")
public class UploadController {
    private final SpreadsheetService spreadsheetService;
    private final ImageStorageService imageStorageService;

    public UploadController(SpreadsheetService spreadsheetService, ImageStorageService imageStorageService) {
        this.spreadsheetService = spreadsheetService;
        this.imageStorageService = imageStorageService;
    }

    @PostMapping("/spreadsheet")
    public SpreadsheetUploadResponse uploadSpreadsheet(@RequestParam(value = "file", required = false) MultipartFile file) {
        return spreadsheetService.upload(file);
    }

    @PostMapping("/images")
    public ImageUploadResponse uploadImage(
            @RequestParam(value = "image", required = false) MultipartFile image,
            @RequestParam(value = "index", required = false) String index,
            @RequestParam(value = "originalPath", required = false) String originalPath
    ) {
        return imageStorageService.store(image, index, originalPath);
    }

    @GetMapping("/images/mappings")
    public Map<String, String> mappings() {
        return imageStorageService.mappings();
    }
}
