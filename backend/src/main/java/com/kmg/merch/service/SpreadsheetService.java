package com.kmg.merch.service;

import com.kmg.merch.config.MerchProperties;
import com.kmg.merch.dto.SpreadsheetUploadResponse;
import com.kmg.merch.model.Item;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

@Service
public class SpreadsheetService {
    private static final Logger log = LoggerFactory.getLogger(SpreadsheetService.class);
    private static final Set<String> ALLOWED = Set.of("csv", "xlsx", "xls");

    private final CsvItemListParser parser;
    private final JobService jobService;
    private final Path spreadsheetDir;
    private final AtomicReference<List<Item>> currentItems = new AtomicReference<>(null);

    public SpreadsheetService(
            CsvItemListParser parser,
            JobService jobService,
            MerchProperties properties
    ) {
        this.parser = parser;
        this.jobService = jobService;
        this.spreadsheetDir = Path.of(properties.getStorage().getSpreadsheetDir());
    }

    public SpreadsheetUploadResponse upload(MultipartFile file) {
        UploadFiles.requireAllowed(file, ALLOWED, "file");
        if (jobService.isRunActive()) {
            throw new JobStateException(JobStateException.Reason.ALREADY_RUNNING);
        }
        String extension = UploadFiles.extensionOf(file.getOriginalFilename());
        if (!"csv".equals(extension)) {
            throw new InputException("Excel workbooks are not supported; export the sheet as CSV and upload it again.");
        }

        Path saved = UploadFiles.save(file, spreadsheetDir);
        List<Item> items;
        try {
            items = parser.parse(saved);
        } catch (InputException e) {
            log.error("Error processing spreadsheet {}: {}", saved, e.getMessage());
            throw e;
        }

        jobService.resetStatusIfIdle();
        currentItems.set(items);
        log.info("Spreadsheet {} accepted with {} products", saved.getFileName(), items.size());

        List<String> imagePaths = items.stream().map(Item::imagePath).toList();
        return new SpreadsheetUploadResponse(
                true,
                "Spreadsheet uploaded successfully. Found " + items.size() + " products to upload.",
                items.size(),
                imagePaths
        );
    }

    public List<Item> currentItems() {
        List<Item> items = currentItems.get();
        if (items == null) {
            throw new InputException("No spreadsheet has been uploaded yet");
        }
        return items;
    }
}
