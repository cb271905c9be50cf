package com.kmg.merch.service;

import com.kmg.merch.model.Item;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class CsvItemListParser {
    static final String TITLE_COLUMN = "title";
    static final String IMAGE_PATH_COLUMN = "image_path";

    private static final CSVFormat FORMAT = CSVFormat.RFC4180.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setIgnoreSurroundingSpaces(true)
            .setTrim(true)
            .build();

    public List<Item> parse(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(reader);
        } catch (IOException e) {
            throw new InputException("Error reading spreadsheet: " + e.getMessage(), e);
        }
    }

    public List<Item> parse(Reader reader) {
        try (CSVParser parser = FORMAT.parse(reader)) {
            Map<String, String> columns = normalizedColumns(parser.getHeaderNames());
            String titleColumn = requireColumn(columns, TITLE_COLUMN);
            String imageColumn = requireColumn(columns, IMAGE_PATH_COLUMN);

            List<Item> items = new ArrayList<>();
            for (CSVRecord record : parser) {
                if (isBlankRecord(record)) {
                    continue;
                }
                String imagePath = valueOf(record, imageColumn);
                if (imagePath.isEmpty()) {
                    throw new InputException("Row " + record.getRecordNumber() + " has no " + IMAGE_PATH_COLUMN);
                }

                Map<String, String> attributes = new LinkedHashMap<>();
                for (String header : parser.getHeaderNames()) {
                    if (header.equals(titleColumn) || header.equals(imageColumn) || header.isBlank()) {
                        continue;
                    }
                    attributes.put(header, valueOf(record, header));
                }

                items.add(Item.of(items.size(), valueOf(record, titleColumn), imagePath, attributes));
            }

            if (items.isEmpty()) {
                throw new InputException("Spreadsheet contains no products.");
            }
            return items;
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            throw new InputException("Error processing spreadsheet: " + e.getMessage(), e);
        }
    }

    private Map<String, String> normalizedColumns(List<String> headers) {
        Map<String, String> columns = new LinkedHashMap<>();
        for (String header : headers) {
            columns.putIfAbsent(header.trim().toLowerCase(Locale.ROOT).replace(' ', '_'), header);
        }
        return columns;
    }

    private String requireColumn(Map<String, String> columns, String name) {
        String header = columns.get(name);
        if (header == null) {
            throw new InputException("Spreadsheet is missing required column '" + name + "'");
        }
        return header;
    }

    private boolean isBlankRecord(CSVRecord record) {
        for (String value : record) {
            if (value != null && !value.isBlank()) {
                return false;
            }
        }
        return true;
    }

    private String valueOf(CSVRecord record, String header) {
        if (!record.isSet(header)) {
            return "";
        }
        String value = record.get(header);
        return value == null ? "" : value.trim();
    }
}
