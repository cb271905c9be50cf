package com.kmg.merch.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class StartupInitializer implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StartupInitializer.class);

    private final MerchProperties properties;

    @Value("${server.port:5000}")
    private int serverPort;

    public StartupInitializer(MerchProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        createDirectories();
        logSettings();
    }

    private void createDirectories() throws IOException {
        Files.createDirectories(properties.baseDirPath());
        Files.createDirectories(Path.of(properties.getStorage().getSpreadsheetDir()));
        Files.createDirectories(Path.of(properties.getStorage().getImageDir()));
        Files.createDirectories(Path.of(properties.getLogs().getDir()));
    }

    private void logSettings() {
        MerchProperties.Job job = properties.getJob();
        MerchProperties.Browser browser = properties.getBrowser();
        log.info("Batch uploader ready on port {} (mode={}, delay={}s, poll={}ms)",
                serverPort, job.getDefaultMode().toText(), job.getDefaultDelay().toSeconds(),
                job.getPollInterval().toMillis());
        if (browser.getRemoteUrl() != null && !browser.getRemoteUrl().isBlank()) {
            log.info("Browser automation will use Selenium Grid at {}", browser.getRemoteUrl());
        } else {
            log.info("Browser automation will use a local Chrome driver");
        }
    }
}
