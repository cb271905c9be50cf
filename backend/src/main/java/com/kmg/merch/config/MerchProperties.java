package com.kmg.merch.config;

import com.kmg.merch.model.RunMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "merch")
public class MerchProperties {
    @NotBlank
    private String baseDir;
    @Valid
    @NotNull
    private Storage storage = new Storage();
    @Valid
    @NotNull
    private Job job = new Job();
    @Valid
    @NotNull
    private Browser browser = new Browser();
    @Valid
    @NotNull
    private Logs logs = new Logs();

    public String getBaseDir() {
        return baseDir;
    }

    public void setBaseDir(String baseDir) {
        this.baseDir = baseDir;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Job getJob() {
        return job;
    }

    public void setJob(Job job) {
        this.job = job;
    }

    public Browser getBrowser() {
        return browser;
    }

    public void setBrowser(Browser browser) {
        this.browser = browser;
    }

    public Logs getLogs() {
        return logs;
    }

    public void setLogs(Logs logs) {
        this.logs = logs;
    }

    public Path baseDirPath() {
        return Path.of(baseDir);
    }

    public static class Storage {
        @NotBlank
        private String spreadsheetDir;
        @NotBlank
        private String imageDir;

        public String getSpreadsheetDir() {
            return spreadsheetDir;
        }

        public void setSpreadsheetDir(String spreadsheetDir) {
            this.spreadsheetDir = spreadsheetDir;
        }

        public String getImageDir() {
            return imageDir;
        }

        public void setImageDir(String imageDir) {
            this.imageDir = imageDir;
        }
    }

    public static class Job {
        @NotNull
        private Duration pollInterval = Duration.ofSeconds(1);
        @NotNull
        private Duration defaultDelay = Duration.ofSeconds(2);
        @NotNull
        private Duration maxDelay = Duration.ofSeconds(300);
        @NotNull
        private RunMode defaultMode = RunMode.LIVE;
        @NotNull
        private Duration stubDuration = Duration.ofSeconds(5);

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getDefaultDelay() {
            return defaultDelay;
        }

        public void setDefaultDelay(Duration defaultDelay) {
            this.defaultDelay = defaultDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public RunMode getDefaultMode() {
            return defaultMode;
        }

        public void setDefaultMode(RunMode defaultMode) {
            this.defaultMode = defaultMode;
        }

        public Duration getStubDuration() {
            return stubDuration;
        }

        public void setStubDuration(Duration stubDuration) {
            this.stubDuration = stubDuration;
        }
    }

    public static class Browser {
        // Local ChromeDriver when empty.
        private String remoteUrl;
        private boolean headless = false;
        @NotBlank
        private String createUrl;
        @NotNull
        private Duration pageTimeout = Duration.ofSeconds(30);
        @NotBlank
        private String titleSelector = "input[name='title']";
        @NotBlank
        private String imageInputSelector = "input[type='file']";
        @NotBlank
        private String submitSelector = "button[type='submit']";
        @NotBlank
        private String successSelector = ".upload-success";
        @NotBlank
        private String attributeSelectorPattern = "[name='%s']";

        public String getRemoteUrl() {
            return remoteUrl;
        }

        public void setRemoteUrl(String remoteUrl) {
            this.remoteUrl = remoteUrl;
        }

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }

        public String getCreateUrl() {
            return createUrl;
        }

        public void setCreateUrl(String createUrl) {
            this.createUrl = createUrl;
        }

        public Duration getPageTimeout() {
            return pageTimeout;
        }

        public void setPageTimeout(Duration pageTimeout) {
            this.pageTimeout = pageTimeout;
        }

        public String getTitleSelector() {
            return titleSelector;
        }

        public void setTitleSelector(String titleSelector) {
            this.titleSelector = titleSelector;
        }

        public String getImageInputSelector() {
            return imageInputSelector;
        }

        public void setImageInputSelector(String imageInputSelector) {
            this.imageInputSelector = imageInputSelector;
        }

        public String getSubmitSelector() {
            return submitSelector;
        }

        public void setSubmitSelector(String submitSelector) {
            this.submitSelector = submitSelector;
        }

        public String getSuccessSelector() {
            return successSelector;
        }

        public void setSuccessSelector(String successSelector) {
            this.successSelector = successSelector;
        }

        public String getAttributeSelectorPattern() {
            return attributeSelectorPattern;
        }

        public void setAttributeSelectorPattern(String attributeSelectorPattern) {
            this.attributeSelectorPattern = attributeSelectorPattern;
        }
    }

    public static class Logs {
        @NotBlank
        private String dir;

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }
    }
}
