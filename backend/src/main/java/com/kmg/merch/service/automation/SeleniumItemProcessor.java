package com.kmg.merch.service.automation;

import com.kmg.merch.config.MerchProperties;
import com.kmg.merch.model.Item;
import com.kmg.merch.model.JobOptions;
import com.kmg.merch.model.ProcessOutcome;
import com.kmg.merch.service.ResourceException;
import org.openqa.selenium.By;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.remote.RemoteWebDriver;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;

@Service
public class SeleniumItemProcessor implements ItemProcessor {
    private static final Logger log = LoggerFactory.getLogger(SeleniumItemProcessor.class);

    private final MerchProperties.Browser browser;

    public SeleniumItemProcessor(MerchProperties properties) {
        this.browser = properties.getBrowser();
    }

    @Override
    public ProcessorSession open(JobOptions options) throws ResourceException {
        ChromeOptions chromeOptions = createChromeOptions(options.headless() || browser.isHeadless());
        try {
            WebDriver driver = createDriver(chromeOptions);
            driver.manage().timeouts().pageLoadTimeout(browser.getPageTimeout());
            log.info("Browser session opened (remote={}, headless={})",
                    hasRemoteUrl(), options.headless() || browser.isHeadless());
            return new SeleniumSession(driver);
        } catch (WebDriverException | MalformedURLException e) {
            throw new ResourceException("Failed to start browser: " + e.getMessage(), e);
        }
    }

    private WebDriver createDriver(ChromeOptions chromeOptions) throws MalformedURLException {
        if (hasRemoteUrl()) {
            return new RemoteWebDriver(new URL(browser.getRemoteUrl()), chromeOptions);
        }
        return new ChromeDriver(chromeOptions);
    }

    private boolean hasRemoteUrl() {
        return browser.getRemoteUrl() != null && !browser.getRemoteUrl().isBlank();
    }

    private ChromeOptions createChromeOptions(boolean headless) {
        ChromeOptions options = new ChromeOptions();
        if (headless) {
            options.addArguments("--headless=new");
        }
        options.setExperimentalOption("excludeSwitches", Collections.singletonList("enable-automation"));
        options.addArguments("--disable-blink-features=AutomationControlled");
        options.addArguments("--no-sandbox");
        options.addArguments("--disable-dev-shm-usage");
        return options;
    }

    private class SeleniumSession implements ProcessorSession {
        private final WebDriver driver;
        private final WebDriverWait wait;

        SeleniumSession(WebDriver driver) {
            this.driver = driver;
            this.wait = new WebDriverWait(driver, browser.getPageTimeout());
        }

        @Override
        public ProcessOutcome process(Item item) {
            Path image = Path.of(item.resolvedImagePath()).toAbsolutePath();
            if (!Files.isRegularFile(image)) {
                return ProcessOutcome.failure("Image not found: " + image);
            }

            try {
                driver.get(browser.getCreateUrl());

                WebElement title = wait.until(ExpectedConditions.visibilityOfElementLocated(
                        By.cssSelector(browser.getTitleSelector())));
                title.clear();
                title.sendKeys(item.title());

                driver.findElement(By.cssSelector(browser.getImageInputSelector()))
                        .sendKeys(image.toString());

                for (Map.Entry<String, String> attribute : item.attributes().entrySet()) {
                    fillAttribute(attribute.getKey(), attribute.getValue());
                }

                wait.until(ExpectedConditions.elementToBeClickable(
                        By.cssSelector(browser.getSubmitSelector()))).click();
                wait.until(ExpectedConditions.presenceOfElementLocated(
                        By.cssSelector(browser.getSuccessSelector())));
                return ProcessOutcome.success();
            } catch (WebDriverException e) {
                return ProcessOutcome.failure(firstLine(e.getMessage()));
            }
        }

        private void fillAttribute(String name, String value) {
            if (value == null || value.isBlank()) {
                return;
            }
            String selector = String.format(browser.getAttributeSelectorPattern(), name);
            List<WebElement> fields = driver.findElements(By.cssSelector(selector));
            if (fields.isEmpty()) {
                log.debug("No form field for attribute '{}', skipped", name);
                return;
            }
            WebElement field = fields.get(0);
            field.clear();
            field.sendKeys(value);
        }

        @Override
        public void close() throws ResourceException {
            try {
                driver.quit();
                log.info("Browser session closed");
            } catch (WebDriverException e) {
                throw new ResourceException("Failed to close browser: " + e.getMessage(), e);
            }
        }
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "Browser automation failed";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}
