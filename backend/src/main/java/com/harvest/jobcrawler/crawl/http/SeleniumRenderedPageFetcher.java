package com.harvest.jobcrawler.crawl.http;

import com.harvest.jobcrawler.config.CrawlerProperties;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.remote.RemoteWebDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.net.MalformedURLException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Headless Chrome fallback. At most {@code crawler.rendering.max-contexts} browsers run at once; further
 * callers queue for a slot up to the acquire timeout.
 */
@Component
@ConditionalOnProperty(prefix = "crawler.rendering", name = "enabled", havingValue = "true")
public class SeleniumRenderedPageFetcher implements RenderedPageFetcher {
    private static final Logger log = LoggerFactory.getLogger(SeleniumRenderedPageFetcher.class);

    private final CrawlerProperties properties;
    private final Semaphore contexts;

    public SeleniumRenderedPageFetcher(CrawlerProperties properties) {
        this.properties = properties;
        this.contexts = new Semaphore(properties.getRendering().getMaxContexts(), true);
    }

    @Override
    public String fetchRendered(String url) {
        CrawlerProperties.Rendering rendering = properties.getRendering();
        boolean acquired = false;
        WebDriver driver = null;
        try {
            acquired = contexts.tryAcquire(rendering.getAcquireTimeoutSeconds(), TimeUnit.SECONDS);
            if (!acquired) {
                throw new RenderingCapacityException("No rendering context available for " + url);
            }
            driver = createDriver(rendering);
            driver.manage().timeouts().pageLoadTimeout(Duration.ofSeconds(rendering.getPageTimeoutSeconds()));
            log.info("Rendering page url={}", url);
            driver.get(url);
            if (rendering.getSettleMillis() > 0) {
                Thread.sleep(rendering.getSettleMillis());
            }
            String html = driver.getPageSource();
            if (html == null || html.isBlank()) {
                throw new RenderingException("Rendered page was empty: " + url);
            }
            return html;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RenderingException("Interrupted while rendering " + url, e);
        } catch (WebDriverException e) {
            throw new RenderingException("Browser failed to render " + url + ": " + e.getMessage(), e);
        } finally {
            if (driver != null) {
                try {
                    driver.quit();
                } catch (WebDriverException e) {
                    log.debug("Failed to close browser url={}", url, e);
                }
            }
            if (acquired) {
                contexts.release();
            }
        }
    }

    private WebDriver createDriver(CrawlerProperties.Rendering rendering) {
        ChromeOptions options = new ChromeOptions();
        if (rendering.isHeadless()) {
            options.addArguments("--headless=new");
        }
        options.addArguments("--no-sandbox");
        options.addArguments("--disable-dev-shm-usage");
        options.addArguments("--disable-gpu");
        options.addArguments("--window-size=1920,1080");
        options.addArguments("--disable-blink-features=AutomationControlled");
        options.addArguments("--user-agent=" + properties.getUserAgent());
        String remoteUrl = rendering.getRemoteUrl();
        if (remoteUrl != null && !remoteUrl.isBlank()) {
            try {
                return new RemoteWebDriver(URI.create(remoteUrl.trim()).toURL(), options);
            } catch (MalformedURLException | IllegalArgumentException e) {
                throw new RenderingException("Invalid crawler.rendering.remote-url: " + remoteUrl, e);
            }
        }
        return new ChromeDriver(options);
    }
}
