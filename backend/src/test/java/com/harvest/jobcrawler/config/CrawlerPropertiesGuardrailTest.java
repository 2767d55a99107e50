package com.harvest.jobcrawler.config;

import com.harvest.jobcrawler.crawl.model.SourcePlatform;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrawlerPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToBrowserDefault() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("Mozilla/5.0"));
    }

    @Test
    void concurrencyAndRetriesAreClamped() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setUrlConcurrency(0);
        properties.setRequestMaxRetries(-3);
        properties.setRetryBackoffFactor(0.5);
        assertEquals(1, properties.getUrlConcurrency());
        assertEquals(0, properties.getRequestMaxRetries());
        assertEquals(1.0, properties.getRetryBackoffFactor());
    }

    @Test
    void throttlePolicyFactorsStayInRange() {
        CrawlerProperties.Throttle throttle = new CrawlerProperties().getThrottle();
        throttle.setBackoffFactor(3.0);
        throttle.setMinRateMultiplier(0.0);
        throttle.setBoostFactor(0.5);
        throttle.setJitterMinMs(40);
        throttle.setJitterMaxMs(20);
        assertEquals(1.0, throttle.getBackoffFactor());
        assertEquals(0.01, throttle.getMinRateMultiplier());
        assertEquals(1.0, throttle.getBoostFactor());
        assertEquals(40, throttle.getJitterMaxMs());
    }

    @Test
    void sourceOverridesFallBackToPlatformDefaults() {
        CrawlerProperties properties = new CrawlerProperties();
        CrawlerProperties.Source yes123 = new CrawlerProperties.Source();
        yes123.setRate(1.5);
        yes123.setCapacity(0.0);
        yes123.setBaseUrl("http://localhost:8089/");
        CrawlerProperties.Source cake = new CrawlerProperties.Source();
        cake.setEnabled(false);
        properties.setSources(Map.of("platform_yes123", yes123, "platform_cakeresume", cake));

        assertEquals(1.5, properties.rateFor(SourcePlatform.PLATFORM_YES123));
        assertEquals(15.0, properties.capacityFor(SourcePlatform.PLATFORM_YES123));
        assertEquals("http://localhost:8089", properties.baseUrlFor(SourcePlatform.PLATFORM_YES123));
        assertEquals(5.0, properties.rateFor(SourcePlatform.PLATFORM_104));
        assertEquals("https://www.104.com.tw", properties.baseUrlFor(SourcePlatform.PLATFORM_104));
        assertFalse(properties.isSourceEnabled(SourcePlatform.PLATFORM_CAKERESUME));
        assertTrue(properties.isSourceEnabled(SourcePlatform.PLATFORM_1111));
    }

    @Test
    void healingSettingsAreBounded() {
        CrawlerProperties.Healing healing = new CrawlerProperties().getHealing();
        healing.setMinTitleSimilarity(1.7);
        healing.setMaxDocumentChars(10);
        healing.setOllamaUrl("http://localhost:11434/");
        assertEquals(1.0, healing.getMinTitleSimilarity());
        assertEquals(200, healing.getMaxDocumentChars());
        assertEquals("http://localhost:11434", healing.getOllamaUrl());
    }
}
