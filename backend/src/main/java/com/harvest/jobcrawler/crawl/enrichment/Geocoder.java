package com.harvest.jobcrawler.crawl.enrichment;

import com.harvest.jobcrawler.config.CrawlerProperties;
import com.harvest.jobcrawler.crawl.http.PoliteHttpClient;
import com.harvest.jobcrawler.crawl.model.HttpFetchResult;
import com.harvest.jobcrawler.crawl.model.JobLocation;
import com.harvest.jobcrawler.crawl.throttle.AdaptiveThrottler;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Address lookup against a Nominatim search endpoint, limited to one request per second.
 */
@Component
public class Geocoder {
    private static final Logger log = LoggerFactory.getLogger(Geocoder.class);
    static final String PROVIDER = "OSM";
    private static final String THROTTLE_KEY = "geocoder";

    private static final String FULL_WIDTH = "１２３４５６７８９０（）［］／、﹝﹞【】";
    private static final String HALF_WIDTH = "1234567890()[]/,()[]";
    private static final Pattern MULTI_ADDRESS = Pattern.compile("[/,、]");
    private static final Pattern COUNTRY_PREFIX = Pattern.compile("^(台灣省|臺灣省|台灣|臺灣|中華民國|Taiwan|R\\.O\\.C)");
    private static final Pattern BRACKETED = Pattern.compile("[(\\[].*?[)\\]]");
    private static final List<Pattern> FLOOR_DETAIL = List.of(
        Pattern.compile("\\d+[樓Ff].*"),
        Pattern.compile("B\\d+.*"),
        Pattern.compile("地下\\d+樓.*"),
        Pattern.compile("第?[A-Z0-9]+室.*"),
        Pattern.compile("\\d+棟.*"),
        Pattern.compile("(?<=號)\\s*[A-Z0-9].*")
    );

    private final PoliteHttpClient httpClient;
    private final AdaptiveThrottler throttler;
    private final ObjectMapper objectMapper;
    private final CrawlerProperties.Enrichment config;

    public Geocoder(
        PoliteHttpClient httpClient,
        AdaptiveThrottler throttler,
        ObjectMapper objectMapper,
        CrawlerProperties properties
    ) {
        this.httpClient = httpClient;
        this.throttler = throttler;
        this.objectMapper = objectMapper;
        this.config = properties.getEnrichment();
    }

    public Optional<JobLocation> geocode(String address) {
        String cleaned = cleanAddress(address);
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }
        Duration timeout = Duration.ofSeconds(config.getGeocoderTimeoutSeconds());
        if (!throttler.acquire(THROTTLE_KEY, 1.0, 1.0, timeout)) {
            log.debug("Geocoder throttle timeout address={}", cleaned);
            return Optional.empty();
        }
        String url = config.getGeocoderUrl()
            + "?format=json&limit=1&countrycodes=tw&q=" + URLEncoder.encode(cleaned, StandardCharsets.UTF_8);
        HttpFetchResult result = httpClient.get(url, "application/json");
        if (!result.isSuccessful() || !result.hasBody()) {
            log.warn("Geocoding failed address={} error={}", cleaned, result.describeFailure());
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(result.body());
            JsonNode first = root.isArray() && root.size() > 0 ? root.get(0) : null;
            if (first == null) {
                return Optional.empty();
            }
            double latitude = Double.parseDouble(first.path("lat").asText());
            double longitude = Double.parseDouble(first.path("lon").asText());
            String formatted = first.path("display_name").asText(address);
            return Optional.of(new JobLocation(latitude, longitude, formatted, PROVIDER));
        } catch (JsonProcessingException | NumberFormatException e) {
            log.warn("Unreadable geocoder response address={} error={}", cleaned, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Normalizes a Taiwanese street address into the form Nominatim matches best: half-width digits,
     * first of several addresses, no country prefix, no brackets, no floor or room detail.
     */
    static String cleanAddress(String address) {
        if (address == null || address.isBlank()) {
            return "";
        }
        StringBuilder halfWidth = new StringBuilder(address.length());
        for (char c : address.toCharArray()) {
            int index = FULL_WIDTH.indexOf(c);
            halfWidth.append(index >= 0 ? HALF_WIDTH.charAt(index) : c);
        }
        String value = halfWidth.toString();
        String[] parts = MULTI_ADDRESS.split(value);
        if (parts.length > 1) {
            value = parts[0].trim();
        }
        value = COUNTRY_PREFIX.matcher(value.trim()).replaceFirst("").trim();
        value = value.replaceAll("^[,， ]+", "");
        value = BRACKETED.matcher(value).replaceAll("").trim();
        for (Pattern pattern : FLOOR_DETAIL) {
            value = pattern.matcher(value).replaceFirst("");
        }
        return value.trim();
    }
}
