package com.harvest.jobcrawler.crawl.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum SourcePlatform {
    PLATFORM_104("platform_104", "https://www.104.com.tw", 5.0, 20, false),
    PLATFORM_1111("platform_1111", "https://www.1111.com.tw", 5.0, 20, false),
    PLATFORM_CAKERESUME("platform_cakeresume", "https://www.cake.me", 5.0, 20, false),
    PLATFORM_YES123("platform_yes123", "https://www.yes123.com.tw", 3.0, 15, true),
    PLATFORM_YOURATOR("platform_yourator", "https://www.yourator.co", 5.0, 20, false);

    private final String code;
    private final String defaultBaseUrl;
    private final double defaultRate;
    private final double defaultCapacity;
    private final boolean queryIdentifiesPosting;

    SourcePlatform(String code, String defaultBaseUrl, double defaultRate, double defaultCapacity, boolean queryIdentifiesPosting) {
        this.code = code;
        this.defaultBaseUrl = defaultBaseUrl;
        this.defaultRate = defaultRate;
        this.defaultCapacity = defaultCapacity;
        this.queryIdentifiesPosting = queryIdentifiesPosting;
    }

    public String code() {
        return code;
    }

    public String defaultBaseUrl() {
        return defaultBaseUrl;
    }

    public double defaultRate() {
        return defaultRate;
    }

    public double defaultCapacity() {
        return defaultCapacity;
    }

    /**
     * Whether the query string is part of a posting's identity. Only yes123 keeps it when URLs are normalized.
     */
    public boolean queryIdentifiesPosting() {
        return queryIdentifiesPosting;
    }

    public static Optional<SourcePlatform> fromCode(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(platform -> platform.code.equals(normalized) || platform.name().toLowerCase(Locale.ROOT).equals(normalized)
                || platform.code.equals("platform_" + normalized))
            .findFirst();
    }
}
