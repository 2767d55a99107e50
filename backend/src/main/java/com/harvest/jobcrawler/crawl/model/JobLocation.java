package com.harvest.jobcrawler.crawl.model;

public record JobLocation(
    double latitude,
    double longitude,
    String formattedAddress,
    String provider
) {
    public static final String PROVIDER_NATIVE = "NATIVE";
}
