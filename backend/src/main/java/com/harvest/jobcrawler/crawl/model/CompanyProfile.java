package com.harvest.jobcrawler.crawl.model;

/**
 * Details read from an organization's own page on the platform. Any field may be {@code null}.
 */
public record CompanyProfile(
    String capital,
    String employeeCount,
    String description,
    String address,
    String website
) {
    public boolean isEmpty() {
        return capital == null && employeeCount == null && description == null && address == null && website == null;
    }
}
