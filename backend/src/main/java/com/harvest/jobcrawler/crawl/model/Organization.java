package com.harvest.jobcrawler.crawl.model;

public record Organization(
    SourcePlatform source,
    String sourceId,
    String name,
    String companyUrl,
    String address,
    String description,
    String dataSourceLayer
) {
    /** Layer of an organization whose row was filled in from its own company page. */
    public static final String LAYER_ENRICHED = "L2";
}
