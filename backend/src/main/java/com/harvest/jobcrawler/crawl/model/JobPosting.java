package com.harvest.jobcrawler.crawl.model;

import java.time.LocalDate;

public record JobPosting(
    SourcePlatform source,
    String sourceId,
    String url,
    String title,
    String organizationSourceId,
    String organizationName,
    String description,
    String address,
    String employmentType,
    Long salaryMin,
    Long salaryMax,
    String salaryType,
    LocalDate datePosted,
    String dataSourceLayer,
    String rawJson
) {
    public static final String LAYER_NATIVE = "L1";
    public static final String LAYER_AI_HEALED = "L2";

    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }

    public JobPosting withLayer(String layer) {
        return new JobPosting(
            source, sourceId, url, title, organizationSourceId, organizationName, description, address,
            employmentType, salaryMin, salaryMax, salaryType, datePosted, layer, rawJson
        );
    }
}
