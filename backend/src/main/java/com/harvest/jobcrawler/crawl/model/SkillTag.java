package com.harvest.jobcrawler.crawl.model;

public record SkillTag(
    String name,
    String type,
    double confidence
) {
}
