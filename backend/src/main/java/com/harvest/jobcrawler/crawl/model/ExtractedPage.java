package com.harvest.jobcrawler.crawl.model;

/**
 * Everything structural extraction recovered from one fetched document. {@code posting} is null when
 * the page carried no usable JobPosting.
 */
public record ExtractedPage(
    String pageTitle,
    JobPosting posting,
    Organization organization,
    JobLocation nativeLocation
) {
    public boolean hasPosting() {
        return posting != null && posting.hasTitle();
    }
}
