package com.harvest.jobcrawler.crawl.healing;

import com.harvest.jobcrawler.crawl.model.JobPosting;
import com.harvest.jobcrawler.crawl.model.Organization;

public record HealedRecord(JobPosting posting, Organization organization) {
}
