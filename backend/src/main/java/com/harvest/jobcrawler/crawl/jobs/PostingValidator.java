package com.harvest.jobcrawler.crawl.jobs;

import com.harvest.jobcrawler.config.CrawlerProperties;
import com.harvest.jobcrawler.crawl.model.JobPosting;
import com.harvest.jobcrawler.crawl.model.SourcePlatform;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Rule checks for extracted postings. A failing posting is counted and sampled to disk but the caller
 * still persists it.
 */
@Component
public class PostingValidator {
    private static final Logger log = LoggerFactory.getLogger(PostingValidator.class);
    private static final int MAX_TITLE_LENGTH = 512;

    private final CrawlerProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<SourcePlatform, Counters> counters = new ConcurrentHashMap<>();

    public PostingValidator(CrawlerProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public boolean validate(JobPosting posting) {
        List<String> violations = violations(posting);
        boolean valid = violations.isEmpty();
        if (posting == null || posting.source() == null) {
            return valid;
        }
        Counters stats = counters.computeIfAbsent(posting.source(), ignored -> new Counters());
        long total = stats.total.incrementAndGet();
        long failed = valid ? stats.failed.get() : stats.failed.incrementAndGet();
        if (!valid) {
            log.warn("Validation failed source={} sourceId={} violations={}",
                posting.source().code(), posting.sourceId(), violations);
            saveSample(posting, violations);
        }
        checkDrift(posting.source(), total, failed);
        return valid;
    }

    public List<String> violations(JobPosting posting) {
        List<String> violations = new ArrayList<>();
        if (posting == null) {
            violations.add("posting_missing");
            return violations;
        }
        if (posting.source() == null) {
            violations.add("source_missing");
        }
        if (isBlank(posting.sourceId())) {
            violations.add("source_id_missing");
        }
        if (isBlank(posting.url())) {
            violations.add("url_missing");
        }
        if (!posting.hasTitle()) {
            violations.add("title_missing");
        } else if (posting.title().length() > MAX_TITLE_LENGTH) {
            violations.add("title_too_long");
        }
        if ((posting.salaryMin() != null && posting.salaryMin() < 0)
            || (posting.salaryMax() != null && posting.salaryMax() < 0)) {
            violations.add("salary_negative");
        }
        if (posting.salaryMin() != null && posting.salaryMax() != null && posting.salaryMin() > posting.salaryMax()) {
            violations.add("salary_range_inverted");
        }
        return violations;
    }

    public long totalCount(SourcePlatform source) {
        Counters stats = counters.get(source);
        return stats == null ? 0 : stats.total.get();
    }

    public long failureCount(SourcePlatform source) {
        Counters stats = counters.get(source);
        return stats == null ? 0 : stats.failed.get();
    }

    private void checkDrift(SourcePlatform source, long total, long failed) {
        CrawlerProperties.Validation config = properties.getValidation();
        if (total < config.getDriftMinSamples()) {
            return;
        }
        double ratio = (double) failed / total;
        if (ratio > config.getDriftFailRatio()) {
            log.error("Structural drift alert source={} failRatio={} samples={}",
                source.code(), String.format("%.3f", ratio), total);
        }
    }

    private void saveSample(JobPosting posting, List<String> violations) {
        if (!properties.getValidation().isSaveSamples()) {
            return;
        }
        Path dir = Path.of(properties.getValidation().getSampleDir());
        String fileName = "job_" + posting.source().code() + "_" + safe(posting.sourceId()) + "_"
            + clock.instant().getEpochSecond() + ".json";
        Map<String, Object> sample = new LinkedHashMap<>();
        sample.put("violations", violations);
        sample.put("posting", posting);
        try {
            Files.createDirectories(dir);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(dir.resolve(fileName).toFile(), sample);
            log.info("Saved failed sample path={}", dir.resolve(fileName));
        } catch (IOException e) {
            log.warn("Failed to save validation sample {}: {}", fileName, e.getMessage());
        }
    }

    private static String safe(String value) {
        return value == null ? "null" : value.replaceAll("[^A-Za-z0-9_-]", "_");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static final class Counters {
        private final AtomicLong total = new AtomicLong();
        private final AtomicLong failed = new AtomicLong();
    }
}
