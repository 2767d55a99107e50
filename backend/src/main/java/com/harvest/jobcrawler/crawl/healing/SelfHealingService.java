package com.harvest.jobcrawler.crawl.healing;

import com.harvest.jobcrawler.config.CrawlerProperties;
import com.harvest.jobcrawler.crawl.model.JobPosting;
import com.harvest.jobcrawler.crawl.model.Organization;
import com.harvest.jobcrawler.crawl.model.SourcePlatform;
import com.harvest.jobcrawler.crawl.resilience.CircuitBreaker;
import com.harvest.jobcrawler.crawl.resilience.CircuitBreakerRegistry;
import com.harvest.jobcrawler.crawl.resilience.CircuitOpenException;
import com.harvest.jobcrawler.crawl.resilience.HealingIsolationGate;
import com.harvest.jobcrawler.crawl.util.PostingUrls;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * AI fallback for pages whose structured data yielded no title. Calls go through the {@code ai_healing}
 * breaker and are skipped entirely while the isolation gate is closed.
 */
@Service
public class SelfHealingService {
    private static final Logger log = LoggerFactory.getLogger(SelfHealingService.class);

    private final OllamaClient ollamaClient;
    private final CircuitBreaker breaker;
    private final HealingIsolationGate isolationGate;
    private final CrawlerProperties.Healing config;

    public SelfHealingService(
        OllamaClient ollamaClient,
        CircuitBreakerRegistry circuitBreakerRegistry,
        HealingIsolationGate isolationGate,
        CrawlerProperties properties
    ) {
        this.ollamaClient = ollamaClient;
        this.breaker = circuitBreakerRegistry.get(CircuitBreakerRegistry.AI_HEALING);
        this.isolationGate = isolationGate;
        this.config = properties.getHealing();
    }

    public Optional<HealedRecord> heal(SourcePlatform source, String html, String url, String pageTitle) {
        if (!config.isEnabled() || isolationGate.isIsolated()) {
            return Optional.empty();
        }
        JsonNode answer;
        try {
            answer = breaker.call(() -> ollamaClient.extractJob(html));
        } catch (CircuitOpenException e) {
            log.debug("AI healing skipped, circuit {} open url={}", e.getCircuitName(), url);
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("AI healing failed source={} url={} error={}", source.code(), url, e.getMessage());
            isolationGate.recordFailure(e.getMessage());
            return Optional.empty();
        }
        isolationGate.recordSuccess();

        String title = text(answer, "title");
        if (title == null) {
            log.info("AI healing produced no title source={} url={}", source.code(), url);
            return Optional.empty();
        }
        double similarity = TitleSimilarity.similarity(pageTitle, title);
        if (similarity < config.getMinTitleSimilarity()) {
            log.info("AI healing rejected source={} url={} similarity={}", source.code(), url, String.format("%.2f", similarity));
            return Optional.empty();
        }
        String sourceId = PostingUrls.sourceIdFromUrl(source, url);
        if (sourceId == null) {
            return Optional.empty();
        }

        String companyName = text(answer, "company_name");
        String companyId = PostingUrls.companyIdFromPostingUrl(source, url);
        JobPosting posting = new JobPosting(
            source,
            sourceId,
            url,
            title,
            companyId,
            companyName,
            text(answer, "description"),
            text(answer, "address"),
            null,
            number(answer, "salary_min"),
            number(answer, "salary_max"),
            text(answer, "salary_type"),
            null,
            JobPosting.LAYER_AI_HEALED,
            answer.toString()
        );
        Organization organization = companyName == null || companyId == null
            ? null
            : new Organization(source, companyId, companyName, null, null, null, JobPosting.LAYER_AI_HEALED);
        log.info("AI healing recovered posting source={} sourceId={}", source.code(), sourceId);
        return Optional.of(new HealedRecord(posting, organization));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static Long number(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.asLong();
        }
        String digits = value.asText().replaceAll("[^0-9]", "");
        if (digits.isEmpty() || digits.length() > 18) {
            return null;
        }
        return Long.parseLong(digits);
    }
}
