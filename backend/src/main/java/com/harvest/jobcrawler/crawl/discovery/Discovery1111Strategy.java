package com.harvest.jobcrawler.crawl.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.harvest.jobcrawler.config.CrawlerProperties;
import com.harvest.jobcrawler.crawl.http.PoliteHttpClient;
import com.harvest.jobcrawler.crawl.model.SourcePlatform;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

@Component
public class Discovery1111Strategy extends AbstractDiscoveryStrategy {
    static final int MAX_PAGES = 20;
    static final int PAGE_CONCURRENCY = 5;

    public Discovery1111Strategy(
        PoliteHttpClient httpClient,
        ObjectMapper objectMapper,
        CrawlerProperties properties,
        @Qualifier("discoveryExecutor") ExecutorService discoveryExecutor
    ) {
        super(httpClient, objectMapper, properties, discoveryExecutor);
    }

    @Override
    public SourcePlatform source() {
        return SourcePlatform.PLATFORM_1111;
    }

    @Override
    public List<String> discover(String categoryId, int limit) {
        JsonNode first = fetchJson(pageUrl(categoryId, 1), true);
        List<String> urls = new ArrayList<>(links(first));
        int totalPages = first.path("result").path("pagination").path("totalPage").asInt(1);
        if (reached(urls, limit) || totalPages <= 1) {
            return truncate(urls, limit);
        }
        List<Integer> pages = pageRange(2, Math.min(totalPages, MAX_PAGES));
        collectPages(pages, PAGE_CONCURRENCY, page -> links(fetchJson(pageUrl(categoryId, page), false)), urls, limit);
        return truncate(urls, limit);
    }

    private String pageUrl(String categoryId, int page) {
        return baseUrl() + "/api/v1/search/jobs/?jobPositions=" + encode(categoryId) + "&page=" + page;
    }

    private List<String> links(JsonNode root) {
        List<String> links = new ArrayList<>();
        if (root == null) {
            return links;
        }
        for (JsonNode hit : root.path("result").path("hits")) {
            String jobId = hit.path("jobId").asText("");
            if (!jobId.isBlank()) {
                links.add(baseUrl() + "/job/" + jobId);
            }
        }
        return links;
    }
}
