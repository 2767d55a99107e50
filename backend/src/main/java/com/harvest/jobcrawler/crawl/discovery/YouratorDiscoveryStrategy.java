package com.harvest.jobcrawler.crawl.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.harvest.jobcrawler.config.CrawlerProperties;
import com.harvest.jobcrawler.crawl.http.PoliteHttpClient;
import com.harvest.jobcrawler.crawl.model.SourcePlatform;
import com.harvest.jobcrawler.crawl.util.PostingUrls;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

@Component
public class YouratorDiscoveryStrategy extends AbstractDiscoveryStrategy {
    static final int MAX_PAGES = 10;

    public YouratorDiscoveryStrategy(
        PoliteHttpClient httpClient,
        ObjectMapper objectMapper,
        CrawlerProperties properties,
        @Qualifier("discoveryExecutor") ExecutorService discoveryExecutor
    ) {
        super(httpClient, objectMapper, properties, discoveryExecutor);
    }

    @Override
    public SourcePlatform source() {
        return SourcePlatform.PLATFORM_YOURATOR;
    }

    @Override
    public List<String> discover(String categoryId, int limit) {
        List<String> urls = new ArrayList<>();
        for (int page = 1; page <= MAX_PAGES; page++) {
            JsonNode root = fetchJson(pageUrl(categoryId, page), page == 1);
            if (root == null) {
                break;
            }
            JsonNode payload = root.path("payload");
            JsonNode jobs = payload.path("jobs");
            if (!jobs.isArray() || jobs.isEmpty()) {
                break;
            }
            for (JsonNode job : jobs) {
                String absolute = PostingUrls.absolutize(job.path("path").asText(null), baseUrl());
                if (absolute != null) {
                    urls.add(absolute);
                }
            }
            JsonNode nextPage = payload.get("nextPage");
            if (reached(urls, limit) || nextPage == null || nextPage.isNull()) {
                break;
            }
        }
        return truncate(urls, limit);
    }

    private String pageUrl(String categoryId, int page) {
        return baseUrl() + "/api/v4/jobs?category_id%5B%5D=" + encode(categoryId) + "&page=" + page;
    }
}
