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
public class Discovery104Strategy extends AbstractDiscoveryStrategy {
    static final int MAX_PAGES = 50;
    static final int PAGE_CONCURRENCY = 5;
    private static final int PAGE_SIZE = 20;

    public Discovery104Strategy(
        PoliteHttpClient httpClient,
        ObjectMapper objectMapper,
        CrawlerProperties properties,
        @Qualifier("discoveryExecutor") ExecutorService discoveryExecutor
    ) {
        super(httpClient, objectMapper, properties, discoveryExecutor);
    }

    @Override
    public SourcePlatform source() {
        return SourcePlatform.PLATFORM_104;
    }

    @Override
    public List<String> discover(String categoryId, int limit) {
        JsonNode first = fetchJson(pageUrl(categoryId, 1), true);
        List<String> urls = new ArrayList<>(links(first));
        int lastPage = first.path("metadata").path("pagination").path("lastPage").asInt(1);
        if (reached(urls, limit) || lastPage <= 1) {
            return truncate(urls, limit);
        }
        List<Integer> pages = pageRange(2, Math.min(lastPage, MAX_PAGES));
        collectPages(pages, PAGE_CONCURRENCY, page -> links(fetchJson(pageUrl(categoryId, page), false)), urls, limit);
        return truncate(urls, limit);
    }

    private String pageUrl(String categoryId, int page) {
        return baseUrl() + "/jobs/search/api/jobs?jobcat=" + encode(categoryId) + "&page=" + page + "&pagesize=" + PAGE_SIZE;
    }

    private List<String> links(JsonNode root) {
        List<String> links = new ArrayList<>();
        if (root == null) {
            return links;
        }
        for (JsonNode item : root.path("data")) {
            String link = item.path("link").path("job").asText(null);
            String absolute = PostingUrls.absolutize(link, baseUrl());
            if (absolute != null) {
                links.add(absolute);
            }
        }
        return links;
    }
}
