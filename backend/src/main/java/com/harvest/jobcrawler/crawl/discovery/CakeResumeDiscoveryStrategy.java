package com.harvest.jobcrawler.crawl.discovery;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.harvest.jobcrawler.config.CrawlerProperties;
import com.harvest.jobcrawler.crawl.http.PoliteHttpClient;
import com.harvest.jobcrawler.crawl.model.SourcePlatform;
import com.harvest.jobcrawler.crawl.util.PostingUrls;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;

/**
 * CakeResume only serves HTML listings and is sensitive to request bursts, so it reads a fixed, shallow page
 * range with a lower fan-out.
 */
@Component
public class CakeResumeDiscoveryStrategy extends AbstractDiscoveryStrategy {
    static final int MAX_PAGES = 5;
    static final int PAGE_CONCURRENCY = 2;

    public CakeResumeDiscoveryStrategy(
        PoliteHttpClient httpClient,
        ObjectMapper objectMapper,
        CrawlerProperties properties,
        @Qualifier("discoveryExecutor") ExecutorService discoveryExecutor
    ) {
        super(httpClient, objectMapper, properties, discoveryExecutor);
    }

    @Override
    public SourcePlatform source() {
        return SourcePlatform.PLATFORM_CAKERESUME;
    }

    @Override
    public List<String> discover(String categoryId, int limit) {
        List<String> urls = new ArrayList<>(links(fetchPage(pageUrl(categoryId, 1), HTML_ACCEPT, true)));
        if (reached(urls, limit)) {
            return truncate(dedupe(urls), limit);
        }
        collectPages(
            pageRange(2, MAX_PAGES),
            PAGE_CONCURRENCY,
            page -> links(fetchPage(pageUrl(categoryId, page), HTML_ACCEPT, false)),
            urls,
            limit
        );
        return truncate(dedupe(urls), limit);
    }

    private String pageUrl(String categoryId, int page) {
        return baseUrl() + "/jobs?refinementList%5Bjob_categories%5D%5B0%5D=" + encode(categoryId) + "&page=" + page;
    }

    private List<String> links(String html) {
        List<String> links = new ArrayList<>();
        if (html == null) {
            return links;
        }
        Document document = Jsoup.parse(html);
        for (Element anchor : document.select("a[href]")) {
            String href = anchor.attr("href");
            if (isPostingLink(href)) {
                String absolute = PostingUrls.absolutize(href, baseUrl());
                if (absolute != null && !links.contains(absolute)) {
                    links.add(absolute);
                }
            }
        }
        return links;
    }

    static boolean isPostingLink(String href) {
        if (href == null || href.isBlank()) {
            return false;
        }
        return href.contains("/companies/")
            && (href.contains("/jobs/") || href.contains("/j/"))
            && !href.startsWith("/jobs/for-");
    }

    private static List<String> dedupe(List<String> urls) {
        Set<String> unique = new LinkedHashSet<>(urls);
        return new ArrayList<>(unique);
    }
}
