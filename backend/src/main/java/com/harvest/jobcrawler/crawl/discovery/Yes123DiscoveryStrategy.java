package com.harvest.jobcrawler.crawl.discovery;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.harvest.jobcrawler.config.CrawlerProperties;
import com.harvest.jobcrawler.crawl.http.PoliteHttpClient;
import com.harvest.jobcrawler.crawl.model.SourcePlatform;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * yes123 listings are legacy ASP pages; posting links are pulled out of the raw markup.
 */
@Component
public class Yes123DiscoveryStrategy extends AbstractDiscoveryStrategy {
    static final int MAX_PAGES = 10;
    private static final Pattern JOB_LINK = Pattern.compile("job\\.asp\\?p_id=[^\"'\\s>]+");

    public Yes123DiscoveryStrategy(
        PoliteHttpClient httpClient,
        ObjectMapper objectMapper,
        CrawlerProperties properties,
        @Qualifier("discoveryExecutor") ExecutorService discoveryExecutor
    ) {
        super(httpClient, objectMapper, properties, discoveryExecutor);
    }

    @Override
    public SourcePlatform source() {
        return SourcePlatform.PLATFORM_YES123;
    }

    @Override
    public List<String> discover(String categoryId, int limit) {
        Set<String> urls = new LinkedHashSet<>();
        for (int page = 1; page <= MAX_PAGES; page++) {
            String html = fetchPage(pageUrl(categoryId, page), HTML_ACCEPT, page == 1);
            if (html == null) {
                break;
            }
            Matcher matcher = JOB_LINK.matcher(html);
            boolean matched = false;
            while (matcher.find()) {
                matched = true;
                urls.add(baseUrl() + "/wk_index/" + matcher.group().replace("&amp;", "&"));
            }
            if (!matched || (limit > 0 && urls.size() >= limit)) {
                break;
            }
        }
        return truncate(new ArrayList<>(urls), limit);
    }

    private String pageUrl(String categoryId, int page) {
        return baseUrl() + "/wk_index/joblist.asp?job_check=" + encode(categoryId) + "&now_page=" + page;
    }
}
