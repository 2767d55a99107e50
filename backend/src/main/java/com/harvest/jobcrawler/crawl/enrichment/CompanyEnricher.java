package com.harvest.jobcrawler.crawl.enrichment;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.harvest.jobcrawler.config.CrawlerProperties;
import com.harvest.jobcrawler.crawl.http.DocumentFetcher;
import com.harvest.jobcrawler.crawl.jobs.PostingExtractor;
import com.harvest.jobcrawler.crawl.model.CompanyProfile;
import com.harvest.jobcrawler.crawl.model.FetchedDocument;
import com.harvest.jobcrawler.crawl.model.Organization;
import com.harvest.jobcrawler.crawl.model.SourcePlatform;
import com.harvest.jobcrawler.crawl.persistence.CrawlJdbcRepository;
import com.harvest.jobcrawler.crawl.util.PostingUrls;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads capital, headcount and contact details from an organization's company page and stores them on the
 * organization row. Profiles are cached per {@code source:sourceId} so each company page is fetched once.
 */
@Component
public class CompanyEnricher {
    private static final Logger log = LoggerFactory.getLogger(CompanyEnricher.class);

    static final String UNDISCLOSED = "暫不公開";
    private static final Set<SourcePlatform> RENDER_FIRST = Set.of(SourcePlatform.PLATFORM_104, SourcePlatform.PLATFORM_CAKERESUME);
    private static final Pattern CAPITAL = Pattern.compile("資本額\\s*[:：]?\\s*([^\\s|｜]+)");
    private static final Pattern EMPLOYEES = Pattern.compile("員工(?:人數|數)\\s*[:：]?\\s*([^\\s|｜]+)");
    private static final Pattern ADDRESS = Pattern.compile("(?:公司地址|地址)\\s*[:：]?\\s*([^\\s|｜]+)");
    private static final Pattern WEBSITE_LABEL = Pattern.compile("(?i)公司網站|官方網站|官網|website");
    private static final int SHORT_FIELD_MAX = 64;

    private final DocumentFetcher documentFetcher;
    private final PostingExtractor extractor;
    private final CrawlJdbcRepository repository;
    private final CrawlerProperties properties;
    private final Cache<String, CompanyProfile> profiles;

    public CompanyEnricher(
        DocumentFetcher documentFetcher,
        PostingExtractor extractor,
        CrawlJdbcRepository repository,
        CrawlerProperties properties
    ) {
        this.documentFetcher = documentFetcher;
        this.extractor = extractor;
        this.repository = repository;
        this.properties = properties;
        this.profiles = Caffeine.newBuilder()
            .maximumSize(properties.getEnrichment().getCompanyCacheMaxSize())
            .build();
    }

    /**
     * @return the stored profile, or empty when the organization has no company page or it could not be read
     */
    public Optional<CompanyProfile> enrich(Organization organization) {
        if (organization == null || organization.sourceId() == null) {
            return Optional.empty();
        }
        String companyUrl = PostingUrls.absolutize(organization.companyUrl(), properties.baseUrlFor(organization.source()));
        if (companyUrl == null) {
            return Optional.empty();
        }
        String key = cacheKey(organization);
        CompanyProfile profile = profiles.getIfPresent(key);
        if (profile == null) {
            String html = fetch(organization.source(), companyUrl);
            if (html == null) {
                log.debug("Company page unavailable source={} sourceId={} url={}",
                    organization.source().code(), organization.sourceId(), companyUrl);
                return Optional.empty();
            }
            profile = parse(organization.source(), html, companyUrl);
            if (profile.isEmpty()) {
                log.debug("Company page had no profile fields source={} url={}", organization.source().code(), companyUrl);
                return Optional.empty();
            }
            profiles.put(key, profile);
        }
        if (!repository.updateOrganizationProfile(organization.source(), organization.sourceId(), profile)) {
            log.debug("Organization row missing source={} sourceId={}", organization.source().code(), organization.sourceId());
        }
        return Optional.of(profile);
    }

    static String cacheKey(Organization organization) {
        return organization.source().code() + ":" + organization.sourceId();
    }

    CompanyProfile parse(SourcePlatform source, String html, String companyUrl) {
        Document document = Jsoup.parse(html, companyUrl);
        String text = document.body() == null ? "" : document.body().text();
        Organization structured = extractor.extractOrganization(source, html, companyUrl);
        String description = description(document);
        String address = disclosed(firstGroup(ADDRESS, text));
        if (structured != null) {
            description = description != null ? description : structured.description();
            address = address != null ? address : structured.address();
        }
        return new CompanyProfile(
            shorten(disclosed(firstGroup(CAPITAL, text))),
            shorten(disclosed(firstGroup(EMPLOYEES, text))),
            description,
            address,
            website(document)
        );
    }

    private String fetch(SourcePlatform source, String companyUrl) {
        if (RENDER_FIRST.contains(source)) {
            String rendered = documentFetcher.fetchRendered(companyUrl);
            return rendered != null ? rendered : documentFetcher.fetchPrimary(source, companyUrl);
        }
        FetchedDocument document = documentFetcher.fetch(source, companyUrl);
        return document == null ? null : document.body();
    }

    private static String description(Document document) {
        for (String selector : new String[] {"meta[name=description]", "meta[property=og:description]"}) {
            Element meta = document.selectFirst(selector);
            if (meta != null && !meta.attr("content").isBlank()) {
                return meta.attr("content").trim();
            }
        }
        return null;
    }

    private static String website(Document document) {
        for (Element anchor : document.select("a[href]")) {
            if (WEBSITE_LABEL.matcher(anchor.text()).find()) {
                String href = anchor.absUrl("href");
                if (href.startsWith("http")) {
                    return href;
                }
            }
        }
        return null;
    }

    private static String firstGroup(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1).trim() : null;
    }

    private static String disclosed(String value) {
        if (value == null || value.isEmpty() || value.startsWith(UNDISCLOSED)) {
            return null;
        }
        return value;
    }

    private static String shorten(String value) {
        return value == null || value.length() <= SHORT_FIELD_MAX ? value : value.substring(0, SHORT_FIELD_MAX);
    }
}
