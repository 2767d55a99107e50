package com.harvest.jobcrawler.crawl.enrichment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.harvest.jobcrawler.config.CrawlerProperties;
import com.harvest.jobcrawler.crawl.http.DocumentFetcher;
import com.harvest.jobcrawler.crawl.http.PoliteHttpClient;
import com.harvest.jobcrawler.crawl.jobs.PostingExtractor;
import com.harvest.jobcrawler.crawl.model.CompanyProfile;
import com.harvest.jobcrawler.crawl.model.JobPosting;
import com.harvest.jobcrawler.crawl.model.Organization;
import com.harvest.jobcrawler.crawl.model.SourcePlatform;
import com.harvest.jobcrawler.crawl.persistence.CrawlJdbcRepository;
import com.harvest.jobcrawler.crawl.resilience.CircuitBreakerRegistry;
import com.harvest.jobcrawler.crawl.throttle.AdaptiveThrottler;
import com.harvest.jobcrawler.crawl.throttle.LocalThrottleStateStore;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class CompanyEnricherTest {
    private static final String COMPANY_PAGE = """
        <html>
          <head><meta name="description" content="Acme builds logistics software."></head>
          <body>
            <ul>
              <li>資本額：暫不公開</li>
              <li>員工人數：50人</li>
              <li>地址：台北市中山區南京東路二段100號</li>
            </ul>
            <a href="https://acme.example.com/">公司網站</a>
            <a href="/jobs">Open jobs</a>
          </body>
        </html>
        """;

    private MockWebServer server;
    private ExecutorService executor;
    private CrawlJdbcRepository repository;
    private CompanyEnricher enricher;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(2);

        CrawlerProperties properties = new CrawlerProperties();
        properties.setRequestTimeoutSeconds(5);
        properties.setRequestMaxRetries(0);
        for (SourcePlatform source : new SourcePlatform[] {SourcePlatform.PLATFORM_104, SourcePlatform.PLATFORM_YES123}) {
            CrawlerProperties.Source config = new CrawlerProperties.Source();
            config.setBaseUrl(server.url("/").toString());
            config.setRate(100.0);
            config.setCapacity(100.0);
            properties.getSources().put(source.code(), config);
        }
        AdaptiveThrottler throttler = new AdaptiveThrottler(new LocalThrottleStateStore(), properties, Clock.systemUTC());
        DocumentFetcher documentFetcher = new DocumentFetcher(
            properties,
            new PoliteHttpClient(properties, executor, throttler),
            Optional.empty(),
            new CircuitBreakerRegistry(properties, Clock.systemUTC())
        );
        repository = Mockito.mock(CrawlJdbcRepository.class);
        enricher = new CompanyEnricher(documentFetcher, new PostingExtractor(new ObjectMapper()), repository, properties);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void readsProfileFromCompanyPageAndStoresIt() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setHeader("Content-Type", "text/html; charset=utf-8").setBody(COMPANY_PAGE));
        Organization organization = organization(SourcePlatform.PLATFORM_YES123, "C77821", server.url("/comp_info.asp?p_id=C77821").toString());

        Optional<CompanyProfile> profile = enricher.enrich(organization);

        CompanyProfile expected = new CompanyProfile(
            null,
            "50人",
            "Acme builds logistics software.",
            "台北市中山區南京東路二段100號",
            "https://acme.example.com/"
        );
        assertThat(profile).contains(expected);
        assertThat(server.takeRequest().getPath()).isEqualTo("/comp_info.asp?p_id=C77821");
        verify(repository).updateOrganizationProfile(SourcePlatform.PLATFORM_YES123, "C77821", expected);
    }

    @Test
    void cachedProfileIsReusedWithoutRefetching() {
        server.enqueue(new MockResponse().setResponseCode(200).setHeader("Content-Type", "text/html; charset=utf-8")
            .setBody("<html><body><p>資本額 1000萬元</p><p>員工數 120人</p></body></html>"));
        Organization organization = organization(SourcePlatform.PLATFORM_104, "a5x1", server.url("/company/a5x1").toString());

        Optional<CompanyProfile> first = enricher.enrich(organization);
        Optional<CompanyProfile> second = enricher.enrich(organization);

        assertThat(first).isPresent();
        assertThat(first.get().capital()).isEqualTo("1000萬元");
        assertThat(first.get().employeeCount()).isEqualTo("120人");
        assertThat(second).isEqualTo(first);
        assertThat(server.getRequestCount()).isEqualTo(1);
        verify(repository, times(2)).updateOrganizationProfile(SourcePlatform.PLATFORM_104, "a5x1", first.get());
        assertThat(CompanyEnricher.cacheKey(organization)).isEqualTo("platform_104:a5x1");
    }

    @Test
    void structuredOrganizationFillsFieldsTheTextLacks() {
        server.enqueue(new MockResponse().setResponseCode(200).setHeader("Content-Type", "text/html; charset=utf-8").setBody("""
            <html><head><script type="application/ld+json">
            {"@context":"https://schema.org","@type":"Organization","name":"Beta",
             "description":"Beta makes payment terminals.",
             "address":{"@type":"PostalAddress","streetAddress":"新北市板橋區文化路一段1號"}}
            </script></head>
            <body><p>員工人數：300人</p></body></html>
            """));
        Organization organization = organization(SourcePlatform.PLATFORM_YES123, "C9", server.url("/comp_info.asp?p_id=C9").toString());

        CompanyProfile profile = enricher.enrich(organization).orElseThrow();

        assertThat(profile.employeeCount()).isEqualTo("300人");
        assertThat(profile.description()).isEqualTo("Beta makes payment terminals.");
        assertThat(profile.address()).contains("新北市板橋區文化路一段1號");
        assertThat(profile.capital()).isNull();
    }

    @Test
    void missingCompanyPageLeavesTheRowAlone() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("gone"));
        server.enqueue(new MockResponse().setResponseCode(404).setBody("gone"));
        Organization organization = organization(SourcePlatform.PLATFORM_YES123, "C1", server.url("/comp_info.asp?p_id=C1").toString());

        assertThat(enricher.enrich(organization)).isEmpty();
        verify(repository, never()).updateOrganizationProfile(any(), anyString(), any());
    }

    @Test
    void organizationWithoutCompanyLinkIsSkipped() {
        assertThat(enricher.enrich(organization(SourcePlatform.PLATFORM_104, "a5x1", null))).isEmpty();
        assertThat(enricher.enrich(null)).isEmpty();

        assertThat(server.getRequestCount()).isZero();
        verify(repository, never()).updateOrganizationProfile(any(), anyString(), any());
    }

    private static Organization organization(SourcePlatform source, String sourceId, String companyUrl) {
        return new Organization(source, sourceId, "Acme", companyUrl, null, null, JobPosting.LAYER_NATIVE);
    }
}
