package com.harvest.jobcrawler.crawl.healing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.harvest.jobcrawler.config.CrawlerProperties;
import com.harvest.jobcrawler.crawl.MutableClock;
import com.harvest.jobcrawler.crawl.model.JobPosting;
import com.harvest.jobcrawler.crawl.model.SourcePlatform;
import com.harvest.jobcrawler.crawl.resilience.CircuitBreakerRegistry;
import com.harvest.jobcrawler.crawl.resilience.HealingIsolationGate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SelfHealingServiceTest {
    private static final String URL = "https://www.yourator.co/companies/acme/jobs/123";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T00:00:00Z"));
    private CrawlerProperties properties;
    private OllamaClient ollamaClient;
    private HealingIsolationGate gate;

    @BeforeEach
    void setUp() {
        properties = new CrawlerProperties();
        properties.getHealing().setFailureThreshold(2);
        properties.getCircuits().setAiFailureThreshold(5);
        ollamaClient = Mockito.mock(OllamaClient.class);
        gate = new HealingIsolationGate(properties, clock);
    }

    @Test
    void acceptsAnswerWhoseTitleMatchesThePage() throws Exception {
        when(ollamaClient.extractJob(anyString())).thenReturn(answer(
            "{\"title\":\"Backend Engineer\",\"company_name\":\"Acme\",\"address\":\"台北市信義區\","
                + "\"salary_min\":\"50,000\",\"salary_max\":70000,\"salary_type\":\"月薪\"}"
        ));

        Optional<HealedRecord> healed = service().heal(SourcePlatform.PLATFORM_YOURATOR, "<html/>", URL, "Backend Engineer | Acme");

        assertThat(healed).isPresent();
        JobPosting posting = healed.get().posting();
        assertThat(posting.sourceId()).isEqualTo("123");
        assertThat(posting.title()).isEqualTo("Backend Engineer");
        assertThat(posting.dataSourceLayer()).isEqualTo(JobPosting.LAYER_AI_HEALED);
        assertThat(posting.salaryMin()).isEqualTo(50000L);
        assertThat(posting.salaryMax()).isEqualTo(70000L);
        assertThat(healed.get().organization().sourceId()).isEqualTo("acme");
        assertThat(healed.get().organization().name()).isEqualTo("Acme");
    }

    @Test
    void rejectsAnswerThatDriftsFromThePageTitle() throws Exception {
        when(ollamaClient.extractJob(anyString())).thenReturn(answer("{\"title\":\"Senior Data Scientist\"}"));

        Optional<HealedRecord> healed = service().heal(SourcePlatform.PLATFORM_YOURATOR, "<html/>", URL, "Login required");

        assertThat(healed).isEmpty();
        assertThat(gate.isIsolated()).isFalse();
    }

    @Test
    void missingPageTitleNeverPassesTheSimilarityCheck() throws Exception {
        when(ollamaClient.extractJob(anyString())).thenReturn(answer("{\"title\":\"Backend Engineer\"}"));

        assertThat(service().heal(SourcePlatform.PLATFORM_YOURATOR, "<html/>", URL, null)).isEmpty();
    }

    @Test
    void repeatedFailuresIsolateHealing() {
        when(ollamaClient.extractJob(anyString())).thenThrow(new AiHealingException("Ollama call failed: io_error"));
        SelfHealingService service = service();

        assertThat(service.heal(SourcePlatform.PLATFORM_YOURATOR, "<html/>", URL, "Backend")).isEmpty();
        assertThat(service.heal(SourcePlatform.PLATFORM_YOURATOR, "<html/>", URL, "Backend")).isEmpty();
        assertThat(gate.isIsolated()).isTrue();

        assertThat(service.heal(SourcePlatform.PLATFORM_YOURATOR, "<html/>", URL, "Backend")).isEmpty();
        verify(ollamaClient, times(2)).extractJob(anyString());
    }

    @Test
    void openCircuitSkipsCallWithoutCountingTowardsIsolation() {
        properties.getCircuits().setAiFailureThreshold(1);
        properties.getHealing().setFailureThreshold(2);
        when(ollamaClient.extractJob(anyString())).thenThrow(new AiHealingException("Ollama returned malformed JSON"));
        SelfHealingService service = service();

        service.heal(SourcePlatform.PLATFORM_YOURATOR, "<html/>", URL, "Backend");
        service.heal(SourcePlatform.PLATFORM_YOURATOR, "<html/>", URL, "Backend");
        service.heal(SourcePlatform.PLATFORM_YOURATOR, "<html/>", URL, "Backend");

        verify(ollamaClient, times(1)).extractJob(anyString());
        assertThat(gate.isIsolated()).isFalse();
    }

    @Test
    void disabledHealingNeverCallsTheModel() {
        properties.getHealing().setEnabled(false);

        assertThat(service().heal(SourcePlatform.PLATFORM_YOURATOR, "<html/>", URL, "Backend")).isEmpty();
        verify(ollamaClient, never()).extractJob(anyString());
    }

    private SelfHealingService service() {
        return new SelfHealingService(ollamaClient, new CircuitBreakerRegistry(properties, clock), gate, properties);
    }

    private JsonNode answer(String json) throws Exception {
        return objectMapper.readTree(json);
    }
}
