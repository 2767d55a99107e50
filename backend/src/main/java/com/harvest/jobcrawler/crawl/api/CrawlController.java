package com.harvest.jobcrawler.crawl.api;

import com.harvest.jobcrawler.crawl.model.CircuitSnapshot;
import com.harvest.jobcrawler.crawl.model.CrawlRunRequest;
import com.harvest.jobcrawler.crawl.model.PlatformHealth;
import com.harvest.jobcrawler.crawl.resilience.CircuitBreakerRegistry;
import com.harvest.jobcrawler.crawl.service.CrawlOrchestratorService;
import com.harvest.jobcrawler.crawl.service.PlatformHealthService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/crawl")
public class CrawlController {
    private final CrawlOrchestratorService crawlOrchestratorService;
    private final PlatformHealthService platformHealthService;
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    public CrawlController(
        CrawlOrchestratorService crawlOrchestratorService,
        PlatformHealthService platformHealthService,
        CircuitBreakerRegistry circuitBreakerRegistry
    ) {
        this.crawlOrchestratorService = crawlOrchestratorService;
        this.platformHealthService = platformHealthService;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
    }

    @PostMapping("/run")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Object> runCrawl(@RequestBody(required = false) CrawlRunRequest request) {
        CrawlRunRequest effective = request == null ? new CrawlRunRequest(null, null, null, null) : request;
        Instant acceptedAt = crawlOrchestratorService.startAsync(effective);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "accepted");
        body.put("acceptedAt", acceptedAt);
        body.put("source", effective.source() == null ? "all" : effective.source());
        return body;
    }

    @PostMapping("/stop")
    public Map<String, Object> stopCrawl() {
        boolean wasRunning = crawlOrchestratorService.requestStop();
        return Map.of("stopRequested", true, "wasRunning", wasRunning);
    }

    @GetMapping("/health")
    public List<PlatformHealth> health() {
        return platformHealthService.listHealth();
    }

    @GetMapping("/circuits")
    public List<CircuitSnapshot> circuits() {
        return circuitBreakerRegistry.snapshots();
    }
}
