package com.harvest.jobcrawler.crawl.throttle;

import com.harvest.jobcrawler.config.CrawlerProperties;
import com.harvest.jobcrawler.crawl.MutableClock;
import com.harvest.jobcrawler.crawl.model.SourcePlatform;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AdaptiveThrottlerTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T00:00:00Z"));
    private final List<Long> sleeps = new ArrayList<>();
    private final Sleeper advancingSleeper = millis -> {
        sleeps.add(millis);
        clock.advance(Duration.ofMillis(millis));
    };

    @Test
    void burstUpToCapacityThenWaitsForRefill() {
        CrawlerProperties properties = properties();
        properties.getSources().put("platform_yes123", source(2.0, 2.0));
        AdaptiveThrottler throttler = new AdaptiveThrottler(new LocalThrottleStateStore(), properties, clock, advancingSleeper);

        assertThat(throttler.acquire(SourcePlatform.PLATFORM_YES123)).isTrue();
        assertThat(throttler.acquire(SourcePlatform.PLATFORM_YES123)).isTrue();
        assertThat(sleeps).isEmpty();

        assertThat(throttler.acquire(SourcePlatform.PLATFORM_YES123)).isTrue();
        assertThat(sleeps).isNotEmpty();
        long slept = sleeps.stream().mapToLong(Long::longValue).sum();
        assertThat(slept).isGreaterThanOrEqualTo(500L);
    }

    @Test
    void returnsFalseWhenTimeoutElapsesWithoutToken() {
        CrawlerProperties properties = properties();
        properties.getSources().put("platform_104", source(0.1, 1.0));
        AdaptiveThrottler throttler = new AdaptiveThrottler(new LocalThrottleStateStore(), properties, clock, advancingSleeper);

        assertThat(throttler.acquire(SourcePlatform.PLATFORM_104, null, Duration.ofSeconds(1))).isTrue();
        assertThat(throttler.acquire(SourcePlatform.PLATFORM_104, null, Duration.ofSeconds(1))).isFalse();
    }

    @Test
    void cooldownBlocksAcquisitionWithoutTouchingTheBucket() {
        CrawlerProperties properties = properties();
        ThrottleStateStore store = Mockito.spy(new LocalThrottleStateStore());
        AdaptiveThrottler throttler = new AdaptiveThrottler(store, properties, clock, advancingSleeper);

        throttler.report429(SourcePlatform.PLATFORM_1111, null, Duration.ofSeconds(30));

        assertThat(throttler.isCoolingDown(SourcePlatform.PLATFORM_1111, null)).isTrue();
        assertThat(throttler.acquire(SourcePlatform.PLATFORM_1111, null, Duration.ofSeconds(5))).isFalse();
        verify(store, never()).tryAcquire(anyString(), anyDouble(), anyDouble(), any());
        assertThat(sleeps).allMatch(ms -> ms <= properties.getThrottle().getCooldownPollMs());
    }

    @Test
    void proxyCooldownOnlyBlocksThatProxy() {
        CrawlerProperties properties = properties();
        AdaptiveThrottler throttler = new AdaptiveThrottler(new LocalThrottleStateStore(), properties, clock, advancingSleeper);

        throttler.report429(SourcePlatform.PLATFORM_104, "http://proxy-a:8080", Duration.ofSeconds(30));

        assertThat(throttler.isCoolingDown(SourcePlatform.PLATFORM_104, "http://proxy-a:8080")).isTrue();
        assertThat(throttler.isCoolingDown(SourcePlatform.PLATFORM_104, "http://proxy-b:8080")).isFalse();
        assertThat(throttler.isCoolingDown(SourcePlatform.PLATFORM_104, null)).isFalse();
    }

    @Test
    void rateLimitCutsAdaptiveRateButNeverBelowFloor() {
        CrawlerProperties properties = properties();
        AdaptiveThrottler throttler = new AdaptiveThrottler(new LocalThrottleStateStore(), properties, clock, advancingSleeper);
        double base = properties.rateFor(SourcePlatform.PLATFORM_CAKERESUME);

        for (int i = 0; i < 20; i++) {
            throttler.report429(SourcePlatform.PLATFORM_CAKERESUME, null, Duration.ofSeconds(1));
        }

        assertThat(throttler.currentRate(SourcePlatform.PLATFORM_CAKERESUME)).isEqualTo(base * 0.1);
    }

    @Test
    void failsOpenWhenStateStoreIsUnreachable() {
        ThrottleStateStore store = Mockito.mock(ThrottleStateStore.class);
        when(store.isCoolingDown(anyString(), any())).thenThrow(new DataAccessResourceFailureException("db down"));
        when(store.adaptiveRate(anyString(), anyDouble())).thenThrow(new DataAccessResourceFailureException("db down"));
        AdaptiveThrottler throttler = new AdaptiveThrottler(store, properties(), clock, advancingSleeper);

        assertThat(throttler.acquire(SourcePlatform.PLATFORM_YOURATOR)).isTrue();
        assertThat(throttler.currentRate(SourcePlatform.PLATFORM_YOURATOR)).isEqualTo(5.0);
        throttler.reportSuccess(SourcePlatform.PLATFORM_YOURATOR);
        throttler.report429(SourcePlatform.PLATFORM_YOURATOR, null);
        assertThat(sleeps).isEmpty();
    }

    private CrawlerProperties properties() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getThrottle().setCooldownPollMs(100);
        properties.getThrottle().setMaxWaitMs(200);
        return properties;
    }

    private CrawlerProperties.Source source(double rate, double capacity) {
        CrawlerProperties.Source source = new CrawlerProperties.Source();
        source.setRate(rate);
        source.setCapacity(capacity);
        return source;
    }
}
