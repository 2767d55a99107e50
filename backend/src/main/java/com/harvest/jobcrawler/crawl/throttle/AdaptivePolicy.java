package com.harvest.jobcrawler.crawl.throttle;

import com.harvest.jobcrawler.config.CrawlerProperties;

public record AdaptivePolicy(
    int successStreakThreshold,
    double boostFactor,
    double backoffFactor,
    double maxRateMultiplier,
    double minRateMultiplier
) {
    public static AdaptivePolicy from(CrawlerProperties.Throttle throttle) {
        return new AdaptivePolicy(
            throttle.getSuccessStreakThreshold(),
            throttle.getBoostFactor(),
            throttle.getBackoffFactor(),
            throttle.getMaxRateMultiplier(),
            throttle.getMinRateMultiplier()
        );
    }

    public double clamp(double rate, double baseRate) {
        double upper = baseRate * maxRateMultiplier;
        double lower = baseRate * minRateMultiplier;
        return Math.min(upper, Math.max(lower, rate));
    }

    public double boost(double currentRate, double baseRate) {
        return clamp(currentRate * boostFactor, baseRate);
    }

    public double cut(double currentRate, double baseRate) {
        return clamp(currentRate * backoffFactor, baseRate);
    }
}
