package com.harvest.jobcrawler.crawl.resilience;

import com.harvest.jobcrawler.crawl.model.CircuitSnapshot;
import com.harvest.jobcrawler.crawl.model.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Predicate;

/**
 * Fail-fast gate around one class of unreliable dependency.
 *
 * <p>CLOSED opens after {@code failureThreshold} consecutive failures. OPEN rejects without invoking the call
 * until {@code recoveryTimeout} has passed since the last failure, then the next call runs as the single
 * HALF_OPEN trial: its success closes the circuit, its failure reopens it at once.
 */
public class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private Instant openedAt;
    private boolean trialInFlight;

    public CircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout, Clock clock) {
        this.name = name;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.recoveryTimeout = recoveryTimeout;
        this.clock = clock;
    }

    public <T> T call(ProtectedCall<T> protectedCall) {
        return call(protectedCall, error -> true);
    }

    /**
     * Runs {@code protectedCall}; a thrown error only counts against the circuit when {@code countsAsFailure}
     * accepts it. Errors it rejects are rethrown and leave the failure count untouched.
     */
    public <T> T call(ProtectedCall<T> protectedCall, Predicate<Throwable> countsAsFailure) {
        boolean trial = admit();
        T result;
        try {
            result = protectedCall.call();
        } catch (RuntimeException e) {
            settle(trial, e, countsAsFailure);
            throw e;
        } catch (Exception e) {
            settle(trial, e, countsAsFailure);
            throw new ProtectedCallException(name, e);
        } catch (Error e) {
            onFailure(trial, e);
            throw e;
        }
        onSuccess(trial);
        return result;
    }

    public synchronized CircuitState state() {
        return state;
    }

    public synchronized CircuitSnapshot snapshot() {
        return new CircuitSnapshot(
            name,
            state,
            consecutiveFailures,
            openedAt,
            failureThreshold,
            recoveryTimeout.toSeconds()
        );
    }

    public String name() {
        return name;
    }

    private synchronized boolean admit() {
        Instant now = clock.instant();
        if (state == CircuitState.OPEN && openedAt != null
            && Duration.between(openedAt, now).compareTo(recoveryTimeout) > 0) {
            log.info("Circuit half-open name={}", name);
            state = CircuitState.HALF_OPEN;
            trialInFlight = false;
        }
        if (state == CircuitState.OPEN) {
            throw new CircuitOpenException(name, remaining(now));
        }
        if (state == CircuitState.HALF_OPEN) {
            if (trialInFlight) {
                throw new CircuitOpenException(name, Duration.ZERO);
            }
            trialInFlight = true;
            return true;
        }
        return false;
    }

    private void settle(boolean trial, Throwable error, Predicate<Throwable> countsAsFailure) {
        if (countsAsFailure.test(error)) {
            onFailure(trial, error);
        } else {
            onIgnored(trial, error);
        }
    }

    private synchronized void onIgnored(boolean trial, Throwable error) {
        if (trial) {
            trialInFlight = false;
        }
        log.debug("Circuit call skipped name={} error={}", name, error.getMessage());
    }

    private synchronized void onSuccess(boolean trial) {
        if (trial || state == CircuitState.HALF_OPEN) {
            log.info("Circuit closed name={}", name);
            state = CircuitState.CLOSED;
            trialInFlight = false;
        }
        consecutiveFailures = 0;
    }

    private synchronized void onFailure(boolean trial, Throwable error) {
        consecutiveFailures++;
        openedAt = clock.instant();
        log.warn("Circuit call failed name={} consecutiveFailures={} error={}", name, consecutiveFailures, error.getMessage());
        if (trial || state == CircuitState.HALF_OPEN || consecutiveFailures >= failureThreshold) {
            if (state != CircuitState.OPEN) {
                log.error("Circuit opened name={} consecutiveFailures={}", name, consecutiveFailures);
            }
            state = CircuitState.OPEN;
            trialInFlight = false;
        }
    }

    private Duration remaining(Instant now) {
        if (openedAt == null) {
            return Duration.ZERO;
        }
        Duration left = Duration.between(now, openedAt.plus(recoveryTimeout));
        return left.isNegative() ? Duration.ZERO : left;
    }
}
