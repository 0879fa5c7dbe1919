package com.pacer.service.ratelimit;

import com.pacer.config.PacerProperties;
import com.pacer.model.Priority;
import com.pacer.model.RateLimiterRegime;
import com.pacer.model.dto.RateLimiterStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.DoubleSupplier;

/**
 * Client-side admission gate in front of a rate-limited API.
 *
 * Before each physical request {@link #acquire(Priority)} computes a delay,
 * checked in this order, first non-zero wins:
 * <ol>
 *   <li>burst window full: wait until its oldest entry leaves, plus jitter</li>
 *   <li>long window full: wait until its oldest entry leaves (at least the
 *       current backoff while backing off), plus jitter</li>
 *   <li>inside a backoff period: wait out the remaining backoff</li>
 *   <li>minimum spacing for the request's priority</li>
 * </ol>
 * The delay is computed under the lock and served outside it. Rate-limit
 * hits escalate the backoff through {@link BackoffPolicy}; a success resets
 * it fully. Capacity of the long window is retuned periodically off the
 * admission path.
 */
@Slf4j
@Component
public class AdaptiveRateLimiter {

    private static final double JITTER_RATIO = 0.1;
    private static final double ADAPTIVE_HEADROOM = 1.2;

    private final PacerProperties.RateLimitConfig config;
    private final Clock clock;
    private final Scheduler delayScheduler;
    private final Scheduler retuneScheduler;
    private final DoubleSupplier random;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Instant> windowTimes = new ArrayDeque<>();
    private final Deque<Instant> burstTimes = new ArrayDeque<>();
    private final Deque<IntervalSample> successIntervals = new ArrayDeque<>();
    private final AtomicBoolean adapting = new AtomicBoolean();
    private final List<Consumer<RateLimiterStatistics>> performanceCallbacks = new CopyOnWriteArrayList<>();

    private volatile int maxRequestsPerWindow;

    // Backoff state
    private int consecutiveRateLimits;
    private Instant lastRateLimitAt;
    private Duration currentBackoff;

    private Instant lastAdaptiveAdjustment;

    // Metrics
    private long totalRequests;
    private long requestsDelayed;
    private Duration totalDelay = Duration.ZERO;
    private long rateLimitHits;
    private long backoffEvents;
    private double avgRequestIntervalSeconds;
    private double currentRatePerSecond;

    @Autowired
    public AdaptiveRateLimiter(PacerProperties properties, Clock clock) {
        this(properties.getRateLimit(), clock, Schedulers.parallel(), Schedulers.boundedElastic(),
                () -> ThreadLocalRandom.current().nextDouble());
    }

    AdaptiveRateLimiter(PacerProperties.RateLimitConfig config,
                        Clock clock,
                        Scheduler delayScheduler,
                        Scheduler retuneScheduler,
                        DoubleSupplier random) {
        this.config = config;
        this.clock = clock;
        this.delayScheduler = delayScheduler;
        this.retuneScheduler = retuneScheduler;
        this.random = random;
        this.maxRequestsPerWindow = config.getMaxRequestsPerWindow();
        this.currentBackoff = config.getMinBackoff();
        this.lastAdaptiveAdjustment = clock.instant();
    }

    /**
     * Wait until a request of the given priority may proceed, then record it.
     *
     * @return the delay that was applied, {@link Duration#ZERO} if none
     */
    public Mono<Duration> acquire(Priority priority) {
        Priority effective = priority == null ? Priority.NORMAL : priority;
        return Mono.fromSupplier(() -> reserve(effective))
                .flatMap(delay -> delay.isZero()
                        ? Mono.just(delay)
                        : Mono.delay(delay, delayScheduler).thenReturn(delay))
                .map(delay -> {
                    recordRequest();
                    return delay;
                });
    }

    /**
     * Report that the API answered with a rate-limit signal.
     *
     * @param serverSuggestedDelay delay from the server (e.g. Retry-After); null if none
     */
    public void reportRateLimitHit(Duration serverSuggestedDelay) {
        int consecutive;
        Duration backoff;

        lock.lock();
        try {
            rateLimitHits++;
            consecutiveRateLimits++;
            lastRateLimitAt = clock.instant();
            currentBackoff = BackoffPolicy.next(currentBackoff, serverSuggestedDelay, config);
            backoffEvents++;

            consecutive = consecutiveRateLimits;
            backoff = currentBackoff;
        } finally {
            lock.unlock();
        }

        log.warn("Rate limit hit (#{}), backing off to {}ms", consecutive, backoff.toMillis());
    }

    public void reportRateLimitHit() {
        reportRateLimitHit(null);
    }

    /**
     * Report a successful physical request. Clears any backoff and records
     * the interval since the latest admitted request for capacity tuning.
     *
     * @param responseTime time the request took
     */
    public void reportSuccess(Duration responseTime) {
        lock.lock();
        try {
            if (consecutiveRateLimits > 0) {
                log.info("Rate limit cleared after {} hits", consecutiveRateLimits);
                consecutiveRateLimits = 0;
                currentBackoff = config.getMinBackoff();
            }

            Instant now = clock.instant();
            Instant latest = windowTimes.peekLast();
            if (latest != null) {
                successIntervals.addLast(new IntervalSample(now, Duration.between(latest, now)));
                pruneIntervalSamples(now);
            }
        } finally {
            lock.unlock();
        }

        if (log.isDebugEnabled() && responseTime != null) {
            log.debug("Successful request in {}ms", responseTime.toMillis());
        }
    }

    public void reportSuccess() {
        reportSuccess(null);
    }

    /**
     * Register a callback notified with fresh statistics after every acquire.
     */
    public void addPerformanceCallback(Consumer<RateLimiterStatistics> callback) {
        performanceCallbacks.add(callback);
    }

    /**
     * Clear metrics and backoff state. Tracked request timestamps and the
     * current capacity are kept.
     */
    public void reset() {
        lock.lock();
        try {
            totalRequests = 0;
            requestsDelayed = 0;
            totalDelay = Duration.ZERO;
            rateLimitHits = 0;
            backoffEvents = 0;
            avgRequestIntervalSeconds = 0.0;
            currentRatePerSecond = 0.0;
            consecutiveRateLimits = 0;
            lastRateLimitAt = null;
            currentBackoff = config.getMinBackoff();
        } finally {
            lock.unlock();
        }
        log.info("Rate limiter statistics reset");
    }

    /**
     * Compute the delay for the next request and account for it.
     */
    Duration reserve(Priority priority) {
        Duration delay;
        lock.lock();
        try {
            Instant now = clock.instant();
            prune(now);
            delay = calculateDelay(now, priority);
            if (!delay.isZero()) {
                requestsDelayed++;
                totalDelay = totalDelay.plus(delay);
            }
        } finally {
            lock.unlock();
        }

        if (!delay.isZero()) {
            log.debug("Rate limiting: delaying {}ms", delay.toMillis());
        }
        return delay;
    }

    private Duration calculateDelay(Instant now, Priority priority) {
        if (burstTimes.size() >= config.getBurstLimit()) {
            Duration burstDelay = remaining(config.getBurstWindow(), burstTimes.peekFirst(), now);
            if (isPositive(burstDelay)) {
                return burstDelay.plus(jitter(burstDelay));
            }
        }

        if (windowTimes.size() >= maxRequestsPerWindow) {
            Duration windowDelay = remaining(config.getWindow(), windowTimes.peekFirst(), now);
            if (isPositive(windowDelay)) {
                Duration base = windowDelay;
                if (consecutiveRateLimits > 0 && currentBackoff.compareTo(base) > 0) {
                    base = currentBackoff;
                }
                return base.plus(jitter(base));
            }
        }

        if (consecutiveRateLimits > 0 && lastRateLimitAt != null) {
            Duration backoffLeft = remaining(currentBackoff, lastRateLimitAt, now);
            if (isPositive(backoffLeft)) {
                return backoffLeft;
            }
        }

        Instant latest = windowTimes.peekLast();
        if (latest != null) {
            Duration floorLeft = remaining(priority.getMinInterval(), latest, now);
            if (isPositive(floorLeft)) {
                return floorLeft;
            }
        }

        return Duration.ZERO;
    }

    private void recordRequest() {
        boolean retune;
        lock.lock();
        try {
            Instant now = clock.instant();
            windowTimes.addLast(now);
            burstTimes.addLast(now);
            totalRequests++;
            updateMetrics();
            retune = shouldAdapt(now);
        } finally {
            lock.unlock();
        }

        notifyPerformanceCallbacks();

        if (retune) {
            scheduleRetune();
        }
    }

    private void updateMetrics() {
        int count = windowTimes.size();
        if (count < 2) {
            return;
        }
        double spanSeconds = seconds(Duration.between(windowTimes.peekFirst(), windowTimes.peekLast()));
        if (spanSeconds > 0) {
            currentRatePerSecond = count / spanSeconds;
        }
        // Mean of consecutive gaps telescopes to span / (count - 1)
        avgRequestIntervalSeconds = spanSeconds / (count - 1);
    }

    private boolean shouldAdapt(Instant now) {
        return config.isAdaptiveEnabled()
                && Duration.between(lastAdaptiveAdjustment, now).compareTo(config.getAdaptiveInterval()) > 0
                && adapting.compareAndSet(false, true);
    }

    private void scheduleRetune() {
        Mono.fromRunnable(this::adaptRateLimits)
                .subscribeOn(retuneScheduler)
                .doFinally(signal -> adapting.set(false))
                .subscribe(unused -> { }, error -> log.error("Adaptive rate limit adjustment failed", error));
    }

    /**
     * Retune the long-window capacity from the recent success intervals.
     * Raises capacity when the observed rate clearly exceeds it and no hits
     * are outstanding; lowers it after repeated consecutive hits.
     */
    void adaptRateLimits() {
        List<IntervalSample> samples;
        int consecutive;
        int currentMax;
        Instant now;

        lock.lock();
        try {
            now = clock.instant();
            pruneIntervalSamples(now);
            samples = new ArrayList<>(successIntervals);
            consecutive = consecutiveRateLimits;
            currentMax = maxRequestsPerWindow;
        } finally {
            lock.unlock();
        }

        int newMax = currentMax;
        if (samples.size() >= config.getAdaptiveMinSamples()) {
            double avgInterval = samples.stream()
                    .mapToDouble(s -> seconds(s.interval))
                    .average()
                    .orElse(0.0);
            double achievableRate = avgInterval > 0 ? 1.0 / avgInterval : Double.POSITIVE_INFINITY;
            double configuredRate = currentMax / seconds(config.getWindow());

            if (achievableRate > configuredRate * ADAPTIVE_HEADROOM && consecutive == 0) {
                newMax = Math.min(currentMax + config.getAdaptiveStep(), config.getAdaptiveCeiling());
            } else if (consecutive > config.getAdaptiveHitThreshold()) {
                newMax = Math.max(currentMax - config.getAdaptiveStep(), config.getAdaptiveFloor());
            }
        }

        lock.lock();
        try {
            maxRequestsPerWindow = newMax;
            lastAdaptiveAdjustment = now;
        } finally {
            lock.unlock();
        }

        if (newMax > currentMax) {
            log.info("Adaptive rate limit increase: {} -> {}", currentMax, newMax);
        } else if (newMax < currentMax) {
            log.info("Adaptive rate limit decrease: {} -> {}", currentMax, newMax);
        }
    }

    private void notifyPerformanceCallbacks() {
        if (performanceCallbacks.isEmpty()) {
            return;
        }
        RateLimiterStatistics stats = getStats();
        for (Consumer<RateLimiterStatistics> callback : performanceCallbacks) {
            try {
                callback.accept(stats);
            } catch (RuntimeException e) {
                log.warn("Performance callback failed: {}", e.getMessage());
            }
        }
    }

    public RateLimiterStatistics getStats() {
        lock.lock();
        try {
            Instant now = clock.instant();
            int inWindow = countWithin(windowTimes, config.getWindow(), now);
            int inBurst = countWithin(burstTimes, config.getBurstWindow(), now);

            double efficiency = totalRequests > 0 ? 1.0 - (double) requestsDelayed / totalRequests : 1.0;
            double avgDelay = requestsDelayed > 0 ? seconds(totalDelay) / requestsDelayed : 0.0;

            return RateLimiterStatistics.builder()
                    .config(RateLimiterStatistics.Configuration.builder()
                            .maxRequestsPerWindow(maxRequestsPerWindow)
                            .windowSeconds(seconds(config.getWindow()))
                            .burstLimit(config.getBurstLimit())
                            .burstWindowSeconds(seconds(config.getBurstWindow()))
                            .backoffStrategy(config.getBackoffStrategy())
                            .build())
                    .currentState(RateLimiterStatistics.CurrentState.builder()
                            .regime(regime(inWindow, inBurst))
                            .requestsInWindow(inWindow)
                            .requestsInBurstWindow(inBurst)
                            .consecutiveRateLimits(consecutiveRateLimits)
                            .currentBackoffSeconds(seconds(currentBackoff))
                            .currentRatePerSecond(round(currentRatePerSecond, 2))
                            .avgRequestIntervalSeconds(round(avgRequestIntervalSeconds, 3))
                            .build())
                    .performance(RateLimiterStatistics.Performance.builder()
                            .totalRequests(totalRequests)
                            .requestsDelayed(requestsDelayed)
                            .efficiencyPercentage(round(efficiency * 100, 1))
                            .avgDelaySeconds(round(avgDelay, 3))
                            .rateLimitHits(rateLimitHits)
                            .backoffEvents(backoffEvents)
                            .build())
                    .recommendations(recommendations(efficiency, inWindow))
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public RateLimiterRegime getRegime() {
        lock.lock();
        try {
            Instant now = clock.instant();
            return regime(countWithin(windowTimes, config.getWindow(), now),
                    countWithin(burstTimes, config.getBurstWindow(), now));
        } finally {
            lock.unlock();
        }
    }

    public Duration getCurrentBackoff() {
        lock.lock();
        try {
            return currentBackoff;
        } finally {
            lock.unlock();
        }
    }

    public int getConsecutiveRateLimits() {
        lock.lock();
        try {
            return consecutiveRateLimits;
        } finally {
            lock.unlock();
        }
    }

    public int getMaxRequestsPerWindow() {
        return maxRequestsPerWindow;
    }

    private RateLimiterRegime regime(int inWindow, int inBurst) {
        if (adapting.get()) {
            return RateLimiterRegime.ADAPTING;
        }
        if (inBurst >= config.getBurstLimit()) {
            return RateLimiterRegime.BURST_LIMITED;
        }
        if (inWindow >= maxRequestsPerWindow) {
            return RateLimiterRegime.WINDOW_LIMITED;
        }
        if (consecutiveRateLimits > 0) {
            return RateLimiterRegime.BACKING_OFF;
        }
        return RateLimiterRegime.NORMAL;
    }

    private List<String> recommendations(double efficiency, int inWindow) {
        List<String> recommendations = new ArrayList<>();

        if (efficiency < 0.8) {
            recommendations.add("Low efficiency detected - consider reducing request rate");
        }
        if (consecutiveRateLimits > 5) {
            recommendations.add("Frequent rate limits - API limits may have changed");
        }
        if (currentRatePerSecond > 8) {
            recommendations.add("High request rate - monitor for rate limit hits");
        }
        if (inWindow >= maxRequestsPerWindow) {
            recommendations.add("Operating at rate limit capacity - consider request batching");
        }

        return recommendations;
    }

    private void prune(Instant now) {
        Instant windowCutoff = now.minus(config.getWindow());
        while (!windowTimes.isEmpty() && !windowTimes.peekFirst().isAfter(windowCutoff)) {
            windowTimes.pollFirst();
        }

        Instant burstCutoff = now.minus(config.getBurstWindow());
        while (!burstTimes.isEmpty() && !burstTimes.peekFirst().isAfter(burstCutoff)) {
            burstTimes.pollFirst();
        }
    }

    private void pruneIntervalSamples(Instant now) {
        Instant cutoff = now.minus(config.getIntervalSampleAge());
        while (!successIntervals.isEmpty() && successIntervals.peekFirst().observedAt.isBefore(cutoff)) {
            successIntervals.pollFirst();
        }
        while (successIntervals.size() > config.getIntervalSampleSize()) {
            successIntervals.pollFirst();
        }
    }

    private Duration jitter(Duration base) {
        if (!config.isJitterEnabled()) {
            return Duration.ZERO;
        }
        return Duration.ofNanos((long) (base.toNanos() * JITTER_RATIO * random.getAsDouble()));
    }

    private static int countWithin(Deque<Instant> times, Duration horizon, Instant now) {
        Instant cutoff = now.minus(horizon);
        int count = 0;
        for (Instant t : times) {
            if (t.isAfter(cutoff)) {
                count++;
            }
        }
        return count;
    }

    private static Duration remaining(Duration span, Instant since, Instant now) {
        return span.minus(Duration.between(since, now));
    }

    private static boolean isPositive(Duration duration) {
        return !duration.isNegative() && !duration.isZero();
    }

    private static double seconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }

    private static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0.0;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    private static final class IntervalSample {
        private final Instant observedAt;
        private final Duration interval;

        private IntervalSample(Instant observedAt, Duration interval) {
            this.observedAt = observedAt;
            this.interval = interval;
        }
    }
}
