package com.pacer.service.ratelimit;

import com.pacer.config.PacerProperties;
import com.pacer.model.BackoffStrategy;
import com.pacer.model.Priority;
import com.pacer.model.RateLimiterRegime;
import com.pacer.model.dto.RateLimiterStatistics;
import com.pacer.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AdaptiveRateLimiter.
 */
class AdaptiveRateLimiterTest {

    private PacerProperties.RateLimitConfig config;
    private MutableClock clock;
    private VirtualTimeScheduler delayScheduler;
    private AdaptiveRateLimiter limiter;

    @BeforeEach
    void setUp() {
        config = new PacerProperties.RateLimitConfig();
        config.setMaxRequestsPerWindow(80);
        config.setWindow(Duration.ofSeconds(10));
        config.setBurstLimit(5);
        config.setBurstWindow(Duration.ofSeconds(2));
        config.setBackoffStrategy(BackoffStrategy.EXPONENTIAL);
        config.setMinBackoff(Duration.ofMillis(100));
        config.setMaxBackoff(Duration.ofSeconds(60));
        config.setJitterEnabled(false);
        config.setAdaptiveMinSamples(3);

        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        delayScheduler = VirtualTimeScheduler.create();
        limiter = newLimiter();
    }

    @AfterEach
    void tearDown() {
        delayScheduler.dispose();
    }

    private AdaptiveRateLimiter newLimiter() {
        return new AdaptiveRateLimiter(config, clock, delayScheduler, Schedulers.immediate(), () -> 0.5);
    }

    private void admitNow() {
        assertEquals(Duration.ZERO, limiter.acquire(Priority.HIGH).block());
    }

    private void admitEvery(Duration spacing, int count) {
        for (int i = 0; i < count; i++) {
            admitNow();
            clock.advance(spacing);
        }
    }

    @Test
    void testFirstRequestIsNotDelayed() {
        assertEquals(Duration.ZERO, limiter.acquire(Priority.NORMAL).block());
        assertEquals(1, limiter.getStats().getPerformance().getTotalRequests());
    }

    @Test
    void testBurstLimitDelaysUntilOldestLeavesBurstWindow() {
        admitEvery(Duration.ofMillis(100), 5);

        // Five requests at 0..400ms, now at 500ms; the one at 0ms leaves the window at 2s
        assertEquals(Duration.ofMillis(1500), limiter.reserve(Priority.HIGH));
        assertEquals(RateLimiterRegime.BURST_LIMITED, limiter.getRegime());
    }

    @Test
    void testBurstDelayIncludesJitter() {
        config.setJitterEnabled(true);
        limiter = newLimiter();
        admitEvery(Duration.ofMillis(100), 5);

        // 1.5s base plus 10% of it scaled by 0.5
        Duration delay = limiter.reserve(Priority.HIGH);
        assertTrue(Math.abs(delay.toNanos() - 1_575_000_000L) < 1_000, "delay was " + delay);
    }

    @Test
    void testAcquireWaitsOutTheDelay() {
        admitEvery(Duration.ofMillis(100), 5);
        List<Duration> applied = new CopyOnWriteArrayList<>();

        limiter.acquire(Priority.HIGH).subscribe(applied::add);
        delayScheduler.advanceTimeBy(Duration.ofMillis(1499));
        assertTrue(applied.isEmpty());

        delayScheduler.advanceTimeBy(Duration.ofMillis(1));
        assertEquals(List.of(Duration.ofMillis(1500)), applied);
        assertEquals(6, limiter.getStats().getPerformance().getTotalRequests());
        assertEquals(1, limiter.getStats().getPerformance().getRequestsDelayed());
    }

    @Test
    void testWindowLimitDelaysUntilOldestLeavesWindow() {
        config.setMaxRequestsPerWindow(3);
        config.setBurstLimit(100);
        limiter = newLimiter();

        admitEvery(Duration.ofSeconds(1), 3);

        assertEquals(Duration.ofSeconds(7), limiter.reserve(Priority.HIGH));
        assertEquals(RateLimiterRegime.WINDOW_LIMITED, limiter.getRegime());
    }

    @Test
    void testWindowDelayUsesLongerBackoffWhileBackingOff() {
        config.setMaxRequestsPerWindow(3);
        config.setBurstLimit(100);
        limiter = newLimiter();
        admitEvery(Duration.ofSeconds(1), 3);

        limiter.reportRateLimitHit(Duration.ofSeconds(20));

        assertEquals(Duration.ofSeconds(20), limiter.reserve(Priority.HIGH));
    }

    @Test
    void testExponentialBackoffEscalatesAndSuccessResets() {
        limiter.reportRateLimitHit();
        assertEquals(Duration.ofMillis(200), limiter.getCurrentBackoff());
        limiter.reportRateLimitHit();
        assertEquals(Duration.ofMillis(400), limiter.getCurrentBackoff());
        limiter.reportRateLimitHit();
        assertEquals(Duration.ofMillis(800), limiter.getCurrentBackoff());
        assertEquals(3, limiter.getConsecutiveRateLimits());
        assertEquals(RateLimiterRegime.BACKING_OFF, limiter.getRegime());

        limiter.reportSuccess(Duration.ofMillis(120));

        assertEquals(Duration.ofMillis(100), limiter.getCurrentBackoff());
        assertEquals(0, limiter.getConsecutiveRateLimits());
        assertEquals(RateLimiterRegime.NORMAL, limiter.getRegime());
    }

    @Test
    void testRemainingBackoffDelaysNextRequest() {
        limiter.reportRateLimitHit();

        assertEquals(Duration.ofMillis(200), limiter.reserve(Priority.HIGH));

        clock.advance(Duration.ofMillis(150));
        assertEquals(Duration.ofMillis(50), limiter.reserve(Priority.HIGH));

        clock.advance(Duration.ofMillis(50));
        assertEquals(Duration.ZERO, limiter.reserve(Priority.HIGH));
    }

    @Test
    void testServerSuggestedDelayIsHonoured() {
        limiter.reportRateLimitHit(Duration.ofSeconds(3));

        assertEquals(Duration.ofSeconds(3), limiter.getCurrentBackoff());
        assertEquals(Duration.ofSeconds(3), limiter.reserve(Priority.HIGH));
    }

    @Test
    void testPriorityFloorSpacing() {
        admitNow();

        assertEquals(Duration.ofMillis(50), limiter.reserve(Priority.HIGH));
        assertEquals(Duration.ofMillis(100), limiter.reserve(Priority.NORMAL));
        assertEquals(Duration.ofMillis(200), limiter.reserve(Priority.LOW));

        clock.advance(Duration.ofMillis(150));
        assertEquals(Duration.ZERO, limiter.reserve(Priority.NORMAL));
        assertEquals(Duration.ofMillis(50), limiter.reserve(Priority.LOW));
    }

    @Test
    void testRetuneRaisesCapacityWhenObservedRateIsHigher() {
        recordSuccessIntervals(3, Duration.ofMillis(50));

        limiter.adaptRateLimits();

        assertEquals(85, limiter.getMaxRequestsPerWindow());
    }

    @Test
    void testRetuneRespectsCeiling() {
        config.setMaxRequestsPerWindow(98);
        config.setAdaptiveCeiling(100);
        limiter = newLimiter();
        recordSuccessIntervals(3, Duration.ofMillis(50));

        limiter.adaptRateLimits();

        assertEquals(100, limiter.getMaxRequestsPerWindow());
    }

    @Test
    void testRetuneLowersCapacityAfterRepeatedHits() {
        recordSuccessIntervals(3, Duration.ofMillis(50));
        for (int i = 0; i < 4; i++) {
            limiter.reportRateLimitHit();
        }

        limiter.adaptRateLimits();

        assertEquals(75, limiter.getMaxRequestsPerWindow());
    }

    @Test
    void testRetuneRespectsFloor() {
        config.setMaxRequestsPerWindow(22);
        config.setAdaptiveFloor(20);
        limiter = newLimiter();
        recordSuccessIntervals(3, Duration.ofMillis(50));
        for (int i = 0; i < 4; i++) {
            limiter.reportRateLimitHit();
        }

        limiter.adaptRateLimits();

        assertEquals(20, limiter.getMaxRequestsPerWindow());
    }

    @Test
    void testRetuneNeedsMinimumSamples() {
        recordSuccessIntervals(2, Duration.ofMillis(50));

        limiter.adaptRateLimits();

        assertEquals(80, limiter.getMaxRequestsPerWindow());
    }

    @Test
    void testRetuneRunsAutomaticallyAfterInterval() {
        config.setAdaptiveInterval(Duration.ofMinutes(5));
        limiter = newLimiter();
        recordSuccessIntervals(3, Duration.ofMillis(50));

        clock.advance(Duration.ofMinutes(6));
        admitNow();

        assertEquals(85, limiter.getMaxRequestsPerWindow());
        assertEquals(RateLimiterRegime.NORMAL, limiter.getRegime());
    }

    @Test
    void testPerformanceCallbacksReceiveStats() {
        List<RateLimiterStatistics> seen = new CopyOnWriteArrayList<>();
        limiter.addPerformanceCallback(stats -> {
            throw new IllegalStateException("broken listener");
        });
        limiter.addPerformanceCallback(seen::add);

        admitNow();

        assertEquals(1, seen.size());
        assertEquals(1, seen.get(0).getPerformance().getTotalRequests());
    }

    @Test
    void testResetClearsMetricsAndBackoff() {
        admitNow();
        limiter.reportRateLimitHit();
        limiter.reportRateLimitHit();

        limiter.reset();

        RateLimiterStatistics stats = limiter.getStats();
        assertEquals(0, stats.getPerformance().getTotalRequests());
        assertEquals(0, stats.getPerformance().getRateLimitHits());
        assertEquals(0, stats.getCurrentState().getConsecutiveRateLimits());
        assertEquals(0.1, stats.getCurrentState().getCurrentBackoffSeconds());
        assertEquals(Duration.ofMillis(100), limiter.getCurrentBackoff());
    }

    @Test
    void testStatsReflectActivity() {
        admitEvery(Duration.ofMillis(100), 5);
        limiter.reserve(Priority.HIGH);
        limiter.reportRateLimitHit();

        RateLimiterStatistics stats = limiter.getStats();
        assertEquals(80, stats.getConfig().getMaxRequestsPerWindow());
        assertEquals(BackoffStrategy.EXPONENTIAL, stats.getConfig().getBackoffStrategy());
        assertEquals(5, stats.getCurrentState().getRequestsInWindow());
        assertEquals(5, stats.getCurrentState().getRequestsInBurstWindow());
        assertEquals(1, stats.getPerformance().getRequestsDelayed());
        assertEquals(1, stats.getPerformance().getRateLimitHits());
        assertEquals(1, stats.getPerformance().getBackoffEvents());
        assertEquals(RateLimiterRegime.BURST_LIMITED, stats.getCurrentState().getRegime());
    }

    /**
     * Admit a request, let {@code interval} pass and report success, {@code count} times.
     */
    private void recordSuccessIntervals(int count, Duration interval) {
        for (int i = 0; i < count; i++) {
            admitNow();
            clock.advance(interval);
            limiter.reportSuccess(interval);
            clock.advance(Duration.ofMillis(500));
        }
    }
}
