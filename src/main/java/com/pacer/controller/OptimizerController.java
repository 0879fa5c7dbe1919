package com.pacer.controller;

import com.pacer.model.dto.OptimizerStatistics;
import com.pacer.service.RequestOptimizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Optimizer management controller.
 * Exposes statistics, cache invalidation and rate limiter reset.
 */
@Slf4j
@RestController
@RequestMapping("/v1/optimizer")
public class OptimizerController {

    private final RequestOptimizer requestOptimizer;

    public OptimizerController(RequestOptimizer requestOptimizer) {
        this.requestOptimizer = requestOptimizer;
    }

    /**
     * Get optimizer statistics.
     */
    @GetMapping("/stats")
    public ResponseEntity<OptimizerStatistics> getStats() {
        return ResponseEntity.ok(requestOptimizer.getStatistics());
    }

    /**
     * Invalidate cached responses. Without a pattern the whole cache is cleared.
     */
    @PostMapping("/cache/invalidate")
    public ResponseEntity<Map<String, Object>> invalidateCache(
            @RequestParam(value = "pattern", required = false) String pattern) {
        log.info("Cache invalidation requested (pattern: {})", pattern);
        int removed = requestOptimizer.invalidateCache(pattern);

        return ResponseEntity.ok(Map.of(
                "status", "success",
                "removed_entries", removed
        ));
    }

    /**
     * Reset the rate limiter to its configured state.
     */
    @PostMapping("/rate-limiter/reset")
    public ResponseEntity<Map<String, String>> resetRateLimiter() {
        log.info("Rate limiter reset requested");
        requestOptimizer.resetRateLimiter();

        return ResponseEntity.ok(Map.of(
                "status", "success",
                "message", "Rate limiter reset"
        ));
    }
}
