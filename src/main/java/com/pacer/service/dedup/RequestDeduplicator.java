package com.pacer.service.dedup;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Collapses concurrent identical requests into one physical call.
 *
 * The first caller for a key registers a shared completion sink and starts
 * the producer. Callers arriving before it resolves attach to the same sink
 * and observe the identical value or error. The entry is removed before the
 * sink is resolved, so a request starting afterwards begins a new cluster.
 *
 * The producer is subscribed by the deduplicator, not by any caller:
 * cancelling one caller's subscription leaves the shared call running.
 */
@Slf4j
@Component
public class RequestDeduplicator {

    private final Map<String, Sinks.One<Object>> inFlight = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong deduplicated = new AtomicLong();

    /**
     * Join the in-flight call for {@code key}, or start one with {@code produce}.
     *
     * @param key     dedup key
     * @param produce producer of the physical call; invoked at most once per cluster
     * @return the shared result
     */
    @SuppressWarnings("unchecked")
    public <T> Mono<T> join(String key, Supplier<Mono<T>> produce) {
        return Mono.defer(() -> {
            Sinks.One<Object> sink;
            boolean owner = false;

            lock.lock();
            try {
                sink = inFlight.get(key);
                if (sink == null) {
                    sink = Sinks.one();
                    inFlight.put(key, sink);
                    owner = true;
                } else {
                    deduplicated.incrementAndGet();
                }
            } finally {
                lock.unlock();
            }

            if (owner) {
                start(key, sink, produce);
            } else {
                log.debug("Deduplicating request {}", key);
            }

            return (Mono<T>) sink.asMono();
        });
    }

    private <T> void start(String key, Sinks.One<Object> sink, Supplier<Mono<T>> produce) {
        Mono<T> call;
        try {
            call = produce.get();
        } catch (RuntimeException e) {
            call = Mono.error(e);
        }

        call.subscribe(
                value -> {
                    remove(key, sink);
                    sink.tryEmitValue(value);
                },
                error -> {
                    remove(key, sink);
                    sink.tryEmitError(error);
                },
                () -> {
                    // Completed without a value; no-op if a value was already emitted
                    remove(key, sink);
                    sink.tryEmitEmpty();
                });
    }

    private void remove(String key, Sinks.One<Object> sink) {
        lock.lock();
        try {
            inFlight.remove(key, sink);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of callers that joined an existing in-flight call.
     */
    public long getDeduplicatedCount() {
        return deduplicated.get();
    }

    /**
     * Number of distinct calls currently in flight.
     */
    public int getInFlightCount() {
        lock.lock();
        try {
            return inFlight.size();
        } finally {
            lock.unlock();
        }
    }
}
