package com.pacer.service.batch;

import com.pacer.config.PacerProperties;
import com.pacer.exception.BatchExecutionException;
import com.pacer.exception.BatchTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Groups requests sharing a batch key into one downstream invocation.
 *
 * A group is flushed when its timer ({@code pacer.batch.timeout}) fires or
 * when it reaches {@code pacer.batch.max-batch-size}, whichever comes first.
 * The executor must return one result per item, in item order; result
 * {@code i} resolves the caller that submitted item {@code i}.
 *
 * Each caller waits at most {@code pacer.batch.max-wait} and then fails
 * with {@link BatchTimeoutException}, whether or not the batch later resolves.
 */
@Slf4j
@Component
public class RequestBatcher {

    private final PacerProperties.BatchConfig config;
    private final Scheduler scheduler;
    private final Map<String, BatchGroup<?, ?>> pending = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong batchedItems = new AtomicLong();
    private final AtomicLong flushedBatches = new AtomicLong();

    @Autowired
    public RequestBatcher(PacerProperties properties) {
        this(properties, Schedulers.parallel());
    }

    RequestBatcher(PacerProperties properties, Scheduler scheduler) {
        this.config = properties.getBatch();
        this.scheduler = scheduler;
    }

    /**
     * Add an item to the batch for {@code batchKey} and wait for its own result.
     *
     * @param batchKey key grouping compatible items
     * @param item     item to submit
     * @param execute  executor invoked once per flushed batch; the first caller's executor is used
     * @return the result for this item
     */
    @SuppressWarnings("unchecked")
    public <I, R> Mono<R> enqueue(String batchKey, I item, Function<List<I>, Mono<List<R>>> execute) {
        if (!config.isEnabled()) {
            return Mono.defer(() -> execute.apply(List.of(item)))
                    .switchIfEmpty(Mono.error(() -> new BatchExecutionException(batchKey,
                            "Batch executor completed without results")))
                    .flatMap(results -> {
                        if (results.size() != 1) {
                            return Mono.error(mismatch(batchKey, 1, results.size()));
                        }
                        return Mono.justOrEmpty(results.get(0));
                    });
        }

        return Mono.defer(() -> {
            Sinks.One<R> sink = Sinks.one();
            BatchGroup<I, R> full = null;

            lock.lock();
            try {
                BatchGroup<I, R> group = (BatchGroup<I, R>) pending.get(batchKey);
                if (group == null) {
                    group = new BatchGroup<>(execute);
                    pending.put(batchKey, group);
                    BatchGroup<I, R> scheduled = group;
                    group.timer = Mono.delay(config.getTimeout(), scheduler)
                            .subscribe(tick -> flushIfPending(batchKey, scheduled));
                }

                group.items.add(new PendingItem<>(item, sink));

                if (group.items.size() >= config.getMaxBatchSize()) {
                    pending.remove(batchKey);
                    group.timer.dispose();
                    full = group;
                }
            } finally {
                lock.unlock();
            }

            if (full != null) {
                log.debug("Batch {} reached max size {}, flushing", batchKey, config.getMaxBatchSize());
                execute(batchKey, full);
            }

            Duration maxWait = config.getMaxWait();
            return sink.asMono()
                    .timeout(maxWait, Mono.error(() -> new BatchTimeoutException(batchKey, maxWait)), scheduler);
        });
    }

    /**
     * Flush the pending batch for {@code batchKey} now, if there is one.
     *
     * @return true if a batch was flushed
     */
    public boolean flush(String batchKey) {
        BatchGroup<?, ?> group;
        lock.lock();
        try {
            group = pending.remove(batchKey);
            if (group != null && group.timer != null) {
                group.timer.dispose();
            }
        } finally {
            lock.unlock();
        }

        if (group == null) {
            return false;
        }
        execute(batchKey, group);
        return true;
    }

    public int getPendingCount(String batchKey) {
        lock.lock();
        try {
            BatchGroup<?, ?> group = pending.get(batchKey);
            return group == null ? 0 : group.items.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of items that went out as part of a flushed batch.
     */
    public long getBatchedItemCount() {
        return batchedItems.get();
    }

    public long getFlushedBatchCount() {
        return flushedBatches.get();
    }

    private void flushIfPending(String batchKey, BatchGroup<?, ?> group) {
        lock.lock();
        try {
            // Already flushed because it filled up
            if (!pending.remove(batchKey, group)) {
                return;
            }
        } finally {
            lock.unlock();
        }
        log.debug("Batch {} timer fired, flushing", batchKey);
        execute(batchKey, group);
    }

    private <I, R> void execute(String batchKey, BatchGroup<I, R> group) {
        List<I> items = new ArrayList<>(group.items.size());
        for (PendingItem<I, R> p : group.items) {
            items.add(p.item);
        }

        flushedBatches.incrementAndGet();
        batchedItems.addAndGet(items.size());
        log.debug("Executing batch {} with {} requests", batchKey, items.size());

        Mono<List<R>> call;
        try {
            call = group.execute.apply(items);
        } catch (RuntimeException e) {
            call = Mono.error(e);
        }

        call.switchIfEmpty(Mono.error(() -> new BatchExecutionException(batchKey,
                        "Batch executor completed without results")))
                .subscribe(
                        results -> dispatch(batchKey, group, results),
                        error -> {
                            log.warn("Batch {} failed: {}", batchKey, error.toString());
                            group.items.forEach(p -> p.sink.tryEmitError(error));
                        });
    }

    private <I, R> void dispatch(String batchKey, BatchGroup<I, R> group, List<R> results) {
        if (results.size() != group.items.size()) {
            BatchExecutionException error = mismatch(batchKey, group.items.size(), results.size());
            log.warn(error.getMessage());
            group.items.forEach(p -> p.sink.tryEmitError(error));
            return;
        }

        for (int i = 0; i < results.size(); i++) {
            R result = results.get(i);
            Sinks.One<R> sink = group.items.get(i).sink;
            if (result == null) {
                sink.tryEmitEmpty();
            } else {
                sink.tryEmitValue(result);
            }
        }
    }

    private static BatchExecutionException mismatch(String batchKey, int expected, int actual) {
        return new BatchExecutionException(batchKey,
                "Batch '" + batchKey + "' returned " + actual + " results for " + expected + " items");
    }

    private static final class BatchGroup<I, R> {
        private final List<PendingItem<I, R>> items = new ArrayList<>();
        private final Function<List<I>, Mono<List<R>>> execute;
        private Disposable timer;

        private BatchGroup(Function<List<I>, Mono<List<R>>> execute) {
            this.execute = execute;
        }
    }

    private static final class PendingItem<I, R> {
        private final I item;
        private final Sinks.One<R> sink;

        private PendingItem(I item, Sinks.One<R> sink) {
            this.item = item;
            this.sink = sink;
        }
    }
}
