package com.contact.dedup.api;

import com.contact.dedup.core.InvalidConfigurationException;
import com.contact.dedup.core.model.ContactRecord;
import com.contact.dedup.core.model.DuplicateDecision;
import com.contact.dedup.core.model.MatchCandidate;
import com.contact.dedup.logging.LogContext;
import com.contact.dedup.matching.MatchAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Asynchronous duplicate checks on a bounded worker pool.
 * The candidate lookup runs with the configured timeout; each candidate comparison is a
 * separate task, and the results are ranked in candidate input order once all complete.
 * Failures complete the returned future exceptionally, a lookup timeout with
 * {@link java.util.concurrent.TimeoutException}.
 */
public class AsyncDeduplicationService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AsyncDeduplicationService.class);

    private final DeduplicationService service;
    private final ExecutorService executor;
    private final long timeoutMs;

    AsyncDeduplicationService(DeduplicationService service) {
        this.service = service;
        DeduplicationOptions options = service.getOptions();
        this.executor = Executors.newFixedThreadPool(options.getParallelism(), new WorkerThreadFactory());
        this.timeoutMs = options.getCandidateLookupTimeout().toMillis();
        log.debug("AsyncDeduplicationService started with {} workers", options.getParallelism());
    }

    public CompletableFuture<DuplicateDecision> checkDuplicatesAsync(ContactRecord record) {
        return checkDuplicatesAsync(record, service.getOptions().getDuplicateThreshold());
    }

    /**
     * @throws InvalidConfigurationException if the threshold is outside [0, 100]
     */
    public CompletableFuture<DuplicateDecision> checkDuplicatesAsync(ContactRecord record, double threshold) {
        Objects.requireNonNull(record, "record is required");
        InvalidConfigurationException.requireThreshold(threshold, "threshold");

        long start = System.nanoTime();
        String fingerprint = service.fingerprint(record);
        Optional<DuplicateDecision> cached = service.cachedDecision(fingerprint, threshold);
        if (cached.isPresent()) {
            return CompletableFuture.completedFuture(cached.get());
        }
        if (!service.hasComparableFields(record)) {
            return CompletableFuture.completedFuture(
                    service.completeCheck(service.getResolver().decide(record, List.of(), threshold), 0, start));
        }

        String correlationId = LogContext.generateCorrelationId();
        return CompletableFuture.supplyAsync(
                        () -> service.getCandidateProvider().findPlausibleCandidates(record), executor)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .thenCompose(candidates -> compareAll(record, candidates)
                        .thenApply(matches -> {
                            try (LogContext ctx = LogContext.forDuplicateCheck(correlationId, fingerprint)) {
                                DuplicateDecision decision = service.getResolver().decide(record, matches, threshold);
                                return service.completeCheck(decision, candidates == null ? 0 : candidates.size(), start);
                            }
                        }));
    }

    /**
     * Checks every record at the configured threshold. The result list follows the input order.
     */
    public CompletableFuture<List<DuplicateDecision>> checkBatchAsync(List<ContactRecord> records) {
        List<CompletableFuture<DuplicateDecision>> futures = records.stream()
                .map(this::checkDuplicatesAsync)
                .toList();

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> futures.stream()
                        .map(CompletableFuture::join)
                        .toList());
    }

    private CompletableFuture<List<MatchCandidate>> compareAll(ContactRecord incoming, List<ContactRecord> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        MatchAggregator aggregator = service.getResolver().getAggregator();
        List<CompletableFuture<Optional<MatchCandidate>>> comparisons = candidates.stream()
                .map(candidate -> CompletableFuture.supplyAsync(
                        () -> aggregator.aggregate(incoming, candidate), executor))
                .toList();

        return CompletableFuture.allOf(comparisons.toArray(new CompletableFuture[0]))
                .thenApply(v -> comparisons.stream()
                        .map(CompletableFuture::join)
                        .flatMap(Optional::stream)
                        .toList());
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "dedup-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
