package com.gpappid.harvester.harvest.service;

import com.gpappid.harvester.config.HarvesterProperties;
import com.gpappid.harvester.harvest.model.FetchSummary;
import com.gpappid.harvester.harvest.shard.InvalidShardUrlException;
import com.gpappid.harvester.harvest.shard.ResumeIndex;
import com.gpappid.harvester.harvest.shard.ShardFailureKind;
import com.gpappid.harvester.harvest.shard.ShardFetchOutcome;
import com.gpappid.harvester.harvest.shard.ShardFetcher;
import com.gpappid.harvester.harvest.shard.ShardKeyCollisionException;
import com.gpappid.harvester.harvest.shard.ShardNameResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the pending shards of a harvest on a fixed pool of workers.
 *
 * <p>Shards are handed out in URL order, one per free worker. A stop request (or an interrupt of
 * the calling thread) ends dispatching; shards already handed out always run to completion so
 * their record is either fully written or removed.
 */
@Service
public class ShardFetchScheduler {
    private static final Logger log = LoggerFactory.getLogger(ShardFetchScheduler.class);

    private final ShardFetcher shardFetcher;
    private final ResumeIndex resumeIndex;
    private final HarvesterProperties properties;
    private volatile boolean stopRequested;

    public ShardFetchScheduler(ShardFetcher shardFetcher, ResumeIndex resumeIndex, HarvesterProperties properties) {
        this.shardFetcher = shardFetcher;
        this.resumeIndex = resumeIndex;
        this.properties = properties;
    }

    /** Stops dispatching for the rest of this scheduler's life. In-flight shards still finish. */
    public void requestStop() {
        stopRequested = true;
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    public FetchSummary run(Set<String> allUrls, Path cacheDir, int concurrency) {
        checkKeyCollisions(allUrls);
        int staleTemps = resumeIndex.removeStaleTempFiles(cacheDir);
        if (staleTemps > 0) {
            log.info("Removed {} stale temp files from {}", staleTemps, cacheDir);
        }

        Set<String> completed = resumeIndex.completedKeys(cacheDir);
        List<String> pending = new ArrayList<>();
        int alreadyCompleted = 0;
        for (String url : allUrls) {
            String key = keyOrNull(url);
            if (key != null && completed.contains(key)) {
                alreadyCompleted++;
            } else {
                pending.add(url);
            }
        }
        if (pending.isEmpty()) {
            log.info("No pending shards; {} already completed", alreadyCompleted);
            return FetchSummary.nothingPending(alreadyCompleted);
        }
        Collections.sort(pending);

        int workers = Math.max(1, concurrency);
        log.info(
            "Fetching {} pending shards with {} workers ({} already completed)",
            pending.size(),
            workers,
            alreadyCompleted
        );

        RunProgress progress = new RunProgress(pending.size(), properties.getProgressLogInterval());
        ExecutorService pool = Executors.newFixedThreadPool(workers, new CustomizableThreadFactory("shard-fetch-"));
        Semaphore freeWorkers = new Semaphore(workers);
        int dispatched = 0;
        try {
            for (String url : pending) {
                if (stopRequested) {
                    break;
                }
                try {
                    freeWorkers.acquire();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while dispatching shards; waiting for in-flight shards to finish");
                    break;
                }
                if (stopRequested) {
                    freeWorkers.release();
                    break;
                }
                CompletableFuture
                    .supplyAsync(() -> fetchOne(url, cacheDir), pool)
                    .whenComplete((outcome, error) -> {
                        try {
                            progress.record(url, outcome, error);
                        } finally {
                            freeWorkers.release();
                        }
                    });
                dispatched++;
            }
        } finally {
            freeWorkers.acquireUninterruptibly(workers);
            pool.shutdown();
        }

        int notDispatched = pending.size() - dispatched;
        if (notDispatched > 0) {
            log.warn("Stopped before dispatching {} of {} pending shards", notDispatched, pending.size());
        }
        return new FetchSummary(
            progress.succeeded.get(),
            progress.failed.get(),
            alreadyCompleted,
            notDispatched,
            Collections.unmodifiableMap(new TreeMap<>(progress.failures))
        );
    }

    private ShardFetchOutcome fetchOne(String url, Path cacheDir) {
        try {
            return shardFetcher.fetch(url, cacheDir);
        } catch (RuntimeException e) {
            return ShardFetchOutcome.failure(url, ShardFailureKind.UNEXPECTED, e.toString());
        }
    }

    private void checkKeyCollisions(Set<String> allUrls) {
        Map<String, Set<String>> urlsByKey = new LinkedHashMap<>();
        for (String url : allUrls) {
            String key = keyOrNull(url);
            if (key != null) {
                urlsByKey.computeIfAbsent(key, ignored -> new TreeSet<>()).add(url);
            }
        }
        for (Map.Entry<String, Set<String>> entry : urlsByKey.entrySet()) {
            if (entry.getValue().size() > 1) {
                throw new ShardKeyCollisionException(entry.getKey(), new ArrayList<>(entry.getValue()));
            }
        }
    }

    private String keyOrNull(String url) {
        try {
            return ShardNameResolver.resolve(url);
        } catch (InvalidShardUrlException e) {
            return null;
        }
    }

    private static final class RunProgress {
        private final int total;
        private final int logInterval;
        private final AtomicInteger finished = new AtomicInteger();
        private final AtomicInteger succeeded = new AtomicInteger();
        private final AtomicInteger failed = new AtomicInteger();
        private final Map<String, ShardFailureKind> failures = new ConcurrentHashMap<>();

        private RunProgress(int total, int logInterval) {
            this.total = total;
            this.logInterval = logInterval;
        }

        private void record(String url, ShardFetchOutcome outcome, Throwable error) {
            if (error != null) {
                failed.incrementAndGet();
                failures.put(url, ShardFailureKind.UNEXPECTED);
                log.warn("Shard {} failed unexpectedly", url, error);
            } else if (outcome.success()) {
                succeeded.incrementAndGet();
            } else {
                failed.incrementAndGet();
                failures.put(url, outcome.failureKind());
                log.warn("Shard {} failed ({}): {}", url, outcome.failureKind(), outcome.message());
            }
            int done = finished.incrementAndGet();
            if (done % logInterval == 0 || done == total) {
                log.info("Progress {}/{} shards ({} failed)", done, total, failed.get());
            }
        }
    }
}
