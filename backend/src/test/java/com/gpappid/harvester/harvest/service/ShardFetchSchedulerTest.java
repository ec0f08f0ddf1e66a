package com.gpappid.harvester.harvest.service;

import com.gpappid.harvester.config.HarvesterProperties;
import com.gpappid.harvester.harvest.model.FetchSummary;
import com.gpappid.harvester.harvest.shard.ResumeIndex;
import com.gpappid.harvester.harvest.shard.ShardFailureKind;
import com.gpappid.harvester.harvest.shard.ShardFetchOutcome;
import com.gpappid.harvester.harvest.shard.ShardFetcher;
import com.gpappid.harvester.harvest.shard.ShardKeyCollisionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ShardFetchSchedulerTest {
    private static final String BASE = "https://play.google.com/sitemaps/";

    @Mock private ShardFetcher shardFetcher;

    @TempDir Path cacheDir;

    private ShardFetchScheduler scheduler;

    @BeforeEach
    void setUp() {
        HarvesterProperties properties = new HarvesterProperties();
        properties.setProgressLogInterval(2);
        scheduler = new ShardFetchScheduler(shardFetcher, new ResumeIndex(), properties);
    }

    @Test
    void shardsWithExistingRecordsAreNotDispatched() throws Exception {
        Files.writeString(cacheDir.resolve("A.xml.gz.txt"), "100\n200\n");
        succeedAll();

        FetchSummary summary = scheduler.run(Set.of(BASE + "A.xml.gz", BASE + "B.xml.gz"), cacheDir, 4);

        verify(shardFetcher, never()).fetch(eq(BASE + "A.xml.gz"), any(Path.class));
        verify(shardFetcher).fetch(BASE + "B.xml.gz", cacheDir);
        assertThat(summary.succeeded()).isEqualTo(1);
        assertThat(summary.failed()).isZero();
        assertThat(summary.alreadyCompleted()).isEqualTo(1);
    }

    @Test
    void leftoverTempFilesAreSweptBeforeDispatch() throws Exception {
        Files.writeString(cacheDir.resolve("A.xml.gz.txt"), "100\n");
        Files.writeString(cacheDir.resolve(".B.xml.gz.txt.99.tmp"), "partial");
        succeedAll();

        FetchSummary summary = scheduler.run(Set.of(BASE + "A.xml.gz", BASE + "B.xml.gz"), cacheDir, 2);

        assertThat(cacheDir.resolve(".B.xml.gz.txt.99.tmp")).doesNotExist();
        assertThat(summary.alreadyCompleted()).isEqualTo(1);
        verify(shardFetcher).fetch(BASE + "B.xml.gz", cacheDir);
    }

    @Test
    void nothingPendingReturnsZeroCountsWithoutDispatch() throws Exception {
        Files.writeString(cacheDir.resolve("A.xml.gz.txt"), "");

        FetchSummary summary = scheduler.run(Set.of(BASE + "A.xml.gz"), cacheDir, 4);

        assertThat(summary.succeeded()).isZero();
        assertThat(summary.failed()).isZero();
        assertThat(summary.isComplete()).isTrue();
        verifyNoInteractions(shardFetcher);
    }

    @Test
    void dispatchesPendingShardsInUrlOrder() {
        succeedAll();
        Set<String> urls = new LinkedHashSet<>();
        urls.add(BASE + "c.xml.gz");
        urls.add(BASE + "a.xml.gz");
        urls.add(BASE + "b.xml.gz");

        scheduler.run(urls, cacheDir, 1);

        InOrder order = inOrder(shardFetcher);
        order.verify(shardFetcher).fetch(BASE + "a.xml.gz", cacheDir);
        order.verify(shardFetcher).fetch(BASE + "b.xml.gz", cacheDir);
        order.verify(shardFetcher).fetch(BASE + "c.xml.gz", cacheDir);
    }

    @Test
    void failuresAreCountedWithoutStoppingTheBatch() {
        when(shardFetcher.fetch(anyString(), any(Path.class))).thenAnswer(invocation -> {
            String url = invocation.getArgument(0);
            if (url.endsWith("b.xml.gz")) {
                return ShardFetchOutcome.failure(url, ShardFailureKind.DECOMPRESS, "gzip_decode_error");
            }
            if (url.endsWith("c.xml.gz")) {
                throw new IllegalStateException("boom");
            }
            return ShardFetchOutcome.success(url, 3);
        });

        FetchSummary summary = scheduler.run(
            Set.of(BASE + "a.xml.gz", BASE + "b.xml.gz", BASE + "c.xml.gz", BASE + "d.xml.gz"),
            cacheDir,
            2
        );

        assertThat(summary.succeeded()).isEqualTo(2);
        assertThat(summary.failed()).isEqualTo(2);
        assertThat(summary.failures())
            .containsEntry(BASE + "b.xml.gz", ShardFailureKind.DECOMPRESS)
            .containsEntry(BASE + "c.xml.gz", ShardFailureKind.UNEXPECTED);
        assertThat(summary.isComplete()).isFalse();
    }

    @Test
    void neverRunsMoreShardsAtOnceThanTheConcurrency() {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        when(shardFetcher.fetch(anyString(), any(Path.class))).thenAnswer(invocation -> {
            int now = active.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            Thread.sleep(20);
            active.decrementAndGet();
            return ShardFetchOutcome.success(invocation.getArgument(0), 1);
        });
        Set<String> urls = new LinkedHashSet<>();
        for (int i = 0; i < 12; i++) {
            urls.add(BASE + "part-" + i + ".xml.gz");
        }

        FetchSummary summary = scheduler.run(urls, cacheDir, 3);

        assertThat(summary.succeeded()).isEqualTo(12);
        assertThat(peak.get()).isBetween(1, 3);
        verify(shardFetcher, times(12)).fetch(anyString(), eq(cacheDir));
    }

    @Test
    void stopRequestEndsDispatchButLetsInFlightShardFinish() {
        when(shardFetcher.fetch(anyString(), any(Path.class))).thenAnswer(invocation -> {
            scheduler.requestStop();
            return ShardFetchOutcome.success(invocation.getArgument(0), 1);
        });

        FetchSummary summary = scheduler.run(
            Set.of(BASE + "a.xml.gz", BASE + "b.xml.gz", BASE + "c.xml.gz"),
            cacheDir,
            1
        );

        assertThat(summary.succeeded()).isEqualTo(1);
        assertThat(summary.notDispatched()).isEqualTo(2);
        assertThat(summary.isComplete()).isFalse();
        verify(shardFetcher).fetch(BASE + "a.xml.gz", cacheDir);
    }

    @Test
    void interruptingTheCallerEndsDispatchButLetsInFlightShardFinish() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean finished = new AtomicBoolean();
        when(shardFetcher.fetch(anyString(), any(Path.class))).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            finished.set(true);
            return ShardFetchOutcome.success(invocation.getArgument(0), 1);
        });
        AtomicReference<FetchSummary> result = new AtomicReference<>();
        AtomicBoolean interruptedAfterRun = new AtomicBoolean();
        Thread coordinator = new Thread(() -> {
            result.set(scheduler.run(Set.of(BASE + "a.xml.gz", BASE + "b.xml.gz", BASE + "c.xml.gz"), cacheDir, 1));
            interruptedAfterRun.set(Thread.currentThread().isInterrupted());
        }, "coordinator");

        coordinator.start();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        while (coordinator.getState() != Thread.State.WAITING) {
            Thread.onSpinWait();
        }
        coordinator.interrupt();
        release.countDown();
        coordinator.join(TimeUnit.SECONDS.toMillis(5));

        assertThat(coordinator.isAlive()).isFalse();
        assertThat(finished).isTrue();
        assertThat(result.get().succeeded()).isEqualTo(1);
        assertThat(result.get().notDispatched()).isEqualTo(2);
        assertThat(interruptedAfterRun).isTrue();
        verify(shardFetcher).fetch(BASE + "a.xml.gz", cacheDir);
    }

    @Test
    void collidingShardKeysFailBeforeAnyDispatch() {
        Set<String> urls = Set.of("https://a.example/x/part.xml.gz", "https://b.example/y/part.xml.gz");

        assertThatThrownBy(() -> scheduler.run(urls, cacheDir, 2))
            .isInstanceOf(ShardKeyCollisionException.class)
            .hasMessageContaining("part.xml.gz");
        verifyNoInteractions(shardFetcher);
    }

    @Test
    void invalidShardUrlStaysPendingAndIsDispatched() {
        when(shardFetcher.fetch(anyString(), any(Path.class))).thenAnswer(invocation ->
            ShardFetchOutcome.failure(invocation.getArgument(0), ShardFailureKind.INVALID_URL, "no segment"));

        FetchSummary summary = scheduler.run(Set.of("https://play.google.com/"), cacheDir, 1);

        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.failures()).containsEntry("https://play.google.com/", ShardFailureKind.INVALID_URL);
    }

    private void succeedAll() {
        when(shardFetcher.fetch(anyString(), any(Path.class)))
            .thenAnswer(invocation -> ShardFetchOutcome.success(invocation.getArgument(0), 1));
    }
}
