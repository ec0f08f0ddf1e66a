package com.gpappid.harvester.harvest.service;

import com.gpappid.harvester.config.HarvesterProperties;
import com.gpappid.harvester.harvest.model.FetchSummary;
import com.gpappid.harvester.harvest.model.HarvestRequest;
import com.gpappid.harvester.harvest.model.HarvestSummary;
import com.gpappid.harvester.harvest.model.MergeStatus;
import com.gpappid.harvester.harvest.robots.RobotsTxtService;
import com.gpappid.harvester.harvest.sitemap.SitemapIndexResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.time.Instant;
import java.util.List;
import java.util.Set;

@Service
public class AppIdHarvestService {
    private static final Logger log = LoggerFactory.getLogger(AppIdHarvestService.class);

    private final HarvesterProperties properties;
    private final RobotsTxtService robotsTxtService;
    private final SitemapIndexResolver sitemapIndexResolver;
    private final ShardFetchScheduler scheduler;
    private final ResultAggregator aggregator;
    private final HarvestReportWriter reportWriter;

    public AppIdHarvestService(
        HarvesterProperties properties,
        RobotsTxtService robotsTxtService,
        SitemapIndexResolver sitemapIndexResolver,
        ShardFetchScheduler scheduler,
        ResultAggregator aggregator,
        HarvestReportWriter reportWriter
    ) {
        this.properties = properties;
        this.robotsTxtService = robotsTxtService;
        this.sitemapIndexResolver = sitemapIndexResolver;
        this.scheduler = scheduler;
        this.aggregator = aggregator;
        this.reportWriter = reportWriter;
    }

    /** Full harvest with the configured paths: resolve shard urls, fetch pending shards, merge, report. */
    public HarvestSummary harvest() {
        HarvestPaths paths = HarvestPaths.from(properties);
        log.info("Task: {}", properties.getTaskName());
        log.info("Cache dir: {}", paths.cacheDir());
        log.info("Output file: {}", paths.outputPath());
        try {
            Files.createDirectories(paths.cacheDir());
        } catch (IOException e) {
            throw new UncheckedIOException("failed to create " + paths.cacheDir(), e);
        }

        List<String> indexUrls = sitemapIndexResolver.hasCachedShardList(paths.shardListFile())
            ? List.of()
            : robotsTxtService.sitemapIndexUrls(properties.getRobotsTxtUrl());
        Set<String> shardUrls = sitemapIndexResolver.resolveShardUrls(indexUrls, paths.shardListFile());

        HarvestSummary summary = run(new HarvestRequest(
            properties.getConcurrency(),
            paths.cacheDir(),
            paths.outputPath(),
            shardUrls
        ));
        reportWriter.write(paths.reportFile(), properties.getTaskName(), summary);
        return summary;
    }

    public HarvestSummary run(HarvestRequest request) {
        Instant startedAt = Instant.now();
        FetchSummary fetch = scheduler.run(request.shardUrls(), request.cacheDir(), request.concurrency());

        if (fetch.failed() > 0) {
            log.warn(
                "{} of {} attempted shards failed; re-run to retry only the failed or missing shards",
                fetch.failed(),
                fetch.attempted()
            );
        } else if (fetch.attempted() > 0) {
            log.info("All {} shards done", fetch.attempted());
        }

        MergeStatus merge;
        if (fetch.stoppedEarly()) {
            log.warn("Skipping merge: stopped before {} pending shards were dispatched", fetch.notDispatched());
            merge = MergeStatus.SKIPPED_INCOMPLETE;
        } else {
            try {
                merge = aggregator.merge(request.cacheDir(), request.outputPath());
            } catch (ResultMergeException e) {
                log.error("Merge failed; it will be retried on the next run", e);
                merge = MergeStatus.FAILED;
            }
            if (merge == MergeStatus.MERGED && !fetch.isComplete()) {
                log.warn(
                    "Output {} lacks the {} failed shards; remove it to merge their records after a later run",
                    request.outputPath(),
                    fetch.failed()
                );
            }
        }

        return new HarvestSummary(
            startedAt,
            Instant.now(),
            request.shardUrls().size(),
            fetch,
            merge,
            request.outputPath().toString()
        );
    }
}
