package com.gpappid.harvester.harvest.service;

import com.gpappid.harvester.config.HarvesterProperties;
import com.gpappid.harvester.harvest.model.HarvestSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@Component
public class HarvestCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(HarvestCliRunner.class);

    private final HarvesterProperties properties;
    private final AppIdHarvestService harvestService;
    private final ShardFetchScheduler scheduler;
    private final ConfigurableApplicationContext applicationContext;

    public HarvestCliRunner(
        HarvesterProperties properties,
        AppIdHarvestService harvestService,
        ShardFetchScheduler scheduler,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.harvestService = harvestService;
        this.scheduler = scheduler;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        CountDownLatch finished = new CountDownLatch(1);
        Thread shutdownHook = new Thread(() -> awaitInFlightShards(finished), "harvest-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        int exitCode = 0;
        try {
            HarvestSummary summary = harvestService.harvest();
            log.info(
                "Harvest finished: shards={}, succeeded={}, failed={}, alreadyCompleted={}, notDispatched={}, merge={}",
                summary.totalShards(),
                summary.succeeded(),
                summary.failed(),
                summary.fetch().alreadyCompleted(),
                summary.fetch().notDispatched(),
                summary.merge()
            );
        } catch (RuntimeException e) {
            log.error("Harvest aborted: {}", e.getMessage(), e);
            exitCode = 1;
        } finally {
            finished.countDown();
        }

        if (scheduler.isStopRequested()) {
            // the JVM is already shutting down; exiting again from here would block
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            log.debug("Shutdown already in progress", e);
            return;
        }
        if (properties.getCli().isExitAfterRun()) {
            int code = exitCode;
            System.exit(SpringApplication.exit(applicationContext, () -> code));
        }
    }

    private void awaitInFlightShards(CountDownLatch finished) {
        scheduler.requestStop();
        int graceSeconds = properties.getCli().getShutdownGraceSeconds();
        log.warn("Shutdown requested; waiting up to {}s for in-flight shards", graceSeconds);
        try {
            if (!finished.await(graceSeconds, TimeUnit.SECONDS)) {
                log.warn("In-flight shards did not finish within {}s", graceSeconds);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
