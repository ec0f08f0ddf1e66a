package com.gpappid.harvester.harvest.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gpappid.harvester.harvest.model.HarvestSummary;
import com.gpappid.harvester.harvest.model.MergeStatus;
import com.gpappid.harvester.harvest.shard.ShardFailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/** Writes the outcome of the last harvest as JSON next to the output file. */
@Component
public class HarvestReportWriter {
    private static final Logger log = LoggerFactory.getLogger(HarvestReportWriter.class);

    private final ObjectMapper objectMapper;

    public HarvestReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(Path reportFile, String taskName, HarvestSummary summary) {
        HarvestReport report = toReport(taskName, summary);
        try {
            Path parent = reportFile.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            objectMapper.writeValue(reportFile.toFile(), report);
        } catch (IOException e) {
            log.warn("Could not write harvest report {}", reportFile, e);
        }
    }

    HarvestReport toReport(String taskName, HarvestSummary summary) {
        List<FailedShard> failedShards = summary.fetch().failures().entrySet().stream()
            .map(entry -> new FailedShard(entry.getKey(), entry.getValue()))
            .toList();
        return new HarvestReport(
            taskName,
            summary.startedAt(),
            summary.finishedAt(),
            summary.totalShards(),
            summary.fetch().succeeded(),
            summary.fetch().failed(),
            summary.fetch().alreadyCompleted(),
            summary.fetch().notDispatched(),
            summary.merge(),
            summary.outputPath(),
            failedShards
        );
    }

    public record HarvestReport(
        String taskName,
        Instant startedAt,
        Instant finishedAt,
        int totalShards,
        int succeeded,
        int failed,
        int alreadyCompleted,
        int notDispatched,
        MergeStatus merge,
        String outputPath,
        List<FailedShard> failedShards
    ) {
    }

    public record FailedShard(String url, ShardFailureKind kind) {
    }
}
