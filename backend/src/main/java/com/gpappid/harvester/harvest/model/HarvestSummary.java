package com.gpappid.harvester.harvest.model;

import java.time.Instant;

public record HarvestSummary(
    Instant startedAt,
    Instant finishedAt,
    int totalShards,
    FetchSummary fetch,
    MergeStatus merge,
    String outputPath
) {
    public int succeeded() {
        return fetch.succeeded();
    }

    public int failed() {
        return fetch.failed();
    }
}
