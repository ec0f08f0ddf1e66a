package com.gpappid.harvester.harvest.model;

import java.nio.file.Path;
import java.util.Set;

public record HarvestRequest(
    int concurrency,
    Path cacheDir,
    Path outputPath,
    Set<String> shardUrls
) {
    public HarvestRequest {
        concurrency = Math.max(1, concurrency);
        shardUrls = shardUrls == null ? Set.of() : Set.copyOf(shardUrls);
    }
}
