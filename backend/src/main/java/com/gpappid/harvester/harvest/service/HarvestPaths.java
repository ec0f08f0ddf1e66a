package com.gpappid.harvester.harvest.service;

import com.gpappid.harvester.config.HarvesterProperties;

import java.nio.file.Path;

public record HarvestPaths(
    Path outputDir,
    Path shardListFile,
    Path cacheDir,
    Path outputPath,
    Path reportFile
) {
    public static HarvestPaths from(HarvesterProperties properties) {
        Path outputDir = Path.of(properties.getOutputDir());
        String task = properties.getTaskName();
        return new HarvestPaths(
            outputDir,
            outputDir.resolve("sitemaps.txt"),
            outputDir.resolve("app_ids_" + task),
            outputDir.resolve("app_ids_" + task + ".txt"),
            outputDir.resolve("harvest-report-" + task + ".json")
        );
    }
}
