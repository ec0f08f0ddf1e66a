package com.gpappid.harvester.harvest.service;

import com.gpappid.harvester.harvest.model.MergeStatus;
import com.gpappid.harvester.harvest.shard.ResumeIndex;
import com.gpappid.harvester.harvest.util.AtomicFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Concatenates every shard record, in file name order, into the aggregate output.
 *
 * <p>The output is built under a hidden temp name and renamed into place at the end, so an
 * existing output is always complete and a second merge can stop at the existence check.
 */
@Service
public class ResultAggregator {
    private static final Logger log = LoggerFactory.getLogger(ResultAggregator.class);

    private final ResumeIndex resumeIndex;

    public ResultAggregator(ResumeIndex resumeIndex) {
        this.resumeIndex = resumeIndex;
    }

    public MergeStatus merge(Path cacheDir, Path outputPath) {
        if (Files.exists(outputPath)) {
            log.info("Output {} already exists; skipping merge", outputPath);
            return MergeStatus.ALREADY_PRESENT;
        }

        Path temp = null;
        try {
            List<Path> records = resumeIndex.listRecordFiles(cacheDir);
            temp = AtomicFiles.createSiblingTemp(outputPath);
            try (OutputStream out = Files.newOutputStream(temp)) {
                for (Path record : records) {
                    Files.copy(record, out);
                }
            }
            AtomicFiles.moveIntoPlace(temp, outputPath);
            log.info("Merged {} shard records into {}", records.size(), outputPath);
            return MergeStatus.MERGED;
        } catch (IOException | UncheckedIOException e) {
            IOException cleanupProblem = AtomicFiles.deleteQuietly(temp);
            if (cleanupProblem != null) {
                e.addSuppressed(cleanupProblem);
            }
            throw new ResultMergeException("failed to merge " + cacheDir + " into " + outputPath, e);
        }
    }
}
