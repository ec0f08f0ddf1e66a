package com.gpappid.harvester.harvest.shard;

import com.gpappid.harvester.harvest.util.AtomicFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Component
public class ResumeIndex {
    private static final Logger log = LoggerFactory.getLogger(ResumeIndex.class);
    private static final String TEMP_SUFFIX = ".tmp";

    /** Keys of shards whose record already exists. A missing directory means nothing is done yet. */
    public Set<String> completedKeys(Path cacheDir) {
        Set<String> keys = new HashSet<>();
        for (Path record : listRecordFiles(cacheDir)) {
            keys.add(ShardNameResolver.keyOfRecordFileName(record.getFileName().toString()));
        }
        return keys;
    }

    /** Record files in {@code cacheDir}, sorted by file name. */
    public List<Path> listRecordFiles(Path cacheDir) {
        List<Path> records = new ArrayList<>();
        if (cacheDir == null || !Files.isDirectory(cacheDir)) {
            return records;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(cacheDir)) {
            for (Path entry : stream) {
                if (ShardNameResolver.isRecordFileName(entry.getFileName().toString()) && Files.isRegularFile(entry)) {
                    records.add(entry);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to list shard records in " + cacheDir, e);
        }
        records.sort((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()));
        return records;
    }

    /**
     * Deletes temp files left by a process that died mid-write. They are never records, so
     * removing them cannot lose a finished shard. Returns the number removed.
     */
    public int removeStaleTempFiles(Path cacheDir) {
        if (cacheDir == null || !Files.isDirectory(cacheDir)) {
            return 0;
        }
        int removed = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(cacheDir)) {
            for (Path entry : stream) {
                String name = entry.getFileName().toString();
                if (!name.startsWith(".") || !name.endsWith(TEMP_SUFFIX) || !Files.isRegularFile(entry)) {
                    continue;
                }
                IOException problem = AtomicFiles.deleteQuietly(entry);
                if (problem == null) {
                    removed++;
                } else {
                    log.warn("Could not remove stale temp file {}", entry, problem);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to list " + cacheDir, e);
        }
        return removed;
    }
}
