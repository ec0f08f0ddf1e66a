package com.gpappid.harvester.harvest.shard;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Maps a shard URL to the key its record is stored under: the last segment of the raw URL path.
 */
public final class ShardNameResolver {
    public static final String RECORD_SUFFIX = ".txt";

    private ShardNameResolver() {
    }

    public static String resolve(String url) {
        if (url == null || url.isBlank()) {
            throw new InvalidShardUrlException("shard url is blank");
        }
        String path;
        try {
            path = new URI(url).getRawPath();
        } catch (URISyntaxException e) {
            throw new InvalidShardUrlException("shard url is malformed: " + url);
        }
        if (path == null || path.isEmpty() || path.endsWith("/")) {
            throw new InvalidShardUrlException("shard url has no final path segment: " + url);
        }
        String key = path.substring(path.lastIndexOf('/') + 1);
        if (key.isEmpty() || ".".equals(key) || "..".equals(key)) {
            throw new InvalidShardUrlException("shard url has no usable final path segment: " + url);
        }
        return key;
    }

    public static String recordFileName(String url) {
        return resolve(url) + RECORD_SUFFIX;
    }

    public static boolean isRecordFileName(String fileName) {
        return fileName != null
            && !fileName.startsWith(".")
            && fileName.endsWith(RECORD_SUFFIX)
            && fileName.length() > RECORD_SUFFIX.length();
    }

    public static String keyOfRecordFileName(String fileName) {
        return fileName.substring(0, fileName.length() - RECORD_SUFFIX.length());
    }
}
