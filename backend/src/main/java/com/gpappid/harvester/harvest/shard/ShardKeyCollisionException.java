package com.gpappid.harvester.harvest.shard;

import java.util.List;

public class ShardKeyCollisionException extends RuntimeException {
    private final String shardKey;
    private final List<String> urls;

    public ShardKeyCollisionException(String shardKey, List<String> urls) {
        super("shard key " + shardKey + " is shared by " + urls);
        this.shardKey = shardKey;
        this.urls = List.copyOf(urls);
    }

    public String getShardKey() {
        return shardKey;
    }

    public List<String> getUrls() {
        return urls;
    }
}
