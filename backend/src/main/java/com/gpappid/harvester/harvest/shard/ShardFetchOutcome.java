package com.gpappid.harvester.harvest.shard;

public record ShardFetchOutcome(
    String url,
    boolean success,
    int appIdCount,
    ShardFailureKind failureKind,
    String message
) {
    public static ShardFetchOutcome success(String url, int appIdCount) {
        return new ShardFetchOutcome(url, true, appIdCount, null, null);
    }

    public static ShardFetchOutcome failure(String url, ShardFailureKind kind, String message) {
        return new ShardFetchOutcome(url, false, 0, kind, message);
    }
}
