package com.gpappid.harvester.harvest.model;

import com.gpappid.harvester.harvest.shard.ShardFailureKind;

import java.util.Map;

public record FetchSummary(
    int succeeded,
    int failed,
    int alreadyCompleted,
    int notDispatched,
    Map<String, ShardFailureKind> failures
) {
    public static FetchSummary nothingPending(int alreadyCompleted) {
        return new FetchSummary(0, 0, alreadyCompleted, 0, Map.of());
    }

    public int attempted() {
        return succeeded + failed;
    }

    public boolean stoppedEarly() {
        return notDispatched > 0;
    }

    public boolean isComplete() {
        return failed == 0 && notDispatched == 0;
    }
}
