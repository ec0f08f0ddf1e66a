package com.gpappid.harvester.harvest.shard;

public enum ShardFailureKind {
    INVALID_URL,
    NETWORK,
    DECOMPRESS,
    PARSE,
    MALFORMED_ENTRY,
    PERSIST,
    UNEXPECTED
}
