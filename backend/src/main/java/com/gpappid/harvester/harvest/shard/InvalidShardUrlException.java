package com.gpappid.harvester.harvest.shard;

public class InvalidShardUrlException extends RuntimeException {
    public InvalidShardUrlException(String message) {
        super(message);
    }
}
