package com.gpappid.harvester.harvest.model;

public enum MergeStatus {
    MERGED,
    ALREADY_PRESENT,
    SKIPPED_INCOMPLETE,
    FAILED
}
