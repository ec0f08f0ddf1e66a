package com.gpappid.harvester.harvest.service;

public class ResultMergeException extends RuntimeException {
    public ResultMergeException(String message, Throwable cause) {
        super(message, cause);
    }
}
