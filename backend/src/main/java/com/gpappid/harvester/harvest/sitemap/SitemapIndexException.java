package com.gpappid.harvester.harvest.sitemap;

public class SitemapIndexException extends RuntimeException {
    public SitemapIndexException(String message) {
        super(message);
    }

    public SitemapIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
