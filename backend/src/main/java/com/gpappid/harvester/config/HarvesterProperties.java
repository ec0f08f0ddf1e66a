package com.gpappid.harvester.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "harvester")
public class HarvesterProperties {
    private static final String DEFAULT_USER_AGENT = "gp-appid-harvester/0.1 (+contact)";
    private static final long DEFAULT_MAX_RESPONSE_BYTES = 64L * 1024 * 1024;
    private static final long DEFAULT_MAX_DECOMPRESSED_BYTES = 256L * 1024 * 1024;

    private String userAgent;
    private int requestTimeoutSeconds = 60;
    private long maxResponseBytes = DEFAULT_MAX_RESPONSE_BYTES;
    private long maxDecompressedBytes = DEFAULT_MAX_DECOMPRESSED_BYTES;
    private int concurrency = 10;
    private int progressLogInterval = 25;
    private String robotsTxtUrl = "https://play.google.com/robots.txt";
    private String productPagePrefix = "https://play.google.com/store/apps";
    private String outputDir = "GPAppId";
    private String taskName = "main";
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public long getMaxResponseBytes() {
        return maxResponseBytes <= 0 ? DEFAULT_MAX_RESPONSE_BYTES : maxResponseBytes;
    }

    public void setMaxResponseBytes(long maxResponseBytes) {
        this.maxResponseBytes = maxResponseBytes;
    }

    public long getMaxDecompressedBytes() {
        return maxDecompressedBytes <= 0 ? DEFAULT_MAX_DECOMPRESSED_BYTES : maxDecompressedBytes;
    }

    public void setMaxDecompressedBytes(long maxDecompressedBytes) {
        this.maxDecompressedBytes = maxDecompressedBytes;
    }

    public int getConcurrency() {
        return Math.max(1, concurrency);
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = Math.max(1, concurrency);
    }

    public int getProgressLogInterval() {
        return Math.max(1, progressLogInterval);
    }

    public void setProgressLogInterval(int progressLogInterval) {
        this.progressLogInterval = Math.max(1, progressLogInterval);
    }

    public String getRobotsTxtUrl() {
        return robotsTxtUrl;
    }

    public void setRobotsTxtUrl(String robotsTxtUrl) {
        this.robotsTxtUrl = robotsTxtUrl;
    }

    public String getProductPagePrefix() {
        return productPagePrefix;
    }

    public void setProductPagePrefix(String productPagePrefix) {
        this.productPagePrefix = productPagePrefix;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public String getTaskName() {
        return taskName == null || taskName.isBlank() ? "main" : taskName.trim();
    }

    public void setTaskName(String taskName) {
        this.taskName = taskName;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Cli {
        private boolean run = true;
        private boolean exitAfterRun = true;
        private int shutdownGraceSeconds = 120;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }

        public int getShutdownGraceSeconds() {
            return Math.max(0, shutdownGraceSeconds);
        }

        public void setShutdownGraceSeconds(int shutdownGraceSeconds) {
            this.shutdownGraceSeconds = Math.max(0, shutdownGraceSeconds);
        }
    }
}
