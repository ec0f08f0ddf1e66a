package com.gpappid.harvester.harvest.http;

import com.gpappid.harvester.config.HarvesterProperties;
import com.gpappid.harvester.harvest.model.HttpFetchResult;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;

/**
 * Plain GET client for robots.txt, sitemap indexes and sitemap shards.
 *
 * <p>Every call is a single attempt: retries happen across runs, not inside one. Failures are
 * reported through {@link HttpFetchResult#errorCode()} instead of exceptions.
 */
@Service
public class SitemapHttpClient {
    private static final int MAX_BUFFERED_BYTES = Integer.MAX_VALUE - 8;

    private final HarvesterProperties properties;
    private final HttpClient client;

    public SitemapHttpClient(
        HarvesterProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public HttpFetchResult get(String url, String acceptHeader) {
        return get(url, acceptHeader, properties.getMaxResponseBytes());
    }

    public HttpFetchResult get(String url, String acceptHeader, long maxBytes) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }

        String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .header("User-Agent", HarvesterProperties.normalizeUserAgent(properties.getUserAgent()))
            .header("Accept", safeAccept)
            .GET()
            .build();

        try {
            HttpResponse<InputStream> response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
            int cap = (int) Math.min(Math.max(0, maxBytes), MAX_BUFFERED_BYTES);
            byte[] bytes;
            try (InputStream in = response.body()) {
                bytes = in.readNBytes(cap + 1);
            }
            if (bytes.length > cap) {
                return errorResult(url, startedAt, "body_too_large", "response exceeded " + cap + " bytes");
            }
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                bytes,
                response.headers().firstValue("Content-Type").orElse(null),
                response.headers().firstValue("Content-Encoding").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, "http_error", e.getMessage());
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            return null;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
