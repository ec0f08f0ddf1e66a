package com.gpappid.harvester.harvest.shard;

import com.gpappid.harvester.config.HarvesterProperties;
import com.gpappid.harvester.harvest.http.SitemapHttpClient;
import com.gpappid.harvester.harvest.model.HttpFetchResult;
import com.gpappid.harvester.harvest.util.AtomicFiles;
import com.gpappid.harvester.harvest.util.GzipPayloads;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.ParseError;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Downloads one sitemap shard and turns it into a shard record.
 *
 * <p>A call leaves either exactly one complete {@code <key>.txt} in the cache directory or none:
 * ids are written to a hidden temp file that is only renamed into place once everything
 * succeeded, and every failure path removes both the temp file and the target.
 */
@Service
public class ShardFetcher {
    private static final Logger log = LoggerFactory.getLogger(ShardFetcher.class);
    private static final String SHARD_ACCEPT = "application/x-gzip,application/gzip,application/xml;q=0.9,*/*;q=0.1";
    private static final int MAX_TRACKED_PARSE_ERRORS = 5;

    private final SitemapHttpClient httpClient;
    private final HarvesterProperties properties;

    public ShardFetcher(SitemapHttpClient httpClient, HarvesterProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    public ShardFetchOutcome fetch(String url, Path cacheDir) {
        Path target;
        try {
            target = cacheDir.resolve(ShardNameResolver.recordFileName(url));
        } catch (InvalidShardUrlException e) {
            return ShardFetchOutcome.failure(url, ShardFailureKind.INVALID_URL, e.getMessage());
        }

        try {
            byte[] compressed = download(url);
            String xml = gunzip(compressed);
            List<String> hrefs = collectHrefs(xml);
            List<String> appIds = extractAppIds(hrefs);
            writeRecord(target, appIds);
            log.debug("Shard {} done with {} app ids", url, appIds.size());
            return ShardFetchOutcome.success(url, appIds.size());
        } catch (ShardFetchException e) {
            removeTarget(url, target);
            return ShardFetchOutcome.failure(url, e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            removeTarget(url, target);
            return ShardFetchOutcome.failure(url, ShardFailureKind.UNEXPECTED, e.toString());
        }
    }

    private byte[] download(String url) {
        HttpFetchResult fetch = httpClient.get(url, SHARD_ACCEPT);
        if (!fetch.isSuccessful()) {
            throw new ShardFetchException(ShardFailureKind.NETWORK, fetch.describeFailure());
        }
        return fetch.bodyBytes() == null ? new byte[0] : fetch.bodyBytes();
    }

    private String gunzip(byte[] compressed) {
        try {
            return new String(GzipPayloads.gunzip(compressed, properties.getMaxDecompressedBytes()), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ShardFetchException(ShardFailureKind.DECOMPRESS, "gzip_decode_error: " + e.getMessage(), e);
        }
    }

    List<String> collectHrefs(String xml) {
        if (xml == null || xml.isBlank()) {
            throw new ShardFetchException(ShardFailureKind.PARSE, "empty sitemap payload");
        }
        Parser parser = Parser.xmlParser().setTrackErrors(MAX_TRACKED_PARSE_ERRORS);
        Document document = Jsoup.parse(xml, "", parser);
        if (!parser.getErrors().isEmpty()) {
            ParseError first = parser.getErrors().get(0);
            throw new ShardFetchException(
                ShardFailureKind.PARSE,
                "malformed xml at " + first.getPosition() + ": " + first.getErrorMessage()
            );
        }
        if (document.children().isEmpty()) {
            throw new ShardFetchException(ShardFailureKind.PARSE, "sitemap payload has no root element");
        }

        Set<String> hrefs = new LinkedHashSet<>();
        for (Element element : document.getAllElements()) {
            for (Attribute attribute : element.attributes()) {
                if ("href".equals(attribute.getKey())) {
                    hrefs.add(attribute.getValue());
                }
            }
        }
        return new ArrayList<>(hrefs);
    }

    List<String> extractAppIds(List<String> hrefs) {
        String prefix = properties.getProductPagePrefix();
        Set<String> appIds = new LinkedHashSet<>();
        for (String href : hrefs) {
            if (href == null || !href.startsWith(prefix)) {
                continue;
            }
            String appId = firstIdParameter(href);
            if (appId == null || appId.isBlank()) {
                throw new ShardFetchException(ShardFailureKind.MALFORMED_ENTRY, "product link without id: " + href);
            }
            appIds.add(appId);
        }
        return new ArrayList<>(appIds);
    }

    private String firstIdParameter(String href) {
        try {
            String raw = UriComponentsBuilder.fromUriString(href).build().getQueryParams().getFirst("id");
            return raw == null ? null : UriUtils.decode(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new ShardFetchException(ShardFailureKind.MALFORMED_ENTRY, "unparseable product link: " + href, e);
        }
    }

    private void writeRecord(Path target, List<String> appIds) {
        Path temp = null;
        try {
            temp = AtomicFiles.createSiblingTemp(target);
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                for (String appId : appIds) {
                    writer.write(appId);
                    writer.write('\n');
                }
            }
            AtomicFiles.moveIntoPlace(temp, target);
        } catch (IOException e) {
            IOException cleanupProblem = AtomicFiles.deleteQuietly(temp);
            if (cleanupProblem != null) {
                e.addSuppressed(cleanupProblem);
            }
            throw new ShardFetchException(ShardFailureKind.PERSIST, "failed to write " + target + ": " + e.getMessage(), e);
        }
    }

    private void removeTarget(String url, Path target) {
        IOException problem = AtomicFiles.deleteQuietly(target);
        if (problem != null) {
            log.error("Could not remove record {} after failed shard {}", target, url, problem);
        }
    }

    static class ShardFetchException extends RuntimeException {
        private final ShardFailureKind kind;

        ShardFetchException(ShardFailureKind kind, String message) {
            super(message);
            this.kind = kind;
        }

        ShardFetchException(ShardFailureKind kind, String message, Throwable cause) {
            super(message, cause);
            this.kind = kind;
        }

        ShardFailureKind getKind() {
            return kind;
        }
    }
}
