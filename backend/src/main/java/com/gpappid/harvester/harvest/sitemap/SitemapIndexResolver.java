package com.gpappid.harvester.harvest.sitemap;

import com.gpappid.harvester.config.HarvesterProperties;
import com.gpappid.harvester.harvest.http.SitemapHttpClient;
import com.gpappid.harvester.harvest.model.HttpFetchResult;
import com.gpappid.harvester.harvest.util.AtomicFiles;
import com.gpappid.harvester.harvest.util.GzipPayloads;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.ParseError;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Supplies the set of shard URLs for a harvest, either from the cached list or by reading the
 * {@code <sitemap><loc>} entries of every sitemap index.
 */
@Service
public class SitemapIndexResolver {
    private static final Logger log = LoggerFactory.getLogger(SitemapIndexResolver.class);
    private static final String INDEX_ACCEPT = "application/xml,text/xml;q=0.9,*/*;q=0.1";

    private static final int MAX_TRACKED_PARSE_ERRORS = 5;

    private final SitemapHttpClient httpClient;
    private final HarvesterProperties properties;

    public SitemapIndexResolver(SitemapHttpClient httpClient, HarvesterProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    public boolean hasCachedShardList(Path cacheFile) {
        return cacheFile != null && Files.isRegularFile(cacheFile);
    }

    public Set<String> resolveShardUrls(List<String> indexUrls, Path cacheFile) {
        if (hasCachedShardList(cacheFile)) {
            Set<String> cached = readCachedShardList(cacheFile);
            log.info("Loaded {} shard urls from {}", cached.size(), cacheFile);
            return cached;
        }

        Set<String> shardUrls = new TreeSet<>();
        for (String indexUrl : indexUrls) {
            List<String> locs = readIndex(indexUrl);
            log.debug("Sitemap index {} lists {} shards", indexUrl, locs.size());
            shardUrls.addAll(locs);
        }
        writeCachedShardList(cacheFile, shardUrls);
        log.info("Resolved {} shard urls from {} sitemap indexes", shardUrls.size(), indexUrls.size());
        return shardUrls;
    }

    List<String> readIndex(String indexUrl) {
        HttpFetchResult fetch = httpClient.get(indexUrl, INDEX_ACCEPT);
        if (!fetch.isSuccessful()) {
            throw new SitemapIndexException("sitemap index " + indexUrl + " failed: " + fetch.describeFailure());
        }
        String xml;
        try {
            xml = extractXmlPayload(indexUrl, fetch);
        } catch (IOException e) {
            throw new SitemapIndexException("sitemap index " + indexUrl + " could not be decompressed: " + e.getMessage(), e);
        }
        if (xml.isBlank()) {
            throw new SitemapIndexException("sitemap index " + indexUrl + " is empty");
        }
        Parser parser = Parser.xmlParser().setTrackErrors(MAX_TRACKED_PARSE_ERRORS);
        Document document = Jsoup.parse(xml, "", parser);
        if (!parser.getErrors().isEmpty()) {
            ParseError first = parser.getErrors().get(0);
            throw new SitemapIndexException(
                "sitemap index " + indexUrl + " is malformed at " + first.getPosition() + ": " + first.getErrorMessage()
            );
        }
        if (document.children().isEmpty()) {
            throw new SitemapIndexException("sitemap index " + indexUrl + " has no root element");
        }
        List<String> locs = document.select("sitemap > loc").stream()
            .map(Element::text)
            .map(String::trim)
            .filter(loc -> !loc.isEmpty())
            .toList();
        if (locs.isEmpty()) {
            throw new SitemapIndexException("sitemap index " + indexUrl + " lists no shards");
        }
        return locs;
    }

    private Set<String> readCachedShardList(Path cacheFile) {
        try {
            Set<String> urls = new TreeSet<>();
            for (String line : Files.readAllLines(cacheFile, StandardCharsets.UTF_8)) {
                String trimmed = line.trim();
                if (!trimmed.isEmpty()) {
                    urls.add(trimmed);
                }
            }
            return urls;
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read shard list " + cacheFile, e);
        }
    }

    private void writeCachedShardList(Path cacheFile, Set<String> shardUrls) {
        if (cacheFile == null) {
            return;
        }
        Path temp = null;
        try {
            temp = AtomicFiles.createSiblingTemp(cacheFile);
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                for (String url : shardUrls) {
                    writer.write(url);
                    writer.write('\n');
                }
            }
            AtomicFiles.moveIntoPlace(temp, cacheFile);
        } catch (IOException e) {
            IOException cleanupProblem = AtomicFiles.deleteQuietly(temp);
            if (cleanupProblem != null) {
                e.addSuppressed(cleanupProblem);
            }
            throw new UncheckedIOException("failed to write shard list " + cacheFile, e);
        }
    }

    private String extractXmlPayload(String sitemapUrl, HttpFetchResult fetch) throws IOException {
        byte[] bodyBytes = fetch.bodyBytes();
        if (bodyBytes == null) {
            return "";
        }
        if (isGzipPayload(sitemapUrl, fetch, bodyBytes)) {
            return new String(GzipPayloads.gunzip(bodyBytes, properties.getMaxDecompressedBytes()), StandardCharsets.UTF_8);
        }
        return new String(bodyBytes, StandardCharsets.UTF_8);
    }

    private boolean isGzipPayload(String sitemapUrl, HttpFetchResult fetch, byte[] bodyBytes) {
        if (bodyBytes.length >= 2 && (bodyBytes[0] & 0xFF) == 0x1f && (bodyBytes[1] & 0xFF) == 0x8b) {
            return true;
        }
        String requestedUrl = sitemapUrl == null ? "" : sitemapUrl.toLowerCase(Locale.ROOT);
        String resolvedUrl = fetch.finalUrlOrRequested() == null
            ? ""
            : fetch.finalUrlOrRequested().toLowerCase(Locale.ROOT);
        if (requestedUrl.endsWith(".gz") || resolvedUrl.endsWith(".gz")) {
            return true;
        }
        return fetch.contentEncoding() != null
            && fetch.contentEncoding().toLowerCase(Locale.ROOT).contains("gzip");
    }
}
