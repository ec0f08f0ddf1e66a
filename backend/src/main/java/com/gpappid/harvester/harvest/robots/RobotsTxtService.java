package com.gpappid.harvester.harvest.robots;

import com.gpappid.harvester.harvest.http.SitemapHttpClient;
import com.gpappid.harvester.harvest.model.HttpFetchResult;
import com.gpappid.harvester.harvest.sitemap.SitemapIndexException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class RobotsTxtService {
    private static final Logger log = LoggerFactory.getLogger(RobotsTxtService.class);

    private final SitemapHttpClient httpClient;

    public RobotsTxtService(SitemapHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public List<String> sitemapIndexUrls(String robotsUrl) {
        HttpFetchResult fetch = httpClient.get(robotsUrl, "text/plain,text/*;q=0.9,*/*;q=0.1");
        if (!fetch.isSuccessful()) {
            log.warn(
                "robots fetch failed url={} status={} errorCode={} errorMessage={}",
                robotsUrl,
                fetch.statusCode(),
                fetch.errorCode(),
                fetch.errorMessage()
            );
            throw new SitemapIndexException("robots.txt " + robotsUrl + " failed: " + fetch.describeFailure());
        }
        List<String> sitemaps = RobotsSitemapDirectives.parse(fetch.body());
        log.info("robots.txt {} lists {} sitemap indexes", robotsUrl, sitemaps.size());
        return sitemaps;
    }
}
