package com.gpappid.harvester.harvest.robots;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RobotsSitemapDirectivesTest {

    @Test
    void collectsSitemapLinesInOrder() {
        String robots =
            """
                User-agent: *
                Disallow: /store/search
                # Sitemap: https://play.google.com/commented-out.xml
                Sitemap: https://play.google.com/sitemaps/sitemaps-index-0.xml
                SITEMAP:   https://play.google.com/sitemaps/sitemaps-index-1.xml   # trailing note
                Sitemap:
                """;

        assertEquals(
            List.of(
                "https://play.google.com/sitemaps/sitemaps-index-0.xml",
                "https://play.google.com/sitemaps/sitemaps-index-1.xml"
            ),
            RobotsSitemapDirectives.parse(robots)
        );
    }

    @Test
    void blankRobotsHasNoSitemaps() {
        assertTrue(RobotsSitemapDirectives.parse("  ").isEmpty());
        assertTrue(RobotsSitemapDirectives.parse(null).isEmpty());
    }
}
