package com.gpappid.harvester.harvest.robots;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** {@code Sitemap:} lines of a robots.txt file. Access rules are not needed for sitemap discovery. */
public final class RobotsSitemapDirectives {

    private RobotsSitemapDirectives() {
    }

    public static List<String> parse(String robotsText) {
        List<String> sitemaps = new ArrayList<>();
        if (robotsText == null || robotsText.isBlank()) {
            return sitemaps;
        }
        for (String rawLine : robotsText.split("\\R")) {
            String line = stripComment(rawLine).trim();
            int colonIdx = line.indexOf(':');
            if (colonIdx <= 0) {
                continue;
            }
            String key = line.substring(0, colonIdx).trim().toLowerCase(Locale.ROOT);
            String value = line.substring(colonIdx + 1).trim();
            if ("sitemap".equals(key) && !value.isBlank()) {
                sitemaps.add(value);
            }
        }
        return sitemaps;
    }

    private static String stripComment(String line) {
        int idx = line.indexOf('#');
        return idx >= 0 ? line.substring(0, idx) : line;
    }
}
