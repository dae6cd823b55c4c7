package com.aerodecode.service.bulletin;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class LatestReportSelector {
    private static final Pattern REPORT_TIME = Pattern.compile("\\s(\\d{2})(\\d{2})(\\d{2})Z");

    private LatestReportSelector() {
    }

    /**
     * Picks the entry with the greatest (day, hour) report time. Entries without a time group rank lowest
     * and ties keep the earlier entry.
     */
    public static Optional<BulletinEntry> latest(List<BulletinEntry> entries) {
        BulletinEntry best = null;
        int bestRank = Integer.MIN_VALUE;
        for (BulletinEntry entry : entries) {
            int rank = rank(entry.report());
            if (best == null || rank > bestRank) {
                best = entry;
                bestRank = rank;
            }
        }
        return Optional.ofNullable(best);
    }

    static int rank(String report) {
        Matcher m = REPORT_TIME.matcher(report);
        if (!m.find()) {
            return -1;
        }
        return Integer.parseInt(m.group(1)) * 100 + Integer.parseInt(m.group(2));
    }
}
