package com.aerodecode.service.bulletin;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One report cut from a bulletin. {@code archivedAt} is set only for archive lines carrying a
 * {@code YYYYMMDDHHMM} prefix.
 */
public record BulletinEntry(LocalDateTime archivedAt, String report) {
    public BulletinEntry {
        Objects.requireNonNull(report, "report is required");
    }
}
