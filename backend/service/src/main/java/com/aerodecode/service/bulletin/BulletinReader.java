package com.aerodecode.service.bulletin;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits bulletin text into single reports. A report starts on an unindented line and continues over
 * indented lines; {@code =} terminators, blank lines and {@code #} comments are dropped.
 */
public final class BulletinReader {
    private static final Pattern ARCHIVE_LINE = Pattern.compile("^(\\d{12})\\s+((?:METAR|SPECI|TAF)\\s+.+)$");
    private static final DateTimeFormatter ARCHIVE_TIME = DateTimeFormatter.ofPattern("uuuuMMddHHmm");

    private BulletinReader() {
    }

    public static List<BulletinEntry> read(String text) {
        List<BulletinEntry> entries = new ArrayList<>();
        LocalDateTime archivedAt = null;
        StringBuilder current = null;

        for (String line : text.split("\\R")) {
            String stripped = line.strip();
            if (stripped.isEmpty() || stripped.startsWith("#")) {
                continue;
            }
            if (current != null && Character.isWhitespace(line.charAt(0))) {
                current.append(' ').append(withoutTerminator(stripped));
                continue;
            }
            if (current != null) {
                entries.add(new BulletinEntry(archivedAt, withoutTerminator(current.toString())));
            }
            Matcher archive = ARCHIVE_LINE.matcher(stripped);
            if (archive.matches()) {
                archivedAt = archiveTime(archive.group(1)).orElse(null);
                current = new StringBuilder(withoutTerminator(archive.group(2)));
            } else {
                archivedAt = null;
                current = new StringBuilder(withoutTerminator(stripped));
            }
        }
        if (current != null) {
            entries.add(new BulletinEntry(archivedAt, withoutTerminator(current.toString())));
        }
        return entries;
    }

    private static Optional<LocalDateTime> archiveTime(String value) {
        try {
            return Optional.of(LocalDateTime.parse(value, ARCHIVE_TIME));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    private static String withoutTerminator(String value) {
        String trimmed = value.strip();
        if (trimmed.endsWith("=")) {
            return trimmed.substring(0, trimmed.length() - 1).strip();
        }
        return trimmed;
    }
}
