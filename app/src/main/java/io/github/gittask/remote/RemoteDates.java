package io.github.gittask.remote;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Timestamp conversions for tracker payloads. */
final class RemoteDates {
    private static final Logger logger = LogManager.getLogger(RemoteDates.class);
    private static final DateTimeFormatter JIRA_DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSZ");

    private RemoteDates() {}

    /** Parses ISO-8601 timestamps, including Jira's offset without a colon; 0 when absent or unreadable. */
    static long toEpochSeconds(@Nullable String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        try {
            return OffsetDateTime.parse(text).toEpochSecond();
        } catch (DateTimeParseException e1) {
            // fall through to Jira's format
        }
        try {
            return OffsetDateTime.parse(text, JIRA_DATE_FORMATTER).toEpochSecond();
        } catch (DateTimeParseException e2) {
            logger.warn("Could not parse remote timestamp '{}': {}", text, e2.getMessage());
            return 0;
        }
    }

    static String toIso(long epochSeconds) {
        return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(Instant.ofEpochSecond(epochSeconds).atOffset(ZoneOffset.UTC));
    }
}
