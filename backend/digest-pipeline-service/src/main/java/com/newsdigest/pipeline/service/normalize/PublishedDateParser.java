package com.newsdigest.pipeline.service.normalize;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Parses the date formats upstream sources use into UTC {@link OffsetDateTime}.
 *
 * Supported, in order:
 * - ISO-8601 with offset or zone ("2024-05-01T09:30:00+09:00", "...Z[Asia/Tokyo]")
 * - ISO instant ("2024-05-01T00:30:00Z")
 * - RFC 1123 ("Wed, 01 May 2024 00:30:00 GMT")
 * - local "yyyy-MM-dd HH:mm[:ss]" and ISO local date-time, resolved in the source zone
 */
@Slf4j
public final class PublishedDateParser {

    private static final DateTimeFormatter LOCAL_SPACED = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm")
            .optionalStart()
            .appendPattern(":ss")
            .optionalEnd()
            .toFormatter();

    private static final List<BiFunction<String, ZoneId, OffsetDateTime>> FORMATS = List.of(
            (s, zone) -> OffsetDateTime.parse(s, DateTimeFormatter.ISO_OFFSET_DATE_TIME),
            (s, zone) -> ZonedDateTime.parse(s, DateTimeFormatter.ISO_ZONED_DATE_TIME).toOffsetDateTime(),
            (s, zone) -> Instant.parse(s).atOffset(ZoneOffset.UTC),
            (s, zone) -> ZonedDateTime.parse(s, DateTimeFormatter.RFC_1123_DATE_TIME).toOffsetDateTime(),
            (s, zone) -> LocalDateTime.parse(s, LOCAL_SPACED).atZone(zone).toOffsetDateTime(),
            (s, zone) -> LocalDateTime.parse(s, DateTimeFormatter.ISO_LOCAL_DATE_TIME).atZone(zone).toOffsetDateTime()
    );

    private PublishedDateParser() {
    }

    /**
     * @param value raw date text, may be null
     * @param zone  zone for values without offset
     * @return parsed UTC timestamp, empty when absent or in no known format
     */
    public static Optional<OffsetDateTime> parse(String value, ZoneId zone) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String text = value.strip();
        for (BiFunction<String, ZoneId, OffsetDateTime> format : FORMATS) {
            try {
                return Optional.of(format.apply(text, zone).withOffsetSameInstant(ZoneOffset.UTC));
            } catch (DateTimeParseException e) {
                // next format
            }
        }
        log.debug("Unparseable publish date '{}'", text);
        return Optional.empty();
    }

    public static Optional<OffsetDateTime> fromDate(Date date) {
        return Optional.ofNullable(date).map(d -> d.toInstant().atOffset(ZoneOffset.UTC));
    }
}
