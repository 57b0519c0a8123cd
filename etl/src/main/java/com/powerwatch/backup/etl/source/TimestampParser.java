package com.powerwatch.backup.etl.source;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses occurrence and clearance cells using the day-first convention of the platform exports,
 * so {@code 03/04/2025} is 3 April. Year-first (ISO-like) text is read as year-month-day.
 */
public class TimestampParser {
    private static final Logger log = LoggerFactory.getLogger(TimestampParser.class);

    private static final List<DateTimeFormatter> FORMATS = ImmutableList.of(
        dayFirst("d/M/uuuu"),
        dayFirst("d-M-uuuu"),
        dayFirst("d.M.uuuu"),
        twelveHour("d/M/uuuu"),
        twelveHour("d-M-uuuu"),
        dayFirst("uuuu-M-d"),
        dayFirst("uuuu/M/d"),
        isoLocal()
    );

    private final ZoneId zone;

    public TimestampParser() {
        this(ZoneId.systemDefault());
    }

    /**
     * @param zone zone used to read {@link Date} cells
     */
    public TimestampParser(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * @return the parsed time, or empty when {@code value} is of an unsupported type or matches no format
     */
    public Optional<LocalDateTime> parse(@Nullable Object value) {
        if (value instanceof LocalDateTime ldt) {
            return Optional.of(ldt);
        }
        if (value instanceof LocalDate ld) {
            return Optional.of(ld.atStartOfDay());
        }
        if (value instanceof Date date) {
            return Optional.of(LocalDateTime.ofInstant(date.toInstant(), zone));
        }
        if (value instanceof String text) {
            return parseText(text.trim());
        }
        return Optional.empty();
    }

    private Optional<LocalDateTime> parseText(String text) {
        for (DateTimeFormatter format : FORMATS) {
            try {
                TemporalAccessor parsed = format.parseBest(text, LocalDateTime::from, LocalDate::from);
                if (parsed instanceof LocalDateTime ldt) {
                    return Optional.of(ldt);
                }
                return Optional.of(((LocalDate) parsed).atStartOfDay());
            } catch (DateTimeParseException e) {
                log.trace("'{}' does not match {}", text, format);
            }
        }
        return Optional.empty();
    }

    private static DateTimeFormatter dayFirst(String datePattern) {
        return new DateTimeFormatterBuilder()
            .appendPattern(datePattern)
            .optionalStart()
            .appendLiteral(' ')
            .appendPattern("H:mm")
            .optionalStart()
            .appendLiteral(':')
            .appendPattern("ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .optionalEnd()
            .optionalEnd()
            .toFormatter(Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT);
    }

    private static DateTimeFormatter twelveHour(String datePattern) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(datePattern)
            .appendPattern(" h:mm")
            .optionalStart()
            .appendLiteral(':')
            .appendPattern("ss")
            .optionalEnd()
            .appendPattern(" a")
            .toFormatter(Locale.ENGLISH)
            .withResolverStyle(ResolverStyle.STRICT);
    }

    private static DateTimeFormatter isoLocal() {
        return new DateTimeFormatterBuilder()
            .appendPattern("uuuu-M-d'T'H:mm")
            .optionalStart()
            .appendLiteral(':')
            .appendPattern("ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .optionalEnd()
            .toFormatter(Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT);
    }
}
