package org.pat2vec.server.service;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import org.pat2vec.model.CalendarDate;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.Optional;

public class TimestampParser {

	// 2021-01-01, 2021-01-01T10:00, 2021-01-01T10:00:00.123456+02:00, 2021-01-01T10:00:00+02, 2021-01-01T10:00:00Z
	private static final DateTimeFormatter FLEXIBLE_ISO = new DateTimeFormatterBuilder()
			.parseCaseInsensitive()
			.append(DateTimeFormatter.ISO_LOCAL_DATE)
			.optionalStart()
				.appendLiteral('T')
				.append(DateTimeFormatter.ISO_LOCAL_TIME)
				.optionalStart().appendOffset("+HH:MM:ss", "Z").optionalEnd()
				.optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
				.optionalStart().appendOffset("+HH", "Z").optionalEnd()
			.optionalEnd()
			.toFormatter()
			.withResolverStyle(ResolverStyle.STRICT);

	private static final int DATE_LENGTH = "2021-01-01".length();

	// Compact forms used by the ingestion files, e.g. 20170910110011 and 19740528.
	private static final DateTimeFormatter COMPACT_DATE_TIME = DateTimeFormatter.ofPattern("uuuuMMddHHmmss")
			.withResolverStyle(ResolverStyle.STRICT);
	private static final DateTimeFormatter COMPACT_DATE = DateTimeFormatter.ofPattern("uuuuMMdd")
			.withResolverStyle(ResolverStyle.STRICT);

	private TimestampParser() {
	}

	public static Optional<OffsetDateTime> parse(Object value) {
		if (value == null) {
			return Optional.empty();
		}
		if (value instanceof OffsetDateTime) {
			return Optional.of(toUtc((OffsetDateTime) value));
		}
		if (value instanceof ZonedDateTime) {
			return Optional.of(toUtc(((ZonedDateTime) value).toOffsetDateTime()));
		}
		if (value instanceof Instant) {
			return Optional.of(((Instant) value).atOffset(ZoneOffset.UTC));
		}
		if (value instanceof LocalDateTime) {
			return Optional.of(((LocalDateTime) value).atOffset(ZoneOffset.UTC));
		}
		if (value instanceof LocalDate) {
			return Optional.of(((LocalDate) value).atStartOfDay().atOffset(ZoneOffset.UTC));
		}
		if (value instanceof CalendarDate) {
			return Optional.of(((CalendarDate) value).startOfDay());
		}
		if (value instanceof Date) {
			return Optional.of(((Date) value).toInstant().atOffset(ZoneOffset.UTC));
		}
		if (value instanceof Number) {
			return fromEpochMillis((Number) value);
		}
		return parseText(value.toString());
	}

	public static Optional<CalendarDate> parseDate(Object value) {
		return parse(value)
				.filter(timestamp -> timestamp.getYear() >= CalendarDate.MIN_YEAR && timestamp.getYear() <= CalendarDate.MAX_YEAR)
				.map(CalendarDate::fromTimestamp);
	}

	private static Optional<OffsetDateTime> parseText(String raw) {
		String text = Strings.nullToEmpty(raw).trim();
		if (text.isEmpty()) {
			return Optional.empty();
		}
		try {
			if (CharMatcher.inRange('0', '9').matchesAllOf(text)) {
				if (text.length() == 14) {
					return Optional.of(LocalDateTime.parse(text, COMPACT_DATE_TIME).atOffset(ZoneOffset.UTC));
				}
				if (text.length() == 8) {
					return Optional.of(LocalDate.parse(text, COMPACT_DATE).atStartOfDay().atOffset(ZoneOffset.UTC));
				}
				return Optional.empty();
			}
			if (text.endsWith("]")) {
				return Optional.of(toUtc(ZonedDateTime.parse(text, DateTimeFormatter.ISO_ZONED_DATE_TIME).toOffsetDateTime()));
			}
			TemporalAccessor parsed = FLEXIBLE_ISO.parseBest(withTimeSeparator(text), OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
			if (parsed instanceof OffsetDateTime) {
				return Optional.of(toUtc((OffsetDateTime) parsed));
			}
			if (parsed instanceof LocalDateTime) {
				return Optional.of(((LocalDateTime) parsed).atOffset(ZoneOffset.UTC));
			}
			return Optional.of(((LocalDate) parsed).atStartOfDay().atOffset(ZoneOffset.UTC));
		} catch (DateTimeParseException e) {
			return Optional.empty();
		}
	}

	// A space between date and time is read as 'T'.
	private static String withTimeSeparator(String text) {
		if (text.length() > DATE_LENGTH && text.charAt(DATE_LENGTH) == ' ') {
			return text.substring(0, DATE_LENGTH) + 'T' + text.substring(DATE_LENGTH + 1);
		}
		return text;
	}

	private static Optional<OffsetDateTime> fromEpochMillis(Number millis) {
		if (millis instanceof Double || millis instanceof Float) {
			double d = millis.doubleValue();
			if (Double.isNaN(d) || Double.isInfinite(d)) {
				return Optional.empty();
			}
		}
		try {
			return Optional.of(Instant.ofEpochMilli(millis.longValue()).atOffset(ZoneOffset.UTC));
		} catch (DateTimeException e) {
			return Optional.empty();
		}
	}

	private static OffsetDateTime toUtc(OffsetDateTime timestamp) {
		return timestamp.withOffsetSameInstant(ZoneOffset.UTC);
	}
}
