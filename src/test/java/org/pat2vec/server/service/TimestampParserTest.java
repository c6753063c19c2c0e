package org.pat2vec.server.service;

import org.junit.jupiter.api.Test;
import org.pat2vec.model.CalendarDate;

import java.time.*;
import java.util.Date;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class TimestampParserTest {

	private static final OffsetDateTime TEN_UTC = OffsetDateTime.of(2021, 1, 1, 10, 0, 0, 0, ZoneOffset.UTC);

	@Test
	public void testIsoTextWithOffsetsIsNormalisedToUtc() {
		assertEquals(Optional.of(TEN_UTC), TimestampParser.parse("2021-01-01T10:00:00Z"));
		assertEquals(Optional.of(TEN_UTC), TimestampParser.parse("2021-01-01T12:00:00+02:00"));
		assertEquals(Optional.of(TEN_UTC), TimestampParser.parse("2021-01-01 08:00:00-02:00"));
		assertEquals(Optional.of(TEN_UTC), TimestampParser.parse("2021-01-01T11:00:00+01:00[Europe/Paris]"));
	}

	@Test
	public void testHourOnlyOffsets() {
		assertEquals(Optional.of(TEN_UTC), TimestampParser.parse("2021-01-01T12:00:00+02"));
		assertEquals(Optional.of(TEN_UTC), TimestampParser.parse("2021-01-01 07:00-03"));
	}

	@Test
	public void testDateAndTimeNeedASeparator() {
		assertEquals(Optional.empty(), TimestampParser.parse("2021-01-0110:00"));
		assertEquals(Optional.empty(), TimestampParser.parse("2021-01-01x10:00"));
	}

	@Test
	public void testTextWithoutZoneIsTakenAsUtc() {
		assertEquals(Optional.of(TEN_UTC), TimestampParser.parse("2021-01-01T10:00"));
		assertEquals(Optional.of(TEN_UTC), TimestampParser.parse(" 2021-01-01 10:00:00 "));
		assertEquals(Optional.of(OffsetDateTime.of(2021, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC)), TimestampParser.parse("2021-01-01"));
		assertEquals(Optional.of(OffsetDateTime.of(2021, 1, 1, 10, 0, 0, 123_456_000, ZoneOffset.UTC)),
				TimestampParser.parse("2021-01-01T10:00:00.123456"));
	}

	@Test
	public void testCompactForms() {
		assertEquals(Optional.of(OffsetDateTime.of(2017, 9, 10, 11, 0, 11, 0, ZoneOffset.UTC)), TimestampParser.parse("20170910110011"));
		assertEquals(Optional.of(OffsetDateTime.of(1974, 5, 28, 0, 0, 0, 0, ZoneOffset.UTC)), TimestampParser.parse("19740528"));
		assertEquals(Optional.empty(), TimestampParser.parse("123"));
	}

	@Test
	public void testTemporalObjects() {
		assertEquals(Optional.of(TEN_UTC), TimestampParser.parse(TEN_UTC.toInstant()));
		assertEquals(Optional.of(TEN_UTC), TimestampParser.parse(LocalDateTime.of(2021, 1, 1, 10, 0)));
		assertEquals(Optional.of(TEN_UTC), TimestampParser.parse(ZonedDateTime.of(2021, 1, 1, 5, 0, 0, 0, ZoneId.of("America/New_York"))));
		assertEquals(Optional.of(TEN_UTC), TimestampParser.parse(Date.from(TEN_UTC.toInstant())));
		assertEquals(Optional.of(TEN_UTC), TimestampParser.parse(TEN_UTC.toInstant().toEpochMilli()));
		assertEquals(Optional.of(OffsetDateTime.of(1970, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC)), TimestampParser.parse(0));
	}

	@Test
	public void testUnreadableValuesAreEmpty() {
		assertEquals(Optional.empty(), TimestampParser.parse(null));
		assertEquals(Optional.empty(), TimestampParser.parse(""));
		assertEquals(Optional.empty(), TimestampParser.parse("   "));
		assertEquals(Optional.empty(), TimestampParser.parse("garbage"));
		assertEquals(Optional.empty(), TimestampParser.parse("2021-02-30"));
		assertEquals(Optional.empty(), TimestampParser.parse("20210230"));
		assertEquals(Optional.empty(), TimestampParser.parse(Double.NaN));
	}

	@Test
	public void testDateIsTheUtcDay() {
		assertEquals(Optional.of(CalendarDate.parse("2021-01-11")), TimestampParser.parseDate("2021-01-10 22:00:00-05:00"));
		assertEquals(Optional.of(CalendarDate.parse("2021-03-01")), TimestampParser.parseDate("20210301"));
		assertEquals(Optional.empty(), TimestampParser.parseDate("not a date"));
		assertEquals(Optional.empty(), TimestampParser.parseDate(Long.MIN_VALUE));
	}
}
