package org.pat2vec.model;

import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

public class TimeWindowTest {

	@Test
	public void testCoversWholeDays() {
		TimeWindow window = TimeWindow.of(CalendarDate.parse("2021-01-01"), CalendarDate.parse("2021-01-31"));
		assertEquals(OffsetDateTime.of(2021, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC), window.getStart());
		assertEquals(OffsetDateTime.of(2021, 1, 31, 23, 59, 59, 999_999_000, ZoneOffset.UTC), window.getEnd());
		assertEquals(CalendarDate.parse("2021-01-31"), window.getEndDate());
	}

	@Test
	public void testReversedDatesAreSwapped() {
		TimeWindow forward = TimeWindow.of(CalendarDate.parse("2021-01-01"), CalendarDate.parse("2021-01-31"));
		TimeWindow reversed = TimeWindow.of(CalendarDate.parse("2021-01-31"), CalendarDate.parse("2021-01-01"));
		assertEquals(forward, reversed);
	}

	@Test
	public void testContainsIsInclusiveAndComparesInUtc() {
		TimeWindow window = TimeWindow.of(CalendarDate.parse("2021-01-01"), CalendarDate.parse("2021-01-01"));
		assertTrue(window.contains(OffsetDateTime.of(2021, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC)));
		assertTrue(window.contains(OffsetDateTime.of(2021, 1, 1, 23, 59, 59, 999_999_000, ZoneOffset.UTC)));
		assertFalse(window.contains(OffsetDateTime.of(2021, 1, 2, 0, 0, 0, 0, ZoneOffset.UTC)));

		// 01:00 at +02:00 is still the previous day in UTC
		assertFalse(window.contains(OffsetDateTime.of(2021, 1, 1, 1, 0, 0, 0, ZoneOffset.ofHours(2))));
		assertTrue(window.contains(OffsetDateTime.of(2021, 1, 1, 20, 0, 0, 0, ZoneOffset.ofHours(-3))));
	}

	@Test
	public void testGlobalBoundsAreOrdered() {
		GlobalBounds bounds = GlobalBounds.of(CalendarDate.parse("2023-11-01"), CalendarDate.parse("1995-01-01"));
		assertEquals(CalendarDate.parse("1995-01-01"), bounds.getEarliest());
		assertEquals(CalendarDate.parse("2023-11-01"), bounds.getLatest());
		assertFalse(GlobalBounds.isChronological(CalendarDate.parse("2023-11-01"), CalendarDate.parse("1995-01-01")));
		assertTrue(bounds.contains(CalendarDate.parse("2000-06-30")));
		assertFalse(bounds.contains(CalendarDate.parse("2023-11-02")));
	}

	@Test
	public void testEntityWindowAnchorDependsOnDirection() {
		EntityWindowSpec spec = EntityWindowSpec.of("P1", CalendarDate.parse("2021-06-15"), CalendarDate.parse("2021-06-08"));
		assertEquals(CalendarDate.parse("2021-06-08"), spec.getStartDate());
		assertEquals(CalendarDate.parse("2021-06-15"), spec.getAnchor(true));
		assertEquals(CalendarDate.parse("2021-06-08"), spec.getAnchor(false));
		assertEquals("P2", spec.borrowedBy("P2").getEntityId());
		assertThrows(IllegalArgumentException.class, () -> EntityWindowSpec.of("", CalendarDate.parse("2021-06-15"), CalendarDate.parse("2021-06-08")));
	}
}
