package org.pat2vec.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Preconditions;

import java.io.Serializable;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

public final class CalendarDate implements Comparable<CalendarDate>, Serializable {

	public static final int MIN_YEAR = 1;
	public static final int MAX_YEAR = 9999;

	// Last representable instant of a day, microsecond precision.
	static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59, 999_999_000);

	private final LocalDate date;

	private CalendarDate(LocalDate date) {
		this.date = date;
	}

	public static CalendarDate of(LocalDate date) {
		Preconditions.checkNotNull(date, "date");
		Preconditions.checkArgument(date.getYear() >= MIN_YEAR && date.getYear() <= MAX_YEAR,
				"Year %s is outside %s..%s", date.getYear(), MIN_YEAR, MAX_YEAR);
		return new CalendarDate(date);
	}

	public static CalendarDate fromTimestamp(OffsetDateTime timestamp) {
		Preconditions.checkNotNull(timestamp, "timestamp");
		return of(timestamp.withOffsetSameInstant(ZoneOffset.UTC).toLocalDate());
	}

	@JsonCreator(mode = JsonCreator.Mode.DELEGATING)
	public static CalendarDate parse(String isoDate) {
		return of(LocalDate.parse(isoDate));
	}

	public int getYear() {
		return date.getYear();
	}

	public int getMonth() {
		return date.getMonthValue();
	}

	public int getDay() {
		return date.getDayOfMonth();
	}

	public LocalDate toLocalDate() {
		return date;
	}

	public CalendarDate plus(RelativeDuration duration) {
		return of(date.plus(duration.toPeriod()));
	}

	public OffsetDateTime startOfDay() {
		return date.atStartOfDay().atOffset(ZoneOffset.UTC);
	}

	public OffsetDateTime endOfDay() {
		return date.atTime(END_OF_DAY).atOffset(ZoneOffset.UTC);
	}

	public long daysUntil(CalendarDate other) {
		return ChronoUnit.DAYS.between(date, other.date);
	}

	public boolean isAfter(CalendarDate other) {
		return date.isAfter(other.date);
	}

	public boolean isBefore(CalendarDate other) {
		return date.isBefore(other.date);
	}

	@Override
	public int compareTo(CalendarDate other) {
		return date.compareTo(other.date);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return date.equals(((CalendarDate) o).date);
	}

	@Override
	public int hashCode() {
		return date.hashCode();
	}

	@JsonValue
	@Override
	public String toString() {
		return date.toString();
	}
}
