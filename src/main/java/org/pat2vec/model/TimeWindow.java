package org.pat2vec.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.google.common.base.Preconditions;

import java.io.Serializable;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

public final class TimeWindow implements Serializable {

	private final OffsetDateTime start;
	private final OffsetDateTime end;

	private TimeWindow(OffsetDateTime start, OffsetDateTime end) {
		this.start = start;
		this.end = end;
	}

	public static TimeWindow of(CalendarDate first, CalendarDate second) {
		Preconditions.checkNotNull(first, "first");
		Preconditions.checkNotNull(second, "second");
		if (first.isAfter(second)) {
			return new TimeWindow(second.startOfDay(), first.endOfDay());
		}
		return new TimeWindow(first.startOfDay(), second.endOfDay());
	}

	public OffsetDateTime getStart() {
		return start;
	}

	public OffsetDateTime getEnd() {
		return end;
	}

	@JsonIgnore
	public CalendarDate getStartDate() {
		return CalendarDate.fromTimestamp(start);
	}

	@JsonIgnore
	public CalendarDate getEndDate() {
		return CalendarDate.fromTimestamp(end);
	}

	public boolean contains(OffsetDateTime timestamp) {
		OffsetDateTime utc = timestamp.withOffsetSameInstant(ZoneOffset.UTC);
		return !utc.isBefore(start) && !utc.isAfter(end);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TimeWindow that = (TimeWindow) o;
		return start.equals(that.start) && end.equals(that.end);
	}

	@Override
	public int hashCode() {
		return 31 * start.hashCode() + end.hashCode();
	}

	@Override
	public String toString() {
		return "[" + start + ", " + end + "]";
	}
}
