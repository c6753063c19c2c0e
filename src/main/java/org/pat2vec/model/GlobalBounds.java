package org.pat2vec.model;

import com.google.common.base.Preconditions;

import java.io.Serializable;
import java.time.OffsetDateTime;

public final class GlobalBounds implements Serializable {

	private final CalendarDate earliest;
	private final CalendarDate latest;

	private GlobalBounds(CalendarDate earliest, CalendarDate latest) {
		this.earliest = earliest;
		this.latest = latest;
	}

	public static GlobalBounds of(CalendarDate first, CalendarDate second) {
		Preconditions.checkNotNull(first, "first");
		Preconditions.checkNotNull(second, "second");
		return isChronological(first, second) ? new GlobalBounds(first, second) : new GlobalBounds(second, first);
	}

	public static boolean isChronological(CalendarDate first, CalendarDate second) {
		return !first.isAfter(second);
	}

	public CalendarDate getEarliest() {
		return earliest;
	}

	public CalendarDate getLatest() {
		return latest;
	}

	public OffsetDateTime getStartInstant() {
		return earliest.startOfDay();
	}

	public OffsetDateTime getEndInstant() {
		return latest.endOfDay();
	}

	public boolean contains(CalendarDate date) {
		return !date.isBefore(earliest) && !date.isAfter(latest);
	}

	public TimeWindow toTimeWindow() {
		return TimeWindow.of(earliest, latest);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GlobalBounds that = (GlobalBounds) o;
		return earliest.equals(that.earliest) && latest.equals(that.latest);
	}

	@Override
	public int hashCode() {
		return 31 * earliest.hashCode() + latest.hashCode();
	}

	@Override
	public String toString() {
		return earliest + ".." + latest;
	}
}
