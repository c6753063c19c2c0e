package org.pat2vec.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.io.Serializable;
import java.util.Iterator;
import java.util.List;

public final class WindowSequence implements Iterable<CalendarDate>, Serializable {

	private static final WindowSequence EMPTY = new WindowSequence(ImmutableList.of());

	private final ImmutableList<CalendarDate> dates;

	private WindowSequence(ImmutableList<CalendarDate> dates) {
		this.dates = dates;
	}

	@JsonCreator(mode = JsonCreator.Mode.DELEGATING)
	public static WindowSequence of(List<CalendarDate> dates) {
		ImmutableList<CalendarDate> copy = ImmutableList.copyOf(dates);
		for (int i = 1; i < copy.size(); i++) {
			Preconditions.checkArgument(copy.get(i - 1).isBefore(copy.get(i)),
					"Dates must be strictly ascending, found %s then %s", copy.get(i - 1), copy.get(i));
		}
		return copy.isEmpty() ? EMPTY : new WindowSequence(copy);
	}

	public static WindowSequence empty() {
		return EMPTY;
	}

	@JsonValue
	public List<CalendarDate> getDates() {
		return dates;
	}

	public int size() {
		return dates.size();
	}

	public boolean isEmpty() {
		return dates.isEmpty();
	}

	public CalendarDate get(int index) {
		return dates.get(index);
	}

	public CalendarDate first() {
		Preconditions.checkState(!dates.isEmpty(), "Empty window sequence");
		return dates.get(0);
	}

	public CalendarDate last() {
		Preconditions.checkState(!dates.isEmpty(), "Empty window sequence");
		return dates.get(dates.size() - 1);
	}

	@Override
	public Iterator<CalendarDate> iterator() {
		return dates.iterator();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return dates.equals(((WindowSequence) o).dates);
	}

	@Override
	public int hashCode() {
		return dates.hashCode();
	}

	@Override
	public String toString() {
		return dates.toString();
	}
}
