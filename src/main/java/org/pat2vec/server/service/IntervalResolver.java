package org.pat2vec.server.service;

import com.google.common.base.Preconditions;
import org.pat2vec.model.CalendarDate;
import org.pat2vec.model.RelativeDuration;
import org.pat2vec.model.TimeWindow;

import static java.lang.String.format;

public class IntervalResolver {

	private IntervalResolver() {
	}

	public static CalendarDate resolveEnd(CalendarDate anchor, RelativeDuration duration) {
		Preconditions.checkNotNull(anchor, "anchor");
		Preconditions.checkNotNull(duration, "duration");
		return anchor.plus(duration);
	}

	/**
	 * Components of the anchor and of anchor + duration, in the order
	 * start year, start month, end year, end month, start day, end day.
	 * The end may precede the start when the duration is negative.
	 */
	public static int[] getStartEndYearMonth(CalendarDate anchor, RelativeDuration duration) {
		CalendarDate end = resolveEnd(anchor, duration);
		return new int[]{anchor.getYear(), anchor.getMonth(), end.getYear(), end.getMonth(), anchor.getDay(), end.getDay()};
	}

	public static TimeWindow resolveSliceWindow(CalendarDate sliceDate, RelativeDuration interval, boolean lookback) {
		RelativeDuration offset = lookback ? interval.negated() : interval;
		return TimeWindow.of(sliceDate, resolveEnd(sliceDate, offset));
	}

	public static int countIntervals(CalendarDate anchor, RelativeDuration total, RelativeDuration interval) {
		Preconditions.checkNotNull(interval, "interval");
		if (!interval.isStrictlyPositive()) {
			throw new InvalidIntervalException(format("The time interval delta must be a positive duration, got %s.", interval));
		}
		CalendarDate end = resolveEnd(anchor, total);
		if (!end.isAfter(anchor)) {
			return 0;
		}
		if (interval.isFixedLength()) {
			return (int) (anchor.daysUntil(end) / interval.getDays());
		}
		int count = 0;
		CalendarDate current = anchor.plus(interval);
		while (!current.isAfter(end)) {
			count++;
			current = current.plus(interval);
		}
		return count;
	}
}
