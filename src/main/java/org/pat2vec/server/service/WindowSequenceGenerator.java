package org.pat2vec.server.service;

import com.google.common.base.Preconditions;
import org.pat2vec.model.CalendarDate;
import org.pat2vec.model.GlobalBounds;
import org.pat2vec.model.RelativeDuration;
import org.pat2vec.model.WindowSequence;
import org.pat2vec.model.WindowingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static java.lang.String.format;

@Service
public class WindowSequenceGenerator {

	public static final int MAX_ITERATIONS = 10_000;

	private final Logger logger = LoggerFactory.getLogger(getClass());

	public WindowSequence generate(CalendarDate anchor, GlobalBounds bounds, WindowingContext context) {
		Preconditions.checkNotNull(anchor, "anchor");
		Preconditions.checkNotNull(context, "context");
		return generate(anchor.startOfDay(), context.getSpan(), context.getInterval(), context.isLookback(), bounds,
				context.getVerbosity());
	}

	public WindowSequence generate(CalendarDate anchor, RelativeDuration span, RelativeDuration interval,
			boolean lookback, GlobalBounds bounds) {
		Preconditions.checkNotNull(anchor, "anchor");
		return generate(anchor.startOfDay(), span, interval, lookback, bounds, 0);
	}

	public WindowSequence generate(CalendarDate anchor, int years, int months, int days, boolean lookback, GlobalBounds bounds) {
		return generate(anchor, RelativeDuration.of(years, months, days), RelativeDuration.ONE_DAY, lookback, bounds);
	}

	/**
	 * Generates the sequence for an anchor carrying a time of day. The anchor is converted to UTC first;
	 * the time of day is kept while stepping and dropped from the returned dates.
	 *
	 * @param anchor    start of the range when looking forward, its end when looking back
	 * @param span      total length of the range
	 * @param interval  step between two slices, must be strictly positive
	 * @param lookback  whether the anchor is the end of the range
	 * @param bounds    dates no slice may fall outside of
	 * @param verbosity 1 or more logs clamping and generation details at INFO instead of DEBUG
	 * @return the slice dates, ascending, possibly empty when the range lies outside the bounds
	 * @throws InvalidIntervalException when the interval is zero or has a negative component
	 */
	public WindowSequence generate(OffsetDateTime anchor, RelativeDuration span, RelativeDuration interval,
			boolean lookback, GlobalBounds bounds, int verbosity) {
		Preconditions.checkNotNull(anchor, "anchor");
		Preconditions.checkNotNull(span, "span");
		Preconditions.checkNotNull(interval, "interval");
		Preconditions.checkNotNull(bounds, "bounds");

		OffsetDateTime utcAnchor = anchor.withOffsetSameInstant(ZoneOffset.UTC);
		OffsetDateTime chronologicalStart;
		OffsetDateTime chronologicalEnd;
		if (lookback) {
			chronologicalStart = utcAnchor.minus(span.toPeriod());
			chronologicalEnd = utcAnchor;
		} else {
			chronologicalStart = utcAnchor;
			chronologicalEnd = utcAnchor.plus(span.toPeriod());
		}

		OffsetDateTime finalStart = max(chronologicalStart, bounds.getStartInstant());
		OffsetDateTime finalEnd = min(chronologicalEnd, bounds.getEndInstant());
		if (finalStart.isAfter(chronologicalStart)) {
			diagnostic(verbosity, "Adjusted start date from {} to {} due to global limit.", chronologicalStart.toLocalDate(), finalStart.toLocalDate());
		}
		if (finalEnd.isBefore(chronologicalEnd)) {
			diagnostic(verbosity, "Adjusted end date from {} to {} due to global limit.", chronologicalEnd.toLocalDate(), finalEnd.toLocalDate());
		}

		if (finalStart.isAfter(finalEnd)) {
			diagnostic(verbosity, "Range {}..{} lies outside bounds {}, no slices generated.",
					chronologicalStart.toLocalDate(), chronologicalEnd.toLocalDate(), bounds);
			return WindowSequence.empty();
		}

		if (!interval.isStrictlyPositive()) {
			throw new InvalidIntervalException(format("The time interval delta must be a positive duration, got %s.", interval));
		}

		List<CalendarDate> dates = interval.isFixedLength()
				? stepFixed(finalStart, finalEnd, interval.getDays())
				: stepCalendar(finalStart, finalEnd, interval);

		WindowSequence sequence = WindowSequence.of(dates);
		if (!sequence.isEmpty()) {
			diagnostic(verbosity, "Generated {} dates from {} to {}, first {}, last {}",
					sequence.size(), finalStart.toLocalDate(), finalEnd.toLocalDate(), sequence.first(), sequence.last());
		}
		return sequence;
	}

	// Whole days in UTC, so the number of steps is known up front.
	private List<CalendarDate> stepFixed(OffsetDateTime start, OffsetDateTime end, int stepDays) {
		long steps = Duration.between(start, end).dividedBy(Duration.ofDays(stepDays)) + 1;
		if (steps > MAX_ITERATIONS) {
			logger.warn("Maximum iterations ({}) reached, stopping date generation at {} of {} slices", MAX_ITERATIONS, MAX_ITERATIONS, steps);
			steps = MAX_ITERATIONS;
		}
		List<CalendarDate> dates = new ArrayList<>((int) steps);
		for (long i = 0; i < steps; i++) {
			dates.add(CalendarDate.of(start.plusDays(i * stepDays).toLocalDate()));
		}
		return dates;
	}

	// Month and year steps clamp to month ends, and the clamp carries into the next step.
	private List<CalendarDate> stepCalendar(OffsetDateTime start, OffsetDateTime end, RelativeDuration interval) {
		List<CalendarDate> dates = new ArrayList<>();
		OffsetDateTime current = start;
		int iterations = 0;
		while (!current.isAfter(end) && iterations < MAX_ITERATIONS) {
			dates.add(CalendarDate.of(current.toLocalDate()));
			current = current.plus(interval.toPeriod());
			iterations++;
		}
		if (!current.isAfter(end)) {
			logger.warn("Maximum iterations ({}) reached, stopping date generation at {}", MAX_ITERATIONS, current.toLocalDate());
		}
		return dates;
	}

	private void diagnostic(int verbosity, String message, Object... args) {
		if (verbosity >= 1) {
			logger.info(message, args);
		} else {
			logger.debug(message, args);
		}
	}

	private static OffsetDateTime max(OffsetDateTime a, OffsetDateTime b) {
		return a.isAfter(b) ? a : b;
	}

	private static OffsetDateTime min(OffsetDateTime a, OffsetDateTime b) {
		return a.isBefore(b) ? a : b;
	}
}
