package org.pat2vec.server.service;

import com.google.common.collect.ImmutableList;
import org.pat2vec.model.CalendarDate;
import org.pat2vec.server.service.InvalidDateException.Boundary;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.LocalDate;

import static java.lang.String.format;

public class DateValidator {

	private DateValidator() {
	}

	// Zero padded: start year, month, day, then end year, month, day.
	public static ImmutableList<String> validateInputDates(Object startYear, Object startMonth, Object startDay,
			Object endYear, Object endMonth, Object endDay) {

		CalendarDate start = toCalendarDate(Boundary.START, startYear, startMonth, startDay);
		CalendarDate end = toCalendarDate(Boundary.END, endYear, endMonth, endDay);
		return ImmutableList.of(
				formatYear(start), formatTwoDigits(start.getMonth()), formatTwoDigits(start.getDay()),
				formatYear(end), formatTwoDigits(end.getMonth()), formatTwoDigits(end.getDay()));
	}

	public static CalendarDate toCalendarDate(Boundary boundary, Object year, Object month, Object day) {
		int y = toInt(boundary, year);
		int m = toInt(boundary, month);
		int d = toInt(boundary, day);
		if (y < CalendarDate.MIN_YEAR || y > CalendarDate.MAX_YEAR) {
			throw new InvalidDateException(boundary, format("Invalid %s date component: year %s is out of range %s..%s",
					boundary.label(), y, CalendarDate.MIN_YEAR, CalendarDate.MAX_YEAR));
		}
		try {
			return CalendarDate.of(LocalDate.of(y, m, d));
		} catch (DateTimeException e) {
			throw new InvalidDateException(boundary, format("Invalid %s date component: %s", boundary.label(), e.getMessage()), e);
		}
	}

	public static String formatYear(CalendarDate date) {
		return format("%04d", date.getYear());
	}

	public static String formatTwoDigits(int value) {
		return format("%02d", value);
	}

	private static int toInt(Boundary boundary, Object component) {
		if (component == null) {
			throw new InvalidDateException(boundary, format("Invalid %s date component: value is missing", boundary.label()));
		}
		if (component instanceof Integer || component instanceof Short || component instanceof Byte) {
			return ((Number) component).intValue();
		}
		if (component instanceof Long) {
			try {
				return Math.toIntExact((Long) component);
			} catch (ArithmeticException e) {
				throw new InvalidDateException(boundary, format("Invalid %s date component: %s is too large", boundary.label(), component), e);
			}
		}
		if (component instanceof Double || component instanceof Float) {
			double value = ((Number) component).doubleValue();
			if (value != Math.rint(value) || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
				throw new InvalidDateException(boundary, format("Invalid %s date component: %s is not a whole number", boundary.label(), component));
			}
			return (int) value;
		}
		if (component instanceof BigDecimal) {
			try {
				return ((BigDecimal) component).intValueExact();
			} catch (ArithmeticException e) {
				throw new InvalidDateException(boundary, format("Invalid %s date component: %s is not a whole number", boundary.label(), component), e);
			}
		}
		try {
			return Integer.parseInt(component.toString().trim());
		} catch (NumberFormatException e) {
			throw new InvalidDateException(boundary, format("Invalid %s date component: '%s' is not an integer", boundary.label(), component), e);
		}
	}
}
