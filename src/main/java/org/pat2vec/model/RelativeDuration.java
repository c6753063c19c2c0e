package org.pat2vec.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Period;
import java.util.Objects;

public final class RelativeDuration implements Serializable {

	public static final RelativeDuration ZERO = new RelativeDuration(0, 0, 0);
	public static final RelativeDuration ONE_DAY = new RelativeDuration(0, 0, 1);

	private final int years;
	private final int months;
	private final int days;

	@JsonCreator
	public RelativeDuration(@JsonProperty("years") int years, @JsonProperty("months") int months, @JsonProperty("days") int days) {
		this.years = years;
		this.months = months;
		this.days = days;
	}

	public static RelativeDuration of(int years, int months, int days) {
		return new RelativeDuration(years, months, days);
	}

	public static RelativeDuration ofDays(int days) {
		return new RelativeDuration(0, 0, days);
	}

	public static RelativeDuration ofMonths(int months) {
		return new RelativeDuration(0, months, 0);
	}

	public static RelativeDuration ofYears(int years) {
		return new RelativeDuration(years, 0, 0);
	}

	public static RelativeDuration from(Period period) {
		return new RelativeDuration(period.getYears(), period.getMonths(), period.getDays());
	}

	public int getYears() {
		return years;
	}

	public int getMonths() {
		return months;
	}

	public int getDays() {
		return days;
	}

	public Period toPeriod() {
		return Period.of(years, months, days);
	}

	public RelativeDuration negated() {
		return new RelativeDuration(-years, -months, -days);
	}

	@JsonIgnore
	public boolean isZero() {
		return years == 0 && months == 0 && days == 0;
	}

	@JsonIgnore
	public boolean isStrictlyPositive() {
		return years >= 0 && months >= 0 && days >= 0 && !isZero();
	}

	@JsonIgnore
	public boolean isFixedLength() {
		return years == 0 && months == 0;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		RelativeDuration that = (RelativeDuration) o;
		return years == that.years && months == that.months && days == that.days;
	}

	@Override
	public int hashCode() {
		return Objects.hash(years, months, days);
	}

	@Override
	public String toString() {
		return toPeriod().toString();
	}
}
