package org.pat2vec.model;

import com.google.common.base.Preconditions;

import java.io.Serializable;
import java.util.Objects;
import java.util.Optional;

public final class WindowingContext implements Serializable {

	private final boolean lookback;
	private final RelativeDuration span;
	private final RelativeDuration interval;
	private final GlobalBounds globalBounds;
	private final boolean individualPatientWindow;
	private final String controlsMethod;
	private final long randomSeed;
	private final CalendarDate anchor;
	private final int verbosity;
	private final boolean dropnaTimestamps;

	private WindowingContext(Builder builder) {
		this.lookback = builder.lookback;
		this.span = builder.span;
		this.interval = builder.interval;
		this.globalBounds = builder.globalBounds;
		this.individualPatientWindow = builder.individualPatientWindow;
		this.controlsMethod = builder.controlsMethod;
		this.randomSeed = builder.randomSeed;
		this.anchor = builder.anchor;
		this.verbosity = builder.verbosity;
		this.dropnaTimestamps = builder.dropnaTimestamps;
	}

	public static Builder builder() {
		return new Builder();
	}

	public Builder toBuilder() {
		return new Builder()
				.lookback(lookback)
				.span(span)
				.interval(interval)
				.globalBounds(globalBounds)
				.individualPatientWindow(individualPatientWindow)
				.controlsMethod(controlsMethod)
				.randomSeed(randomSeed)
				.anchor(anchor)
				.verbosity(verbosity)
				.dropnaTimestamps(dropnaTimestamps);
	}

	public boolean isLookback() {
		return lookback;
	}

	public RelativeDuration getSpan() {
		return span;
	}

	public RelativeDuration getInterval() {
		return interval;
	}

	public GlobalBounds getGlobalBounds() {
		return globalBounds;
	}

	public boolean isIndividualPatientWindow() {
		return individualPatientWindow;
	}

	public String getControlsMethod() {
		return controlsMethod;
	}

	public long getRandomSeed() {
		return randomSeed;
	}

	public Optional<CalendarDate> getAnchor() {
		return Optional.ofNullable(anchor);
	}

	public CalendarDate getEffectiveAnchor() {
		if (anchor != null) {
			return anchor;
		}
		return lookback ? globalBounds.getLatest() : globalBounds.getEarliest();
	}

	public int getVerbosity() {
		return verbosity;
	}

	public boolean isDropnaTimestamps() {
		return dropnaTimestamps;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		WindowingContext that = (WindowingContext) o;
		return lookback == that.lookback
				&& individualPatientWindow == that.individualPatientWindow
				&& randomSeed == that.randomSeed
				&& verbosity == that.verbosity
				&& dropnaTimestamps == that.dropnaTimestamps
				&& span.equals(that.span)
				&& interval.equals(that.interval)
				&& globalBounds.equals(that.globalBounds)
				&& Objects.equals(controlsMethod, that.controlsMethod)
				&& Objects.equals(anchor, that.anchor);
	}

	@Override
	public int hashCode() {
		return Objects.hash(lookback, span, interval, globalBounds, individualPatientWindow, controlsMethod, randomSeed,
				anchor, verbosity, dropnaTimestamps);
	}

	@Override
	public String toString() {
		return "WindowingContext{" +
				"lookback=" + lookback +
				", span=" + span +
				", interval=" + interval +
				", globalBounds=" + globalBounds +
				", individualPatientWindow=" + individualPatientWindow +
				", controlsMethod='" + controlsMethod + '\'' +
				", randomSeed=" + randomSeed +
				", anchor=" + anchor +
				'}';
	}

	public static final class Builder {

		private boolean lookback = true;
		private RelativeDuration span = RelativeDuration.ONE_DAY;
		private RelativeDuration interval = RelativeDuration.ONE_DAY;
		private GlobalBounds globalBounds;
		private boolean individualPatientWindow;
		private String controlsMethod = "full";
		private long randomSeed = 42;
		private CalendarDate anchor;
		private int verbosity;
		private boolean dropnaTimestamps = true;

		private Builder() {
		}

		public Builder lookback(boolean lookback) {
			this.lookback = lookback;
			return this;
		}

		public Builder span(RelativeDuration span) {
			this.span = span;
			return this;
		}

		public Builder interval(RelativeDuration interval) {
			this.interval = interval;
			return this;
		}

		public Builder globalBounds(GlobalBounds globalBounds) {
			this.globalBounds = globalBounds;
			return this;
		}

		public Builder individualPatientWindow(boolean individualPatientWindow) {
			this.individualPatientWindow = individualPatientWindow;
			return this;
		}

		public Builder controlsMethod(String controlsMethod) {
			this.controlsMethod = controlsMethod;
			return this;
		}

		public Builder randomSeed(long randomSeed) {
			this.randomSeed = randomSeed;
			return this;
		}

		public Builder anchor(CalendarDate anchor) {
			this.anchor = anchor;
			return this;
		}

		public Builder verbosity(int verbosity) {
			this.verbosity = verbosity;
			return this;
		}

		public Builder dropnaTimestamps(boolean dropnaTimestamps) {
			this.dropnaTimestamps = dropnaTimestamps;
			return this;
		}

		public WindowingContext build() {
			Preconditions.checkNotNull(span, "span");
			Preconditions.checkNotNull(interval, "interval");
			Preconditions.checkNotNull(globalBounds, "globalBounds");
			return new WindowingContext(this);
		}
	}
}
