package org.pat2vec.server.config;

import org.pat2vec.model.CalendarDate;
import org.pat2vec.model.GlobalBounds;
import org.pat2vec.model.RelativeDuration;
import org.pat2vec.model.WindowingContext;
import org.pat2vec.server.service.DateValidator;
import org.pat2vec.server.service.InvalidDateException.Boundary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pat2vec")
public class WindowingProperties {

	static final String DEFAULT_GLOBAL_START = "1995-01-01";
	static final String DEFAULT_GLOBAL_END = "2023-11-01";

	private static final Logger LOGGER = LoggerFactory.getLogger(WindowingProperties.class);

	private boolean lookback = true;

	private String globalStartYear;
	private String globalStartMonth;
	private String globalStartDay;
	private String globalEndYear;
	private String globalEndMonth;
	private String globalEndDay;

	private int years = 0;
	private int months = 0;
	private int days = 1;

	private RelativeDuration timeWindowInterval = RelativeDuration.ONE_DAY;

	private boolean individualPatientWindow = false;
	private String individualPatientWindowControlsMethod = "full";
	private long randomSeed = 42;

	private String anchorYear;
	private String anchorMonth;
	private String anchorDay;

	private int verbosity = 0;
	private boolean dropnaTimestamps = true;

	public WindowingContext toContext() {
		return WindowingContext.builder()
				.lookback(lookback)
				.span(RelativeDuration.of(years, months, days))
				.interval(timeWindowInterval)
				.globalBounds(getGlobalBounds())
				.individualPatientWindow(individualPatientWindow)
				.controlsMethod(individualPatientWindowControlsMethod)
				.randomSeed(randomSeed)
				.anchor(getAnchor())
				.verbosity(verbosity)
				.dropnaTimestamps(dropnaTimestamps)
				.build();
	}

	public GlobalBounds getGlobalBounds() {
		if (allNull(globalStartYear, globalStartMonth, globalStartDay, globalEndYear, globalEndMonth, globalEndDay)) {
			return GlobalBounds.of(CalendarDate.parse(DEFAULT_GLOBAL_START), CalendarDate.parse(DEFAULT_GLOBAL_END));
		}
		CalendarDate start = DateValidator.toCalendarDate(Boundary.START, globalStartYear, globalStartMonth, globalStartDay);
		CalendarDate end = DateValidator.toCalendarDate(Boundary.END, globalEndYear, globalEndMonth, globalEndDay);
		if (!GlobalBounds.isChronological(start, end)) {
			LOGGER.warn("Global start date {} is after global end date {}, swapping them", start, end);
		}
		return GlobalBounds.of(start, end);
	}

	public CalendarDate getAnchor() {
		if (allNull(anchorYear, anchorMonth, anchorDay)) {
			return null;
		}
		return DateValidator.toCalendarDate(Boundary.START, anchorYear, anchorMonth, anchorDay);
	}

	private static boolean allNull(Object... values) {
		for (Object value : values) {
			if (value != null) {
				return false;
			}
		}
		return true;
	}

	public boolean isLookback() {
		return lookback;
	}

	public void setLookback(boolean lookback) {
		this.lookback = lookback;
	}

	public String getGlobalStartYear() {
		return globalStartYear;
	}

	public void setGlobalStartYear(String globalStartYear) {
		this.globalStartYear = globalStartYear;
	}

	public String getGlobalStartMonth() {
		return globalStartMonth;
	}

	public void setGlobalStartMonth(String globalStartMonth) {
		this.globalStartMonth = globalStartMonth;
	}

	public String getGlobalStartDay() {
		return globalStartDay;
	}

	public void setGlobalStartDay(String globalStartDay) {
		this.globalStartDay = globalStartDay;
	}

	public String getGlobalEndYear() {
		return globalEndYear;
	}

	public void setGlobalEndYear(String globalEndYear) {
		this.globalEndYear = globalEndYear;
	}

	public String getGlobalEndMonth() {
		return globalEndMonth;
	}

	public void setGlobalEndMonth(String globalEndMonth) {
		this.globalEndMonth = globalEndMonth;
	}

	public String getGlobalEndDay() {
		return globalEndDay;
	}

	public void setGlobalEndDay(String globalEndDay) {
		this.globalEndDay = globalEndDay;
	}

	public int getYears() {
		return years;
	}

	public void setYears(int years) {
		this.years = years;
	}

	public int getMonths() {
		return months;
	}

	public void setMonths(int months) {
		this.months = months;
	}

	public int getDays() {
		return days;
	}

	public void setDays(int days) {
		this.days = days;
	}

	public RelativeDuration getTimeWindowInterval() {
		return timeWindowInterval;
	}

	public void setTimeWindowInterval(RelativeDuration timeWindowInterval) {
		this.timeWindowInterval = timeWindowInterval;
	}

	public boolean isIndividualPatientWindow() {
		return individualPatientWindow;
	}

	public void setIndividualPatientWindow(boolean individualPatientWindow) {
		this.individualPatientWindow = individualPatientWindow;
	}

	public String getIndividualPatientWindowControlsMethod() {
		return individualPatientWindowControlsMethod;
	}

	public void setIndividualPatientWindowControlsMethod(String individualPatientWindowControlsMethod) {
		this.individualPatientWindowControlsMethod = individualPatientWindowControlsMethod;
	}

	public long getRandomSeed() {
		return randomSeed;
	}

	public void setRandomSeed(long randomSeed) {
		this.randomSeed = randomSeed;
	}

	public String getAnchorYear() {
		return anchorYear;
	}

	public void setAnchorYear(String anchorYear) {
		this.anchorYear = anchorYear;
	}

	public String getAnchorMonth() {
		return anchorMonth;
	}

	public void setAnchorMonth(String anchorMonth) {
		this.anchorMonth = anchorMonth;
	}

	public String getAnchorDay() {
		return anchorDay;
	}

	public void setAnchorDay(String anchorDay) {
		this.anchorDay = anchorDay;
	}

	public int getVerbosity() {
		return verbosity;
	}

	public void setVerbosity(int verbosity) {
		this.verbosity = verbosity;
	}

	public boolean isDropnaTimestamps() {
		return dropnaTimestamps;
	}

	public void setDropnaTimestamps(boolean dropnaTimestamps) {
		this.dropnaTimestamps = dropnaTimestamps;
	}
}
