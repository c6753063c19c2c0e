package org.pat2vec.server.config;

import org.junit.jupiter.api.Test;
import org.pat2vec.model.CalendarDate;
import org.pat2vec.model.GlobalBounds;
import org.pat2vec.model.RelativeDuration;
import org.pat2vec.model.WindowingContext;
import org.pat2vec.server.AbstractWindowingTest;
import org.pat2vec.server.service.InvalidDateException;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class WindowingPropertiesTest extends AbstractWindowingTest {

	@Autowired
	private WindowingContext windowingContext;

	@Test
	public void testTestProfileIsBound() {
		assertEquals(GlobalBounds.of(date("2020-01-01"), date("2020-12-31")), windowingContext.getGlobalBounds());
		assertFalse(windowingContext.isLookback());
		assertEquals(RelativeDuration.ofDays(9), windowingContext.getSpan());
		assertEquals(RelativeDuration.ofDays(3), windowingContext.getInterval());
		assertEquals(Optional.of(date("2020-03-01")), windowingContext.getAnchor());
		assertFalse(windowingContext.isIndividualPatientWindow());
		assertEquals("random", windowingContext.getControlsMethod());
		assertEquals(7, windowingContext.getRandomSeed());
		assertEquals(1, windowingContext.getVerbosity());
		assertTrue(windowingContext.isDropnaTimestamps());
	}

	@Test
	public void testDefaults() {
		WindowingContext context = new WindowingProperties().toContext();
		assertEquals(GlobalBounds.of(date("1995-01-01"), date("2023-11-01")), context.getGlobalBounds());
		assertTrue(context.isLookback());
		assertEquals(RelativeDuration.ONE_DAY, context.getSpan());
		assertEquals(RelativeDuration.ONE_DAY, context.getInterval());
		assertEquals(Optional.empty(), context.getAnchor());
		assertEquals(date("2023-11-01"), context.getEffectiveAnchor());
		assertEquals("full", context.getControlsMethod());
		assertEquals(42, context.getRandomSeed());
	}

	@Test
	public void testReversedGlobalBoundsAreSwapped() {
		WindowingProperties properties = globalBounds("2023", "11", "01", "1995", "01", "01");
		assertEquals(GlobalBounds.of(date("1995-01-01"), date("2023-11-01")), properties.getGlobalBounds());
		assertEquals(date("1995-01-01"), properties.toContext().getGlobalBounds().getEarliest());
	}

	@Test
	public void testInvalidOrPartialBoundsFail() {
		assertThrows(InvalidDateException.class, () -> globalBounds("2023", "02", "30", "2023", "11", "01").toContext());

		WindowingProperties partial = new WindowingProperties();
		partial.setGlobalStartYear("2020");
		InvalidDateException e = assertThrows(InvalidDateException.class, partial::toContext);
		assertEquals(InvalidDateException.Boundary.START, e.getBoundary());
	}

	@Test
	public void testAnchorComponents() {
		WindowingProperties properties = new WindowingProperties();
		properties.setAnchorYear("2010");
		properties.setAnchorMonth("6");
		properties.setAnchorDay("30");
		assertEquals(CalendarDate.parse("2010-06-30"), properties.toContext().getEffectiveAnchor());
	}

	private static WindowingProperties globalBounds(String sy, String sm, String sd, String ey, String em, String ed) {
		WindowingProperties properties = new WindowingProperties();
		properties.setGlobalStartYear(sy);
		properties.setGlobalStartMonth(sm);
		properties.setGlobalStartDay(sd);
		properties.setGlobalEndYear(ey);
		properties.setGlobalEndMonth(em);
		properties.setGlobalEndDay(ed);
		return properties;
	}
}
