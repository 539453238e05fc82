/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.cron;

import java.text.ParseException;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.TimeZone;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.quartz.CronExpression;

/**
 * Test class of {@link CronWindow}
 */
class CronWindowTest {

	private static final String WORKDAY_START = "0 9 * * 1-5";

	private static final Duration TOLERANCE = CronWindow.DEFAULT_TOLERANCE;

	/**
	 * Monday 2024-01-15 at the given UTC time.
	 */
	private ZonedDateTime monday(final int hour, final int minute, final int second) {
		return ZonedDateTime.of(2024, 1, 15, hour, minute, second, 0, ZoneOffset.UTC);
	}

	@Test
	void isDueInsideWindow() {
		Assertions.assertTrue(CronWindow.isDue(WORKDAY_START, monday(9, 0, 0), TOLERANCE));
		Assertions.assertTrue(CronWindow.isDue(WORKDAY_START, monday(9, 1, 0), TOLERANCE));

		// Upper bound is included
		Assertions.assertTrue(CronWindow.isDue(WORKDAY_START, monday(9, 2, 0), TOLERANCE));
	}

	@Test
	void isDueOutsideWindow() {
		Assertions.assertFalse(CronWindow.isDue(WORKDAY_START, monday(9, 2, 1), TOLERANCE));
		Assertions.assertFalse(CronWindow.isDue(WORKDAY_START, monday(8, 59, 59), TOLERANCE));
		Assertions.assertFalse(CronWindow.isDue(WORKDAY_START, monday(12, 0, 0), TOLERANCE));
	}

	@Test
	void isDueWeekEnd() {
		final var saturday = ZonedDateTime.of(2024, 1, 20, 9, 1, 0, 0, ZoneOffset.UTC);
		Assertions.assertFalse(CronWindow.isDue(WORKDAY_START, saturday, TOLERANCE));
	}

	@Test
	void isDueTimezone() {
		// 09:01 in Paris is 08:01 UTC in winter
		final var now = monday(8, 1, 0).withZoneSameInstant(ZoneId.of("Europe/Paris"));
		Assertions.assertTrue(CronWindow.isDue(WORKDAY_START, now, TOLERANCE));
		Assertions.assertFalse(CronWindow.isDue(WORKDAY_START, monday(8, 1, 0), TOLERANCE));
	}

	@Test
	void previousFireIncludesNow() {
		Assertions.assertEquals(monday(9, 0, 0), CronWindow.previousFire(WORKDAY_START, monday(9, 0, 0)).get());
		Assertions.assertEquals(monday(9, 0, 0), CronWindow.previousFire(WORKDAY_START, monday(16, 30, 0)).get());
	}

	@Test
	void previousFireBeforeFirstOfDay() {
		// Friday before
		Assertions.assertEquals(ZonedDateTime.of(2024, 1, 12, 9, 0, 0, 0, ZoneOffset.UTC),
				CronWindow.previousFire(WORKDAY_START, monday(8, 0, 0)).get());
	}

	@Test
	void nextFireIsStrictlyAfter() {
		Assertions.assertEquals(ZonedDateTime.of(2024, 1, 16, 9, 0, 0, 0, ZoneOffset.UTC),
				CronWindow.nextFire(WORKDAY_START, monday(9, 0, 0)).get());
		Assertions.assertEquals(monday(9, 0, 0), CronWindow.nextFire(WORKDAY_START, monday(8, 59, 59)).get());
	}

	@Test
	void quartzSyntax() {
		final var window = CronWindow.parse("0 0 9 ? * MON-FRI");
		Assertions.assertEquals("0 0 9 ? * MON-FRI", window.getQuartz());
		Assertions.assertTrue(window.isDue(monday(9, 1, 0), TOLERANCE));
		Assertions.assertFalse(window.isDue(monday(9, 3, 0), TOLERANCE));
		Assertions.assertEquals(monday(9, 0, 0), window.previousFire(monday(9, 0, 30)).get());
	}

	@Test
	void quartzSyntaxWithYear() {
		final var window = CronWindow.parse("0 0 9 ? * MON-FRI 2024");
		Assertions.assertTrue(window.isDue(monday(9, 1, 0), TOLERANCE));
	}

	@Test
	void toQuartz() throws ParseException {
		final var quartz = CronWindow.toQuartz("30 9 * * *");
		Assertions.assertTrue(CronExpression.isValidExpression(quartz));

		// Both forms agree on the next fire time
		final var expression = new CronExpression(quartz);
		expression.setTimeZone(TimeZone.getTimeZone("UTC"));
		Assertions.assertEquals(Date.from(monday(9, 30, 0).toInstant()),
				expression.getNextValidTimeAfter(Date.from(monday(9, 0, 0).toInstant())));
		Assertions.assertTrue(CronExpression.isValidExpression(CronWindow.toQuartz(WORKDAY_START)));
	}

	@Test
	void toQuartzKeepsQuartz() {
		Assertions.assertEquals("0 */5 * * * ?", CronWindow.toQuartz("0 */5 * * * ?"));
	}

	@Test
	void normalizedSpaces() {
		Assertions.assertEquals("0 9 * * 1-5", CronWindow.parse("  0  9 * *   1-5 ").getExpression());
	}

	@Test
	void invalidSyntax() {
		assertInvalid("not a cron", CronWindow.ERROR_SYNTAX);
		assertInvalid("61 * * * *", CronWindow.ERROR_SYNTAX);
		assertInvalid("0 9 * * 1-5 * * *", CronWindow.ERROR_SYNTAX);
		assertInvalid("0 0 25 ? * *", CronWindow.ERROR_SYNTAX);
		assertInvalid("", CronWindow.ERROR_SYNTAX);
		assertInvalid(null, CronWindow.ERROR_SYNTAX);
	}

	@Test
	void everySecond() {
		assertInvalid("* * * * * ?", CronWindow.ERROR_SECOND);
		assertInvalid("* 0 9 ? * MON-FRI", CronWindow.ERROR_SECOND);
		assertInvalid("*/1 * * * * ?", CronWindow.ERROR_SECOND);
		assertInvalid("0-59 * * * * ?", CronWindow.ERROR_SECOND);
		assertInvalid("*/1 0 0 * * ?", CronWindow.ERROR_SECOND);
	}

	@Test
	void notEverySecond() {
		Assertions.assertEquals("0-58 * * * * ?", CronWindow.parse("0-58 * * * * ?").getExpression());
		Assertions.assertEquals("*/2 * * * * ?", CronWindow.parse("*/2 * * * * ?").getExpression());
		Assertions.assertEquals("0 0 9 ? * * 1999", CronWindow.parse("0 0 9 ? * * 1999").getExpression());
	}

	@Test
	void dayOfMonthAndDayOfWeek() {
		// The 1st of the month, or any Monday; 2024-01-01 is both
		final var window = CronWindow.parse("0 9 1 * 1");
		Assertions.assertTrue(window.isDue(ZonedDateTime.of(2024, 1, 1, 9, 1, 0, 0, ZoneOffset.UTC), TOLERANCE));
		Assertions.assertFalse(window.isDue(ZonedDateTime.of(2024, 1, 1, 12, 0, 0, 0, ZoneOffset.UTC), TOLERANCE));

		// Quartz triggers cannot run it
		final var e = Assertions.assertThrows(InvalidExpressionException.class, () -> CronWindow.toQuartz("0 9 1 * 1"));
		Assertions.assertEquals(CronWindow.ERROR_SYNTAX, e.getError());
	}

	private void assertInvalid(final String expression, final String error) {
		final var e = Assertions.assertThrows(InvalidExpressionException.class, () -> CronWindow.parse(expression));
		Assertions.assertEquals(error, e.getError());
	}

	@Test
	void minimumInterval() {
		Assertions.assertEquals(Duration.ofMinutes(1),
				CronWindow.parse("* * * * *").minimumInterval(monday(9, 0, 0), 5).get());
		Assertions.assertEquals(Duration.ofMinutes(5),
				CronWindow.parse("*/5 * * * *").minimumInterval(monday(9, 0, 0), 5).get());
		Assertions.assertEquals(Duration.ofDays(1),
				CronWindow.parse(WORKDAY_START).minimumInterval(monday(9, 0, 0), 3).get());
	}

	@Test
	void everyMinuteDueWithinTolerance() {
		// A cadence shorter than the tolerance is always due
		Assertions.assertTrue(CronWindow.isDue("* * * * *", monday(9, 0, 59), TOLERANCE));
		Assertions.assertTrue(CronWindow.isDue("* * * * *", monday(13, 37, 12), TOLERANCE));
	}

	@Test
	void parseToString() {
		Assertions.assertEquals("0 17 * * 1-5", CronWindow.parse("0 17 * * 1-5").toString());
	}
}
