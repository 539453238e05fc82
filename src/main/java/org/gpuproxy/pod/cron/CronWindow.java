/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.cron;

import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.quartz.CronExpression;

import com.cronutils.mapper.CronMapper;
import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import lombok.Getter;

/**
 * Fire window of a CRON expression: an expression is due from each of its fire times and during the given tolerance.
 * The expression may be either in 5 parts (UNIX, minute precision), either in 6 or 7 parts (Quartz, seconds first
 * and optional year). A UNIX expression may set both the day of month and the day of week, it is then accepted for
 * the fire window but has no Quartz form. Instances are immutable and thread safe.
 */
public final class CronWindow {

	/**
	 * Error key of an expression that cannot be parsed.
	 */
	public static final String ERROR_SYNTAX = "pod-cron";

	/**
	 * Error key of an expression firing every second.
	 */
	public static final String ERROR_SECOND = "pod-cron-second";

	/**
	 * Default fire window length.
	 */
	public static final Duration DEFAULT_TOLERANCE = Duration.ofMinutes(2);

	private static final CronParser UNIX_PARSER = new CronParser(
			CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

	private static final CronParser QUARTZ_PARSER = new CronParser(
			CronDefinitionBuilder.instanceDefinitionFor(CronType.QUARTZ));

	/**
	 * The original expression.
	 */
	@Getter
	private final String expression;

	private final Cron cron;

	/**
	 * UNIX form, 5 parts.
	 */
	private final boolean unix;

	private final ExecutionTime executionTime;

	private CronWindow(final String expression, final Cron cron, final boolean unix) {
		this.expression = expression;
		this.cron = cron;
		this.unix = unix;
		this.executionTime = ExecutionTime.forCron(cron);
	}

	/**
	 * Parse the given expression.
	 *
	 * @param expression The CRON expression.
	 * @return The parsed window.
	 * @throws InvalidExpressionException When the expression cannot be parsed or fires every second.
	 */
	public static CronWindow parse(final String expression) {
		if (StringUtils.isBlank(expression)) {
			throw new InvalidExpressionException(expression, ERROR_SYNTAX, null);
		}
		final var normalized = StringUtils.normalizeSpace(expression);
		final var parts = normalized.split(" ").length;
		if (parts != 5 && parts != 6 && parts != 7) {
			throw new InvalidExpressionException(normalized, ERROR_SYNTAX, null);
		}
		final CronWindow window;
		try {
			final var unix = parts == 5;
			window = new CronWindow(normalized, (unix ? UNIX_PARSER : QUARTZ_PARSER).parse(normalized).validate(), unix);
		} catch (final IllegalArgumentException e) {
			throw new InvalidExpressionException(normalized, ERROR_SYNTAX, e);
		}
		if (!window.unix && window.isEverySecond()) {
			throw new InvalidExpressionException(normalized, ERROR_SECOND, null);
		}
		return window;
	}

	/**
	 * Indicate the seconds field matches every second: all seconds of a firing minute are fire times.
	 */
	private boolean isEverySecond() {
		final var first = executionTime.nextExecution(ZonedDateTime.of(2000, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC));
		if (first.isEmpty()) {
			return false;
		}
		var fire = first.get().truncatedTo(ChronoUnit.MINUTES).minusSeconds(1);
		for (var i = 0; i < 60; i++) {
			final var expected = fire.plusSeconds(1);
			final var next = executionTime.nextExecution(fire);
			if (next.isEmpty() || !next.get().equals(expected)) {
				return false;
			}
			fire = expected;
		}
		return true;
	}

	/**
	 * Return the equivalent Quartz expression, the form the Quartz triggers run.
	 *
	 * @return The Quartz expression.
	 * @throws InvalidExpressionException When Quartz cannot run this expression, such as a UNIX expression setting
	 *                                    both the day of month and the day of week.
	 */
	public String getQuartz() {
		final String quartz;
		try {
			quartz = unix ? CronMapper.fromUnixToQuartz().map(cron).asString() : expression;
		} catch (final IllegalArgumentException e) {
			throw new InvalidExpressionException(expression, ERROR_SYNTAX, e);
		}
		if (!CronExpression.isValidExpression(quartz)) {
			throw new InvalidExpressionException(expression, ERROR_SYNTAX, null);
		}
		return quartz;
	}

	/**
	 * Return the latest fire time at or before the given date.
	 *
	 * @param now The reference date. Its zone is the zone of the expression.
	 * @return The latest fire time, empty when the expression never fired before.
	 */
	public Optional<ZonedDateTime> previousFire(final ZonedDateTime now) {
		// Fire times are whole seconds, a fire time equal to "now" is included
		final var second = now.truncatedTo(ChronoUnit.SECONDS);
		return executionTime.lastExecution(second.plusSeconds(1)).filter(p -> !p.isAfter(now))
				.or(() -> executionTime.lastExecution(second));
	}

	/**
	 * Return the earliest fire time strictly after the given date.
	 *
	 * @param now The reference date. Its zone is the zone of the expression.
	 * @return The next fire time, empty when the expression never fires again.
	 */
	public Optional<ZonedDateTime> nextFire(final ZonedDateTime now) {
		return executionTime.nextExecution(now);
	}

	/**
	 * Indicate the given date is inside a fire window.
	 *
	 * @param now       The reference date. Its zone is the zone of the expression.
	 * @param tolerance The fire window length.
	 * @return <code>true</code> when <code>now - previousFire(now) &lt;= tolerance</code>.
	 */
	public boolean isDue(final ZonedDateTime now, final Duration tolerance) {
		return previousFire(now).map(p -> Duration.between(p, now).compareTo(tolerance) <= 0).orElse(false);
	}

	/**
	 * Return the shortest interval between consecutive fire times among the next ones. Used to detect a tolerance
	 * covering the whole cadence.
	 *
	 * @param from    The starting date.
	 * @param samples The amount of consecutive intervals to inspect.
	 * @return The shortest sampled interval, empty when the expression fires less than twice.
	 */
	public Optional<Duration> minimumInterval(final ZonedDateTime from, final int samples) {
		Duration result = null;
		var previous = nextFire(from);
		for (var i = 0; i < samples && previous.isPresent(); i++) {
			final var next = nextFire(previous.get());
			if (next.isPresent()) {
				final var interval = Duration.between(previous.get(), next.get());
				if (result == null || interval.compareTo(result) < 0) {
					result = interval;
				}
			}
			previous = next;
		}
		return Optional.ofNullable(result);
	}

	/**
	 * Indicate the given expression is due at the given date.
	 *
	 * @param expression The CRON expression.
	 * @param now        The reference date. Its zone is the zone of the expression.
	 * @param tolerance  The fire window length.
	 * @return <code>true</code> when the date is inside a fire window of the expression.
	 * @throws InvalidExpressionException When the expression is not valid.
	 */
	public static boolean isDue(final String expression, final ZonedDateTime now, final Duration tolerance) {
		return parse(expression).isDue(now, tolerance);
	}

	/**
	 * Return the latest fire time at or before the given date.
	 *
	 * @param expression The CRON expression.
	 * @param now        The reference date.
	 * @return The latest fire time, empty when the expression never fired before.
	 * @throws InvalidExpressionException When the expression is not valid.
	 */
	public static Optional<ZonedDateTime> previousFire(final String expression, final ZonedDateTime now) {
		return parse(expression).previousFire(now);
	}

	/**
	 * Return the earliest fire time strictly after the given date.
	 *
	 * @param expression The CRON expression.
	 * @param now        The reference date.
	 * @return The next fire time, empty when the expression never fires again.
	 * @throws InvalidExpressionException When the expression is not valid.
	 */
	public static Optional<ZonedDateTime> nextFire(final String expression, final ZonedDateTime now) {
		return parse(expression).nextFire(now);
	}

	/**
	 * Return the Quartz form of the given expression.
	 *
	 * @param expression The CRON expression, UNIX or Quartz.
	 * @return The equivalent Quartz expression.
	 * @throws InvalidExpressionException When the expression is not valid.
	 */
	public static String toQuartz(final String expression) {
		return parse(expression).getQuartz();
	}

	@Override
	public String toString() {
		return expression;
	}
}
