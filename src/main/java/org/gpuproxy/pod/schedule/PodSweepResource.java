/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.schedule;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import org.gpuproxy.pod.PodProperties;
import org.gpuproxy.pod.PodResource;
import org.gpuproxy.pod.cron.CronWindow;
import org.gpuproxy.pod.cron.InvalidExpressionException;
import org.gpuproxy.pod.dao.PodScheduleRepository;
import org.gpuproxy.pod.execution.NoMatchingOfferException;
import org.gpuproxy.pod.execution.PodExecutionResource;
import org.gpuproxy.pod.model.PodSchedule;
import org.gpuproxy.pod.model.PodStatus;
import org.gpuproxy.pod.provider.PodStatusProbe;
import org.gpuproxy.pod.provider.PodStatusSnapshot;
import org.gpuproxy.pod.provider.ProviderException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import jakarta.persistence.PersistenceException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import lombok.extern.slf4j.Slf4j;

/**
 * Reconciliation of the active schedules against the live pod status. A sweep starts the pods whose start window is
 * open, and stops the running pods whose stop window is open. Each schedule is isolated: a failure is logged and the
 * schedule is retried at the next sweep.
 */
@Slf4j
@Service
@Path(PodResource.SERVICE_URL + "/sweep")
@Produces(MediaType.APPLICATION_JSON)
public class PodSweepResource {

	/**
	 * Trigger mode of the executions made by a sweep.
	 */
	public static final String TRIGGER = "sweep";

	@Autowired
	protected PodScheduleRepository repository;

	@Autowired
	protected PodStatusProbe probe;

	@Autowired
	protected PodExecutionResource executor;

	@Autowired
	protected PodProperties properties;

	@Autowired
	protected Clock clock;

	private final AtomicBoolean running = new AtomicBoolean();

	/**
	 * Invalid schedule settings already reported, "id:field:value".
	 */
	private final Set<String> reported = ConcurrentHashMap.newKeySet();

	/**
	 * Reconcile all active schedules. Never fails, and skipped when a sweep is already running.
	 *
	 * @return The started and stopped schedules.
	 */
	@POST
	public ReconciliationOutcome sweep() {
		final var outcome = new ReconciliationOutcome();
		if (!running.compareAndSet(false, true)) {
			log.warn("A sweep is already running, this one is skipped");
			return outcome;
		}
		try {
			sweep(outcome);
		} finally {
			running.set(false);
		}
		return outcome;
	}

	private void sweep(final ReconciliationOutcome outcome) {
		final List<PodSchedule> schedules;
		try {
			schedules = repository.findAllActive();
		} catch (final RuntimeException e) {
			log.error("Unable to load the active schedules", e);
			return;
		}
		if (schedules.isEmpty()) {
			log.debug("No active schedule");
			return;
		}

		// A single provider listing for all schedules
		final var snapshot = probe.snapshot();
		if (!snapshot.isAvailable()) {
			log.warn("Pod status is unavailable, tracked pods of {} schedules are left unchanged", schedules.size());
		}
		final var now = Instant.now(clock);
		for (final var schedule : schedules) {
			try {
				reconcile(schedule, snapshot, now, outcome);
			} catch (final RuntimeException e) {
				log.error("Reconciliation of schedule {} failed", schedule.getId(), e);
			}
		}
		log.info("Sweep of {} schedules, started {}, stopped {}", schedules.size(), outcome.getStarted(),
				outcome.getStopped());
	}

	private void reconcile(final PodSchedule schedule, final PodStatusSnapshot snapshot, final Instant instant,
			final ReconciliationOutcome outcome) {
		final ZonedDateTime now;
		try {
			now = instant.atZone(ZoneId.of(schedule.getTimezone()));
		} catch (final DateTimeException e) {
			reportInvalid(schedule, "timezone", schedule.getTimezone(), e.getMessage());
			return;
		}
		final var start = parse(schedule, "startCron", schedule.getStartCron());
		final var stop = parse(schedule, "stopCron", schedule.getStopCron());
		if (start == null || stop == null) {
			return;
		}

		// Both decisions rely on the status before this sweep
		final var instance = schedule.getLastInstance();
		final var status = snapshot.statusOf(instance);
		final var tolerance = properties.getSchedule().getTolerance();
		if (start.isDue(now, tolerance) && status != PodStatus.RUNNING && status != PodStatus.UNKNOWN
				&& isDebounced(schedule, instant)) {
			start(schedule, instant, outcome);
		}
		if (instance != null && status == PodStatus.RUNNING && stop.isDue(now, tolerance)) {
			stop(schedule, instance, instant, outcome);
		}
	}

	private boolean isDebounced(final PodSchedule schedule, final Instant now) {
		final var last = schedule.getLastRunTime();
		if (last == null
				|| Duration.between(last, now).compareTo(properties.getSchedule().getDebounce()) >= 0) {
			return true;
		}
		log.debug("Schedule {} started at {}, start is debounced", schedule.getId(), last);
		return false;
	}

	private void start(final PodSchedule schedule, final Instant now, final ReconciliationOutcome outcome) {
		try {
			final var instance = executor.start(schedule, TRIGGER);
			if (repository.markStarted(schedule.getId(), instance, now) == 0) {
				throw new PersistenceException(
						"Schedule " + schedule.getId() + " no longer exists, instance " + instance + " is not tracked");
			}
			schedule.setLastInstance(instance);
			schedule.setLastRunTime(now);
			schedule.setUpdatedDate(now);
			outcome.getStarted().add(schedule.getId());
		} catch (final NoMatchingOfferException | ProviderException | PersistenceException e) {
			log.error("Start of schedule {} failed, retried at next sweep: {}", schedule.getId(), e.getMessage());
		}
	}

	private void stop(final PodSchedule schedule, final String instance, final Instant now,
			final ReconciliationOutcome outcome) {
		try {
			executor.stop(instance, schedule, TRIGGER);
			if (repository.markStopped(schedule.getId(), now) == 0) {
				throw new PersistenceException("Schedule " + schedule.getId() + " no longer exists");
			}
			schedule.setUpdatedDate(now);
			outcome.getStopped().add(schedule.getId());
		} catch (final ProviderException | PersistenceException e) {
			log.error("Stop of schedule {} failed, retried at next sweep: {}", schedule.getId(), e.getMessage());
		}
	}

	private CronWindow parse(final PodSchedule schedule, final String field, final String expression) {
		try {
			return CronWindow.parse(expression);
		} catch (final InvalidExpressionException e) {
			reportInvalid(schedule, field, expression, e.getMessage());
			return null;
		}
	}

	/**
	 * Log an invalid setting once per schedule and value.
	 */
	private void reportInvalid(final PodSchedule schedule, final String field, final String value,
			final String message) {
		if (reported.add(schedule.getId() + ":" + field + ":" + value)) {
			log.warn("Schedule {} is skipped, invalid {} '{}': {}", schedule.getId(), field, value, message);
		} else {
			log.debug("Schedule {} is skipped, invalid {}", schedule.getId(), field);
		}
	}
}
