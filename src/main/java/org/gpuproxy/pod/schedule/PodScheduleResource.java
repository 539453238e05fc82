/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.schedule;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.gpuproxy.pod.PodProperties;
import org.gpuproxy.pod.PodResource;
import org.gpuproxy.pod.ValidationJsonException;
import org.gpuproxy.pod.cron.CronWindow;
import org.gpuproxy.pod.cron.InvalidExpressionException;
import org.gpuproxy.pod.dao.PodExecutionRepository;
import org.gpuproxy.pod.dao.PodScheduleRepository;
import org.gpuproxy.pod.model.PodSchedule;
import org.gpuproxy.pod.model.PodSpec;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import jakarta.persistence.EntityNotFoundException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import lombok.extern.slf4j.Slf4j;

/**
 * The pod schedules of the current user.
 */
@Service
@Path(PodResource.SERVICE_URL + "/schedule")
@Produces(MediaType.APPLICATION_JSON)
@Slf4j
public class PodScheduleResource {

	/**
	 * Error key of an unknown time zone.
	 */
	public static final String ERROR_TIMEZONE = "pod-timezone";

	/**
	 * Error key of a rejected creation option.
	 */
	public static final String ERROR_OPTION = "pod-option";

	@Autowired
	private PodScheduleRepository repository;

	@Autowired
	private PodExecutionRepository executionRepository;

	@Autowired
	protected PodProperties properties;

	@Autowired
	protected Clock clock;

	/**
	 * Return all schedules of the given user, with their next fire times.
	 *
	 * @param user The requesting user.
	 * @return All schedules of the given user, ordered by name.
	 */
	@GET
	@Transactional(readOnly = true)
	public List<PodScheduleVo> findAll(@HeaderParam(PodResource.USER_HEADER) final String user) {
		final var now = Instant.now(clock);
		return repository.findAllByOwner(user).stream().map(s -> toVo(s, now)).collect(Collectors.toList());
	}

	/**
	 * Return a schedule of the given user.
	 *
	 * @param id   The schedule identifier.
	 * @param user The requesting user.
	 * @return The schedule.
	 */
	@GET
	@Path("{id:\\d+}")
	@Transactional(readOnly = true)
	public PodScheduleVo findById(@PathParam("id") final int id,
			@HeaderParam(PodResource.USER_HEADER) final String user) {
		return toVo(findOneVisible(id, user), Instant.now(clock));
	}

	/**
	 * Return the schedule by its identifier, and check it is owned by the given user.
	 *
	 * @param id   The schedule identifier.
	 * @param user The requesting user.
	 * @return The schedule. Never <code>null</code>.
	 * @throws EntityNotFoundException When not found or owned by another user.
	 */
	public PodSchedule findOneVisible(final int id, final String user) {
		return repository.findById(id).filter(s -> Objects.equals(s.getOwner(), user))
				.orElseThrow(() -> new EntityNotFoundException(String.valueOf(id)));
	}

	private PodScheduleVo toVo(final PodSchedule schedule, final Instant now) {
		final var vo = new PodScheduleVo();
		vo.setId(schedule.getId());
		vo.setName(schedule.getName());
		vo.setSpec(schedule.getSpec());
		vo.setStartCron(schedule.getStartCron());
		vo.setStopCron(schedule.getStopCron());
		vo.setTimezone(schedule.getTimezone());
		vo.setActive(schedule.isActive());
		vo.setLastInstance(schedule.getLastInstance());
		vo.setLastRunTime(schedule.getLastRunTime());
		try {
			final var zoned = now.atZone(ZoneId.of(schedule.getTimezone()));
			vo.setNextStart(CronWindow.nextFire(schedule.getStartCron(), zoned).map(d -> d.toInstant()).orElse(null));
			vo.setNextStop(CronWindow.nextFire(schedule.getStopCron(), zoned).map(d -> d.toInstant()).orElse(null));
		} catch (final InvalidExpressionException | DateTimeException e) {
			// Non blocking error
			log.error("Invalid schedule {}: {}", schedule.getId(), e.getMessage());
		}
		return vo;
	}

	/**
	 * Create a new schedule owned by the given user.
	 *
	 * @param schedule The schedule to create.
	 * @param user     The requesting user.
	 * @return The created schedule identifier.
	 */
	@POST
	@Consumes(MediaType.APPLICATION_JSON)
	@Transactional
	public int create(final PodScheduleVo schedule, @HeaderParam(PodResource.USER_HEADER) final String user) {
		return checkAndSave(schedule, newSchedule(user)).getId();
	}

	/**
	 * Create a new schedule owning an existing pod. This pod is considered as started now.
	 *
	 * @param schedule The schedule to create.
	 * @param user     The requesting user.
	 * @param instance The pod handle created for this schedule.
	 * @return The created schedule.
	 */
	@Transactional
	public PodSchedule create(final PodScheduleVo schedule, final String user, final String instance) {
		final var entity = newSchedule(user);
		entity.setLastInstance(instance);
		entity.setLastRunTime(Instant.now(clock));
		return checkAndSave(schedule, entity);
	}

	private PodSchedule newSchedule(final String user) {
		final var entity = new PodSchedule();
		entity.setOwner(user);
		entity.setCreatedDate(Instant.now(clock));
		return entity;
	}

	/**
	 * Update an existing schedule. The tracked pod is unchanged.
	 *
	 * @param schedule The schedule to update.
	 * @param user     The requesting user.
	 */
	@PUT
	@Consumes(MediaType.APPLICATION_JSON)
	@Transactional
	public void update(final PodScheduleVo schedule, @HeaderParam(PodResource.USER_HEADER) final String user) {
		if (schedule.getId() == null) {
			throw new ValidationJsonException("id", "NotNull");
		}
		checkAndSave(schedule, findOneVisible(schedule.getId(), user));
	}

	/**
	 * Enable or disable a schedule.
	 *
	 * @param id     The schedule identifier.
	 * @param active The new state.
	 * @param user   The requesting user.
	 */
	@PUT
	@Path("{id:\\d+}/active/{active}")
	@Transactional
	public void setActive(@PathParam("id") final int id, @PathParam("active") final boolean active,
			@HeaderParam(PodResource.USER_HEADER) final String user) {
		final var entity = findOneVisible(id, user);
		entity.setActive(active);
		entity.setUpdatedDate(Instant.now(clock));
		repository.saveAndFlush(entity);
		log.info("Schedule {} is {}", id, active ? "enabled" : "disabled");
	}

	/**
	 * Delete a schedule and its execution history. The tracked pod is not released.
	 *
	 * @param id   The schedule identifier.
	 * @param user The requesting user.
	 */
	@DELETE
	@Path("{id:\\d+}")
	@Transactional
	public void delete(@PathParam("id") final int id, @HeaderParam(PodResource.USER_HEADER) final String user) {
		final var entity = findOneVisible(id, user);

		// Also remove execution history
		executionRepository.deleteAllBySchedule(id);
		repository.delete(entity);
		log.info("Schedule {} is deleted, instance {} is kept", id, entity.getLastInstance());
	}

	/**
	 * Check a schedule before saving it.
	 *
	 * @param schedule The schedule to check.
	 * @throws ValidationJsonException When a field is missing or not valid.
	 */
	public void check(final PodScheduleVo schedule) {
		if (StringUtils.isBlank(schedule.getName())) {
			throw new ValidationJsonException("name", "NotBlank");
		}
		checkSpec(schedule.getSpec());
		final var start = checkCron("startCron", schedule.getStartCron());
		final var stop = checkCron("stopCron", schedule.getStopCron());
		final ZoneId zone;
		try {
			zone = ZoneId.of(StringUtils.defaultIfBlank(schedule.getTimezone(), "UTC"));
		} catch (final DateTimeException e) {
			throw new ValidationJsonException("timezone", ERROR_TIMEZONE);
		}
		checkCadence(start, zone);
		checkCadence(stop, zone);
	}

	private PodSchedule checkAndSave(final PodScheduleVo schedule, final PodSchedule entity) {
		check(schedule);
		entity.setName(schedule.getName().trim());
		entity.setSpec(schedule.getSpec());
		entity.setStartCron(CronWindow.parse(schedule.getStartCron()).getExpression());
		entity.setStopCron(CronWindow.parse(schedule.getStopCron()).getExpression());
		entity.setTimezone(StringUtils.defaultIfBlank(schedule.getTimezone(), "UTC"));
		entity.setActive(schedule.isActive());
		entity.setUpdatedDate(Instant.now(clock));
		return repository.saveAndFlush(entity);
	}

	private CronWindow checkCron(final String field, final String expression) {
		try {
			return CronWindow.parse(expression);
		} catch (final InvalidExpressionException e) {
			throw new ValidationJsonException(field, e.getError());
		}
	}

	/**
	 * A tolerance covering the whole cadence opens a new window before the previous one ends.
	 */
	private void checkCadence(final CronWindow window, final ZoneId zone) {
		final var tolerance = properties.getSchedule().getTolerance();
		window.minimumInterval(Instant.now(clock).atZone(zone), 5).filter(i -> i.compareTo(tolerance) <= 0)
				.ifPresent(i -> log.warn("CRON expression '{}' fires every {}, within the tolerance {}", window, i,
						tolerance));
	}

	/**
	 * Check the pod requirements.
	 *
	 * @param spec The requirements to check.
	 * @throws ValidationJsonException When a requirement is missing or not valid.
	 */
	public void checkSpec(final PodSpec spec) {
		if (spec == null || StringUtils.isBlank(spec.getImage())) {
			throw new ValidationJsonException("image", "NotBlank");
		}
		if (spec.getNumGpus() < 1) {
			throw new ValidationJsonException("numGpus", "Min");
		}
		if (spec.getDiskSize() < 1) {
			throw new ValidationJsonException("diskSize", "Min");
		}
		if (spec.getEnv() == null) {
			spec.setEnv(new HashMap<>());
		}
		if (spec.getOptions() == null) {
			spec.setOptions(new HashMap<>());
		}
		spec.getOptions().keySet().stream()
				.filter(k -> !PodSpec.OPTION_NAME.matcher(k).matches() || PodSpec.RESERVED_OPTIONS.contains(k))
				.findFirst().ifPresent(k -> {
					throw new ValidationJsonException("options", ERROR_OPTION);
				});
	}
}
