/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.job;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TimeZone;
import java.util.UUID;

import org.apache.commons.lang3.StringUtils;
import org.gpuproxy.pod.PodResource;
import org.gpuproxy.pod.ValidationJsonException;
import org.gpuproxy.pod.cron.CronWindow;
import org.gpuproxy.pod.cron.InvalidExpressionException;
import org.quartz.CronScheduleBuilder;
import org.quartz.CronTrigger;
import org.quartz.JobBuilder;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.ScheduleBuilder;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.SimpleScheduleBuilder;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.quartz.impl.matchers.GroupMatcher;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import lombok.extern.slf4j.Slf4j;

/**
 * In process deferred jobs: one shot or recurring, bound to a registered action. Jobs are not persisted.
 */
@Slf4j
@Service
@Path(PodResource.SERVICE_URL + "/job")
@Produces(MediaType.APPLICATION_JSON)
public class PodJobResource {

	/**
	 * Group of all deferred jobs.
	 */
	public static final String JOB_GROUP = "pod-job";

	@Autowired
	private Scheduler scheduler;

	@Autowired
	private List<PodAction> actions;

	/**
	 * Return the action of the given name.
	 *
	 * @param name The action name.
	 * @return The action.
	 * @throws ValidationJsonException When the action is unknown.
	 */
	public PodAction getAction(final String name) {
		return actions.stream().filter(a -> a.getName().equals(name)).findFirst()
				.orElseThrow(() -> new ValidationJsonException("action", "pod-action"));
	}

	/**
	 * Register a job from its description: a one shot job when the date is set, a recurring job otherwise.
	 *
	 * @param job The job to register.
	 * @return The job identifier.
	 * @throws SchedulerException When Quartz refused the job.
	 */
	@POST
	@Consumes(MediaType.APPLICATION_JSON)
	public String create(final PodJobVo job) throws SchedulerException {
		if (job.getAt() != null) {
			return scheduleOnce(job.getAction(), job.getArgs(), job.getAt());
		}
		if (StringUtils.isBlank(job.getCron())) {
			throw new ValidationJsonException("at", "NotNull");
		}
		return scheduleRecurring(job.getAction(), job.getArgs(), job.getCron());
	}

	/**
	 * Run an action once at the given date. A date in the past fires immediately.
	 *
	 * @param action The action name.
	 * @param args   The action arguments.
	 * @param at     The fire date.
	 * @return The job identifier.
	 * @throws SchedulerException When Quartz refused the job.
	 */
	public String scheduleOnce(final String action, final Map<String, String> args, final Instant at)
			throws SchedulerException {
		return schedule(action, args, SimpleScheduleBuilder.simpleSchedule().withMisfireHandlingInstructionFireNow(),
				Date.from(at));
	}

	/**
	 * Run an action at each fire time of the given CRON expression, UTC.
	 *
	 * @param action The action name.
	 * @param args   The action arguments.
	 * @param cron   The CRON expression, 5 parts (UNIX) or 6 to 7 parts (Quartz).
	 * @return The job identifier.
	 * @throws SchedulerException When Quartz refused the job.
	 */
	public String scheduleRecurring(final String action, final Map<String, String> args, final String cron)
			throws SchedulerException {
		final String quartz;
		try {
			quartz = CronWindow.toQuartz(cron);
		} catch (final InvalidExpressionException e) {
			throw new ValidationJsonException("cron", e.getError());
		}
		return schedule(action, args,
				CronScheduleBuilder.cronSchedule(quartz).inTimeZone(TimeZone.getTimeZone("UTC"))
						.withMisfireHandlingInstructionDoNothing(),
				null);
	}

	private String schedule(final String action, final Map<String, String> args,
			final ScheduleBuilder<? extends Trigger> schedule, final Date startAt) throws SchedulerException {
		final var resolved = getAction(action);
		final var safeArgs = args == null ? new HashMap<String, String>() : new HashMap<>(args);
		resolved.validate(safeArgs);

		final var id = action + "-" + UUID.randomUUID();
		final var data = new JobDataMap();
		data.put(PodActionJob.ACTION, action);
		data.put(PodActionJob.ARGS, safeArgs);
		final JobDetail detail = JobBuilder.newJob(PodActionJob.class).withIdentity(id, JOB_GROUP).usingJobData(data)
				.build();
		final var builder = TriggerBuilder.newTrigger().withIdentity(id, JOB_GROUP).withSchedule(schedule);
		if (startAt == null) {
			builder.startNow();
		} else {
			builder.startAt(startAt);
		}
		final var next = scheduler.scheduleJob(detail, builder.build());
		log.info("Job {} registered, next fire at {}", id, next);
		return id;
	}

	/**
	 * Cancel a job. A running firing completes.
	 *
	 * @param id The job identifier.
	 * @return <code>true</code> when the job was found and removed.
	 * @throws SchedulerException When Quartz failed.
	 */
	@DELETE
	@Path("{id}")
	public boolean cancel(@PathParam("id") final String id) throws SchedulerException {
		final var deleted = scheduler.deleteJob(new JobKey(id, JOB_GROUP));
		log.info("Job {} cancel, found: {}", id, deleted);
		return deleted;
	}

	/**
	 * Return all registered jobs.
	 *
	 * @return The jobs by identifier.
	 * @throws SchedulerException When Quartz failed.
	 */
	@SuppressWarnings("unchecked")
	public Map<String, PodJobVo> findAll() throws SchedulerException {
		final var result = new LinkedHashMap<String, PodJobVo>();
		for (final var key : scheduler.getJobKeys(GroupMatcher.jobGroupEquals(JOB_GROUP))) {
			final var detail = scheduler.getJobDetail(key);
			if (detail == null) {
				// Removed meanwhile
				continue;
			}
			final var vo = new PodJobVo();
			vo.setId(key.getName());
			vo.setAction(detail.getJobDataMap().getString(PodActionJob.ACTION));
			vo.setArgs((Map<String, String>) detail.getJobDataMap().get(PodActionJob.ARGS));
			for (final var trigger : scheduler.getTriggersOfJob(key)) {
				if (trigger.getNextFireTime() != null) {
					vo.setNextFireTime(trigger.getNextFireTime().toInstant());
				}
				if (trigger instanceof CronTrigger) {
					vo.setCron(((CronTrigger) trigger).getCronExpression());
					vo.setTrigger("cron:" + vo.getCron());
				} else {
					vo.setAt(trigger.getStartTime().toInstant());
					vo.setTrigger("once:" + vo.getAt());
				}
			}
			result.put(vo.getId(), vo);
		}
		return result;
	}

	/**
	 * Return all registered jobs.
	 *
	 * @return The jobs.
	 * @throws SchedulerException When Quartz failed.
	 */
	@GET
	public Collection<PodJobVo> findAllJobs() throws SchedulerException {
		return new ArrayList<>(findAll().values());
	}
}
