/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.execution;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TimeZone;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.time.FastDateFormat;
import org.gpuproxy.pod.PodResource;
import org.gpuproxy.pod.dao.PodExecutionRepository;
import org.gpuproxy.pod.dao.PodScheduleRepository;
import org.gpuproxy.pod.model.PodExecution;
import org.gpuproxy.pod.model.PodOperation;
import org.gpuproxy.pod.model.PodSchedule;
import org.gpuproxy.pod.model.PodSpec;
import org.gpuproxy.pod.provider.GpuProvider;
import org.gpuproxy.pod.provider.InstanceNotFoundException;
import org.gpuproxy.pod.provider.ProviderException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import jakarta.persistence.EntityNotFoundException;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.StreamingOutput;
import lombok.extern.slf4j.Slf4j;

/**
 * Pod start and stop against the provider, with execution history.
 */
@Slf4j
@Service
@Path(PodResource.SERVICE_URL + "/schedule/{schedule:\\d+}/execution")
@Produces(MediaType.APPLICATION_JSON)
public class PodExecutionResource {

	/**
	 * Status text of a release of an unknown pod.
	 */
	public static final String NOT_FOUND = "not-found";

	@Autowired
	protected GpuProvider provider;

	@Autowired
	protected PodExecutionRepository repository;

	@Autowired
	protected PodScheduleRepository scheduleRepository;

	@Autowired
	protected Clock clock;

	/**
	 * Provision a pod from the requirements of a schedule.
	 *
	 * @param schedule The schedule holding the requirements. Its name is the label of the new pod.
	 * @param trigger  The trigger mode.
	 * @return The handle of the new pod.
	 * @throws NoMatchingOfferException When no offer matches the requirements.
	 * @throws ProviderException        When the search or the provisioning failed.
	 */
	public String start(final PodSchedule schedule, final String trigger)
			throws NoMatchingOfferException, ProviderException {
		return start(schedule.getName(), schedule.getSpec(), schedule, trigger);
	}

	/**
	 * Provision a pod from the best offer matching the given requirements.
	 *
	 * @param label    The label of the new pod.
	 * @param spec     The pod requirements.
	 * @param schedule The related schedule. May be <code>null</code>.
	 * @param trigger  The trigger mode.
	 * @return The handle of the new pod.
	 * @throws NoMatchingOfferException When no offer matches the requirements.
	 * @throws ProviderException        When the search or the provisioning failed.
	 */
	public String start(final String label, final PodSpec spec, final PodSchedule schedule, final String trigger)
			throws NoMatchingOfferException, ProviderException {
		log.info("Start of {} ({}xGPU {}) is requested by {}", label, spec.getNumGpus(), spec.getImage(), trigger);
		final var execution = newExecution(PodOperation.START, schedule, trigger);
		try {
			final var offers = provider.search(spec);
			if (offers.isEmpty()) {
				throw new NoMatchingOfferException(spec);
			}

			// Offers are ordered by the provider, the first one is the best one
			final var offer = offers.get(0);
			execution.setStatusText(offer.toString());
			final var instance = provider.provision(offer.getId(), label, spec);
			execution.setInstance(instance);
			execution.setSucceed(true);
			log.info("Start of {} : succeed, instance {} on offer {}", label, instance, offer);
			return instance;
		} catch (final NoMatchingOfferException | ProviderException | RuntimeException e) {
			execution.setError(StringUtils.abbreviate(e.getMessage(), 1024));
			log.error("Start of {} : failed, {}", label, e.getMessage());
			throw e;
		} finally {
			save(execution);
		}
	}

	/**
	 * Release a pod. A pod unknown by the provider is considered as released.
	 *
	 * @param instance The pod handle.
	 * @param schedule The related schedule. May be <code>null</code>.
	 * @param trigger  The trigger mode.
	 * @throws ProviderException When the release failed.
	 */
	public void stop(final String instance, final PodSchedule schedule, final String trigger)
			throws ProviderException {
		log.info("Stop of instance {} is requested by {}", instance, trigger);
		final var execution = newExecution(PodOperation.STOP, schedule, trigger);
		execution.setInstance(instance);
		try {
			provider.release(instance);
			execution.setSucceed(true);
			log.info("Stop of instance {} : succeed", instance);
		} catch (final InstanceNotFoundException e) {
			// Already gone, nothing to release
			execution.setSucceed(true);
			execution.setStatusText(NOT_FOUND);
			log.info("Stop of instance {} : not found, already released", instance);
		} catch (final ProviderException | RuntimeException e) {
			execution.setError(StringUtils.abbreviate(e.getMessage(), 1024));
			log.error("Stop of instance {} : failed, {}", instance, e.getMessage());
			throw e;
		} finally {
			save(execution);
		}
	}

	/**
	 * Attach the start of a pod made without schedule to the schedule created afterwards for this pod.
	 *
	 * @param instance The pod handle.
	 * @param schedule The schedule now tracking this pod.
	 */
	public void attach(final String instance, final PodSchedule schedule) {
		final var count = repository.attach(schedule, instance, PodOperation.START);
		log.info("Start of instance {} : {} execution(s) attached to schedule {}", instance, count, schedule.getId());
	}

	private PodExecution newExecution(final PodOperation operation, final PodSchedule schedule,
			final String trigger) {
		final var execution = new PodExecution();
		execution.setOperation(operation);
		execution.setSchedule(schedule);
		execution.setTrigger(trigger);
		execution.setDate(Instant.now(clock));
		return execution;
	}

	/**
	 * Persist the execution. A failure is only logged, the outcome of the operation is unchanged.
	 */
	private void save(final PodExecution execution) {
		try {
			repository.saveAndFlush(execution);
		} catch (final RuntimeException e) {
			log.error("Unable to record the {} execution of instance {}", execution.getOperation(),
					execution.getInstance(), e);
		}
	}

	/**
	 * Return the execution history of a schedule, the newest first.
	 *
	 * @param schedule The schedule identifier.
	 * @param user     The requesting user.
	 * @return The executions of this schedule.
	 */
	@GET
	@Transactional(readOnly = true)
	public List<PodExecution> findAll(@PathParam("schedule") final int schedule,
			@HeaderParam(PodResource.USER_HEADER) final String user) {
		checkVisible(schedule, user);
		return repository.findAllBySchedule(schedule);
	}

	private PodSchedule checkVisible(final int schedule, final String user) {
		return scheduleRepository.findById(schedule).filter(s -> Objects.equals(s.getOwner(), user))
				.orElseThrow(() -> new EntityNotFoundException(String.valueOf(schedule)));
	}

	/**
	 * Return the execution report of a schedule.
	 *
	 * @param schedule The schedule identifier.
	 * @param file     The requested file name.
	 * @param user     The requesting user.
	 * @return The download stream.
	 */
	@GET
	@Produces(MediaType.APPLICATION_OCTET_STREAM)
	@Path("{file:executions-.*.csv}")
	@Transactional(readOnly = true)
	public Response downloadHistoryReport(@PathParam("schedule") final int schedule,
			@PathParam("file") final String file, @HeaderParam(PodResource.USER_HEADER) final String user) {
		final var entity = checkVisible(schedule, user);
		final var executions = repository.findAllBySchedule(schedule);
		return Response.ok((StreamingOutput) o -> writeHistory(o, entity, executions))
				.header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + file + "\"").build();
	}

	/**
	 * Write all executions of the given schedule.
	 */
	void writeHistory(final OutputStream output, final PodSchedule schedule,
			final Collection<PodExecution> executions) throws IOException {
		final Writer writer = new BufferedWriter(new OutputStreamWriter(output, StandardCharsets.UTF_8));
		final var df = FastDateFormat.getInstance("yyyy/MM/dd HH:mm:ss", TimeZone.getTimeZone("UTC"));
		writer.write("schedule;name;dateHMS;timestamp;operation;instance;trigger;succeed;statusText;errorText");
		for (final var execution : executions) {
			writer.write('\n');
			writer.write(String.valueOf(schedule.getId()));
			writer.write(';');
			writer.write(schedule.getName().replace(';', ','));
			writer.write(';');
			writer.write(df.format(execution.getDate().toEpochMilli()));
			writer.write(';');
			writer.write(String.valueOf(execution.getDate().toEpochMilli()));
			writer.write(';');
			writer.write(execution.getOperation().name());
			writer.write(';');
			writer.write(StringUtils.defaultString(execution.getInstance()));
			writer.write(';');
			writer.write(execution.getTrigger());
			writer.write(';');
			writer.write(String.valueOf(execution.isSucceed()));
			writer.write(';');
			writer.write(StringUtils.defaultString(execution.getStatusText()));
			writer.write(';');
			writer.write(StringUtils.defaultString(execution.getError()).replace('\n', ' '));
		}

		// Ensure buffer is flushed
		writer.flush();
	}
}
