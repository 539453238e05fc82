/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod;

import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.gpuproxy.pod.execution.NoMatchingOfferException;
import org.gpuproxy.pod.execution.PodExecutionResource;
import org.gpuproxy.pod.model.PodSpec;
import org.gpuproxy.pod.model.PodStatus;
import org.gpuproxy.pod.provider.GpuProvider;
import org.gpuproxy.pod.provider.Offer;
import org.gpuproxy.pod.provider.ProviderException;
import org.gpuproxy.pod.schedule.PodScheduleResource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import lombok.extern.slf4j.Slf4j;

/**
 * The pods of the provider account.
 */
@Slf4j
@Service
@Path(PodResource.SERVICE_URL)
@Produces(MediaType.APPLICATION_JSON)
public class PodResource {

	/**
	 * Base URL of the pod services.
	 */
	public static final String SERVICE_URL = "/pod";

	/**
	 * Header holding the requesting user.
	 */
	public static final String USER_HEADER = "X-User";

	/**
	 * Trigger mode of the executions requested without user.
	 */
	public static final String TRIGGER = "api";

	@Autowired
	protected GpuProvider provider;

	@Autowired
	protected PodExecutionResource executor;

	@Autowired
	protected PodScheduleResource scheduleResource;

	/**
	 * Return the status of all pods of the provider account.
	 *
	 * @return The status by handle.
	 * @throws ProviderException When the listing failed.
	 */
	@GET
	@Path("instance")
	public Map<String, PodStatus> findAll() throws ProviderException {
		return provider.listStatus();
	}

	/**
	 * Create a pod now. With a schedule, this schedule tracks the new pod and will stop it.
	 *
	 * @param creation The pod to create.
	 * @param user     The requesting user.
	 * @return The creation completed with the new pod handle and the optional schedule identifier.
	 * @throws NoMatchingOfferException When no offer matches the requirements.
	 * @throws ProviderException        When the provisioning failed.
	 */
	@POST
	@Path("instance")
	@Consumes(MediaType.APPLICATION_JSON)
	public PodCreationVo create(final PodCreationVo creation, @HeaderParam(USER_HEADER) final String user)
			throws NoMatchingOfferException, ProviderException {
		final var label = StringUtils.defaultIfBlank(creation.getLabel(), "pod");
		final var schedule = creation.getSchedule();
		scheduleResource.checkSpec(creation.getSpec());
		if (schedule != null) {
			// Validate the schedule before any provisioning
			schedule.setName(StringUtils.defaultIfBlank(schedule.getName(), label));
			schedule.setSpec(creation.getSpec());
			scheduleResource.check(schedule);
		}

		final var instance = executor.start(label, creation.getSpec(), null, toTrigger(user));
		creation.setInstance(instance);
		if (schedule != null) {
			final var entity = scheduleResource.create(schedule, user, instance);
			executor.attach(instance, entity);
			creation.setScheduleId(entity.getId());
			log.info("Instance {} is tracked by the new schedule {}", instance, entity.getId());
		}
		return creation;
	}

	/**
	 * Stop a pod now. A pod unknown by the provider is considered as stopped.
	 *
	 * @param instance The pod handle.
	 * @param user     The requesting user.
	 * @throws ProviderException When the release failed.
	 */
	@POST
	@Path("instance/{instance}/stop")
	public void stop(@PathParam("instance") final String instance, @HeaderParam(USER_HEADER) final String user)
			throws ProviderException {
		executor.stop(instance, null, toTrigger(user));
	}

	/**
	 * Return the offers matching the given requirements, the best one first. Nothing is provisioned.
	 *
	 * @param spec The pod requirements.
	 * @return The matching offers.
	 * @throws ProviderException When the search failed.
	 */
	@POST
	@Path("offer")
	@Consumes(MediaType.APPLICATION_JSON)
	public List<Offer> findOffers(final PodSpec spec) throws ProviderException {
		scheduleResource.checkSpec(spec);
		return provider.search(spec);
	}

	private String toTrigger(final String user) {
		return StringUtils.defaultIfBlank(user, TRIGGER);
	}
}
