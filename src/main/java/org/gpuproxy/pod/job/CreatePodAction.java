/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.job;

import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.gpuproxy.pod.ValidationJsonException;
import org.gpuproxy.pod.dao.PodScheduleRepository;
import org.gpuproxy.pod.execution.NoMatchingOfferException;
import org.gpuproxy.pod.execution.PodExecutionResource;
import org.gpuproxy.pod.model.PodSpec;
import org.gpuproxy.pod.provider.ProviderException;
import org.gpuproxy.pod.schedule.PodScheduleResource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;

/**
 * Provision a pod, either from the requirements of a schedule ("schedule" argument), either from the inline
 * arguments "image", "gpuType", "numGpus", "diskSize", "maxPricePerHour". The new pod is not tracked by any schedule.
 */
@Slf4j
@Component
public class CreatePodAction implements PodAction {

	/**
	 * Default label of the created pods.
	 */
	public static final String DEFAULT_LABEL = "pod-job";

	@Autowired
	private PodScheduleRepository repository;

	@Autowired
	private PodScheduleResource scheduleResource;

	@Autowired
	private PodExecutionResource executor;

	@Override
	public String getName() {
		return "create";
	}

	@Override
	public void validate(final Map<String, String> args) {
		if (args.containsKey("schedule")) {
			final var schedule = toInt(args, "schedule", 0);
			if (!repository.existsById(schedule)) {
				throw new ValidationJsonException("schedule", "pod-schedule");
			}
		} else {
			scheduleResource.checkSpec(toSpec(args));
		}
	}

	@Override
	public void execute(final Map<String, String> args, final String trigger)
			throws NoMatchingOfferException, ProviderException {
		final String instance;
		if (args.containsKey("schedule")) {
			// The schedule lends its requirements, it does not track the new pod
			final var id = toInt(args, "schedule", 0);
			final var schedule = repository.findById(id)
					.orElseThrow(() -> new EntityNotFoundException(String.valueOf(id)));
			instance = executor.start(StringUtils.defaultIfBlank(args.get("label"), schedule.getName()),
					schedule.getSpec(), null, trigger);
		} else {
			instance = executor.start(StringUtils.defaultIfBlank(args.get("label"), DEFAULT_LABEL), toSpec(args), null,
					trigger);
		}
		log.info("Instance {} created by {}", instance, trigger);
	}

	private PodSpec toSpec(final Map<String, String> args) {
		final var spec = new PodSpec();
		spec.setImage(args.get("image"));
		spec.setGpuType(StringUtils.trimToNull(args.get("gpuType")));
		spec.setNumGpus(toInt(args, "numGpus", spec.getNumGpus()));
		spec.setDiskSize(toInt(args, "diskSize", spec.getDiskSize()));
		if (StringUtils.isNotBlank(args.get("maxPricePerHour"))) {
			try {
				spec.setMaxPricePerHour(Double.valueOf(args.get("maxPricePerHour").trim()));
			} catch (final NumberFormatException e) {
				throw new ValidationJsonException("maxPricePerHour", "pod-number");
			}
		}
		return spec;
	}

	private int toInt(final Map<String, String> args, final String name, final int defaultValue) {
		final var value = args.get(name);
		if (StringUtils.isBlank(value)) {
			return defaultValue;
		}
		try {
			return Integer.parseInt(value.trim());
		} catch (final NumberFormatException e) {
			throw new ValidationJsonException(name, "pod-number");
		}
	}
}
