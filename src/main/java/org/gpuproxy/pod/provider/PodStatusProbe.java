/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.provider;

import org.gpuproxy.pod.model.PodStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import lombok.extern.slf4j.Slf4j;

/**
 * Read only view of the pod status from the provider listing. A provider failure is never an absence.
 */
@Slf4j
@Service
public class PodStatusProbe {

	@Autowired
	protected GpuProvider provider;

	/**
	 * Take a snapshot of all pods with a single provider call.
	 *
	 * @return The snapshot, answering {@link PodStatus#UNKNOWN} when the provider failed.
	 */
	public PodStatusSnapshot snapshot() {
		try {
			return new PodStatusSnapshot(provider.listStatus());
		} catch (final ProviderException | RuntimeException e) {
			log.warn("Unable to list the instances, status is unknown: {}", e.getMessage());
			return PodStatusSnapshot.unavailable();
		}
	}

	/**
	 * Return the current status of a pod.
	 *
	 * @param instance The pod handle. May be <code>null</code>.
	 * @return The pod status.
	 */
	public PodStatus statusOf(final String instance) {
		if (instance == null) {
			return PodStatus.ABSENT;
		}
		return snapshot().statusOf(instance);
	}
}
