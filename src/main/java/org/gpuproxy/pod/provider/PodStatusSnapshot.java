/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.provider;

import java.util.Map;

import org.gpuproxy.pod.model.PodStatus;

/**
 * Status of all pods at a given time, taken once per reconciliation. A failed listing answers
 * {@link PodStatus#UNKNOWN} for any pod.
 */
public class PodStatusSnapshot {

	/**
	 * Status by handle, <code>null</code> when the listing failed.
	 */
	private final Map<String, PodStatus> statuses;

	/**
	 * Constructor.
	 *
	 * @param statuses The status by handle. <code>null</code> when the listing failed.
	 */
	public PodStatusSnapshot(final Map<String, PodStatus> statuses) {
		this.statuses = statuses == null ? null : Map.copyOf(statuses);
	}

	/**
	 * Return a snapshot of a failed listing.
	 *
	 * @return A snapshot answering {@link PodStatus#UNKNOWN} for any pod.
	 */
	public static PodStatusSnapshot unavailable() {
		return new PodStatusSnapshot(null);
	}

	/**
	 * Indicate the listing succeeded.
	 *
	 * @return <code>true</code> when the listing succeeded.
	 */
	public boolean isAvailable() {
		return statuses != null;
	}

	/**
	 * Return the status of the given pod.
	 *
	 * @param instance The pod handle. May be <code>null</code>.
	 * @return The pod status. {@link PodStatus#ABSENT} for a <code>null</code> handle or a pod not listed.
	 */
	public PodStatus statusOf(final String instance) {
		if (instance == null) {
			return PodStatus.ABSENT;
		}
		if (statuses == null) {
			return PodStatus.UNKNOWN;
		}
		return statuses.getOrDefault(instance, PodStatus.ABSENT);
	}
}
