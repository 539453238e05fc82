/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.provider;

import java.util.List;
import java.util.Map;

import org.gpuproxy.pod.model.PodSpec;
import org.gpuproxy.pod.model.PodStatus;

/**
 * Features of a GPU rental provider. All calls are blocking, their time is bounded by the implementation.
 */
public interface GpuProvider {

	/**
	 * Return the offers matching the given requirements.
	 *
	 * @param spec The pod requirements.
	 * @return The matching offers, best first. May be empty.
	 * @throws ProviderException When the search failed.
	 */
	List<Offer> search(PodSpec spec) throws ProviderException;

	/**
	 * Rent the given offer and start a pod.
	 *
	 * @param offer The offer identifier.
	 * @param label The label of the new pod.
	 * @param spec  The pod requirements: image, disk, environment and options.
	 * @return The handle of the new pod.
	 * @throws ProviderException When the provisioning failed.
	 */
	String provision(String offer, String label, PodSpec spec) throws ProviderException;

	/**
	 * Release the given pod.
	 *
	 * @param instance The pod handle.
	 * @throws InstanceNotFoundException When the pod does not exist.
	 * @throws ProviderException         When the release failed.
	 */
	void release(String instance) throws ProviderException;

	/**
	 * Return the status of all pods of the account.
	 *
	 * @return The status of each pod, by handle. Never contains {@link PodStatus#ABSENT} nor
	 *         {@link PodStatus#UNKNOWN}.
	 * @throws ProviderException When the listing failed.
	 */
	Map<String, PodStatus> listStatus() throws ProviderException;
}
