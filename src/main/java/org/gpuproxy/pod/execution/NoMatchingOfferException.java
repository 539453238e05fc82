/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.execution;

import org.gpuproxy.pod.model.PodSpec;

/**
 * No provider offer matches the pod requirements.
 */
public class NoMatchingOfferException extends Exception {

	private static final long serialVersionUID = 1L;

	/**
	 * Constructor.
	 *
	 * @param spec The unsatisfied requirements.
	 */
	public NoMatchingOfferException(final PodSpec spec) {
		super(String.format("No offer matches %dx%s, image %s, max %s$/h", spec.getNumGpus(),
				spec.getGpuType() == null ? "any GPU" : spec.getGpuType(), spec.getImage(),
				spec.getMaxPricePerHour() == null ? "-" : spec.getMaxPricePerHour()));
	}
}
