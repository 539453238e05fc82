/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.provider;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A rentable machine offer.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class Offer {

	/**
	 * Provider identifier of this offer.
	 */
	private String id;

	/**
	 * GPU model name.
	 */
	private String gpuName;

	private int numGpus;

	/**
	 * Total price per hour, USD.
	 */
	private double pricePerHour;

	@Override
	public String toString() {
		return id + " (" + numGpus + "x" + gpuName + ", " + pricePerHour + "$/h)";
	}
}
