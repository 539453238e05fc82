/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.model;

/**
 * Observed status of a provisioned pod.
 */
public enum PodStatus {

	/**
	 * Running, or booting toward the running state.
	 */
	RUNNING,

	/**
	 * Known by the provider but not running.
	 */
	STOPPED,

	/**
	 * Not found in a successful listing of the provider.
	 */
	ABSENT,

	/**
	 * The provider could not be queried.
	 */
	UNKNOWN
}
