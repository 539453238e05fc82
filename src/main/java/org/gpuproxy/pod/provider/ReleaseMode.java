/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.provider;

/**
 * How a pod is released by the provider.
 */
public enum ReleaseMode {

	/**
	 * Stop the pod, the disk is kept and still charged.
	 */
	STOP,

	/**
	 * Destroy the pod and its disk.
	 */
	DESTROY
}
