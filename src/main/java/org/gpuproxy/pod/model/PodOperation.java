/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.model;

/**
 * Pod operation to execute.
 */
public enum PodOperation {

	/**
	 * Find a matching offer and provision a new pod.
	 */
	START,

	/**
	 * Release the pod. Releasing an already gone pod is a success.
	 */
	STOP
}
