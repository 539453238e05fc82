/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.provider;

import lombok.Getter;

/**
 * The provider does not know the requested pod.
 */
@Getter
public class InstanceNotFoundException extends ProviderException {

	private static final long serialVersionUID = 1L;

	/**
	 * The unknown pod handle.
	 */
	private final String instance;

	/**
	 * Constructor.
	 *
	 * @param instance The unknown pod handle.
	 * @param cause    The root cause.
	 */
	public InstanceNotFoundException(final String instance, final Throwable cause) {
		super("Instance " + instance + " not found", cause);
		this.instance = instance;
	}
}
