/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.provider;

/**
 * Any failure of the GPU provider: network, authentication, rejected request, unreadable response.
 */
public class ProviderException extends Exception {

	private static final long serialVersionUID = 1L;

	/**
	 * Constructor.
	 *
	 * @param message The failure description.
	 * @param cause   The optional root cause.
	 */
	public ProviderException(final String message, final Throwable cause) {
		super(message, cause);
	}

	/**
	 * Constructor without cause.
	 *
	 * @param message The failure description.
	 */
	public ProviderException(final String message) {
		super(message);
	}
}
