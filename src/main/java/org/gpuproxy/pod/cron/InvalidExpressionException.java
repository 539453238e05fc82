/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.cron;

import lombok.Getter;

/**
 * A CRON expression that cannot be parsed, or that is not accepted.
 */
@Getter
public class InvalidExpressionException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	/**
	 * The rejected expression.
	 */
	private final String expression;

	/**
	 * The error key: "pod-cron" for a syntax error, "pod-cron-second" for an every second expression.
	 */
	private final String error;

	/**
	 * Constructor.
	 *
	 * @param expression The rejected expression.
	 * @param error      The error key.
	 * @param cause      The optional parser error.
	 */
	public InvalidExpressionException(final String expression, final String error, final Throwable cause) {
		super("Invalid CRON expression '" + expression + "' (" + error + ")", cause);
		this.expression = expression;
		this.error = error;
	}
}
