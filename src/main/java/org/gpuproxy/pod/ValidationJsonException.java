/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod;

import java.util.List;
import java.util.Map;

import lombok.Getter;

/**
 * A rejected user input: the field in error and the error key.
 */
@Getter
public class ValidationJsonException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	/**
	 * Errors by field.
	 */
	private final Map<String, List<String>> errors;

	/**
	 * Constructor for a single field in error.
	 *
	 * @param field The field in error.
	 * @param error The error key.
	 */
	public ValidationJsonException(final String field, final String error) {
		super(field + ":" + error);
		this.errors = Map.of(field, List.of(error));
	}
}
