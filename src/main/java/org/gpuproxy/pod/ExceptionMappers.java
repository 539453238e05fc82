/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod;

import java.util.Map;

import org.gpuproxy.pod.execution.NoMatchingOfferException;
import org.gpuproxy.pod.provider.ProviderException;

import jakarta.persistence.EntityNotFoundException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.Response.Status;
import jakarta.ws.rs.ext.ExceptionMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * JSON error responses of the REST surface.
 */
public final class ExceptionMappers {

	private ExceptionMappers() {
		// Holder only
	}

	private static Response toResponse(final Status status, final Object entity) {
		return Response.status(status).type(MediaType.APPLICATION_JSON_TYPE).entity(entity).build();
	}

	/**
	 * Validation errors, 400.
	 */
	public static class ValidationMapper implements ExceptionMapper<ValidationJsonException> {
		@Override
		public Response toResponse(final ValidationJsonException exception) {
			return ExceptionMappers.toResponse(Status.BAD_REQUEST, Map.of("errors", exception.getErrors()));
		}
	}

	/**
	 * Unknown or not visible entity, 404.
	 */
	public static class EntityNotFoundMapper implements ExceptionMapper<EntityNotFoundException> {
		@Override
		public Response toResponse(final EntityNotFoundException exception) {
			return ExceptionMappers.toResponse(Status.NOT_FOUND,
					Map.of("code", "entity", "message", String.valueOf(exception.getMessage())));
		}
	}

	/**
	 * Provider failure, 502.
	 */
	@Slf4j
	public static class ProviderMapper implements ExceptionMapper<ProviderException> {
		@Override
		public Response toResponse(final ProviderException exception) {
			log.error("Provider failure", exception);
			return ExceptionMappers.toResponse(Status.BAD_GATEWAY,
					Map.of("code", "provider", "message", String.valueOf(exception.getMessage())));
		}
	}

	/**
	 * No offer matches the requirements, 409.
	 */
	public static class NoMatchingOfferMapper implements ExceptionMapper<NoMatchingOfferException> {
		@Override
		public Response toResponse(final NoMatchingOfferException exception) {
			return ExceptionMappers.toResponse(Status.CONFLICT,
					Map.of("code", "no-offer", "message", String.valueOf(exception.getMessage())));
		}
	}
}
