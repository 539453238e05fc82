/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod;

import java.util.List;
import java.util.Map;

import org.gpuproxy.pod.execution.NoMatchingOfferException;
import org.gpuproxy.pod.model.PodSpec;
import org.gpuproxy.pod.provider.ProviderException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import jakarta.persistence.EntityNotFoundException;

/**
 * Test class of {@link ExceptionMappers}
 */
class ExceptionMappersTest {

	@Test
	void validation() {
		final var response = new ExceptionMappers.ValidationMapper()
				.toResponse(new ValidationJsonException("startCron", "pod-cron"));
		Assertions.assertEquals(400, response.getStatus());
		Assertions.assertEquals(Map.of("errors", Map.of("startCron", List.of("pod-cron"))), response.getEntity());
	}

	@Test
	void entityNotFound() {
		final var response = new ExceptionMappers.EntityNotFoundMapper().toResponse(new EntityNotFoundException("12"));
		Assertions.assertEquals(404, response.getStatus());
		Assertions.assertEquals(Map.of("code", "entity", "message", "12"), response.getEntity());
	}

	@Test
	void provider() {
		final var response = new ExceptionMappers.ProviderMapper().toResponse(new ProviderException("HTTP 500"));
		Assertions.assertEquals(502, response.getStatus());
	}

	@Test
	void noMatchingOffer() {
		final var spec = new PodSpec();
		spec.setImage("pytorch/pytorch:latest");
		final var response = new ExceptionMappers.NoMatchingOfferMapper()
				.toResponse(new NoMatchingOfferException(spec));
		Assertions.assertEquals(409, response.getStatus());
	}
}
