/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.gpuproxy.pod.execution.NoMatchingOfferException;
import org.gpuproxy.pod.execution.PodExecutionResource;
import org.gpuproxy.pod.model.PodOperation;
import org.gpuproxy.pod.model.PodStatus;
import org.gpuproxy.pod.provider.InstanceNotFoundException;
import org.gpuproxy.pod.provider.ProviderException;
import org.gpuproxy.pod.provider.Offer;
import org.gpuproxy.pod.schedule.PodScheduleVo;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;

/**
 * Test class of {@link PodResource}
 */
class PodResourceTest extends AbstractPodTest {

	@Autowired
	private PodResource resource;

	@Test
	void findAll() throws Exception {
		Mockito.when(provider.listStatus()).thenReturn(Map.of("1", PodStatus.RUNNING));
		Assertions.assertEquals(Map.of("1", PodStatus.RUNNING), resource.findAll());
	}

	private PodCreationVo newCreation() throws Exception {
		Mockito.when(provider.search(ArgumentMatchers.any())).thenReturn(List.of(new Offer("123", "RTX 4090", 1, 0.4)));
		Mockito.when(provider.provision(ArgumentMatchers.eq("123"), ArgumentMatchers.eq("notebook"),
				ArgumentMatchers.any())).thenReturn("456");
		final var creation = new PodCreationVo();
		creation.setLabel("notebook");
		creation.setSpec(newSpec());
		return creation;
	}

	@Test
	void create() throws Exception {
		final var result = resource.create(newCreation(), USER);
		Assertions.assertEquals("456", result.getInstance());
		Assertions.assertNull(result.getScheduleId());
		Assertions.assertEquals(0, scheduleRepository.count());
		Assertions.assertEquals(USER, executionRepository.findAll().get(0).getTrigger());
	}

	@Test
	void createWithSchedule() throws Exception {
		setNow(Instant.parse("2024-01-15T09:30:00Z"));
		final var creation = newCreation();
		final var schedule = new PodScheduleVo();
		schedule.setStartCron("0 9 * * 1-5");
		schedule.setStopCron("0 17 * * 1-5");
		creation.setSchedule(schedule);

		final var result = resource.create(creation, USER);
		Assertions.assertEquals("456", result.getInstance());
		final var entity = scheduleRepository.findById(result.getScheduleId()).get();
		Assertions.assertEquals("notebook", entity.getName());
		Assertions.assertEquals(USER, entity.getOwner());
		Assertions.assertEquals("456", entity.getLastInstance());
		Assertions.assertEquals(Instant.parse("2024-01-15T09:30:00Z"), entity.getLastRunTime());
		Assertions.assertEquals("pytorch/pytorch:latest", entity.getSpec().getImage());

		// The start belongs to the history of the new schedule
		final var executions = executionRepository.findAllBySchedule(result.getScheduleId());
		Assertions.assertEquals(1, executions.size());
		Assertions.assertEquals(PodOperation.START, executions.get(0).getOperation());
		Assertions.assertEquals("456", executions.get(0).getInstance());
		Assertions.assertTrue(executions.get(0).isSucceed());
	}

	@Test
	void createWithoutUser() throws Exception {
		final var result = resource.create(newCreation(), null);
		Assertions.assertEquals("456", result.getInstance());

		// Recorded with the default trigger
		final var executions = executionRepository.findAll();
		Assertions.assertEquals(1, executions.size());
		Assertions.assertEquals(PodResource.TRIGGER, executions.get(0).getTrigger());
		Assertions.assertEquals("456", executions.get(0).getInstance());
	}

	@Test
	void createInvalidSchedule() throws Exception {
		final var creation = newCreation();
		final var schedule = new PodScheduleVo();
		schedule.setStartCron("0 9 * * 1-5");
		schedule.setStopCron("0 17 * * 8");
		creation.setSchedule(schedule);

		Assertions.assertThrows(ValidationJsonException.class, () -> resource.create(creation, USER));

		// Nothing is provisioned
		Mockito.verify(provider, Mockito.never()).search(ArgumentMatchers.any());
		Assertions.assertEquals(0, scheduleRepository.count());
	}

	@Test
	void createNoOffer() throws Exception {
		final var creation = newCreation();
		Mockito.when(provider.search(ArgumentMatchers.any())).thenReturn(List.of());
		Assertions.assertThrows(NoMatchingOfferException.class, () -> resource.create(creation, USER));
	}

	@Test
	void createInvalidSpec() throws Exception {
		final var creation = newCreation();
		creation.getSpec().setImage("");
		Assertions.assertThrows(ValidationJsonException.class, () -> resource.create(creation, USER));
	}

	@Test
	void stop() throws Exception {
		resource.stop("456", USER);
		Mockito.verify(provider).release("456");
		final var execution = executionRepository.findAll().get(0);
		Assertions.assertEquals(PodOperation.STOP, execution.getOperation());
		Assertions.assertEquals("456", execution.getInstance());
		Assertions.assertEquals(USER, execution.getTrigger());
		Assertions.assertTrue(execution.isSucceed());
		Assertions.assertNull(execution.getSchedule());
	}

	@Test
	void stopNotFound() throws Exception {
		Mockito.doThrow(new InstanceNotFoundException("456", null)).when(provider).release("456");
		resource.stop("456", null);
		final var execution = executionRepository.findAll().get(0);
		Assertions.assertTrue(execution.isSucceed());
		Assertions.assertEquals(PodExecutionResource.NOT_FOUND, execution.getStatusText());
		Assertions.assertEquals(PodResource.TRIGGER, execution.getTrigger());
	}

	@Test
	void stopFailed() throws Exception {
		Mockito.doThrow(new ProviderException("HTTP 500")).when(provider).release("456");
		Assertions.assertThrows(ProviderException.class, () -> resource.stop("456", USER));
		Assertions.assertFalse(executionRepository.findAll().get(0).isSucceed());
	}

	@Test
	void findOffers() throws Exception {
		final var offers = List.of(new Offer("123", "RTX 4090", 1, 0.4), new Offer("124", "RTX 4090", 1, 0.5));
		Mockito.when(provider.search(ArgumentMatchers.any())).thenReturn(offers);
		Assertions.assertEquals(offers, resource.findOffers(newSpec()));

		// Nothing is provisioned nor recorded
		Mockito.verify(provider, Mockito.never()).provision(ArgumentMatchers.any(), ArgumentMatchers.any(),
				ArgumentMatchers.any());
		Assertions.assertEquals(0, executionRepository.count());
	}

	@Test
	void findOffersInvalidSpec() throws Exception {
		final var spec = newSpec();
		spec.setNumGpus(0);
		Assertions.assertThrows(ValidationJsonException.class, () -> resource.findOffers(spec));
		Mockito.verify(provider, Mockito.never()).search(ArgumentMatchers.any());
	}
}
