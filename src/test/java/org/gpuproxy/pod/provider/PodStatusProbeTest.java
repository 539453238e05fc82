/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.provider;

import java.util.Map;

import org.gpuproxy.pod.model.PodStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

/**
 * Test class of {@link PodStatusProbe} and {@link PodStatusSnapshot}
 */
class PodStatusProbeTest {

	private PodStatusProbe probe;

	@BeforeEach
	void prepareProbe() {
		probe = new PodStatusProbe();
		probe.provider = Mockito.mock(GpuProvider.class);
	}

	@Test
	void snapshot() throws ProviderException {
		Mockito.when(probe.provider.listStatus()).thenReturn(Map.of("1", PodStatus.RUNNING, "2", PodStatus.STOPPED));
		final var snapshot = probe.snapshot();
		Assertions.assertTrue(snapshot.isAvailable());
		Assertions.assertEquals(PodStatus.RUNNING, snapshot.statusOf("1"));
		Assertions.assertEquals(PodStatus.STOPPED, snapshot.statusOf("2"));
		Assertions.assertEquals(PodStatus.ABSENT, snapshot.statusOf("3"));
		Assertions.assertEquals(PodStatus.ABSENT, snapshot.statusOf(null));

		// A single listing for the whole snapshot
		Mockito.verify(probe.provider, Mockito.times(1)).listStatus();
	}

	@Test
	void snapshotProviderError() throws ProviderException {
		Mockito.when(probe.provider.listStatus()).thenThrow(new ProviderException("timeout"));
		final var snapshot = probe.snapshot();
		Assertions.assertFalse(snapshot.isAvailable());
		Assertions.assertEquals(PodStatus.UNKNOWN, snapshot.statusOf("1"));
		Assertions.assertEquals(PodStatus.ABSENT, snapshot.statusOf(null));
	}

	@Test
	void snapshotUnexpectedError() throws ProviderException {
		Mockito.when(probe.provider.listStatus()).thenThrow(new IllegalStateException("bug"));
		Assertions.assertEquals(PodStatus.UNKNOWN, probe.snapshot().statusOf("1"));
	}

	@Test
	void statusOf() throws ProviderException {
		Mockito.when(probe.provider.listStatus()).thenReturn(Map.of("1", PodStatus.RUNNING));
		Assertions.assertEquals(PodStatus.RUNNING, probe.statusOf("1"));
		Assertions.assertEquals(PodStatus.ABSENT, probe.statusOf("2"));
	}

	@Test
	void statusOfNull() throws ProviderException {
		Assertions.assertEquals(PodStatus.ABSENT, probe.statusOf(null));
		Mockito.verify(probe.provider, Mockito.never()).listStatus();
	}

	@Test
	void statusOfProviderError() throws ProviderException {
		Mockito.when(probe.provider.listStatus()).thenThrow(new ProviderException("HTTP 500"));
		Assertions.assertEquals(PodStatus.UNKNOWN, probe.statusOf("1"));
	}
}
