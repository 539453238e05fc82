/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod;

import java.time.Duration;

import org.gpuproxy.pod.cron.CronWindow;
import org.gpuproxy.pod.provider.ReleaseMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Getter;
import lombok.Setter;

/**
 * Pod scheduler configuration, "pod" prefix.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "pod")
public class PodProperties {

	private final Schedule schedule = new Schedule();

	private final Sweep sweep = new Sweep();

	private final Provider provider = new Provider();

	/**
	 * Window evaluation of the stored schedules.
	 */
	@Getter
	@Setter
	public static class Schedule {

		/**
		 * Length of the fire window following each fire time.
		 */
		private Duration tolerance = CronWindow.DEFAULT_TOLERANCE;

		/**
		 * Minimal delay between two starts of the same schedule.
		 */
		private Duration debounce = Duration.ofHours(1);
	}

	/**
	 * Periodic trigger of the reconciliation.
	 */
	@Getter
	@Setter
	public static class Sweep {

		private boolean enabled = true;

		/**
		 * Quartz CRON expression of the sweep trigger.
		 */
		private String cron = "0 * * * * ?";
	}

	/**
	 * GPU provider access.
	 */
	@Getter
	@Setter
	public static class Provider {

		private String url = "https://console.vast.ai/api/v0";

		private String apiKey;

		private ReleaseMode releaseMode = ReleaseMode.STOP;

		private Duration connectTimeout = Duration.ofSeconds(10);

		private Duration readTimeout = Duration.ofSeconds(60);
	}
}
