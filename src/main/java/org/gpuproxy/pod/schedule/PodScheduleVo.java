/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.schedule;

import java.time.Instant;

import org.gpuproxy.pod.model.PodSpec;

import lombok.Getter;
import lombok.Setter;

/**
 * A pod schedule: the requirements, the start and stop windows.
 */
@Getter
@Setter
public class PodScheduleVo {

	/**
	 * Optional identifier.
	 */
	private Integer id;

	private String name;

	private PodSpec spec;

	/**
	 * CRON expression of the start, 5 parts (UNIX) or 6 to 7 parts (Quartz).
	 */
	private String startCron;

	/**
	 * CRON expression of the stop.
	 */
	private String stopCron;

	/**
	 * IANA time zone of the expressions. Default is UTC.
	 */
	private String timezone;

	private boolean active = true;

	/**
	 * Handle of the last created pod, read only.
	 */
	private String lastInstance;

	/**
	 * Last successful start, read only.
	 */
	private Instant lastRunTime;

	/**
	 * The next start fire time from the server side.
	 */
	private Instant nextStart;

	/**
	 * The next stop fire time from the server side.
	 */
	private Instant nextStop;

}
