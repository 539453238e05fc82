/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.job;

import java.time.Instant;
import java.util.Map;

import lombok.Getter;
import lombok.Setter;

/**
 * A deferred job: one shot at a given date, or recurring with a CRON expression.
 */
@Getter
@Setter
public class PodJobVo {

	/**
	 * Job identifier, read only.
	 */
	private String id;

	/**
	 * The registered action name.
	 */
	private String action;

	private Map<String, String> args;

	/**
	 * Date of a one shot job.
	 */
	private Instant at;

	/**
	 * CRON expression of a recurring job, UTC.
	 */
	private String cron;

	/**
	 * The next fire time, read only.
	 */
	private Instant nextFireTime;

	/**
	 * Trigger description, read only.
	 */
	private String trigger;
}
