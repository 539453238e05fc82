/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.model;

import java.time.Instant;

import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

/**
 * A recurring window during which a pod is provisioned, then released.
 */
@Getter
@Setter
@Entity
@Table(name = "POD_SCHEDULE")
public class PodSchedule {

	@Id
	@GeneratedValue
	private Integer id;

	/**
	 * Display name, also used as label of the provisioned pods.
	 */
	@NotNull
	private String name;

	/**
	 * The pod requirements.
	 */
	@Embedded
	private PodSpec spec = new PodSpec();

	/**
	 * CRON expression opening the start window.
	 */
	@NotNull
	private String startCron;

	/**
	 * CRON expression opening the stop window.
	 */
	@NotNull
	private String stopCron;

	/**
	 * IANA time zone of both CRON expressions.
	 */
	@NotNull
	private String timezone = "UTC";

	/**
	 * When <code>false</code>, the schedule is never evaluated.
	 */
	private boolean active = true;

	/**
	 * Handle of the last pod created by this schedule. Kept after the stop.
	 */
	private String lastInstance;

	/**
	 * Last successful start, UTC.
	 */
	private Instant lastRunTime;

	/**
	 * The owner identifier.
	 */
	private String owner;

	@NotNull
	private Instant createdDate;

	@NotNull
	private Instant updatedDate;

}
