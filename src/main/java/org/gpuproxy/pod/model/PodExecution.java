/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.model;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

/**
 * An executed (succeed or failed) pod operation.
 */
@Getter
@Setter
@Entity
@Table(name = "POD_EXECUTION")
public class PodExecution {

	@Id
	@GeneratedValue
	private Integer id;

	/**
	 * Execution date
	 */
	@NotNull
	@Column(name = "EXECUTION_DATE")
	private Instant date;

	/**
	 * The executed pod operation.
	 */
	@NotNull
	@Enumerated(EnumType.STRING)
	private PodOperation operation;

	/**
	 * The schedule this execution was made for. <code>null</code> for a deferred job or a manual creation without
	 * schedule.
	 */
	@ManyToOne
	@JsonIgnore
	private PodSchedule schedule;

	private boolean succeed;

	/**
	 * The trigger mode: "sweep", "job:" followed by the job identifier, the requesting user or "api" without user.
	 */
	@NotNull
	@Column(name = "TRIGGER_MODE")
	private String trigger;

	/**
	 * The error message. <code>null</code> when succeeded.
	 */
	@Column(length = 1024)
	private String error;

	/**
	 * The related pod handle. May be <code>null</code> when the start failed before the provisioning.
	 */
	private String instance;

	/**
	 * The optional status text, such as the selected offer.
	 */
	private String statusText;

}
