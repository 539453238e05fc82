/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod;

import org.gpuproxy.pod.model.PodSpec;
import org.gpuproxy.pod.schedule.PodScheduleVo;

import lombok.Getter;
import lombok.Setter;

/**
 * An immediate pod creation, optionally followed by a schedule owning the new pod.
 */
@Getter
@Setter
public class PodCreationVo {

	/**
	 * Label of the new pod.
	 */
	private String label;

	private PodSpec spec;

	/**
	 * Optional schedule taking over the new pod. Its requirements are the ones of this creation, its name defaults to
	 * the label.
	 */
	private PodScheduleVo schedule;

	/**
	 * The created pod handle, read only.
	 */
	private String instance;

	/**
	 * The created schedule identifier, read only.
	 */
	private Integer scheduleId;
}
