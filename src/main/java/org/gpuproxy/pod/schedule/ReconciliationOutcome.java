/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.schedule;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Schedules started and stopped by a single reconciliation.
 */
@Getter
public class ReconciliationOutcome {

	/**
	 * Identifiers of the started schedules.
	 */
	private final List<Integer> started = new ArrayList<>();

	/**
	 * Identifiers of the stopped schedules.
	 */
	private final List<Integer> stopped = new ArrayList<>();

}
