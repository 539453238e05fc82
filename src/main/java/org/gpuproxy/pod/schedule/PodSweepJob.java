/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.schedule;

import org.quartz.DisallowConcurrentExecution;
import org.quartz.JobExecutionContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.quartz.QuartzJobBean;

import lombok.extern.slf4j.Slf4j;

/**
 * Periodic reconciliation job.
 */
@Slf4j
@DisallowConcurrentExecution
public class PodSweepJob extends QuartzJobBean {

	@Autowired
	private PodSweepResource sweepResource;

	@Override
	protected void executeInternal(final JobExecutionContext context) {
		log.debug("Sweep fired at {}", context.getFireTime());
		sweepResource.sweep();
	}
}
