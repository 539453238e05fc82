/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.schedule;

import org.gpuproxy.pod.PodProperties;
import org.gpuproxy.pod.cron.CronWindow;
import org.quartz.CronScheduleBuilder;
import org.quartz.JobBuilder;
import org.quartz.JobDetail;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registration of the periodic reconciliation in the Quartz scheduler.
 */
@Configuration
@ConditionalOnProperty(prefix = "pod.sweep", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PodSweepConfiguration {

	/**
	 * Group of the sweep job and trigger.
	 */
	public static final String SWEEP_GROUP = "pod-sweep";

	@Bean
	public JobDetail podSweepJobDetail() {
		return JobBuilder.newJob(PodSweepJob.class).withIdentity("sweep", SWEEP_GROUP).storeDurably()
				.withDescription("Reconciliation of the pod schedules").build();
	}

	@Bean
	public Trigger podSweepTrigger(final JobDetail podSweepJobDetail, final PodProperties properties) {
		// A late sweep is not replayed, the next one catches up
		return TriggerBuilder.newTrigger().forJob(podSweepJobDetail).withIdentity("sweep", SWEEP_GROUP)
				.withSchedule(CronScheduleBuilder.cronSchedule(CronWindow.toQuartz(properties.getSweep().getCron()))
						.withMisfireHandlingInstructionDoNothing())
				.build();
	}
}
