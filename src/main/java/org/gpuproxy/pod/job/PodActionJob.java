/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.job;

import java.util.Map;

import org.quartz.JobExecutionContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.quartz.QuartzJobBean;

import lombok.extern.slf4j.Slf4j;

/**
 * Deferred job running a registered action.
 */
@Slf4j
public class PodActionJob extends QuartzJobBean {

	/**
	 * Job data holding the action name.
	 */
	public static final String ACTION = "action";

	/**
	 * Job data holding the action arguments.
	 */
	public static final String ARGS = "args";

	@Autowired
	private PodJobResource jobResource;

	@Override
	@SuppressWarnings("unchecked")
	protected void executeInternal(final JobExecutionContext context) {
		// Extract the job data to execute the action
		final var data = context.getMergedJobDataMap();
		final var name = data.getString(ACTION);
		final var args = (Map<String, String>) data.get(ARGS);
		final var id = context.getJobDetail().getKey().getName();
		log.info("Executing {} for job {}", name, id);
		try {
			jobResource.getAction(name).execute(args, "job:" + id);
			log.info("Succeed {} for job {}", name, id);
		} catch (final Exception e) {
			// The job stays registered, the next firing is unchanged
			log.error("Failed {} for job {}", name, id, e);
		}
	}
}
