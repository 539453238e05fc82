/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod;

import org.glassfish.jersey.server.ResourceConfig;
import org.gpuproxy.pod.execution.PodExecutionResource;
import org.gpuproxy.pod.job.PodJobResource;
import org.gpuproxy.pod.schedule.PodScheduleResource;
import org.gpuproxy.pod.schedule.PodSweepResource;
import org.springframework.context.annotation.Configuration;

import jakarta.ws.rs.ApplicationPath;

/**
 * JAX-RS resources and error mappers.
 */
@Configuration
@ApplicationPath("/rest")
public class JerseyConfig extends ResourceConfig {

	public JerseyConfig() {
		register(PodResource.class);
		register(PodScheduleResource.class);
		register(PodExecutionResource.class);
		register(PodSweepResource.class);
		register(PodJobResource.class);
		register(ExceptionMappers.ValidationMapper.class);
		register(ExceptionMappers.EntityNotFoundMapper.class);
		register(ExceptionMappers.ProviderMapper.class);
		register(ExceptionMappers.NoMatchingOfferMapper.class);
	}
}
