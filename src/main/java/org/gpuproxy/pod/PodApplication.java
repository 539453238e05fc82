/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod;

import java.time.Clock;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.web.client.RestTemplate;

/**
 * GPU pod scheduler entry point.
 */
@SpringBootApplication
@EnableConfigurationProperties(PodProperties.class)
public class PodApplication {

	public static void main(final String[] args) {
		SpringApplication.run(PodApplication.class, args);
	}

	/**
	 * Wall clock of the reconciliation and of the execution history.
	 *
	 * @return The UTC system clock.
	 */
	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

	/**
	 * HTTP client of the provider API.
	 *
	 * @param builder    The Boot builder.
	 * @param properties The provider timeouts.
	 * @return The provider client.
	 */
	@Bean
	public RestTemplate vastRestTemplate(final RestTemplateBuilder builder, final PodProperties properties) {
		return builder.setConnectTimeout(properties.getProvider().getConnectTimeout())
				.setReadTimeout(properties.getProvider().getReadTimeout()).build();
	}
}
