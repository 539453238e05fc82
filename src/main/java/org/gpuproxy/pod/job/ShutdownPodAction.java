/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.job;

import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.gpuproxy.pod.ValidationJsonException;
import org.gpuproxy.pod.execution.PodExecutionResource;
import org.gpuproxy.pod.provider.ProviderException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Release the pod of the "instance" argument.
 */
@Component
public class ShutdownPodAction implements PodAction {

	@Autowired
	private PodExecutionResource executor;

	@Override
	public String getName() {
		return "shutdown";
	}

	@Override
	public void validate(final Map<String, String> args) {
		if (StringUtils.isBlank(args.get("instance"))) {
			throw new ValidationJsonException("instance", "NotBlank");
		}
	}

	@Override
	public void execute(final Map<String, String> args, final String trigger) throws ProviderException {
		executor.stop(args.get("instance").trim(), null, trigger);
	}
}
