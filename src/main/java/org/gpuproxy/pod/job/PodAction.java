/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.job;

import java.util.Map;

/**
 * An action a deferred job can run.
 */
public interface PodAction {

	/**
	 * Return the action name, unique among the actions.
	 *
	 * @return The action name.
	 */
	String getName();

	/**
	 * Check the arguments before the job is registered.
	 *
	 * @param args The job arguments.
	 * @throws org.gpuproxy.pod.ValidationJsonException When an argument is missing or not valid.
	 */
	void validate(Map<String, String> args);

	/**
	 * Run the action.
	 *
	 * @param args    The job arguments.
	 * @param trigger The trigger mode recorded in the execution history.
	 * @throws Exception When the action failed.
	 */
	void execute(Map<String, String> args, String trigger) throws Exception;
}
