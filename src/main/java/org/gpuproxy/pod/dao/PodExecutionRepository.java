/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.dao;

import java.util.List;

import org.gpuproxy.pod.model.PodExecution;
import org.gpuproxy.pod.model.PodOperation;
import org.gpuproxy.pod.model.PodSchedule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link PodExecution} repository.
 */
public interface PodExecutionRepository extends JpaRepository<PodExecution, Integer> {

	/**
	 * Return all executions related to given schedule and ordered from the most to the least recent date.
	 *
	 * @param schedule The related schedule.
	 * @return All executions associated to given schedule.
	 */
	@Query("FROM PodExecution WHERE schedule.id = :schedule ORDER BY id DESC")
	List<PodExecution> findAllBySchedule(int schedule);

	/**
	 * Delete the history of the given schedule.
	 *
	 * @param schedule The related schedule.
	 * @return The amount of deleted executions.
	 */
	@Modifying
	@Query("DELETE FROM PodExecution WHERE schedule.id = :schedule")
	int deleteAllBySchedule(int schedule);

	/**
	 * Attach the executions of a pod recorded without schedule to the given schedule.
	 *
	 * @param schedule  The schedule now tracking the pod.
	 * @param instance  The pod handle.
	 * @param operation The operation of the executions to attach.
	 * @return The amount of attached executions.
	 */
	@Transactional
	@Modifying(clearAutomatically = true, flushAutomatically = true)
	@Query("UPDATE PodExecution SET schedule = :schedule WHERE schedule IS NULL AND instance = :instance AND operation = :operation")
	int attach(PodSchedule schedule, String instance, PodOperation operation);
}
