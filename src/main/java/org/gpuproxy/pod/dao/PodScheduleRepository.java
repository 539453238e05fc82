/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.dao;

import java.time.Instant;
import java.util.List;

import org.gpuproxy.pod.model.PodSchedule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link PodSchedule} repository.
 */
public interface PodScheduleRepository extends JpaRepository<PodSchedule, Integer> {

	/**
	 * Return all schedules to evaluate.
	 *
	 * @return The active schedules, ordered by identifier.
	 */
	@Query("FROM PodSchedule WHERE active = true ORDER BY id")
	List<PodSchedule> findAllActive();

	/**
	 * Return schedules owned by the given user.
	 *
	 * @param owner The owner identifier.
	 * @return The schedules owned by the given user, ordered by name.
	 */
	@Query("FROM PodSchedule WHERE owner = ?1 ORDER BY name")
	List<PodSchedule> findAllByOwner(String owner);

	/**
	 * Record a successful start.
	 *
	 * @param id       The schedule identifier.
	 * @param instance The created pod handle.
	 * @param now      The start date, used for the last run and update dates.
	 * @return The amount of updated rows, <code>0</code> when the schedule has vanished.
	 */
	@Transactional
	@Modifying(clearAutomatically = true, flushAutomatically = true)
	@Query("UPDATE PodSchedule SET lastInstance = :instance, lastRunTime = :now, updatedDate = :now WHERE id = :id")
	int markStarted(int id, String instance, Instant now);

	/**
	 * Record a successful stop. The last handle is kept.
	 *
	 * @param id  The schedule identifier.
	 * @param now The stop date.
	 * @return The amount of updated rows, <code>0</code> when the schedule has vanished.
	 */
	@Transactional
	@Modifying(clearAutomatically = true, flushAutomatically = true)
	@Query("UPDATE PodSchedule SET updatedDate = :now WHERE id = :id")
	int markStopped(int id, Instant now);
}
