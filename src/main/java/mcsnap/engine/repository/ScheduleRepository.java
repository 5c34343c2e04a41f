package mcsnap.engine.repository;

import mcsnap.engine.model.RunStatus;
import mcsnap.engine.model.Schedule;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Schedule persistence.
 * Every mutating call is committed before it returns.
 */
public interface ScheduleRepository {

    /**
     * Persist a new schedule.
     *
     * @param schedule the schedule to save
     */
    void create(Schedule schedule);

    /**
     * Get all schedules, oldest first.
     */
    List<Schedule> findAll();

    /**
     * Find a schedule by ID.
     *
     * @param id the schedule ID
     * @return the schedule if found
     */
    Optional<Schedule> findById(String id);

    /**
     * Get the schedules of one target.
     *
     * @param target the target name
     */
    List<Schedule> findByTarget(String target);

    /**
     * Get all schedules with {@code enabled = true}.
     */
    List<Schedule> findAllEnabled();

    /**
     * Overwrite the mutable fields of an existing schedule.
     *
     * @param schedule the new state
     * @throws mcsnap.engine.error.NotFoundException if the id is unknown
     */
    void update(Schedule schedule);

    /**
     * Record the outcome of a run: sets lastRunAt to now together with status and message.
     *
     * @return true if the schedule still exists
     */
    boolean recordRun(String id, RunStatus status, String message);

    /**
     * Delete a schedule. Artifacts it produced are left untouched.
     *
     * @param id the schedule ID
     * @return true if deleted
     */
    boolean delete(String id);

    /**
     * Generate a new unique schedule ID.
     */
    String generateId();
}
