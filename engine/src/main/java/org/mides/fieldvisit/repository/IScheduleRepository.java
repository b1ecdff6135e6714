package org.mides.fieldvisit.repository;

import org.mides.fieldvisit.model.Schedule;
import org.mides.fieldvisit.model.Stop;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Storage for schedules and the stops they own.
 * A stop and its schedule are normally updated independently; each update is atomic on its own record.
 */
public interface IScheduleRepository {

    /**
     * Stores a new schedule with its stops, assigning ids where missing.
     *
     * @throws org.mides.fieldvisit.exception.ConflictException when a schedule already exists for the date
     */
    Schedule insert(Schedule schedule);

    Optional<Schedule> findById(String scheduleId);

    Optional<Schedule> findByDate(LocalDate date);

    List<Schedule> findAll();

    Optional<Stop> findStop(String stopId);

    /**
     * Applies {@code transition} to the current stop while holding it exclusively.
     * An exception thrown by the transition leaves the stored stop untouched.
     *
     * @throws org.mides.fieldvisit.exception.NotFoundException when the stop does not exist
     */
    Stop updateStop(String stopId, UnaryOperator<Stop> transition);

    /**
     * Same contract as {@link #updateStop} for the schedule record; stops are not touched.
     */
    Schedule updateSchedule(String scheduleId, UnaryOperator<Schedule> transition);

    /**
     * Like {@link #updateSchedule}, but the transition receives the schedule with its stops and the stops it
     * returns are written back in the same atomic step. Stops can be changed but not added or removed.
     */
    Schedule updateScheduleAndStops(String scheduleId, UnaryOperator<Schedule> transition);
}
