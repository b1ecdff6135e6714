package org.mides.fieldvisit.service;

import org.mides.fieldvisit.model.Schedule;
import org.mides.fieldvisit.model.ScheduleStats;
import org.mides.fieldvisit.model.request.CreateScheduleRequest;

import java.time.LocalDate;
import java.util.List;

public interface ISchedulePlanner {
    Schedule createSchedule(CreateScheduleRequest request, String actor);

    Schedule approveSchedule(String scheduleId, String actor);

    /**
     * Replaces the optimized order with a manual one while the schedule is still a draft.
     */
    Schedule reorderStops(String scheduleId, List<String> orderedStopIds);

    Schedule getSchedule(String scheduleId);

    Schedule getScheduleByDate(LocalDate date);

    ScheduleStats getStats();
}
