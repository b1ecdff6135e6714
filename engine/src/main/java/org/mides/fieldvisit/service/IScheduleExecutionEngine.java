package org.mides.fieldvisit.service;

import org.mides.fieldvisit.model.Schedule;
import org.mides.fieldvisit.model.Stop;
import org.mides.fieldvisit.model.StopCompletionResult;
import org.mides.fieldvisit.model.request.CompleteStopRequest;

public interface IScheduleExecutionEngine {
    /**
     * APPROVED → IN_PROGRESS. Already started or finished schedules are returned unchanged.
     */
    Schedule startSchedule(String scheduleId);

    /**
     * PENDING → IN_PROGRESS. A stop already in progress is returned unchanged.
     */
    Stop startStop(String stopId);

    /**
     * Finalizes the stop as COMPLETED and signals downstream exactly once.
     */
    StopCompletionResult completeStop(String stopId, CompleteStopRequest outcome, String actor);

    /**
     * Finalizes the stop as CANCELLED with the given reason.
     */
    Stop skipStop(String stopId, String reason, String actor);

    /**
     * IN_PROGRESS → COMPLETED once every stop is COMPLETED or CANCELLED. Not idempotent.
     */
    Schedule completeSchedule(String scheduleId, String actor);
}
