package org.mides.fieldvisit.service;

import org.mides.fieldvisit.config.ExecutionConfiguration;
import org.mides.fieldvisit.exception.ConflictException;
import org.mides.fieldvisit.exception.ErrorCode;
import org.mides.fieldvisit.exception.NotFoundException;
import org.mides.fieldvisit.exception.UpstreamException;
import org.mides.fieldvisit.exception.ValidationException;
import org.mides.fieldvisit.model.RequestStatus;
import org.mides.fieldvisit.model.Schedule;
import org.mides.fieldvisit.model.ScheduleStatus;
import org.mides.fieldvisit.model.Stop;
import org.mides.fieldvisit.model.StopCompletedEvent;
import org.mides.fieldvisit.model.StopCompletion;
import org.mides.fieldvisit.model.StopCompletionResult;
import org.mides.fieldvisit.model.StopStatus;
import org.mides.fieldvisit.model.request.CompleteStopRequest;
import org.mides.fieldvisit.model.request.PhotoUpload;
import org.mides.fieldvisit.repository.IScheduleRepository;
import org.mides.fieldvisit.repository.IServiceRequestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

@Service
public class ScheduleExecutionEngine implements IScheduleExecutionEngine {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleExecutionEngine.class);

    private static final int MAX_NOTE_LENGTH = 500;

    private final IScheduleRepository scheduleRepository;
    private final IServiceRequestRepository requestRepository;
    private final IObjectStorageService objectStorageService;
    private final CompletionSignalDispatcher signalDispatcher;
    private final ExecutionConfiguration executionConfig;
    private final Clock clock;

    @Autowired
    public ScheduleExecutionEngine(
        IScheduleRepository scheduleRepository,
        IServiceRequestRepository requestRepository,
        IObjectStorageService objectStorageService,
        CompletionSignalDispatcher signalDispatcher,
        ExecutionConfiguration executionConfig,
        Clock clock)
    {
        this.scheduleRepository = scheduleRepository;
        this.requestRepository = requestRepository;
        this.objectStorageService = objectStorageService;
        this.signalDispatcher = signalDispatcher;
        this.executionConfig = executionConfig;
        this.clock = clock;
    }

    @Override
    public Schedule startSchedule(String scheduleId) {
        var changed = new AtomicBoolean(false);

        var schedule = scheduleRepository.updateSchedule(scheduleId, current -> {
            if (current.getStatus().isStarted()) {
                return current;
            }
            if (!current.getStatus().canStart()) {
                throw new ConflictException(ErrorCode.INVALID_SCHEDULE_STATUS, String.format(
                    "Schedule %s is %s; only APPROVED schedules can be started", scheduleId, current.getStatus()));
            }
            current.setStatus(ScheduleStatus.IN_PROGRESS);
            current.setStartedAt(clock.instant());
            changed.set(true);
            return current;
        });

        if (changed.get()) {
            logger.info("Schedule {} for {} started with {} stops", scheduleId, schedule.getScheduleDate(), schedule.getStops().size());
        } else {
            logger.debug("Schedule {} already {}, start ignored", scheduleId, schedule.getStatus());
        }
        return schedule;
    }

    @Override
    public Stop startStop(String stopId) {
        var stop = loadStop(stopId);
        requireScheduleInProgress(stop);

        return scheduleRepository.updateStop(stopId, current -> {
            if (current.getStatus() == StopStatus.IN_PROGRESS) {
                return current;
            }
            if (!current.getStatus().canStart()) {
                throw alreadyFinalized(current);
            }
            current.setStatus(StopStatus.IN_PROGRESS);
            return current;
        });
    }

    @Override
    public StopCompletionResult completeStop(String stopId, CompleteStopRequest outcome, String actor) {
        validateOutcome(outcome);

        var stop = loadStop(stopId);
        if (stop.getStatus().isTerminal()) {
            throw alreadyFinalized(stop);
        }
        requireScheduleInProgress(stop);

        var completion = StopCompletion.builder()
            .arrivedAt(outcome.getArrivedAt())
            .startedAt(outcome.getStartedAt())
            .completedAt(outcome.getCompletedAt())
            .itemsRemoved(outcome.getItemsRemoved())
            .itemsInstalled(outcome.getItemsInstalled())
            .issues(outcome.getIssues())
            .customerFeedback(outcome.getCustomerFeedback())
            .photoUrls(collectPhotoUrls(stopId, outcome))
            .completedBy(actor)
            .build();

        /* The status check inside the update is what makes racing finalizations safe */
        var completed = scheduleRepository.updateStop(stopId, current -> {
            if (!current.getStatus().canFinalize()) {
                throw alreadyFinalized(current);
            }
            current.setStatus(StopStatus.COMPLETED);
            current.setCompletion(completion);
            return current;
        });

        logger.info("Stop {} (order {}) of schedule {} completed by {}",
            stopId, completed.getStopOrder(), completed.getScheduleId(), actor);

        resolveRequest(completed, RequestStatus.COMPLETED);

        var event = StopCompletedEvent.builder()
            .stopId(completed.getId())
            .scheduleId(completed.getScheduleId())
            .serviceRequestId(completed.getServiceRequestId())
            .customerId(completed.getCustomerId())
            .itemsRemoved(completion.getItemsRemoved())
            .itemsInstalled(completion.getItemsInstalled())
            .issues(completion.getIssues())
            .customerFeedback(completion.getCustomerFeedback())
            .completedBy(actor)
            .completedAt(completion.getCompletedAt())
            .build();

        return new StopCompletionResult(completed, signalDispatcher.dispatch(event));
    }

    @Override
    public Stop skipStop(String stopId, String reason, String actor) {
        var trimmed = reason == null ? "" : reason.trim();
        if (trimmed.length() < executionConfig.getMinSkipReasonLength()) {
            throw new ValidationException(ErrorCode.SKIP_REASON_TOO_SHORT, String.format(
                "Skip reason must be at least %d characters", executionConfig.getMinSkipReasonLength()));
        }
        if (trimmed.length() > executionConfig.getMaxSkipReasonLength()) {
            throw new ValidationException(ErrorCode.INVALID_INPUT, String.format(
                "Skip reason must be at most %d characters", executionConfig.getMaxSkipReasonLength()));
        }

        var stop = loadStop(stopId);
        if (stop.getStatus().isTerminal()) {
            throw alreadyFinalized(stop);
        }
        requireScheduleInProgress(stop);

        var skipped = scheduleRepository.updateStop(stopId, current -> {
            if (!current.getStatus().canFinalize()) {
                throw alreadyFinalized(current);
            }
            current.setStatus(StopStatus.CANCELLED);
            current.setSkipReason(trimmed);
            current.setSkippedBy(actor);
            return current;
        });

        logger.info("Stop {} (order {}) of schedule {} skipped by {}: {}",
            stopId, skipped.getStopOrder(), skipped.getScheduleId(), actor, trimmed);

        resolveRequest(skipped, RequestStatus.SKIPPED);
        return skipped;
    }

    @Override
    public Schedule completeSchedule(String scheduleId, String actor) {
        var schedule = scheduleRepository.findById(scheduleId)
            .orElseThrow(() -> new NotFoundException(ErrorCode.SCHEDULE_NOT_FOUND, "Schedule " + scheduleId + " not found"));

        if (!schedule.getStatus().canComplete()) {
            throw new ConflictException(ErrorCode.INVALID_SCHEDULE_STATUS, String.format(
                "Schedule %s is %s; only IN_PROGRESS schedules can be completed", scheduleId, schedule.getStatus()));
        }

        /* Terminal stop states never revert, so this check stays valid through the update below */
        var unfinished = schedule.unfinishedStops();
        if (!unfinished.isEmpty()) {
            throw new ConflictException(ErrorCode.SCHEDULE_NOT_FULLY_EXECUTED, String.format(
                "Schedule %s still has %d unfinished stops", scheduleId, unfinished.size()));
        }

        var now = clock.instant();
        var completed = scheduleRepository.updateSchedule(scheduleId, current -> {
            if (!current.getStatus().canComplete()) {
                throw new ConflictException(ErrorCode.INVALID_SCHEDULE_STATUS, String.format(
                    "Schedule %s is %s; only IN_PROGRESS schedules can be completed", scheduleId, current.getStatus()));
            }
            current.setStatus(ScheduleStatus.COMPLETED);
            current.setCompletedAt(now);
            current.setCompletedBy(actor);
            if (current.getStartedAt() != null) {
                current.setActualDurationMinutes(Duration.between(current.getStartedAt(), now).toMinutes());
            }
            return current;
        });

        long done = completed.getStops().stream().filter(stop -> stop.getStatus() == StopStatus.COMPLETED).count();
        logger.info("Schedule {} completed by {}: {} stops done, {} skipped, {} min",
            scheduleId, actor, done, completed.getStops().size() - done, completed.getActualDurationMinutes());
        return completed;
    }

    private Stop loadStop(String stopId) {
        return scheduleRepository.findStop(stopId)
            .orElseThrow(() -> new NotFoundException(ErrorCode.STOP_NOT_FOUND, "Stop " + stopId + " not found"));
    }

    private void requireScheduleInProgress(Stop stop) {
        var schedule = scheduleRepository.findById(stop.getScheduleId())
            .orElseThrow(() -> new NotFoundException(ErrorCode.SCHEDULE_NOT_FOUND,
                "Schedule " + stop.getScheduleId() + " not found"));

        if (schedule.getStatus() != ScheduleStatus.IN_PROGRESS) {
            throw new ConflictException(ErrorCode.INVALID_SCHEDULE_STATUS, String.format(
                "Stop %s belongs to schedule %s which is %s, not IN_PROGRESS",
                stop.getId(), schedule.getId(), schedule.getStatus()));
        }
    }

    private ConflictException alreadyFinalized(Stop stop) {
        return new ConflictException(ErrorCode.STOP_ALREADY_FINALIZED,
            String.format("Stop %s is already %s", stop.getId(), stop.getStatus()));
    }

    private void validateOutcome(CompleteStopRequest outcome) {
        if (outcome == null || outcome.getArrivedAt() == null
            || outcome.getStartedAt() == null || outcome.getCompletedAt() == null) {
            throw new ValidationException(ErrorCode.INVALID_INPUT,
                "Arrival, start and completion timestamps are required");
        }

        if (outcome.getStartedAt().isBefore(outcome.getArrivedAt())
            || outcome.getCompletedAt().isBefore(outcome.getStartedAt())) {
            throw new ValidationException(ErrorCode.NON_MONOTONIC_TIMESTAMPS, String.format(
                "Expected arrival (%s) <= start (%s) <= completion (%s)",
                outcome.getArrivedAt(), outcome.getStartedAt(), outcome.getCompletedAt()));
        }

        if (outcome.getItemsRemoved() < 0 || outcome.getItemsInstalled() < 0) {
            throw new ValidationException(ErrorCode.NEGATIVE_QUANTITY, "Handled quantities cannot be negative");
        }

        if (tooLong(outcome.getIssues()) || tooLong(outcome.getCustomerFeedback())) {
            throw new ValidationException(ErrorCode.INVALID_INPUT,
                String.format("Issues and feedback are limited to %d characters", MAX_NOTE_LENGTH));
        }

        if (outcome.getPhotoUrls() != null && outcome.getPhotoUrls().stream().anyMatch(url -> url == null || url.isBlank())) {
            throw new ValidationException(ErrorCode.INVALID_INPUT, "Photo URLs cannot be blank");
        }
    }

    private boolean tooLong(String note) {
        return note != null && note.length() > MAX_NOTE_LENGTH;
    }

    private List<String> collectPhotoUrls(String stopId, CompleteStopRequest outcome) {
        List<String> urls = new ArrayList<>();
        if (outcome.getPhotoUrls() != null) {
            urls.addAll(outcome.getPhotoUrls());
        }

        if (outcome.getPhotos() != null) {
            for (PhotoUpload photo : outcome.getPhotos()) {
                try {
                    urls.add(objectStorageService.upload(photo.getContent(), photo.getFilename()));
                } catch (RuntimeException ex) {
                    throw new UpstreamException(ErrorCode.PHOTO_UPLOAD_FAILED,
                        "Photo upload for stop " + stopId + " failed: " + ex.getMessage(), ex);
                }
            }
        }
        return List.copyOf(urls);
    }

    /* The stop is already committed; a missing request is reported, not fatal */
    private void resolveRequest(Stop stop, RequestStatus status) {
        if (stop.getServiceRequestId() == null) {
            return;
        }
        try {
            requestRepository.update(stop.getServiceRequestId(), request -> {
                request.setStatus(status);
                return request;
            });
        } catch (NotFoundException ex) {
            logger.warn("Stop {} references unknown service request {}", stop.getId(), stop.getServiceRequestId());
        }
    }
}
