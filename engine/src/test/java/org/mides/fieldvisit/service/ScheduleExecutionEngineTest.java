package org.mides.fieldvisit.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mides.fieldvisit.config.ExecutionConfiguration;
import org.mides.fieldvisit.exception.ConflictException;
import org.mides.fieldvisit.exception.ErrorCode;
import org.mides.fieldvisit.exception.FieldVisitException;
import org.mides.fieldvisit.exception.NotFoundException;
import org.mides.fieldvisit.exception.UpstreamException;
import org.mides.fieldvisit.exception.ValidationException;
import org.mides.fieldvisit.model.GeoPoint;
import org.mides.fieldvisit.model.RequestStatus;
import org.mides.fieldvisit.model.Schedule;
import org.mides.fieldvisit.model.ScheduleStatus;
import org.mides.fieldvisit.model.ServiceRequest;
import org.mides.fieldvisit.model.Stop;
import org.mides.fieldvisit.model.StopCompletedEvent;
import org.mides.fieldvisit.model.StopStatus;
import org.mides.fieldvisit.model.UrgencyTier;
import org.mides.fieldvisit.model.request.CompleteStopRequest;
import org.mides.fieldvisit.model.request.PhotoUpload;
import org.mides.fieldvisit.repository.InMemoryScheduleRepository;
import org.mides.fieldvisit.repository.InMemoryServiceRequestRepository;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ScheduleExecutionEngineTest {

    private static final Instant NOW = Instant.parse("2024-06-10T15:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2024, 6, 10);

    private InMemoryScheduleRepository scheduleRepository;
    private InMemoryServiceRequestRepository requestRepository;
    private IObjectStorageService objectStorageService;
    private ICompletionSignalService signalService;
    private CompletionSignalDispatcher signalDispatcher;
    private ScheduleExecutionEngine executionEngine;

    @BeforeEach
    void setUp() {
        scheduleRepository = new InMemoryScheduleRepository();
        requestRepository = new InMemoryServiceRequestRepository();
        objectStorageService = mock(IObjectStorageService.class);
        signalService = mock(ICompletionSignalService.class);

        var executionConfig = new ExecutionConfiguration();
        signalDispatcher = new CompletionSignalDispatcher(signalService, executionConfig);

        executionEngine = new ScheduleExecutionEngine(
            scheduleRepository,
            requestRepository,
            objectStorageService,
            signalDispatcher,
            executionConfig,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Schedule seedSchedule(ScheduleStatus status, int stopCount) {
        return seedSchedule(TODAY, status, stopCount);
    }

    private Schedule seedSchedule(LocalDate date, ScheduleStatus status, int stopCount) {
        List<Stop> stops = new ArrayList<>();
        for (int i = 1; i <= stopCount; i++) {
            var request = requestRepository.save(ServiceRequest.builder()
                .customerId("C" + i)
                .urgency(UrgencyTier.MEDIUM)
                .quantity(2)
                .status(RequestStatus.SCHEDULED)
                .build());

            stops.add(Stop.builder()
                .serviceRequestId(request.getId())
                .customerId(request.getCustomerId())
                .location(new GeoPoint(10.0 + i / 100.0, 106.0))
                .quantity(2)
                .stopOrder(i)
                .build());
        }

        return scheduleRepository.insert(Schedule.builder()
            .scheduleDate(date)
            .status(status)
            .startedAt(status == ScheduleStatus.IN_PROGRESS ? NOW.minus(Duration.ofHours(5)) : null)
            .stops(stops)
            .totalStops(stopCount)
            .build());
    }

    private CompleteStopRequest outcome() {
        return CompleteStopRequest.builder()
            .arrivedAt(NOW.minus(Duration.ofMinutes(40)))
            .startedAt(NOW.minus(Duration.ofMinutes(35)))
            .completedAt(NOW.minus(Duration.ofMinutes(5)))
            .itemsRemoved(2)
            .itemsInstalled(2)
            .issues("Root rot on one pot")
            .build();
    }

    private Stop reload(Stop stop) {
        return scheduleRepository.findStop(stop.getId()).orElseThrow();
    }

    @Test
    void startSchedule_approved_shouldMoveToInProgress() {
        var schedule = seedSchedule(ScheduleStatus.APPROVED, 2);

        var started = executionEngine.startSchedule(schedule.getId());

        assertEquals(ScheduleStatus.IN_PROGRESS, started.getStatus());
        assertEquals(NOW, started.getStartedAt());
    }

    @Test
    void startSchedule_alreadyStarted_shouldBeNoOp() {
        var schedule = seedSchedule(ScheduleStatus.IN_PROGRESS, 1);

        var again = executionEngine.startSchedule(schedule.getId());

        assertEquals(ScheduleStatus.IN_PROGRESS, again.getStatus());
        assertEquals(NOW.minus(Duration.ofHours(5)), again.getStartedAt());
    }

    @Test
    void startSchedule_draft_shouldConflict() {
        var schedule = seedSchedule(ScheduleStatus.DRAFT, 1);

        var ex = assertThrows(ConflictException.class, () -> executionEngine.startSchedule(schedule.getId()));

        assertEquals(ErrorCode.INVALID_SCHEDULE_STATUS, ex.getCode());
    }

    @Test
    void completeStop_validOutcome_shouldFinalizeAndSignalOnce() {
        var schedule = seedSchedule(ScheduleStatus.IN_PROGRESS, 2);
        var stop = schedule.getStops().get(0);

        var result = executionEngine.completeStop(stop.getId(), outcome(), "crew-7");

        assertTrue(result.isSignalDelivered());
        assertEquals(StopStatus.COMPLETED, result.getStop().getStatus());
        assertEquals(2, result.getStop().getCompletion().getItemsRemoved());
        assertEquals("crew-7", result.getStop().getCompletion().getCompletedBy());
        assertEquals(StopStatus.COMPLETED, reload(stop).getStatus());
        assertEquals(RequestStatus.COMPLETED, requestRepository.findById(stop.getServiceRequestId()).orElseThrow().getStatus());

        var captor = ArgumentCaptor.forClass(StopCompletedEvent.class);
        verify(signalService, times(1)).publish(captor.capture());
        assertEquals(stop.getId(), captor.getValue().getStopId());
        assertEquals(schedule.getId(), captor.getValue().getScheduleId());
        assertEquals("C1", captor.getValue().getCustomerId());
    }

    @Test
    void completeStop_finishBeforeStart_shouldRejectAndLeaveStopPending() {
        var schedule = seedSchedule(ScheduleStatus.IN_PROGRESS, 1);
        var stop = schedule.getStops().get(0);
        var outcome = outcome();
        outcome.setCompletedAt(outcome.getStartedAt().minusSeconds(60));

        var ex = assertThrows(ValidationException.class,
            () -> executionEngine.completeStop(stop.getId(), outcome, "crew-7"));

        assertEquals(ErrorCode.NON_MONOTONIC_TIMESTAMPS, ex.getCode());
        assertEquals(StopStatus.PENDING, reload(stop).getStatus());
        verifyNoInteractions(signalService);
    }

    @Test
    void completeStop_equalTimestamps_shouldBeAccepted() {
        var schedule = seedSchedule(ScheduleStatus.IN_PROGRESS, 1);
        var stop = schedule.getStops().get(0);
        var outcome = outcome();
        outcome.setStartedAt(outcome.getArrivedAt());
        outcome.setCompletedAt(outcome.getArrivedAt());

        var result = executionEngine.completeStop(stop.getId(), outcome, "crew-7");

        assertEquals(StopStatus.COMPLETED, result.getStop().getStatus());
    }

    @Test
    void completeStop_negativeQuantity_shouldReject() {
        var schedule = seedSchedule(ScheduleStatus.IN_PROGRESS, 1);
        var outcome = outcome();
        outcome.setItemsInstalled(-1);

        var ex = assertThrows(ValidationException.class,
            () -> executionEngine.completeStop(schedule.getStops().get(0).getId(), outcome, "crew-7"));

        assertEquals(ErrorCode.NEGATIVE_QUANTITY, ex.getCode());
    }

    @Test
    void completeStop_twice_shouldConflictAndSignalOnlyOnce() {
        var schedule = seedSchedule(ScheduleStatus.IN_PROGRESS, 1);
        var stopId = schedule.getStops().get(0).getId();
        executionEngine.completeStop(stopId, outcome(), "crew-7");

        var ex = assertThrows(ConflictException.class, () -> executionEngine.completeStop(stopId, outcome(), "crew-7"));

        assertEquals(ErrorCode.STOP_ALREADY_FINALIZED, ex.getCode());
        verify(signalService, times(1)).publish(any());
    }

    @Test
    void completeStop_scheduleNotStarted_shouldConflict() {
        var schedule = seedSchedule(ScheduleStatus.APPROVED, 1);

        var ex = assertThrows(ConflictException.class,
            () -> executionEngine.completeStop(schedule.getStops().get(0).getId(), outcome(), "crew-7"));

        assertEquals(ErrorCode.INVALID_SCHEDULE_STATUS, ex.getCode());
    }

    @Test
    void completeStop_unknownStop_shouldBeNotFound() {
        var ex = assertThrows(NotFoundException.class,
            () -> executionEngine.completeStop("missing", outcome(), "crew-7"));

        assertEquals(ErrorCode.STOP_NOT_FOUND, ex.getCode());
    }

    @Test
    void completeStop_withPhotos_shouldStoreUploadedUrls() {
        var schedule = seedSchedule(ScheduleStatus.IN_PROGRESS, 1);
        var outcome = outcome();
        outcome.setPhotoUrls(List.of("https://cdn.example/existing.jpg"));
        outcome.setPhotos(List.of(new PhotoUpload("after.jpg", new byte[]{1, 2, 3})));
        when(objectStorageService.upload(any(), eq("after.jpg"))).thenReturn("https://cdn.example/after.jpg");

        var result = executionEngine.completeStop(schedule.getStops().get(0).getId(), outcome, "crew-7");

        assertEquals(List.of("https://cdn.example/existing.jpg", "https://cdn.example/after.jpg"),
            result.getStop().getCompletion().getPhotoUrls());
    }

    @Test
    void completeStop_photoUploadFails_shouldLeaveStopUntouched() {
        var schedule = seedSchedule(ScheduleStatus.IN_PROGRESS, 1);
        var stop = schedule.getStops().get(0);
        var outcome = outcome();
        outcome.setPhotos(List.of(new PhotoUpload("after.jpg", new byte[]{1})));
        when(objectStorageService.upload(any(), anyString())).thenThrow(new IllegalStateException("bucket offline"));

        var ex = assertThrows(UpstreamException.class, () -> executionEngine.completeStop(stop.getId(), outcome, "crew-7"));

        assertEquals(ErrorCode.PHOTO_UPLOAD_FAILED, ex.getCode());
        assertEquals(StopStatus.PENDING, reload(stop).getStatus());
        verifyNoInteractions(signalService);
    }

    @Test
    void completeStop_signalFails_shouldKeepStopCompletedAndQueueRetry() {
        var schedule = seedSchedule(ScheduleStatus.IN_PROGRESS, 1);
        var stop = schedule.getStops().get(0);
        doThrow(new IllegalStateException("receiver down")).when(signalService).publish(any());

        var result = executionEngine.completeStop(stop.getId(), outcome(), "crew-7");

        assertFalse(result.isSignalDelivered());
        assertEquals(StopStatus.COMPLETED, reload(stop).getStatus());
        assertEquals(1, signalDispatcher.pendingSignals().size());
        assertEquals(stop.getId(), signalDispatcher.pendingSignals().get(0).getEvent().getStopId());
    }

    @Test
    void skipStop_shortReason_shouldReject() {
        var schedule = seedSchedule(ScheduleStatus.IN_PROGRESS, 1);
        var stopId = schedule.getStops().get(0).getId();

        var ex = assertThrows(ValidationException.class, () -> executionEngine.skipStop(stopId, "   no one   ", "crew-7"));

        assertEquals(ErrorCode.SKIP_REASON_TOO_SHORT, ex.getCode());
        assertThrows(ValidationException.class, () -> executionEngine.skipStop(stopId, null, "crew-7"));
    }

    @Test
    void skipStop_validReason_shouldCancelAndReleaseRequest() {
        var schedule = seedSchedule(ScheduleStatus.IN_PROGRESS, 1);
        var stop = schedule.getStops().get(0);

        var skipped = executionEngine.skipStop(stop.getId(), "  Customer not at home  ", "crew-7");

        assertEquals(StopStatus.CANCELLED, skipped.getStatus());
        assertEquals("Customer not at home", skipped.getSkipReason());
        assertEquals("crew-7", skipped.getSkippedBy());
        assertNull(skipped.getCompletion());
        assertEquals(RequestStatus.SKIPPED, requestRepository.findById(stop.getServiceRequestId()).orElseThrow().getStatus());
        verifyNoInteractions(signalService);
    }

    @Test
    void skipStop_afterCompletion_shouldConflict() {
        var schedule = seedSchedule(ScheduleStatus.IN_PROGRESS, 1);
        var stopId = schedule.getStops().get(0).getId();
        executionEngine.completeStop(stopId, outcome(), "crew-7");

        var ex = assertThrows(ConflictException.class,
            () -> executionEngine.skipStop(stopId, "Customer not at home", "crew-7"));

        assertEquals(ErrorCode.STOP_ALREADY_FINALIZED, ex.getCode());
        assertEquals(StopStatus.COMPLETED, scheduleRepository.findStop(stopId).orElseThrow().getStatus());
    }

    @Test
    void startStop_shouldMoveToInProgressOnce() {
        var schedule = seedSchedule(ScheduleStatus.IN_PROGRESS, 1);
        var stopId = schedule.getStops().get(0).getId();

        assertEquals(StopStatus.IN_PROGRESS, executionEngine.startStop(stopId).getStatus());
        assertEquals(StopStatus.IN_PROGRESS, executionEngine.startStop(stopId).getStatus());

        executionEngine.completeStop(stopId, outcome(), "crew-7");
        var ex = assertThrows(ConflictException.class, () -> executionEngine.startStop(stopId));
        assertEquals(ErrorCode.STOP_ALREADY_FINALIZED, ex.getCode());
    }

    @Test
    void racingCompleteAndSkip_shouldHaveExactlyOneWinner() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 25; round++) {
                var schedule = seedSchedule(TODAY.plusDays(round + 1), ScheduleStatus.IN_PROGRESS, 1);
                var stopId = schedule.getStops().get(0).getId();
                var gate = new CountDownLatch(1);

                Callable<Object> complete = () -> {
                    gate.await();
                    return executionEngine.completeStop(stopId, outcome(), "crew-a");
                };
                Callable<Object> skip = () -> {
                    gate.await();
                    return executionEngine.skipStop(stopId, "Gate locked, nobody answered", "crew-b");
                };

                List<Future<Object>> futures = List.of(pool.submit(complete), pool.submit(skip));
                gate.countDown();

                int winners = 0;
                int conflicts = 0;
                for (var future : futures) {
                    try {
                        future.get();
                        winners++;
                    } catch (ExecutionException ex) {
                        var cause = assertInstanceOf(FieldVisitException.class, ex.getCause());
                        assertEquals(ErrorCode.STOP_ALREADY_FINALIZED, cause.getCode());
                        conflicts++;
                    }
                }

                assertEquals(1, winners);
                assertEquals(1, conflicts);
                assertTrue(scheduleRepository.findStop(stopId).orElseThrow().getStatus().isTerminal());
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void completeSchedule_withUnfinishedStops_shouldConflict() {
        var schedule = seedSchedule(ScheduleStatus.IN_PROGRESS, 2);
        executionEngine.completeStop(schedule.getStops().get(0).getId(), outcome(), "crew-7");

        var ex = assertThrows(ConflictException.class, () -> executionEngine.completeSchedule(schedule.getId(), "lead"));

        assertEquals(ErrorCode.SCHEDULE_NOT_FULLY_EXECUTED, ex.getCode());
        assertEquals(ScheduleStatus.IN_PROGRESS, scheduleRepository.findById(schedule.getId()).orElseThrow().getStatus());
    }

    @Test
    void completeSchedule_allStopsTerminal_shouldCompleteOnce() {
        var schedule = seedSchedule(ScheduleStatus.IN_PROGRESS, 2);
        executionEngine.completeStop(schedule.getStops().get(0).getId(), outcome(), "crew-7");
        executionEngine.skipStop(schedule.getStops().get(1).getId(), "Customer moved away", "crew-7");

        var completed = executionEngine.completeSchedule(schedule.getId(), "lead");

        assertEquals(ScheduleStatus.COMPLETED, completed.getStatus());
        assertEquals(NOW, completed.getCompletedAt());
        assertEquals("lead", completed.getCompletedBy());
        assertEquals(300L, completed.getActualDurationMinutes());

        var ex = assertThrows(ConflictException.class, () -> executionEngine.completeSchedule(schedule.getId(), "lead"));
        assertEquals(ErrorCode.INVALID_SCHEDULE_STATUS, ex.getCode());
    }
}
