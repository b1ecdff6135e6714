package org.mides.fieldvisit.service;

import org.mides.fieldvisit.config.RoutingConfiguration;
import org.mides.fieldvisit.exception.ConflictException;
import org.mides.fieldvisit.exception.ErrorCode;
import org.mides.fieldvisit.exception.NotFoundException;
import org.mides.fieldvisit.exception.ValidationException;
import org.mides.fieldvisit.model.RequestStatus;
import org.mides.fieldvisit.model.RouteResult;
import org.mides.fieldvisit.model.RouteSource;
import org.mides.fieldvisit.model.Schedule;
import org.mides.fieldvisit.model.ScheduleStats;
import org.mides.fieldvisit.model.ScheduleStatus;
import org.mides.fieldvisit.model.ScoredRequest;
import org.mides.fieldvisit.model.ServiceRequest;
import org.mides.fieldvisit.model.Stop;
import org.mides.fieldvisit.model.request.CreateScheduleRequest;
import org.mides.fieldvisit.repository.IScheduleRepository;
import org.mides.fieldvisit.repository.IServiceRequestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class SchedulePlanner implements ISchedulePlanner {

    private static final Logger logger = LoggerFactory.getLogger(SchedulePlanner.class);

    private final IScheduleRepository scheduleRepository;
    private final IServiceRequestRepository requestRepository;
    private final IPriorityScorer priorityScorer;
    private final IRouteOptimizer routeOptimizer;
    private final RoutingConfiguration routingConfig;
    private final Clock clock;

    @Autowired
    public SchedulePlanner(
        IScheduleRepository scheduleRepository,
        IServiceRequestRepository requestRepository,
        IPriorityScorer priorityScorer,
        IRouteOptimizer routeOptimizer,
        RoutingConfiguration routingConfig,
        Clock clock)
    {
        this.scheduleRepository = scheduleRepository;
        this.requestRepository = requestRepository;
        this.priorityScorer = priorityScorer;
        this.routeOptimizer = routeOptimizer;
        this.routingConfig = routingConfig;
        this.clock = clock;
    }

    @Override
    public Schedule createSchedule(CreateScheduleRequest request, String actor) {
        var date = request.getScheduleDate();
        if (date == null) {
            throw new ValidationException(ErrorCode.INVALID_INPUT, "Schedule date is required");
        }
        if (scheduleRepository.findByDate(date).isPresent()) {
            throw new ConflictException(ErrorCode.DUPLICATE_SCHEDULE, "A schedule already exists for " + date);
        }

        var now = clock.instant();
        var ids = request.getServiceRequestIds();
        var selected = ids == null || ids.isEmpty()
            ? selectPending(date, now)
            : selectExplicit(ids, now);

        for (var candidate : selected) {
            if (candidate.getLocation() == null || !candidate.getLocation().isValid()) {
                throw new ValidationException(ErrorCode.INVALID_COORDINATES,
                    "Service request " + candidate.getId() + " has missing or invalid coordinates");
            }
        }

        var claimed = claimRequests(selected);
        try {
            var saved = buildAndInsert(request, selected, actor, now);
            logger.info("Schedule {} created for {} by {}: {} stops, {} items, source {}",
                saved.getId(), date, actor, saved.getTotalStops(), saved.getTotalItems(), saved.getRouteSource());
            return saved;
        } catch (RuntimeException ex) {
            releaseRequests(claimed);
            throw ex;
        }
    }

    @Override
    public Schedule approveSchedule(String scheduleId, String actor) {
        var approved = scheduleRepository.updateSchedule(scheduleId, current -> {
            if (!current.getStatus().canApprove()) {
                throw new ConflictException(ErrorCode.INVALID_SCHEDULE_STATUS, String.format(
                    "Schedule %s is %s; only DRAFT schedules can be approved", scheduleId, current.getStatus()));
            }
            current.setStatus(ScheduleStatus.APPROVED);
            current.setApprovedBy(actor);
            current.setApprovedAt(clock.instant());
            return current;
        });

        logger.info("Schedule {} for {} approved by {}", scheduleId, approved.getScheduleDate(), actor);
        return approved;
    }

    @Override
    public Schedule reorderStops(String scheduleId, List<String> orderedStopIds) {
        var schedule = getSchedule(scheduleId);
        requireEditable(schedule);

        var byId = schedule.getStops().stream().collect(Collectors.toMap(Stop::getId, Function.identity()));
        validatePermutation(byId, orderedStopIds);

        var ordered = orderedStopIds.stream().map(byId::get).toList();
        var route = routeOptimizer.estimate(ordered, schedule.getStartPoint(), null);

        var placedById = route.getStops().stream().collect(Collectors.toMap(Stop::getId, Function.identity()));
        var updated = scheduleRepository.updateScheduleAndStops(scheduleId, current -> {
            requireEditable(current);
            applyRoute(current, route);
            for (var stop : current.getStops()) {
                var placed = placedById.get(stop.getId());
                stop.setStopOrder(placed.getStopOrder());
                stop.setPlannedArrival(placed.getPlannedArrival());
                stop.setEta(placed.getEta());
            }
            return current;
        });

        logger.info("Schedule {} for {} reordered manually: {}", scheduleId, updated.getScheduleDate(), orderedStopIds);
        return updated;
    }

    @Override
    public Schedule getSchedule(String scheduleId) {
        return scheduleRepository.findById(scheduleId)
            .orElseThrow(() -> new NotFoundException(ErrorCode.SCHEDULE_NOT_FOUND, "Schedule " + scheduleId + " not found"));
    }

    @Override
    public Schedule getScheduleByDate(LocalDate date) {
        return scheduleRepository.findByDate(date)
            .orElseThrow(() -> new NotFoundException(ErrorCode.SCHEDULE_NOT_FOUND, "No schedule for " + date));
    }

    @Override
    public ScheduleStats getStats() {
        Map<ScheduleStatus, Long> counts = scheduleRepository.findAll().stream()
            .collect(Collectors.groupingBy(Schedule::getStatus, Collectors.counting()));

        return new ScheduleStats(
            counts.values().stream().mapToLong(Long::longValue).sum(),
            counts.getOrDefault(ScheduleStatus.DRAFT, 0L),
            counts.getOrDefault(ScheduleStatus.APPROVED, 0L),
            counts.getOrDefault(ScheduleStatus.IN_PROGRESS, 0L),
            counts.getOrDefault(ScheduleStatus.COMPLETED, 0L));
    }

    private List<ServiceRequest> selectPending(LocalDate date, Instant now) {
        var eligible = requestRepository.findByStatus(RequestStatus.PENDING).stream()
            .filter(request -> request.getPreferredDate() == null || !request.getPreferredDate().isAfter(date))
            .toList();

        var selected = priorityScorer.rank(eligible, now).stream()
            .limit(routingConfig.getMaxStopsPerDay())
            .map(ScoredRequest::getRequest)
            .toList();

        if (selected.isEmpty()) {
            throw new ValidationException(ErrorCode.EMPTY_STOP_SET, "No pending service requests are due by " + date);
        }

        logger.debug("Selected {} of {} eligible pending requests for {}", selected.size(), eligible.size(), date);
        return selected;
    }

    private List<ServiceRequest> selectExplicit(List<String> ids, Instant now) {
        var distinct = List.copyOf(new LinkedHashSet<>(ids));
        var found = requestRepository.findAllById(distinct);

        if (found.size() != distinct.size()) {
            var foundIds = found.stream().map(ServiceRequest::getId).collect(Collectors.toSet());
            var missing = distinct.stream().filter(id -> !foundIds.contains(id)).toList();
            throw new ValidationException(ErrorCode.INVALID_REQUESTS, "Unknown service requests: " + missing);
        }

        var unavailable = found.stream()
            .filter(request -> !request.getStatus().isSchedulable())
            .map(request -> request.getId() + " (" + request.getStatus() + ")")
            .toList();
        if (!unavailable.isEmpty()) {
            throw new ValidationException(ErrorCode.INVALID_REQUESTS, "Service requests cannot be scheduled: " + unavailable);
        }

        return priorityScorer.rank(found, now).stream().map(ScoredRequest::getRequest).toList();
    }

    private Schedule buildAndInsert(CreateScheduleRequest request, List<ServiceRequest> selected, String actor, Instant now) {
        var stops = selected.stream().map(this::toStop).toList();
        var route = routeOptimizer.optimize(stops, request.getStartPoint(), null);

        var schedule = Schedule.builder()
            .scheduleDate(request.getScheduleDate())
            .status(ScheduleStatus.DRAFT)
            .startPoint(request.getStartPoint())
            .stops(route.getStops())
            .totalStops(route.getStops().size())
            .totalItems(route.getStops().stream().mapToInt(Stop::getQuantity).sum())
            .notes(request.getNotes())
            .createdBy(actor)
            .createdAt(now)
            .build();
        applyRoute(schedule, route);

        return scheduleRepository.insert(schedule);
    }

    /**
     * Moves each request to SCHEDULED, re-checking its status in the same atomic step.
     * Returns the previous status of every claimed request so the claim can be undone.
     */
    private Map<String, RequestStatus> claimRequests(List<ServiceRequest> selected) {
        Map<String, RequestStatus> claimed = new LinkedHashMap<>();
        try {
            for (var candidate : selected) {
                requestRepository.update(candidate.getId(), current -> {
                    if (!current.getStatus().isSchedulable()) {
                        throw new ConflictException(ErrorCode.INVALID_REQUESTS, String.format(
                            "Service request %s is %s and cannot be scheduled", current.getId(), current.getStatus()));
                    }
                    claimed.put(current.getId(), current.getStatus());
                    current.setStatus(RequestStatus.SCHEDULED);
                    return current;
                });
            }
        } catch (RuntimeException ex) {
            releaseRequests(claimed);
            throw ex;
        }
        return claimed;
    }

    private void releaseRequests(Map<String, RequestStatus> claimed) {
        claimed.forEach((requestId, previous) -> requestRepository.update(requestId, current -> {
            if (current.getStatus() == RequestStatus.SCHEDULED) {
                current.setStatus(previous);
            }
            return current;
        }));
        if (!claimed.isEmpty()) {
            logger.debug("Released {} claimed service requests", claimed.size());
        }
    }

    private void validatePermutation(Map<String, Stop> stopsById, List<String> orderedStopIds) {
        if (orderedStopIds == null || orderedStopIds.size() != stopsById.size()
            || new HashSet<>(orderedStopIds).size() != orderedStopIds.size()
            || !stopsById.keySet().containsAll(orderedStopIds))
        {
            throw new ValidationException(ErrorCode.INVALID_STOP_ORDER,
                "Stop order must list each of the schedule's " + stopsById.size() + " stops exactly once");
        }
    }

    private void requireEditable(Schedule schedule) {
        if (!schedule.getStatus().isEditable()) {
            throw new ConflictException(ErrorCode.INVALID_SCHEDULE_STATUS, String.format(
                "Schedule %s is %s; stops can only be reordered on a DRAFT", schedule.getId(), schedule.getStatus()));
        }
    }

    private void applyRoute(Schedule schedule, RouteResult route) {
        schedule.setEstimatedDistanceKm(route.getTotalDistanceKm());
        schedule.setApproximateDistanceKm(route.getApproximateDistanceKm());
        schedule.setEstimatedDurationMinutes(route.getTotalDurationMinutes());
        schedule.setRouteSource(route.getSource());
        schedule.setOptimized(route.getSource() != RouteSource.MANUAL);
        schedule.setPolyline(route.getPolyline());
    }

    private Stop toStop(ServiceRequest request) {
        return Stop.builder()
            .serviceRequestId(request.getId())
            .customerId(request.getCustomerId())
            .customerName(request.getCustomerName())
            .address(request.getAddress())
            .location(request.getLocation())
            .estimatedDurationMinutes(request.getEstimatedDurationMinutes())
            .quantity(request.getQuantity())
            .build();
    }
}
