package org.mides.fieldvisit.repository;

import org.mides.fieldvisit.exception.ConflictException;
import org.mides.fieldvisit.exception.ErrorCode;
import org.mides.fieldvisit.exception.NotFoundException;
import org.mides.fieldvisit.model.Schedule;
import org.mides.fieldvisit.model.Stop;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

@Repository
public class InMemoryScheduleRepository implements IScheduleRepository {

    /* Headers are stored without stops; stops live in their own map */
    private final Map<String, Schedule> schedules = new ConcurrentHashMap<>();
    private final Map<LocalDate, String> scheduleIdsByDate = new ConcurrentHashMap<>();
    private final Map<String, Stop> stops = new ConcurrentHashMap<>();
    private final Map<String, List<String>> stopIdsBySchedule = new ConcurrentHashMap<>();

    @Override
    public Schedule insert(Schedule schedule) {
        var scheduleId = schedule.getId() != null ? schedule.getId() : UUID.randomUUID().toString();

        if (scheduleIdsByDate.putIfAbsent(schedule.getScheduleDate(), scheduleId) != null) {
            throw new ConflictException(ErrorCode.DUPLICATE_SCHEDULE,
                "A schedule already exists for " + schedule.getScheduleDate());
        }

        List<String> stopIds = new ArrayList<>();
        for (var stop : schedule.getStops()) {
            var stored = stop.copy();
            if (stored.getId() == null) {
                stored.setId(UUID.randomUUID().toString());
            }
            stored.setScheduleId(scheduleId);
            stops.put(stored.getId(), stored);
            stopIds.add(stored.getId());
        }
        stopIdsBySchedule.put(scheduleId, List.copyOf(stopIds));

        schedules.put(scheduleId, header(schedule.toBuilder().id(scheduleId).build()));
        return assemble(schedules.get(scheduleId));
    }

    @Override
    public Optional<Schedule> findById(String scheduleId) {
        return Optional.ofNullable(schedules.get(scheduleId)).map(this::assemble);
    }

    @Override
    public Optional<Schedule> findByDate(LocalDate date) {
        return Optional.ofNullable(scheduleIdsByDate.get(date)).flatMap(this::findById);
    }

    @Override
    public List<Schedule> findAll() {
        return schedules.values().stream()
            .map(this::assemble)
            .sorted(Comparator.comparing(Schedule::getScheduleDate).reversed())
            .toList();
    }

    @Override
    public Optional<Stop> findStop(String stopId) {
        return Optional.ofNullable(stops.get(stopId)).map(Stop::copy);
    }

    @Override
    public Stop updateStop(String stopId, UnaryOperator<Stop> transition) {
        var updated = stops.compute(stopId, (id, current) -> {
            if (current == null) {
                throw new NotFoundException(ErrorCode.STOP_NOT_FOUND, "Stop " + stopId + " not found");
            }
            return transition.apply(current.copy());
        });
        return updated.copy();
    }

    @Override
    public Schedule updateSchedule(String scheduleId, UnaryOperator<Schedule> transition) {
        var updated = schedules.compute(scheduleId, (id, current) -> {
            if (current == null) {
                throw new NotFoundException(ErrorCode.SCHEDULE_NOT_FOUND, "Schedule " + scheduleId + " not found");
            }
            return header(transition.apply(current.toBuilder().build()));
        });
        return assemble(updated);
    }

    @Override
    public Schedule updateScheduleAndStops(String scheduleId, UnaryOperator<Schedule> transition) {
        var updated = schedules.compute(scheduleId, (id, current) -> {
            if (current == null) {
                throw new NotFoundException(ErrorCode.SCHEDULE_NOT_FOUND, "Schedule " + scheduleId + " not found");
            }
            var result = transition.apply(assemble(current));

            var owned = stopIdsBySchedule.getOrDefault(id, List.of());
            for (var stop : result.getStops()) {
                if (!owned.contains(stop.getId())) {
                    throw new IllegalArgumentException("Stop " + stop.getId() + " does not belong to schedule " + id);
                }
            }
            for (var stop : result.getStops()) {
                var stored = stop.copy();
                stored.setScheduleId(id);
                stops.put(stored.getId(), stored);
            }
            return header(result);
        });
        return assemble(updated);
    }

    private Schedule header(Schedule schedule) {
        return schedule.toBuilder().stops(new ArrayList<>()).build();
    }

    private Schedule assemble(Schedule header) {
        var ownedStops = stopIdsBySchedule.getOrDefault(header.getId(), List.of()).stream()
            .map(stops::get)
            .map(Stop::copy)
            .sorted(Comparator.comparingInt(Stop::getStopOrder))
            .toList();
        return header.toBuilder().stops(new ArrayList<>(ownedStops)).build();
    }
}
