package org.mides.fieldvisit.controller;

import jakarta.validation.Valid;
import org.mides.fieldvisit.model.Schedule;
import org.mides.fieldvisit.model.ScheduleStats;
import org.mides.fieldvisit.model.request.CreateScheduleRequest;
import org.mides.fieldvisit.model.request.ReorderStopsRequest;
import org.mides.fieldvisit.service.ISchedulePlanner;
import org.mides.fieldvisit.service.IScheduleExecutionEngine;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

@Validated
@RestController
@CrossOrigin(origins = "*")
@RequestMapping("schedules")
public class ScheduleController {

    static final String ACTOR_HEADER = "X-Actor-Id";
    static final String DEFAULT_ACTOR = "system";

    private final ISchedulePlanner schedulePlanner;
    private final IScheduleExecutionEngine executionEngine;

    @Autowired
    public ScheduleController(ISchedulePlanner schedulePlanner, IScheduleExecutionEngine executionEngine) {
        this.schedulePlanner = schedulePlanner;
        this.executionEngine = executionEngine;
    }

    @PostMapping
    public ResponseEntity<Schedule> create(
        @RequestBody @Valid CreateScheduleRequest request,
        @RequestHeader(name = ACTOR_HEADER, defaultValue = DEFAULT_ACTOR) String actor)
    {
        return ResponseEntity.status(HttpStatus.CREATED).body(schedulePlanner.createSchedule(request, actor));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Schedule> get(@PathVariable String id) {
        return ResponseEntity.ok(schedulePlanner.getSchedule(id));
    }

    @GetMapping
    public ResponseEntity<Schedule> getByDate(@RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(schedulePlanner.getScheduleByDate(date));
    }

    @GetMapping("/stats")
    public ResponseEntity<ScheduleStats> stats() {
        return ResponseEntity.ok(schedulePlanner.getStats());
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<Schedule> approve(
        @PathVariable String id,
        @RequestHeader(name = ACTOR_HEADER, defaultValue = DEFAULT_ACTOR) String actor)
    {
        return ResponseEntity.ok(schedulePlanner.approveSchedule(id, actor));
    }

    @PutMapping("/{id}/stops/order")
    public ResponseEntity<Schedule> reorder(@PathVariable String id, @RequestBody @Valid ReorderStopsRequest request) {
        return ResponseEntity.ok(schedulePlanner.reorderStops(id, request.getStopIds()));
    }

    @PostMapping("/{id}/start")
    public ResponseEntity<Schedule> start(@PathVariable String id) {
        return ResponseEntity.ok(executionEngine.startSchedule(id));
    }

    @PostMapping("/{id}/complete")
    public ResponseEntity<Schedule> complete(
        @PathVariable String id,
        @RequestHeader(name = ACTOR_HEADER, defaultValue = DEFAULT_ACTOR) String actor)
    {
        return ResponseEntity.ok(executionEngine.completeSchedule(id, actor));
    }
}
