package org.mides.fieldvisit.controller;

import jakarta.validation.Valid;
import org.mides.fieldvisit.model.Stop;
import org.mides.fieldvisit.model.StopCompletionResult;
import org.mides.fieldvisit.model.request.CompleteStopRequest;
import org.mides.fieldvisit.model.request.SkipStopRequest;
import org.mides.fieldvisit.service.IScheduleExecutionEngine;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import static org.mides.fieldvisit.controller.ScheduleController.ACTOR_HEADER;
import static org.mides.fieldvisit.controller.ScheduleController.DEFAULT_ACTOR;

@Validated
@RestController
@CrossOrigin(origins = "*")
@RequestMapping("stops")
public class StopController {

    private final IScheduleExecutionEngine executionEngine;

    @Autowired
    public StopController(IScheduleExecutionEngine executionEngine) {
        this.executionEngine = executionEngine;
    }

    @PostMapping("/{id}/start")
    public ResponseEntity<Stop> start(@PathVariable String id) {
        return ResponseEntity.ok(executionEngine.startStop(id));
    }

    @PostMapping("/{id}/complete")
    public ResponseEntity<StopCompletionResult> complete(
        @PathVariable String id,
        @RequestBody @Valid CompleteStopRequest request,
        @RequestHeader(name = ACTOR_HEADER, defaultValue = DEFAULT_ACTOR) String actor)
    {
        return ResponseEntity.ok(executionEngine.completeStop(id, request, actor));
    }

    @PostMapping("/{id}/skip")
    public ResponseEntity<Stop> skip(
        @PathVariable String id,
        @RequestBody SkipStopRequest request,
        @RequestHeader(name = ACTOR_HEADER, defaultValue = DEFAULT_ACTOR) String actor)
    {
        return ResponseEntity.ok(executionEngine.skipStop(id, request.getReason(), actor));
    }
}
