package org.mides.fieldvisit.controller;

import org.mides.fieldvisit.model.PendingSignal;
import org.mides.fieldvisit.model.SignalBacklog;
import org.mides.fieldvisit.service.CompletionSignalDispatcher;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@CrossOrigin(origins = "*")
@RequestMapping("signals")
public class SignalController {

    private final CompletionSignalDispatcher signalDispatcher;

    @Autowired
    public SignalController(CompletionSignalDispatcher signalDispatcher) {
        this.signalDispatcher = signalDispatcher;
    }

    @GetMapping("/pending")
    public ResponseEntity<SignalBacklog> pending() {
        return ResponseEntity.ok(new SignalBacklog(signalDispatcher.pendingSignals(), signalDispatcher.parkedSignals()));
    }

    @PostMapping("/parked/{stopId}/requeue")
    public ResponseEntity<PendingSignal> requeue(@PathVariable String stopId) {
        return ResponseEntity.ok(signalDispatcher.requeueParked(stopId));
    }

    @DeleteMapping("/parked/{stopId}")
    public ResponseEntity<Void> discard(@PathVariable String stopId) {
        signalDispatcher.discardParked(stopId);
        return ResponseEntity.noContent().build();
    }
}
