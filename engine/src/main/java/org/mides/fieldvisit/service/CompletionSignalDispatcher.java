package org.mides.fieldvisit.service;

import org.mides.fieldvisit.config.ExecutionConfiguration;
import org.mides.fieldvisit.exception.ErrorCode;
import org.mides.fieldvisit.exception.NotFoundException;
import org.mides.fieldvisit.model.PendingSignal;
import org.mides.fieldvisit.model.StopCompletedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Delivers stop-completion events downstream. A failed delivery never affects the stop;
 * it is queued and retried until it succeeds or runs out of attempts, then parked until an operator
 * re-queues or discards it.
 */
@Component
public class CompletionSignalDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(CompletionSignalDispatcher.class);

    private final ICompletionSignalService signalService;
    private final ExecutionConfiguration executionConfig;

    /* Keyed by stop id, so a stop never has more than one queued signal */
    private final Map<String, PendingSignal> pending = new ConcurrentHashMap<>();
    private final Map<String, PendingSignal> parked = new ConcurrentHashMap<>();

    @Autowired
    public CompletionSignalDispatcher(ICompletionSignalService signalService, ExecutionConfiguration executionConfig) {
        this.signalService = signalService;
        this.executionConfig = executionConfig;
    }

    /**
     * @return whether the first delivery attempt succeeded
     */
    public boolean dispatch(StopCompletedEvent event) {
        try {
            signalService.publish(event);
            return true;
        } catch (RuntimeException ex) {
            logger.warn("Completion signal for stop {} failed, queued for retry: {}", event.getStopId(), ex.getMessage());
            pending.put(event.getStopId(), new PendingSignal(event, 1, ex.getMessage()));
            return false;
        }
    }

    @Scheduled(
        fixedDelayString = "${execution.signal-retry-interval:PT30S}",
        initialDelayString = "${execution.signal-retry-interval:PT30S}")
    public synchronized void retryPending() {
        for (var stopId : new ArrayList<>(pending.keySet())) {
            var signal = pending.get(stopId);
            if (signal == null) {
                continue;
            }

            try {
                signalService.publish(signal.getEvent());
                pending.remove(stopId);
                logger.info("Completion signal for stop {} delivered after {} failed attempts", stopId, signal.getAttempts());
            } catch (RuntimeException ex) {
                signal.setAttempts(signal.getAttempts() + 1);
                signal.setLastError(ex.getMessage());

                if (signal.getAttempts() >= executionConfig.getSignalMaxAttempts()) {
                    pending.remove(stopId);
                    parked.put(stopId, signal);
                    logger.error("Completion signal for stop {} parked after {} attempts: {}",
                        stopId, signal.getAttempts(), ex.getMessage());
                } else {
                    logger.warn("Completion signal for stop {} failed again (attempt {}): {}",
                        stopId, signal.getAttempts(), ex.getMessage());
                }
            }
        }
    }

    /**
     * Moves a parked signal back to the retry queue with a fresh attempt budget.
     */
    public synchronized PendingSignal requeueParked(String stopId) {
        var signal = parked.remove(stopId);
        if (signal == null) {
            throw new NotFoundException(ErrorCode.SIGNAL_NOT_FOUND, "No parked signal for stop " + stopId);
        }
        signal.setAttempts(0);
        pending.put(stopId, signal);
        logger.info("Parked completion signal for stop {} re-queued", stopId);
        return signal;
    }

    /**
     * Drops a parked signal, e.g. once the inventory change was recorded downstream by hand.
     */
    public synchronized PendingSignal discardParked(String stopId) {
        var signal = parked.remove(stopId);
        if (signal == null) {
            throw new NotFoundException(ErrorCode.SIGNAL_NOT_FOUND, "No parked signal for stop " + stopId);
        }
        logger.info("Parked completion signal for stop {} discarded", stopId);
        return signal;
    }

    public List<PendingSignal> pendingSignals() {
        return List.copyOf(pending.values());
    }

    public List<PendingSignal> parkedSignals() {
        return List.copyOf(parked.values());
    }
}
