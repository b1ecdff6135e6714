package org.mides.fieldvisit.service;

import org.mides.fieldvisit.model.ScoredRequest;
import org.mides.fieldvisit.model.ServiceRequest;

import java.time.Instant;
import java.util.List;

public interface IPriorityScorer {
    int MIN_SCORE = 0;
    int MAX_SCORE = 100;

    int score(ServiceRequest request, Instant now);

    /**
     * Highest score first; equal scores keep the oldest request first.
     */
    List<ScoredRequest> rank(List<ServiceRequest> requests, Instant now);
}
