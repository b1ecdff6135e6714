package org.mides.fieldvisit.service;

import org.mides.fieldvisit.model.ScoredRequest;
import org.mides.fieldvisit.model.ServiceRequest;

import java.util.List;

public interface IServiceRequestService {
    ServiceRequest register(ServiceRequest request);

    List<ScoredRequest> rankedPending();
}
