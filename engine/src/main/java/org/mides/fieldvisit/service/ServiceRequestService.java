package org.mides.fieldvisit.service;

import org.mides.fieldvisit.model.CustomerTier;
import org.mides.fieldvisit.model.RequestStatus;
import org.mides.fieldvisit.model.ScoredRequest;
import org.mides.fieldvisit.model.ServiceRequest;
import org.mides.fieldvisit.repository.IServiceRequestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

@Service
public class ServiceRequestService implements IServiceRequestService {

    private static final Logger logger = LoggerFactory.getLogger(ServiceRequestService.class);

    private final IServiceRequestRepository requestRepository;
    private final IPriorityScorer priorityScorer;
    private final Clock clock;

    @Autowired
    public ServiceRequestService(IServiceRequestRepository requestRepository, IPriorityScorer priorityScorer, Clock clock) {
        this.requestRepository = requestRepository;
        this.priorityScorer = priorityScorer;
        this.clock = clock;
    }

    @Override
    public ServiceRequest register(ServiceRequest request) {
        var pending = request.toBuilder()
            .id(null)
            .status(RequestStatus.PENDING)
            .customerTier(request.getCustomerTier() != null ? request.getCustomerTier() : CustomerTier.STANDARD)
            .createdAt(request.getCreatedAt() != null ? request.getCreatedAt() : clock.instant())
            .build();

        var saved = requestRepository.save(pending);
        logger.info("Service request {} registered for customer {} ({}, qty {})",
            saved.getId(), saved.getCustomerId(), saved.getUrgency(), saved.getQuantity());
        return saved;
    }

    @Override
    public List<ScoredRequest> rankedPending() {
        return priorityScorer.rank(requestRepository.findByStatus(RequestStatus.PENDING), clock.instant());
    }
}
