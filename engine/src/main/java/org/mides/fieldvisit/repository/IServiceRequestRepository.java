package org.mides.fieldvisit.repository;

import org.mides.fieldvisit.model.RequestStatus;
import org.mides.fieldvisit.model.ServiceRequest;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

public interface IServiceRequestRepository {
    ServiceRequest save(ServiceRequest request);

    Optional<ServiceRequest> findById(String id);

    List<ServiceRequest> findAllById(List<String> ids);

    List<ServiceRequest> findByStatus(RequestStatus status);

    /**
     * Atomically applies {@code transition} to the stored request.
     *
     * @throws org.mides.fieldvisit.exception.NotFoundException when the request does not exist
     */
    ServiceRequest update(String id, UnaryOperator<ServiceRequest> transition);
}
