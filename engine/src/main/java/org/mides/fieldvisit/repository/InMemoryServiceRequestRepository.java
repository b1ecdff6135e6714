package org.mides.fieldvisit.repository;

import org.mides.fieldvisit.exception.ErrorCode;
import org.mides.fieldvisit.exception.NotFoundException;
import org.mides.fieldvisit.model.RequestStatus;
import org.mides.fieldvisit.model.ServiceRequest;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

@Repository
public class InMemoryServiceRequestRepository implements IServiceRequestRepository {

    private final Map<String, ServiceRequest> store = new ConcurrentHashMap<>();

    @Override
    public ServiceRequest save(ServiceRequest request) {
        var stored = request.toBuilder().build();
        if (stored.getId() == null) {
            stored.setId(UUID.randomUUID().toString());
        }
        store.put(stored.getId(), stored);
        return stored.toBuilder().build();
    }

    @Override
    public Optional<ServiceRequest> findById(String id) {
        return Optional.ofNullable(store.get(id)).map(request -> request.toBuilder().build());
    }

    @Override
    public List<ServiceRequest> findAllById(List<String> ids) {
        return ids.stream()
            .map(store::get)
            .filter(Objects::nonNull)
            .map(request -> request.toBuilder().build())
            .toList();
    }

    @Override
    public List<ServiceRequest> findByStatus(RequestStatus status) {
        return store.values().stream()
            .filter(request -> request.getStatus() == status)
            .map(request -> request.toBuilder().build())
            .toList();
    }

    @Override
    public ServiceRequest update(String id, UnaryOperator<ServiceRequest> transition) {
        var updated = store.compute(id, (key, current) -> {
            if (current == null) {
                throw new NotFoundException(ErrorCode.REQUEST_NOT_FOUND, "Service request " + id + " not found");
            }
            return transition.apply(current.toBuilder().build());
        });
        return updated.toBuilder().build();
    }
}
