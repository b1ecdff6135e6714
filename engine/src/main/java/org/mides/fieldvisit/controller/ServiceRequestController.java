package org.mides.fieldvisit.controller;

import jakarta.validation.Valid;
import org.mides.fieldvisit.model.ScoredRequest;
import org.mides.fieldvisit.model.ServiceRequest;
import org.mides.fieldvisit.service.IServiceRequestService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Validated
@RestController
@CrossOrigin(origins = "*")
@RequestMapping("requests")
public class ServiceRequestController {

    private final IServiceRequestService requestService;

    @Autowired
    public ServiceRequestController(IServiceRequestService requestService) {
        this.requestService = requestService;
    }

    @PostMapping
    public ResponseEntity<ServiceRequest> register(@RequestBody @Valid ServiceRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(requestService.register(request));
    }

    @GetMapping("/ranked")
    public ResponseEntity<List<ScoredRequest>> ranked() {
        return ResponseEntity.ok(requestService.rankedPending());
    }
}
