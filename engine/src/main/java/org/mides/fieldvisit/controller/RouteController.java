package org.mides.fieldvisit.controller;

import jakarta.validation.Valid;
import org.mides.fieldvisit.model.RouteResult;
import org.mides.fieldvisit.model.request.OptimizeRouteRequest;
import org.mides.fieldvisit.service.IRouteOptimizer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Validated
@RestController
@CrossOrigin(origins = "*")
@RequestMapping("routes")
public class RouteController {

    private final IRouteOptimizer routeOptimizer;

    @Autowired
    public RouteController(IRouteOptimizer routeOptimizer) {
        this.routeOptimizer = routeOptimizer;
    }

    @PostMapping("/optimize")
    public ResponseEntity<RouteResult> optimize(@RequestBody @Valid OptimizeRouteRequest request) {
        var result = routeOptimizer.optimize(request.getStops(), request.getStartPoint(), request.getDayStart());
        return ResponseEntity.ok(result);
    }
}
