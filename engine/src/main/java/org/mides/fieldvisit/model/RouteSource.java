package org.mides.fieldvisit.model;

public enum RouteSource {
    /* Ordered and timed by the directions provider */
    PROVIDER,
    /* Nearest-neighbor order with fixed travel allowances */
    FALLBACK,
    SINGLE_STOP,
    /* Order chosen by a planner, timed with fixed travel allowances */
    MANUAL
}
