package com.lastmile.locationtracking.entity;

/**
 * User-chosen privacy level applied to every sample exposed outside the engine.
 */
public enum TrackingLevel {

    /** Exact position and timing, all device fields kept */
    PRECISE,

    /** Neighbourhood-level position (~500 m), 5-minute time buckets */
    APPROXIMATE,

    /** City-level position (~5 km), 30-minute time buckets, motion/device fields removed */
    MINIMAL
}
