package com.lastmile.locationtracking.entity;

/**
 * Lifecycle states of a tracking session.
 *
 * ACTIVE  ⇄ PAUSED      (pause / resume)
 * ACTIVE | PAUSED → STOPPED (stop; a later start resumes it)
 * ACTIVE | PAUSED → COMPLETED (terminal)
 */
public enum TrackingStatus {
    ACTIVE,
    PAUSED,
    STOPPED,
    COMPLETED
}
