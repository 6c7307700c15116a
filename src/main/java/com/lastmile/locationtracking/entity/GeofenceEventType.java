package com.lastmile.locationtracking.entity;

/**
 * Transitions detected for a (user, geofence) pair.
 *
 * Stored as a String in the DB via @Enumerated(EnumType.STRING).
 */
public enum GeofenceEventType {

    /** User moved from outside (or unknown) to inside the geofence */
    ENTER,

    /** User moved from inside to outside the geofence */
    EXIT,

    /** User stayed inside longer than the geofence's dwell duration; once per inside period */
    DWELL
}
