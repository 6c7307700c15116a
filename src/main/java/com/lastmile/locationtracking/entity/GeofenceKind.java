package com.lastmile.locationtracking.entity;

public enum GeofenceKind {
    PICKUP,
    DELIVERY,
    RESTRICTED,
    SAFE_ZONE
}
