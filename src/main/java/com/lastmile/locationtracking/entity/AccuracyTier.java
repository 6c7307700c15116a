package com.lastmile.locationtracking.entity;

/** Requested GPS accuracy of the tracking device. */
public enum AccuracyTier {
    HIGH,
    BALANCED,
    LOW
}
