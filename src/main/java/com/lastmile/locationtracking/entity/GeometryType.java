package com.lastmile.locationtracking.entity;

public enum GeometryType {
    CIRCLE,
    POLYGON
}
