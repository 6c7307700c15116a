package com.lastmile.locationtracking.service.privacy;

import com.lastmile.locationtracking.entity.Coordinates;

/**
 * Strategy that blurs a position so that the result lies within
 * {@code radiusMeters} of the true point.
 */
public interface CoordinateGeneralizer {

    Coordinates generalize(Coordinates coordinates, double radiusMeters);
}
