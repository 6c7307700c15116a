package com.lastmile.locationtracking.store;

import com.lastmile.locationtracking.entity.LocationSample;
import com.lastmile.locationtracking.entity.TrackingSession;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/** Samples and session as written by {@link TrackingStore#recordSamples}. */
@Getter
@AllArgsConstructor
public class RecordedSamples {

    private final TrackingSession session;

    /** Same order as submitted, with ids assigned. */
    private final List<LocationSample> samples;
}
