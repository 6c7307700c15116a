package com.lastmile.locationtracking.dto;

import lombok.*;

import java.time.Instant;

/**
 * Raw GPS sample as reported by a courier device.
 *
 * Range checks happen in the ingestion pipeline, not through bean
 * validation, so that a batch can report a specific error per item.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class LocationSampleRequest {

    private Double latitude;

    private Double longitude;

    /** Horizontal accuracy radius in meters, [0, 10000] */
    private Double accuracyM;

    private Double altitudeM;

    private Double bearingDeg;

    /** Device-reported speed in m/s, [0, 500]; derived from the previous sample when absent */
    private Double speedMps;

    private Integer batteryPct;

    private String networkType;

    /** Device time; the server clock is used when absent */
    private Instant timestamp;
}
