package com.lastmile.locationtracking.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.*;

/**
 * Device-side sampling settings attached to a tracking session.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class TrackingSettings {

    public static final int DEFAULT_INTERVAL_SEC = 30;

    /** Lower bound on the sampling interval while battery optimization is on */
    public static final int BATTERY_SAVER_MIN_INTERVAL_SEC = 15;

    @Column(name = "interval_sec", nullable = false)
    private Integer intervalSec;

    @Enumerated(EnumType.STRING)
    @Column(name = "accuracy_tier", nullable = false)
    private AccuracyTier accuracyTier;

    @Column(name = "battery_optimization", nullable = false)
    private Boolean batteryOptimization;

    /**
     * Fills in defaults (30 s, HIGH, battery optimization on) and raises the
     * interval to at least 15 s when battery optimization is enabled.
     */
    public static TrackingSettings normalize(TrackingSettings requested) {
        TrackingSettings source = requested != null ? requested : new TrackingSettings();
        int interval = source.getIntervalSec() != null && source.getIntervalSec() > 0
                ? source.getIntervalSec() : DEFAULT_INTERVAL_SEC;
        boolean batterySaver = source.getBatteryOptimization() == null || source.getBatteryOptimization();
        if (batterySaver) {
            interval = Math.max(interval, BATTERY_SAVER_MIN_INTERVAL_SEC);
        }
        return TrackingSettings.builder()
                .intervalSec(interval)
                .accuracyTier(source.getAccuracyTier() != null ? source.getAccuracyTier() : AccuracyTier.HIGH)
                .batteryOptimization(batterySaver)
                .build();
    }
}
