package com.lastmile.locationtracking.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.*;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PrivacySettings {

    @Enumerated(EnumType.STRING)
    @Column(name = "tracking_level", nullable = false)
    private TrackingLevel trackingLevel;

    public static PrivacySettings precise() {
        return new PrivacySettings(TrackingLevel.PRECISE);
    }

    /** Missing settings or level fall back to PRECISE. */
    public static PrivacySettings normalize(PrivacySettings requested) {
        if (requested == null || requested.getTrackingLevel() == null) {
            return precise();
        }
        return new PrivacySettings(requested.getTrackingLevel());
    }
}
