package com.lastmile.locationtracking.dto;

import com.lastmile.locationtracking.entity.PrivacySettings;
import com.lastmile.locationtracking.entity.TrackingSettings;
import jakarta.validation.constraints.NotBlank;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StartTrackingRequest {

    @NotBlank(message = "userId is required")
    private String userId;

    private TrackingSettings settings;

    private PrivacySettings privacySettings;
}
