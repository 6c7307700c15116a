package com.lastmile.locationtracking.dto;

import com.lastmile.locationtracking.entity.Coordinates;
import com.lastmile.locationtracking.entity.GeofenceKind;
import com.lastmile.locationtracking.entity.GeometryType;
import com.lastmile.locationtracking.entity.NotificationPolicy;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.time.LocalDateTime;
import java.util.List;

/**
 * DTO for creating or replacing a geofence.
 *
 * CIRCLE  - requires center and radiusM (1..10000 m)
 * POLYGON - requires ring: at least 4 [lat,lon] vertices, first == last
 *
 * Example polygon request body:
 * {
 *   "name": "Depot yard",
 *   "kind": "RESTRICTED",
 *   "geometryType": "POLYGON",
 *   "ring": [{"latitude":18.519,"longitude":73.855},{"latitude":18.521,"longitude":73.855},
 *            {"latitude":18.521,"longitude":73.858},{"latitude":18.519,"longitude":73.855}],
 *   "notificationPolicy": {"onEntry": true, "onExit": true}
 * }
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GeofenceRequest {

    private String name;

    /** Trip the geofence belongs to; null applies it to every trip */
    private String tripId;

    @NotNull(message = "kind is required")
    private GeofenceKind kind;

    @NotNull(message = "geometryType is required")
    private GeometryType geometryType;

    private Coordinates center;

    private Double radiusM;

    private List<Coordinates> ring;

    private NotificationPolicy notificationPolicy;

    private LocalDateTime activeFrom;

    private LocalDateTime activeUntil;

    /** IANA zone id for the active window, e.g. "Asia/Kolkata"; defaults to UTC */
    private String timezone;
}
