package com.lastmile.locationtracking.dto;

import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class StopTrackingRequest {

    /** Optional free-text reason, e.g. "delivered" or "courier went offline" */
    private String reason;
}
