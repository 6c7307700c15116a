package com.lastmile.locationtracking.dto;

import com.lastmile.locationtracking.exception.ErrorCode;
import lombok.*;

import java.time.Instant;

/**
 * Per-item outcome of a batch ingestion; {@code index} is the position in the submitted list.
 */
@Getter
@AllArgsConstructor
@Builder
public class BatchItemResult {

    private final int index;
    private final boolean success;
    private final Long sampleId;
    private final Instant timestamp;
    private final ErrorCode errorCode;
    private final String error;

    /** Echo of the rejected input, null on success */
    private final LocationSampleRequest rejected;

    public static BatchItemResult accepted(int index, Long sampleId, Instant timestamp) {
        return new BatchItemResult(index, true, sampleId, timestamp, null, null, null);
    }

    public static BatchItemResult rejected(int index, ErrorCode code, String error, LocationSampleRequest input) {
        return new BatchItemResult(index, false, null, input != null ? input.getTimestamp() : null,
                code, error, input);
    }
}
