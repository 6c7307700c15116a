package com.lastmile.locationtracking.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.lastmile.locationtracking.exception.ErrorCode;
import lombok.*;

/**
 * Generic API response wrapper.
 *
 *   ApiResponse.success(data, message)
 *   ApiResponse.error(code, message, data)  - data echoes rejected input where there is one
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse {

    private boolean success;
    private String message;
    private ErrorCode errorCode;
    private Object data;

    public static ApiResponse success(Object data, String message) {
        ApiResponse r = new ApiResponse();
        r.setSuccess(true);
        r.setMessage(message);
        r.setData(data);
        return r;
    }

    public static ApiResponse error(ErrorCode code, String message, Object data) {
        ApiResponse r = new ApiResponse();
        r.setSuccess(false);
        r.setErrorCode(code);
        r.setMessage(message);
        r.setData(data);
        return r;
    }

    public static ApiResponse error(String message) {
        return error(null, message, null);
    }
}
