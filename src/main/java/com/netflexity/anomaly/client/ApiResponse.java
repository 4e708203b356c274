package com.netflexity.anomaly.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Response envelope of the query service.
 *
 * @param <T> payload type
 * @author Netflexity
 * @version 1.0.0
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiResponse<T> {

    public static final String STATUS_SUCCESS = "success";

    /**
     * success or error
     */
    private String status;

    private T data;

    /**
     * Error message when status is error
     */
    private String error;

    public boolean isSuccess() {
        return STATUS_SUCCESS.equalsIgnoreCase(status);
    }
}
