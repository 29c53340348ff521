package com.architectai.generation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Error body returned by every endpoint, e.g. {@code {"error":"validation_error","message":"..."}}.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ApiError {

    @JsonProperty("error")
    private String error;

    @JsonProperty("message")
    private String message;

    public static ApiError of(String error, String message) {
        return new ApiError(error, message);
    }
}
