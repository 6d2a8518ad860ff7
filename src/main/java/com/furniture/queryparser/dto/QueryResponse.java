package com.furniture.queryparser.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Envelope returned by the analyze endpoint and by every error path.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Response envelope with either a result or an error message")
public record QueryResponse<T>(
        @JsonProperty("success") boolean success,
        @JsonProperty("result") T result,
        @JsonProperty("processing_time") String processingTime,
        @JsonProperty("error") String error
) {
    public static <T> QueryResponse<T> ok(T result, String processingTime) {
        return new QueryResponse<>(true, result, processingTime, null);
    }

    public static <T> QueryResponse<T> failure(String error) {
        return new QueryResponse<>(false, null, null, error);
    }
}
