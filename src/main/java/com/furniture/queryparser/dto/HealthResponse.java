package com.furniture.queryparser.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Liveness payload")
public record HealthResponse(
        @Schema(example = "healthy") String status,
        @Schema(example = "2024-05-01T10:15:30Z") String timestamp,
        @Schema(example = "query-parser-api") String service
) {
}
