package com.furniture.queryparser.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@Schema(description = "Request carrying a free-text furniture query")
public class QueryRequest {
    @Schema(description = "Free-text search query", required = true, example = "grey l shape sofa with metal legs under 1000 eur")
    private String query;
}
