package com.furniture.queryparser.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Catalog row reduced to its identifier and display name")
public record NamedItem(
        @Schema(example = "42") String id,
        @Schema(example = "Oslo Corner Sofa") String name
) {
}
