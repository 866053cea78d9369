package com.adobe.items.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Request body for {@code POST /api/items}.
 *
 * @param name        required, must not be empty
 * @param description optional; absent or empty means the default placeholder
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "Payload for creating an item")
public record CreateItemRequest(

    @Schema(description = "Item name", example = "Item D", requiredMode = Schema.RequiredMode.REQUIRED)
    String name,

    @Schema(description = "Optional description", example = "Description for Item D")
    String description

) {
}
