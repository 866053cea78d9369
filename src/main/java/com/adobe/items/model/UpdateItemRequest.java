package com.adobe.items.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Request body for {@code PUT /api/items/{id}}.
 *
 * <p>Partial update: a field that is absent from the payload (or explicitly
 * {@code null}) keeps the stored value. A field that is present replaces the
 * stored value, the empty string included.</p>
 *
 * @param name        replacement name, or null to keep the current one
 * @param description replacement description, or null to keep the current one
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "Payload for partially updating an item")
public record UpdateItemRequest(

    @Schema(description = "New name; omit to keep the current name", example = "Item A2")
    String name,

    @Schema(description = "New description; omit to keep the current description", example = "Updated description")
    String description

) {
}
