package com.adobe.items.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * An item held by the in-memory store.
 *
 * <h2>Response Format:</h2>
 * <pre>
 * {
 *     "id": 1,
 *     "name": "Item A",
 *     "description": "Description for Item A"
 * }
 * </pre>
 *
 * <p>Items are immutable; an update replaces the stored value at the same
 * position in the store.</p>
 *
 * @param id          store-assigned identifier, positive and never changed
 * @param name        non-empty item name
 * @param description free text description
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@Schema(description = "An item managed by the service")
public record Item(

    @Schema(description = "Identifier assigned by the store", example = "1")
    long id,

    @Schema(description = "Item name", example = "Item A")
    String name,

    @Schema(description = "Item description", example = "Description for Item A")
    String description

) {

    /**
     * Description given to items created without one.
     */
    public static final String DEFAULT_DESCRIPTION = "No description provided";

    /**
     * Returns a copy of this item with the given fields replaced.
     * A {@code null} or empty argument keeps the current value.
     *
     * @param newName        replacement name, or null
     * @param newDescription replacement description, or null
     * @return the merged item, same id
     */
    public Item merge(String newName, String newDescription) {
        return new Item(
            id,
            hasText(newName) ? newName : name,
            hasText(newDescription) ? newDescription : description);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
