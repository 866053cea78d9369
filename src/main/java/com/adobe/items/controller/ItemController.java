package com.adobe.items.controller;

import com.adobe.items.model.CreateItemRequest;
import com.adobe.items.model.Item;
import com.adobe.items.model.UpdateItemRequest;
import com.adobe.items.service.ItemService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.net.URI;
import java.util.List;

/**
 * REST Controller for the item endpoints.
 *
 * <ul>
 *   <li>List: GET /api/items</li>
 *   <li>Read: GET /api/items/{id}</li>
 *   <li>Create: POST /api/items</li>
 *   <li>Update: PUT /api/items/{id}</li>
 *   <li>Delete: DELETE /api/items/{id}</li>
 * </ul>
 *
 * <h2>Response Formats:</h2>
 * <ul>
 *   <li><b>Success:</b> JSON item or array of items (204 has no body)</li>
 *   <li><b>Error:</b> Plain text message</li>
 * </ul>
 *
 * <p>The path id is taken as a string and parsed by the service, so a
 * non-numeric id yields 404 rather than a type conversion error. Parsing is
 * strict: a value with trailing characters such as {@code 1abc} is not read
 * as {@code 1} and also yields 404.</p>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@RestController
@RequestMapping("/api/items")
@Tag(name = "Items", description = "Create, read, update and delete in-memory items")
public class ItemController {

    private static final Logger logger = LoggerFactory.getLogger(ItemController.class);

    private final ItemService itemService;

    public ItemController(ItemService itemService) {
        this.itemService = itemService;
    }

    /**
     * Lists all items.
     *
     * <pre>
     * Request:  GET /api/items
     * Response: [{"id": 1, "name": "Item A", "description": "Description for Item A"}, ...]
     * </pre>
     *
     * @return 200 with the items in insertion order
     */
    @GetMapping
    @Operation(summary = "List all items", description = "Returns every item in insertion order.")
    @ApiResponse(
        responseCode = "200",
        description = "All items, possibly none",
        content = @Content(mediaType = "application/json",
            array = @ArraySchema(schema = @Schema(implementation = Item.class)))
    )
    public ResponseEntity<List<Item>> listItems() {
        List<Item> items = itemService.listItems();
        logger.info("GET /api/items - returning {} items", items.size());
        return ResponseEntity.ok(items);
    }

    /**
     * Fetches a single item.
     *
     * @param id the item id from the path
     * @return 200 with the item
     */
    @GetMapping("/{id}")
    @Operation(summary = "Get an item by id")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Item found",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = Item.class))),
        @ApiResponse(responseCode = "404", description = "Item not found",
            content = @Content(mediaType = "text/plain"))
    })
    public ResponseEntity<Item> getItem(
            @Parameter(description = "Item id", example = "1")
            @PathVariable("id") String id) {
        Item item = itemService.getItem(id);
        logger.info("GET /api/items/{} - item found", id);
        return ResponseEntity.ok(item);
    }

    /**
     * Creates an item.
     *
     * <pre>
     * Request:  POST /api/items {"name": "Item D"}
     * Response: 201 {"id": 4, "name": "Item D", "description": "No description provided"}
     * </pre>
     *
     * @param request the payload; may be absent
     * @return 201 with the new item and its location
     */
    @PostMapping
    @Operation(summary = "Create an item",
        description = "Requires a non-empty name. A missing description defaults to 'No description provided'.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "201", description = "Item created",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = Item.class))),
        @ApiResponse(responseCode = "400", description = "Name missing or body malformed",
            content = @Content(mediaType = "text/plain"))
    })
    public ResponseEntity<Item> createItem(@RequestBody(required = false) CreateItemRequest request) {
        Item item = itemService.createItem(request);

        URI location = ServletUriComponentsBuilder.fromCurrentRequest()
            .path("/{id}")
            .buildAndExpand(item.id())
            .toUri();

        logger.info("POST /api/items - item {} created", item.id());
        return ResponseEntity.created(location).body(item);
    }

    /**
     * Partially updates an item. Fields omitted from the payload, null or
     * empty keep their current value.
     *
     * @param id      the item id from the path
     * @param request the payload; may be absent
     * @return 200 with the updated item
     */
    @PutMapping("/{id}")
    @Operation(summary = "Update an item",
        description = "Only non-empty fields in the body are changed; omitted or empty fields keep their value.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Item updated",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = Item.class))),
        @ApiResponse(responseCode = "404", description = "Item not found",
            content = @Content(mediaType = "text/plain"))
    })
    public ResponseEntity<Item> updateItem(
            @Parameter(description = "Item id", example = "1")
            @PathVariable("id") String id,
            @RequestBody(required = false) UpdateItemRequest request) {
        Item item = itemService.updateItem(id, request);
        logger.info("PUT /api/items/{} - item updated", id);
        return ResponseEntity.ok(item);
    }

    /**
     * Deletes an item.
     *
     * @param id the item id from the path
     * @return 204 with no body
     */
    @DeleteMapping("/{id}")
    @Operation(summary = "Delete an item")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "204", description = "Item deleted"),
        @ApiResponse(responseCode = "404", description = "Item not found",
            content = @Content(mediaType = "text/plain"))
    })
    public ResponseEntity<Void> deleteItem(
            @Parameter(description = "Item id", example = "1")
            @PathVariable("id") String id) {
        itemService.deleteItem(id);
        logger.info("DELETE /api/items/{} - item deleted", id);
        return ResponseEntity.noContent().build();
    }
}
