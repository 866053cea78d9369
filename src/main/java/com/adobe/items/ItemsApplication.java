package com.adobe.items;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Items Service.
 *
 * <p>This service provides REST endpoints for creating, reading, updating and
 * deleting items held in process memory.</p>
 *
 * <h2>API Endpoints:</h2>
 * <ul>
 *   <li>GET /api/items - List all items</li>
 *   <li>GET /api/items/{id} - Fetch one item</li>
 *   <li>POST /api/items - Create an item</li>
 *   <li>PUT /api/items/{id} - Partially update an item</li>
 *   <li>DELETE /api/items/{id} - Delete an item</li>
 * </ul>
 *
 * <p>The HTTP port is taken from the {@code PORT} environment variable and
 * defaults to 3000.</p>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@SpringBootApplication
public class ItemsApplication {

    /**
     * Application entry point.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(ItemsApplication.class, args);
    }
}
