package com.adobe.items.exception;

/**
 * Thrown when a read, update or delete targets an id that matches no item.
 *
 * <p>An expected outcome rather than a fault: results in a 404 response with
 * the plain text body {@value #MESSAGE}.</p>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
public class ItemNotFoundException extends RuntimeException {

    public static final String MESSAGE = "Item not found";

    private final String requestedId;

    /**
     * @param requestedId the id as it appeared in the request path
     */
    public ItemNotFoundException(String requestedId) {
        super(MESSAGE);
        this.requestedId = requestedId;
    }

    public String getRequestedId() {
        return requestedId;
    }
}
