package com.adobe.items.exception;

/**
 * Exception thrown when a request payload fails validation.
 *
 * <p>Used for:</p>
 * <ul>
 *   <li>Missing or empty {@code name} on create</li>
 *   <li>Empty {@code name} on update</li>
 * </ul>
 *
 * <p>Results in a 400 Bad Request response whose plain text body is the
 * exception message.</p>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
public class InvalidInputException extends RuntimeException {

    /**
     * @param message the client-facing error message
     */
    public InvalidInputException(String message) {
        super(message);
    }

    /**
     * @param message the client-facing error message
     * @param cause   the underlying cause of the exception
     */
    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
